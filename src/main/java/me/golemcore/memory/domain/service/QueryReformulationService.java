package me.golemcore.memory.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.MemoryOperation;
import me.golemcore.memory.domain.model.Message;
import me.golemcore.memory.domain.model.ModelTier;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Rewrites a raw user utterance into a retrieval query conditioned on the last
 * few turns. Advisory only: any failure yields the original input.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryReformulationService {

    private static final String SYSTEM_PROMPT = "You are a search query optimizer. Convert user messages into "
            + "effective search queries for finding relevant memories. Output only the query.";
    private static final String NO_CONTEXT = "No recent context";
    private static final double TEMPERATURE = 0.3;
    private static final int MAX_TOKENS = 100;

    private final LlmInvoker llmInvoker;
    private final MemoryProperties properties;

    public String reformulate(String input, List<Turn> recentTurns) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("input must not be blank");
        }

        LlmRequest request = LlmRequest.builder()
                .modelTier(ModelTier.FAST)
                .systemPrompt(SYSTEM_PROMPT)
                .message(Message.user(buildPrompt(input, recentTurns)))
                .temperature(TEMPERATURE)
                .maxTokens(MAX_TOKENS)
                .build();

        String query = OperationGuard.execute(MemoryOperation.REFORMULATE,
                () -> llmInvoker.complete(request), input);
        if (query == null || query.isBlank()) {
            return input;
        }
        return stripQuotes(query);
    }

    String buildPrompt(String input, List<Turn> recentTurns) {
        return "Given this user input and recent conversation context, generate a concise search query "
                + "to find relevant memories.\n\n"
                + "Recent context:\n" + formatContext(recentTurns) + "\n\n"
                + "User input: \"" + input + "\"\n\n"
                + "Generate a search query that captures:\n"
                + "- What the user is asking about\n"
                + "- Key entities, topics, or concepts\n"
                + "- Implicit references from context\n\n"
                + "Output ONLY the search query, nothing else. Keep it under 20 words.";
    }

    private String formatContext(List<Turn> recentTurns) {
        if (recentTurns == null || recentTurns.isEmpty()) {
            return NO_CONTEXT;
        }
        int window = Math.max(0, properties.getBuffer().getReformulationContextTurns());
        List<Turn> tail = recentTurns.subList(Math.max(0, recentTurns.size() - window), recentTurns.size());
        if (tail.isEmpty()) {
            return NO_CONTEXT;
        }
        return tail.stream()
                .map(turn -> turn.role().wireName() + ": " + turn.content())
                .collect(Collectors.joining("\n"));
    }

    // Models sometimes wrap the query in quotes despite the instruction.
    private static String stripQuotes(String query) {
        String trimmed = query.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            String inner = trimmed.substring(1, trimmed.length() - 1).trim();
            return inner.isEmpty() ? trimmed : inner;
        }
        return trimmed;
    }
}
