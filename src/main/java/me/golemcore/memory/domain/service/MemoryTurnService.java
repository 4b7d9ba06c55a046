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
import me.golemcore.memory.domain.exception.GenerationException;
import me.golemcore.memory.domain.model.ConversationSession;
import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.Message;
import me.golemcore.memory.domain.model.ModelTier;
import me.golemcore.memory.domain.model.SearchResult;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.domain.model.TurnResult;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs one chat turn: reformulate the input, recall memories, generate the
 * reply with memories and the conversation window as context, then record the
 * exchange in the buffer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryTurnService {

    static final String ASSISTANT_PROMPT = "You are a helpful AI assistant. Keep your responses concise and friendly.";
    static final String MEMORIES_PREFIX = "Relevant memories from past conversations: ";
    private static final String MEMORY_SEPARATOR = " | ";
    private static final double TEMPERATURE = 0.7;
    private static final int MAX_TOKENS = 1000;

    private final QueryReformulationService reformulationService;
    private final VectorMemoryStore memoryStore;
    private final ConversationBufferService bufferService;
    private final LlmInvoker llmInvoker;
    private final MemoryProperties properties;

    /**
     * Handles one user input.
     *
     * @throws GenerationException
     *             if the reply could not be generated; the session is unchanged
     */
    public TurnResult handleTurn(ConversationSession session, String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("input must not be blank");
        }

        List<Turn> window = session.getTurns();
        String searchQuery = reformulationService.reformulate(input, window);
        if (!searchQuery.equals(input)) {
            log.info("[Turn] Reformulated query: \"{}\"", searchQuery);
        }

        List<SearchResult> memories = memoryStore.search(searchQuery, properties.getBuffer().getSearchLimit());
        log.debug("[Turn] Recalled {} memories", memories.size());

        String reply = llmInvoker.complete(buildRequest(window, memories, input));

        boolean rotated = false;
        GenerationException rotationError = null;
        try {
            rotated = bufferService.appendAll(session, List.of(Turn.user(input), Turn.assistant(reply)));
        } catch (GenerationException e) {
            log.warn("[Turn] Conversation summarization failed, keeping full buffer: {}", e.getMessage());
            rotationError = e;
        }
        return new TurnResult(reply, searchQuery, memories, rotated, rotationError);
    }

    LlmRequest buildRequest(List<Turn> window, List<SearchResult> memories, String input) {
        List<Message> messages = new ArrayList<>();
        if (!memories.isEmpty()) {
            String memoryContext = memories.stream()
                    .map(SearchResult::narrative)
                    .collect(Collectors.joining(MEMORY_SEPARATOR));
            messages.add(Message.system(MEMORIES_PREFIX + memoryContext));
        }
        window.forEach(turn -> messages.add(turn.toMessage()));
        messages.add(Message.user(input));

        return LlmRequest.builder()
                .modelTier(ModelTier.BALANCED)
                .systemPrompt(ASSISTANT_PROMPT)
                .messages(messages)
                .temperature(TEMPERATURE)
                .maxTokens(MAX_TOKENS)
                .build();
    }
}
