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
import me.golemcore.memory.domain.model.Message;
import me.golemcore.memory.domain.model.ModelTier;
import me.golemcore.memory.domain.model.Turn;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Compresses a run of conversation turns into a short summary via the
 * generation service.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationSummarizer {

    static final String SYSTEM_PROMPT = "Summarize all the context in this following chat conversation concisely.";
    private static final double TEMPERATURE = 0.12;
    private static final int MAX_TOKENS = 1000;

    private final LlmInvoker llmInvoker;

    /**
     * Summarizes the given turns.
     *
     * @throws me.golemcore.memory.domain.exception.GenerationException
     *             if generation fails
     */
    public String summarize(List<Turn> turns) {
        if (turns == null || turns.isEmpty()) {
            throw new IllegalArgumentException("Nothing to summarize");
        }

        LlmRequest request = LlmRequest.builder()
                .modelTier(ModelTier.BALANCED)
                .systemPrompt(SYSTEM_PROMPT)
                .message(Message.user(buildConversationText(turns)))
                .temperature(TEMPERATURE)
                .maxTokens(MAX_TOKENS)
                .build();

        long start = System.currentTimeMillis();
        String summary = llmInvoker.complete(request);
        log.info("[Buffer] Summarized {} turns in {}ms ({} chars)",
                turns.size(), System.currentTimeMillis() - start, summary.length());
        return summary;
    }

    static String buildConversationText(List<Turn> turns) {
        StringBuilder sb = new StringBuilder();
        for (Turn turn : turns) {
            sb.append(turn.content()).append('\n');
        }
        sb.append("\nsummary:");
        return sb.toString();
    }
}
