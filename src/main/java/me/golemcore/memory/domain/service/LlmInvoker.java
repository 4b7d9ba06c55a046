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
import me.golemcore.memory.domain.model.GenerationFailureKind;
import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.LlmResponse;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking, time-bounded access to the generation service. Every failure is
 * reported as a classified {@link GenerationException}; callers decide whether
 * to degrade or propagate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmInvoker {

    private final LlmPort llmPort;
    private final MemoryProperties properties;

    /**
     * Runs the request and returns the trimmed completion text.
     *
     * @throws GenerationException
     *             if the service is unavailable, fails, times out or returns
     *             nothing
     */
    public String complete(LlmRequest request) {
        if (llmPort == null || !llmPort.isAvailable()) {
            throw new GenerationException(GenerationFailureKind.OTHER, "Generation service not available");
        }

        long timeoutMs = properties.getLlm().getTimeoutMs();
        LlmResponse response;
        try {
            response = llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(GenerationFailureKind.OTHER, "Generation interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new GenerationException(LlmErrorClassifier.classify(cause),
                    "Generation failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new GenerationException(GenerationFailureKind.TIMEOUT,
                    "Generation timed out after " + timeoutMs + "ms", e);
        } catch (RuntimeException e) {
            throw new GenerationException(LlmErrorClassifier.classify(e), "Generation failed: " + e.getMessage(), e);
        }

        if (response == null || response.getContent() == null || response.getContent().isBlank()) {
            throw new GenerationException(LlmErrorClassifier.classifyResponse(response),
                    "Generation service returned empty content");
        }
        log.trace("[LLM] {} chars from model {}", response.getContent().length(), response.getModel());
        return response.getContent().trim();
    }
}
