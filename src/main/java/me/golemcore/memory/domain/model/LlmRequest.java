package me.golemcore.memory.domain.model;

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

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * One chat completion call. Summaries, reformulated queries, fact lists and
 * replies are all produced through this shape; only the prompt and the
 * generation parameters differ.
 */
@Data
@Builder
public class LlmRequest {

    /**
     * Chat replies, summaries and extraction use BALANCED; query reformulation
     * uses FAST.
     */
    @Builder.Default
    private ModelTier modelTier = ModelTier.BALANCED;

    private String systemPrompt;

    @Singular
    private List<Message> messages;

    @Builder.Default
    private double temperature = 0.7;

    /** Upper bound on generated tokens, or null for the provider default. */
    private Integer maxTokens;
}
