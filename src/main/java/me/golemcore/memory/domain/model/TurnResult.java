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

import me.golemcore.memory.domain.exception.GenerationException;

import java.util.List;

/**
 * Outcome of one chat turn.
 *
 * @param reply
 *            generated assistant reply
 * @param searchQuery
 *            query actually used for memory retrieval
 * @param memories
 *            memories injected into the prompt
 * @param rotated
 *            whether the buffer was summarized and reseeded after the turn
 * @param rotationError
 *            rotation failure, or null; the reply is still valid
 */
public record TurnResult(String reply, String searchQuery, List<SearchResult> memories, boolean rotated,
        GenerationException rotationError) {

    public boolean hasRotationError() {
        return rotationError != null;
    }
}
