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
import me.golemcore.memory.domain.model.ConversationSession;
import me.golemcore.memory.domain.model.MemoryChunk;
import me.golemcore.memory.domain.model.ProcessingResult;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Moves a session's accumulated summaries into long-term memory: snapshot,
 * extract, store, and only then reset the session. Any failure propagates and
 * leaves the session intact, so the same input can be retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryProcessingService {

    private final ConversationBufferService bufferService;
    private final FactExtractionService extractionService;
    private final VectorMemoryStore memoryStore;

    public ProcessingResult process(ConversationSession session) {
        if (session.isEmpty()) {
            log.info("[Processing] No conversation to process");
            return ProcessingResult.nothingToProcess();
        }

        List<String> summaries = bufferService.snapshotForProcessing(session);
        if (summaries.isEmpty()) {
            return ProcessingResult.nothingToProcess();
        }

        List<MemoryChunk> chunks = extractionService.process(summaries);
        if (chunks.isEmpty()) {
            log.warn("[Processing] No memory chunks extracted from {} summaries, keeping conversation state",
                    summaries.size());
            return ProcessingResult.noChunks(summaries.size());
        }

        memoryStore.insert(chunks);
        bufferService.reset(session);
        log.info("[Processing] Stored {} memory chunks from {} summaries", chunks.size(), summaries.size());
        return ProcessingResult.stored(summaries.size(), chunks.size());
    }
}
