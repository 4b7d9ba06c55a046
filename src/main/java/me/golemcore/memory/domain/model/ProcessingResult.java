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

/**
 * Outcome of moving the rolling summary into long-term memory.
 */
public record ProcessingResult(Status status, int summaryCount, int storedCount) {

    public enum Status {
        /** Summary and buffer were both empty. */
        NOTHING_TO_PROCESS,
        /** Extraction produced no chunks; session state was kept. */
        NO_CHUNKS,
        /** Chunks were stored and the session was reset. */
        STORED
    }

    public static ProcessingResult nothingToProcess() {
        return new ProcessingResult(Status.NOTHING_TO_PROCESS, 0, 0);
    }

    public static ProcessingResult noChunks(int summaryCount) {
        return new ProcessingResult(Status.NO_CHUNKS, summaryCount, 0);
    }

    public static ProcessingResult stored(int summaryCount, int storedCount) {
        return new ProcessingResult(Status.STORED, summaryCount, storedCount);
    }
}
