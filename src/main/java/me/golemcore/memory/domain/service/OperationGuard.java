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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.MemoryOperation;

import java.util.function.Supplier;

/**
 * Applies a {@link MemoryOperation}'s failure policy to a unit of work.
 * Degrading operations log and return the fallback; propagating operations log
 * and rethrow.
 */
@Slf4j
public final class OperationGuard {

    private OperationGuard() {
    }

    public static <T> T execute(MemoryOperation operation, Supplier<T> action, T fallback) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            if (operation.degrades()) {
                log.warn("[Memory] {} failed, continuing without it: {}", operation, e.getMessage());
                return fallback;
            }
            log.warn("[Memory] {} failed: {}", operation, e.getMessage());
            throw e;
        }
    }

    public static void execute(MemoryOperation operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        }, null);
    }
}
