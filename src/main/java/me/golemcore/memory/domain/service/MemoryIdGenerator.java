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
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.IntStream;

/**
 * Generates memory ids of the form {@code chunk_<millis>_<index>}. The
 * millisecond component is strictly increasing across batches, so ids stay
 * unique even when two batches land in the same millisecond or the clock goes
 * backwards.
 */
@Component
@RequiredArgsConstructor
public class MemoryIdGenerator {

    private static final String PREFIX = "chunk_";

    private final Clock clock;
    private final AtomicLong lastMillis = new AtomicLong();

    public List<String> nextBatch(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        long millis = lastMillis.updateAndGet(previous -> Math.max(previous + 1, clock.millis()));
        return IntStream.range(0, count)
                .mapToObj(index -> PREFIX + millis + "_" + index)
                .toList();
    }
}
