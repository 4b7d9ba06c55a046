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

/**
 * Merge policy for the rolling summary: newer text is appended after a blank
 * line, nothing is ever rewritten.
 */
public final class SummaryMerger {

    public static final String SEPARATOR = "\n\n";

    private SummaryMerger() {
    }

    public static String merge(String previous, String incoming) {
        boolean hasPrevious = previous != null && !previous.isEmpty();
        boolean hasIncoming = incoming != null && !incoming.isBlank();
        if (!hasIncoming) {
            return hasPrevious ? previous : "";
        }
        if (!hasPrevious) {
            return incoming;
        }
        return previous + SEPARATOR + incoming;
    }
}
