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

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits raw fact-extraction output into candidate narratives and applies the
 * word-count guardrails. Pure; no I/O.
 */
public final class FactChunkParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Pattern delimiter;
    private final int minWords;
    private final int maxWords;

    public FactChunkParser(String delimiter, int minWords, int maxWords) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }
        if (minWords < 0 || maxWords < minWords) {
            throw new IllegalArgumentException("invalid word bounds: [" + minWords + ", " + maxWords + "]");
        }
        this.delimiter = Pattern.compile(Pattern.quote(delimiter));
        this.minWords = minWords;
        this.maxWords = maxWords;
    }

    /**
     * Splits on the delimiter, trims every fragment and drops empty ones.
     */
    public List<String> split(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(delimiter.split(raw, -1))
                .map(String::trim)
                .filter(fragment -> !fragment.isEmpty())
                .toList();
    }

    /**
     * Returns the fragments whose word count lies within the configured bounds.
     */
    public List<String> parse(String raw) {
        return split(raw).stream()
                .filter(this::withinBounds)
                .toList();
    }

    public boolean withinBounds(String fragment) {
        int words = wordCount(fragment);
        return words >= minWords && words <= maxWords;
    }

    public static int wordCount(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }
}
