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

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Naive keyword heuristic: the first three distinct words longer than five
 * characters, lower-cased.
 */
@Component
public class LongWordTopicExtractor implements TopicExtractor {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");
    private static final int MIN_LENGTH_EXCLUSIVE = 5;
    private static final int MAX_TOPICS = 3;

    @Override
    public Optional<String> extractTopics(String narrative) {
        if (narrative == null || narrative.isBlank()) {
            return Optional.empty();
        }
        String topics = Arrays.stream(WHITESPACE.split(narrative.trim().toLowerCase(Locale.ROOT)))
                .map(word -> EDGE_PUNCTUATION.matcher(word).replaceAll(""))
                .filter(word -> word.length() > MIN_LENGTH_EXCLUSIVE)
                .distinct()
                .limit(MAX_TOPICS)
                .collect(Collectors.joining(", "));
        return topics.isEmpty() ? Optional.empty() : Optional.of(topics);
    }
}
