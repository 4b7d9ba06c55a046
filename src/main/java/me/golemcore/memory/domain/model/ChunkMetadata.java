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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata attached to every memory chunk. {@code topics} is optional and
 * holds a comma-joined keyword string.
 */
public record ChunkMetadata(String timestamp, String source, String topics, int chunkLength) {

    public static final String KEY_TIMESTAMP = "timestamp";
    public static final String KEY_SOURCE = "source";
    public static final String KEY_TOPICS = "topics";
    public static final String KEY_CHUNK_LENGTH = "chunk_length";

    public ChunkMetadata {
        Objects.requireNonNull(timestamp, KEY_TIMESTAMP);
        Objects.requireNonNull(source, KEY_SOURCE);
    }

    public boolean hasTopics() {
        return topics != null && !topics.isBlank();
    }

    /**
     * Flattens the metadata into the key/value layout stored by vector
     * backends. Absent topics are omitted rather than stored as null.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(KEY_TIMESTAMP, timestamp);
        map.put(KEY_SOURCE, source);
        if (hasTopics()) {
            map.put(KEY_TOPICS, topics);
        }
        map.put(KEY_CHUNK_LENGTH, chunkLength);
        return map;
    }

    public static ChunkMetadata fromMap(Map<String, Object> map) {
        if (map == null) {
            map = Map.of();
        }
        Object length = map.get(KEY_CHUNK_LENGTH);
        int chunkLength = length instanceof Number number ? number.intValue() : parseLength(length);
        Object topics = map.get(KEY_TOPICS);
        return new ChunkMetadata(
                stringValue(map.get(KEY_TIMESTAMP)),
                stringValue(map.get(KEY_SOURCE)),
                topics != null ? topics.toString() : null,
                chunkLength);
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : "";
    }

    private static int parseLength(Object value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
