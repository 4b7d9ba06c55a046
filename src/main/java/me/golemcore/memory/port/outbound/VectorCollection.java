package me.golemcore.memory.port.outbound;

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

import me.golemcore.memory.domain.model.VectorMatch;
import me.golemcore.memory.domain.model.VectorRecord;

import java.util.List;
import java.util.Map;

/**
 * A named collection inside a vector backend. Each call is atomic on the
 * backend side; nothing is promised across calls.
 */
public interface VectorCollection {

    String getName();

    /**
     * Writes records. All lists must have the same size.
     */
    void add(List<String> ids, List<float[]> vectors, List<String> documents, List<Map<String, Object>> metadatas);

    /**
     * Returns up to {@code k} nearest neighbours, closest first.
     */
    List<VectorMatch> query(float[] vector, int k);

    /**
     * Returns every record in backend order.
     */
    List<VectorRecord> getAll();

    /**
     * Removes every record in the collection.
     */
    void deleteAll();

    long count();
}
