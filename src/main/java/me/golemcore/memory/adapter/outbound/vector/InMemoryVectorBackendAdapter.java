package me.golemcore.memory.adapter.outbound.vector;

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
import me.golemcore.memory.domain.exception.MemoryStoreException;
import me.golemcore.memory.domain.model.VectorMatch;
import me.golemcore.memory.domain.model.VectorRecord;
import me.golemcore.memory.port.outbound.VectorBackendPort;
import me.golemcore.memory.port.outbound.VectorCollection;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local vector backend. Records are kept in insertion order; queries
 * are exact nearest-neighbour scans with distance {@code 1 - cosine}.
 * Everything is lost on restart.
 */
@Component
@ConditionalOnProperty(prefix = "memory.vector", name = "provider", havingValue = "in-memory", matchIfMissing = true)
@Slf4j
public class InMemoryVectorBackendAdapter implements VectorBackendPort {

    private final Map<String, InMemoryCollection> collections = new ConcurrentHashMap<>();

    @Override
    public String getBackendId() {
        return "in-memory";
    }

    @Override
    public VectorCollection getOrCreateCollection(String name, int dimension) {
        if (dimension <= 0) {
            throw new MemoryStoreException("Invalid vector dimension: " + dimension);
        }
        InMemoryCollection collection = collections.computeIfAbsent(name, n -> {
            log.info("[InMemoryVector] Creating collection '{}' (dim={})", n, dimension);
            return new InMemoryCollection(n, dimension);
        });
        if (collection.dimension != dimension) {
            throw new MemoryStoreException("Collection '" + name + "' has dimension " + collection.dimension
                    + ", requested " + dimension);
        }
        return collection;
    }

    /**
     * {@code 1 - cosine similarity}: 0 for the same direction, 2 for opposite
     * directions. A zero vector is at distance 1 from everything.
     */
    static double cosineDistance(float[] a, float[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 1.0;
        }
        return 1.0 - dot / Math.sqrt(normA * normB);
    }

    static final class InMemoryCollection implements VectorCollection {

        private final String name;
        private final int dimension;
        private final Map<String, Entry> entries = new LinkedHashMap<>();
        private final ReadWriteLock lock = new ReentrantReadWriteLock();

        private record Entry(VectorRecord vectorRecord, float[] vector) {
        }

        InMemoryCollection(String name, int dimension) {
            this.name = name;
            this.dimension = dimension;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public void add(List<String> ids, List<float[]> vectors, List<String> documents,
                List<Map<String, Object>> metadatas) {
            int size = ids.size();
            if (vectors.size() != size || documents.size() != size || metadatas.size() != size) {
                throw new IllegalArgumentException("ids, vectors, documents and metadatas must have the same size");
            }
            for (float[] vector : vectors) {
                if (vector == null || vector.length != dimension) {
                    throw new IllegalArgumentException("Expected vectors of dimension " + dimension);
                }
            }

            lock.writeLock().lock();
            try {
                for (String id : ids) {
                    if (entries.containsKey(id)) {
                        throw new IllegalArgumentException("Duplicate id: " + id);
                    }
                }
                for (int i = 0; i < size; i++) {
                    String id = Objects.requireNonNull(ids.get(i), "id");
                    VectorRecord vectorRecord = new VectorRecord(id, documents.get(i), metadatas.get(i));
                    entries.put(id, new Entry(vectorRecord, vectors.get(i).clone()));
                }
            } finally {
                lock.writeLock().unlock();
            }
        }

        @Override
        public List<VectorMatch> query(float[] vector, int k) {
            if (k <= 0) {
                return List.of();
            }
            if (vector == null || vector.length != dimension) {
                throw new IllegalArgumentException("Expected query vector of dimension " + dimension);
            }

            List<VectorMatch> matches = new ArrayList<>();
            lock.readLock().lock();
            try {
                for (Entry entry : entries.values()) {
                    double distance = cosineDistance(vector, entry.vector());
                    VectorRecord vectorRecord = entry.vectorRecord();
                    matches.add(new VectorMatch(vectorRecord.id(), vectorRecord.document(), vectorRecord.metadata(),
                            distance));
                }
            } finally {
                lock.readLock().unlock();
            }
            // List.sort is stable: ties keep insertion order
            matches.sort(Comparator.comparingDouble(VectorMatch::distance));
            return matches.size() > k ? List.copyOf(matches.subList(0, k)) : matches;
        }

        @Override
        public List<VectorRecord> getAll() {
            lock.readLock().lock();
            try {
                return entries.values().stream().map(Entry::vectorRecord).toList();
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public void deleteAll() {
            lock.writeLock().lock();
            try {
                entries.clear();
            } finally {
                lock.writeLock().unlock();
            }
        }

        @Override
        public long count() {
            lock.readLock().lock();
            try {
                return entries.size();
            } finally {
                lock.readLock().unlock();
            }
        }
    }
}
