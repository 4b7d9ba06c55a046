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
import me.golemcore.memory.domain.exception.MemoryStoreException;
import me.golemcore.memory.domain.model.ChunkMetadata;
import me.golemcore.memory.domain.model.MemoryChunk;
import me.golemcore.memory.domain.model.MemoryOperation;
import me.golemcore.memory.domain.model.SearchResult;
import me.golemcore.memory.domain.model.StoredMemory;
import me.golemcore.memory.domain.model.VectorMatch;
import me.golemcore.memory.domain.model.VectorRecord;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.VectorBackendPort;
import me.golemcore.memory.port.outbound.VectorCollection;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Long-term semantic memory on top of the embedding service and a vector
 * backend collection.
 *
 * <p>
 * The collection is opened on first use and reused for the lifetime of the
 * store. Reads (search, listAll) run concurrently and degrade to an empty
 * result on failure. Writes (insert, clear) are serialized and fail loudly with
 * {@link MemoryStoreException}.
 */
@Service
@Slf4j
public class VectorMemoryStore {

    private final EmbeddingPort embeddingPort;
    private final VectorBackendPort backendPort;
    private final MemoryIdGenerator idGenerator;
    private final MemoryProperties properties;

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile VectorCollection collection;

    public VectorMemoryStore(EmbeddingPort embeddingPort, VectorBackendPort backendPort,
            MemoryIdGenerator idGenerator, MemoryProperties properties) {
        this.embeddingPort = embeddingPort;
        this.backendPort = backendPort;
        this.idGenerator = idGenerator;
        this.properties = properties;
    }

    /**
     * Embeds and stores the chunks in a single backend write.
     *
     * @throws MemoryStoreException
     *             if any chunk could not be embedded or the write failed
     */
    public void insert(List<MemoryChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            log.debug("[VectorStore] No chunks to store");
            return;
        }

        OperationGuard.execute(MemoryOperation.INSERT, () -> {
            writeLock.lock();
            try {
                doInsert(chunks);
            } finally {
                writeLock.unlock();
            }
        });
    }

    private void doInsert(List<MemoryChunk> chunks) {
        log.info("[VectorStore] Generating embeddings for {} chunks", chunks.size());
        List<float[]> vectors = new ArrayList<>(chunks.size());
        List<String> documents = new ArrayList<>(chunks.size());
        List<Map<String, Object>> metadatas = new ArrayList<>(chunks.size());
        for (MemoryChunk chunk : chunks) {
            vectors.add(embed(chunk.narrative()));
            documents.add(chunk.narrative());
            metadatas.add(chunk.metadata().toMap());
        }

        List<String> ids = idGenerator.nextBatch(chunks.size());
        try {
            collection().add(ids, vectors, documents, metadatas);
        } catch (MemoryStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MemoryStoreException("Failed to store memories: " + e.getMessage(), e);
        }
        log.info("[VectorStore] Stored {} chunks", chunks.size());
    }

    /**
     * Returns at most {@code limit} memories closest to the query, closest
     * first. Failures yield an empty list.
     *
     * @throws IllegalArgumentException
     *             if limit is negative
     */
    public List<SearchResult> search(String query, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        if (limit == 0 || query == null || query.isBlank()) {
            return List.of();
        }

        return OperationGuard.execute(MemoryOperation.SEARCH, () -> {
            float[] vector = embed(query);
            List<VectorMatch> matches = collection().query(vector, limit);
            List<SearchResult> results = matches.stream()
                    .limit(limit)
                    .map(match -> new SearchResult(match.document(), ChunkMetadata.fromMap(match.metadata()),
                            match.distance()))
                    .toList();
            log.debug("[VectorStore] Search returned {} results", results.size());
            return results;
        }, List.of());
    }

    /**
     * Returns every stored memory in backend order. Failures yield an empty
     * list.
     */
    public List<StoredMemory> listAll() {
        return OperationGuard.execute(MemoryOperation.LIST_ALL, () -> collection().getAll().stream()
                .map(VectorMemoryStore::toStoredMemory)
                .toList(), List.of());
    }

    /**
     * Deletes every stored memory.
     *
     * @return number of memories deleted, 0 if the store was empty
     * @throws MemoryStoreException
     *             if the store could not be cleared
     */
    public int clear() {
        return OperationGuard.execute(MemoryOperation.CLEAR, () -> {
            writeLock.lock();
            try {
                return doClear();
            } finally {
                writeLock.unlock();
            }
        }, 0);
    }

    private int doClear() {
        try {
            VectorCollection col = collection();
            long count = col.count();
            if (count == 0) {
                return 0;
            }
            col.deleteAll();
            log.info("[VectorStore] Deleted {} memories", count);
            return Math.toIntExact(count);
        } catch (MemoryStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MemoryStoreException("Failed to clear memories: " + e.getMessage(), e);
        }
    }

    private VectorCollection collection() {
        VectorCollection current = collection;
        if (current == null) {
            synchronized (this) {
                current = collection;
                if (current == null) {
                    String name = properties.getVector().getCollectionName();
                    current = backendPort.getOrCreateCollection(name, embeddingPort.getDimension());
                    collection = current;
                    log.info("[VectorStore] Collection '{}' ready on {} backend", name,
                            backendPort.getBackendId());
                }
            }
        }
        return current;
    }

    private float[] embed(String text) {
        long timeoutMs = properties.getEmbedding().getTimeoutMs();
        try {
            return embeddingPort.embed(text).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MemoryStoreException("Embedding interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new MemoryStoreException("Embedding failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new MemoryStoreException("Embedding timed out after " + timeoutMs + "ms", e);
        }
    }

    private static StoredMemory toStoredMemory(VectorRecord vectorRecord) {
        return new StoredMemory(vectorRecord.id(), vectorRecord.document(),
                ChunkMetadata.fromMap(vectorRecord.metadata()));
    }
}
