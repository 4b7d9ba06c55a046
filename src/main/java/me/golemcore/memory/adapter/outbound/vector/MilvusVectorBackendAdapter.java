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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.ConsistencyLevel;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import io.milvus.v2.service.vector.request.DeleteReq;
import io.milvus.v2.service.vector.request.InsertReq;
import io.milvus.v2.service.vector.request.QueryReq;
import io.milvus.v2.service.vector.request.SearchReq;
import io.milvus.v2.service.vector.request.data.FloatVec;
import io.milvus.v2.service.vector.response.QueryResp;
import io.milvus.v2.service.vector.response.SearchResp;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.MemoryStoreException;
import me.golemcore.memory.domain.model.VectorMatch;
import me.golemcore.memory.domain.model.VectorRecord;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.VectorBackendPort;
import me.golemcore.memory.port.outbound.VectorCollection;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Milvus vector backend (Milvus v2 Java client).
 *
 * <p>
 * The client is created on first use. Collection schema:
 * <ul>
 * <li>{@code id} VARCHAR primary key, supplied by the caller
 * <li>{@code document} VARCHAR, the memory narrative
 * <li>{@code metadata} VARCHAR, metadata as JSON
 * <li>{@code embedding} FLOAT_VECTOR, HNSW index with COSINE metric
 * </ul>
 * Distances are reported as {@code 1 - cosine score}, so closest is lowest.
 */
@Component
@ConditionalOnProperty(prefix = "memory.vector", name = "provider", havingValue = "milvus")
@Slf4j
public class MilvusVectorBackendAdapter implements VectorBackendPort {

    static final String FIELD_ID = "id";
    static final String FIELD_DOCUMENT = "document";
    static final String FIELD_METADATA = "metadata";
    static final String FIELD_EMBEDDING = "embedding";
    static final String COUNT_FIELD = "count(*)";
    static final String ALL_ROWS_FILTER = FIELD_ID + " != \"\"";

    private static final int ID_MAX_LENGTH = 64;
    private static final int DOCUMENT_MAX_LENGTH = 8192;
    private static final int METADATA_MAX_LENGTH = 4096;
    static final int PAGE_SIZE = 1000;
    private static final List<String> OUTPUT_FIELDS = List.of(FIELD_ID, FIELD_DOCUMENT, FIELD_METADATA);
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final MemoryProperties properties;
    private final ObjectMapper objectMapper;

    private volatile MilvusClientV2 client;

    public MilvusVectorBackendAdapter(MemoryProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getBackendId() {
        return "milvus";
    }

    @Override
    public VectorCollection getOrCreateCollection(String name, int dimension) {
        MilvusClientV2 milvus = client();
        try {
            boolean exists = milvus.hasCollection(HasCollectionReq.builder().collectionName(name).build());
            if (exists) {
                log.info("[Milvus] Collection '{}' already exists", name);
            } else {
                createCollection(milvus, name, dimension);
            }
        } catch (RuntimeException e) {
            throw new MemoryStoreException("Failed to open Milvus collection '" + name + "': " + e.getMessage(), e);
        }
        return new MilvusCollection(milvus, name);
    }

    /**
     * Connects to Milvus. Overridden in tests.
     */
    protected MilvusClientV2 createClient() {
        MemoryProperties.MilvusProperties milvus = properties.getVector().getMilvus();
        String uri = "http://" + milvus.getHost() + ":" + milvus.getPort();
        log.info("[Milvus] Connecting to {}...", uri);
        return new MilvusClientV2(ConnectConfig.builder()
                .uri(uri)
                .connectTimeoutMs(milvus.getConnectTimeoutMs())
                .build());
    }

    private MilvusClientV2 client() {
        MilvusClientV2 current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    try {
                        current = createClient();
                    } catch (RuntimeException e) {
                        throw new MemoryStoreException("Failed to connect to Milvus: " + e.getMessage(), e);
                    }
                    client = current;
                    log.info("[Milvus] Connected");
                }
            }
        }
        return current;
    }

    @PreDestroy
    public void close() {
        MilvusClientV2 current = client;
        if (current == null) {
            return;
        }
        try {
            current.close(5);
            log.info("[Milvus] Connection closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Milvus] Interrupted while closing connection");
        } finally {
            client = null;
        }
    }

    private void createCollection(MilvusClientV2 milvus, String name, int dimension) {
        log.info("[Milvus] Creating collection '{}' (dim={})...", name, dimension);

        CreateCollectionReq.CollectionSchema schema = CreateCollectionReq.CollectionSchema.builder().build();

        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_ID)
                .dataType(DataType.VarChar)
                .maxLength(ID_MAX_LENGTH)
                .isPrimaryKey(true)
                .autoID(false)
                .build());

        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_DOCUMENT)
                .dataType(DataType.VarChar)
                .maxLength(DOCUMENT_MAX_LENGTH)
                .build());

        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_METADATA)
                .dataType(DataType.VarChar)
                .maxLength(METADATA_MAX_LENGTH)
                .build());

        schema.addField(AddFieldReq.builder()
                .fieldName(FIELD_EMBEDDING)
                .dataType(DataType.FloatVector)
                .dimension(dimension)
                .build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName(FIELD_EMBEDDING)
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.COSINE)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();

        milvus.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex))
                .build());

        log.info("[Milvus] Collection '{}' created", name);
    }

    String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new MemoryStoreException("Failed to serialize memory metadata", e);
        }
    }

    Map<String, Object> readMetadata(Object json) {
        if (json == null || json.toString().isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json.toString(), MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[Milvus] Ignoring unreadable metadata: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private static List<Float> toFloatList(float[] vector) {
        List<Float> list = new ArrayList<>(vector.length);
        for (float value : vector) {
            list.add(value);
        }
        return list;
    }

    static String lastId(List<VectorRecord> page) {
        return page.stream()
                .map(VectorRecord::id)
                .max(String::compareTo)
                .orElseThrow();
    }

    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }

    final class MilvusCollection implements VectorCollection {

        private final MilvusClientV2 milvus;
        private final String name;

        MilvusCollection(MilvusClientV2 milvus, String name) {
            this.milvus = milvus;
            this.name = name;
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

            List<JsonObject> rows = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                JsonObject row = new JsonObject();
                row.addProperty(FIELD_ID, ids.get(i));
                row.addProperty(FIELD_DOCUMENT, documents.get(i));
                row.addProperty(FIELD_METADATA, writeMetadata(metadatas.get(i)));
                JsonArray embedding = new JsonArray();
                for (float value : vectors.get(i)) {
                    embedding.add(value);
                }
                row.add(FIELD_EMBEDDING, embedding);
                rows.add(row);
            }

            milvus.insert(InsertReq.builder()
                    .collectionName(name)
                    .data(rows)
                    .build());
            log.debug("[Milvus] Inserted {} rows into '{}'", size, name);
        }

        @Override
        public List<VectorMatch> query(float[] vector, int k) {
            if (k <= 0) {
                return List.of();
            }
            SearchResp resp = milvus.search(SearchReq.builder()
                    .collectionName(name)
                    .data(List.of(new FloatVec(toFloatList(vector))))
                    .annsField(FIELD_EMBEDDING)
                    .topK(k)
                    .outputFields(List.of(FIELD_DOCUMENT, FIELD_METADATA))
                    .consistencyLevel(ConsistencyLevel.STRONG)
                    .build());

            List<VectorMatch> matches = new ArrayList<>();
            if (resp == null || resp.getSearchResults() == null || resp.getSearchResults().isEmpty()) {
                return matches;
            }
            for (SearchResp.SearchResult hit : resp.getSearchResults().get(0)) {
                Map<String, Object> entity = hit.getEntity() != null ? hit.getEntity() : Map.of();
                Float score = hit.getScore();
                double distance = score != null ? 1.0 - score : Double.MAX_VALUE;
                matches.add(new VectorMatch(stringValue(hit.getId()), stringValue(entity.get(FIELD_DOCUMENT)),
                        readMetadata(entity.get(FIELD_METADATA)), distance));
            }
            return matches;
        }

        @Override
        public List<VectorRecord> getAll() {
            // Keyset paging on the primary key; offset paging is capped by the query window
            List<VectorRecord> records = new ArrayList<>();
            String filter = ALL_ROWS_FILTER;
            while (true) {
                QueryResp resp = milvus.query(QueryReq.builder()
                        .collectionName(name)
                        .filter(filter)
                        .outputFields(OUTPUT_FIELDS)
                        .limit(PAGE_SIZE)
                        .consistencyLevel(ConsistencyLevel.STRONG)
                        .build());
                List<VectorRecord> page = toRecords(resp);
                records.addAll(page);
                if (page.size() < PAGE_SIZE) {
                    return records;
                }
                filter = FIELD_ID + " > " + quote(lastId(page));
            }
        }

        @Override
        public void deleteAll() {
            milvus.delete(DeleteReq.builder()
                    .collectionName(name)
                    .filter(ALL_ROWS_FILTER)
                    .build());
            log.debug("[Milvus] Deleted all rows from '{}'", name);
        }

        @Override
        public long count() {
            QueryResp resp = milvus.query(QueryReq.builder()
                    .collectionName(name)
                    .outputFields(List.of(COUNT_FIELD))
                    .consistencyLevel(ConsistencyLevel.STRONG)
                    .build());
            if (resp == null || resp.getQueryResults() == null || resp.getQueryResults().isEmpty()) {
                return 0L;
            }
            Object count = resp.getQueryResults().get(0).getEntity().get(COUNT_FIELD);
            return count instanceof Number number ? number.longValue() : 0L;
        }

        private List<VectorRecord> toRecords(QueryResp resp) {
            if (resp == null || resp.getQueryResults() == null) {
                return List.of();
            }
            List<VectorRecord> records = new ArrayList<>();
            for (QueryResp.QueryResult result : resp.getQueryResults()) {
                Map<String, Object> entity = result.getEntity();
                records.add(new VectorRecord(stringValue(entity.get(FIELD_ID)),
                        stringValue(entity.get(FIELD_DOCUMENT)), readMetadata(entity.get(FIELD_METADATA))));
            }
            return records;
        }
    }
}
