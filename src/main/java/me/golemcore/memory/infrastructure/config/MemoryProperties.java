package me.golemcore.memory.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the memory engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code memory.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - generation provider and model tiers</li>
 * <li>{@link EmbeddingProperties} - embedding provider and dimension</li>
 * <li>{@link VectorProperties} - vector backend selection</li>
 * <li>{@link BufferProperties} - conversation window and retrieval</li>
 * <li>{@link ExtractionProperties} - fact extraction guardrails</li>
 * <li>{@link ConsoleProperties} - interactive console channel</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryProperties {

    private LlmProperties llm = new LlmProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private VectorProperties vector = new VectorProperties();
    private BufferProperties buffer = new BufferProperties();
    private ExtractionProperties extraction = new ExtractionProperties();
    private ConsoleProperties console = new ConsoleProperties();

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private Map<String, ProviderProperties> providers = new HashMap<>();
        private String balancedModel = "openai/gpt-4o";
        private String fastModel = "openai/gpt-4o-mini";
        private long timeoutMs = 60_000;
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class EmbeddingProperties {
        private String provider = "openai";
        private String model = "text-embedding-3-small";
        private int dimension = 1536;
        private long timeoutMs = 30_000;
    }

    @Data
    public static class VectorProperties {
        private String provider = "in-memory";
        private String collectionName = "memories";
        private MilvusProperties milvus = new MilvusProperties();
    }

    @Data
    public static class MilvusProperties {
        private String host = "localhost";
        private int port = 19530;
        private long connectTimeoutMs = 10_000;
    }

    @Data
    public static class BufferProperties {
        private int cacheLimit = 7;
        private int reformulationContextTurns = 4;
        private int searchLimit = 3;
        private int summaryWarnChars = 20_000;
    }

    @Data
    public static class ExtractionProperties {
        private int minWords = 10;
        private int maxWords = 200;
        private String delimiter = "|";
        private int maxTokens = 2500;
        private double temperature = 0.7;
    }

    @Data
    public static class ConsoleProperties {
        private boolean enabled = false;
    }
}
