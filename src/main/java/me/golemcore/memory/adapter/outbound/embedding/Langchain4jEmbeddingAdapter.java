package me.golemcore.memory.adapter.outbound.embedding;

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

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * OpenAI embeddings through langchain4j. Uses the api key and base URL of the
 * {@code openai} entry under {@code memory.llm.providers}, and requests
 * vectors of {@code memory.embedding.dimension} components.
 *
 * <p>
 * The model is built on first use. Without an api key the adapter stays
 * unavailable and every embed call fails, which the vector store turns into
 * empty search results or a failed insert.
 */
@Component
@ConditionalOnProperty(prefix = "memory.embedding", name = "provider", havingValue = "openai", matchIfMissing = true)
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final String OPENAI = "openai";
    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private final MemoryProperties properties;

    private volatile Optional<EmbeddingModel> model;

    public Langchain4jEmbeddingAdapter(MemoryProperties properties) {
        this.properties = properties;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            EmbeddingModel embeddingModel = model()
                    .orElseThrow(() -> new IllegalStateException("Embedding model not available"));
            Response<Embedding> response = embeddingModel.embed(text);
            float[] vector = response.content().vector();
            if (vector.length != getDimension()) {
                throw new IllegalStateException("Embedding has " + vector.length + " dimensions, expected "
                        + getDimension());
            }
            return vector;
        });
    }

    @Override
    public int getDimension() {
        return properties.getEmbedding().getDimension();
    }

    @Override
    public String getModel() {
        String configured = properties.getEmbedding().getModel();
        return configured != null && !configured.isBlank() ? configured : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        return model().isPresent();
    }

    private Optional<EmbeddingModel> model() {
        Optional<EmbeddingModel> current = model;
        if (current == null) {
            synchronized (this) {
                current = model;
                if (current == null) {
                    current = Optional.ofNullable(createModel());
                    model = current;
                }
            }
        }
        return current;
    }

    /**
     * Builds the embedding model, or returns null when it cannot be used.
     */
    protected EmbeddingModel createModel() {
        MemoryProperties.ProviderProperties openai = properties.getLlm().getProviders().get(OPENAI);
        if (openai == null || openai.getApiKey() == null || openai.getApiKey().isBlank()) {
            log.warn("[Embedding] No api key under memory.llm.providers.openai, embeddings unavailable");
            return null;
        }
        try {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(openai.getApiKey())
                    .modelName(getModel())
                    .dimensions(getDimension())
                    .timeout(Duration.ofMillis(properties.getEmbedding().getTimeoutMs()));
            if (openai.getBaseUrl() != null) {
                builder.baseUrl(openai.getBaseUrl());
            }
            EmbeddingModel built = builder.build();
            log.info("[Embedding] Using {} ({} dims)", getModel(), getDimension());
            return built;
        } catch (RuntimeException e) {
            log.error("[Embedding] Failed to initialize embedding model", e);
            return null;
        }
    }
}
