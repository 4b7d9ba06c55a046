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

import lombok.RequiredArgsConstructor;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Deterministic offline embedding: every character code is folded into the
 * vector position {@code index % dimension}, then the vector is normalized to
 * unit length. Similar strings get similar vectors, which is enough for demos
 * and tests without an API key. Not semantic.
 */
@Component
@ConditionalOnProperty(prefix = "memory.embedding", name = "provider", havingValue = "hash")
@RequiredArgsConstructor
public class HashEmbeddingAdapter implements EmbeddingPort {

    private static final String MODEL = "char-hash";

    private final MemoryProperties properties;

    @Override
    public CompletableFuture<float[]> embed(String text) {
        if (text == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("text must not be null"));
        }
        return CompletableFuture.completedFuture(hash(text, getDimension()));
    }

    static float[] hash(String text, int dimension) {
        double[] accumulator = new double[dimension];
        for (int i = 0; i < text.length(); i++) {
            accumulator[i % dimension] += text.charAt(i) / 1000.0;
        }

        double magnitude = 0;
        for (double value : accumulator) {
            magnitude += value * value;
        }
        magnitude = Math.sqrt(magnitude);

        float[] vector = new float[dimension];
        if (magnitude == 0) {
            return vector;
        }
        for (int i = 0; i < dimension; i++) {
            vector[i] = (float) (accumulator[i] / magnitude);
        }
        return vector;
    }

    @Override
    public int getDimension() {
        return properties.getEmbedding().getDimension();
    }

    @Override
    public String getModel() {
        return MODEL;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
