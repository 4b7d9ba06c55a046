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

import java.util.concurrent.CompletableFuture;

/**
 * Turns memory narratives and search queries into vectors. Every vector
 * produced by one implementation has {@link #getDimension()} components, and
 * the vector backend collection is created with that dimension.
 */
public interface EmbeddingPort {

    /**
     * Embeds one narrative or query. Failures complete the future
     * exceptionally.
     */
    CompletableFuture<float[]> embed(String text);

    int getDimension();

    /**
     * Model identifier, used in startup logging.
     */
    String getModel();

    boolean isAvailable();
}
