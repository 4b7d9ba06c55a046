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

/**
 * Port for the persistent vector index. Implementations connect lazily and
 * create the named collection when it does not exist yet.
 */
public interface VectorBackendPort {

    /**
     * Returns the backend identifier (e.g., "in-memory", "milvus").
     */
    String getBackendId();

    /**
     * Opens the named collection, creating it with the given vector dimension
     * when missing.
     *
     * @throws me.golemcore.memory.domain.exception.MemoryStoreException
     *             if the backend cannot be reached
     */
    VectorCollection getOrCreateCollection(String name, int dimension);
}
