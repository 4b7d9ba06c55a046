package me.golemcore.memory;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the conversational memory engine.
 *
 * <p>
 * Gives a chat assistant artificial long-term memory: a bounded conversation
 * window, a rolling summary of everything rotated out of it, extraction of that
 * summary into self-contained facts, and semantic recall of the facts relevant
 * to each new message.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → ConsoleChannel, ConsoleCommandRouter
 * Domain Layer       → MemoryTurnService, ConversationBufferService,
 *                      FactExtractionService, VectorMemoryStore
 * Infrastructure     → LLM/Embedding/Vector backend adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code memory.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemoryEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryEngineApplication.class, args);
    }

}
