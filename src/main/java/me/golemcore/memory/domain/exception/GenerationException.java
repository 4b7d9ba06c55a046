package me.golemcore.memory.domain.exception;

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

import me.golemcore.memory.domain.model.GenerationFailureKind;

/**
 * Raised when a call to the generation service fails and the calling operation
 * must not degrade.
 */
public class GenerationException extends RuntimeException {

    private final GenerationFailureKind kind;

    public GenerationException(GenerationFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GenerationException(GenerationFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public GenerationFailureKind getKind() {
        return kind;
    }
}
