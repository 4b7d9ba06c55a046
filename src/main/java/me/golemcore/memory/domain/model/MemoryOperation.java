package me.golemcore.memory.domain.model;

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
 * Memory engine operations and their failure policy. Read paths degrade so a
 * chat turn is never aborted by retrieval; write paths propagate because
 * silently losing data is worse than an error.
 */
public enum MemoryOperation {

    SEARCH(FailurePolicy.DEGRADE),
    LIST_ALL(FailurePolicy.DEGRADE),
    REFORMULATE(FailurePolicy.DEGRADE),
    INSERT(FailurePolicy.PROPAGATE),
    CLEAR(FailurePolicy.PROPAGATE),
    EXTRACT(FailurePolicy.PROPAGATE),
    ROTATE(FailurePolicy.PROPAGATE);

    private final FailurePolicy failurePolicy;

    MemoryOperation(FailurePolicy failurePolicy) {
        this.failurePolicy = failurePolicy;
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    public boolean degrades() {
        return failurePolicy == FailurePolicy.DEGRADE;
    }
}
