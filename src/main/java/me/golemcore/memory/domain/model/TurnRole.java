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
 * Speaker of a conversation turn. Only user and assistant turns live in the
 * conversation buffer; system prompts are composed per request.
 */
public enum TurnRole {

    USER("user"), ASSISTANT("assistant");

    private final String wireName;

    TurnRole(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Role name as understood by chat completion APIs.
     */
    public String wireName() {
        return wireName;
    }
}
