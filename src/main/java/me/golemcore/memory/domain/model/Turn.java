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

import java.util.Objects;

/**
 * One role-tagged message in the active conversation window. Immutable.
 */
public record Turn(TurnRole role, String content) {

    public Turn {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
    }

    public static Turn user(String content) {
        return new Turn(TurnRole.USER, content);
    }

    public static Turn assistant(String content) {
        return new Turn(TurnRole.ASSISTANT, content);
    }

    public boolean isUserTurn() {
        return role == TurnRole.USER;
    }

    /**
     * Converts the turn into a generation request message.
     */
    public Message toMessage() {
        return Message.builder()
                .role(role.wireName())
                .content(content)
                .build();
    }
}
