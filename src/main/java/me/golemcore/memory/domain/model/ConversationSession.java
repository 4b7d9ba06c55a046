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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Session-scoped conversation state: the active turn window and the rolling
 * summary of everything that has been rotated out of it.
 *
 * <p>
 * Not thread-safe. A session is driven by a single logical thread and must not
 * be shared between conversations. Mutation goes through
 * {@link me.golemcore.memory.domain.service.ConversationBufferService}.
 */
public class ConversationSession {

    private final String id;
    private final List<Turn> turns = new ArrayList<>();
    private String rollingSummary = "";

    public ConversationSession(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getId() {
        return id;
    }

    /**
     * Returns a snapshot copy of the current turns.
     */
    public List<Turn> getTurns() {
        return List.copyOf(turns);
    }

    public int size() {
        return turns.size();
    }

    public boolean isEmpty() {
        return turns.isEmpty() && !hasRollingSummary();
    }

    public void addTurn(Turn turn) {
        turns.add(Objects.requireNonNull(turn, "turn"));
    }

    public void replaceTurns(List<Turn> replacement) {
        turns.clear();
        turns.addAll(replacement);
    }

    public String getRollingSummary() {
        return rollingSummary;
    }

    public boolean hasRollingSummary() {
        return !rollingSummary.isEmpty();
    }

    public void setRollingSummary(String rollingSummary) {
        this.rollingSummary = rollingSummary != null ? rollingSummary : "";
    }
}
