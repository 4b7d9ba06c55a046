package me.golemcore.memory.domain.service;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.ConversationSession;
import me.golemcore.memory.domain.model.MemoryOperation;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Owns the bounded turn window and the rolling summary of a
 * {@link ConversationSession}.
 *
 * <p>
 * When the window reaches {@code memory.buffer.cache-limit} turns it is
 * rotated synchronously: the whole window is summarized, the summary is merged
 * into the rolling summary, and the window is reseeded with a single user turn
 * carrying the merged summary. A failed rotation leaves the session untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationBufferService {

    public static final String CONTEXT_PREFIX = "Previous conversation context: ";

    private final ConversationSummarizer summarizer;
    private final MemoryProperties properties;

    /**
     * Appends a single turn, rotating if the window is full.
     *
     * @return true if a rotation happened
     */
    public boolean append(ConversationSession session, Turn turn) {
        return appendAll(session, List.of(Objects.requireNonNull(turn, "turn")));
    }

    /**
     * Appends turns as one batch (typically a user turn and its reply) and
     * checks the limit once afterwards, so a question is never rotated away
     * from its answer.
     *
     * @return true if a rotation happened
     */
    public boolean appendAll(ConversationSession session, List<Turn> turns) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(turns, "turns");
        turns.forEach(turn -> Objects.requireNonNull(turn, "turn"));

        turns.forEach(session::addTurn);
        if (session.size() >= properties.getBuffer().getCacheLimit()) {
            log.info("[Buffer] Cache limit reached ({} turns), summarizing conversation", session.size());
            return rotate(session);
        }
        return false;
    }

    /**
     * Summarizes the window into the rolling summary and reseeds it.
     *
     * @return false if the window was empty
     * @throws me.golemcore.memory.domain.exception.GenerationException
     *             if summarization fails; the session is left as it was
     */
    public boolean rotate(ConversationSession session) {
        List<Turn> turns = session.getTurns();
        if (turns.isEmpty()) {
            return false;
        }

        String summary = OperationGuard.execute(MemoryOperation.ROTATE, () -> summarizer.summarize(turns), null);
        String merged = SummaryMerger.merge(session.getRollingSummary(), summary);

        int warnChars = properties.getBuffer().getSummaryWarnChars();
        if (warnChars > 0 && merged.length() > warnChars) {
            log.warn("[Buffer] Rolling summary is {} chars (threshold {}), consider processing it into memory",
                    merged.length(), warnChars);
        }

        session.setRollingSummary(merged);
        session.replaceTurns(List.of(Turn.user(CONTEXT_PREFIX + merged)));
        log.debug("[Buffer] Session {} rotated, rolling summary now {} chars", session.getId(), merged.length());
        return true;
    }

    /**
     * Collects the summaries awaiting extraction: the rolling summary and, if
     * the window holds turns besides the seeded context turn, a fresh summary of
     * those turns. Does not mutate the session.
     */
    public List<String> snapshotForProcessing(ConversationSession session) {
        List<String> summaries = new ArrayList<>();
        if (session.hasRollingSummary()) {
            summaries.add(session.getRollingSummary());
        }

        List<Turn> residual = residualTurns(session);
        if (!residual.isEmpty()) {
            log.info("[Buffer] Summarizing {} residual turns for processing", residual.size());
            summaries.add(OperationGuard.execute(MemoryOperation.ROTATE,
                    () -> summarizer.summarize(residual), null));
        }
        return summaries;
    }

    public void reset(ConversationSession session) {
        session.setRollingSummary("");
        session.replaceTurns(List.of());
        log.info("[Buffer] Session {} reset", session.getId());
    }

    private List<Turn> residualTurns(ConversationSession session) {
        List<Turn> turns = session.getTurns();
        if (!turns.isEmpty() && isSeedTurn(session, turns.get(0))) {
            return turns.subList(1, turns.size());
        }
        return turns;
    }

    private boolean isSeedTurn(ConversationSession session, Turn turn) {
        return session.hasRollingSummary()
                && turn.isUserTurn()
                && turn.content().equals(CONTEXT_PREFIX + session.getRollingSummary());
    }
}
