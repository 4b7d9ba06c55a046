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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.ChunkMetadata;
import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.MemoryChunk;
import me.golemcore.memory.domain.model.MemoryOperation;
import me.golemcore.memory.domain.model.Message;
import me.golemcore.memory.domain.model.ModelTier;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Turns accumulated conversation summaries into atomic, self-contained memory
 * chunks.
 *
 * <p>
 * The generation service is asked for facts rather than narrative, related
 * facts merged and unrelated ones separated by the configured delimiter. The
 * output goes through {@link FactChunkParser}; malformed output simply yields
 * no chunks. Generation failures propagate.
 */
@Service
@Slf4j
public class FactExtractionService {

    public static final String SOURCE = "conversation_summary";

    private static final String SYSTEM_PROMPT = "You are a long-term memory system. Extract and consolidate "
            + "important facts from conversations. Each memory chunk should be self-contained (readable "
            + "independently), focus on facts not conversation flow, and capture what someone would remember "
            + "long-term. Combine related information. Output only memory chunks separated by %s.";

    private final LlmInvoker llmInvoker;
    private final TopicExtractor topicExtractor;
    private final MemoryProperties properties;
    private final Clock clock;
    private final FactChunkParser parser;

    public FactExtractionService(LlmInvoker llmInvoker, TopicExtractor topicExtractor,
            MemoryProperties properties, Clock clock) {
        this.llmInvoker = llmInvoker;
        this.topicExtractor = topicExtractor;
        this.properties = properties;
        this.clock = clock;
        MemoryProperties.ExtractionProperties extraction = properties.getExtraction();
        this.parser = new FactChunkParser(extraction.getDelimiter(), extraction.getMinWords(),
                extraction.getMaxWords());
    }

    /**
     * Extracts memory chunks from the given summaries. Returns an empty list
     * without calling the generation service when there is nothing to process.
     *
     * @throws me.golemcore.memory.domain.exception.GenerationException
     *             if generation fails
     */
    public List<MemoryChunk> process(List<String> summaries) {
        List<String> nonBlank = summaries == null ? List.of()
                : summaries.stream()
                        .filter(s -> s != null && !s.isBlank())
                        .toList();
        if (nonBlank.isEmpty()) {
            log.debug("[Extraction] No summaries to process");
            return List.of();
        }

        log.info("[Extraction] Processing {} summaries", nonBlank.size());
        MemoryProperties.ExtractionProperties extraction = properties.getExtraction();
        String delimiter = extraction.getDelimiter();
        LlmRequest request = LlmRequest.builder()
                .modelTier(ModelTier.BALANCED)
                .systemPrompt(String.format(SYSTEM_PROMPT, delimiter))
                .message(Message.user(buildPrompt(combine(nonBlank), delimiter)))
                .temperature(extraction.getTemperature())
                .maxTokens(extraction.getMaxTokens())
                .build();

        String raw = OperationGuard.execute(MemoryOperation.EXTRACT, () -> llmInvoker.complete(request), null);
        log.debug("[Extraction] Raw output: {}", raw);

        List<String> candidates = parser.split(raw);
        List<String> narratives = candidates.stream()
                .filter(parser::withinBounds)
                .toList();
        if (narratives.size() < candidates.size()) {
            log.debug("[Extraction] Dropped {} fragments outside [{}, {}] words",
                    candidates.size() - narratives.size(), extraction.getMinWords(), extraction.getMaxWords());
        }

        String timestamp = Instant.now(clock).toString();
        List<MemoryChunk> chunks = narratives.stream()
                .map(narrative -> toChunk(narrative, timestamp))
                .toList();
        log.info("[Extraction] Created {} memory chunks", chunks.size());
        return chunks;
    }

    private MemoryChunk toChunk(String narrative, String timestamp) {
        String topics = topicExtractor.extractTopics(narrative).orElse(null);
        return new MemoryChunk(narrative, new ChunkMetadata(timestamp, SOURCE, topics, narrative.length()));
    }

    static String combine(List<String> summaries) {
        return IntStream.range(0, summaries.size())
                .mapToObj(i -> "Summary " + (i + 1) + ":\n" + summaries.get(i))
                .collect(Collectors.joining("\n\n"));
    }

    static String buildPrompt(String combinedSummaries, String delimiter) {
        return String.format("""
                Extract important facts and information from these conversation summaries. \
                Think like long-term human memory - what would someone remember weeks later?

                CRITICAL RULES:
                1. Each chunk must be SELF-CONTAINED and make sense on its own
                2. Focus on FACTS and ATTRIBUTES, not conversation flow
                3. Extract WHO, WHAT, WHERE, WHEN - not "discussed" or "shifted to"
                4. Combine related information into one chunk
                5. Keep chunks 2-4 sentences, focused on one topic
                6. Separate unrelated topics with %1$s character

                What to extract:
                - Personal information (name, job, location, preferences, goals)
                - Specific facts and details (numbers, dates, names)
                - Skills, knowledge, or capabilities demonstrated
                - Preferences, likes/dislikes, constraints
                - Plans, goals, or future intentions

                BAD (conversation flow): "User asked about Roman history. Conversation shifted to programming."
                GOOD (facts only): "User is interested in Python and web development."

                BAD (fragmented): "User moved to Tokyo. %1$s User speaks Portuguese. %1$s User misses Brazilian food."
                GOOD (self-contained): "User is Brazilian (speaks Portuguese), recently moved to Tokyo for work, \
                and is looking for Brazilian food there while learning Japanese."

                BAD (too detailed): "Assistant asked about first emperor of Rome, user correctly answered \
                Augustus, demonstrating knowledge of Roman history."
                GOOD (high-level): "User has knowledge of Roman history."

                BAD (incomplete context): "They miss Brazilian food and want to find it in Tokyo."
                GOOD (complete context): "User recently moved to Tokyo and misses Brazilian food from home."

                Summaries:
                %2$s

                Extract the key facts as self-contained chunks, separated by %1$s.""", delimiter, combinedSummaries);
    }
}
