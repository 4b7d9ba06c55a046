package me.golemcore.memory.adapter.inbound.console;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.GenerationException;
import me.golemcore.memory.domain.exception.MemoryStoreException;
import me.golemcore.memory.domain.model.ConversationSession;
import me.golemcore.memory.domain.model.ProcessingResult;
import me.golemcore.memory.domain.model.StoredMemory;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.domain.service.MemoryProcessingService;
import me.golemcore.memory.domain.service.VectorMemoryStore;
import me.golemcore.memory.port.inbound.CommandPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Routes console commands to the memory engine for the console's
 * conversation session.
 *
 * <p>
 * Available commands:
 * <ul>
 * <li>help - list commands
 * <li>cache - show the conversation window
 * <li>summaries - show the rolling summary
 * <li>memories - list stored memories
 * <li>process - extract the summaries into long-term memory
 * <li>clear confirm - delete every stored memory
 * <li>exit, quit - leave the console
 * </ul>
 */
@Component
@Slf4j
public class ConsoleCommandRouter implements CommandPort {

    private static final String CMD_CLEAR = "clear";
    public static final String CONFIRM = "confirm";
    private static final String CMD_EXIT = "exit";
    private static final String CMD_QUIT = "quit";
    private static final Set<String> EXIT_COMMANDS = Set.of(CMD_EXIT, CMD_QUIT);

    private static final List<CommandDefinition> COMMANDS = List.of(
            new CommandDefinition("memories", "Show all stored memory chunks", false),
            new CommandDefinition("process", "Process summaries into chunks and store them", false),
            new CommandDefinition("cache", "Show current conversation cache", false),
            new CommandDefinition("summaries", "Show collected summaries", false),
            new CommandDefinition(CMD_CLEAR, "Clear all stored memories", true),
            new CommandDefinition("help", "Show this help message", false),
            new CommandDefinition(CMD_EXIT, "Quit the application", false));

    private final MemoryProcessingService processingService;
    private final VectorMemoryStore memoryStore;
    private final ObjectMapper objectMapper;
    private final ConversationSession session = new ConversationSession("console");

    public ConsoleCommandRouter(MemoryProcessingService processingService, VectorMemoryStore memoryStore,
            ObjectMapper objectMapper) {
        this.processingService = processingService;
        this.memoryStore = memoryStore;
        this.objectMapper = objectMapper;
    }

    public ConversationSession getSession() {
        return session;
    }

    public static boolean isExitCommand(String command) {
        return command != null && EXIT_COMMANDS.contains(command.toLowerCase(Locale.ROOT));
    }

    @Override
    public CommandResult execute(String command, List<String> args) {
        String normalized = command.toLowerCase(Locale.ROOT);
        log.debug("[Console] Executing command: {} {}", normalized, args);
        try {
            return switch (normalized) {
            case "help" -> handleHelp();
            case "cache" -> handleCache();
            case "summaries" -> handleSummaries();
            case "memories" -> handleMemories();
            case "process" -> handleProcess();
            case CMD_CLEAR -> handleClear(args);
            case CMD_EXIT, CMD_QUIT -> CommandResult.success("Goodbye!");
            default -> CommandResult.failure("Unknown command: " + command);
            };
        } catch (GenerationException e) {
            log.warn("[Console] Command '{}' failed: {}", normalized, e.getMessage());
            return CommandResult.failure(describeFailure(e));
        } catch (MemoryStoreException e) {
            log.warn("[Console] Command '{}' failed: {}", normalized, e.getMessage());
            return CommandResult.failure("Memory store error: " + e.getMessage());
        }
    }

    @Override
    public boolean hasCommand(String command) {
        if (command == null) {
            return false;
        }
        String normalized = command.toLowerCase(Locale.ROOT);
        return isExitCommand(normalized) || COMMANDS.stream().anyMatch(c -> c.name().equals(normalized));
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return COMMANDS;
    }

    /**
     * User-facing message for a failed generation call.
     */
    public static String describeFailure(GenerationException e) {
        return switch (e.getKind()) {
        case AUTHENTICATION -> "Authentication failed. Please check the API key in memory.llm.providers.";
        case RATE_LIMIT -> "Rate limit exceeded. Please try again later.";
        case TIMEOUT -> "The language model did not answer in time. Please try again.";
        default -> "Something went wrong: " + e.getMessage();
        };
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder("=== Available Commands ===\n");
        sb.append(String.format("  %-17s - %s%n", "Normal text", "Chat with AI"));
        for (CommandDefinition definition : COMMANDS) {
            String note = definition.destructive() ? " (asks for confirmation)" : "";
            sb.append(String.format("  %-17s - %s%s%n", definition.name(), definition.description(), note));
        }
        return CommandResult.success(sb.toString().stripTrailing());
    }

    private CommandResult handleCache() {
        List<Turn> turns = session.getTurns();
        StringBuilder sb = new StringBuilder("=== Conversation Cache ===\n");
        if (turns.isEmpty()) {
            sb.append("Cache is empty\n");
        }
        for (int i = 0; i < turns.size(); i++) {
            Turn turn = turns.get(i);
            sb.append(i + 1).append(". [").append(turn.role().wireName()).append("] ").append(turn.content())
                    .append('\n');
        }
        sb.append("Total: ").append(turns.size()).append(" messages");
        return CommandResult.success(sb.toString(), turns);
    }

    private CommandResult handleSummaries() {
        String summary = session.getRollingSummary();
        return CommandResult.success("=== Current Summary ===\n" + (summary.isEmpty() ? "No summary yet" : summary));
    }

    private CommandResult handleMemories() {
        List<StoredMemory> memories = memoryStore.listAll();
        StringBuilder sb = new StringBuilder("=== Stored Memories ===\n");
        if (memories.isEmpty()) {
            sb.append("No memories stored yet\n");
        }
        for (int i = 0; i < memories.size(); i++) {
            StoredMemory memory = memories.get(i);
            sb.append("\nMemory ").append(i + 1).append(" (").append(memory.id()).append("):\n");
            sb.append("  Narrative: ").append(memory.narrative()).append('\n');
            sb.append("  Metadata: ").append(formatMetadata(memory)).append('\n');
        }
        sb.append("\nTotal: ").append(memories.size()).append(" memories");
        return CommandResult.success(sb.toString(), memories);
    }

    private CommandResult handleProcess() {
        ProcessingResult result = processingService.process(session);
        return switch (result.status()) {
        case NOTHING_TO_PROCESS -> CommandResult.success("No conversation to process");
        case NO_CHUNKS -> CommandResult.success("No chunks created", result);
        case STORED -> CommandResult.success("Created " + result.storedCount()
                + " narrative chunks and stored them in memory. Summary and cache cleared.", result);
        };
    }

    private CommandResult handleClear(List<String> args) {
        boolean confirmed = args != null && args.stream().anyMatch(arg -> CONFIRM.equalsIgnoreCase(arg.trim()));
        if (!confirmed) {
            return CommandResult.failure("This will delete ALL memories. Run \"clear confirm\" to proceed.");
        }
        int deleted = memoryStore.clear();
        return CommandResult.success("Database cleared. " + deleted + " memories deleted.", deleted);
    }

    private String formatMetadata(StoredMemory memory) {
        try {
            return objectMapper.writeValueAsString(memory.metadata().toMap());
        } catch (JsonProcessingException e) {
            log.debug("[Console] Could not render metadata for {}: {}", memory.id(), e.getMessage());
            return memory.metadata().toString();
        }
    }
}
