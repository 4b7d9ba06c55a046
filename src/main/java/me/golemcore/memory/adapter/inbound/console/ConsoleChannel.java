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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.GenerationException;
import me.golemcore.memory.domain.model.SearchResult;
import me.golemcore.memory.domain.model.TurnResult;
import me.golemcore.memory.domain.service.MemoryTurnService;
import me.golemcore.memory.port.inbound.CommandPort.CommandResult;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Interactive stdin/stdout channel. A line that is exactly a command name is
 * executed as a command; anything else is a chat message.
 */
@Component
@ConditionalOnProperty(prefix = "memory.console", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ConsoleChannel implements CommandLineRunner {

    private static final String PROMPT = "> ";

    private final ConsoleCommandRouter commandRouter;
    private final MemoryTurnService turnService;

    @Override
    public void run(String... args) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        runLoop(reader, System.out);
    }

    void runLoop(BufferedReader reader, PrintStream out) throws IOException {
        out.println("====================================");
        out.println("  AI Memory with Vector Database");
        out.println("====================================");
        out.println("Type \"help\" for available commands");

        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                out.println();
                out.println("Goodbye!");
                return;
            }
            String input = line.trim();
            if (input.isEmpty()) {
                continue;
            }

            String command = input.toLowerCase(Locale.ROOT);
            if (ConsoleCommandRouter.isExitCommand(command)) {
                out.println(commandRouter.execute(command, List.of()).output());
                return;
            }
            if (commandRouter.requiresConfirmation(command)) {
                handleConfirmed(command, reader, out);
            } else if (commandRouter.hasCommand(command)) {
                print(out, commandRouter.execute(command, List.of()));
            } else {
                handleChat(input, out);
            }
        }
    }

    private void handleConfirmed(String command, BufferedReader reader, PrintStream out) throws IOException {
        out.println("This will delete ALL memories from the vector database.");
        out.println("Type \"confirm\" to proceed or anything else to cancel:");
        String confirmation = reader.readLine();
        if (confirmation != null && ConsoleCommandRouter.CONFIRM.equalsIgnoreCase(confirmation.trim())) {
            print(out, commandRouter.execute(command, List.of(ConsoleCommandRouter.CONFIRM)));
        } else {
            out.println("Cancelled. No memories were deleted.");
        }
    }

    private void handleChat(String input, PrintStream out) {
        try {
            TurnResult result = turnService.handleTurn(commandRouter.getSession(), input);
            if (!result.searchQuery().equals(input)) {
                out.println("[Reformulated query: \"" + result.searchQuery() + "\"]");
            }
            List<SearchResult> memories = result.memories();
            if (memories.isEmpty()) {
                out.println("No relevant memories found.");
            } else {
                out.println("Found " + memories.size() + " relevant memories:");
                for (int i = 0; i < memories.size(); i++) {
                    out.println("  " + (i + 1) + ". " + memories.get(i).narrative());
                }
            }
            out.println();
            out.println("AI: " + result.reply());
            out.println();
            if (result.rotated()) {
                out.println("[Conversation summarized and cache reset]");
            }
            if (result.hasRotationError()) {
                out.println("[Could not summarize conversation: "
                        + ConsoleCommandRouter.describeFailure(result.rotationError()) + "]");
            }
        } catch (GenerationException e) {
            log.warn("[Console] Chat turn failed: {}", e.getMessage());
            out.println("Error in chat: " + ConsoleCommandRouter.describeFailure(e));
        }
    }

    private static void print(PrintStream out, CommandResult result) {
        out.println(result.success() ? result.output() : "Error: " + result.output());
    }
}
