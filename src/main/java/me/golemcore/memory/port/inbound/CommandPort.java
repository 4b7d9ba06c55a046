package me.golemcore.memory.port.inbound;

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

import java.util.List;
import java.util.Locale;

/**
 * Direct commands against the memory engine, routed around the chat turn.
 */
public interface CommandPort {

    /**
     * Runs {@code command}. Destructive commands only act when {@code args}
     * carries the confirmation token.
     */
    CommandResult execute(String command, List<String> args);

    boolean hasCommand(String command);

    List<CommandDefinition> listCommands();

    /**
     * True for commands that must be confirmed before {@link #execute} is
     * called with the confirmation token.
     */
    default boolean requiresConfirmation(String command) {
        if (command == null) {
            return false;
        }
        String normalized = command.toLowerCase(Locale.ROOT);
        return listCommands().stream()
                .anyMatch(definition -> definition.destructive() && definition.name().equals(normalized));
    }

    /**
     * Outcome shown to the user. {@code data} carries the structured result
     * (turns, memories, counts) for callers that want more than text.
     */
    record CommandResult(boolean success, String output, Object data) {

        public static CommandResult success(String output) {
            return new CommandResult(true, output, null);
        }

        public static CommandResult success(String output, Object data) {
            return new CommandResult(true, output, data);
        }

        public static CommandResult failure(String error) {
            return new CommandResult(false, error, null);
        }
    }

    record CommandDefinition(String name, String description, boolean destructive) {
    }
}
