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

package me.golemcore.todo.adapter.inbound.console;

import me.golemcore.todo.infrastructure.config.TodoProperties;
import me.golemcore.todo.port.inbound.CommandPort;
import me.golemcore.todo.port.inbound.CommandPort.CommandResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Interactive read-eval-print loop over the terminal. Each line is split into
 * a command and arguments (double or single quotes group words) and handed to
 * the {@link CommandPort}. The loop ends on {@code quit}, {@code exit} or end
 * of input.
 *
 * <p>
 * Enabled by {@code todo.console.enabled} (default {@code true}).
 */
@Component
@ConditionalOnProperty(prefix = "todo.console", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ConsoleChannel implements CommandLineRunner {

    private static final Set<String> EXIT_COMMANDS = Set.of("quit", "exit");
    private static final String ERROR_PREFIX = "! ";

    private final CommandPort commandPort;
    private final ConsoleIo consoleIo;
    private final TodoProperties properties;

    @Override
    public void run(String... args) {
        log.info("[Console] Started");
        consoleIo.println("Type 'help' for commands, 'quit' to exit.");
        render(commandPort.execute("list", List.of()));

        while (true) {
            consoleIo.print(properties.getConsole().getPrompt());
            String line = consoleIo.readLine();
            if (line == null) {
                break;
            }
            List<String> tokens = tokenize(line);
            if (tokens.isEmpty()) {
                continue;
            }
            String command = normalizeCommand(tokens.get(0));
            if (EXIT_COMMANDS.contains(command)) {
                break;
            }
            render(commandPort.execute(command, tokens.subList(1, tokens.size())));
        }
        log.info("[Console] Stopped");
    }

    private void render(CommandResult result) {
        if (result.success()) {
            consoleIo.println(result.output());
        } else {
            consoleIo.println(ERROR_PREFIX + result.output());
        }
    }

    static String normalizeCommand(String token) {
        String command = token.startsWith("/") ? token.substring(1) : token;
        return command.toLowerCase(Locale.ROOT);
    }

    /**
     * Splits a line on whitespace, keeping quoted segments together. An
     * unterminated quote runs to the end of the line.
     */
    static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        boolean inToken = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
