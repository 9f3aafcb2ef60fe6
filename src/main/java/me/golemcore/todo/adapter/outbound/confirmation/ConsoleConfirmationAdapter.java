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

package me.golemcore.todo.adapter.outbound.confirmation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.todo.adapter.inbound.console.ConsoleIo;
import me.golemcore.todo.port.outbound.ConfirmationPort;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Asks for a yes/no answer on the terminal. Anything other than an explicit
 * "y" or "yes" counts as a denial, including end of input.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConsoleConfirmationAdapter implements ConfirmationPort {

    private static final Set<String> APPROVALS = Set.of("y", "yes");

    private final ConsoleIo consoleIo;

    @Override
    public CompletableFuture<Boolean> requestConfirmation(String description) {
        consoleIo.print(description + " [y/N] ");
        String answer = consoleIo.readLine();
        boolean approved = answer != null && APPROVALS.contains(answer.trim().toLowerCase(Locale.ROOT));
        log.debug("[Confirmation] '{}' -> {}", description, approved ? "approved" : "denied");
        return CompletableFuture.completedFuture(approved);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
