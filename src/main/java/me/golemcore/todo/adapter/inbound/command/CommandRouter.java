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

package me.golemcore.todo.adapter.inbound.command;

import me.golemcore.todo.domain.model.IndexedTask;
import me.golemcore.todo.domain.model.ProgressSummary;
import me.golemcore.todo.domain.model.Task;
import me.golemcore.todo.domain.model.TaskCategory;
import me.golemcore.todo.domain.model.TaskDraft;
import me.golemcore.todo.domain.model.TaskOperationResult;
import me.golemcore.todo.domain.service.TaskStoreService;
import me.golemcore.todo.domain.service.TaskValidationException;
import me.golemcore.todo.domain.service.TaskValidator;
import me.golemcore.todo.port.inbound.CommandPort;
import me.golemcore.todo.port.outbound.ConfirmationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Routes console commands to the task store.
 *
 * <p>
 * Supported commands:
 *
 * <ul>
 * <li>add &lt;title&gt; &lt;DD-MM-YYYY&gt; [category] [description...] - Create a task
 * <li>list [filter...] - List tasks with urgency and progress
 * <li>search &lt;text...&gt; - List tasks matching text
 * <li>done &lt;id&gt; - Toggle completion
 * <li>edit &lt;id&gt; &lt;title&gt; &lt;DD-MM-YYYY&gt; [description...] - Edit a task
 * <li>category &lt;id&gt; &lt;category&gt; - Change a task's category
 * <li>delete &lt;id&gt; - Delete a task after confirmation
 * <li>progress - Show completion progress
 * <li>categories - List categories
 * <li>help - Show available commands
 * </ul>
 *
 * <p>
 * Tasks are addressed by id, which stays valid across re-renders, rather than
 * by list position.
 *
 * @see me.golemcore.todo.port.inbound.CommandPort
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_ADD = "add";
    private static final String CMD_LIST = "list";
    private static final String CMD_SEARCH = "search";
    private static final String CMD_DONE = "done";
    private static final String CMD_EDIT = "edit";
    private static final String CMD_CATEGORY = "category";
    private static final String CMD_DELETE = "delete";
    private static final String CMD_PROGRESS = "progress";
    private static final String CMD_CATEGORIES = "categories";
    private static final String CMD_HELP = "help";
    private static final int MIN_ADD_ARGS = 2;
    private static final int MIN_EDIT_ARGS = 3;
    private static final int MIN_CATEGORY_ARGS = 2;
    private static final String NOT_PERSISTED_SUFFIX = " (not saved: writing the task file failed)";

    private static final List<String> KNOWN_COMMANDS = List.of(
            CMD_ADD, CMD_LIST, CMD_SEARCH, CMD_DONE, CMD_EDIT, CMD_CATEGORY, CMD_DELETE,
            CMD_PROGRESS, CMD_CATEGORIES, CMD_HELP);

    private static final Set<String> KNOWN_COMMAND_SET = Set.copyOf(KNOWN_COMMANDS);

    private final TaskStoreService taskStoreService;
    private final TaskValidator taskValidator;
    private final ConfirmationPort confirmationPort;

    public CommandRouter(TaskStoreService taskStoreService, TaskValidator taskValidator,
            ConfirmationPort confirmationPort) {
        this.taskStoreService = taskStoreService;
        this.taskValidator = taskValidator;
        this.confirmationPort = confirmationPort;
        log.info("CommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CommandResult execute(String command, List<String> args) {
        log.debug("Executing command: /{} {}", command, args);
        if (!hasCommand(command)) {
            return CommandResult.failure("Unknown command: " + command + ". Type 'help' for the list.");
        }

        try {
            return switch (command) {
            case CMD_ADD -> handleAdd(args);
            case CMD_LIST -> handleList(String.join(" ", args));
            case CMD_SEARCH -> handleSearch(args);
            case CMD_DONE -> handleDone(args);
            case CMD_EDIT -> handleEdit(args);
            case CMD_CATEGORY -> handleCategory(args);
            case CMD_DELETE -> handleDelete(args);
            case CMD_PROGRESS -> CommandResult.success(formatProgress(taskStoreService.progressSummary()),
                    taskStoreService.progressSummary());
            case CMD_CATEGORIES -> CommandResult.success("Categories: " + String.join(", ", TaskCategory.labels()));
            case CMD_HELP -> handleHelp();
            default -> CommandResult.failure("Unknown command: " + command);
            };
        } catch (TaskValidationException e) {
            return CommandResult.failure(e.getMessage());
        }
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMAND_SET.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_ADD, "Create a task",
                        "add <title> <DD-MM-YYYY> [category] [description...]"),
                new CommandDefinition(CMD_LIST, "List tasks", "list [filter...]"),
                new CommandDefinition(CMD_SEARCH, "Search tasks by title, description or category",
                        "search <text...>"),
                new CommandDefinition(CMD_DONE, "Toggle a task between done and pending", "done <id>"),
                new CommandDefinition(CMD_EDIT, "Edit a task",
                        "edit <id> <title> <DD-MM-YYYY> [description...]"),
                new CommandDefinition(CMD_CATEGORY, "Change a task's category", "category <id> <category>"),
                new CommandDefinition(CMD_DELETE, "Delete a task", "delete <id>"),
                new CommandDefinition(CMD_PROGRESS, "Show completion progress", "progress"),
                new CommandDefinition(CMD_CATEGORIES, "List categories", "categories"),
                new CommandDefinition(CMD_HELP, "Show available commands", "help"));
    }

    private CommandResult handleAdd(List<String> args) {
        if (args.size() < MIN_ADD_ARGS) {
            return usage(CMD_ADD);
        }
        String title = args.get(0);
        String deadline = args.get(1);
        int descriptionStart = 2;
        TaskCategory category = null;
        if (args.size() > 2) {
            Optional<TaskCategory> explicit = TaskCategory.fromLabel(args.get(2));
            if (explicit.isPresent()) {
                category = explicit.get();
                descriptionStart = 3;
            }
        }
        String description = joinFrom(args, descriptionStart);

        TaskOperationResult result = taskStoreService.create(new TaskDraft(title, description, deadline, category));
        Task task = result.getTask();
        return report(result, "Added task #" + task.getId() + ": " + task.getTitle(), task.getId());
    }

    private CommandResult handleSearch(List<String> args) {
        if (args.isEmpty()) {
            return usage(CMD_SEARCH);
        }
        return handleList(String.join(" ", args));
    }

    private CommandResult handleList(String filter) {
        List<IndexedTask> rows = taskStoreService.query(filter);
        StringBuilder sb = new StringBuilder();
        if (rows.isEmpty()) {
            sb.append(filter.isBlank() ? "No tasks yet." : "No tasks match '" + filter.trim() + "'.");
        }
        for (IndexedTask row : rows) {
            if (sb.length() > 0) {
                sb.append("\n");
            }
            sb.append(formatRow(row.task()));
        }
        sb.append("\n").append(formatProgress(taskStoreService.progressSummary()));
        return CommandResult.success(sb.toString(), rows);
    }

    private CommandResult handleDone(List<String> args) {
        Optional<Integer> id = parseId(args);
        if (id.isEmpty()) {
            return usage(CMD_DONE);
        }
        TaskOperationResult result = taskStoreService.toggleById(id.get());
        String message = result.getTask() != null
                ? "Task #" + id.get() + " is now " + (result.getTask().isCompleted() ? "done" : "pending")
                : "";
        return report(result, message, id.get());
    }

    private CommandResult handleEdit(List<String> args) {
        Optional<Integer> id = parseId(args);
        if (id.isEmpty() || args.size() < MIN_EDIT_ARGS) {
            return usage(CMD_EDIT);
        }
        Optional<Task> existing = taskStoreService.findById(id.get());
        if (existing.isEmpty()) {
            return notFound(id.get());
        }
        String description = args.size() > MIN_EDIT_ARGS
                ? joinFrom(args, MIN_EDIT_ARGS)
                : existing.get().getDescription();

        TaskOperationResult result = taskStoreService.editById(id.get(),
                TaskDraft.of(args.get(1), description, args.get(2)));
        return report(result, "Updated task #" + id.get(), id.get());
    }

    private CommandResult handleCategory(List<String> args) {
        Optional<Integer> id = parseId(args);
        if (id.isEmpty() || args.size() < MIN_CATEGORY_ARGS) {
            return usage(CMD_CATEGORY);
        }
        Optional<Task> existing = taskStoreService.findById(id.get());
        if (existing.isEmpty()) {
            return notFound(id.get());
        }
        Task task = existing.get();
        TaskDraft draft = taskValidator.validate(task.getTitle(), task.getDescription(), task.getDeadline(),
                joinFrom(args, 1));

        TaskOperationResult result = taskStoreService.editById(id.get(), draft);
        return report(result, "Task #" + id.get() + " moved to " + draft.category().getLabel(), id.get());
    }

    private CommandResult handleDelete(List<String> args) {
        Optional<Integer> id = parseId(args);
        if (id.isEmpty()) {
            return usage(CMD_DELETE);
        }
        Optional<Task> existing = taskStoreService.findById(id.get());
        if (existing.isEmpty()) {
            return notFound(id.get());
        }
        if (!confirmationPort.isAvailable()) {
            return CommandResult.failure("Cannot delete task #" + id.get() + ": confirmation is not available");
        }
        boolean approved = confirmationPort
                .requestConfirmation("Delete task #" + id.get() + " \"" + existing.get().getTitle() + "\"?")
                .join();
        if (!approved) {
            return CommandResult.success("Deletion cancelled");
        }
        return report(taskStoreService.deleteById(id.get()), "Deleted task #" + id.get(), id.get());
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder("Available commands:");
        for (CommandDefinition definition : listCommands()) {
            sb.append("\n  ").append(definition.usage()).append(" - ").append(definition.description());
        }
        sb.append("\n  quit - Exit");
        return CommandResult.success(sb.toString());
    }

    // ==================== Formatting ====================

    private String formatRow(Task task) {
        return String.format("#%d [%s] %s (%s) created %s",
                task.getId(),
                taskStoreService.urgencyOf(task).getLabel(),
                task.getDetails(),
                task.getCategory().getLabel(),
                task.getCreatedDate());
    }

    static String formatProgress(ProgressSummary summary) {
        return String.format("Total: %d • Done: %d • Pending: %d • Progress: %d%%",
                summary.total(), summary.done(), summary.pending(), summary.percent());
    }

    private CommandResult report(TaskOperationResult result, String message, int id) {
        return switch (result.getOutcome()) {
        case APPLIED -> CommandResult.success(message, result.getTask());
        case NOT_PERSISTED -> CommandResult.failure(message + NOT_PERSISTED_SUFFIX);
        case NOT_FOUND -> notFound(id);
        };
    }

    private CommandResult notFound(int id) {
        return CommandResult.failure("Task #" + id + " not found");
    }

    private CommandResult usage(String command) {
        return listCommands().stream()
                .filter(d -> d.name().equals(command))
                .findFirst()
                .map(d -> CommandResult.failure("Usage: " + d.usage()))
                .orElseGet(() -> CommandResult.failure("Invalid arguments"));
    }

    private static Optional<Integer> parseId(List<String> args) {
        if (args.isEmpty()) {
            return Optional.empty();
        }
        String raw = args.get(0).trim();
        if (raw.startsWith("#")) {
            raw = raw.substring(1);
        }
        try {
            return Optional.of(Integer.parseInt(raw));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String joinFrom(List<String> args, int from) {
        return from < args.size() ? String.join(" ", args.subList(from, args.size())) : "";
    }
}
