package me.golemcore.todo.domain.service;

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

import me.golemcore.todo.domain.model.IndexedTask;
import me.golemcore.todo.domain.model.ProgressSummary;
import me.golemcore.todo.domain.model.Task;
import me.golemcore.todo.domain.model.TaskDraft;
import me.golemcore.todo.domain.model.TaskOperationResult;
import me.golemcore.todo.domain.model.TaskRecord;
import me.golemcore.todo.domain.model.Urgency;
import me.golemcore.todo.infrastructure.config.TodoProperties;
import me.golemcore.todo.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Owner of the task list and its file mirror. Single-user, single-process
 * design: the whole list is loaded once at startup and the whole list is
 * rewritten after every change.
 *
 * <p>
 * Tasks can be addressed by position (a zero-based index that is valid until
 * the next mutation) or by id (stable for the lifetime of the task). Operations
 * on an unknown position or id change nothing and report
 * {@link TaskOperationResult.Outcome#NOT_FOUND}. Tasks handed out are copies;
 * changes go through the operations of this class.
 *
 * <p>
 * Records in the file that cannot be turned into tasks (no usable id, an
 * unknown kind, a duplicate id, wrongly typed fields) are not loaded but are
 * kept as they are and written back after the loaded tasks on every save.
 *
 * <p>
 * Storage layout:
 * <ul>
 * <li>tasks/tasks.json - pretty-printed JSON array of task records</li>
 * </ul>
 */
@Service
@Slf4j
public class TaskStoreService {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final TaskRecordMapper recordMapper;
    private final TaskValidator validator;
    private final TodoProperties properties;
    private final Clock clock;

    private final List<Task> tasks = new ArrayList<>();
    private final List<JsonNode> retainedRecords = new ArrayList<>();

    // Highest id ever held by this instance, so ids are not reused after delete
    private int highestId;

    public TaskStoreService(StoragePort storagePort, ObjectMapper objectMapper, TaskRecordMapper recordMapper,
            TaskValidator validator, TodoProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.recordMapper = recordMapper;
        this.validator = validator;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        load();
    }

    // ==================== Reads ====================

    public List<Task> getTasks() {
        return tasks.stream()
                .map(Task::copy)
                .toList();
    }

    public int size() {
        return tasks.size();
    }

    public Optional<Task> findById(int id) {
        return tasks.stream()
                .filter(t -> t.getId() == id)
                .findFirst()
                .map(Task::copy);
    }

    /**
     * Returns the tasks whose title, description or category label contains the
     * filter text, ignoring case, together with their current positions. A blank
     * filter matches every task.
     */
    public List<IndexedTask> query(String filterText) {
        String needle = filterText == null ? "" : filterText.trim().toLowerCase(Locale.ROOT);
        List<IndexedTask> result = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            Task task = tasks.get(i);
            if (needle.isEmpty() || matches(task, needle)) {
                result.add(new IndexedTask(i, task.copy()));
            }
        }
        return result;
    }

    public ProgressSummary progressSummary() {
        int done = (int) tasks.stream().filter(Task::isCompleted).count();
        return ProgressSummary.of(tasks.size(), done);
    }

    public Urgency urgencyOf(Task task) {
        return task.urgency(LocalDateTime.now(clock), properties.getTasks().getUrgentWithinDays());
    }

    // ==================== Mutations by position ====================

    /**
     * Validates the draft, builds a task with the next id and appends it.
     *
     * @throws TaskValidationException
     *             if the draft is invalid or no id is left; nothing is added in
     *             that case
     */
    public TaskOperationResult create(TaskDraft draft) {
        TaskDraft valid = validator.validate(draft);
        Task task = Task.create(nextId(), valid, today());
        return add(task);
    }

    /**
     * Appends a copy of an already built task to the end of the list.
     */
    public TaskOperationResult add(Task task) {
        if (task == null) {
            throw new IllegalArgumentException("Task is required");
        }
        if (task.getId() <= 0) {
            throw new IllegalArgumentException("Task id must be positive: " + task.getId());
        }
        if (findById(task.getId()).isPresent()) {
            throw new IllegalArgumentException("Duplicate task id: " + task.getId());
        }

        tasks.add(task.copy());
        highestId = Math.max(highestId, task.getId());
        log.info("[Tasks] Added task #{} '{}'", task.getId(), task.getTitle());
        return saved(task);
    }

    public TaskOperationResult delete(int position) {
        if (!inRange(position)) {
            log.debug("[Tasks] Delete ignored, no task at position {}", position);
            return TaskOperationResult.notFound();
        }
        Task removed = tasks.remove(position);
        log.info("[Tasks] Deleted task #{} '{}'", removed.getId(), removed.getTitle());
        return saved(removed);
    }

    public TaskOperationResult toggle(int position) {
        if (!inRange(position)) {
            log.debug("[Tasks] Toggle ignored, no task at position {}", position);
            return TaskOperationResult.notFound();
        }
        Task task = tasks.get(position);
        task.toggleCompletion();
        log.info("[Tasks] Task #{} marked {}", task.getId(), task.isCompleted() ? "done" : "pending");
        return saved(task);
    }

    /**
     * Overwrites title, description, deadline and, when given, category of the
     * task at the position.
     *
     * @throws TaskValidationException
     *             if the draft is invalid; the task is left unchanged
     */
    public TaskOperationResult edit(int position, TaskDraft draft) {
        TaskDraft valid = validator.validate(draft);
        if (!inRange(position)) {
            log.debug("[Tasks] Edit ignored, no task at position {}", position);
            return TaskOperationResult.notFound();
        }
        Task task = tasks.get(position);
        task.apply(valid);
        log.info("[Tasks] Edited task #{}", task.getId());
        return saved(task);
    }

    // ==================== Mutations by id ====================

    public TaskOperationResult deleteById(int id) {
        OptionalInt position = positionOf(id);
        return position.isPresent() ? delete(position.getAsInt()) : TaskOperationResult.notFound();
    }

    public TaskOperationResult toggleById(int id) {
        OptionalInt position = positionOf(id);
        return position.isPresent() ? toggle(position.getAsInt()) : TaskOperationResult.notFound();
    }

    /**
     * @throws TaskValidationException
     *             if the draft is invalid; the task is left unchanged
     */
    public TaskOperationResult editById(int id, TaskDraft draft) {
        OptionalInt position = positionOf(id);
        if (position.isEmpty()) {
            validator.validate(draft);
            return TaskOperationResult.notFound();
        }
        return edit(position.getAsInt(), draft);
    }

    // ==================== Persistence ====================

    /**
     * Writes the whole list, followed by the records kept from loading, to the
     * task file, replacing it.
     *
     * @return false if the write failed; the in-memory list is kept either way
     */
    public boolean persist() {
        try {
            ArrayNode records = objectMapper.createArrayNode();
            for (Task task : tasks) {
                records.add(objectMapper.<JsonNode>valueToTree(recordMapper.toRecord(task)));
            }
            records.addAll(retainedRecords);
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(records);
            storagePort.putTextAtomic(tasksDirectory(), tasksFile(), json,
                    properties.getStorage().isBackupOnSave()).join();
            log.debug("[Tasks] Saved {} tasks and {} retained records", tasks.size(), retainedRecords.size());
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("[Tasks] Failed to save tasks, changes are kept in memory only", e);
            return false;
        }
    }

    /**
     * Replaces the in-memory list with the content of the task file. A missing
     * file yields an empty list; an unreadable or malformed file is logged and
     * also yields an empty list.
     */
    public void load() {
        tasks.clear();
        retainedRecords.clear();
        highestId = 0;

        String json;
        try {
            if (!Boolean.TRUE.equals(storagePort.exists(tasksDirectory(), tasksFile()).join())) {
                log.info("[Tasks] No task file yet, starting with an empty list");
                return;
            }
            json = storagePort.getText(tasksDirectory(), tasksFile()).join();
        } catch (RuntimeException e) {
            log.warn("[Tasks] Failed to read task file, starting with an empty list: {}", e.getMessage());
            return;
        }
        if (json == null || json.isBlank()) {
            return;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            log.warn("[Tasks] Task file is malformed, starting with an empty list: {}", e.getMessage());
            return;
        }
        if (root == null || !root.isArray()) {
            log.warn("[Tasks] Task file holds no task list, starting with an empty list");
            return;
        }

        LocalDate today = today();
        Set<Integer> seenIds = new HashSet<>();
        for (JsonNode node : root) {
            if (node.isNull()) {
                continue;
            }
            Optional<Task> task = readRecord(node, today);
            if (task.isPresent() && !seenIds.add(task.get().getId())) {
                log.warn("[Tasks] Duplicate task id {}, keeping the record without loading it",
                        task.get().getId());
                task = Optional.empty();
            }
            if (task.isEmpty()) {
                retain(node);
                continue;
            }
            tasks.add(task.get());
            highestId = Math.max(highestId, task.get().getId());
        }
        if (!retainedRecords.isEmpty()) {
            log.warn("[Tasks] {} records could not be loaded and are kept in the file as they are",
                    retainedRecords.size());
        }
        log.info("[Tasks] Loaded {} tasks", tasks.size());
    }

    private Optional<Task> readRecord(JsonNode node, LocalDate today) {
        try {
            return recordMapper.fromRecord(objectMapper.treeToValue(node, TaskRecord.class), today);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[Tasks] Cannot read task record: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // Ids of retained records stay reserved so a new task never collides with them
    private void retain(JsonNode node) {
        retainedRecords.add(node);
        JsonNode id = node.get("id");
        if (id != null && id.canConvertToInt()) {
            highestId = Math.max(highestId, id.asInt());
        }
    }

    // ==================== Helpers ====================

    private TaskOperationResult saved(Task task) {
        Task snapshot = task.copy();
        return persist() ? TaskOperationResult.applied(snapshot) : TaskOperationResult.notPersisted(snapshot);
    }

    private int nextId() {
        try {
            return Math.addExact(highestId, 1);
        } catch (ArithmeticException e) {
            throw new TaskValidationException("No task id left: id " + highestId + " is already in use");
        }
    }

    private boolean inRange(int position) {
        return position >= 0 && position < tasks.size();
    }

    private OptionalInt positionOf(int id) {
        return IntStream.range(0, tasks.size())
                .filter(i -> tasks.get(i).getId() == id)
                .findFirst();
    }

    private static boolean matches(Task task, String needle) {
        return containsIgnoreCase(task.getTitle(), needle)
                || containsIgnoreCase(task.getDescription(), needle)
                || containsIgnoreCase(task.getCategory().getLabel(), needle);
    }

    private static boolean containsIgnoreCase(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private String tasksDirectory() {
        return properties.getStorage().getTasksDirectory();
    }

    private String tasksFile() {
        return properties.getStorage().getTasksFile();
    }
}
