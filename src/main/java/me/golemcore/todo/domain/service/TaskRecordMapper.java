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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.todo.domain.model.Task;
import me.golemcore.todo.domain.model.TaskCategory;
import me.golemcore.todo.domain.model.TaskRecord;
import me.golemcore.todo.domain.model.TaskType;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Converts between {@link Task} and its flat on-disk {@link TaskRecord},
 * dispatching on the record's {@code type} discriminant.
 *
 * <p>
 * Reading is lenient: a missing deadline becomes an empty string, a missing or
 * unknown category becomes the default one, a missing completion flag becomes
 * {@code false} and a missing creation date becomes today. Legacy
 * {@code "Task"} records are upgraded to deadline tasks with an empty
 * deadline. A blank title is kept as it is; titles are only checked when a
 * task is created or edited. Records without a usable id, or of an unknown
 * kind, are not turned into tasks.
 */
@Component
@Slf4j
public class TaskRecordMapper {

    private static final DateTimeFormatter CREATED_DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    public TaskRecord toRecord(Task task) {
        TaskRecord.TaskRecordBuilder builder = TaskRecord.builder()
                .id(task.getId())
                .title(task.getTitle())
                .description(task.getDescription() != null ? task.getDescription() : "")
                .category(task.getCategory().getLabel())
                .completed(task.isCompleted())
                .createdDate(task.getCreatedDate() != null ? task.getCreatedDate().format(CREATED_DATE_FORMAT) : null)
                .type(task.getType().getDiscriminant());

        switch (task.getType()) {
        case DEADLINE_TASK -> builder.deadline(task.getDeadline() != null ? task.getDeadline() : "");
        case BASIC_TASK -> builder.deadline(null);
        default -> throw new IllegalStateException("Unhandled task type: " + task.getType());
        }
        return builder.build();
    }

    public Optional<Task> fromRecord(TaskRecord record, LocalDate today) {
        Optional<TaskType> type = record.getType() == null
                ? Optional.of(TaskType.DEADLINE_TASK)
                : TaskType.fromDiscriminant(record.getType());
        if (type.isEmpty()) {
            log.warn("[Tasks] Cannot load record {} with unknown type '{}'", record.getId(), record.getType());
            return Optional.empty();
        }
        if (record.getId() == null || record.getId() <= 0) {
            log.warn("[Tasks] Cannot load record without a valid id: '{}'", record.getTitle());
            return Optional.empty();
        }

        String deadline = switch (type.get()) {
        case DEADLINE_TASK -> record.getDeadline() != null ? record.getDeadline() : "";
        case BASIC_TASK -> "";
        };

        return Optional.of(Task.builder()
                .id(record.getId())
                .title(record.getTitle() != null ? record.getTitle() : "")
                .description(record.getDescription() != null ? record.getDescription() : "")
                .category(resolveCategory(record))
                .deadline(deadline)
                .completed(Boolean.TRUE.equals(record.getCompleted()))
                .createdDate(resolveCreatedDate(record, today))
                .type(TaskType.DEADLINE_TASK)
                .build());
    }

    private TaskCategory resolveCategory(TaskRecord record) {
        if (record.getCategory() == null) {
            return TaskCategory.defaultCategory();
        }
        return TaskCategory.fromLabel(record.getCategory()).orElseGet(() -> {
            log.warn("[Tasks] Record {} has unknown category '{}', using {}", record.getId(),
                    record.getCategory(), TaskCategory.defaultCategory().getLabel());
            return TaskCategory.defaultCategory();
        });
    }

    private LocalDate resolveCreatedDate(TaskRecord record, LocalDate today) {
        if (record.getCreatedDate() == null || record.getCreatedDate().isBlank()) {
            return today;
        }
        try {
            return LocalDate.parse(record.getCreatedDate().trim(), CREATED_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            log.debug("[Tasks] Record {} has invalid created_date '{}', using today", record.getId(),
                    record.getCreatedDate());
            return today;
        }
    }
}
