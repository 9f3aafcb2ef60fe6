package me.golemcore.todo.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * A single to-do item. Deadlines are kept in their textual {@code DD-MM-YYYY}
 * form so that records loaded with a missing or damaged deadline survive a
 * load/save cycle unchanged.
 *
 * <p>
 * There are no setters: a task changes only through {@link #apply(TaskDraft)}
 * and {@link #toggleCompletion()}, which the task store calls on its own
 * instances. Everything the store hands out is a {@link #copy()}.
 */
@Getter
@EqualsAndHashCode
@ToString
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    /**
     * Day and month may omit their leading zero ({@code 5-1-2027}); the date
     * must still exist.
     */
    public static final DateTimeFormatter DEADLINE_FORMAT = DateTimeFormatter.ofPattern("d-M-uuuu")
            .withResolverStyle(ResolverStyle.STRICT);
    public static final int DEFAULT_URGENT_WITHIN_DAYS = 3;

    private int id;

    private String title;

    @Builder.Default
    private String description = "";

    @Builder.Default
    private TaskCategory category = TaskCategory.defaultCategory();

    @Builder.Default
    private String deadline = "";

    private boolean completed;

    private LocalDate createdDate;

    @Builder.Default
    private TaskType type = TaskType.DEADLINE_TASK;

    /**
     * Builds a new, not yet completed task from already validated fields.
     */
    public static Task create(int id, TaskDraft draft, LocalDate today) {
        return Task.builder()
                .id(id)
                .title(draft.title())
                .description(draft.description() != null ? draft.description() : "")
                .deadline(draft.deadline())
                .category(draft.category() != null ? draft.category() : TaskCategory.defaultCategory())
                .completed(false)
                .createdDate(today)
                .type(TaskType.DEADLINE_TASK)
                .build();
    }

    public static Optional<LocalDate> parseDeadline(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.trim(), DEADLINE_FORMAT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public Task copy() {
        return toBuilder().build();
    }

    /**
     * Overwrites the user-editable fields. The category is left as is when the
     * draft does not carry one.
     */
    public void apply(TaskDraft draft) {
        this.title = draft.title();
        this.description = draft.description() != null ? draft.description() : "";
        this.deadline = draft.deadline();
        if (draft.category() != null) {
            this.category = draft.category();
        }
    }

    public void toggleCompletion() {
        this.completed = !this.completed;
    }

    public Optional<LocalDate> getDeadlineDate() {
        return parseDeadline(deadline);
    }

    public Urgency urgency(LocalDateTime now) {
        return urgency(now, DEFAULT_URGENT_WITHIN_DAYS);
    }

    /**
     * Classifies the task relative to {@code now}. The time left runs up to the
     * start of the deadline day and is counted in whole days, so at noon a
     * deadline three calendar days away has two days left. An unparseable
     * deadline yields {@link Urgency#PENDING}.
     */
    public Urgency urgency(LocalDateTime now, int urgentWithinDays) {
        if (completed) {
            return Urgency.DONE;
        }
        return getDeadlineDate()
                .map(date -> daysLeft(now, date) < urgentWithinDays ? Urgency.URGENT : Urgency.PENDING)
                .orElse(Urgency.PENDING);
    }

    private static long daysLeft(LocalDateTime now, LocalDate deadline) {
        Duration left = Duration.between(now, deadline.atStartOfDay());
        return Math.floorDiv(left.getSeconds(), Duration.ofDays(1).getSeconds());
    }

    public String getDetails() {
        String status = completed ? "✓" : "✗";
        return "[" + status + "] " + title + " | Deadline: " + deadline;
    }
}
