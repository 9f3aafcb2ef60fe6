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

import me.golemcore.todo.domain.model.Task;
import me.golemcore.todo.domain.model.TaskCategory;
import me.golemcore.todo.domain.model.TaskDraft;
import org.springframework.stereotype.Component;

/**
 * Validates user-supplied task fields. Creation and in-place edit both go
 * through here, so a record can never be changed into a state it could not
 * have been created in.
 */
@Component
public class TaskValidator {

    /**
     * Validates raw input where the category is given by name.
     *
     * @throws TaskValidationException
     *             if a field is missing or malformed
     */
    public TaskDraft validate(String title, String description, String deadline, String categoryName) {
        TaskCategory category = null;
        if (categoryName != null && !categoryName.isBlank()) {
            category = TaskCategory.fromLabel(categoryName)
                    .orElseThrow(() -> new TaskValidationException(
                            "Unknown category: " + categoryName.trim() + ". Expected one of "
                                    + String.join(", ", TaskCategory.labels())));
        }
        return validate(new TaskDraft(title, description, deadline, category));
    }

    /**
     * Returns a trimmed copy of the draft.
     *
     * @throws TaskValidationException
     *             if the title or deadline is empty, or the deadline is not a
     *             valid {@code DD-MM-YYYY} date
     */
    public TaskDraft validate(TaskDraft draft) {
        if (draft == null) {
            throw new TaskValidationException("Task fields are required");
        }
        String title = trimToEmpty(draft.title());
        if (title.isEmpty()) {
            throw new TaskValidationException("Title must not be empty");
        }
        String deadline = trimToEmpty(draft.deadline());
        if (deadline.isEmpty()) {
            throw new TaskValidationException("Deadline must not be empty");
        }
        if (Task.parseDeadline(deadline).isEmpty()) {
            throw new TaskValidationException("Deadline must be a valid date in DD-MM-YYYY format: " + deadline);
        }
        return new TaskDraft(title, trimToEmpty(draft.description()), deadline, draft.category());
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
