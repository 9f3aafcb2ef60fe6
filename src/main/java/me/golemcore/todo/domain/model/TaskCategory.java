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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of task categories. The first constant is the default for tasks
 * created without an explicit category.
 */
public enum TaskCategory {

    GENERAL("General"), SCHOOL("School"), WORK("Work"), PERSONAL("Personal");

    private final String label;

    TaskCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static TaskCategory defaultCategory() {
        return GENERAL;
    }

    /**
     * Resolves a category by its display label or constant name, ignoring case.
     */
    public static Optional<TaskCategory> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.label.toLowerCase(Locale.ROOT).equals(normalized)
                        || c.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(TaskCategory::getLabel).toList();
    }
}
