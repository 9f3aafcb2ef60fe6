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
import java.util.Optional;

/**
 * Record kinds that may appear in the task file, keyed by the {@code type}
 * discriminant written next to each record.
 */
public enum TaskType {

    /**
     * Task with a deadline. The only kind the application writes.
     */
    DEADLINE_TASK("DeadlineTask"),

    /**
     * Legacy base shape without a deadline. Read only.
     */
    BASIC_TASK("Task");

    private final String discriminant;

    TaskType(String discriminant) {
        this.discriminant = discriminant;
    }

    public String getDiscriminant() {
        return discriminant;
    }

    public static Optional<TaskType> fromDiscriminant(String value) {
        return Arrays.stream(values())
                .filter(t -> t.discriminant.equals(value))
                .findFirst();
    }
}
