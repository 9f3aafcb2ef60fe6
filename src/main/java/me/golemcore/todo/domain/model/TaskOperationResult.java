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

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a mutating task store operation. Lets callers tell a stale
 * position or unknown id apart from a change that was applied, and a change
 * that was applied in memory but could not be written to disk.
 */
@Data
@Builder
public class TaskOperationResult {

    private Outcome outcome;
    private Task task;

    public static TaskOperationResult applied(Task task) {
        return TaskOperationResult.builder()
                .outcome(Outcome.APPLIED)
                .task(task)
                .build();
    }

    public static TaskOperationResult notPersisted(Task task) {
        return TaskOperationResult.builder()
                .outcome(Outcome.NOT_PERSISTED)
                .task(task)
                .build();
    }

    public static TaskOperationResult notFound() {
        return TaskOperationResult.builder()
                .outcome(Outcome.NOT_FOUND)
                .build();
    }

    /**
     * True when the in-memory collection was changed, whether or not the save
     * succeeded.
     */
    public boolean isChanged() {
        return outcome != Outcome.NOT_FOUND;
    }

    public enum Outcome {
        APPLIED, NOT_FOUND, NOT_PERSISTED
    }
}
