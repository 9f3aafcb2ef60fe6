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

/**
 * User-supplied task fields, used both to create a task and to edit one in
 * place. A {@code null} category means "default" on create and "unchanged" on
 * edit.
 */
public record TaskDraft(
        String title,
        String description,
        String deadline,
        TaskCategory category) {

    public static TaskDraft of(String title, String description, String deadline) {
        return new TaskDraft(title, description, deadline, null);
    }
}
