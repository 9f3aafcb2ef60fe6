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
 * Completion counters for the whole task list.
 */
public record ProgressSummary(int total, int done, int pending, int percent) {

    public static ProgressSummary of(int total, int done) {
        int percent = total > 0 ? (int) Math.round(done * 100.0 / total) : 0;
        return new ProgressSummary(total, done, total - done, percent);
    }
}
