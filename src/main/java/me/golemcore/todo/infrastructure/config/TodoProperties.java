package me.golemcore.todo.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the application, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code todo.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where and how the task file is written</li>
 * <li>{@link TasksProperties} - task classification rules</li>
 * <li>{@link ConsoleProperties} - the interactive console</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "todo")
@Data
public class TodoProperties {

    private StorageProperties storage = new StorageProperties();
    private TasksProperties tasks = new TasksProperties();
    private ConsoleProperties console = new ConsoleProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String tasksDirectory = "tasks";
        private String tasksFile = "tasks.json";
        private boolean backupOnSave = false;
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore-todo";
    }

    @Data
    public static class TasksProperties {
        private int urgentWithinDays = 3;
    }

    @Data
    public static class ConsoleProperties {
        private boolean enabled = true;
        private String prompt = "todo> ";
    }
}
