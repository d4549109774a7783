package me.golemcore.groupdesk.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of outbound work a {@link ScheduledTask} performs.
 */
public enum TaskType {

    BROADCAST("broadcast", "broadcast"),
    POLL("poll", "poll"),
    OPEN_GROUP("open_group", "settings"),
    CLOSE_GROUP("close_group", "settings");

    private final String value;
    private final String notificationPrefix;

    TaskType(String value, String notificationPrefix) {
        this.value = value;
        this.notificationPrefix = notificationPrefix;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Prefix of the {@code *_progress} / {@code *_complete} notification types.
     */
    public String getNotificationPrefix() {
        return notificationPrefix;
    }

    public boolean isGroupSetting() {
        return this == OPEN_GROUP || this == CLOSE_GROUP;
    }

    @JsonCreator
    public static TaskType fromValue(String value) {
        for (TaskType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + value);
    }
}
