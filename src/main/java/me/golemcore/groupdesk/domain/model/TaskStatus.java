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
 * Task lifecycle states.
 *
 * <p>
 * Allowed transitions are {@code pending -> sending -> sent | partially_sent |
 * failed} and {@code pending -> cancelled}. Terminal states are never left.
 */
public enum TaskStatus {

    PENDING("pending"),
    SENDING("sending"),
    SENT("sent"),
    PARTIALLY_SENT("partially_sent"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == SENT || this == PARTIALLY_SENT || this == FAILED || this == CANCELLED;
    }

    /**
     * Terminal status for a finished execution.
     */
    public static TaskStatus fromCounts(int sent, int failed) {
        if (failed == 0) {
            return SENT;
        }
        if (sent == 0) {
            return FAILED;
        }
        return PARTIALLY_SENT;
    }

    @JsonCreator
    public static TaskStatus fromValue(String value) {
        for (TaskStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
