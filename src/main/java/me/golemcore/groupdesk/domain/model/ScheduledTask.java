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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A unit of scheduled outbound work: a broadcast, a poll, or an open/close
 * group mode change targeting one or more groups of a tenant.
 *
 * <p>
 * Persisted as {@code tasks/<id>.json}. Mutated only by the dispatcher once
 * created; a task that left {@link TaskStatus#PENDING} is never reset.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledTask {

    private String id;
    private String tenantId;
    private TaskType type;

    private boolean recurring;
    private String recurringTime;
    private String parentScheduleId;

    private String content;
    private String mediaReference;

    @Builder.Default
    private List<String> pollOptions = new ArrayList<>();
    private boolean pollAllowMultiple;

    @Builder.Default
    private List<String> targetGroupIds = new ArrayList<>();
    @Builder.Default
    private List<String> targetGroupNames = new ArrayList<>();

    @Builder.Default
    private MentionMode mentionMode = MentionMode.NONE;
    @Builder.Default
    private List<String> mentionIds = new ArrayList<>();

    private Instant scheduledAt;

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;
    private int groupsSent;
    private int groupsFailed;
    private String errorMessage;
    private Instant sentAt;

    private Instant createdAt;
    private Instant updatedAt;

    public static String newId() {
        return "task-" + UUID.randomUUID();
    }

    @JsonIgnore
    public int getTotalGroups() {
        return targetGroupIds != null ? targetGroupIds.size() : 0;
    }

    @JsonIgnore
    public boolean isMentionAll() {
        return mentionMode == MentionMode.ALL;
    }

    /**
     * Mention ids passed to the bridge; empty unless the mode is selected.
     */
    @JsonIgnore
    public List<String> getEffectiveMentionIds() {
        if (mentionMode != MentionMode.SELECTED || mentionIds == null) {
            return List.of();
        }
        return mentionIds;
    }

    @JsonIgnore
    public boolean hasMedia() {
        return mediaReference != null && !mediaReference.isBlank();
    }

    @JsonIgnore
    public boolean isDue(Instant now) {
        return status == TaskStatus.PENDING && scheduledAt != null && !scheduledAt.isAfter(now);
    }
}
