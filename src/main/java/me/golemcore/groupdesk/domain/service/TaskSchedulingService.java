package me.golemcore.groupdesk.domain.service;

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

import me.golemcore.groupdesk.domain.model.GroupScheduleRequest;
import me.golemcore.groupdesk.domain.model.MentionMode;
import me.golemcore.groupdesk.domain.model.MonitoredGroup;
import me.golemcore.groupdesk.domain.model.ScheduledTask;
import me.golemcore.groupdesk.domain.model.TaskRequest;
import me.golemcore.groupdesk.domain.model.TaskStatus;
import me.golemcore.groupdesk.domain.model.TaskType;
import me.golemcore.groupdesk.port.outbound.GroupStorePort;
import me.golemcore.groupdesk.port.outbound.TaskStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Creates and cancels scheduled tasks.
 *
 * <p>
 * Validation failures throw {@link IllegalArgumentException}; cancelling a
 * task that already left {@code pending} throws
 * {@link IllegalStateException}.
 */
@Service
@Slf4j
public class TaskSchedulingService {

    private static final int MIN_POLL_OPTIONS = 2;
    private static final int MAX_POLL_OPTIONS = 12;

    private final TaskStorePort taskStore;
    private final GroupStorePort groupStore;
    private final RecurrenceCalculator recurrence;
    private final Clock clock;

    public TaskSchedulingService(TaskStorePort taskStore, GroupStorePort groupStore,
            RecurrenceCalculator recurrence, Clock clock) {
        this.taskStore = taskStore;
        this.groupStore = groupStore;
        this.recurrence = recurrence;
        this.clock = clock;
    }

    public ScheduledTask scheduleBroadcast(TaskRequest request) {
        boolean hasContent = request.getContent() != null && !request.getContent().isBlank();
        boolean hasMedia = request.getMediaReference() != null && !request.getMediaReference().isBlank();
        if (!hasContent && !hasMedia) {
            throw new IllegalArgumentException("Message content is required");
        }
        return create(request, TaskType.BROADCAST, List.of());
    }

    public ScheduledTask schedulePoll(TaskRequest request) {
        if (request.getContent() == null || request.getContent().isBlank()) {
            throw new IllegalArgumentException("Poll question is required");
        }
        List<String> options = request.getPollOptions() == null ? List.of()
                : request.getPollOptions().stream()
                        .filter(Objects::nonNull)
                        .map(String::trim)
                        .filter(option -> !option.isEmpty())
                        .toList();
        if (options.size() < MIN_POLL_OPTIONS) {
            throw new IllegalArgumentException("Poll must have at least " + MIN_POLL_OPTIONS + " options");
        }
        if (options.size() > MAX_POLL_OPTIONS) {
            throw new IllegalArgumentException("Poll cannot have more than " + MAX_POLL_OPTIONS + " options");
        }
        return create(request, TaskType.POLL, options);
    }

    /**
     * Create a daily open/close pair. The open task's id becomes the
     * {@code parentScheduleId} of both tasks and of every later occurrence.
     */
    public GroupSettingsSchedule createGroupSettingsSchedule(GroupScheduleRequest request) {
        RecurrenceCalculator.parseTime(request.getOpenTime());
        RecurrenceCalculator.parseTime(request.getCloseTime());
        validateMentions(request.getMentionMode(), request.getMentionIds());
        List<MonitoredGroup> groups = resolveGroups(request.getTenantId(), request.getGroupIds());

        ScheduledTask openTask = buildSettingsTask(request, groups, TaskType.OPEN_GROUP, request.getOpenTime(),
                request.getOpenMessage());
        String parentId = openTask.getId();
        openTask.setParentScheduleId(parentId);
        ScheduledTask closeTask = buildSettingsTask(request, groups, TaskType.CLOSE_GROUP, request.getCloseTime(),
                request.getCloseMessage());
        closeTask.setParentScheduleId(parentId);

        taskStore.save(openTask);
        taskStore.save(closeTask);
        log.info("[Schedule] Created group schedule {} for tenant {}: open {} at {}, close {} at {}", parentId,
                request.getTenantId(), request.getOpenTime(), openTask.getScheduledAt(), request.getCloseTime(),
                closeTask.getScheduledAt());
        return new GroupSettingsSchedule(parentId, openTask, closeTask);
    }

    /**
     * Cancel a pending task.
     *
     * @throws IllegalArgumentException
     *             if the tenant has no such task
     * @throws IllegalStateException
     *             if the task is no longer pending
     */
    public ScheduledTask cancel(String tenantId, String taskId) {
        ScheduledTask task = taskStore.findById(taskId)
                .filter(t -> Objects.equals(t.getTenantId(), tenantId))
                .orElseThrow(() -> new IllegalArgumentException("Task not found: " + taskId));

        Optional<ScheduledTask> cancelled = taskStore.transition(taskId, TaskStatus.PENDING, TaskStatus.CANCELLED,
                clock.instant());
        if (cancelled.isEmpty()) {
            TaskStatus status = taskStore.findById(taskId).map(ScheduledTask::getStatus).orElse(task.getStatus());
            throw new IllegalStateException("Cannot cancel task with status '" + status.getValue() + "'");
        }
        log.info("[Schedule] Cancelled task {}", taskId);
        return cancelled.get();
    }

    /**
     * Cancel every pending task of a recurring schedule.
     *
     * @return number of tasks cancelled
     */
    public int cancelSchedule(String tenantId, String parentScheduleId) {
        List<ScheduledTask> members = taskStore.findByTenant(tenantId).stream()
                .filter(task -> parentScheduleId.equals(task.getParentScheduleId()))
                .toList();
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Schedule not found: " + parentScheduleId);
        }
        int cancelled = 0;
        for (ScheduledTask task : members) {
            if (task.getStatus() == TaskStatus.PENDING && taskStore
                    .transition(task.getId(), TaskStatus.PENDING, TaskStatus.CANCELLED, clock.instant())
                    .isPresent()) {
                cancelled++;
            }
        }
        log.info("[Schedule] Cancelled schedule {} ({} pending tasks)", parentScheduleId, cancelled);
        return cancelled;
    }

    private ScheduledTask create(TaskRequest request, TaskType type, List<String> pollOptions) {
        validateMentions(request.getMentionMode(), request.getMentionIds());
        List<MonitoredGroup> groups = resolveGroups(request.getTenantId(), request.getGroupIds());

        Instant now = clock.instant();
        Instant scheduledAt = request.getScheduledAt();
        if (scheduledAt == null) {
            scheduledAt = now;
        } else if (!scheduledAt.isAfter(now)) {
            throw new IllegalArgumentException("Scheduled time must be in the future");
        }

        ScheduledTask task = ScheduledTask.builder()
                .id(ScheduledTask.newId())
                .tenantId(request.getTenantId())
                .type(type)
                .content(request.getContent())
                .mediaReference(request.getMediaReference())
                .pollOptions(new ArrayList<>(pollOptions))
                .pollAllowMultiple(request.isPollAllowMultiple())
                .targetGroupIds(new ArrayList<>(request.getGroupIds()))
                .targetGroupNames(groupNames(groups))
                .mentionMode(request.getMentionMode())
                .mentionIds(mentionIdsFor(request.getMentionMode(), request.getMentionIds()))
                .scheduledAt(scheduledAt)
                .status(TaskStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        taskStore.save(task);
        log.info("[Schedule] Created {} {} for tenant {} at {}", type.getValue(), task.getId(),
                task.getTenantId(), scheduledAt);
        return task;
    }

    private ScheduledTask buildSettingsTask(GroupScheduleRequest request, List<MonitoredGroup> groups, TaskType type,
            String time, String message) {
        boolean hasMessage = message != null && !message.isBlank();
        MentionMode mode = hasMessage ? request.getMentionMode() : MentionMode.NONE;
        Instant now = clock.instant();
        return ScheduledTask.builder()
                .id(ScheduledTask.newId())
                .tenantId(request.getTenantId())
                .type(type)
                .recurring(true)
                .recurringTime(time.trim())
                .content(hasMessage ? message : null)
                .targetGroupIds(new ArrayList<>(request.getGroupIds()))
                .targetGroupNames(groupNames(groups))
                .mentionMode(mode)
                .mentionIds(mentionIdsFor(mode, request.getMentionIds()))
                .scheduledAt(recurrence.firstOccurrence(time))
                .status(TaskStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static void validateMentions(MentionMode mode, List<String> mentionIds) {
        if (mode == null) {
            throw new IllegalArgumentException("Invalid mention mode");
        }
        if (mode == MentionMode.SELECTED && (mentionIds == null || mentionIds.isEmpty())) {
            throw new IllegalArgumentException("Mention ids are required for 'selected' mention mode");
        }
    }

    private List<MonitoredGroup> resolveGroups(String tenantId, List<String> groupIds) {
        if (groupIds == null || groupIds.isEmpty()) {
            throw new IllegalArgumentException("At least one group is required");
        }
        List<MonitoredGroup> groups = new ArrayList<>();
        for (String groupId : groupIds) {
            MonitoredGroup group = groupStore.findByTenantAndId(tenantId, groupId)
                    .filter(MonitoredGroup::isActive)
                    .orElseThrow(() -> new IllegalArgumentException("One or more groups not found or not active"));
            groups.add(group);
        }
        return groups;
    }

    private static List<String> groupNames(List<MonitoredGroup> groups) {
        return new ArrayList<>(groups.stream().map(MonitoredGroup::getName).toList());
    }

    private static List<String> mentionIdsFor(MentionMode mode, List<String> mentionIds) {
        if (mode != MentionMode.SELECTED || mentionIds == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(mentionIds);
    }

    /**
     * The two linked tasks of a daily open/close schedule.
     */
    public record GroupSettingsSchedule(String parentScheduleId, ScheduledTask openTask, ScheduledTask closeTask) {
    }
}
