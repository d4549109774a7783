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

import me.golemcore.groupdesk.domain.model.BridgeResult;
import me.golemcore.groupdesk.domain.model.MonitoredGroup;
import me.golemcore.groupdesk.domain.model.ScheduledTask;
import me.golemcore.groupdesk.domain.model.TaskStatus;
import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import me.golemcore.groupdesk.port.outbound.BridgePort;
import me.golemcore.groupdesk.port.outbound.GroupStorePort;
import me.golemcore.groupdesk.port.outbound.NotificationPort;
import me.golemcore.groupdesk.port.outbound.TaskStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes one scheduled task against its target groups.
 *
 * <p>
 * Every task type follows the same algorithm:
 * <ol>
 * <li>claim the task ({@code pending -> sending}); a failed claim means
 * another worker or a cancellation got there first and the task is
 * skipped</li>
 * <li>walk the target groups in order, sleeping the pacing interval between
 * groups</li>
 * <li>check the tenant session before each group; when recovery fails every
 * remaining group is recorded as failed</li>
 * <li>send through {@link BridgeRetryPolicy}, recording one success or one
 * failure per group</li>
 * <li>stamp the terminal status, release media, persist and notify</li>
 * <li>for recurring tasks, create tomorrow's successor whatever the
 * outcome</li>
 * </ol>
 * Groups of one task are never sent concurrently: the pacing interval encodes
 * the bridge's rate limit.
 */
@Service
@Slf4j
public class TaskExecutionService {

    private static final String ERROR_SEPARATOR = "; ";
    private static final String SESSION_NOT_READY = "session not ready";

    private final TaskStorePort taskStore;
    private final GroupStorePort groupStore;
    private final BridgePort bridgePort;
    private final NotificationPort notificationPort;
    private final BridgeRetryPolicy retryPolicy;
    private final SessionHealthService sessionHealth;
    private final RecurrenceCalculator recurrence;
    private final Sleeper sleeper;
    private final GroupDeskProperties properties;
    private final Clock clock;

    public TaskExecutionService(TaskStorePort taskStore, GroupStorePort groupStore, BridgePort bridgePort,
            NotificationPort notificationPort, BridgeRetryPolicy retryPolicy, SessionHealthService sessionHealth,
            RecurrenceCalculator recurrence, Sleeper sleeper, GroupDeskProperties properties, Clock clock) {
        this.taskStore = taskStore;
        this.groupStore = groupStore;
        this.bridgePort = bridgePort;
        this.notificationPort = notificationPort;
        this.retryPolicy = retryPolicy;
        this.sessionHealth = sessionHealth;
        this.recurrence = recurrence;
        this.sleeper = sleeper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Route a due task to the executor for its type.
     */
    public void execute(ScheduledTask task) {
        switch (task.getType()) {
        case BROADCAST -> executeBroadcast(task);
        case POLL -> executePoll(task);
        case OPEN_GROUP -> executeGroupSetting(task, false);
        case CLOSE_GROUP -> executeGroupSetting(task, true);
        default -> log.warn("[Task] Unknown task type {} for {}", task.getType(), task.getId());
        }
    }

    public void executeBroadcast(ScheduledTask task) {
        run(task, null, group -> task.hasMedia()
                ? bridgePort.sendMedia(task.getTenantId(), group.getBridgeGroupId(), task.getMediaReference(),
                        task.getContent(), task.isMentionAll(), task.getEffectiveMentionIds())
                : bridgePort.sendText(task.getTenantId(), group.getBridgeGroupId(), task.getContent(),
                        task.isMentionAll(), task.getEffectiveMentionIds()));
    }

    public void executePoll(ScheduledTask task) {
        run(task, null, group -> bridgePort.sendPoll(task.getTenantId(), group.getBridgeGroupId(),
                task.getContent(), task.getPollOptions(), task.isPollAllowMultiple(),
                task.isMentionAll(), task.getEffectiveMentionIds()));
    }

    /**
     * Open ({@code adminOnly = false}) or close ({@code adminOnly = true}) the
     * target groups, posting the task content afterwards when present.
     */
    public void executeGroupSetting(ScheduledTask task, boolean adminOnly) {
        String action = adminOnly ? "close" : "open";
        run(task, action, group -> {
            BridgeResult result = bridgePort.setGroupMode(task.getTenantId(), group.getBridgeGroupId(), adminOnly);
            if (result != null && result.isSuccess()) {
                sendAssociatedMessage(task, group);
            }
            return result;
        });
    }

    /**
     * Create the next day's pending copy of a recurring task.
     *
     * @return the successor, or empty if the task is not recurring
     */
    public Optional<ScheduledTask> scheduleNextOccurrence(ScheduledTask task) {
        if (!task.isRecurring() || task.getRecurringTime() == null || task.getRecurringTime().isBlank()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        ScheduledTask successor = ScheduledTask.builder()
                .id(ScheduledTask.newId())
                .tenantId(task.getTenantId())
                .type(task.getType())
                .recurring(true)
                .recurringTime(task.getRecurringTime())
                .parentScheduleId(task.getParentScheduleId() != null ? task.getParentScheduleId() : task.getId())
                .content(task.getContent())
                .mediaReference(task.getMediaReference())
                .pollOptions(copy(task.getPollOptions()))
                .pollAllowMultiple(task.isPollAllowMultiple())
                .targetGroupIds(copy(task.getTargetGroupIds()))
                .targetGroupNames(copy(task.getTargetGroupNames()))
                .mentionMode(task.getMentionMode())
                .mentionIds(copy(task.getMentionIds()))
                .scheduledAt(recurrence.nextDailyOccurrence(task.getRecurringTime()))
                .status(TaskStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        taskStore.save(successor);
        log.info("[Task] Scheduled next occurrence of {} as {} at {}", task.getId(), successor.getId(),
                successor.getScheduledAt());
        return Optional.of(successor);
    }

    private void run(ScheduledTask task, String settingsAction, GroupAction action) {
        Optional<ScheduledTask> claimed = taskStore.transition(task.getId(), TaskStatus.PENDING,
                TaskStatus.SENDING, clock.instant());
        if (claimed.isEmpty()) {
            log.info("[Task] {} is no longer pending, skipping", task.getId());
            return;
        }

        ScheduledTask current = claimed.get();
        log.info("[Task] Executing {} {} for tenant {} ({} groups)", current.getType().getValue(),
                current.getId(), current.getTenantId(), current.getTotalGroups());

        Outcome outcome = new Outcome();
        try {
            deliver(current, settingsAction, action, outcome);
            finish(current, settingsAction, outcome);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Task] {} interrupted after {} groups", current.getId(), outcome.processed());
            outcome.failRemaining(current.getTargetGroupIds(), "interrupted");
            finishQuietly(current, settingsAction, outcome);
        } catch (RuntimeException e) { // NOSONAR - one bad task must not stop the dispatcher
            log.error("[Task] {} failed unexpectedly: {}", current.getId(), e.getMessage(), e);
            markFailed(current, settingsAction, outcome, e);
        }

        try {
            scheduleNextOccurrence(current);
        } catch (RuntimeException e) { // NOSONAR
            log.error("[Task] Failed to schedule next occurrence of {}: {}", current.getId(), e.getMessage(), e);
        }
    }

    private void deliver(ScheduledTask task, String settingsAction, GroupAction action, Outcome outcome)
            throws InterruptedException {
        List<String> groupIds = task.getTargetGroupIds() != null ? task.getTargetGroupIds() : List.of();
        for (int i = 0; i < groupIds.size(); i++) {
            String groupId = groupIds.get(i);
            if (i > 0) {
                log.debug("[Task] Waiting {}s before next group", properties.getDispatcher().getPacingInterval()
                        .toSeconds());
                sleeper.sleep(properties.getDispatcher().getPacingInterval());
            }

            if (!sessionHealth.ensureReady(task.getTenantId())) {
                log.warn("[Task] {} aborting: session not ready, {} groups left", task.getId(),
                        groupIds.size() - i);
                outcome.failRemaining(groupIds, SESSION_NOT_READY);
                return;
            }

            try {
                Optional<MonitoredGroup> group = groupStore.findByTenantAndId(task.getTenantId(), groupId);
                if (group.isEmpty()) {
                    outcome.fail("Group " + groupId + " not found");
                    continue;
                }
                MonitoredGroup target = group.get();
                BridgeResult result = retryPolicy.execute(
                        task.getType().getValue() + " " + target.getName(), () -> action.apply(target));
                if (result.isSuccess()) {
                    outcome.succeed();
                    log.info("[Task] {} sent to {}", task.getId(), target.getName());
                    notifyProgress(task, settingsAction, target, outcome);
                } else {
                    outcome.fail(target.getName() + ": " + result.getErrorOrDefault());
                    log.warn("[Task] {} failed for {}: {}", task.getId(), target.getName(), result.getError());
                }
            } catch (RuntimeException e) { // NOSONAR - recorded as a per-group failure
                log.warn("[Task] {} error for group {}: {}", task.getId(), groupId, e.getMessage());
                outcome.fail("Group " + groupId + ": " + e.getMessage());
            }
        }
    }

    private void sendAssociatedMessage(ScheduledTask task, MonitoredGroup group) {
        if (task.getContent() == null || task.getContent().isBlank()) {
            return;
        }
        BridgeResult result = bridgePort.sendText(task.getTenantId(), group.getBridgeGroupId(), task.getContent(),
                task.isMentionAll(), task.getEffectiveMentionIds());
        if (result == null || !result.isSuccess()) {
            log.warn("[Task] Message after settings change failed for {}: {}", group.getName(),
                    result != null ? result.getError() : "no response");
        }
    }

    private void finish(ScheduledTask task, String settingsAction, Outcome outcome) {
        Instant now = clock.instant();
        task.setGroupsSent(outcome.sent);
        task.setGroupsFailed(outcome.failed);
        task.setStatus(TaskStatus.fromCounts(outcome.sent, outcome.failed));
        task.setErrorMessage(outcome.errors.isEmpty() ? null : String.join(ERROR_SEPARATOR, outcome.errors));
        task.setSentAt(now);
        task.setUpdatedAt(now);

        taskStore.save(task);
        releaseOneShotMedia(task);
        log.info("[Task] {} completed: {} (sent={}, failed={})", task.getId(), task.getStatus().getValue(),
                outcome.sent, outcome.failed);
        notifyComplete(task, settingsAction);
    }

    private void finishQuietly(ScheduledTask task, String settingsAction, Outcome outcome) {
        try {
            finish(task, settingsAction, outcome);
        } catch (RuntimeException e) { // NOSONAR
            log.error("[Task] Failed to persist outcome of {}: {}", task.getId(), e.getMessage(), e);
        }
    }

    private void markFailed(ScheduledTask task, String settingsAction, Outcome outcome, RuntimeException cause) {
        Instant now = clock.instant();
        task.setStatus(TaskStatus.FAILED);
        task.setGroupsSent(outcome.sent);
        task.setGroupsFailed(task.getTotalGroups() - outcome.sent);
        task.setErrorMessage(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        task.setSentAt(now);
        task.setUpdatedAt(now);
        try {
            taskStore.save(task);
        } catch (RuntimeException e) { // NOSONAR
            log.error("[Task] Failed to persist failure of {}: {}", task.getId(), e.getMessage(), e);
        }
        releaseOneShotMedia(task);
        notifyComplete(task, settingsAction);
    }

    // recurring tasks keep their media for the next occurrence
    private void releaseOneShotMedia(ScheduledTask task) {
        if (!task.hasMedia() || task.isRecurring()) {
            return;
        }
        try {
            BridgeResult result = bridgePort.deleteMedia(task.getMediaReference());
            if (result == null || !result.isSuccess()) {
                log.warn("[Task] Failed to delete media {} of {}: {}", task.getMediaReference(), task.getId(),
                        result != null ? result.getError() : "no response");
            }
        } catch (RuntimeException e) { // NOSONAR - media cleanup never changes the task outcome
            log.warn("[Task] Failed to delete media {} of {}: {}", task.getMediaReference(), task.getId(),
                    e.getMessage());
        }
    }

    private void notifyProgress(ScheduledTask task, String settingsAction, MonitoredGroup group, Outcome outcome) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", task.getType().getNotificationPrefix() + "_progress");
        payload.put("task_id", task.getId());
        if (settingsAction != null) {
            payload.put("action", settingsAction);
        }
        payload.put("group_name", group.getName());
        payload.put("groups_sent", outcome.sent);
        payload.put("groups_failed", outcome.failed);
        payload.put("total_groups", task.getTotalGroups());
        notifyTenant(task.getTenantId(), payload);
    }

    private void notifyComplete(ScheduledTask task, String settingsAction) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", task.getType().getNotificationPrefix() + "_complete");
        payload.put("task_id", task.getId());
        if (settingsAction != null) {
            payload.put("action", settingsAction);
        }
        payload.put("status", task.getStatus().getValue());
        payload.put("groups_sent", task.getGroupsSent());
        payload.put("groups_failed", task.getGroupsFailed());
        payload.put("total_groups", task.getTotalGroups());
        payload.put("error_message", task.getErrorMessage());
        notifyTenant(task.getTenantId(), payload);
    }

    private void notifyTenant(String tenantId, Map<String, Object> payload) {
        try {
            notificationPort.sendToTenant(tenantId, payload);
        } catch (RuntimeException e) { // NOSONAR - notifications are best-effort
            log.debug("[Task] Notification {} dropped: {}", payload.get("type"), e.getMessage());
        }
    }

    private static List<String> copy(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    @FunctionalInterface
    private interface GroupAction {
        BridgeResult apply(MonitoredGroup group);
    }

    /**
     * Per-invocation counters. Every target group ends up in exactly one of
     * {@code sent} or {@code failed}.
     */
    private static final class Outcome {
        private int sent;
        private int failed;
        private final List<String> errors = new ArrayList<>();

        void succeed() {
            sent++;
        }

        void fail(String error) {
            failed++;
            errors.add(error);
        }

        int processed() {
            return sent + failed;
        }

        void failRemaining(List<String> groupIds, String reason) {
            for (int i = processed(); i < groupIds.size(); i++) {
                fail("Group " + groupIds.get(i) + ": " + reason);
            }
        }
    }
}
