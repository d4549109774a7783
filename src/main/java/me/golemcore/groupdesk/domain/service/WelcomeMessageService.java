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
import me.golemcore.groupdesk.domain.model.WelcomeSettings;
import me.golemcore.groupdesk.port.outbound.BridgePort;
import me.golemcore.groupdesk.port.outbound.GroupStorePort;
import me.golemcore.groupdesk.port.outbound.NotificationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Welcome-threshold automation.
 *
 * <p>
 * Each qualifying join is added to the group's pending joiners. When the
 * pending count reaches the threshold, the list is captured and the counter
 * reset in the same locked update, before anything is sent. A slow or failing
 * send therefore cannot trigger a second welcome for the same joiners.
 *
 * <p>
 * Failures are logged only; they never reach the event pipeline.
 */
@Service
@Slf4j
public class WelcomeMessageService {

    static final String DEFAULT_WELCOME_TEXT = "Welcome!";

    private final GroupStorePort groupStore;
    private final BridgePort bridgePort;
    private final NotificationPort notificationPort;
    private final Clock clock;

    public WelcomeMessageService(GroupStorePort groupStore, BridgePort bridgePort,
            NotificationPort notificationPort, Clock clock) {
        this.groupStore = groupStore;
        this.bridgePort = bridgePort;
        this.notificationPort = notificationPort;
        this.clock = clock;
    }

    /**
     * Count a join towards the group's welcome threshold and send the welcome
     * once it is reached.
     */
    public void onMemberJoined(MonitoredGroup group, String memberPhone) {
        if (memberPhone == null || memberPhone.isBlank()) {
            log.debug("[Welcome] Join in {} without phone, not counted", group.getName());
            return;
        }

        AtomicReference<List<String>> captured = new AtomicReference<>();
        Optional<MonitoredGroup> updated = groupStore.update(group.getId(), current -> {
            if (!current.isWelcomeEnabled()) {
                return current;
            }
            List<String> pending = current.getWelcomePendingJoiners() != null
                    ? new ArrayList<>(current.getWelcomePendingJoiners())
                    : new ArrayList<>();
            if (!pending.contains(memberPhone)) {
                pending.add(memberPhone);
            }
            int threshold = Math.max(1, current.getWelcomeThreshold());
            log.debug("[Welcome] {} pending joiners {}/{}", current.getName(), pending.size(), threshold);

            if (pending.size() >= threshold) {
                captured.set(List.copyOf(pending));
                current.setWelcomeJoinCount(0);
                current.setWelcomePendingJoiners(new ArrayList<>());
            } else {
                current.setWelcomeJoinCount(pending.size());
                current.setWelcomePendingJoiners(pending);
            }
            current.setUpdatedAt(clock.instant());
            return current;
        });

        if (updated.isPresent() && captured.get() != null) {
            sendWelcome(updated.get(), captured.get());
        }
    }

    /**
     * Replace the group's welcome settings. The counter and pending joiners
     * are reset.
     */
    public MonitoredGroup updateSettings(String tenantId, String groupId, WelcomeSettings settings) {
        if (settings.getThreshold() < 1) {
            throw new IllegalArgumentException("Welcome threshold must be at least 1");
        }
        requireTenantGroup(tenantId, groupId);
        return groupStore.update(groupId, group -> {
            group.setWelcomeEnabled(settings.isEnabled());
            group.setWelcomeThreshold(settings.getThreshold());
            group.setWelcomeText(settings.getText());
            group.setWelcomeExtraMentions(settings.getExtraMentions() != null
                    ? new ArrayList<>(settings.getExtraMentions())
                    : new ArrayList<>());
            group.setWelcomePart2Enabled(settings.isPart2Enabled());
            group.setWelcomePart2Text(settings.getPart2Text());
            group.setWelcomePart2Image(settings.getPart2Image());
            resetCounter(group);
            return group;
        }).orElseThrow(() -> new IllegalArgumentException("Group not found: " + groupId));
    }

    /**
     * Drop all pending joiners without sending anything.
     */
    public MonitoredGroup resetCounter(String tenantId, String groupId) {
        requireTenantGroup(tenantId, groupId);
        return groupStore.update(groupId, group -> {
            resetCounter(group);
            return group;
        }).orElseThrow(() -> new IllegalArgumentException("Group not found: " + groupId));
    }

    void sendWelcome(MonitoredGroup group, List<String> joinerPhones) {
        try {
            List<String> extraMentions = group.getWelcomeExtraMentions() != null
                    ? group.getWelcomeExtraMentions()
                    : List.of();
            List<String> joiners = joinerPhones.stream()
                    .filter(Objects::nonNull)
                    .filter(phone -> !phone.isBlank())
                    .distinct()
                    .filter(phone -> !extraMentions.contains(phone))
                    .toList();
            String text = group.getWelcomeText() != null && !group.getWelcomeText().isBlank()
                    ? group.getWelcomeText()
                    : DEFAULT_WELCOME_TEXT;

            BridgeResult part1 = bridgePort.sendWelcome(group.getTenantId(), group.getBridgeGroupId(), text,
                    joiners, extraMentions);
            if (part1 != null && part1.isSuccess()) {
                log.info("[Welcome] Sent welcome to {} for {} joiners", group.getName(), joiners.size());
            } else {
                log.warn("[Welcome] Welcome to {} failed: {}", group.getName(),
                        part1 != null ? part1.getError() : "no response");
            }

            sendSecondPart(group);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("type", "welcome_sent");
            payload.put("group_id", group.getId());
            payload.put("group_name", group.getName());
            payload.put("joiners_count", joinerPhones.size());
            notificationPort.sendToTenant(group.getTenantId(), payload);
        } catch (RuntimeException e) { // NOSONAR - welcome failures stay internal
            log.error("[Welcome] Failed to send welcome to {}: {}", group.getName(), e.getMessage(), e);
        }
    }

    private void sendSecondPart(MonitoredGroup group) {
        if (!group.isWelcomePart2Enabled()) {
            return;
        }
        String text = group.getWelcomePart2Text();
        String image = group.getWelcomePart2Image();
        BridgeResult result;
        if (image != null && !image.isBlank()) {
            result = bridgePort.sendMedia(group.getTenantId(), group.getBridgeGroupId(), image,
                    text != null ? text : "", false, List.of());
        } else if (text != null && !text.isBlank()) {
            result = bridgePort.sendText(group.getTenantId(), group.getBridgeGroupId(), text, false, List.of());
        } else {
            return;
        }
        if (result == null || !result.isSuccess()) {
            log.warn("[Welcome] Second part to {} failed: {}", group.getName(),
                    result != null ? result.getError() : "no response");
        }
    }

    private void requireTenantGroup(String tenantId, String groupId) {
        if (groupStore.findByTenantAndId(tenantId, groupId).isEmpty()) {
            throw new IllegalArgumentException("Group not found: " + groupId);
        }
    }

    private void resetCounter(MonitoredGroup group) {
        group.setWelcomeJoinCount(0);
        group.setWelcomePendingJoiners(new ArrayList<>());
        group.setUpdatedAt(clock.instant());
    }
}
