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

import me.golemcore.groupdesk.domain.model.BridgeEvent;
import me.golemcore.groupdesk.domain.model.BridgeEventType;
import me.golemcore.groupdesk.domain.model.BridgeSession;
import me.golemcore.groupdesk.domain.model.GroupMessage;
import me.golemcore.groupdesk.domain.model.MemberEvent;
import me.golemcore.groupdesk.domain.model.MonitoredGroup;
import me.golemcore.groupdesk.port.inbound.BridgeEventPort;
import me.golemcore.groupdesk.port.outbound.GroupStorePort;
import me.golemcore.groupdesk.port.outbound.MemberEventStorePort;
import me.golemcore.groupdesk.port.outbound.MessageStorePort;
import me.golemcore.groupdesk.port.outbound.NotificationPort;
import me.golemcore.groupdesk.port.outbound.SessionStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Applies bridge events to tenant state.
 *
 * <p>
 * Dispatch by event type:
 * <ul>
 * <li>{@code qr}, {@code authenticated}, {@code ready}, {@code disconnected} -
 * update the tenant's session and forward to the tenant</li>
 * <li>{@code message} - store the message once per upstream id, forward it,
 * then run the mention workflow</li>
 * <li>{@code member_join}, {@code member_leave} - record and forward; a join
 * also feeds the welcome workflow</li>
 * <li>{@code certificate} - record at most once per member, group and day</li>
 * </ul>
 * Delivery is at-least-once and unordered. Messages and member events for
 * groups the tenant does not actively monitor are dropped. A failure while
 * processing one event is logged and the event is dropped.
 */
@Service
@Slf4j
public class BridgeEventPipeline implements BridgeEventPort {

    private static final String UNKNOWN_NAME = "Unknown";
    private static final String DEFAULT_MESSAGE_TYPE = "text";

    private final SessionStorePort sessionStore;
    private final GroupStorePort groupStore;
    private final MessageStorePort messageStore;
    private final MemberEventStorePort memberEventStore;
    private final NotificationPort notificationPort;
    private final WelcomeMessageService welcomeMessageService;
    private final AgentMentionService agentMentionService;
    private final Clock clock;

    public BridgeEventPipeline(SessionStorePort sessionStore, GroupStorePort groupStore,
            MessageStorePort messageStore, MemberEventStorePort memberEventStore,
            NotificationPort notificationPort, WelcomeMessageService welcomeMessageService,
            AgentMentionService agentMentionService, Clock clock) {
        this.sessionStore = sessionStore;
        this.groupStore = groupStore;
        this.messageStore = messageStore;
        this.memberEventStore = memberEventStore;
        this.notificationPort = notificationPort;
        this.welcomeMessageService = welcomeMessageService;
        this.agentMentionService = agentMentionService;
        this.clock = clock;
    }

    @Override
    public void handle(BridgeEvent event) {
        if (event == null || event.getTenantId() == null || event.getTenantId().isBlank()) {
            log.debug("[Events] Ignoring event without tenant");
            return;
        }
        Optional<BridgeEventType> type = BridgeEventType.fromWire(event.getType());
        if (type.isEmpty()) {
            log.debug("[Events] Ignoring unknown event type {}", event.getType());
            return;
        }

        try {
            switch (type.get()) {
            case QR -> onQr(event);
            case AUTHENTICATED -> onAuthenticated(event);
            case READY -> onReady(event);
            case DISCONNECTED -> onDisconnected(event);
            case MESSAGE -> onMessage(event);
            case MEMBER_JOIN -> onMemberEvent(event, MemberEvent.Type.JOIN);
            case MEMBER_LEAVE -> onMemberEvent(event, MemberEvent.Type.LEAVE);
            case CERTIFICATE -> onCertificate(event);
            default -> log.debug("[Events] Unhandled event type {}", type.get());
            }
        } catch (RuntimeException e) { // NOSONAR - one bad event must not stop ingestion
            log.error("[Events] Dropped {} event for tenant {}: {}", event.getType(), event.getTenantId(),
                    e.getMessage(), e);
        }
    }

    private void onQr(BridgeEvent event) {
        updateSession(event.getTenantId(), BridgeSession.AuthStatus.QR_READY, null);
        Map<String, Object> payload = payload("qr");
        payload.put("qr", event.getQr());
        notificationPort.sendToTenant(event.getTenantId(), payload);
    }

    private void onAuthenticated(BridgeEvent event) {
        updateSession(event.getTenantId(), BridgeSession.AuthStatus.AUTHENTICATED, null);
        notificationPort.sendToTenant(event.getTenantId(), payload("authenticated"));
    }

    private void onReady(BridgeEvent event) {
        Instant now = clock.instant();
        sessionStore.update(event.getTenantId(), session -> {
            session.setAuthStatus(BridgeSession.AuthStatus.READY);
            session.setAuthenticated(true);
            session.setPhoneNumber(event.getPhoneNumber());
            session.setLastConnectedAt(now);
            session.setUpdatedAt(now);
            return session;
        });
        log.info("[Events] Session ready for tenant {}", event.getTenantId());
        Map<String, Object> payload = payload("ready");
        payload.put("phoneNumber", event.getPhoneNumber());
        notificationPort.sendToTenant(event.getTenantId(), payload);
    }

    private void onDisconnected(BridgeEvent event) {
        updateSession(event.getTenantId(), BridgeSession.AuthStatus.DISCONNECTED, false);
        log.info("[Events] Session disconnected for tenant {}: {}", event.getTenantId(), event.getReason());
        Map<String, Object> payload = payload("disconnected");
        payload.put("reason", event.getReason());
        notificationPort.sendToTenant(event.getTenantId(), payload);
    }

    private void onMessage(BridgeEvent event) {
        BridgeEvent.MessagePayload data = event.getMessage();
        if (data == null || data.getId() == null) {
            log.debug("[Events] Message event without message id for tenant {}", event.getTenantId());
            return;
        }
        Optional<MonitoredGroup> group = groupStore.findActiveByBridgeId(event.getTenantId(), data.getGroupId());
        if (group.isEmpty()) {
            return;
        }

        GroupMessage message = GroupMessage.builder()
                .id(data.getId())
                .tenantId(event.getTenantId())
                .groupId(group.get().getId())
                .groupName(data.getGroupName() != null ? data.getGroupName() : group.get().getName())
                .senderId(data.getSenderId())
                .senderName(data.getSenderName() != null ? data.getSenderName() : UNKNOWN_NAME)
                .senderPhone(data.getSenderPhone() != null ? data.getSenderPhone() : "")
                .content(data.getContent() != null ? data.getContent() : "")
                .messageType(data.getMessageType() != null ? data.getMessageType() : DEFAULT_MESSAGE_TYPE)
                .mentionedPhones(data.getMentionedPhones() != null
                        ? new ArrayList<>(data.getMentionedPhones())
                        : new ArrayList<>())
                .timestamp(toInstant(data.getTimestamp()))
                .receivedAt(clock.instant())
                .build();

        if (!messageStore.insertIfAbsent(message)) {
            log.debug("[Events] Duplicate message {} ignored", message.getId());
            return;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", message.getId());
        body.put("group_name", message.getGroupName());
        body.put("sender_name", message.getSenderName());
        body.put("sender_phone", message.getSenderPhone());
        body.put("content", message.getContent());
        body.put("timestamp", message.getTimestamp().toString());
        Map<String, Object> payload = payload("new_message");
        payload.put("message", body);
        notificationPort.sendToTenant(event.getTenantId(), payload);

        agentMentionService.onMessage(group.get(), message);
    }

    private void onMemberEvent(BridgeEvent event, MemberEvent.Type type) {
        BridgeEvent.MemberPayload data = event.getEvent();
        if (data == null) {
            return;
        }
        Optional<MonitoredGroup> group = groupStore.findActiveByBridgeId(event.getTenantId(), data.getGroupId());
        if (group.isEmpty()) {
            return;
        }

        MemberEvent record = memberEventStore.save(toMemberEvent(event.getTenantId(), group.get(), data, type,
                data.getMemberPhone()));
        notifyMemberEvent(record, "member_" + type.getValue().toLowerCase(Locale.ROOT));

        if (type == MemberEvent.Type.JOIN && group.get().isWelcomeEnabled()) {
            welcomeMessageService.onMemberJoined(group.get(), data.getMemberPhone());
        }
    }

    private void onCertificate(BridgeEvent event) {
        BridgeEvent.MemberPayload data = event.getEvent();
        if (data == null) {
            return;
        }
        Optional<MonitoredGroup> group = groupStore.findActiveByBridgeId(event.getTenantId(), data.getGroupId());
        if (group.isEmpty()) {
            return;
        }

        String memberPhone = data.getMemberPhone() != null ? data.getMemberPhone() : "";
        MemberEvent record = toMemberEvent(event.getTenantId(), group.get(), data, MemberEvent.Type.CERTIFICATE,
                memberPhone);
        if (!memberEventStore.insertCertificateIfAbsent(record)) {
            log.debug("[Events] Certificate for {} in {} already recorded today", memberPhone,
                    group.get().getName());
            return;
        }
        log.info("[Events] Certificate recorded for {} in {}", record.getMemberName(), group.get().getName());
        notifyMemberEvent(record, "certificate");
    }

    private MemberEvent toMemberEvent(String tenantId, MonitoredGroup group, BridgeEvent.MemberPayload data,
            MemberEvent.Type type, String memberPhone) {
        return MemberEvent.builder()
                .tenantId(tenantId)
                .groupId(group.getId())
                .groupName(data.getGroupName() != null ? data.getGroupName() : group.getName())
                .memberId(data.getMemberId() != null ? data.getMemberId() : "")
                .memberName(data.getMemberName() != null ? data.getMemberName() : UNKNOWN_NAME)
                .memberPhone(memberPhone)
                .type(type)
                .eventDate(LocalDate.now(clock))
                .timestamp(toInstant(data.getTimestamp()))
                .build();
    }

    private void notifyMemberEvent(MemberEvent record, String type) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", record.getId());
        body.put("group_id", record.getGroupId());
        body.put("group_name", record.getGroupName());
        body.put("member_name", record.getMemberName());
        body.put("member_phone", record.getMemberPhone());
        body.put("event_type", record.getType().getValue());
        body.put("event_date", record.getEventDate().toString());
        body.put("timestamp", record.getTimestamp().toString());
        Map<String, Object> payload = payload(type);
        payload.put("event", body);
        notificationPort.sendToTenant(record.getTenantId(), payload);
    }

    private void updateSession(String tenantId, BridgeSession.AuthStatus status, Boolean authenticated) {
        Instant now = clock.instant();
        sessionStore.update(tenantId, session -> {
            session.setAuthStatus(status);
            if (authenticated != null) {
                session.setAuthenticated(authenticated);
            }
            session.setUpdatedAt(now);
            return session;
        });
    }

    private Instant toInstant(Double epochSeconds) {
        if (epochSeconds == null) {
            return clock.instant();
        }
        return Instant.ofEpochMilli(Math.round(epochSeconds * 1000));
    }

    private static Map<String, Object> payload(String type) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        return payload;
    }
}
