package me.golemcore.groupdesk.domain.service;

import me.golemcore.groupdesk.adapter.outbound.storage.GroupStore;
import me.golemcore.groupdesk.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.groupdesk.adapter.outbound.storage.MemberEventStore;
import me.golemcore.groupdesk.adapter.outbound.storage.MessageStore;
import me.golemcore.groupdesk.adapter.outbound.storage.SessionStore;
import me.golemcore.groupdesk.domain.model.BridgeEvent;
import me.golemcore.groupdesk.domain.model.BridgeSession;
import me.golemcore.groupdesk.domain.model.GroupMessage;
import me.golemcore.groupdesk.domain.model.MemberEvent;
import me.golemcore.groupdesk.domain.model.MonitoredGroup;
import me.golemcore.groupdesk.infrastructure.config.AutoConfiguration;
import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import me.golemcore.groupdesk.port.outbound.NotificationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BridgeEventPipelineTest {

    private static final String TENANT = "tenant-1";
    private static final Instant NOW = Instant.parse("2026-03-10T08:00:00Z");

    @TempDir
    Path tempDir;

    private SessionStore sessionStore;
    private GroupStore groupStore;
    private MessageStore messageStore;
    private MemberEventStore memberEventStore;
    private NotificationPort notificationPort;
    private WelcomeMessageService welcomeMessageService;
    private AgentMentionService agentMentionService;
    private BridgeEventPipeline pipeline;

    @BeforeEach
    void setUp() {
        GroupDeskProperties properties = new GroupDeskProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        sessionStore = new SessionStore(storage, AutoConfiguration.objectMapper());
        groupStore = new GroupStore(storage, AutoConfiguration.objectMapper());
        messageStore = new MessageStore(storage, AutoConfiguration.objectMapper());
        memberEventStore = new MemberEventStore(storage, AutoConfiguration.objectMapper());
        notificationPort = mock(NotificationPort.class);
        welcomeMessageService = mock(WelcomeMessageService.class);
        agentMentionService = mock(AgentMentionService.class);
        pipeline = pipelineAt(NOW);

        groupStore.save(MonitoredGroup.builder().id("g-1").tenantId(TENANT).bridgeGroupId("bridge-1")
                .name("Team").welcomeEnabled(true).build());
        groupStore.save(MonitoredGroup.builder().id("g-off").tenantId(TENANT).bridgeGroupId("bridge-off")
                .name("Archived").active(false).build());
    }

    @Test
    void shouldTrackSessionLifecycle() {
        pipeline.handle(BridgeEvent.builder().type("qr").tenantId(TENANT).qr("qr-data").build());
        assertEquals(BridgeSession.AuthStatus.QR_READY, session().getAuthStatus());

        pipeline.handle(BridgeEvent.builder().type("authenticated").tenantId(TENANT).build());
        assertEquals(BridgeSession.AuthStatus.AUTHENTICATED, session().getAuthStatus());

        pipeline.handle(BridgeEvent.builder().type("ready").tenantId(TENANT).phoneNumber("4915112345").build());
        BridgeSession ready = session();
        assertEquals(BridgeSession.AuthStatus.READY, ready.getAuthStatus());
        assertTrue(ready.isAuthenticated());
        assertEquals("4915112345", ready.getPhoneNumber());
        assertEquals(NOW, ready.getLastConnectedAt());

        pipeline.handle(BridgeEvent.builder().type("disconnected").tenantId(TENANT).reason("LOGOUT").build());
        BridgeSession disconnected = session();
        assertEquals(BridgeSession.AuthStatus.DISCONNECTED, disconnected.getAuthStatus());
        assertFalse(disconnected.isAuthenticated());
        assertEquals("4915112345", disconnected.getPhoneNumber());

        List<Map<String, Object>> payloads = notifications();
        assertEquals(List.of("qr", "authenticated", "ready", "disconnected"),
                payloads.stream().map(p -> p.get("type")).toList());
        assertEquals("qr-data", payloads.get(0).get("qr"));
        assertEquals("LOGOUT", payloads.get(3).get("reason"));
    }

    @Test
    void shouldStoreMessageOnceAndNotifyOnce() {
        BridgeEvent event = messageEvent("msg-1", "bridge-1");

        pipeline.handle(event);
        pipeline.handle(event);

        List<GroupMessage> stored = messageStore.findByTenant(TENANT);
        assertEquals(1, stored.size());
        GroupMessage message = stored.get(0);
        assertEquals("g-1", message.getGroupId());
        assertEquals("Unknown", message.getSenderName());
        assertEquals("text", message.getMessageType());
        assertEquals(Instant.ofEpochSecond(1_773_129_600L), message.getTimestamp());

        verify(notificationPort, times(1)).sendToTenant(eq(TENANT), anyMap());
        verify(agentMentionService, times(1)).onMessage(any(MonitoredGroup.class), any(GroupMessage.class));
        assertEquals("new_message", notifications().get(0).get("type"));
    }

    @Test
    void shouldIgnoreMessagesForUnmonitoredGroups() {
        pipeline.handle(messageEvent("msg-1", "bridge-off"));
        pipeline.handle(messageEvent("msg-2", "bridge-unknown"));

        assertTrue(messageStore.findByTenant(TENANT).isEmpty());
        verifyNoInteractions(notificationPort, agentMentionService);
    }

    @Test
    void shouldRecordJoinAndTriggerWelcome() {
        pipeline.handle(memberEvent("member_join", "111"));

        List<MemberEvent> events = memberEventStore.findByTenant(TENANT);
        assertEquals(1, events.size());
        assertEquals(MemberEvent.Type.JOIN, events.get(0).getType());
        assertEquals("member_join", notifications().get(0).get("type"));
        verify(welcomeMessageService).onMemberJoined(any(MonitoredGroup.class), eq("111"));
    }

    @Test
    void shouldRecordLeaveWithoutWelcome() {
        pipeline.handle(memberEvent("member_leave", "111"));

        assertEquals(MemberEvent.Type.LEAVE, memberEventStore.findByTenant(TENANT).get(0).getType());
        verifyNoInteractions(welcomeMessageService);
    }

    @Test
    void shouldDeduplicateCertificatesPerDay() {
        pipeline.handle(memberEvent("certificate", "111"));
        pipeline.handle(memberEvent("certificate", "111"));
        pipeline.handle(memberEvent("certificate", "222"));

        assertEquals(2, memberEventStore.findByTenant(TENANT).size());
        verify(notificationPort, times(2)).sendToTenant(eq(TENANT), anyMap());

        pipelineAt(NOW.plusSeconds(86_400)).handle(memberEvent("certificate", "111"));

        assertEquals(3, memberEventStore.findByTenant(TENANT).size());
    }

    @Test
    void shouldIgnoreEventsWithoutTenantOrKnownType() {
        pipeline.handle(BridgeEvent.builder().type("ready").build());
        pipeline.handle(BridgeEvent.builder().type("typing").tenantId(TENANT).build());
        pipeline.handle(null);

        verifyNoInteractions(notificationPort);
        assertTrue(sessionStore.findByTenant(TENANT).isEmpty());
    }

    @Test
    void shouldSurviveDownstreamFailure() {
        doThrow(new IllegalStateException("boom")).when(notificationPort).sendToTenant(anyString(), anyMap());

        assertDoesNotThrow(() -> pipeline.handle(messageEvent("msg-1", "bridge-1")));
        assertEquals(1, messageStore.findByTenant(TENANT).size());
    }

    private BridgeEventPipeline pipelineAt(Instant instant) {
        return new BridgeEventPipeline(sessionStore, groupStore, messageStore, memberEventStore, notificationPort,
                welcomeMessageService, agentMentionService, Clock.fixed(instant, ZoneOffset.UTC));
    }

    private BridgeSession session() {
        return sessionStore.findByTenant(TENANT).orElseThrow();
    }

    private static BridgeEvent messageEvent(String id, String bridgeGroupId) {
        return BridgeEvent.builder()
                .type("message")
                .tenantId(TENANT)
                .message(BridgeEvent.MessagePayload.builder()
                        .id(id)
                        .groupId(bridgeGroupId)
                        .content("hi")
                        .timestamp(1_773_129_600d)
                        .build())
                .build();
    }

    private static BridgeEvent memberEvent(String type, String phone) {
        return BridgeEvent.builder()
                .type(type)
                .tenantId(TENANT)
                .event(BridgeEvent.MemberPayload.builder()
                        .groupId("bridge-1")
                        .memberId(phone + "@c.us")
                        .memberName("Member " + phone)
                        .memberPhone(phone)
                        .build())
                .build();
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> notifications() {
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(notificationPort, atLeastOnce()).sendToTenant(eq(TENANT), captor.capture());
        return captor.getAllValues();
    }
}
