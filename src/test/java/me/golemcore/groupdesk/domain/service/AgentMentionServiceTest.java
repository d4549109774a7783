package me.golemcore.groupdesk.domain.service;

import me.golemcore.groupdesk.domain.model.AgentProfile;
import me.golemcore.groupdesk.domain.model.BridgeResult;
import me.golemcore.groupdesk.domain.model.BridgeSession;
import me.golemcore.groupdesk.domain.model.GroupMessage;
import me.golemcore.groupdesk.domain.model.MonitoredGroup;
import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import me.golemcore.groupdesk.port.outbound.AgentGenerationPort;
import me.golemcore.groupdesk.port.outbound.AgentStorePort;
import me.golemcore.groupdesk.port.outbound.BridgePort;
import me.golemcore.groupdesk.port.outbound.NotificationPort;
import me.golemcore.groupdesk.port.outbound.SessionStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AgentMentionServiceTest {

    private static final String TENANT = "tenant-1";
    private static final String OWN_PHONE = "4915112345";

    private SessionStorePort sessionStore;
    private AgentStorePort agentStore;
    private AgentGenerationPort generationPort;
    private BridgePort bridgePort;
    private NotificationPort notificationPort;
    private AgentMentionService service;
    private MonitoredGroup group;
    private AgentProfile agent;

    @BeforeEach
    void setUp() {
        sessionStore = mock(SessionStorePort.class);
        agentStore = mock(AgentStorePort.class);
        generationPort = mock(AgentGenerationPort.class);
        bridgePort = mock(BridgePort.class);
        notificationPort = mock(NotificationPort.class);
        service = new AgentMentionService(sessionStore, agentStore, generationPort, bridgePort, notificationPort,
                new GroupDeskProperties());

        group = MonitoredGroup.builder().id("g-1").tenantId(TENANT).bridgeGroupId("bridge-1").name("Team").build();
        agent = AgentProfile.builder().id("agent-1").tenantId(TENANT).name("Helper").active(true)
                .enabledGroupIds(new ArrayList<>(List.of("g-1"))).build();

        when(sessionStore.findByTenant(TENANT))
                .thenReturn(Optional.of(BridgeSession.builder().tenantId(TENANT).phoneNumber(OWN_PHONE).build()));
        when(agentStore.findActiveByTenant(TENANT)).thenReturn(Optional.of(agent));
        when(bridgePort.sendText(anyString(), anyString(), anyString(), anyBoolean(), anyList()))
                .thenReturn(BridgeResult.ok());
    }

    @Test
    void shouldReplyWhenMentioned() {
        when(generationPort.generate(agent, "what time is the meeting?", "Alice", "Team"))
                .thenReturn(Optional.of("At 10:00"));

        service.onMessage(group, message("@Bot (" + OWN_PHONE + ") what time is the meeting?",
                List.of(OWN_PHONE)));

        verify(bridgePort).sendText(TENANT, "bridge-1", "At 10:00", false, List.of());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(notificationPort).sendToTenant(eq(TENANT), payload.capture());
        assertEquals("agent_response", payload.getValue().get("type"));
        assertEquals("Helper", payload.getValue().get("agent_name"));
        assertEquals("At 10:00", payload.getValue().get("response"));
    }

    @Test
    void shouldUseDefaultPromptForBareMention() {
        when(generationPort.generate(any(), anyString(), any(), any())).thenReturn(Optional.of("Hi!"));

        service.onMessage(group, message("@" + OWN_PHONE, List.of()));

        verify(generationPort).generate(agent, "Hello", "Alice", "Team");
    }

    @Test
    void shouldIgnoreMessageWithoutMention() {
        service.onMessage(group, message("just chatting", List.of("111")));

        verifyNoInteractions(generationPort, notificationPort);
    }

    @Test
    void shouldIgnoreWhenAgentNotEnabledForGroup() {
        agent.setEnabledGroupIds(new ArrayList<>(List.of("g-other")));

        service.onMessage(group, message("hey", List.of(OWN_PHONE)));

        verifyNoInteractions(generationPort);
    }

    @Test
    void shouldIgnoreWhenNoActiveAgentOrNoSessionPhone() {
        when(agentStore.findActiveByTenant(TENANT)).thenReturn(Optional.empty());
        service.onMessage(group, message("hey", List.of(OWN_PHONE)));

        when(sessionStore.findByTenant(TENANT)).thenReturn(Optional.empty());
        service.onMessage(group, message("hey", List.of(OWN_PHONE)));

        verifyNoInteractions(generationPort);
    }

    @Test
    void shouldNotSendEmptyGeneration() {
        when(generationPort.generate(any(), anyString(), any(), any())).thenReturn(Optional.empty());

        service.onMessage(group, message("hey", List.of(OWN_PHONE)));

        verify(bridgePort, never()).sendText(anyString(), anyString(), anyString(), anyBoolean(), anyList());
        verifyNoInteractions(notificationPort);
    }

    @Test
    void shouldTruncateLongResponseInNotification() {
        String longReply = "x".repeat(250);
        when(generationPort.generate(any(), anyString(), any(), any())).thenReturn(Optional.of(longReply));

        service.onMessage(group, message("hey", List.of(OWN_PHONE)));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(notificationPort).sendToTenant(eq(TENANT), payload.capture());
        assertEquals("x".repeat(200) + "...", payload.getValue().get("response"));
        verify(bridgePort).sendText(TENANT, "bridge-1", longReply, false, List.of());
    }

    @Test
    void shouldSwallowGenerationErrors() {
        when(generationPort.generate(any(), anyString(), any(), any())).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> service.onMessage(group, message("hey", List.of(OWN_PHONE))));
    }

    @Test
    void shouldCleanMentionVariantsFromPrompt() {
        assertEquals("hello there", AgentMentionService.cleanPrompt("@Bot (123) hello there", "123", "Hello"));
        assertEquals("ping", AgentMentionService.cleanPrompt("@123 ping", "123", "Hello"));
        assertEquals("Hello", AgentMentionService.cleanPrompt("123", "123", "Hello"));
        assertEquals("Hello", AgentMentionService.cleanPrompt(null, "123", "Hello"));
    }

    private static GroupMessage message(String content, List<String> mentioned) {
        return GroupMessage.builder()
                .id("msg-1")
                .tenantId(TENANT)
                .groupId("g-1")
                .senderName("Alice")
                .content(content)
                .mentionedPhones(new ArrayList<>(mentioned))
                .build();
    }
}
