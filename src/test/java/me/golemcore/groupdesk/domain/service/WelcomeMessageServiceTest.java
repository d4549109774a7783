package me.golemcore.groupdesk.domain.service;

import me.golemcore.groupdesk.adapter.outbound.storage.GroupStore;
import me.golemcore.groupdesk.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.groupdesk.domain.model.BridgeResult;
import me.golemcore.groupdesk.domain.model.MonitoredGroup;
import me.golemcore.groupdesk.domain.model.WelcomeSettings;
import me.golemcore.groupdesk.infrastructure.config.AutoConfiguration;
import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import me.golemcore.groupdesk.port.outbound.BridgePort;
import me.golemcore.groupdesk.port.outbound.NotificationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WelcomeMessageServiceTest {

    private static final String TENANT = "tenant-1";
    private static final String GROUP_ID = "g-1";

    @TempDir
    Path tempDir;

    private GroupStore groupStore;
    private BridgePort bridgePort;
    private NotificationPort notificationPort;
    private WelcomeMessageService service;

    @BeforeEach
    void setUp() {
        GroupDeskProperties properties = new GroupDeskProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        groupStore = new GroupStore(storage, AutoConfiguration.objectMapper());

        bridgePort = mock(BridgePort.class);
        notificationPort = mock(NotificationPort.class);
        when(bridgePort.sendWelcome(anyString(), anyString(), anyString(), anyList(), anyList()))
                .thenReturn(BridgeResult.ok());
        when(bridgePort.sendText(anyString(), anyString(), anyString(), anyBoolean(), anyList()))
                .thenReturn(BridgeResult.ok());
        when(bridgePort.sendMedia(anyString(), anyString(), anyString(), anyString(), anyBoolean(), anyList()))
                .thenReturn(BridgeResult.ok());

        service = new WelcomeMessageService(groupStore, bridgePort, notificationPort,
                Clock.fixed(Instant.parse("2026-03-10T08:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldWelcomeBatchWhenThresholdReached() {
        MonitoredGroup group = saveGroup(3);

        service.onMemberJoined(group, "111");
        service.onMemberJoined(group, "222");
        verify(bridgePort, never()).sendWelcome(anyString(), anyString(), anyString(), anyList(), anyList());
        assertEquals(2, stored().getWelcomeJoinCount());

        service.onMemberJoined(group, "333");

        verify(bridgePort).sendWelcome(TENANT, "bridge-1", "Hi all", List.of("111", "222", "333"), List.of());
        MonitoredGroup after = stored();
        assertEquals(0, after.getWelcomeJoinCount());
        assertTrue(after.getWelcomePendingJoiners().isEmpty());
    }

    @Test
    void shouldNotCountSameJoinerTwice() {
        MonitoredGroup group = saveGroup(3);

        service.onMemberJoined(group, "111");
        service.onMemberJoined(group, "111");

        MonitoredGroup after = stored();
        assertEquals(1, after.getWelcomeJoinCount());
        assertEquals(List.of("111"), after.getWelcomePendingJoiners());
    }

    @Test
    void shouldIgnoreJoinWithoutPhone() {
        MonitoredGroup group = saveGroup(1);

        service.onMemberJoined(group, "");

        verifyNoInteractions(bridgePort);
        assertEquals(0, stored().getWelcomeJoinCount());
    }

    @Test
    void shouldIgnoreJoinWhenWelcomeDisabledMeanwhile() {
        MonitoredGroup group = saveGroup(1);
        groupStore.update(GROUP_ID, g -> {
            g.setWelcomeEnabled(false);
            return g;
        });

        service.onMemberJoined(group, "111");

        verifyNoInteractions(bridgePort);
    }

    @Test
    void shouldFireExactlyOnceUnderConcurrentJoins() throws InterruptedException {
        MonitoredGroup group = saveGroup(5);
        ExecutorService pool = Executors.newFixedThreadPool(5);
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 0; i < 5; i++) {
            String phone = "10" + i;
            pool.execute(() -> {
                try {
                    start.await();
                    service.onMemberJoined(group, phone);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<String>> joiners = ArgumentCaptor.forClass(List.class);
        verify(bridgePort, times(1)).sendWelcome(anyString(), anyString(), anyString(), joiners.capture(),
                anyList());
        assertEquals(5, joiners.getValue().size());
        assertEquals(0, stored().getWelcomeJoinCount());
    }

    @Test
    void shouldExcludeExtraMentionsFromJoinersAndSendSecondPart() {
        MonitoredGroup group = saveGroup(1);
        group.setWelcomeExtraMentions(new ArrayList<>(List.of("999")));
        group.setWelcomeText(null);
        group.setWelcomePart2Enabled(true);
        group.setWelcomePart2Text("Read the rules");
        group.setWelcomePart2Image("/media/rules.png");

        service.sendWelcome(group, List.of("999", "111", "111"));

        verify(bridgePort).sendWelcome(TENANT, "bridge-1", "Welcome!", List.of("111"), List.of("999"));
        verify(bridgePort).sendMedia(TENANT, "bridge-1", "/media/rules.png", "Read the rules", false, List.of());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(notificationPort).sendToTenant(eq(TENANT), payload.capture());
        assertEquals("welcome_sent", payload.getValue().get("type"));
        assertEquals(3, payload.getValue().get("joiners_count"));
    }

    @Test
    void shouldSendTextSecondPartWithoutImage() {
        MonitoredGroup group = saveGroup(1);
        group.setWelcomePart2Enabled(true);
        group.setWelcomePart2Text("Read the rules");

        service.sendWelcome(group, List.of("111"));

        verify(bridgePort).sendText(TENANT, "bridge-1", "Read the rules", false, List.of());
        verify(bridgePort, never()).sendMedia(anyString(), anyString(), anyString(), anyString(), anyBoolean(),
                anyList());
    }

    @Test
    void shouldSwallowBridgeErrors() {
        MonitoredGroup group = saveGroup(1);
        when(bridgePort.sendWelcome(anyString(), anyString(), anyString(), anyList(), anyList()))
                .thenThrow(new IllegalStateException("bridge down"));

        assertDoesNotThrow(() -> service.onMemberJoined(group, "111"));
        assertEquals(0, stored().getWelcomeJoinCount());
    }

    @Test
    void shouldResetCounterWhenSettingsChange() {
        MonitoredGroup group = saveGroup(3);
        service.onMemberJoined(group, "111");

        MonitoredGroup updated = service.updateSettings(TENANT, GROUP_ID, WelcomeSettings.builder()
                .enabled(true).threshold(2).text("Hey").build());

        assertEquals(2, updated.getWelcomeThreshold());
        assertEquals(0, stored().getWelcomeJoinCount());
        assertTrue(stored().getWelcomePendingJoiners().isEmpty());
    }

    @Test
    void shouldRejectInvalidThresholdAndUnknownGroup() {
        saveGroup(3);
        WelcomeSettings zero = WelcomeSettings.builder().enabled(true).threshold(0).build();
        WelcomeSettings valid = WelcomeSettings.builder().enabled(true).threshold(1).build();

        assertThrows(IllegalArgumentException.class, () -> service.updateSettings(TENANT, GROUP_ID, zero));
        assertThrows(IllegalArgumentException.class, () -> service.updateSettings("tenant-2", GROUP_ID, valid));
        assertThrows(IllegalArgumentException.class, () -> service.resetCounter(TENANT, "g-missing"));
    }

    private MonitoredGroup saveGroup(int threshold) {
        return groupStore.save(MonitoredGroup.builder()
                .id(GROUP_ID)
                .tenantId(TENANT)
                .bridgeGroupId("bridge-1")
                .name("Group One")
                .welcomeEnabled(true)
                .welcomeThreshold(threshold)
                .welcomeText("Hi all")
                .build());
    }

    private MonitoredGroup stored() {
        return groupStore.findById(GROUP_ID).orElseThrow();
    }
}
