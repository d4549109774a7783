package me.golemcore.groupdesk.domain.service;

import me.golemcore.groupdesk.domain.model.BridgeResult;
import me.golemcore.groupdesk.domain.model.BridgeStatus;
import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import me.golemcore.groupdesk.port.outbound.BridgePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SessionHealthServiceTest {

    private static final String TENANT = "tenant-1";

    private BridgePort bridgePort;
    private final List<Duration> sleeps = new ArrayList<>();
    private SessionHealthService service;

    @BeforeEach
    void setUp() {
        bridgePort = mock(BridgePort.class);
        service = new SessionHealthService(bridgePort, new GroupDeskProperties(), sleeps::add);
    }

    @Test
    void shouldReturnTrueWithoutRecoveryWhenReady() throws InterruptedException {
        when(bridgePort.getStatus(TENANT)).thenReturn(status("ready"));

        assertTrue(service.ensureReady(TENANT));

        verify(bridgePort, never()).initSession(anyString());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldRecoverAfterInitAndWait() throws InterruptedException {
        when(bridgePort.getStatus(TENANT)).thenReturn(status("disconnected"), status("ready"));
        when(bridgePort.initSession(TENANT)).thenReturn(BridgeResult.ok());

        assertTrue(service.ensureReady(TENANT));

        verify(bridgePort).initSession(TENANT);
        assertEquals(List.of(Duration.ofSeconds(15)), sleeps);
    }

    @Test
    void shouldReportNotReadyWhenRecoveryFails() throws InterruptedException {
        when(bridgePort.getStatus(TENANT)).thenReturn(status("qr"));
        when(bridgePort.initSession(TENANT)).thenReturn(BridgeResult.failed("boom"));

        assertFalse(service.ensureReady(TENANT));
        verify(bridgePort, times(2)).getStatus(TENANT);
    }

    @Test
    void shouldTreatStatusErrorAsNotReady() {
        when(bridgePort.getStatus(TENANT)).thenThrow(new IllegalStateException("connection refused"));

        assertFalse(service.isReady(TENANT));
    }

    private static BridgeStatus status(String value) {
        BridgeStatus status = new BridgeStatus();
        status.setStatus(value);
        return status;
    }
}
