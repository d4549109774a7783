package me.golemcore.groupdesk.infrastructure.http;

import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeoutsWithoutTransportRetry() {
        GroupDeskProperties properties = new GroupDeskProperties();
        properties.getHttp().setConnectTimeout(2000);
        properties.getHttp().setReadTimeout(7000);

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(2000, client.connectTimeoutMillis());
        assertEquals(7000, client.readTimeoutMillis());
        assertFalse(client.retryOnConnectionFailure());
    }

    @Test
    void shouldSizeIdlePoolForConcurrentCallers() {
        GroupDeskProperties properties = new GroupDeskProperties();
        properties.getDispatcher().setWorkerThreads(6);
        properties.getEvents().setListenerThreads(4);

        assertEquals(10, new OkHttpConfig(properties).idleConnections());
    }

    @Test
    void shouldKeepLargerConfiguredIdlePool() {
        GroupDeskProperties properties = new GroupDeskProperties();
        properties.getHttp().setMaxIdleConnections(20);

        assertEquals(20, new OkHttpConfig(properties).idleConnections());
    }
}
