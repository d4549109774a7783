package me.golemcore.groupdesk.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for GroupDesk, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code groupdesk.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - JSON workspace location</li>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * <li>{@link BridgeProperties} - remote bridge service endpoint</li>
 * <li>{@link DispatcherProperties} - task dispatcher timing</li>
 * <li>{@link EventsProperties} - event ingestion channel</li>
 * <li>{@link AgentProperties} - mention autoresponder defaults</li>
 * </ul>
 *
 * <p>
 * Dispatcher timing values encode the bridge's rate limit. They are
 * deployment-wide, not per-tenant.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "groupdesk")
@Data
public class GroupDeskProperties {

    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private BridgeProperties bridge = new BridgeProperties();
    private DispatcherProperties dispatcher = new DispatcherProperties();
    private EventsProperties events = new EventsProperties();
    private AgentProperties agent = new AgentProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.groupdesk/workspace";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class BridgeProperties {
        private String baseUrl = "http://localhost:3001";
        private long connectTimeoutMs = 10000;
        private long readTimeoutMs = 120000;
    }

    @Data
    public static class DispatcherProperties {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(60);
        private Duration pacingInterval = Duration.ofSeconds(30);
        private List<Duration> retryDelays = new ArrayList<>(List.of(
                Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(20)));
        private int maxAttempts = 3;
        private Duration recoveryWait = Duration.ofSeconds(15);
        // Fixed for every tenant; not derived from a tenant's real timezone
        private int tenantUtcOffsetHours = 2;
        private int workerThreads = 4;
        private boolean reconcileOnStart = true;
        private Duration staleSendingThreshold = Duration.ofHours(1);
    }

    @Data
    public static class EventsProperties {
        private boolean enabled = true;
        private String channel = "whatsapp:events";
        private int listenerThreads = 4;
    }

    @Data
    public static class AgentProperties {
        private String defaultPrompt = "Hello";
        private long timeoutMs = 60000;
        private int defaultOutputTokens = 1024;
        private double temperature = 0.7;
    }
}
