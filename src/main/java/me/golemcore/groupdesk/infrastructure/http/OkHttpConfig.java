package me.golemcore.groupdesk.infrastructure.http;

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

import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for the shared OkHttp client used by the bridge and
 * agent adapters.
 *
 * <p>
 * Timeouts come from {@code groupdesk.http.*}. Dispatcher workers and event
 * listener threads call the bridge concurrently, so the idle pool is never
 * smaller than their combined thread count. The bridge adapter narrows
 * timeouts per call through Feign request options; the agent adapter derives
 * a client with the agent timeout.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final GroupDeskProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        GroupDeskProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        idleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                // bridge sends are not idempotent; retries belong to BridgeRetryPolicy
                .retryOnConnectionFailure(false)
                .build();
    }

    int idleConnections() {
        int concurrentCallers = properties.getDispatcher().getWorkerThreads()
                + properties.getEvents().getListenerThreads();
        return Math.max(properties.getHttp().getMaxIdleConnections(), concurrentCallers);
    }
}
