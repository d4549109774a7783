package me.golemcore.groupdesk.adapter.outbound.notification;

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

import me.golemcore.groupdesk.port.outbound.NotificationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process notification fan-out with one Reactor sink per tenant.
 *
 * <p>
 * The transport layer (WebSocket, SSE) subscribes with
 * {@link #subscribe(String)} and relays payloads to the tenant's connected
 * clients. Emission is best-effort: with no subscriber, or a subscriber that
 * is not keeping up, the payload is dropped and the caller is never blocked.
 */
@Component
@Slf4j
public class TenantNotificationHub implements NotificationPort {

    private final Map<String, Sinks.Many<Map<String, Object>>> sinks = new ConcurrentHashMap<>();

    @Override
    public void sendToTenant(String tenantId, Map<String, Object> payload) {
        if (tenantId == null || payload == null) {
            return;
        }
        Map<String, Object> snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        Sinks.EmitResult result = sinkFor(tenantId).tryEmitNext(snapshot);
        if (result.isFailure()) {
            log.trace("[Notify] Dropped {} for tenant {}: {}", payload.get("type"), tenantId, result);
        }
    }

    /**
     * Live stream of payloads for one tenant. Only payloads emitted after
     * subscription are delivered.
     */
    public Flux<Map<String, Object>> subscribe(String tenantId) {
        return sinkFor(tenantId).asFlux();
    }

    private Sinks.Many<Map<String, Object>> sinkFor(String tenantId) {
        return sinks.computeIfAbsent(tenantId, id -> Sinks.many().multicast().directBestEffort());
    }
}
