package me.golemcore.groupdesk.adapter.outbound.storage;

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

import me.golemcore.groupdesk.domain.model.BridgeSession;
import me.golemcore.groupdesk.port.outbound.SessionStorePort;
import me.golemcore.groupdesk.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Session store backed by {@code sessions/<tenant>.json}.
 */
@Component
public class SessionStore extends JsonDocumentStore<BridgeSession> implements SessionStorePort {

    private static final String SESSIONS_DIR = "sessions";

    public SessionStore(StoragePort storagePort, ObjectMapper objectMapper) {
        super(storagePort, objectMapper, BridgeSession.class, SESSIONS_DIR);
    }

    @Override
    public Optional<BridgeSession> findByTenant(String tenantId) {
        return read(fileName(tenantId));
    }

    @Override
    public BridgeSession save(BridgeSession session) {
        return withLock(session.getTenantId(), () -> {
            write(fileName(session.getTenantId()), session);
            return session;
        });
    }

    @Override
    public BridgeSession update(String tenantId, UnaryOperator<BridgeSession> mutator) {
        return withLock(tenantId, () -> {
            BridgeSession current = read(fileName(tenantId))
                    .orElseGet(() -> BridgeSession.builder().tenantId(tenantId).build());
            BridgeSession updated = mutator.apply(current);
            write(fileName(tenantId), updated);
            return updated;
        });
    }
}
