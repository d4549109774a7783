package me.golemcore.groupdesk.port.outbound;

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

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence for per-tenant {@link BridgeSession}s.
 */
public interface SessionStorePort {

    Optional<BridgeSession> findByTenant(String tenantId);

    BridgeSession save(BridgeSession session);

    /**
     * Update the tenant's session, creating a fresh one first if none exists.
     */
    BridgeSession update(String tenantId, UnaryOperator<BridgeSession> mutator);
}
