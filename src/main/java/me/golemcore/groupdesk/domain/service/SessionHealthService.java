package me.golemcore.groupdesk.domain.service;

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

import me.golemcore.groupdesk.domain.model.BridgeResult;
import me.golemcore.groupdesk.domain.model.BridgeStatus;
import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import me.golemcore.groupdesk.port.outbound.BridgePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Checks that a tenant's bridge session can send, with one recovery attempt.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionHealthService {

    private final BridgePort bridgePort;
    private final GroupDeskProperties properties;
    private final Sleeper sleeper;

    /**
     * Returns {@code true} if the session is ready, reinitializing it once and
     * waiting for it to stabilize if it is not.
     */
    public boolean ensureReady(String tenantId) throws InterruptedException {
        if (isReady(tenantId)) {
            return true;
        }

        log.warn("[Task] Session for tenant {} not ready, reinitializing", tenantId);
        BridgeResult init = bridgePort.initSession(tenantId);
        if (init == null || !init.isSuccess()) {
            log.warn("[Task] Session init for tenant {} failed: {}", tenantId,
                    init != null ? init.getError() : "no response");
        }
        sleeper.sleep(properties.getDispatcher().getRecoveryWait());

        boolean ready = isReady(tenantId);
        if (ready) {
            log.info("[Task] Session for tenant {} recovered", tenantId);
        } else {
            log.warn("[Task] Session for tenant {} still not ready after recovery", tenantId);
        }
        return ready;
    }

    public boolean isReady(String tenantId) {
        try {
            BridgeStatus status = bridgePort.getStatus(tenantId);
            return status != null && status.isReady();
        } catch (RuntimeException e) {
            log.warn("[Task] Status check for tenant {} failed: {}", tenantId, e.getMessage());
            return false;
        }
    }
}
