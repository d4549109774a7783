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

import me.golemcore.groupdesk.domain.model.AgentProfile;
import me.golemcore.groupdesk.port.outbound.AgentStorePort;
import me.golemcore.groupdesk.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Agent profile store backed by {@code agents/<tenant>/<id>.json}.
 */
@Component
public class AgentStore extends JsonDocumentStore<AgentProfile> implements AgentStorePort {

    private static final String AGENTS_DIR = "agents";

    public AgentStore(StoragePort storagePort, ObjectMapper objectMapper) {
        super(storagePort, objectMapper, AgentProfile.class, AGENTS_DIR);
    }

    @Override
    public Optional<AgentProfile> findActiveByTenant(String tenantId) {
        return readAll(encode(tenantId)).stream()
                .filter(AgentProfile::isActive)
                .findFirst();
    }

    @Override
    public AgentProfile save(AgentProfile agent) {
        if (agent.getId() == null) {
            agent.setId("agent-" + UUID.randomUUID());
        }
        write(encode(agent.getTenantId()) + "/" + fileName(agent.getId()), agent);
        return agent;
    }
}
