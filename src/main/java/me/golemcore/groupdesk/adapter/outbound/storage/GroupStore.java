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

import me.golemcore.groupdesk.domain.model.MonitoredGroup;
import me.golemcore.groupdesk.port.outbound.GroupStorePort;
import me.golemcore.groupdesk.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Group store backed by {@code groups/<id>.json}.
 */
@Component
public class GroupStore extends JsonDocumentStore<MonitoredGroup> implements GroupStorePort {

    private static final String GROUPS_DIR = "groups";

    public GroupStore(StoragePort storagePort, ObjectMapper objectMapper) {
        super(storagePort, objectMapper, MonitoredGroup.class, GROUPS_DIR);
    }

    @Override
    public Optional<MonitoredGroup> findById(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return read(fileName(id));
    }

    @Override
    public Optional<MonitoredGroup> findByTenantAndId(String tenantId, String id) {
        return findById(id).filter(group -> Objects.equals(group.getTenantId(), tenantId));
    }

    @Override
    public Optional<MonitoredGroup> findActiveByBridgeId(String tenantId, String bridgeGroupId) {
        return readAll("").stream()
                .filter(MonitoredGroup::isActive)
                .filter(group -> Objects.equals(group.getTenantId(), tenantId))
                .filter(group -> Objects.equals(group.getBridgeGroupId(), bridgeGroupId))
                .findFirst();
    }

    @Override
    public MonitoredGroup save(MonitoredGroup group) {
        return withLock(group.getId(), () -> {
            write(fileName(group.getId()), group);
            return group;
        });
    }

    @Override
    public Optional<MonitoredGroup> update(String id, UnaryOperator<MonitoredGroup> mutator) {
        return withLock(id, () -> read(fileName(id)).map(current -> {
            MonitoredGroup updated = mutator.apply(current);
            write(fileName(id), updated);
            return updated;
        }));
    }
}
