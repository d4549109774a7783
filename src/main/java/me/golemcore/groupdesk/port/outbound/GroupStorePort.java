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

import me.golemcore.groupdesk.domain.model.MonitoredGroup;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence for {@link MonitoredGroup}s.
 */
public interface GroupStorePort {

    Optional<MonitoredGroup> findById(String id);

    Optional<MonitoredGroup> findByTenantAndId(String tenantId, String id);

    /**
     * Active group of a tenant matching the bridge-side group id.
     */
    Optional<MonitoredGroup> findActiveByBridgeId(String tenantId, String bridgeGroupId);

    MonitoredGroup save(MonitoredGroup group);

    /**
     * Read-modify-write under the group's lock. The mutator sees the latest
     * stored state and no other update of the same group interleaves.
     *
     * @return the stored result, or empty if the group does not exist
     */
    Optional<MonitoredGroup> update(String id, UnaryOperator<MonitoredGroup> mutator);
}
