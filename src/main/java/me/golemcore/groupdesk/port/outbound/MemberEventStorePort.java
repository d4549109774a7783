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

import me.golemcore.groupdesk.domain.model.MemberEvent;

import java.util.List;

/**
 * Persistence for {@link MemberEvent} records.
 */
public interface MemberEventStorePort {

    MemberEvent save(MemberEvent event);

    /**
     * Store a certificate record unless one already exists for the same
     * tenant, group, member phone and event date.
     *
     * @return {@code true} if stored
     */
    boolean insertCertificateIfAbsent(MemberEvent event);

    List<MemberEvent> findByTenant(String tenantId);
}
