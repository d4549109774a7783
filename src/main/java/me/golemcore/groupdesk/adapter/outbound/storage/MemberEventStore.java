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

import me.golemcore.groupdesk.domain.model.MemberEvent;
import me.golemcore.groupdesk.port.outbound.MemberEventStorePort;
import me.golemcore.groupdesk.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Member event store backed by
 * {@code member-events/<tenant>/<yyyy-MM-dd>/<id>.json}.
 *
 * <p>
 * Certificate deduplication scans the day's directory under a lock held for
 * that tenant and day, so two concurrent certificates for the same member
 * cannot both be stored.
 */
@Component
public class MemberEventStore extends JsonDocumentStore<MemberEvent> implements MemberEventStorePort {

    private static final String EVENTS_DIR = "member-events";

    public MemberEventStore(StoragePort storagePort, ObjectMapper objectMapper) {
        super(storagePort, objectMapper, MemberEvent.class, EVENTS_DIR);
    }

    @Override
    public MemberEvent save(MemberEvent event) {
        if (event.getId() == null) {
            event.setId("evt-" + UUID.randomUUID());
        }
        write(dayDirectory(event) + "/" + fileName(event.getId()), event);
        return event;
    }

    @Override
    public boolean insertCertificateIfAbsent(MemberEvent event) {
        String dayDirectory = dayDirectory(event);
        return withLock(dayDirectory, () -> {
            boolean duplicate = readAll(dayDirectory).stream()
                    .anyMatch(existing -> existing.getType() == MemberEvent.Type.CERTIFICATE
                            && Objects.equals(existing.getGroupId(), event.getGroupId())
                            && Objects.equals(memberKey(existing), memberKey(event)));
            if (duplicate) {
                return false;
            }
            save(event);
            return true;
        });
    }

    @Override
    public List<MemberEvent> findByTenant(String tenantId) {
        return readAll(encode(tenantId)).stream()
                .sorted(Comparator.comparing(MemberEvent::getTimestamp,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    private static String dayDirectory(MemberEvent event) {
        Objects.requireNonNull(event.getEventDate(), "eventDate");
        return encode(event.getTenantId()) + "/" + event.getEventDate();
    }

    private static String memberKey(MemberEvent event) {
        String phone = event.getMemberPhone();
        return phone != null && !phone.isBlank() ? phone : event.getMemberId();
    }
}
