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

import me.golemcore.groupdesk.domain.model.GroupMessage;
import me.golemcore.groupdesk.port.outbound.MessageStorePort;
import me.golemcore.groupdesk.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Message store backed by {@code messages/<tenant>/<messageId>.json}. The
 * upstream message id is the primary key.
 */
@Component
public class MessageStore extends JsonDocumentStore<GroupMessage> implements MessageStorePort {

    private static final String MESSAGES_DIR = "messages";

    public MessageStore(StoragePort storagePort, ObjectMapper objectMapper) {
        super(storagePort, objectMapper, GroupMessage.class, MESSAGES_DIR);
    }

    @Override
    public boolean insertIfAbsent(GroupMessage message) {
        String path = encode(message.getTenantId()) + "/" + fileName(message.getId());
        return withLock(path, () -> {
            if (exists(path)) {
                return false;
            }
            write(path, message);
            return true;
        });
    }

    @Override
    public List<GroupMessage> findByTenant(String tenantId) {
        return readAll(encode(tenantId)).stream()
                .sorted(Comparator.comparing(GroupMessage::getTimestamp,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }
}
