package me.golemcore.groupdesk.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Inbound chat message, keyed by the upstream message id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupMessage {

    private String id;
    private String tenantId;
    private String groupId;
    private String groupName;
    private String senderId;
    private String senderName;
    private String senderPhone;
    private String content;
    private String messageType;
    @Builder.Default
    private List<String> mentionedPhones = new ArrayList<>();
    private Instant timestamp;
    private Instant receivedAt;
}
