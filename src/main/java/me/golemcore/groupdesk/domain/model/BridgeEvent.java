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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Envelope of an event published by the bridge. Only the fields relevant to
 * {@code type} are populated.
 *
 * <p>
 * Timestamps are epoch seconds as sent by the bridge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BridgeEvent {

    private String type;

    @JsonProperty("userId")
    private String tenantId;

    private String qr;
    private String phoneNumber;
    private String reason;

    private MessagePayload message;
    private MemberPayload event;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessagePayload {
        private String id;
        private String groupId;
        private String groupName;
        private String senderId;
        private String senderName;
        private String senderPhone;
        private String content;
        private String messageType;
        private Double timestamp;
        @Builder.Default
        private List<String> mentionedPhones = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MemberPayload {
        private String groupId;
        private String groupName;
        private String memberId;
        private String memberName;
        private String memberPhone;
        private Double timestamp;
    }
}
