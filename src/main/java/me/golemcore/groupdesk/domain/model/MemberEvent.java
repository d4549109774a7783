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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Durable record of a join, leave or certificate occurrence in a group.
 *
 * <p>
 * {@code eventDate} is the calendar day used for certificate deduplication:
 * at most one {@link Type#CERTIFICATE} record exists per tenant, group,
 * member and day.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberEvent {

    private String id;
    private String tenantId;
    private String groupId;
    private String groupName;
    private String memberId;
    private String memberName;
    private String memberPhone;
    private Type type;
    private LocalDate eventDate;
    private Instant timestamp;

    public enum Type {
        JOIN("JOIN"),
        LEAVE("LEAVE"),
        CERTIFICATE("CERTIFICATE");

        private final String value;

        Type(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static Type fromValue(String value) {
            return Type.valueOf(value.toUpperCase(Locale.ROOT));
        }
    }
}
