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

/**
 * Per-tenant connection state towards the remote messaging service. One
 * document per tenant, updated only by the event pipeline.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BridgeSession {

    private String tenantId;

    @Builder.Default
    private AuthStatus authStatus = AuthStatus.NOT_INITIALIZED;
    private boolean authenticated;
    private String phoneNumber;
    private Instant lastConnectedAt;
    private Instant updatedAt;

    public enum AuthStatus {
        NOT_INITIALIZED("not_initialized"),
        INITIALIZING("initializing"),
        QR_READY("qr_ready"),
        AUTHENTICATED("authenticated"),
        READY("ready"),
        DISCONNECTED("disconnected"),
        FAILED("failed");

        private final String value;

        AuthStatus(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static AuthStatus fromValue(String value) {
            for (AuthStatus status : values()) {
                if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                    return status;
                }
            }
            return NOT_INITIALIZED;
        }
    }
}
