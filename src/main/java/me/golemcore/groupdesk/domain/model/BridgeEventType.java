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

import java.util.Locale;
import java.util.Optional;

/**
 * Event types published by the bridge on the events channel.
 */
public enum BridgeEventType {

    QR,
    AUTHENTICATED,
    READY,
    DISCONNECTED,
    MESSAGE,
    MEMBER_JOIN,
    MEMBER_LEAVE,
    CERTIFICATE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<BridgeEventType> fromWire(String type) {
        if (type == null) {
            return Optional.empty();
        }
        for (BridgeEventType candidate : values()) {
            if (candidate.wireName().equals(type)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
