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

import me.golemcore.groupdesk.domain.model.BridgeResult;
import me.golemcore.groupdesk.domain.model.BridgeStatus;

import java.util.List;

/**
 * Port for the remote bridge service that performs group actions on the chat
 * platform on behalf of a tenant.
 *
 * <p>
 * Every send returns a {@link BridgeResult}; implementations never throw for
 * remote failures, and map timeouts to an error text the retry policy
 * recognizes as transient. Calls block until the bridge answers or the
 * configured timeout elapses.
 */
public interface BridgePort {

    BridgeResult initSession(String tenantId);

    /**
     * Current session status. May throw if the bridge is unreachable.
     */
    BridgeStatus getStatus(String tenantId);

    BridgeResult sendText(String tenantId, String groupId, String content, boolean mentionAll,
            List<String> mentionIds);

    /**
     * Send media that already lives on the bridge host.
     *
     * @param mediaReference
     *            bridge-side file path
     */
    BridgeResult sendMedia(String tenantId, String groupId, String mediaReference, String caption,
            boolean mentionAll, List<String> mentionIds);

    BridgeResult sendPoll(String tenantId, String groupId, String question, List<String> options,
            boolean allowMultiple, boolean mentionAll, List<String> mentionIds);

    /**
     * Restrict (or lift the restriction on) who can post in a group.
     *
     * @param adminOnly
     *            {@code true} closes the group, {@code false} opens it
     */
    BridgeResult setGroupMode(String tenantId, String groupId, boolean adminOnly);

    BridgeResult sendWelcome(String tenantId, String groupId, String content, List<String> joinerPhones,
            List<String> extraMentionPhones);

    BridgeResult deleteMedia(String mediaReference);
}
