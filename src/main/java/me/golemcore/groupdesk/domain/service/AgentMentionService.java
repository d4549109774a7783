package me.golemcore.groupdesk.domain.service;

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

import me.golemcore.groupdesk.domain.model.AgentProfile;
import me.golemcore.groupdesk.domain.model.BridgeResult;
import me.golemcore.groupdesk.domain.model.BridgeSession;
import me.golemcore.groupdesk.domain.model.GroupMessage;
import me.golemcore.groupdesk.domain.model.MonitoredGroup;
import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import me.golemcore.groupdesk.port.outbound.AgentGenerationPort;
import me.golemcore.groupdesk.port.outbound.AgentStorePort;
import me.golemcore.groupdesk.port.outbound.BridgePort;
import me.golemcore.groupdesk.port.outbound.NotificationPort;
import me.golemcore.groupdesk.port.outbound.SessionStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Replies in a group when the tenant's own number is mentioned and the
 * tenant's active agent is enabled for that group.
 *
 * <p>
 * One generation call, no retry. Failures are logged and never reach the
 * event pipeline.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentMentionService {

    private static final int NOTIFICATION_PREVIEW_CHARS = 200;

    private final SessionStorePort sessionStore;
    private final AgentStorePort agentStore;
    private final AgentGenerationPort generationPort;
    private final BridgePort bridgePort;
    private final NotificationPort notificationPort;
    private final GroupDeskProperties properties;

    public void onMessage(MonitoredGroup group, GroupMessage message) {
        try {
            Optional<String> ownPhone = sessionStore.findByTenant(message.getTenantId())
                    .map(BridgeSession::getPhoneNumber)
                    .filter(phone -> !phone.isBlank());
            if (ownPhone.isEmpty() || !isMentioned(ownPhone.get(), message)) {
                return;
            }

            Optional<AgentProfile> agent = agentStore.findActiveByTenant(message.getTenantId());
            if (agent.isEmpty()) {
                log.debug("[Agent] Mentioned in {} but tenant has no active agent", group.getName());
                return;
            }
            if (!agent.get().isEnabledFor(group.getId())) {
                log.debug("[Agent] Agent {} not enabled for {}", agent.get().getName(), group.getName());
                return;
            }

            respond(agent.get(), group, message, ownPhone.get());
        } catch (RuntimeException e) { // NOSONAR - autoresponse failures stay internal
            log.error("[Agent] Mention handling failed in {}: {}", group.getName(), e.getMessage(), e);
        }
    }

    private void respond(AgentProfile agent, MonitoredGroup group, GroupMessage message, String ownPhone) {
        String prompt = cleanPrompt(message.getContent(), ownPhone, properties.getAgent().getDefaultPrompt());
        log.info("[Agent] {} mentioned in {}, generating reply", agent.getName(), group.getName());

        Optional<String> response = generationPort.generate(agent, prompt, message.getSenderName(),
                group.getName());
        if (response.isEmpty() || response.get().isBlank()) {
            log.warn("[Agent] No response generated by {}", agent.getName());
            return;
        }

        BridgeResult result = bridgePort.sendText(group.getTenantId(), group.getBridgeGroupId(), response.get(),
                false, List.of());
        if (result == null || !result.isSuccess()) {
            log.warn("[Agent] Failed to send reply to {}: {}", group.getName(),
                    result != null ? result.getError() : "no response");
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "agent_response");
        payload.put("agent_name", agent.getName());
        payload.put("group_name", group.getName());
        payload.put("response", preview(response.get()));
        notificationPort.sendToTenant(group.getTenantId(), payload);
    }

    static boolean isMentioned(String ownPhone, GroupMessage message) {
        if (message.getMentionedPhones() != null && message.getMentionedPhones().contains(ownPhone)) {
            return true;
        }
        return message.getContent() != null && message.getContent().contains(ownPhone);
    }

    /**
     * Strip the tenant's own mention markup ({@code @Name (phone)},
     * {@code @phone}, bare phone) from the message text.
     */
    static String cleanPrompt(String content, String ownPhone, String fallback) {
        String clean = content != null ? content : "";
        clean = clean.replaceAll("@[^@\\n]+\\(" + Pattern.quote(ownPhone) + "\\)", "").trim();
        clean = clean.replace("@" + ownPhone, "").trim();
        clean = clean.replace(ownPhone, "").trim();
        return clean.isEmpty() ? fallback : clean;
    }

    private static String preview(String response) {
        return response.length() > NOTIFICATION_PREVIEW_CHARS
                ? response.substring(0, NOTIFICATION_PREVIEW_CHARS) + "..."
                : response;
    }
}
