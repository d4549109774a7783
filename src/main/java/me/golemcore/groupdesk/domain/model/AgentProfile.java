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

import java.util.ArrayList;
import java.util.List;

/**
 * Mention autoresponder configuration. A tenant has at most one active
 * profile at a time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentProfile {

    private String id;
    private String tenantId;
    private String name;
    private String apiUrl;
    private String apiKey;
    private String systemPrompt;
    private Integer outputTokenLimit;
    private boolean active;

    @Builder.Default
    private List<String> enabledGroupIds = new ArrayList<>();

    public boolean isEnabledFor(String groupId) {
        return enabledGroupIds != null && enabledGroupIds.contains(groupId);
    }
}
