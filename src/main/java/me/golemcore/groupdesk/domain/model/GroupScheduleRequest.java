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
 * Input for a daily open/close schedule. Times are tenant-local {@code HH:MM}.
 * The mention settings only apply to a side that has a message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupScheduleRequest {

    private String tenantId;
    private String openTime;
    private String closeTime;
    private String openMessage;
    private String closeMessage;

    @Builder.Default
    private List<String> groupIds = new ArrayList<>();

    @Builder.Default
    private MentionMode mentionMode = MentionMode.NONE;
    @Builder.Default
    private List<String> mentionIds = new ArrayList<>();
}
