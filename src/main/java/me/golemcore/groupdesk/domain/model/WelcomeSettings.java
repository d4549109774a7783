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
 * Welcome automation settings of a group, as edited by the tenant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WelcomeSettings {

    private boolean enabled;
    @Builder.Default
    private int threshold = 1;
    private String text;
    @Builder.Default
    private List<String> extraMentions = new ArrayList<>();
    private boolean part2Enabled;
    private String part2Text;
    private String part2Image;
}
