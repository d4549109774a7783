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
 * A tenant-owned external group with its welcome automation state.
 *
 * <p>
 * {@code welcomeJoinCount} always equals the size of
 * {@code welcomePendingJoiners} outside of an in-progress update; both are
 * reset together when a welcome goes out or the welcome settings change.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MonitoredGroup {

    private String id;
    private String tenantId;
    private String bridgeGroupId;
    private String name;

    @Builder.Default
    private boolean active = true;

    private boolean welcomeEnabled;
    @Builder.Default
    private int welcomeThreshold = 1;
    private int welcomeJoinCount;
    @Builder.Default
    private List<String> welcomePendingJoiners = new ArrayList<>();
    private String welcomeText;
    @Builder.Default
    private List<String> welcomeExtraMentions = new ArrayList<>();

    private boolean welcomePart2Enabled;
    private String welcomePart2Text;
    private String welcomePart2Image;

    private Instant createdAt;
    private Instant updatedAt;
}
