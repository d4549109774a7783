package me.golemcore.groupdesk;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GroupDesk.
 *
 * <p>
 * GroupDesk watches messaging groups owned by many tenants and acts on them
 * through a remote bridge service. Two background engines run next to each
 * other:
 * <ul>
 * <li><b>Task Dispatcher</b> - executes scheduled and recurring broadcasts,
 * polls and group open/close changes with pacing, retry and session
 * health-checks</li>
 * <li><b>Event Pipeline</b> - ingests bridge notifications (session lifecycle,
 * messages, joins, leaves, certificates) and drives welcome messages and
 * mention-triggered agent replies</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → RedisBridgeEventListener
 * Domain Layer       → TaskDispatcher, TaskExecutionService, BridgeEventPipeline
 * Infrastructure     → Bridge/Agent/Notification/Storage Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code groupdesk.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GroupDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroupDeskApplication.class, args);
    }

}
