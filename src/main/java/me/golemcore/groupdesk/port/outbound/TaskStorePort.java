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

import me.golemcore.groupdesk.domain.model.ScheduledTask;
import me.golemcore.groupdesk.domain.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for {@link ScheduledTask}s.
 */
public interface TaskStorePort {

    Optional<ScheduledTask> findById(String id);

    /**
     * Pending tasks with {@code scheduledAt <= now}, oldest first.
     */
    List<ScheduledTask> findDue(Instant now);

    List<ScheduledTask> findByStatus(TaskStatus status);

    List<ScheduledTask> findByTenant(String tenantId);

    ScheduledTask save(ScheduledTask task);

    /**
     * Compare-and-set status change. Applies only when the stored status is
     * {@code expected}.
     *
     * @return the updated task, or empty if the task is missing or its status
     *         differs
     */
    Optional<ScheduledTask> transition(String id, TaskStatus expected, TaskStatus target, Instant at);
}
