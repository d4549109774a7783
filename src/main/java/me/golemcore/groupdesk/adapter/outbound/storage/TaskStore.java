package me.golemcore.groupdesk.adapter.outbound.storage;

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
import me.golemcore.groupdesk.port.outbound.StoragePort;
import me.golemcore.groupdesk.port.outbound.TaskStorePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Task store backed by {@code tasks/<id>.json}.
 */
@Component
@Slf4j
public class TaskStore extends JsonDocumentStore<ScheduledTask> implements TaskStorePort {

    private static final String TASKS_DIR = "tasks";

    public TaskStore(StoragePort storagePort, ObjectMapper objectMapper) {
        super(storagePort, objectMapper, ScheduledTask.class, TASKS_DIR);
    }

    @Override
    public Optional<ScheduledTask> findById(String id) {
        return read(fileName(id));
    }

    @Override
    public List<ScheduledTask> findDue(Instant now) {
        return readAll("").stream()
                .filter(task -> task.isDue(now))
                .sorted(Comparator.comparing(ScheduledTask::getScheduledAt))
                .toList();
    }

    @Override
    public List<ScheduledTask> findByStatus(TaskStatus status) {
        return readAll("").stream()
                .filter(task -> task.getStatus() == status)
                .toList();
    }

    @Override
    public List<ScheduledTask> findByTenant(String tenantId) {
        return readAll("").stream()
                .filter(task -> Objects.equals(task.getTenantId(), tenantId))
                .sorted(Comparator.comparing(ScheduledTask::getScheduledAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    @Override
    public ScheduledTask save(ScheduledTask task) {
        if (task.getId() == null) {
            task.setId(ScheduledTask.newId());
        }
        return withLock(task.getId(), () -> {
            write(fileName(task.getId()), task);
            return task;
        });
    }

    @Override
    public Optional<ScheduledTask> transition(String id, TaskStatus expected, TaskStatus target, Instant at) {
        return withLock(id, () -> {
            Optional<ScheduledTask> stored = read(fileName(id));
            if (stored.isEmpty() || stored.get().getStatus() != expected) {
                log.debug("[Storage] Task {} not in {}, transition to {} refused", id, expected, target);
                return Optional.empty();
            }
            ScheduledTask task = stored.get();
            task.setStatus(target);
            task.setUpdatedAt(at);
            write(fileName(id), task);
            return Optional.of(task);
        });
    }
}
