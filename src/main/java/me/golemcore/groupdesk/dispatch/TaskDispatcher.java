package me.golemcore.groupdesk.dispatch;

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
import me.golemcore.groupdesk.domain.service.TaskExecutionService;
import me.golemcore.groupdesk.infrastructure.config.GroupDeskProperties;
import me.golemcore.groupdesk.port.outbound.TaskStorePort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background loop that picks up due tasks and hands them to
 * {@link TaskExecutionService}.
 *
 * <p>
 * This component runs two kinds of threads:
 * <ul>
 * <li>a single poller that calls {@link #pollOnce()} every
 * {@code groupdesk.dispatcher.poll-interval} (default 60 seconds)</li>
 * <li>a fixed worker pool, one task per worker, so a task sleeping through its
 * pacing intervals does not hold up other tenants</li>
 * </ul>
 *
 * <p>
 * A task is executed at most once: the poller never submits a task that is
 * already in flight, and the execution itself claims the task with a
 * {@code pending -> sending} compare-and-set. A task left in {@code sending} by
 * a crash is not retried; {@link #reconcileStaleTasks()} marks it failed on
 * startup.
 *
 * @since 1.0
 * @see TaskExecutionService
 */
@Component
@Slf4j
public class TaskDispatcher {

    static final String RESTART_ERROR = "Interrupted: dispatcher restarted while sending";

    private final TaskStorePort taskStore;
    private final TaskExecutionService executionService;
    private final GroupDeskProperties properties;
    private final Clock clock;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private Executor workerExecutor;
    private ExecutorService ownedWorkerPool;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pollTask;

    @Autowired
    public TaskDispatcher(TaskStorePort taskStore, TaskExecutionService executionService,
            GroupDeskProperties properties, Clock clock) {
        this(taskStore, executionService, properties, clock, null);
    }

    TaskDispatcher(TaskStorePort taskStore, TaskExecutionService executionService,
            GroupDeskProperties properties, Clock clock, Executor workerExecutor) {
        this.taskStore = taskStore;
        this.executionService = executionService;
        this.properties = properties;
        this.clock = clock;
        this.workerExecutor = workerExecutor;
    }

    @PostConstruct
    public void start() {
        GroupDeskProperties.DispatcherProperties config = properties.getDispatcher();
        if (!config.isEnabled()) {
            log.info("[Dispatcher] Disabled");
            return;
        }

        if (config.isReconcileOnStart()) {
            try {
                reconcileStaleTasks();
            } catch (RuntimeException e) { // NOSONAR - startup must not fail on a bad store read
                log.error("[Dispatcher] Reconciliation failed: {}", e.getMessage(), e);
            }
        }

        if (workerExecutor == null) {
            AtomicInteger counter = new AtomicInteger();
            ownedWorkerPool = Executors.newFixedThreadPool(Math.max(1, config.getWorkerThreads()), r -> {
                Thread t = new Thread(r, "task-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            workerExecutor = ownedWorkerPool;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "task-dispatcher");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = config.getPollInterval().toMillis();
        pollTask = scheduler.scheduleWithFixedDelay(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);

        log.info("[Dispatcher] Started with poll interval {}s, {} workers",
                config.getPollInterval().toSeconds(), config.getWorkerThreads());
    }

    @PreDestroy
    public void stop() {
        if (pollTask != null) {
            pollTask.cancel(false);
        }
        shutdown(scheduler);
        shutdown(ownedWorkerPool);
        log.info("[Dispatcher] Shut down ({} tasks still in flight)", inFlight.size());
    }

    /**
     * Submit every due pending task that is not already executing.
     *
     * @return number of tasks submitted
     */
    public int pollOnce() {
        List<ScheduledTask> due = taskStore.findDue(clock.instant());
        if (due.isEmpty()) {
            return 0;
        }
        log.info("[Dispatcher] Found {} due tasks", due.size());

        int submitted = 0;
        for (ScheduledTask task : due) {
            if (!inFlight.add(task.getId())) {
                log.debug("[Dispatcher] Task {} already in flight", task.getId());
                continue;
            }
            try {
                workerExecutor.execute(() -> runTask(task));
                submitted++;
            } catch (RejectedExecutionException e) {
                inFlight.remove(task.getId());
                log.warn("[Dispatcher] Worker pool rejected task {}, will retry next poll", task.getId());
            }
        }
        return submitted;
    }

    /**
     * Fail tasks stuck in {@code sending} for longer than
     * {@code groupdesk.dispatcher.stale-sending-threshold}. They are never
     * re-sent; recurring ones get their next occurrence.
     *
     * @return number of tasks reconciled
     */
    public int reconcileStaleTasks() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(properties.getDispatcher().getStaleSendingThreshold());
        int reconciled = 0;

        for (ScheduledTask stale : taskStore.findByStatus(TaskStatus.SENDING)) {
            if (stale.getUpdatedAt() != null && stale.getUpdatedAt().isAfter(cutoff)) {
                continue;
            }
            Optional<ScheduledTask> failed = taskStore.transition(stale.getId(), TaskStatus.SENDING,
                    TaskStatus.FAILED, now);
            if (failed.isEmpty()) {
                continue;
            }
            ScheduledTask task = failed.get();
            task.setGroupsFailed(Math.max(0, task.getTotalGroups() - task.getGroupsSent()));
            task.setErrorMessage(RESTART_ERROR);
            taskStore.save(task);
            executionService.scheduleNextOccurrence(task);
            reconciled++;
            log.warn("[Dispatcher] Task {} was stuck in sending, marked failed", task.getId());
        }

        if (reconciled > 0) {
            log.info("[Dispatcher] Reconciled {} stale tasks", reconciled);
        }
        return reconciled;
    }

    void tick() {
        try {
            pollOnce();
        } catch (Exception e) { // NOSONAR - the loop must survive store failures
            log.error("[Dispatcher] Poll failed: {}", e.getMessage(), e);
        }
    }

    boolean isInFlight(String taskId) {
        return inFlight.contains(taskId);
    }

    private void runTask(ScheduledTask task) {
        try {
            executionService.execute(task);
        } catch (RuntimeException e) { // NOSONAR
            log.error("[Dispatcher] Task {} crashed: {}", task.getId(), e.getMessage(), e);
        } finally {
            inFlight.remove(task.getId());
        }
    }

    private static void shutdown(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
