package me.scout.cron.auto;

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

import me.scout.cron.domain.model.ReconciliationReport;
import me.scout.cron.domain.model.RunRecord;
import me.scout.cron.domain.service.JobRunService;
import me.scout.cron.domain.service.SchedulingService;
import me.scout.cron.infrastructure.config.CronProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background loop that keeps schedules and runs moving.
 *
 * <p>
 * Each tick:
 * <ul>
 * <li>creates runs for due jobs ({@link SchedulingService#dispatchDueJobs()})</li>
 * <li>reconciles every enabled job's schedule, catching up where
 * configured</li>
 * <li>executes pending runs, when {@code cron.runner.process-pending} is
 * set</li>
 * </ul>
 *
 * <p>
 * Ticks do not overlap: while one is still running, the next is skipped.
 *
 * @since 1.0
 * @see SchedulingService
 * @see JobRunService
 */
@Component
@Slf4j
public class CronTickScheduler {

    private final SchedulingService schedulingService;
    private final JobRunService jobRunService;
    private final CronProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public CronTickScheduler(SchedulingService schedulingService, JobRunService jobRunService,
            CronProperties properties) {
        this.schedulingService = schedulingService;
        this.jobRunService = jobRunService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("[Tick] Scheduler disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cron-tick-scheduler");
            t.setDaemon(true);
            return t;
        });

        int tickIntervalSeconds = Math.max(1, properties.getScheduler().getTickIntervalSeconds());
        tickTask = scheduler.scheduleAtFixedRate(this::tick, 0, tickIntervalSeconds, TimeUnit.SECONDS);

        log.info("[Tick] Started with tick interval: {}s", tickIntervalSeconds);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Tick] Shut down");
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Tick] Skipped: previous tick still in progress");
            return;
        }

        try {
            List<RunRecord> dispatched = schedulingService.dispatchDueJobs();
            ReconciliationReport report = schedulingService.updateAllSchedules();
            int processed = properties.getRunner().isProcessPending() ? jobRunService.processPendingRuns() : 0;

            if (!dispatched.isEmpty() || report.catchupRunsCreated() > 0 || processed > 0) {
                log.info("[Tick] Dispatched {} run(s), {} catch-up run(s), processed {} run(s)",
                        dispatched.size(), report.catchupRunsCreated(), processed);
            }
        } catch (RuntimeException e) {
            log.error("[Tick] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }
}
