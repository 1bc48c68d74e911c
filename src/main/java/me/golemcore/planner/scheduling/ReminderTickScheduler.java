package me.golemcore.planner.scheduling;

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

import me.golemcore.planner.domain.model.FireResult;
import me.golemcore.planner.domain.service.ReminderScheduler;
import me.golemcore.planner.infrastructure.config.BotProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background loop that drives {@link ReminderScheduler#tick}.
 *
 * <p>
 * A single daemon thread ticks at {@code bot.scheduler.tick-interval}. If a
 * tick is still running when the next one is due, the next one is skipped.
 * On startup pending jobs are recovered and the first tick runs immediately,
 * so reminders that came due while the bot was down fire right away.
 *
 * <p>
 * Shutdown stops future ticks without interrupting the running one and waits
 * up to {@code bot.scheduler.shutdown-grace} for it to finish its batch.
 *
 * @since 1.0
 * @see ReminderScheduler
 */
@Component
@Slf4j
public class ReminderTickScheduler {

    private final ReminderScheduler reminderScheduler;
    private final BotProperties properties;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public ReminderTickScheduler(ReminderScheduler reminderScheduler, BotProperties properties, Clock clock) {
        this.reminderScheduler = reminderScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("[ReminderTick] Scheduler disabled");
            return;
        }

        reminderScheduler.recover();

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reminder-tick");
            t.setDaemon(true);
            return t;
        });

        long intervalMs = properties.getScheduler().getTickInterval().toMillis();
        tickTask = scheduler.scheduleWithFixedDelay(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);

        log.info("[ReminderTick] Started with tick interval: {}ms", intervalMs);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            Duration grace = properties.getScheduler().getShutdownGrace();
            try {
                if (!scheduler.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("[ReminderTick] Tick still running after {}ms, forcing shutdown", grace.toMillis());
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[ReminderTick] Shut down");
    }

    /**
     * Run one tick unless another is in progress.
     *
     * @return false if the tick was skipped
     */
    boolean tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[ReminderTick] Previous tick still running, skipping");
            return false;
        }
        try {
            List<FireResult> results = reminderScheduler.tick(clock.instant());
            if (!results.isEmpty()) {
                long delivered = results.stream()
                        .filter(result -> result.outcome() == FireResult.Outcome.DELIVERED)
                        .count();
                log.info("[ReminderTick] Processed {} due jobs, {} delivered", results.size(), delivered);
            }
        } catch (RuntimeException e) { // NOSONAR - keep the loop alive
            log.error("[ReminderTick] Tick failed", e);
        } finally {
            executing.set(false);
        }
        return true;
    }

    boolean isExecuting() {
        return executing.get();
    }
}
