package me.golemcore.planner.domain.service;

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

import me.golemcore.planner.domain.exception.InvalidArgumentException;
import me.golemcore.planner.domain.exception.InvalidScheduleException;
import me.golemcore.planner.domain.exception.NotFoundException;
import me.golemcore.planner.domain.exception.PermissionDeniedException;
import me.golemcore.planner.domain.exception.PlannerException;
import me.golemcore.planner.domain.exception.StorageException;
import me.golemcore.planner.domain.model.ExecutionLogEntry;
import me.golemcore.planner.domain.model.FireResult;
import me.golemcore.planner.domain.model.JobStatus;
import me.golemcore.planner.domain.model.Recurrence;
import me.golemcore.planner.domain.model.ReminderJob;
import me.golemcore.planner.domain.model.ReminderPayload;
import me.golemcore.planner.infrastructure.config.BotProperties;
import me.golemcore.planner.port.outbound.JobStorePort;
import me.golemcore.planner.port.outbound.NotificationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable reminder scheduler.
 *
 * <p>
 * Jobs are persisted {@code PENDING} before {@link #schedule} returns and are
 * fired by {@link #tick}, which is driven by
 * {@link me.golemcore.planner.scheduling.ReminderTickScheduler}. Fire and
 * cancel on the same job are serialized by a per-job lock, and every status
 * change is a compare-and-set from {@code PENDING} in the job store.
 *
 * <p>
 * Delivery is at-least-once: the execution log entry and the status
 * transition are written after delivery, and if either write fails the job
 * stays {@code PENDING} and is delivered again on the next tick.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ReminderScheduler {

    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;
    private static final Comparator<ReminderJob> FIRE_ORDER = Comparator
            .comparing(ReminderJob::getFireTime)
            .thenComparing(ReminderJob::getId);

    private final JobStorePort jobStore;
    private final NotificationPort notificationPort;
    private final ReminderRenderer renderer;
    private final BotProperties properties;
    private final Clock clock;
    private final Map<String, ReentrantLock> jobLocks = new ConcurrentHashMap<>();

    public ReminderScheduler(JobStorePort jobStore, NotificationPort notificationPort, ReminderRenderer renderer,
            BotProperties properties, Clock clock) {
        this.jobStore = jobStore;
        this.notificationPort = notificationPort;
        this.renderer = renderer;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Create and persist a pending job.
     *
     * @return the new job id
     * @throws InvalidScheduleException
     *             if the fire time is not strictly in the future or the
     *             recurrence is invalid
     * @throws StorageException
     *             if the job could not be persisted
     */
    public String schedule(String ownerId, Instant fireTime, ReminderPayload payload, Recurrence recurrence) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new InvalidArgumentException("Owner is required");
        }
        if (payload == null || !payload.hasContent()) {
            throw new InvalidArgumentException("Reminder needs a message or a template");
        }
        Instant now = clock.instant();
        if (fireTime == null || !fireTime.isAfter(now)) {
            throw new InvalidScheduleException("Fire time must be in the future");
        }
        Recurrence normalized = normalizeRecurrence(recurrence, fireTime);

        ReminderJob job = ReminderJob.builder()
                .id("rem-" + UUID.randomUUID().toString().substring(0, 8))
                .ownerId(ownerId)
                .fireTime(fireTime)
                .payload(payload.copy())
                .recurrence(normalized)
                .status(JobStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        jobStore.save(job);

        log.info("[Reminders] Scheduled {} for {} at {} ({})", job.getId(), ownerId, fireTime,
                normalized.getType());
        return job.getId();
    }

    /**
     * Cancel a pending job.
     *
     * @return true if the job is cancelled (now or before), false if it already
     *         reached {@code FIRED} or {@code FAILED}
     */
    public boolean cancel(String jobId, String requesterId, boolean elevated) {
        ReminderJob job = requireAccessible(jobId, requesterId, elevated);
        if (job.getStatus() == JobStatus.CANCELLED) {
            return true;
        }

        ReentrantLock lock = lockFor(jobId);
        lock.lock();
        try {
            ReminderJob current = jobStore.findById(jobId)
                    .orElseThrow(() -> new NotFoundException("Reminder not found: " + jobId));
            if (current.getStatus() == JobStatus.CANCELLED) {
                return true;
            }
            if (current.getStatus() != JobStatus.PENDING) {
                log.debug("[Reminders] Cancel of {} ignored, status {}", jobId, current.getStatus());
                return false;
            }

            ReminderJob cancelled = current.copy();
            cancelled.setStatus(JobStatus.CANCELLED);
            cancelled.setUpdatedAt(clock.instant());
            if (jobStore.compareAndSetStatus(jobId, JobStatus.PENDING, cancelled)) {
                log.info("[Reminders] Cancelled {}", jobId);
                return true;
            }
            return jobStore.findById(jobId)
                    .map(latest -> latest.getStatus() == JobStatus.CANCELLED)
                    .orElse(false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fire every pending job due at {@code now}, in fire-time order.
     */
    public List<FireResult> tick(Instant now) {
        List<ReminderJob> due = jobStore.loadPending().stream()
                .filter(job -> job.isDue(now))
                .sorted(FIRE_ORDER)
                .toList();
        if (due.isEmpty()) {
            return List.of();
        }

        log.debug("[Reminders] Tick at {}: {} due", now, due.size());
        List<FireResult> results = new ArrayList<>(due.size());
        for (ReminderJob job : due) {
            try {
                results.add(fire(job.getId(), now));
            } catch (RuntimeException e) { // NOSONAR - one broken job must not stop the batch
                log.error("[Reminders] Unexpected failure firing {}, it stays pending", job.getId(), e);
                results.add(new FireResult(job.getId(), FireResult.Outcome.FAILED, 0, JobStatus.PENDING,
                        job.getFireTime(), e.getMessage()));
            }
        }
        return results;
    }

    /**
     * Load pending jobs at startup. Overdue jobs are not dropped; the next tick
     * fires them.
     *
     * @return number of pending jobs
     */
    public int recover() {
        Instant now = clock.instant();
        List<ReminderJob> pending = jobStore.loadPending();
        long overdue = pending.stream().filter(job -> job.isDue(now)).count();
        log.info("[Reminders] Recovered {} pending jobs, {} overdue", pending.size(), overdue);
        return pending.size();
    }

    public List<ReminderJob> getUserReminders(String ownerId) {
        return jobStore.findByOwner(ownerId).stream()
                .sorted(FIRE_ORDER)
                .toList();
    }

    /**
     * Newest execution log entries of the owner's jobs first.
     */
    public List<ExecutionLogEntry> getLogs(String ownerId, int limit) {
        if (limit <= 0) {
            throw new InvalidArgumentException("Limit must be positive");
        }
        int capped = Math.min(limit, properties.getScheduler().getMaxLogsPage());
        return jobStore.findLogs(ownerId, capped);
    }

    public ReminderJob findJob(String jobId, String requesterId, boolean elevated) {
        return requireAccessible(jobId, requesterId, elevated);
    }

    /**
     * Delete jobs that are no longer pending and were last updated before
     * {@code olderThan}.
     */
    public int purgeTerminal(Instant olderThan) {
        int deleted = jobStore.deleteTerminal(olderThan);
        if (deleted > 0) {
            jobLocks.keySet().removeIf(jobId -> jobStore.findById(jobId).isEmpty());
        }
        return deleted;
    }

    // ==================== FIRE ====================

    private FireResult fire(String jobId, Instant now) {
        ReentrantLock lock = lockFor(jobId);
        lock.lock();
        try {
            ReminderJob job;
            try {
                job = jobStore.findById(jobId).orElse(null);
            } catch (StorageException e) {
                log.error("[Reminders] Failed to re-read {}: {}", jobId, e.getMessage());
                return new FireResult(jobId, FireResult.Outcome.STORAGE_ERROR, 0, JobStatus.PENDING, null,
                        e.getMessage());
            }
            if (job == null || !job.isDue(now)) {
                return FireResult.skipped(jobId, job != null ? job.getStatus() : null);
            }

            String content;
            try {
                content = renderer.render(job, now);
            } catch (StorageException e) {
                log.error("[Reminders] Storage failure while rendering {}: {}", jobId, e.getMessage());
                return storageError(job, 0, e);
            } catch (PlannerException e) {
                log.warn("[Reminders] Cannot render {}: {}", jobId, e.getMessage());
                return complete(job, now, null, new Delivery(false, 1, e.getMessage(), false));
            }

            Delivery delivery = deliverWithRetries(job, content);
            if (delivery.interrupted()) {
                log.warn("[Reminders] Delivery of {} interrupted, leaving it pending", jobId);
                return new FireResult(jobId, FireResult.Outcome.FAILED, delivery.attempts(), JobStatus.PENDING,
                        job.getFireTime(), delivery.error());
            }
            return complete(job, now, content, delivery);
        } finally {
            lock.unlock();
        }
    }

    private FireResult complete(ReminderJob job, Instant now, String content, Delivery delivery) {
        ExecutionLogEntry entry = ExecutionLogEntry.builder()
                .id(UUID.randomUUID().toString())
                .jobId(job.getId())
                .ownerId(job.getOwnerId())
                .attemptedAt(now)
                .outcome(delivery.delivered() ? ExecutionLogEntry.Outcome.SUCCESS : ExecutionLogEntry.Outcome.ERROR)
                .errorMessage(delivery.error())
                .attempts(delivery.attempts())
                .deliveredPayload(content)
                .build();

        ReminderJob next = job.copy();
        next.setUpdatedAt(now);
        if (delivery.delivered()) {
            next.setLastFiredAt(now);
            next.setOccurrenceCount(job.getOccurrenceCount() + 1);
            Instant nextFire = job.isRecurring() && !job.getRecurrence().isExhaustedAfter(next.getOccurrenceCount())
                    ? nextFireTimeOrNull(job, now)
                    : null;
            if (nextFire != null) {
                next.setFireTime(nextFire);
                next.setStatus(JobStatus.PENDING);
            } else {
                next.setStatus(JobStatus.FIRED);
            }
        } else {
            next.setStatus(JobStatus.FAILED);
        }

        try {
            jobStore.appendLog(entry);
            if (!jobStore.compareAndSetStatus(job.getId(), JobStatus.PENDING, next)) {
                ReminderJob latest = jobStore.findById(job.getId()).orElse(null);
                log.warn("[Reminders] Status of {} changed during fire", job.getId());
                return FireResult.skipped(job.getId(), latest != null ? latest.getStatus() : null);
            }
        } catch (StorageException e) {
            log.error("[Reminders] Failed to record fire of {}, it stays pending: {}", job.getId(), e.getMessage());
            return storageError(job, delivery.attempts(), e);
        }

        if (delivery.delivered()) {
            log.info("[Reminders] Fired {} (attempts: {}, status: {})", job.getId(), delivery.attempts(),
                    next.getStatus());
            return new FireResult(job.getId(), FireResult.Outcome.DELIVERED, delivery.attempts(), next.getStatus(),
                    next.getStatus() == JobStatus.PENDING ? next.getFireTime() : null, null);
        }
        log.error("[Reminders] Job {} failed after {} attempts: {}", job.getId(), delivery.attempts(),
                delivery.error());
        return new FireResult(job.getId(), FireResult.Outcome.FAILED, delivery.attempts(), JobStatus.FAILED, null,
                delivery.error());
    }

    private static FireResult storageError(ReminderJob job, int attempts, StorageException e) {
        return new FireResult(job.getId(), FireResult.Outcome.STORAGE_ERROR, attempts, JobStatus.PENDING,
                job.getFireTime(), e.getMessage());
    }

    private Delivery deliverWithRetries(ReminderJob job, String content) {
        BotProperties.SchedulerProperties config = properties.getScheduler();
        int maxAttempts = 1 + Math.max(0, config.getMaxRetries());
        long timeoutMs = config.getDeliveryTimeout().toMillis();
        String channelId = job.getPayload().getChannelId();
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                try {
                    sleepForRetry(config.getRetryBackoff().multipliedBy(attempt - 1L));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return new Delivery(false, attempt - 1, "Interrupted", true);
                }
            }
            CompletableFuture<Void> future = null;
            try {
                future = notificationPort.deliver(job.getOwnerId(), channelId, content);
                if (future == null) {
                    throw new IllegalStateException("Notification adapter returned no result");
                }
                future.get(timeoutMs, TimeUnit.MILLISECONDS);
                return new Delivery(true, attempt, null, false);
            } catch (TimeoutException e) {
                future.cancel(true);
                lastError = "Delivery timed out after " + timeoutMs + "ms";
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                lastError = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new Delivery(false, attempt, "Interrupted", true);
            } catch (RuntimeException e) { // NOSONAR - adapters may fail synchronously
                lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            }
            log.warn("[Reminders] Delivery attempt {}/{} for {} failed: {}", attempt, maxAttempts, job.getId(),
                    lastError);
        }
        return new Delivery(false, maxAttempts, lastError, false);
    }

    void sleepForRetry(Duration backoff) throws InterruptedException {
        Thread.sleep(backoff.toMillis());
    }

    private record Delivery(boolean delivered, int attempts, String error, boolean interrupted) {
    }

    // ==================== RECURRENCE ====================

    /**
     * Next fire time strictly after {@code now}. A fixed interval skips missed
     * occurrences so a long outage produces one catch-up fire.
     *
     * @return next fire time, or null if the cron expression has no future
     *         match
     */
    static Instant nextFireTime(ReminderJob job, Instant now) {
        Recurrence recurrence = job.getRecurrence();
        if (recurrence.getType() == Recurrence.RecurrenceType.FIXED_INTERVAL) {
            Duration interval = recurrence.getInterval();
            long steps = now.isBefore(job.getFireTime())
                    ? 1
                    : Duration.between(job.getFireTime(), now).dividedBy(interval) + 1;
            return job.getFireTime().plus(interval.multipliedBy(steps));
        }
        return nextCronTime(recurrence.getCronExpression(), now);
    }

    private static Instant nextFireTimeOrNull(ReminderJob job, Instant now) {
        try {
            return nextFireTime(job, now);
        } catch (ArithmeticException | DateTimeException e) {
            log.warn("[Reminders] {} has no representable next fire time, finishing it: {}", job.getId(),
                    e.getMessage());
            return null;
        }
    }

    /**
     * Next match of a 6-field cron expression after {@code after}, in UTC.
     */
    public static Instant nextCronTime(String cronExpression, Instant after) {
        CronExpression cron = CronExpression.parse(cronExpression);
        ZonedDateTime next = cron.next(after.atZone(ZoneOffset.UTC));
        return next != null ? next.toInstant() : null;
    }

    /**
     * Convert a 5-field cron expression to Spring's 6-field form by prefixing
     * the seconds field, and validate it.
     */
    public static String normalizeCronExpression(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidScheduleException("Cron expression cannot be empty");
        }

        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");

        String sixFieldCron;
        if (parts.length == CRON_FIVE_FIELDS) {
            sixFieldCron = "0 " + trimmed;
        } else if (parts.length == CRON_SIX_FIELDS) {
            sixFieldCron = trimmed;
        } else {
            throw new InvalidScheduleException(
                    "Invalid cron expression: expected 5 or 6 fields, got " + parts.length);
        }

        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + trimmed + "': " + e.getMessage());
        }
        return sixFieldCron;
    }

    private Recurrence normalizeRecurrence(Recurrence recurrence, Instant fireTime) {
        if (recurrence == null || recurrence.getType() == null
                || recurrence.getType() == Recurrence.RecurrenceType.NONE) {
            return Recurrence.none();
        }
        if (recurrence.getMaxOccurrences() < 0) {
            throw new InvalidScheduleException("Max occurrences must not be negative");
        }
        if (recurrence.getType() == Recurrence.RecurrenceType.FIXED_INTERVAL) {
            Duration interval = recurrence.getInterval();
            if (interval == null || interval.isZero() || interval.isNegative()) {
                throw new InvalidScheduleException("Recurrence interval must be positive");
            }
            try {
                fireTime.plus(interval);
            } catch (ArithmeticException | DateTimeException e) {
                throw new InvalidScheduleException("Recurrence interval is too long");
            }
            return recurrence.toBuilder().cronExpression(null).build();
        }
        String cron = normalizeCronExpression(recurrence.getCronExpression());
        if (nextCronTime(cron, clock.instant()) == null) {
            throw new InvalidScheduleException("Cron expression has no future occurrence");
        }
        return recurrence.toBuilder().cronExpression(cron).interval(null).build();
    }

    // ==================== ACCESS ====================

    private ReminderJob requireAccessible(String jobId, String requesterId, boolean elevated) {
        ReminderJob job = jobStore.findById(jobId)
                .orElseThrow(() -> new NotFoundException("Reminder not found: " + jobId));
        if (!elevated && !job.getOwnerId().equals(requesterId)) {
            throw new PermissionDeniedException("You can only manage your own reminders");
        }
        return job;
    }

    private ReentrantLock lockFor(String jobId) {
        return jobLocks.computeIfAbsent(jobId, id -> new ReentrantLock());
    }
}
