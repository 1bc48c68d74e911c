package me.golemcore.planner.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.planner.adapter.outbound.storage.JsonJobStoreAdapter;
import me.golemcore.planner.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.planner.domain.exception.InvalidArgumentException;
import me.golemcore.planner.domain.exception.InvalidScheduleException;
import me.golemcore.planner.domain.exception.NotFoundException;
import me.golemcore.planner.domain.exception.PermissionDeniedException;
import me.golemcore.planner.domain.exception.StorageException;
import me.golemcore.planner.domain.model.ExecutionLogEntry;
import me.golemcore.planner.domain.model.FireResult;
import me.golemcore.planner.domain.model.JobStatus;
import me.golemcore.planner.domain.model.Recurrence;
import me.golemcore.planner.domain.model.ReminderJob;
import me.golemcore.planner.domain.model.ReminderPayload;
import me.golemcore.planner.infrastructure.config.AutoConfiguration;
import me.golemcore.planner.infrastructure.config.BotProperties;
import me.golemcore.planner.port.outbound.JobStorePort;
import me.golemcore.planner.port.outbound.NotificationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReminderSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");
    private static final String OWNER = "111";
    private static final String OTHER = "222";

    @TempDir
    Path tempDir;

    private BotProperties properties;
    private ObjectMapper objectMapper;
    private FlakyJobStore jobStore;
    private NotificationPort notificationPort;
    private ReminderRenderer renderer;
    private List<Duration> retrySleeps;
    private ReminderScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        properties.getScheduler().setMaxRetries(2);
        properties.getScheduler().setRetryBackoff(Duration.ofMillis(100));
        properties.getScheduler().setDeliveryTimeout(Duration.ofSeconds(2));
        objectMapper = AutoConfiguration.objectMapper();

        jobStore = new FlakyJobStore(newStore());
        notificationPort = mock(NotificationPort.class);
        when(notificationPort.deliver(anyString(), any(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        renderer = mock(ReminderRenderer.class);
        when(renderer.render(any(), any())).thenAnswer(invocation -> {
            ReminderJob job = invocation.getArgument(0);
            return job.getPayload().getMessage();
        });
        retrySleeps = new ArrayList<>();
        scheduler = newScheduler(jobStore);
    }

    private JsonJobStoreAdapter newStore() {
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        return new JsonJobStoreAdapter(storage, objectMapper);
    }

    private ReminderScheduler newScheduler(JobStorePort store) {
        return new ReminderScheduler(store, notificationPort, renderer, properties,
                Clock.fixed(NOW, ZoneOffset.UTC)) {
            @Override
            void sleepForRetry(Duration backoff) {
                retrySleeps.add(backoff);
            }
        };
    }

    private static ReminderPayload message(String text) {
        return ReminderPayload.builder().message(text).build();
    }

    private String scheduleOnce(Duration delay) {
        return scheduler.schedule(OWNER, NOW.plus(delay), message("stand-up"), Recurrence.none());
    }

    private JobStatus statusOf(String jobId) {
        return jobStore.findById(jobId).orElseThrow().getStatus();
    }

    // ==================== SCHEDULE ====================

    @Test
    void shouldPersistPendingJob() {
        String jobId = scheduleOnce(Duration.ofMinutes(5));

        ReminderJob job = jobStore.findById(jobId).orElseThrow();
        assertTrue(jobId.startsWith("rem-"));
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(NOW.plus(Duration.ofMinutes(5)), job.getFireTime());
        assertEquals(OWNER, job.getOwnerId());
    }

    @Test
    void shouldRejectFireTimeNotInFuture() {
        assertThrows(InvalidScheduleException.class,
                () -> scheduler.schedule(OWNER, NOW, message("late"), Recurrence.none()));
        assertThrows(InvalidScheduleException.class,
                () -> scheduler.schedule(OWNER, NOW.minusSeconds(1), message("late"), Recurrence.none()));
        assertTrue(jobStore.loadPending().isEmpty());
    }

    @Test
    void shouldRejectEmptyPayload() {
        assertThrows(InvalidArgumentException.class,
                () -> scheduler.schedule(OWNER, NOW.plusSeconds(60), new ReminderPayload(), Recurrence.none()));
    }

    @Test
    void shouldRejectInvalidRecurrence() {
        Instant fireTime = NOW.plusSeconds(60);

        assertThrows(InvalidScheduleException.class,
                () -> scheduler.schedule(OWNER, fireTime, message("x"), Recurrence.every(Duration.ZERO)));
        assertThrows(InvalidScheduleException.class,
                () -> scheduler.schedule(OWNER, fireTime, message("x"), Recurrence.cron("61 * * * *")));
        assertThrows(InvalidScheduleException.class,
                () -> scheduler.schedule(OWNER, fireTime, message("x"), Recurrence.cron("* * *")));
    }

    @Test
    void shouldNormalizeFiveFieldCron() {
        String jobId = scheduler.schedule(OWNER, NOW.plusSeconds(60), message("daily"),
                Recurrence.cron("30 9 * * *"));

        assertEquals("0 30 9 * * *", jobStore.findById(jobId).orElseThrow().getRecurrence().getCronExpression());
    }

    @Test
    void shouldNotPersistWhenStoreFails() {
        jobStore.failWrites = true;

        assertThrows(StorageException.class, () -> scheduleOnce(Duration.ofMinutes(1)));
        jobStore.failWrites = false;
        assertTrue(jobStore.loadPending().isEmpty());
    }

    // ==================== TICK ====================

    @Test
    void shouldNotFireBeforeDue() {
        String jobId = scheduleOnce(Duration.ofMinutes(5));

        List<FireResult> results = scheduler.tick(NOW.plus(Duration.ofMinutes(4)));

        assertTrue(results.isEmpty());
        assertEquals(JobStatus.PENDING, statusOf(jobId));
        verify(notificationPort, never()).deliver(anyString(), any(), anyString());
    }

    @Test
    void shouldFireOneShotExactlyOnce() {
        String jobId = scheduleOnce(Duration.ofMinutes(5));
        Instant due = NOW.plus(Duration.ofMinutes(5));

        List<FireResult> first = scheduler.tick(due);
        List<FireResult> second = scheduler.tick(due.plusSeconds(5));

        assertEquals(1, first.size());
        assertEquals(FireResult.Outcome.DELIVERED, first.get(0).outcome());
        assertEquals(JobStatus.FIRED, first.get(0).status());
        assertTrue(second.isEmpty());
        assertEquals(JobStatus.FIRED, statusOf(jobId));
        verify(notificationPort, times(1)).deliver(eq(OWNER), isNull(), eq("stand-up"));

        List<ExecutionLogEntry> logs = scheduler.getLogs(OWNER, 10);
        assertEquals(1, logs.size());
        assertEquals(ExecutionLogEntry.Outcome.SUCCESS, logs.get(0).getOutcome());
        assertEquals("stand-up", logs.get(0).getDeliveredPayload());
    }

    @Test
    void shouldFireDueJobsInFireTimeOrder() {
        String later = scheduleOnce(Duration.ofMinutes(10));
        String earlier = scheduleOnce(Duration.ofMinutes(5));

        List<FireResult> results = scheduler.tick(NOW.plus(Duration.ofMinutes(15)));

        assertEquals(List.of(earlier, later), results.stream().map(FireResult::jobId).toList());
    }

    @Test
    void shouldDeliverToPayloadChannel() {
        ReminderPayload payload = ReminderPayload.builder().message("deploy").channelId("555").build();
        scheduler.schedule(OWNER, NOW.plusSeconds(60), payload, Recurrence.none());

        scheduler.tick(NOW.plusSeconds(60));

        verify(notificationPort).deliver(OWNER, "555", "deploy");
    }

    @Test
    void recurringJobShouldCatchUpWithSingleFire() {
        String jobId = scheduler.schedule(OWNER, NOW.plus(Duration.ofHours(1)), message("water"),
                Recurrence.every(Duration.ofHours(1)));

        // Offline for three and a half intervals
        Instant late = NOW.plus(Duration.ofMinutes(270));
        List<FireResult> results = scheduler.tick(late);

        assertEquals(1, results.size());
        assertEquals(FireResult.Outcome.DELIVERED, results.get(0).outcome());
        ReminderJob job = jobStore.findById(jobId).orElseThrow();
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(NOW.plus(Duration.ofMinutes(300)), job.getFireTime());
        assertEquals(1, job.getOccurrenceCount());
        verify(notificationPort, times(1)).deliver(anyString(), any(), anyString());
    }

    @Test
    void recurringJobShouldStopAtMaxOccurrences() {
        Recurrence recurrence = Recurrence.every(Duration.ofMinutes(10)).toBuilder().maxOccurrences(2).build();
        String jobId = scheduler.schedule(OWNER, NOW.plus(Duration.ofMinutes(10)), message("twice"), recurrence);

        scheduler.tick(NOW.plus(Duration.ofMinutes(10)));
        List<FireResult> second = scheduler.tick(NOW.plus(Duration.ofMinutes(20)));
        List<FireResult> third = scheduler.tick(NOW.plus(Duration.ofMinutes(30)));

        assertEquals(JobStatus.FIRED, second.get(0).status());
        assertNull(second.get(0).nextFireTime());
        assertTrue(third.isEmpty());
        assertEquals(2, jobStore.findById(jobId).orElseThrow().getOccurrenceCount());
    }

    @Test
    void cronJobShouldAdvanceToNextMatch() {
        String jobId = scheduler.schedule(OWNER, Instant.parse("2026-03-02T09:30:00Z"), message("daily"),
                Recurrence.cron("30 9 * * *"));

        scheduler.tick(Instant.parse("2026-03-02T09:30:00Z"));

        assertEquals(Instant.parse("2026-03-03T09:30:00Z"), jobStore.findById(jobId).orElseThrow().getFireTime());
    }

    // ==================== RETRIES ====================

    @Test
    void shouldRetryWithLinearBackoffThenFail() {
        when(notificationPort.deliver(anyString(), any(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("gateway down")));
        String jobId = scheduleOnce(Duration.ofMinutes(1));

        FireResult result = scheduler.tick(NOW.plus(Duration.ofMinutes(1))).get(0);

        assertEquals(FireResult.Outcome.FAILED, result.outcome());
        assertEquals(3, result.attempts());
        assertEquals(JobStatus.FAILED, statusOf(jobId));
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), retrySleeps);
        ExecutionLogEntry entry = scheduler.getLogs(OWNER, 5).get(0);
        assertEquals(ExecutionLogEntry.Outcome.ERROR, entry.getOutcome());
        assertEquals("gateway down", entry.getErrorMessage());
        assertEquals(3, entry.getAttempts());
    }

    @Test
    void shouldSucceedOnRetry() {
        when(notificationPort.deliver(anyString(), any(), anyString()))
                .thenThrow(new IllegalStateException("socket reset"))
                .thenReturn(CompletableFuture.completedFuture(null));
        String jobId = scheduleOnce(Duration.ofMinutes(1));

        FireResult result = scheduler.tick(NOW.plus(Duration.ofMinutes(1))).get(0);

        assertEquals(FireResult.Outcome.DELIVERED, result.outcome());
        assertEquals(2, result.attempts());
        assertEquals(JobStatus.FIRED, statusOf(jobId));
    }

    @Test
    void shouldTreatTimeoutAsFailedAttemptAndCancelDelivery() {
        properties.getScheduler().setDeliveryTimeout(Duration.ofMillis(20));
        properties.getScheduler().setMaxRetries(0);
        CompletableFuture<Void> hanging = new CompletableFuture<>();
        when(notificationPort.deliver(anyString(), any(), anyString())).thenReturn(hanging);
        String jobId = scheduleOnce(Duration.ofMinutes(1));

        FireResult result = scheduler.tick(NOW.plus(Duration.ofMinutes(1))).get(0);

        assertEquals(FireResult.Outcome.FAILED, result.outcome());
        assertTrue(result.error().contains("timed out"));
        assertTrue(hanging.isCancelled());
        assertEquals(JobStatus.FAILED, statusOf(jobId));
    }

    // ==================== STORAGE FAILURES ====================

    @Test
    void logWriteFailureShouldKeepJobPendingAndRedeliver() {
        String jobId = scheduleOnce(Duration.ofMinutes(1));
        Instant due = NOW.plus(Duration.ofMinutes(1));
        jobStore.failAppend = true;

        FireResult first = scheduler.tick(due).get(0);

        assertEquals(FireResult.Outcome.STORAGE_ERROR, first.outcome());
        assertEquals(JobStatus.PENDING, statusOf(jobId));

        jobStore.failAppend = false;
        FireResult second = scheduler.tick(due.plusSeconds(5)).get(0);

        assertEquals(FireResult.Outcome.DELIVERED, second.outcome());
        assertEquals(JobStatus.FIRED, statusOf(jobId));
        verify(notificationPort, times(2)).deliver(anyString(), any(), anyString());
    }

    @Test
    void statusWriteFailureShouldNotAdvanceJob() {
        String jobId = scheduleOnce(Duration.ofMinutes(1));
        jobStore.failWrites = true;

        FireResult result = scheduler.tick(NOW.plus(Duration.ofMinutes(1))).get(0);

        jobStore.failWrites = false;
        assertEquals(FireResult.Outcome.STORAGE_ERROR, result.outcome());
        assertEquals(JobStatus.PENDING, statusOf(jobId));
    }

    // ==================== CANCEL ====================

    @Test
    void cancelShouldBeIdempotent() {
        String jobId = scheduleOnce(Duration.ofMinutes(5));

        assertTrue(scheduler.cancel(jobId, OWNER, false));
        assertTrue(scheduler.cancel(jobId, OWNER, false));
        assertEquals(JobStatus.CANCELLED, statusOf(jobId));
        assertTrue(scheduler.tick(NOW.plus(Duration.ofMinutes(10))).isEmpty());
    }

    @Test
    void cancelAfterFireShouldReturnFalse() {
        String jobId = scheduleOnce(Duration.ofMinutes(1));
        scheduler.tick(NOW.plus(Duration.ofMinutes(1)));

        assertFalse(scheduler.cancel(jobId, OWNER, false));
        assertEquals(JobStatus.FIRED, statusOf(jobId));
    }

    @Test
    void cancelShouldEnforceOwnership() {
        String jobId = scheduleOnce(Duration.ofMinutes(5));

        assertThrows(PermissionDeniedException.class, () -> scheduler.cancel(jobId, OTHER, false));
        assertTrue(scheduler.cancel(jobId, OTHER, true));
    }

    @Test
    void cancelUnknownJobShouldThrowNotFound() {
        assertThrows(NotFoundException.class, () -> scheduler.cancel("rem-missing", OWNER, false));
    }

    @Test
    void cancelDuringDeliveryShouldWaitForFireToFinish() throws Exception {
        CountDownLatch deliveryStarted = new CountDownLatch(1);
        CompletableFuture<Void> delivery = new CompletableFuture<>();
        when(notificationPort.deliver(anyString(), any(), anyString())).thenAnswer(invocation -> {
            deliveryStarted.countDown();
            return delivery;
        });
        String jobId = scheduleOnce(Duration.ofMinutes(1));

        CompletableFuture<List<FireResult>> tick = CompletableFuture
                .supplyAsync(() -> scheduler.tick(NOW.plus(Duration.ofMinutes(1))));
        assertTrue(deliveryStarted.await(5, TimeUnit.SECONDS));
        CompletableFuture<Boolean> cancel = CompletableFuture
                .supplyAsync(() -> scheduler.cancel(jobId, OWNER, false));
        delivery.complete(null);

        assertEquals(FireResult.Outcome.DELIVERED, tick.get(5, TimeUnit.SECONDS).get(0).outcome());
        assertFalse(cancel.get(5, TimeUnit.SECONDS));
        assertEquals(JobStatus.FIRED, statusOf(jobId));
        verify(notificationPort, times(1)).deliver(anyString(), any(), anyString());
    }

    // ==================== RECOVERY ====================

    @Test
    void pendingJobsShouldSurviveRestartAndFireWhenOverdue() {
        String overdue = scheduleOnce(Duration.ofMinutes(1));
        String future = scheduleOnce(Duration.ofHours(2));
        String cancelled = scheduleOnce(Duration.ofMinutes(2));
        scheduler.cancel(cancelled, OWNER, false);

        // Fresh store instance over the same directory, as after a crash
        JsonJobStoreAdapter reloaded = newStore();
        ReminderScheduler restarted = newScheduler(reloaded);

        assertEquals(2, restarted.recover());
        List<FireResult> results = restarted.tick(NOW.plus(Duration.ofMinutes(30)));

        assertEquals(List.of(overdue), results.stream().map(FireResult::jobId).toList());
        assertEquals(JobStatus.FIRED, reloaded.findById(overdue).orElseThrow().getStatus());
        assertEquals(JobStatus.PENDING, reloaded.findById(future).orElseThrow().getStatus());
        assertEquals(JobStatus.CANCELLED, reloaded.findById(cancelled).orElseThrow().getStatus());
    }

    // ==================== QUERIES ====================

    @Test
    void getUserRemindersShouldOnlyReturnOwnJobs() {
        scheduleOnce(Duration.ofMinutes(5));
        scheduler.schedule(OTHER, NOW.plusSeconds(60), message("other"), Recurrence.none());

        List<ReminderJob> jobs = scheduler.getUserReminders(OWNER);

        assertEquals(1, jobs.size());
        assertEquals(OWNER, jobs.get(0).getOwnerId());
    }

    @Test
    void getLogsShouldRejectNonPositiveLimitAndCapPage() {
        properties.getScheduler().setMaxLogsPage(1);
        scheduleOnce(Duration.ofMinutes(1));
        scheduleOnce(Duration.ofMinutes(2));
        scheduler.tick(NOW.plus(Duration.ofMinutes(5)));

        assertThrows(InvalidArgumentException.class, () -> scheduler.getLogs(OWNER, 0));
        assertEquals(1, scheduler.getLogs(OWNER, 50).size());
    }

    @Test
    void purgeTerminalShouldKeepPendingJobs() {
        String fired = scheduleOnce(Duration.ofMinutes(1));
        String pending = scheduleOnce(Duration.ofHours(5));
        scheduler.tick(NOW.plus(Duration.ofMinutes(1)));

        int deleted = scheduler.purgeTerminal(NOW.plus(Duration.ofDays(1)));

        assertEquals(1, deleted);
        assertTrue(jobStore.findById(fired).isEmpty());
        assertTrue(jobStore.findById(pending).isPresent());
    }

    @Test
    void nextFireTimeShouldSkipMissedIntervals() {
        ReminderJob job = ReminderJob.builder()
                .fireTime(NOW)
                .recurrence(Recurrence.every(Duration.ofMinutes(15)))
                .build();

        assertEquals(NOW.plus(Duration.ofMinutes(15)), ReminderScheduler.nextFireTime(job, NOW));
        assertEquals(NOW.plus(Duration.ofMinutes(60)),
                ReminderScheduler.nextFireTime(job, NOW.plus(Duration.ofMinutes(45))));
    }

    @Test
    void veryLongIntervalShouldRescheduleWithoutBlockingOtherJobs() {
        Duration longInterval = Duration.ofDays(120_000);
        String longJob = scheduler.schedule(OWNER, NOW.plusSeconds(60), message("century"),
                Recurrence.every(longInterval));
        String shortJob = scheduler.schedule(OWNER, NOW.plusSeconds(61), message("tea"), Recurrence.none());

        scheduler.tick(NOW.plusSeconds(120));
        scheduler.tick(NOW.plusSeconds(120));

        ReminderJob rescheduled = jobStore.findById(longJob).orElseThrow();
        assertEquals(JobStatus.PENDING, rescheduled.getStatus());
        assertEquals(NOW.plusSeconds(60).plus(longInterval), rescheduled.getFireTime());
        assertEquals(JobStatus.FIRED, statusOf(shortJob));
        verify(notificationPort, times(2)).deliver(anyString(), any(), anyString());
    }

    @Test
    void shouldRejectIntervalWithNoRepresentableNextFire() {
        Instant fireTime = NOW.plusSeconds(60);

        assertThrows(InvalidScheduleException.class, () -> scheduler.schedule(OWNER, fireTime, message("x"),
                Recurrence.every(Duration.ofSeconds(Long.MAX_VALUE))));
    }

    @Test
    void unexpectedFailureShouldNotStopRemainingJobs() {
        String broken = scheduler.schedule(OWNER, NOW.plusSeconds(60), message("broken"), Recurrence.none());
        String healthy = scheduler.schedule(OWNER, NOW.plusSeconds(61), message("healthy"), Recurrence.none());
        doAnswer(invocation -> {
            ReminderJob job = invocation.getArgument(0);
            if ("broken".equals(job.getPayload().getMessage())) {
                throw new IllegalStateException("renderer bug");
            }
            return job.getPayload().getMessage();
        }).when(renderer).render(any(), any());

        List<FireResult> results = scheduler.tick(NOW.plusSeconds(120));

        assertEquals(2, results.size());
        assertEquals(FireResult.Outcome.FAILED, results.get(0).outcome());
        assertEquals(JobStatus.PENDING, results.get(0).status());
        assertEquals(FireResult.Outcome.DELIVERED, results.get(1).outcome());
        assertEquals(JobStatus.PENDING, statusOf(broken));
        assertEquals(JobStatus.FIRED, statusOf(healthy));
    }

    @Test
    void nextFireTimeShouldHandleIntervalsBeyondNanosecondRange() {
        Duration longInterval = Duration.ofDays(120_000);
        ReminderJob job = ReminderJob.builder()
                .fireTime(NOW)
                .recurrence(Recurrence.every(longInterval))
                .build();

        assertEquals(NOW.plus(longInterval), ReminderScheduler.nextFireTime(job, NOW.plusSeconds(5)));
    }

    @Test
    void normalizeCronExpressionShouldKeepSixFields() {
        assertEquals("0 0 9 * * MON", ReminderScheduler.normalizeCronExpression("0 0 9 * * MON"));
        assertThrows(InvalidScheduleException.class, () -> ReminderScheduler.normalizeCronExpression(" "));
    }

    /**
     * Job store whose writes can be made to fail on demand.
     */
    private static final class FlakyJobStore implements JobStorePort {

        private final JobStorePort delegate;
        private volatile boolean failWrites;
        private volatile boolean failAppend;

        private FlakyJobStore(JobStorePort delegate) {
            this.delegate = delegate;
        }

        private void maybeFail(boolean flag) {
            if (flag) {
                throw new StorageException("disk full", new java.io.IOException("ENOSPC"));
            }
        }

        @Override
        public void save(ReminderJob job) {
            maybeFail(failWrites);
            delegate.save(job);
        }

        @Override
        public Optional<ReminderJob> findById(String jobId) {
            return delegate.findById(jobId);
        }

        @Override
        public List<ReminderJob> loadPending() {
            return delegate.loadPending();
        }

        @Override
        public List<ReminderJob> findByOwner(String ownerId) {
            return delegate.findByOwner(ownerId);
        }

        @Override
        public boolean compareAndSetStatus(String jobId, JobStatus expected, ReminderJob replacement) {
            maybeFail(failWrites);
            return delegate.compareAndSetStatus(jobId, expected, replacement);
        }

        @Override
        public void appendLog(ExecutionLogEntry entry) {
            maybeFail(failAppend);
            delegate.appendLog(entry);
        }

        @Override
        public List<ExecutionLogEntry> findLogs(String ownerId, int limit) {
            return delegate.findLogs(ownerId, limit);
        }

        @Override
        public int deleteTerminal(Instant olderThan) {
            return delegate.deleteTerminal(olderThan);
        }
    }
}
