package me.golemcore.planner.port.outbound;

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

import me.golemcore.planner.domain.model.ExecutionLogEntry;
import me.golemcore.planner.domain.model.JobStatus;
import me.golemcore.planner.domain.model.ReminderJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for reminder jobs and their execution log. Every method that
 * writes either confirms durability or throws
 * {@link me.golemcore.planner.domain.exception.StorageException}. Returned
 * jobs are copies; mutating them has no effect on the store.
 */
public interface JobStorePort {

    /**
     * Insert or replace a job unconditionally.
     */
    void save(ReminderJob job);

    Optional<ReminderJob> findById(String jobId);

    /**
     * All jobs in {@link JobStatus#PENDING}, in no particular order.
     */
    List<ReminderJob> loadPending();

    List<ReminderJob> findByOwner(String ownerId);

    /**
     * Replace the stored job with {@code replacement} only if its current status
     * equals {@code expected}.
     *
     * @return true if the swap was applied and persisted, false if the status
     *         did not match or the job is unknown
     */
    boolean compareAndSetStatus(String jobId, JobStatus expected, ReminderJob replacement);

    void appendLog(ExecutionLogEntry entry);

    /**
     * Most recent entries first.
     */
    List<ExecutionLogEntry> findLogs(String ownerId, int limit);

    /**
     * Delete every non-pending job last updated before the cutoff.
     *
     * @return number of deleted jobs
     */
    int deleteTerminal(Instant olderThan);
}
