package me.golemcore.planner.adapter.outbound.storage;

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

import me.golemcore.planner.domain.exception.StorageException;
import me.golemcore.planner.domain.model.ExecutionLogEntry;
import me.golemcore.planner.domain.model.JobStatus;
import me.golemcore.planner.domain.model.ReminderJob;
import me.golemcore.planner.domain.service.StorageSupport;
import me.golemcore.planner.port.outbound.JobStorePort;
import me.golemcore.planner.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Job store persisting all reminder jobs as one JSON document in
 * {@code reminders/jobs.json} and the execution log as JSONL in
 * {@code reminders/executions.jsonl}.
 *
 * <p>
 * All mutations run under a single lock and are written with
 * {@link StoragePort#writeDocument} before they become visible. If the write
 * does not confirm, the in-memory state is rolled back and
 * {@link StorageException} is thrown, so a failed write never advances a job.
 */
@Component
@Slf4j
public class JsonJobStoreAdapter implements JobStorePort {

    private static final String REMINDERS_DIR = "reminders";
    private static final String JOBS_FILE = "jobs.json";
    private static final String LOG_FILE = "executions.jsonl";
    private static final TypeReference<List<ReminderJob>> JOB_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    private Map<String, ReminderJob> jobs;

    public JsonJobStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(ReminderJob job) {
        lock.lock();
        try {
            Map<String, ReminderJob> current = loaded();
            ReminderJob previous = current.put(job.getId(), job.copy());
            try {
                persist(current);
            } catch (StorageException e) {
                restore(current, job.getId(), previous);
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ReminderJob> findById(String jobId) {
        lock.lock();
        try {
            return Optional.ofNullable(loaded().get(jobId)).map(ReminderJob::copy);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ReminderJob> loadPending() {
        lock.lock();
        try {
            return loaded().values().stream()
                    .filter(job -> job.getStatus() == JobStatus.PENDING)
                    .map(ReminderJob::copy)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ReminderJob> findByOwner(String ownerId) {
        lock.lock();
        try {
            return loaded().values().stream()
                    .filter(job -> ownerId.equals(job.getOwnerId()))
                    .map(ReminderJob::copy)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean compareAndSetStatus(String jobId, JobStatus expected, ReminderJob replacement) {
        lock.lock();
        try {
            Map<String, ReminderJob> current = loaded();
            ReminderJob existing = current.get(jobId);
            if (existing == null || existing.getStatus() != expected) {
                return false;
            }
            current.put(jobId, replacement.copy());
            try {
                persist(current);
            } catch (StorageException e) {
                current.put(jobId, existing);
                throw e;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void appendLog(ExecutionLogEntry entry) {
        String line;
        try {
            line = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize execution log entry for job " + entry.getJobId(), e);
        }
        StorageSupport.join(storagePort.appendRecord(REMINDERS_DIR, LOG_FILE, line), "append execution log");
    }

    @Override
    public List<ExecutionLogEntry> findLogs(String ownerId, int limit) {
        List<String> lines = StorageSupport.join(storagePort.readRecords(REMINDERS_DIR, LOG_FILE),
                "read execution log");
        List<ExecutionLogEntry> entries = new ArrayList<>();
        for (String line : lines) {
            try {
                ExecutionLogEntry entry = objectMapper.readValue(line, ExecutionLogEntry.class);
                if (ownerId.equals(entry.getOwnerId())) {
                    entries.add(entry);
                }
            } catch (JsonProcessingException e) {
                // A torn append followed by later ones leaves a merged, unparseable record
                log.warn("[JobStore] Skipping unreadable execution log record: {}", e.getOriginalMessage());
            }
        }
        return entries.stream()
                .sorted(Comparator.comparing(ExecutionLogEntry::getAttemptedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public int deleteTerminal(Instant olderThan) {
        lock.lock();
        try {
            Map<String, ReminderJob> current = loaded();
            Map<String, ReminderJob> removed = new LinkedHashMap<>();
            current.values().stream()
                    .filter(job -> job.getStatus() != JobStatus.PENDING)
                    .filter(job -> job.getUpdatedAt() != null && job.getUpdatedAt().isBefore(olderThan))
                    .forEach(job -> removed.put(job.getId(), job));
            if (removed.isEmpty()) {
                return 0;
            }
            removed.keySet().forEach(current::remove);
            try {
                persist(current);
            } catch (StorageException e) {
                current.putAll(removed);
                throw e;
            }
            log.info("[JobStore] Deleted {} terminal jobs older than {}", removed.size(), olderThan);
            return removed.size();
        } finally {
            lock.unlock();
        }
    }

    private Map<String, ReminderJob> loaded() {
        if (jobs == null) {
            jobs = load();
        }
        return jobs;
    }

    private Map<String, ReminderJob> load() {
        List<ReminderJob> list;
        try {
            list = parse(StorageSupport.join(storagePort.readDocument(REMINDERS_DIR, JOBS_FILE), "read jobs"));
        } catch (JsonProcessingException e) {
            log.error("[JobStore] {} is unreadable, falling back to backup: {}", JOBS_FILE, e.getOriginalMessage());
            String backup = StorageSupport.join(storagePort.readBackup(REMINDERS_DIR, JOBS_FILE), "read jobs backup");
            if (backup == null || backup.isBlank()) {
                // Loading empty here would let the next save replace the only copy
                throw new StorageException("Job store is unreadable and has no backup", e);
            }
            try {
                list = parse(backup);
            } catch (JsonProcessingException backupError) {
                throw new StorageException("Job store and its backup are unreadable", backupError);
            }
        }
        Map<String, ReminderJob> result = new LinkedHashMap<>();
        for (ReminderJob job : list) {
            result.put(job.getId(), job);
        }
        log.debug("[JobStore] Loaded {} jobs", result.size());
        return result;
    }

    private List<ReminderJob> parse(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return objectMapper.readValue(json, JOB_LIST_TYPE_REF);
    }

    private void persist(Map<String, ReminderJob> current) {
        String json;
        try {
            json = objectMapper.writeValueAsString(new ArrayList<>(current.values()));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize jobs", e);
        }
        StorageSupport.join(storagePort.writeDocument(REMINDERS_DIR, JOBS_FILE, json, true), "write jobs");
    }

    private static void restore(Map<String, ReminderJob> current, String jobId, ReminderJob previous) {
        if (previous == null) {
            current.remove(jobId);
        } else {
            current.put(jobId, previous);
        }
    }
}
