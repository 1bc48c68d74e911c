package me.golemcore.planner.domain.model;

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

import java.time.Instant;

/**
 * Result of handling one due job within a tick.
 */
public record FireResult(
        String jobId,
        Outcome outcome,
        int attempts,
        JobStatus status,
        Instant nextFireTime,
        String error) {

    public enum Outcome {
        DELIVERED, FAILED, SKIPPED, STORAGE_ERROR
    }

    public static FireResult skipped(String jobId, JobStatus status) {
        return new FireResult(jobId, Outcome.SKIPPED, 0, status, null, null);
    }
}
