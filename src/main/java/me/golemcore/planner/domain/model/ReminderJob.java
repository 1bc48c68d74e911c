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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A scheduled unit of future work. Persisted by the job store and mutated only
 * by the fire loop or an owner's cancel request.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReminderJob {

    private String id;
    private String ownerId;
    private Instant fireTime;
    private ReminderPayload payload;

    @Builder.Default
    private Recurrence recurrence = Recurrence.none();

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastFiredAt;
    private int occurrenceCount;

    @JsonIgnore
    public boolean isRecurring() {
        return recurrence != null && recurrence.isRecurring();
    }

    @JsonIgnore
    public boolean isDue(Instant now) {
        return status == JobStatus.PENDING && fireTime != null && !fireTime.isAfter(now);
    }

    /**
     * Deep copy, so callers never share mutable state with the store.
     */
    public ReminderJob copy() {
        return toBuilder()
                .payload(payload != null ? payload.copy() : null)
                .recurrence(recurrence != null ? recurrence.toBuilder().build() : null)
                .build();
    }
}
