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

import java.time.Duration;

/**
 * Rule deriving a fired job's next fire time from its previous one.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Recurrence {

    @Builder.Default
    private RecurrenceType type = RecurrenceType.NONE;

    private Duration interval;
    private String cronExpression;

    /** Stop after this many successful fires; 0 or negative means unlimited. */
    private int maxOccurrences;

    public enum RecurrenceType {
        NONE, FIXED_INTERVAL, CRON
    }

    public static Recurrence none() {
        return Recurrence.builder().type(RecurrenceType.NONE).build();
    }

    public static Recurrence every(Duration interval) {
        return Recurrence.builder().type(RecurrenceType.FIXED_INTERVAL).interval(interval).build();
    }

    public static Recurrence cron(String cronExpression) {
        return Recurrence.builder().type(RecurrenceType.CRON).cronExpression(cronExpression).build();
    }

    @JsonIgnore
    public boolean isRecurring() {
        return type != null && type != RecurrenceType.NONE;
    }

    @JsonIgnore
    public boolean isExhaustedAfter(int occurrences) {
        return maxOccurrences > 0 && occurrences >= maxOccurrences;
    }
}
