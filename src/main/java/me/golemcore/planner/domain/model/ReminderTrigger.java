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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * How a reminder's first fire time and recurrence are derived.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReminderTrigger {

    private TriggerType type;

    /** SPECIFIC_TIME: the fire time. */
    private Instant at;

    /** INTERVAL: period between fires, first fire one period from now. */
    private Duration interval;

    /** TIME_BEFORE: minutes before the target poll closes. */
    private int minutesBefore;

    /** CRON: 5- or 6-field expression, evaluated in UTC. */
    private String cronExpression;

    /** Recurring triggers only; 0 means unlimited. */
    private int maxOccurrences;

    public enum TriggerType {
        SPECIFIC_TIME, INTERVAL, TIME_BEFORE, CRON
    }

    public static ReminderTrigger at(Instant at) {
        return ReminderTrigger.builder().type(TriggerType.SPECIFIC_TIME).at(at).build();
    }

    public static ReminderTrigger every(Duration interval) {
        return ReminderTrigger.builder().type(TriggerType.INTERVAL).interval(interval).build();
    }

    public static ReminderTrigger beforeClose(int minutesBefore) {
        return ReminderTrigger.builder().type(TriggerType.TIME_BEFORE).minutesBefore(minutesBefore).build();
    }

    public static ReminderTrigger cron(String cronExpression) {
        return ReminderTrigger.builder().type(TriggerType.CRON).cronExpression(cronExpression).build();
    }
}
