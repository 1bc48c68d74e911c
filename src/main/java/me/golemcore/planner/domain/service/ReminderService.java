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
import me.golemcore.planner.domain.model.Poll;
import me.golemcore.planner.domain.model.Recurrence;
import me.golemcore.planner.domain.model.ReminderPayload;
import me.golemcore.planner.domain.model.ReminderTrigger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Resolves reminder triggers into a fire time and recurrence and hands the
 * job to {@link ReminderScheduler}.
 */
@Service
@Slf4j
public class ReminderService {

    private final ReminderScheduler scheduler;
    private final ReminderTemplateService templateService;
    private final PollService pollService;
    private final Clock clock;

    public ReminderService(ReminderScheduler scheduler, ReminderTemplateService templateService,
            PollService pollService, Clock clock) {
        this.scheduler = scheduler;
        this.templateService = templateService;
        this.pollService = pollService;
        this.clock = clock;
    }

    /**
     * @return the new job id
     */
    public String createReminder(String ownerId, ReminderTrigger trigger, ReminderPayload payload) {
        if (trigger == null || trigger.getType() == null) {
            throw new InvalidArgumentException("Trigger is required");
        }
        if (payload == null) {
            throw new InvalidArgumentException("Reminder needs a message or a template");
        }
        if (payload.getTemplateName() != null && !payload.getTemplateName().isBlank()) {
            templateService.getTemplate(payload.getTemplateName());
        }
        if (payload.getTargetType() == ReminderPayload.TargetType.POLL) {
            pollService.getPoll(payload.getTargetId());
        }

        Instant now = clock.instant();
        return switch (trigger.getType()) {
        case SPECIFIC_TIME -> scheduler.schedule(ownerId, trigger.getAt(), payload, Recurrence.none());
        case INTERVAL -> scheduleInterval(ownerId, trigger, payload, now);
        case TIME_BEFORE -> scheduleBeforePollClose(ownerId, trigger, payload);
        case CRON -> scheduleCron(ownerId, trigger, payload, now);
        };
    }

    /**
     * Remind about a poll {@code minutesBefore} minutes before it closes, using
     * the given template or {@code poll_reminder}.
     */
    public String createPollReminder(String ownerId, String pollId, int minutesBefore, String templateName,
            String channelId) {
        Poll poll = pollService.getPoll(pollId);
        ReminderPayload payload = ReminderPayload.builder()
                .channelId(channelId != null ? channelId : poll.getChannelId())
                .templateName(templateName != null && !templateName.isBlank() ? templateName : "poll_reminder")
                .targetType(ReminderPayload.TargetType.POLL)
                .targetId(pollId)
                .build();
        return createReminder(ownerId, ReminderTrigger.beforeClose(minutesBefore), payload);
    }

    private String scheduleInterval(String ownerId, ReminderTrigger trigger, ReminderPayload payload,
            Instant now) {
        Duration interval = trigger.getInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new InvalidScheduleException("Interval must be positive");
        }
        Recurrence recurrence = Recurrence.every(interval).toBuilder()
                .maxOccurrences(trigger.getMaxOccurrences())
                .build();
        return scheduler.schedule(ownerId, now.plus(interval), payload, recurrence);
    }

    private String scheduleBeforePollClose(String ownerId, ReminderTrigger trigger, ReminderPayload payload) {
        if (payload.getTargetType() != ReminderPayload.TargetType.POLL) {
            throw new InvalidArgumentException("A time-before reminder needs a target poll");
        }
        if (trigger.getMinutesBefore() <= 0) {
            throw new InvalidScheduleException("Minutes before must be positive");
        }
        Poll poll = pollService.getPoll(payload.getTargetId());
        if (poll.getExpiresAt() == null) {
            throw new InvalidScheduleException("Poll " + poll.getId() + " has no closing time");
        }
        Instant fireTime = poll.getExpiresAt().minus(Duration.ofMinutes(trigger.getMinutesBefore()));
        log.debug("[Reminders] Poll {} closes at {}, reminding at {}", poll.getId(), poll.getExpiresAt(), fireTime);
        return scheduler.schedule(ownerId, fireTime, payload, Recurrence.none());
    }

    private String scheduleCron(String ownerId, ReminderTrigger trigger, ReminderPayload payload, Instant now) {
        String cron = ReminderScheduler.normalizeCronExpression(trigger.getCronExpression());
        Instant first = ReminderScheduler.nextCronTime(cron, now);
        if (first == null) {
            throw new InvalidScheduleException("Cron expression has no future occurrence");
        }
        Recurrence recurrence = Recurrence.cron(cron).toBuilder()
                .maxOccurrences(trigger.getMaxOccurrences())
                .build();
        return scheduler.schedule(ownerId, first, payload, recurrence);
    }
}
