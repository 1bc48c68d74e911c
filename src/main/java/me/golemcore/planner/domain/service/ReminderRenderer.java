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
import me.golemcore.planner.domain.model.Poll;
import me.golemcore.planner.domain.model.PollResults;
import me.golemcore.planner.domain.model.ReminderJob;
import me.golemcore.planner.domain.model.ReminderPayload;
import me.golemcore.planner.domain.model.ReminderPriority;
import me.golemcore.planner.domain.model.ReminderTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a reminder payload into the text that is delivered.
 *
 * <p>
 * The base text is the named template, or the raw message when no template is
 * set. Poll targets contribute {@code {poll_id}}, {@code {poll_title}},
 * {@code {time_left}} and {@code {results}}; custom substitutions are applied
 * after them. Unknown placeholders are left untouched. The template priority
 * indicator is prepended and role/user mentions are appended.
 */
@Component
public class ReminderRenderer {

    private final ReminderTemplateService templateService;
    private final PollService pollService;

    public ReminderRenderer(ReminderTemplateService templateService, PollService pollService) {
        this.templateService = templateService;
        this.pollService = pollService;
    }

    /**
     * Render the job's payload as of {@code now}.
     *
     * @throws me.golemcore.planner.domain.exception.NotFoundException
     *             if the template or target poll no longer exists
     */
    public String render(ReminderJob job, Instant now) {
        ReminderPayload payload = job.getPayload();
        if (payload == null || !payload.hasContent()) {
            throw new InvalidArgumentException("Reminder " + job.getId() + " has no content");
        }

        ReminderTemplate template = null;
        String text;
        if (payload.getTemplateName() != null && !payload.getTemplateName().isBlank()) {
            template = templateService.getTemplate(payload.getTemplateName());
            text = template.getMessageTemplate();
        } else {
            text = payload.getMessage();
        }

        Map<String, String> values = new LinkedHashMap<>();
        if (payload.getMessage() != null) {
            values.put("message", payload.getMessage());
        }
        if (payload.getTargetType() == ReminderPayload.TargetType.POLL && payload.getTargetId() != null) {
            PollResults results = pollService.getResults(payload.getTargetId());
            Poll poll = results.poll();
            values.put("poll_id", poll.getId());
            values.put("poll_title", poll.getQuestion());
            values.put("time_left", formatTimeLeft(poll.getExpiresAt(), now));
            values.put("results", results.summary());
        }
        if (payload.getSubstitutions() != null) {
            values.putAll(payload.getSubstitutions());
        }
        text = substitute(text, values);

        if (template == null) {
            return text;
        }
        ReminderPriority priority = template.getPriority() != null ? template.getPriority()
                : ReminderPriority.INFORMATIONAL;
        String mentions = mentions(template);
        return priority.getIndicator() + text + (mentions.isEmpty() ? "" : "\n" + mentions);
    }

    static String substitute(String text, Map<String, String> values) {
        String result = text;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String value = entry.getValue() != null ? entry.getValue() : "";
            result = result.replace("{" + entry.getKey() + "}", value);
        }
        return result;
    }

    static String formatTimeLeft(Instant expiresAt, Instant now) {
        if (expiresAt == null) {
            return "unknown";
        }
        Duration left = Duration.between(now, expiresAt);
        if (left.isNegative()) {
            return "expired";
        }
        long days = left.toDays();
        int hours = left.toHoursPart();
        int minutes = left.toMinutesPart();
        if (days > 0) {
            return days + "d " + hours + "h " + minutes + "m";
        }
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        return minutes + "m";
    }

    private static String mentions(ReminderTemplate template) {
        List<String> parts = new ArrayList<>();
        if (template.getPingRoles() != null) {
            template.getPingRoles().forEach(role -> parts.add("<@&" + role + ">"));
        }
        if (template.getPingUsers() != null) {
            template.getPingUsers().forEach(user -> parts.add("<@" + user + ">"));
        }
        return String.join(" ", parts);
    }
}
