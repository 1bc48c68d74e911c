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
import me.golemcore.planner.domain.exception.NotFoundException;
import me.golemcore.planner.domain.exception.StorageException;
import me.golemcore.planner.domain.model.ReminderPriority;
import me.golemcore.planner.domain.model.ReminderTemplate;
import me.golemcore.planner.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Named reminder message templates stored in {@code reminders/templates.json}.
 * The built-in templates are seeded the first time the store is empty.
 */
@Service
@Slf4j
public class ReminderTemplateService {

    public static final String SYSTEM_CREATOR = "0";

    private static final String REMINDERS_DIR = "reminders";
    private static final String TEMPLATES_FILE = "templates.json";
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9_-]{1,64}$");
    private static final TypeReference<List<ReminderTemplate>> TEMPLATE_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private Map<String, ReminderTemplate> templates;

    public ReminderTemplateService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public synchronized ReminderTemplate createTemplate(String name, String description, String messageTemplate,
            ReminderPriority priority, String creatorId, List<String> pingRoles, List<String> pingUsers) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        if (!NAME_PATTERN.matcher(normalized).matches()) {
            throw new InvalidArgumentException("Template name must be 1-64 chars of [a-z0-9_-]");
        }
        if (messageTemplate == null || messageTemplate.isBlank()) {
            throw new InvalidArgumentException("Template message is required");
        }
        Map<String, ReminderTemplate> current = loaded();
        if (current.containsKey(normalized)) {
            throw new InvalidArgumentException("Template already exists: " + normalized);
        }

        ReminderTemplate template = ReminderTemplate.builder()
                .name(normalized)
                .description(description)
                .messageTemplate(messageTemplate)
                .priority(priority != null ? priority : ReminderPriority.INFORMATIONAL)
                .createdBy(creatorId)
                .pingRoles(pingRoles != null ? new ArrayList<>(pingRoles) : new ArrayList<>())
                .pingUsers(pingUsers != null ? new ArrayList<>(pingUsers) : new ArrayList<>())
                .createdAt(clock.instant())
                .build();
        current.put(normalized, template);
        try {
            persist(current);
        } catch (StorageException e) {
            current.remove(normalized);
            throw e;
        }
        log.info("[Templates] Created template {} by {}", normalized, creatorId);
        return template;
    }

    public synchronized Optional<ReminderTemplate> findTemplate(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(loaded().get(name.trim().toLowerCase(Locale.ROOT)));
    }

    public ReminderTemplate getTemplate(String name) {
        return findTemplate(name).orElseThrow(() -> new NotFoundException("Template not found: " + name));
    }

    /**
     * List templates sorted by name. With a creator, only built-ins and that
     * creator's templates are returned.
     */
    public synchronized List<ReminderTemplate> listTemplates(String creatorId) {
        return loaded().values().stream()
                .filter(template -> creatorId == null
                        || SYSTEM_CREATOR.equals(template.getCreatedBy())
                        || creatorId.equals(template.getCreatedBy()))
                .sorted(Comparator.comparing(ReminderTemplate::getName))
                .toList();
    }

    private Map<String, ReminderTemplate> loaded() {
        if (templates == null) {
            templates = load();
            if (templates.isEmpty()) {
                seedDefaults(templates);
            }
        }
        return templates;
    }

    private Map<String, ReminderTemplate> load() {
        String json = StorageSupport.join(storagePort.readDocument(REMINDERS_DIR, TEMPLATES_FILE), "read templates");
        Map<String, ReminderTemplate> result = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return result;
        }
        try {
            for (ReminderTemplate template : objectMapper.readValue(json, TEMPLATE_LIST_TYPE_REF)) {
                result.put(template.getName(), template);
            }
        } catch (JsonProcessingException e) {
            throw new StorageException("Templates file is unreadable", e);
        }
        return result;
    }

    private void seedDefaults(Map<String, ReminderTemplate> target) {
        Instant now = clock.instant();
        for (ReminderTemplate template : defaultTemplates(now)) {
            target.put(template.getName(), template);
        }
        try {
            persist(target);
            log.info("[Templates] Seeded {} default templates", target.size());
        } catch (StorageException e) {
            // Defaults stay in memory and are written with the next successful save
            log.warn("[Templates] Failed to persist default templates: {}", e.getMessage());
        }
    }

    private void persist(Map<String, ReminderTemplate> current) {
        String json;
        try {
            json = objectMapper.writeValueAsString(new ArrayList<>(current.values()));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize templates", e);
        }
        StorageSupport.join(storagePort.writeDocument(REMINDERS_DIR, TEMPLATES_FILE, json, true),
                "write templates");
    }

    static List<ReminderTemplate> defaultTemplates(Instant now) {
        return List.of(
                builtIn("poll_reminder", "Standard poll reminder",
                        "Don't forget to vote in the poll: **{poll_title}**\nTime left: {time_left}\n"
                                + "Poll ID: {poll_id}",
                        ReminderPriority.URGENT, now),
                builtIn("poll_urgent", "Final call before a poll closes",
                        "**FINAL CALL** - poll closing soon!\nPoll: **{poll_title}**\nTime left: {time_left}\n"
                                + "Vote now: poll ID `{poll_id}`",
                        ReminderPriority.VERY_URGENT, now),
                builtIn("event_reminder", "General event reminder",
                        "Upcoming event: **{event_title}**\nStarting soon!\nEvent ID: {event_id}",
                        ReminderPriority.INFORMATIONAL, now),
                builtIn("meeting_reminder", "Meeting reminder with details",
                        "Meeting reminder: **{meeting_title}**\nTime: {meeting_time}\nLocation: {meeting_location}\n"
                                + "Agenda: {meeting_agenda}",
                        ReminderPriority.URGENT, now),
                builtIn("task_reminder", "Task deadline reminder",
                        "Task reminder: **{task_title}**\nDeadline: {deadline}\nDescription: {description}\n"
                                + "Assigned to: {assigned_to}",
                        ReminderPriority.URGENT, now));
    }

    private static ReminderTemplate builtIn(String name, String description, String text,
            ReminderPriority priority, Instant now) {
        return ReminderTemplate.builder()
                .name(name)
                .description(description)
                .messageTemplate(text)
                .priority(priority)
                .createdBy(SYSTEM_CREATOR)
                .createdAt(now)
                .build();
    }
}
