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
import me.golemcore.planner.domain.exception.StorageException;
import me.golemcore.planner.domain.model.UserPreferences;
import me.golemcore.planner.infrastructure.i18n.MessageService;
import me.golemcore.planner.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Per-user preferences: language, timezone, linked calendar and free-form
 * key/value settings. Each user has one document in
 * {@code preferences/<userId>.json}, cached after the first read.
 */
@Service
@Slf4j
public class UserPreferencesService {

    private static final String PREFERENCES_DIR = "preferences";
    private static final Pattern CALENDAR_ID_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern USER_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_.-]+$");

    private final StoragePort storagePort;
    private final MessageService messageService;
    private final ObjectMapper objectMapper;
    private final Map<String, UserPreferences> cache = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public UserPreferencesService(StoragePort storagePort, MessageService messageService,
            ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.messageService = messageService;
        this.objectMapper = objectMapper;
    }

    /**
     * Get a copy of the user's preferences, defaults if none were saved.
     */
    public UserPreferences getPreferences(String userId) {
        return copy(loaded(userId));
    }

    public String getLanguage(String userId) {
        return loaded(userId).getLanguage();
    }

    public ZoneId getZone(String userId) {
        try {
            return ZoneId.of(loaded(userId).getTimezone());
        } catch (DateTimeException e) {
            return ZoneId.of("UTC");
        }
    }

    public String getPreference(String userId, String key, String defaultValue) {
        return loaded(userId).getCustom().getOrDefault(key, defaultValue);
    }

    public void setPreference(String userId, String key, String value) {
        if (key == null || key.isBlank()) {
            throw new InvalidArgumentException("Preference key is required");
        }
        update(userId, prefs -> prefs.getCustom().put(key, value));
    }

    /**
     * @return true if the key existed
     */
    public boolean removePreference(String userId, String key) {
        if (!loaded(userId).getCustom().containsKey(key)) {
            return false;
        }
        update(userId, prefs -> prefs.getCustom().remove(key));
        return true;
    }

    public void clearPreferences(String userId) {
        update(userId, prefs -> {
            prefs.getCustom().clear();
            prefs.setLanguage(MessageService.DEFAULT_LANG);
            prefs.setTimezone("UTC");
            prefs.setCalendarId(null);
        });
    }

    public void setLanguage(String userId, String language) {
        if (!messageService.isSupported(language)) {
            throw new InvalidArgumentException("Unsupported language: " + language + ", use one of "
                    + String.join(", ", messageService.getSupportedLanguages()));
        }
        update(userId, prefs -> prefs.setLanguage(language));
    }

    public void setTimezone(String userId, String timezone) {
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException | NullPointerException e) {
            throw new InvalidArgumentException("Unknown timezone: " + timezone);
        }
        update(userId, prefs -> prefs.setTimezone(timezone));
    }

    public void linkCalendar(String userId, String calendarId) {
        if (calendarId == null || !CALENDAR_ID_PATTERN.matcher(calendarId).matches()) {
            throw new InvalidArgumentException("Calendar id must look like an email address");
        }
        update(userId, prefs -> prefs.setCalendarId(calendarId));
    }

    /**
     * The identity used for calendar lookups: the linked calendar id if one is
     * set, else the user id itself.
     */
    public String resolveCalendarIdentity(String userId) {
        String calendarId = loaded(userId).getCalendarId();
        return calendarId != null && !calendarId.isBlank() ? calendarId : userId;
    }

    /**
     * Get a localized message in the user's language.
     */
    public String getMessage(String userId, String key, Object... args) {
        return messageService.getMessage(key, getLanguage(userId), args);
    }

    private void update(String userId, Consumer<UserPreferences> change) {
        validateUserId(userId);
        synchronized (lockFor(userId)) {
            UserPreferences previous = loaded(userId);
            UserPreferences updated = copy(previous);
            change.accept(updated);
            cache.put(userId, updated);
            try {
                persist(updated);
            } catch (StorageException e) {
                cache.put(userId, previous);
                log.error("[Preferences] Failed to save preferences for {}, rolled back", userId, e);
                throw e;
            }
        }
    }

    private Object lockFor(String userId) {
        return locks.computeIfAbsent(userId, id -> new Object());
    }

    private UserPreferences loaded(String userId) {
        validateUserId(userId);
        return cache.computeIfAbsent(userId, this::load);
    }

    private UserPreferences load(String userId) {
        String json = StorageSupport.join(storagePort.readDocument(PREFERENCES_DIR, fileName(userId)),
                "read preferences");
        if (json == null || json.isBlank()) {
            return UserPreferences.builder().userId(userId).build();
        }
        try {
            UserPreferences prefs = objectMapper.readValue(json, UserPreferences.class);
            if (prefs.getCustom() == null) {
                prefs.setCustom(new HashMap<>());
            }
            return prefs;
        } catch (JsonProcessingException e) {
            log.warn("[Preferences] Unreadable preferences for {}, using defaults: {}", userId,
                    e.getOriginalMessage());
            return UserPreferences.builder().userId(userId).build();
        }
    }

    private void persist(UserPreferences prefs) {
        String json;
        try {
            json = objectMapper.writeValueAsString(prefs);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize preferences", e);
        }
        StorageSupport.join(storagePort.writeDocument(PREFERENCES_DIR, fileName(prefs.getUserId()), json, false),
                "write preferences");
        log.debug("[Preferences] Saved preferences for {}", prefs.getUserId());
    }

    private static String fileName(String userId) {
        return userId + ".json";
    }

    private static void validateUserId(String userId) {
        if (userId == null || !USER_ID_PATTERN.matcher(userId).matches()) {
            throw new InvalidArgumentException("Invalid user id");
        }
    }

    private static UserPreferences copy(UserPreferences prefs) {
        return UserPreferences.builder()
                .userId(prefs.getUserId())
                .language(prefs.getLanguage())
                .timezone(prefs.getTimezone())
                .calendarId(prefs.getCalendarId())
                .custom(new HashMap<>(prefs.getCustom()))
                .build();
    }
}
