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
import me.golemcore.planner.domain.model.CalendarEvent;
import me.golemcore.planner.domain.service.StorageSupport;
import me.golemcore.planner.port.outbound.CalendarEventStorePort;
import me.golemcore.planner.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Calendar events stored as one JSON document in {@code calendar/events.json}.
 */
@Component
public class JsonCalendarEventStore implements CalendarEventStorePort {

    private static final String CALENDAR_DIR = "calendar";
    private static final String EVENTS_FILE = "events.json";
    private static final TypeReference<List<CalendarEvent>> EVENT_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private Map<String, CalendarEvent> events;

    public JsonCalendarEventStore(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void save(CalendarEvent event) {
        Map<String, CalendarEvent> current = loaded();
        CalendarEvent previous = current.put(event.getId(), event);
        try {
            persist(current);
        } catch (StorageException e) {
            if (previous == null) {
                current.remove(event.getId());
            } else {
                current.put(event.getId(), previous);
            }
            throw e;
        }
    }

    @Override
    public synchronized Optional<CalendarEvent> findById(String eventId) {
        return Optional.ofNullable(loaded().get(eventId));
    }

    @Override
    public synchronized List<CalendarEvent> findAll() {
        return new ArrayList<>(loaded().values());
    }

    @Override
    public synchronized boolean delete(String eventId) {
        Map<String, CalendarEvent> current = loaded();
        CalendarEvent removed = current.remove(eventId);
        if (removed == null) {
            return false;
        }
        try {
            persist(current);
        } catch (StorageException e) {
            current.put(eventId, removed);
            throw e;
        }
        return true;
    }

    private Map<String, CalendarEvent> loaded() {
        if (events == null) {
            events = load();
        }
        return events;
    }

    private Map<String, CalendarEvent> load() {
        String json = StorageSupport.join(storagePort.readDocument(CALENDAR_DIR, EVENTS_FILE), "read events");
        Map<String, CalendarEvent> result = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return result;
        }
        try {
            for (CalendarEvent event : objectMapper.readValue(json, EVENT_LIST_TYPE_REF)) {
                result.put(event.getId(), event);
            }
        } catch (JsonProcessingException e) {
            throw new StorageException("Events file is unreadable", e);
        }
        return result;
    }

    private void persist(Map<String, CalendarEvent> current) {
        String json;
        try {
            json = objectMapper.writeValueAsString(new ArrayList<>(current.values()));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize events", e);
        }
        StorageSupport.join(storagePort.writeDocument(CALENDAR_DIR, EVENTS_FILE, json, true), "write events");
    }
}
