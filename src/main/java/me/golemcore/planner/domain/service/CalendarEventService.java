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
import me.golemcore.planner.domain.exception.PermissionDeniedException;
import me.golemcore.planner.domain.model.CalendarEvent;
import me.golemcore.planner.domain.model.EventBooking;
import me.golemcore.planner.domain.model.Interval;
import me.golemcore.planner.port.outbound.CalendarEventStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Events created through the bot. New events are checked against the busy
 * time of the creator and every attendee first.
 */
@Service
@Slf4j
public class CalendarEventService {

    private static final int MAX_TITLE_LENGTH = 200;

    private final CalendarEventStorePort eventStore;
    private final CalendarAvailabilityService availabilityService;
    private final Clock clock;

    public CalendarEventService(CalendarEventStorePort eventStore, CalendarAvailabilityService availabilityService,
            Clock clock) {
        this.eventStore = eventStore;
        this.availabilityService = availabilityService;
        this.clock = clock;
    }

    /**
     * Create an event unless it conflicts with a participant's busy time.
     *
     * @param force
     *            create the event even when there are conflicts
     */
    public EventBooking createEvent(String creatorId, String title, Interval interval, List<String> attendees,
            String location, String description, boolean force) {
        if (creatorId == null || creatorId.isBlank()) {
            throw new InvalidArgumentException("Creator is required");
        }
        if (title == null || title.isBlank() || title.length() > MAX_TITLE_LENGTH) {
            throw new InvalidArgumentException("Title must be 1-" + MAX_TITLE_LENGTH + " characters");
        }
        if (interval == null) {
            throw new InvalidArgumentException("Event time is required");
        }

        Set<String> participants = new LinkedHashSet<>();
        participants.add(creatorId);
        if (attendees != null) {
            participants.addAll(attendees);
        }
        List<Interval> conflicts = availabilityService.findConflicts(participants, interval);
        if (!conflicts.isEmpty() && !force) {
            log.info("[Calendar] Refused event '{}' for {}: {} conflicts", title, creatorId, conflicts.size());
            return EventBooking.refused(conflicts);
        }

        List<String> others = new ArrayList<>(participants);
        others.remove(creatorId);
        CalendarEvent event = CalendarEvent.builder()
                .id("evt-" + UUID.randomUUID().toString().substring(0, 8))
                .title(title.trim())
                .description(description)
                .location(location)
                .startTime(interval.start())
                .endTime(interval.end())
                .createdBy(creatorId)
                .attendees(others)
                .createdAt(clock.instant())
                .build();
        eventStore.save(event);
        log.info("[Calendar] Created event {} '{}' at {}", event.getId(), event.getTitle(), interval.start());
        return EventBooking.created(event, conflicts);
    }

    /**
     * Events the user created or attends that overlap {@code window}, by start.
     */
    public List<CalendarEvent> listEvents(String userId, Interval window) {
        return eventStore.findAll().stream()
                .filter(event -> event.involves(userId))
                .filter(event -> window == null || event.toInterval().overlaps(window))
                .sorted(Comparator.comparing(CalendarEvent::getStartTime))
                .toList();
    }

    public void deleteEvent(String eventId, String requesterId, boolean elevated) {
        CalendarEvent event = eventStore.findById(eventId)
                .orElseThrow(() -> new NotFoundException("Event not found: " + eventId));
        if (!elevated && !event.getCreatedBy().equals(requesterId)) {
            throw new PermissionDeniedException("Only the event creator or an administrator can delete it");
        }
        eventStore.delete(eventId);
        log.info("[Calendar] Deleted event {}", eventId);
    }
}
