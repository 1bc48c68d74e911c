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
import me.golemcore.planner.domain.exception.RateLimitException;
import me.golemcore.planner.domain.exception.TransientExternalException;
import me.golemcore.planner.domain.model.FreeSlot;
import me.golemcore.planner.domain.model.Interval;
import me.golemcore.planner.infrastructure.config.BotProperties;
import me.golemcore.planner.port.outbound.CalendarPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Free-slot search and conflict checks across the calendars of several users.
 *
 * <p>
 * Busy sets are fetched per identity through {@link CalendarPort} and unioned
 * before the pure computation in {@link AvailabilityService}. A throttled
 * provider gets one backoff and one retry. Auth failures are never retried.
 */
@Service
@Slf4j
public class CalendarAvailabilityService {

    private final AvailabilityService availabilityService;
    private final CalendarPort calendarPort;
    private final UserPreferencesService preferencesService;
    private final BotProperties properties;

    public CalendarAvailabilityService(AvailabilityService availabilityService, CalendarPort calendarPort,
            UserPreferencesService preferencesService, BotProperties properties) {
        this.availabilityService = availabilityService;
        this.calendarPort = calendarPort;
        this.preferencesService = preferencesService;
        this.properties = properties;
    }

    /**
     * Find slots in {@code window} where every user in {@code userIds} is free.
     */
    public List<FreeSlot> findFreeSlots(Collection<String> userIds, Interval window, Duration minDuration) {
        Duration effective = minDuration != null ? minDuration
                : properties.getAvailability().getDefaultMinDuration();
        Set<Interval> busy = collectBusy(userIds, window);
        List<FreeSlot> slots = availabilityService.freeSlots(busy, window, effective);
        log.debug("[Availability] {} users, {} busy intervals, {} free slots", userIds.size(), busy.size(),
                slots.size());
        return slots;
    }

    /**
     * Busy intervals of any of the users that overlap {@code candidate}.
     */
    public List<Interval> findConflicts(Collection<String> userIds, Interval candidate) {
        return collectBusy(userIds, candidate).stream()
                .filter(candidate::overlaps)
                .sorted(Comparator.comparing(Interval::start))
                .toList();
    }

    public boolean hasConflict(Collection<String> userIds, Interval candidate) {
        return availabilityService.overlaps(candidate, collectBusy(userIds, candidate));
    }

    private Set<Interval> collectBusy(Collection<String> userIds, Interval window) {
        if (userIds == null || userIds.isEmpty()) {
            throw new InvalidArgumentException("At least one user is required");
        }
        if (window == null) {
            throw new InvalidArgumentException("Window is required");
        }
        Set<String> identities = new LinkedHashSet<>();
        for (String userId : userIds) {
            identities.add(preferencesService.resolveCalendarIdentity(userId));
        }
        Set<Interval> busy = new HashSet<>();
        for (String identity : identities) {
            busy.addAll(fetchWithRetry(identity, window));
        }
        return busy;
    }

    private Set<Interval> fetchWithRetry(String identity, Interval window) {
        try {
            return calendarPort.getBusyIntervals(identity, window);
        } catch (RateLimitException e) {
            Duration backoff = properties.getAvailability().getRateLimitBackoff();
            log.warn("[Availability] Calendar rate limited for {}, retrying in {}ms", identity,
                    backoff.toMillis());
            sleepBeforeRetry(backoff);
            return calendarPort.getBusyIntervals(identity, window);
        }
    }

    void sleepBeforeRetry(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientExternalException("Interrupted while waiting for calendar rate limit", e);
        }
    }
}
