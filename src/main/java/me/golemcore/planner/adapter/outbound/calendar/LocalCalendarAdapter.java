package me.golemcore.planner.adapter.outbound.calendar;

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

import me.golemcore.planner.domain.model.CalendarEvent;
import me.golemcore.planner.domain.model.Interval;
import me.golemcore.planner.port.outbound.CalendarEventStorePort;
import me.golemcore.planner.port.outbound.CalendarPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Default calendar provider: a user is busy during the bot events they
 * created or attend.
 */
@Component
@ConditionalOnProperty(name = "bot.calendar.google.enabled", havingValue = "false", matchIfMissing = true)
public class LocalCalendarAdapter implements CalendarPort {

    private final CalendarEventStorePort eventStore;

    public LocalCalendarAdapter(CalendarEventStorePort eventStore) {
        this.eventStore = eventStore;
    }

    @Override
    public Set<Interval> getBusyIntervals(String identity, Interval window) {
        return eventStore.findAll().stream()
                .filter(event -> event.involves(identity))
                .map(CalendarEvent::toInterval)
                .filter(window::overlaps)
                .collect(Collectors.toSet());
    }
}
