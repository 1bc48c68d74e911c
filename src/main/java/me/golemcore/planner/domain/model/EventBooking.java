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

import java.util.List;

/**
 * Outcome of an event creation request: the stored event, or the busy
 * intervals that blocked it.
 */
public record EventBooking(CalendarEvent event, List<Interval> conflicts) {

    public static EventBooking created(CalendarEvent event, List<Interval> conflicts) {
        return new EventBooking(event, List.copyOf(conflicts));
    }

    public static EventBooking refused(List<Interval> conflicts) {
        return new EventBooking(null, List.copyOf(conflicts));
    }

    public boolean isCreated() {
        return event != null;
    }
}
