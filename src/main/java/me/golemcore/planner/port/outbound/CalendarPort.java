package me.golemcore.planner.port.outbound;

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

import me.golemcore.planner.domain.model.Interval;

import java.util.Set;

/**
 * Source of busy intervals for a calendar identity.
 */
public interface CalendarPort {

    /**
     * Busy intervals of {@code identity} that intersect {@code window}. Intervals
     * may extend beyond the window.
     *
     * @throws me.golemcore.planner.domain.exception.CalendarAuthException
     *             if credentials were revoked or expired
     * @throws me.golemcore.planner.domain.exception.RateLimitException
     *             if the provider throttled the request
     */
    Set<Interval> getBusyIntervals(String identity, Interval window);
}
