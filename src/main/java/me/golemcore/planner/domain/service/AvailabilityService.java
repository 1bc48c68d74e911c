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
import me.golemcore.planner.domain.exception.InvalidRangeException;
import me.golemcore.planner.domain.model.FreeSlot;
import me.golemcore.planner.domain.model.Interval;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Free-slot computation over half-open {@code [start, end)} intervals.
 *
 * <p>
 * Busy intervals are clipped to the query window, sorted and merged with a
 * single sweep. Touching intervals ({@code next.start == current.end}) merge,
 * so no zero-length gap is ever reported. The free slots are the complement of
 * the merged cover inside the window, filtered by a minimum duration.
 *
 * <p>
 * Stateless and side-effect free. Safe for concurrent use.
 */
@Service
public class AvailabilityService {

    private static final Comparator<Interval> BY_START_THEN_END = Comparator
            .comparing(Interval::start)
            .thenComparing(Interval::end);

    /**
     * Compute free slots inside {@code window} of at least {@code minDuration}.
     *
     * @return slots in chronological order, pairwise disjoint and non-touching
     */
    public List<FreeSlot> freeSlots(Collection<Interval> busy, Interval window, Duration minDuration) {
        if (window == null) {
            throw new InvalidArgumentException("Window is required");
        }
        requirePositive(minDuration);

        List<FreeSlot> slots = new ArrayList<>();
        Instant cursor = window.start();
        for (Interval merged : mergeBusy(busy, window)) {
            addIfLongEnough(slots, cursor, merged.start(), minDuration);
            cursor = merged.end();
        }
        addIfLongEnough(slots, cursor, window.end(), minDuration);
        return slots;
    }

    public List<FreeSlot> freeSlots(Collection<Interval> busy, Instant windowStart, Instant windowEnd,
            Duration minDuration) {
        if (windowStart == null || windowEnd == null || !windowStart.isBefore(windowEnd)) {
            throw new InvalidRangeException("Window start must be before window end");
        }
        return freeSlots(busy, new Interval(windowStart, windowEnd), minDuration);
    }

    /**
     * Merge the busy intervals that overlap {@code window} into a sorted,
     * disjoint cover clipped to the window.
     */
    public List<Interval> mergeBusy(Collection<Interval> busy, Interval window) {
        if (busy == null || busy.isEmpty()) {
            return List.of();
        }
        List<Interval> clipped = busy.stream()
                .map(interval -> interval.clipTo(window))
                .flatMap(Optional::stream)
                .sorted(BY_START_THEN_END)
                .toList();

        List<Interval> merged = new ArrayList<>();
        Instant currentStart = null;
        Instant currentEnd = null;
        for (Interval interval : clipped) {
            if (currentStart == null) {
                currentStart = interval.start();
                currentEnd = interval.end();
            } else if (!interval.start().isAfter(currentEnd)) {
                if (interval.end().isAfter(currentEnd)) {
                    currentEnd = interval.end();
                }
            } else {
                merged.add(new Interval(currentStart, currentEnd));
                currentStart = interval.start();
                currentEnd = interval.end();
            }
        }
        if (currentStart != null) {
            merged.add(new Interval(currentStart, currentEnd));
        }
        return merged;
    }

    /**
     * @return true iff any busy interval shares a non-empty open intersection
     *         with {@code candidate}
     */
    public boolean overlaps(Interval candidate, Collection<Interval> busy) {
        if (candidate == null) {
            throw new InvalidArgumentException("Candidate interval is required");
        }
        if (busy == null) {
            return false;
        }
        return busy.stream().anyMatch(candidate::overlaps);
    }

    private static void addIfLongEnough(List<FreeSlot> slots, Instant start, Instant end, Duration minDuration) {
        if (!start.isBefore(end)) {
            return;
        }
        Interval gap = new Interval(start, end);
        if (gap.duration().compareTo(minDuration) >= 0) {
            slots.add(FreeSlot.of(gap));
        }
    }

    private static void requirePositive(Duration minDuration) {
        if (minDuration == null || minDuration.isZero() || minDuration.isNegative()) {
            throw new InvalidArgumentException("Minimum duration must be positive");
        }
    }
}
