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

import me.golemcore.planner.domain.exception.InvalidRangeException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Half-open time range {@code [start, end)}. Zero-length and inverted ranges
 * are rejected at construction.
 */
public record Interval(Instant start, Instant end) {

    public Interval {
        if (start == null || end == null) {
            throw new InvalidRangeException("Interval bounds must not be null");
        }
        if (!start.isBefore(end)) {
            throw new InvalidRangeException("Interval start must be before end: " + start + " >= " + end);
        }
    }

    public static Interval of(Instant start, Instant end) {
        return new Interval(start, end);
    }

    public static Interval of(Instant start, Duration length) {
        return new Interval(start, start.plus(length));
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    /**
     * True iff the two ranges share a non-empty open intersection. Touching
     * ranges do not overlap.
     */
    public boolean overlaps(Interval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean contains(Interval other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    /**
     * Clip this range to the window bounds.
     *
     * @return the clipped range, or empty if nothing of it lies inside the window
     */
    public Optional<Interval> clipTo(Interval window) {
        if (!overlaps(window)) {
            return Optional.empty();
        }
        Instant clippedStart = start.isBefore(window.start) ? window.start : start;
        Instant clippedEnd = end.isAfter(window.end) ? window.end : end;
        return Optional.of(new Interval(clippedStart, clippedEnd));
    }
}
