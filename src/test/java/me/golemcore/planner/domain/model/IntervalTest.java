package me.golemcore.planner.domain.model;

import me.golemcore.planner.domain.exception.InvalidRangeException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntervalTest {

    private static Instant at(String hhmm) {
        return Instant.parse("2026-03-02T" + hhmm + ":00Z");
    }

    @Test
    void shouldRejectZeroLengthAndInvertedRanges() {
        assertThrows(InvalidRangeException.class, () -> Interval.of(at("10:00"), at("10:00")));
        assertThrows(InvalidRangeException.class, () -> Interval.of(at("11:00"), at("10:00")));
        assertThrows(InvalidRangeException.class, () -> Interval.of(null, at("10:00")));
    }

    @Test
    void touchingRangesShouldNotOverlap() {
        Interval morning = Interval.of(at("09:00"), at("10:00"));
        Interval next = Interval.of(at("10:00"), at("11:00"));

        assertFalse(morning.overlaps(next));
        assertFalse(next.overlaps(morning));
    }

    @Test
    void shouldDetectPartialAndNestedOverlap() {
        Interval outer = Interval.of(at("09:00"), at("12:00"));

        assertTrue(outer.overlaps(Interval.of(at("11:59"), at("13:00"))));
        assertTrue(outer.overlaps(Interval.of(at("10:00"), at("10:30"))));
        assertTrue(outer.contains(Interval.of(at("10:00"), at("10:30"))));
    }

    @Test
    void containsInstantShouldExcludeEnd() {
        Interval interval = Interval.of(at("09:00"), at("10:00"));

        assertTrue(interval.contains(at("09:00")));
        assertFalse(interval.contains(at("10:00")));
    }

    @Test
    void clipToShouldTrimToWindow() {
        Interval window = Interval.of(at("09:00"), at("17:00"));

        assertEquals(Interval.of(at("09:00"), at("10:00")),
                Interval.of(at("08:00"), at("10:00")).clipTo(window).orElseThrow());
        assertTrue(Interval.of(at("17:00"), at("18:00")).clipTo(window).isEmpty());
    }

    @Test
    void ofDurationShouldComputeEnd() {
        Interval interval = Interval.of(at("09:00"), Duration.ofMinutes(45));

        assertEquals(at("09:45"), interval.end());
        assertEquals(Duration.ofMinutes(45), interval.duration());
    }
}
