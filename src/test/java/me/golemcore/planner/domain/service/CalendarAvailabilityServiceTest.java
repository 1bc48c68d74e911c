package me.golemcore.planner.domain.service;

import me.golemcore.planner.domain.exception.CalendarAuthException;
import me.golemcore.planner.domain.exception.InvalidArgumentException;
import me.golemcore.planner.domain.exception.RateLimitException;
import me.golemcore.planner.domain.model.FreeSlot;
import me.golemcore.planner.domain.model.Interval;
import me.golemcore.planner.infrastructure.config.BotProperties;
import me.golemcore.planner.port.outbound.CalendarPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CalendarAvailabilityServiceTest {

    private CalendarPort calendarPort;
    private UserPreferencesService preferencesService;
    private BotProperties properties;
    private List<Duration> sleeps;
    private CalendarAvailabilityService service;

    private static Instant at(String hhmm) {
        return Instant.parse("2026-03-02T" + hhmm + ":00Z");
    }

    private static Interval range(String from, String to) {
        return Interval.of(at(from), at(to));
    }

    @BeforeEach
    void setUp() {
        calendarPort = mock(CalendarPort.class);
        preferencesService = mock(UserPreferencesService.class);
        when(preferencesService.resolveCalendarIdentity(anyString()))
                .thenAnswer(invocation -> invocation.getArgument(0));
        properties = new BotProperties();
        sleeps = new ArrayList<>();
        service = new CalendarAvailabilityService(new AvailabilityService(), calendarPort, preferencesService,
                properties) {
            @Override
            void sleepBeforeRetry(Duration backoff) {
                sleeps.add(backoff);
            }
        };
    }

    @Test
    void shouldUnionBusyTimeOfAllUsers() {
        when(calendarPort.getBusyIntervals(eq("alice"), any())).thenReturn(Set.of(range("10:00", "11:00")));
        when(calendarPort.getBusyIntervals(eq("bob"), any())).thenReturn(Set.of(range("10:30", "12:00")));

        List<FreeSlot> slots = service.findFreeSlots(List.of("alice", "bob"), range("09:00", "13:00"),
                Duration.ofMinutes(30));

        assertEquals(List.of(range("09:00", "10:00"), range("12:00", "13:00")),
                slots.stream().map(FreeSlot::interval).toList());
    }

    @Test
    void shouldUseDefaultMinimumDurationWhenAbsent() {
        properties.getAvailability().setDefaultMinDuration(Duration.ofMinutes(90));
        when(calendarPort.getBusyIntervals(eq("alice"), any())).thenReturn(Set.of(range("10:00", "11:00")));

        List<FreeSlot> slots = service.findFreeSlots(List.of("alice"), range("09:00", "13:00"), null);

        assertEquals(List.of(range("11:00", "13:00")), slots.stream().map(FreeSlot::interval).toList());
    }

    @Test
    void shouldFetchLinkedIdentityOnce() {
        when(preferencesService.resolveCalendarIdentity("alice")).thenReturn("team@example.com");
        when(preferencesService.resolveCalendarIdentity("bob")).thenReturn("team@example.com");
        when(calendarPort.getBusyIntervals(eq("team@example.com"), any())).thenReturn(Set.of());

        service.findFreeSlots(List.of("alice", "bob"), range("09:00", "13:00"), Duration.ofMinutes(30));

        verify(calendarPort, times(1)).getBusyIntervals(eq("team@example.com"), any());
    }

    @Test
    void shouldRetryOnceAfterRateLimit() {
        properties.getAvailability().setRateLimitBackoff(Duration.ofMillis(250));
        when(calendarPort.getBusyIntervals(eq("alice"), any()))
                .thenThrow(new RateLimitException("slow down"))
                .thenReturn(Set.of(range("10:00", "11:00")));

        List<FreeSlot> slots = service.findFreeSlots(List.of("alice"), range("09:00", "12:00"),
                Duration.ofMinutes(30));

        assertEquals(2, slots.size());
        assertEquals(List.of(Duration.ofMillis(250)), sleeps);
    }

    @Test
    void shouldPropagateSecondRateLimit() {
        when(calendarPort.getBusyIntervals(eq("alice"), any()))
                .thenThrow(new RateLimitException("slow down"))
                .thenThrow(new RateLimitException("still slow"));

        assertThrows(RateLimitException.class,
                () -> service.findFreeSlots(List.of("alice"), range("09:00", "12:00"), Duration.ofMinutes(30)));
    }

    @Test
    void shouldNotRetryAuthFailure() {
        when(calendarPort.getBusyIntervals(eq("alice"), any())).thenThrow(new CalendarAuthException("revoked"));

        assertThrows(CalendarAuthException.class,
                () -> service.findFreeSlots(List.of("alice"), range("09:00", "12:00"), Duration.ofMinutes(30)));
        verify(calendarPort, times(1)).getBusyIntervals(eq("alice"), any());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldReportConflictsSortedByStart() {
        when(calendarPort.getBusyIntervals(eq("alice"), any()))
                .thenReturn(Set.of(range("11:30", "12:30"), range("09:30", "10:15")));

        List<Interval> conflicts = service.findConflicts(List.of("alice"), range("10:00", "12:00"));

        assertEquals(List.of(range("09:30", "10:15"), range("11:30", "12:30")), conflicts);
        assertTrue(service.hasConflict(List.of("alice"), range("10:00", "12:00")));
    }

    @Test
    void touchingBusyIntervalIsNotAConflict() {
        when(calendarPort.getBusyIntervals(eq("alice"), any())).thenReturn(Set.of(range("09:00", "10:00")));

        assertFalse(service.hasConflict(List.of("alice"), range("10:00", "11:00")));
    }

    @Test
    void shouldRejectEmptyUserList() {
        assertThrows(InvalidArgumentException.class,
                () -> service.findFreeSlots(List.of(), range("09:00", "12:00"), Duration.ofMinutes(30)));
    }
}
