package me.golemcore.planner.adapter.inbound.web.controller;

import me.golemcore.planner.domain.model.CalendarEvent;
import me.golemcore.planner.domain.model.EventBooking;
import me.golemcore.planner.domain.model.FreeSlot;
import me.golemcore.planner.domain.model.Interval;
import me.golemcore.planner.domain.service.CalendarAvailabilityService;
import me.golemcore.planner.domain.service.CalendarEventService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AvailabilityControllerTest {

    private static final String USER = "111";
    private static final Instant T09 = Instant.parse("2026-03-04T09:00:00Z");
    private static final Instant T10 = Instant.parse("2026-03-04T10:00:00Z");
    private static final Instant T11 = Instant.parse("2026-03-04T11:00:00Z");
    private static final Instant T17 = Instant.parse("2026-03-04T17:00:00Z");

    private CalendarAvailabilityService availabilityService;
    private CalendarEventService eventService;
    private AvailabilityController controller;

    @BeforeEach
    void setUp() {
        availabilityService = mock(CalendarAvailabilityService.class);
        eventService = mock(CalendarEventService.class);
        controller = new AvailabilityController(availabilityService, eventService);
    }

    @Test
    void freeSlotsShouldReturnSlotsWithDuration() {
        when(availabilityService.findFreeSlots(Set.of("a", "b"), Interval.of(T09, T17), Duration.ofMinutes(30)))
                .thenReturn(List.of(FreeSlot.of(Interval.of(T09, T11))));
        AvailabilityController.FreeSlotsRequest request = new AvailabilityController.FreeSlotsRequest(
                List.of("a", "b", "a"), T09, T17, Duration.ofMinutes(30));

        StepVerifier.create(controller.findFreeSlots(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    List<AvailabilityController.SlotDto> body = response.getBody();
                    assertNotNull(body);
                    assertEquals(1, body.size());
                    assertEquals(T09, body.get(0).start());
                    assertEquals(120, body.get(0).durationMinutes());
                })
                .verifyComplete();
    }

    @Test
    void freeSlotsShouldRequireUsersAndBounds() {
        assertThrows(ResponseStatusException.class, () -> controller.findFreeSlots(
                new AvailabilityController.FreeSlotsRequest(List.of(), T09, T17, null)));
        assertThrows(ResponseStatusException.class, () -> controller.findFreeSlots(
                new AvailabilityController.FreeSlotsRequest(List.of("a"), null, T17, null)));
        verifyNoInteractions(availabilityService);
    }

    @Test
    void conflictsShouldFlagOverlap() {
        when(availabilityService.findConflicts(Set.of("a"), Interval.of(T10, T11)))
                .thenReturn(List.of(Interval.of(T10, T11)));

        StepVerifier.create(controller.findConflicts(new AvailabilityController.ConflictRequest(List.of("a"), T10, T11)))
                .assertNext(response -> {
                    assertTrue(response.getBody().conflict());
                    assertEquals(T11, response.getBody().conflicts().get(0).end());
                })
                .verifyComplete();
    }

    @Test
    void createEventShouldReturnConflictStatusWhenRefused() {
        when(eventService.createEvent(eq(USER), eq("Review"), eq(Interval.of(T10, T11)), any(), any(), any(),
                eq(false))).thenReturn(EventBooking.refused(List.of(Interval.of(T10, T11))));
        AvailabilityController.CreateEventRequest request = new AvailabilityController.CreateEventRequest(
                "Review", T10, T11, List.of("222"), null, null, null);

        StepVerifier.create(controller.createEvent(USER, request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    assertNull(response.getBody().event());
                    assertEquals(1, response.getBody().conflicts().size());
                })
                .verifyComplete();
    }

    @Test
    void createEventShouldReturnCreatedEvent() {
        CalendarEvent event = CalendarEvent.builder()
                .id("evt-1")
                .title("Review")
                .startTime(T10)
                .endTime(T11)
                .createdBy(USER)
                .attendees(List.of("222"))
                .build();
        when(eventService.createEvent(eq(USER), eq("Review"), any(), any(), any(), any(), eq(true)))
                .thenReturn(EventBooking.created(event, List.of()));
        AvailabilityController.CreateEventRequest request = new AvailabilityController.CreateEventRequest(
                "Review", T10, T11, List.of("222"), null, null, true);

        StepVerifier.create(controller.createEvent(USER, request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals("evt-1", response.getBody().event().id());
                    assertFalse(response.getBody().conflicts().iterator().hasNext());
                })
                .verifyComplete();
    }

    @Test
    void deleteEventShouldUseCallerIdentity() {
        StepVerifier.create(controller.deleteEvent(USER, "evt-1"))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();

        verify(eventService).deleteEvent("evt-1", USER, false);
    }

    @Test
    void listEventsShouldMapFields() {
        CalendarEvent event = CalendarEvent.builder()
                .id("evt-2")
                .title("Lunch")
                .location("Cafe")
                .startTime(T10)
                .endTime(T11)
                .createdBy(USER)
                .build();
        when(eventService.listEvents(USER, Interval.of(T09, T17))).thenReturn(List.of(event));

        StepVerifier.create(controller.listEvents(USER, T09, T17))
                .assertNext(response -> {
                    AvailabilityController.EventDto dto = response.getBody().get(0);
                    assertEquals("Lunch", dto.title());
                    assertEquals("Cafe", dto.location());
                    assertEquals(T10, dto.start());
                })
                .verifyComplete();
    }
}
