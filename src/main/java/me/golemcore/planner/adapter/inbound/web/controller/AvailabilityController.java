package me.golemcore.planner.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.planner.domain.model.CalendarEvent;
import me.golemcore.planner.domain.model.EventBooking;
import me.golemcore.planner.domain.model.FreeSlot;
import me.golemcore.planner.domain.model.Interval;
import me.golemcore.planner.domain.service.CalendarAvailabilityService;
import me.golemcore.planner.domain.service.CalendarEventService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Free-slot search, conflict checks and bot calendar events.
 */
@RestController
@RequestMapping("/api/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private static final String USER_HEADER = ReminderController.USER_HEADER;

    private final CalendarAvailabilityService availabilityService;
    private final CalendarEventService eventService;

    @PostMapping("/free-slots")
    public Mono<ResponseEntity<List<SlotDto>>> findFreeSlots(@RequestBody FreeSlotsRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        Interval window = Interval.of(require(request.start(), "start"), require(request.end(), "end"));
        List<SlotDto> slots = availabilityService.findFreeSlots(users(request.userIds()), window,
                request.minDuration()).stream()
                .map(AvailabilityController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(slots));
    }

    @PostMapping("/conflicts")
    public Mono<ResponseEntity<ConflictResponse>> findConflicts(@RequestBody ConflictRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        Interval candidate = Interval.of(require(request.start(), "start"), require(request.end(), "end"));
        List<IntervalDto> conflicts = availabilityService.findConflicts(users(request.userIds()), candidate).stream()
                .map(interval -> new IntervalDto(interval.start(), interval.end()))
                .toList();
        return Mono.just(ResponseEntity.ok(new ConflictResponse(!conflicts.isEmpty(), conflicts)));
    }

    @GetMapping("/events")
    public Mono<ResponseEntity<List<EventDto>>> listEvents(@RequestHeader(USER_HEADER) String userId,
            @RequestParam Instant from, @RequestParam Instant to) {
        List<EventDto> events = eventService.listEvents(ReminderController.requireUser(userId), Interval.of(from, to))
                .stream()
                .map(AvailabilityController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(events));
    }

    @PostMapping("/events")
    public Mono<ResponseEntity<BookingResponse>> createEvent(@RequestHeader(USER_HEADER) String userId,
            @RequestBody CreateEventRequest request) {
        String creator = ReminderController.requireUser(userId);
        if (request == null) {
            throw badRequest("Request body is required");
        }
        Interval interval = Interval.of(require(request.start(), "start"), require(request.end(), "end"));
        EventBooking booking = eventService.createEvent(creator, request.title(), interval, request.attendees(),
                request.location(), request.description(), Boolean.TRUE.equals(request.force()));
        List<IntervalDto> conflicts = booking.conflicts().stream()
                .map(conflict -> new IntervalDto(conflict.start(), conflict.end()))
                .toList();
        if (!booking.isCreated()) {
            return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(new BookingResponse(null, conflicts)));
        }
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED)
                .body(new BookingResponse(toDto(booking.event()), conflicts)));
    }

    @DeleteMapping("/events/{eventId}")
    public Mono<ResponseEntity<Void>> deleteEvent(@RequestHeader(USER_HEADER) String userId,
            @PathVariable String eventId) {
        eventService.deleteEvent(eventId, ReminderController.requireUser(userId), false);
        return Mono.just(ResponseEntity.noContent().build());
    }

    private static Set<String> users(List<String> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            throw badRequest("userIds is required");
        }
        return new LinkedHashSet<>(userIds);
    }

    private static Instant require(Instant value, String field) {
        if (value == null) {
            throw badRequest(field + " is required");
        }
        return value;
    }

    private static SlotDto toDto(FreeSlot slot) {
        return new SlotDto(slot.start(), slot.end(), slot.duration().toMinutes());
    }

    private static EventDto toDto(CalendarEvent event) {
        return new EventDto(event.getId(), event.getTitle(), event.getDescription(), event.getLocation(),
                event.getStartTime(), event.getEndTime(), event.getCreatedBy(), event.getAttendees());
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record FreeSlotsRequest(List<String> userIds, Instant start, Instant end, Duration minDuration) {
    }

    public record ConflictRequest(List<String> userIds, Instant start, Instant end) {
    }

    public record CreateEventRequest(
            String title,
            Instant start,
            Instant end,
            List<String> attendees,
            String location,
            String description,
            Boolean force) {
    }

    public record SlotDto(Instant start, Instant end, long durationMinutes) {
    }

    public record IntervalDto(Instant start, Instant end) {
    }

    public record ConflictResponse(boolean conflict, List<IntervalDto> conflicts) {
    }

    public record EventDto(
            String id,
            String title,
            String description,
            String location,
            Instant start,
            Instant end,
            String createdBy,
            List<String> attendees) {
    }

    public record BookingResponse(EventDto event, List<IntervalDto> conflicts) {
    }
}
