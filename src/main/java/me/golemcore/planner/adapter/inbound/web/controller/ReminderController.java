package me.golemcore.planner.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.planner.domain.model.ExecutionLogEntry;
import me.golemcore.planner.domain.model.Recurrence;
import me.golemcore.planner.domain.model.ReminderJob;
import me.golemcore.planner.domain.model.ReminderPayload;
import me.golemcore.planner.domain.model.ReminderPriority;
import me.golemcore.planner.domain.model.ReminderTemplate;
import me.golemcore.planner.domain.model.ReminderTrigger;
import me.golemcore.planner.domain.service.ReminderScheduler;
import me.golemcore.planner.domain.service.ReminderService;
import me.golemcore.planner.domain.service.ReminderTemplateService;
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
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reminder endpoints for dashboards and integrations. The caller is
 * identified by the {@code X-User-Id} header and may only see and manage
 * their own reminders.
 */
@RestController
@RequestMapping("/api/reminders")
@RequiredArgsConstructor
public class ReminderController {

    static final String USER_HEADER = "X-User-Id";

    private final ReminderService reminderService;
    private final ReminderScheduler reminderScheduler;
    private final ReminderTemplateService templateService;

    @GetMapping
    public Mono<ResponseEntity<List<ReminderDto>>> listReminders(@RequestHeader(USER_HEADER) String userId) {
        List<ReminderDto> reminders = reminderScheduler.getUserReminders(requireUser(userId)).stream()
                .map(ReminderController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(reminders));
    }

    @GetMapping("/{jobId}")
    public Mono<ResponseEntity<ReminderDto>> getReminder(@RequestHeader(USER_HEADER) String userId,
            @PathVariable String jobId) {
        ReminderJob job = reminderScheduler.findJob(jobId, requireUser(userId), false);
        return Mono.just(ResponseEntity.ok(toDto(job)));
    }

    @PostMapping
    public Mono<ResponseEntity<ReminderDto>> createReminder(@RequestHeader(USER_HEADER) String userId,
            @RequestBody CreateReminderRequest request) {
        String owner = requireUser(userId);
        if (request == null) {
            throw badRequest("Request body is required");
        }
        ReminderTrigger trigger = toTrigger(request);
        ReminderPayload payload = ReminderPayload.builder()
                .channelId(request.channelId())
                .message(request.message())
                .templateName(request.templateName())
                .targetType(request.pollId() != null
                        ? ReminderPayload.TargetType.POLL
                        : ReminderPayload.TargetType.NONE)
                .targetId(request.pollId())
                .substitutions(request.substitutions() != null ? new HashMap<>(request.substitutions())
                        : new HashMap<>())
                .build();

        String jobId = reminderService.createReminder(owner, trigger, payload);
        ReminderJob job = reminderScheduler.findJob(jobId, owner, false);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(job)));
    }

    @DeleteMapping("/{jobId}")
    public Mono<ResponseEntity<CancelResponse>> cancelReminder(@RequestHeader(USER_HEADER) String userId,
            @PathVariable String jobId) {
        boolean cancelled = reminderScheduler.cancel(jobId, requireUser(userId), false);
        return Mono.just(ResponseEntity.ok(new CancelResponse(jobId, cancelled)));
    }

    @GetMapping("/logs")
    public Mono<ResponseEntity<List<LogEntryDto>>> getLogs(@RequestHeader(USER_HEADER) String userId,
            @RequestParam(defaultValue = "20") int limit) {
        List<LogEntryDto> entries = reminderScheduler.getLogs(requireUser(userId), limit).stream()
                .map(ReminderController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(entries));
    }

    @GetMapping("/templates")
    public Mono<ResponseEntity<List<TemplateDto>>> listTemplates(@RequestHeader(USER_HEADER) String userId) {
        List<TemplateDto> templates = templateService.listTemplates(requireUser(userId)).stream()
                .map(ReminderController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(templates));
    }

    @PostMapping("/templates")
    public Mono<ResponseEntity<TemplateDto>> createTemplate(@RequestHeader(USER_HEADER) String userId,
            @RequestBody CreateTemplateRequest request) {
        String owner = requireUser(userId);
        if (request == null) {
            throw badRequest("Request body is required");
        }
        ReminderTemplate template = templateService.createTemplate(request.name(), request.description(),
                request.messageTemplate(), parsePriority(request.priority()), owner, request.pingRoles(),
                request.pingUsers());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(template)));
    }

    private static ReminderTrigger toTrigger(CreateReminderRequest request) {
        if (request.trigger() == null || request.trigger().isBlank()) {
            throw badRequest("trigger is required");
        }
        ReminderTrigger.TriggerType type;
        try {
            type = ReminderTrigger.TriggerType.valueOf(request.trigger().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw badRequest("Unknown trigger: " + request.trigger());
        }
        return ReminderTrigger.builder()
                .type(type)
                .at(request.at())
                .interval(request.interval())
                .minutesBefore(request.minutesBefore() != null ? request.minutesBefore() : 0)
                .cronExpression(request.cronExpression())
                .maxOccurrences(request.maxOccurrences() != null ? request.maxOccurrences() : 0)
                .build();
    }

    private static ReminderPriority parsePriority(String value) {
        if (value == null || value.isBlank()) {
            return ReminderPriority.INFORMATIONAL;
        }
        try {
            return ReminderPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw badRequest("Unknown priority: " + value);
        }
    }

    static String requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw badRequest(USER_HEADER + " header is required");
        }
        return userId.trim();
    }

    private static ReminderDto toDto(ReminderJob job) {
        Recurrence recurrence = job.getRecurrence();
        ReminderPayload payload = job.getPayload();
        return new ReminderDto(
                job.getId(),
                job.getStatus().name(),
                job.getFireTime(),
                recurrence.getType().name(),
                recurrence.getInterval(),
                recurrence.getCronExpression(),
                recurrence.getMaxOccurrences(),
                job.getOccurrenceCount(),
                payload.getChannelId(),
                payload.getMessage(),
                payload.getTemplateName(),
                payload.getTargetType() == ReminderPayload.TargetType.POLL ? payload.getTargetId() : null,
                job.getCreatedAt(),
                job.getLastFiredAt());
    }

    private static LogEntryDto toDto(ExecutionLogEntry entry) {
        return new LogEntryDto(entry.getJobId(), entry.getAttemptedAt(), entry.getOutcome().name(),
                entry.getAttempts(), entry.getErrorMessage(), entry.getDeliveredPayload());
    }

    private static TemplateDto toDto(ReminderTemplate template) {
        return new TemplateDto(template.getName(), template.getDescription(), template.getMessageTemplate(),
                template.getPriority().name(),
                ReminderTemplateService.SYSTEM_CREATOR.equals(template.getCreatedBy()));
    }

    private static ResponseStatusException badRequest(String reason) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, reason);
    }

    public record CreateReminderRequest(
            String trigger,
            Instant at,
            Duration interval,
            Integer minutesBefore,
            String cronExpression,
            Integer maxOccurrences,
            String message,
            String templateName,
            String channelId,
            String pollId,
            Map<String, String> substitutions) {
    }

    public record CreateTemplateRequest(
            String name,
            String description,
            String messageTemplate,
            String priority,
            List<String> pingRoles,
            List<String> pingUsers) {
    }

    public record ReminderDto(
            String id,
            String status,
            Instant fireTime,
            String recurrence,
            Duration interval,
            String cronExpression,
            int maxOccurrences,
            int occurrenceCount,
            String channelId,
            String message,
            String templateName,
            String pollId,
            Instant createdAt,
            Instant lastFiredAt) {
    }

    public record LogEntryDto(
            String jobId,
            Instant attemptedAt,
            String outcome,
            int attempts,
            String error,
            String deliveredPayload) {
    }

    public record TemplateDto(
            String name,
            String description,
            String messageTemplate,
            String priority,
            boolean builtIn) {
    }

    public record CancelResponse(String jobId, boolean cancelled) {
    }
}
