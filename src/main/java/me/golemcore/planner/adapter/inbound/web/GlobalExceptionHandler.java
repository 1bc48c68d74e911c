package me.golemcore.planner.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.planner.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.planner.domain.exception.CalendarAuthException;
import me.golemcore.planner.domain.exception.InvalidArgumentException;
import me.golemcore.planner.domain.exception.NotFoundException;
import me.golemcore.planner.domain.exception.PermissionDeniedException;
import me.golemcore.planner.domain.exception.PlannerException;
import me.golemcore.planner.domain.exception.StorageException;
import me.golemcore.planner.domain.exception.TransientExternalException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for API controllers. Domain exceptions are
 * mapped to HTTP statuses here so controllers can let them propagate.
 */
@ControllerAdvice(basePackages = "me.golemcore.planner.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return Mono.just(error(status, status.is4xxClientError() ? "invalid_request" : "internal", ex.getReason()));
    }

    @ExceptionHandler(PlannerException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handlePlanner(PlannerException ex) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.error("[API] {}: {}", status, ex.getMessage(), ex);
        } else {
            log.warn("[API] {}: {}", status, ex.getMessage());
        }
        return Mono.just(error(status, codeOf(ex), ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Internal server error"));
    }

    static HttpStatus statusOf(PlannerException ex) {
        if (ex instanceof InvalidArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof PermissionDeniedException) {
            return HttpStatus.FORBIDDEN;
        }
        if (ex instanceof CalendarAuthException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (ex instanceof TransientExternalException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static String codeOf(PlannerException ex) {
        if (ex instanceof InvalidArgumentException) {
            return "invalid_argument";
        }
        if (ex instanceof NotFoundException) {
            return "not_found";
        }
        if (ex instanceof PermissionDeniedException) {
            return "permission_denied";
        }
        if (ex instanceof CalendarAuthException) {
            return "calendar_auth";
        }
        if (ex instanceof TransientExternalException) {
            return "calendar_unavailable";
        }
        if (ex instanceof StorageException) {
            return "storage";
        }
        return "internal";
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String code, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .code(code)
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
