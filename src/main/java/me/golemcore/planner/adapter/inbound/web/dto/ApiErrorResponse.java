package me.golemcore.planner.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body returned by every planner endpoint.
 *
 * <p>
 * {@code code} is stable and meant for clients to branch on, e.g.
 * {@code not_found} or {@code calendar_auth}. {@code message} is for humans.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiErrorResponse {
    private int status;
    private String code;
    private String message;
}
