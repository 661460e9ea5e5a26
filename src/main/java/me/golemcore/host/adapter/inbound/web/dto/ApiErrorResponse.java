package me.golemcore.host.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body for HTTP-level failures (malformed payloads, host not running).
 * Request-level failures travel inside the response envelope instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiErrorResponse {
    private int status;
    private String errorKind;
    private String message;
}
