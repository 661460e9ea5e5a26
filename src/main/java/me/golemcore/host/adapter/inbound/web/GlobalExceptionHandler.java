package me.golemcore.host.adapter.inbound.web;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.host.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.host.domain.exception.HostException;
import me.golemcore.host.domain.model.ErrorKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for the host HTTP controllers. Only failures
 * outside the dispatch pipeline reach it; dispatched requests always answer
 * with a response envelope.
 */
@ControllerAdvice(basePackages = "me.golemcore.host.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, null, ex.getReason());
    }

    @ExceptionHandler(HostException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleHostException(HostException ex) {
        HttpStatus status = statusOf(ex.getKind());
        log.warn("[API] {} {}: {}", status, ex.getKind(), ex.getMessage());
        return respond(status, ex.getKind().name(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ARGUMENT.name(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, null, "Internal server error");
    }

    private static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
        case SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
        case HOST_NOT_RUNNING -> HttpStatus.SERVICE_UNAVAILABLE;
        default -> HttpStatus.BAD_REQUEST;
        };
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String errorKind,
            String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .errorKind(errorKind)
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
