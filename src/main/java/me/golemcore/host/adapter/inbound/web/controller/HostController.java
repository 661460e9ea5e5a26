package me.golemcore.host.adapter.inbound.web.controller;

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

import me.golemcore.host.adapter.inbound.web.dto.CreateSessionRequest;
import me.golemcore.host.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.host.domain.model.HostRequest;
import me.golemcore.host.domain.model.HostResponse;
import me.golemcore.host.domain.model.HostSession;
import me.golemcore.host.domain.model.RequestType;
import me.golemcore.host.domain.service.RequestDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Session lifecycle and request dispatch endpoints. Each request call maps to
 * exactly one dispatch; the envelope carries success or failure, so dispatched
 * requests always answer 200.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
@Slf4j
public class HostController {

    private final RequestDispatcher dispatcher;
    private final Clock clock;

    @PostMapping
    public Mono<ResponseEntity<SessionSummaryDto>> createSession(
            @RequestBody(required = false) CreateSessionRequest request) {
        return Mono.fromCallable(() -> {
            Map<String, String> metadata = request != null ? request.getMetadata() : Map.of();
            HostSession session = dispatcher.createSession(metadata);
            return ResponseEntity.status(HttpStatus.CREATED).body(toSummary(session));
        });
    }

    @GetMapping
    public Mono<ResponseEntity<List<SessionSummaryDto>>> listSessions() {
        List<SessionSummaryDto> sessions = dispatcher.listSessions().stream()
                .map(HostController::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(sessions));
    }

    @PostMapping("/{sessionId}/requests")
    public Mono<ResponseEntity<HostResponse>> process(@PathVariable String sessionId,
            @RequestBody HostRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(dispatcher.process(sessionId, request)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{sessionId}")
    public Mono<ResponseEntity<HostResponse>> closeSession(@PathVariable String sessionId) {
        HostRequest request = HostRequest.builder()
                .id(UUID.randomUUID().toString())
                .type(RequestType.SESSIONS_CLOSE.getTag())
                .timestamp(clock.millis())
                .build();
        log.debug("[API] Close requested for session {}", sessionId);
        return Mono.fromCallable(() -> ResponseEntity.ok(dispatcher.process(sessionId, request)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static SessionSummaryDto toSummary(HostSession session) {
        return SessionSummaryDto.builder()
                .id(session.getId())
                .status(session.getStatus().name())
                .createdAt(session.getCreatedAt() != null ? session.getCreatedAt().toString() : null)
                .lastActivityAt(session.getLastActivityAt() != null ? session.getLastActivityAt().toString() : null)
                .metadata(session.getMetadata())
                .ownedHandles(session.getOwnedHandles().size())
                .build();
    }
}
