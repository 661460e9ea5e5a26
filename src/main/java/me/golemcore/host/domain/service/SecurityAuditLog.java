package me.golemcore.host.domain.service;

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

import me.golemcore.host.domain.model.AuditEvent;
import me.golemcore.host.infrastructure.config.HostProperties;
import me.golemcore.host.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, append-only record of dispatched requests and their permission
 * verdicts.
 *
 * <p>
 * Keeps the most recent {@code host.security.audit-max-events} entries in
 * memory, evicting the oldest first. When persistence is enabled every entry is
 * also appended to {@code audit/security-<date>.jsonl}; on startup the newest
 * file is read back so the in-memory window survives restarts. Persistence
 * failures are logged and never fail the request being audited.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SecurityAuditLog {

    private static final String LOG_PREFIX = "[Audit]";
    private static final String AUDIT_DIR = "audit";
    private static final String FILE_PREFIX = "security-";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final HostProperties properties;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<AuditEvent> events = new ArrayDeque<>();

    @PostConstruct
    void init() {
        if (!properties.getSecurity().isAuditPersistenceEnabled()) {
            return;
        }
        try {
            List<String> files = storagePort.listObjects(AUDIT_DIR, FILE_PREFIX).join();
            List<String> auditFiles = files == null ? List.of()
                    : files.stream().filter(file -> file.endsWith(JSONL_EXTENSION)).sorted().toList();
            if (auditFiles.isEmpty()) {
                log.debug("{} No persisted audit files found", LOG_PREFIX);
                return;
            }
            String latest = auditFiles.get(auditFiles.size() - 1);
            String content = storagePort.getText(AUDIT_DIR, latest).join();
            int restored = restore(latest, content);
            log.info("{} Restored {} audit events from {}", LOG_PREFIX, restored, latest);
        } catch (RuntimeException e) {
            log.warn("{} Failed to load persisted audit events", LOG_PREFIX, e);
        }
    }

    /**
     * Appends an event, assigning id and timestamp when missing.
     */
    public AuditEvent record(AuditEvent event) {
        if (event.getId() == null) {
            event.setId(UUID.randomUUID().toString());
        }
        if (event.getTimestamp() == null) {
            event.setTimestamp(clock.instant());
        }

        lock.lock();
        try {
            append(event);
        } finally {
            lock.unlock();
        }

        log.debug("{} {} session={} {}:{}:{} verdict={} outcome={}", LOG_PREFIX, event.getRequestType(),
                event.getSessionId(), event.getResourceType(), event.getOperation(), event.getResource(),
                event.getVerdict(), event.getOutcome());
        persist(event);
        return event;
    }

    /**
     * Returns up to {@code limit} events, most recent first.
     */
    public List<AuditEvent> recent(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Audit limit must be positive: " + limit);
        }
        lock.lock();
        try {
            List<AuditEvent> result = new ArrayList<>(Math.min(limit, events.size()));
            Iterator<AuditEvent> iterator = events.descendingIterator();
            while (iterator.hasNext() && result.size() < limit) {
                result.add(iterator.next());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    private void append(AuditEvent event) {
        events.addLast(event);
        int maxEvents = properties.getSecurity().getAuditMaxEvents();
        while (events.size() > maxEvents) {
            events.removeFirst();
        }
    }

    private int restore(String file, String content) {
        if (content == null || content.isBlank()) {
            return 0;
        }
        int restored = 0;
        lock.lock();
        try {
            for (String line : content.split(NEWLINE)) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    append(objectMapper.readValue(line, AuditEvent.class));
                    restored++;
                } catch (JsonProcessingException e) {
                    log.debug("{} Skipping malformed line in {}: {}", LOG_PREFIX, file, e.getMessage());
                }
            }
        } finally {
            lock.unlock();
        }
        return Math.min(restored, properties.getSecurity().getAuditMaxEvents());
    }

    private void persist(AuditEvent event) {
        if (!properties.getSecurity().isAuditPersistenceEnabled()) {
            return;
        }
        String file = FILE_PREFIX + LocalDate.now(clock) + JSONL_EXTENSION;
        try {
            String json = objectMapper.writeValueAsString(event) + NEWLINE;
            storagePort.appendText(AUDIT_DIR, file, json)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            log.warn("{} Failed to persist audit event {}: {}", LOG_PREFIX, event.getId(),
                                    error.getMessage());
                        }
                    });
        } catch (JsonProcessingException e) {
            log.warn("{} Failed to serialize audit event {}", LOG_PREFIX, event.getId(), e);
        }
    }
}
