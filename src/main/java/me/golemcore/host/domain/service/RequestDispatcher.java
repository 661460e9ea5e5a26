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

import me.golemcore.host.domain.exception.HostException;
import me.golemcore.host.domain.exception.InvariantViolationException;
import me.golemcore.host.domain.exception.ShutdownIncompleteException;
import me.golemcore.host.domain.model.AuditEvent;
import me.golemcore.host.domain.model.CloseReport;
import me.golemcore.host.domain.model.ErrorKind;
import me.golemcore.host.domain.model.HostRequest;
import me.golemcore.host.domain.model.HostResponse;
import me.golemcore.host.domain.model.HostSession;
import me.golemcore.host.domain.model.MemoryCategory;
import me.golemcore.host.domain.model.MemoryHandle;
import me.golemcore.host.domain.model.OptimizationResult;
import me.golemcore.host.domain.model.OptimizationStrategy;
import me.golemcore.host.domain.model.PermissionEffect;
import me.golemcore.host.domain.model.PermissionRule;
import me.golemcore.host.domain.model.PermissionTriple;
import me.golemcore.host.domain.model.RequestParameters;
import me.golemcore.host.domain.model.RequestType;
import me.golemcore.host.domain.model.SecurityLevel;
import me.golemcore.host.domain.model.ShutdownReport;
import me.golemcore.host.infrastructure.config.HostProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes requests from sessions to the subsystems that own the resources.
 *
 * <p>
 * Every request runs the same pipeline:
 * <ol>
 * <li>check the host is running and healthy</li>
 * <li>resolve the requesting session (must be active)</li>
 * <li>resolve the request type and its permission triple</li>
 * <li>evaluate the permission policy; a deny stops here</li>
 * <li>route to the owning subsystem</li>
 * <li>record an audit event, on success and failure alike</li>
 * </ol>
 * Recoverable failures become the failure branch of the {@link HostResponse}.
 * An {@link InvariantViolationException} is never turned into a response: it
 * is audited, handed to the {@link FatalErrorHandler} and rethrown.
 *
 * <p>
 * Memory handle ownership is changed only while holding the session table lock
 * (taken before the memory registry lock), so a handle is owned by at most one
 * session and never left allocated without an owner.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequestDispatcher {

    private static final String LOG_PREFIX = "[Kernel]";
    private static final int DEFAULT_AUDIT_LIMIT = 100;
    private static final int SHUTDOWN_THREADS = 4;

    private final SessionTable sessionTable;
    private final MemoryRegistryService memoryRegistry;
    private final PermissionPolicyService permissionPolicy;
    private final SecurityAuditLog auditLog;
    private final ToolRegistryService toolRegistry;
    private final FatalErrorHandler fatalErrorHandler;
    private final HostProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final ExecutorService shutdownExecutor = Executors.newFixedThreadPool(SHUTDOWN_THREADS, r -> {
        Thread t = new Thread(r, "host-shutdown");
        t.setDaemon(true);
        return t;
    });

    @PreDestroy
    void destroy() {
        shutdownExecutor.shutdownNow();
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== SESSIONS ====================

    public HostSession createSession(Map<String, String> metadata) {
        fatalErrorHandler.ensureHealthy();
        if (!running.get()) {
            throw new HostException(ErrorKind.HOST_NOT_RUNNING, "Host is not running");
        }
        HostSession session = sessionTable.create(metadata);
        auditLog.record(AuditEvent.builder()
                .sessionId(session.getId())
                .requestType("sessions_create")
                .resourceType("session")
                .operation("create")
                .resource(session.getId())
                .outcome(AuditEvent.OUTCOME_SUCCESS)
                .build());
        return session;
    }

    public List<HostSession> listSessions() {
        return sessionTable.listLive();
    }

    /**
     * Closes a session: every handle it owns is released best-effort, failures
     * are collected, and the session ends {@code CLOSED} regardless.
     *
     * @throws HostException
     *             {@code SESSION_NOT_FOUND} if the session is not active
     */
    public CloseReport closeSession(String sessionId) {
        Set<String> owned = sessionTable.beginClose(sessionId);
        List<String> released = new ArrayList<>();
        List<CloseReport.ReleaseFailure> failures = new ArrayList<>();

        for (String handleId : owned) {
            try {
                boolean releasedNow = sessionTable.locked(() -> {
                    if (!sessionTable.owns(sessionId, handleId)) {
                        // reclaimed by optimization after close began
                        return false;
                    }
                    memoryRegistry.release(handleId);
                    sessionTable.disown(sessionId, handleId);
                    return true;
                });
                if (releasedNow) {
                    released.add(handleId);
                }
            } catch (InvariantViolationException e) {
                throw e;
            } catch (RuntimeException e) {
                ErrorKind kind = e instanceof HostException hostException ? hostException.getKind() : null;
                log.warn("{} Failed to release handle {} while closing session {}: {}", LOG_PREFIX, handleId,
                        sessionId, e.getMessage());
                failures.add(CloseReport.ReleaseFailure.builder()
                        .handleId(handleId)
                        .errorKind(kind)
                        .message(e.getMessage())
                        .build());
            }
        }

        HostSession closed = sessionTable.finishClose(sessionId);
        log.info("{} Session {} closed: {} handles released, {} failures", LOG_PREFIX, sessionId,
                released.size(), failures.size());
        return CloseReport.builder()
                .sessionId(sessionId)
                .status(closed.getStatus())
                .releasedHandles(List.copyOf(released))
                .failures(List.copyOf(failures))
                .build();
    }

    // ==================== DISPATCH ====================

    public HostResponse process(String sessionId, HostRequest request) {
        fatalErrorHandler.ensureHealthy();

        String requestId = request != null && request.getId() != null
                ? request.getId()
                : UUID.randomUUID().toString();
        AuditEvent audit = AuditEvent.builder()
                .sessionId(sessionId)
                .requestId(requestId)
                .requestType(request != null ? request.getType() : null)
                .build();

        HostResponse response;
        try {
            if (request == null) {
                throw HostException.invalidArgument("Request is required");
            }
            if (!running.get()) {
                throw new HostException(ErrorKind.HOST_NOT_RUNNING, "Host is not running");
            }
            sessionTable.requireActive(sessionId);
            RequestType type = RequestType.fromTag(request.getType());
            RequestParameters params = new RequestParameters(request.getParameters());

            PermissionTriple triple = type.triple(sessionId, params);
            audit.setResourceType(triple.resourceType());
            audit.setOperation(triple.operation());
            audit.setResource(triple.resource());

            PermissionEffect verdict = permissionPolicy.evaluate(triple);
            audit.setVerdict(verdict);
            if (verdict == PermissionEffect.DENY) {
                throw HostException.permissionDenied(triple.toString());
            }

            Object data = route(type, sessionId, params);
            audit.setOutcome(AuditEvent.OUTCOME_SUCCESS);
            response = HostResponse.success(requestId, data, clock.millis());
        } catch (ShutdownIncompleteException e) {
            audit.setOutcome(e.getKind().name());
            audit.setDetail(e.getMessage());
            response = HostResponse.failure(requestId, e.getKind(), e.getMessage(), e.getReport(), clock.millis());
        } catch (HostException e) {
            log.debug("{} Request {} ({}) from session {} failed: {} {}", LOG_PREFIX, requestId,
                    audit.getRequestType(), sessionId, e.getKind(), e.getMessage());
            audit.setOutcome(e.getKind().name());
            audit.setDetail(e.getMessage());
            response = HostResponse.failure(requestId, e.getKind(), e.getMessage(), clock.millis());
        } catch (InvariantViolationException e) {
            audit.setOutcome("INVARIANT_VIOLATION");
            audit.setDetail(e.getMessage());
            auditLog.record(audit);
            fatalErrorHandler.halt(e);
            throw e;
        } catch (RuntimeException e) {
            log.error("{} Unexpected failure processing request {} ({})", LOG_PREFIX, requestId,
                    audit.getRequestType(), e);
            audit.setOutcome("INTERNAL_ERROR");
            audit.setDetail(e.getMessage());
            auditLog.record(audit);
            throw e;
        }

        auditLog.record(audit);
        return response;
    }

    private Object route(RequestType type, String sessionId, RequestParameters params) {
        return switch (type) {
        case SESSIONS_CLOSE -> closeSession(sessionId);
        case MEMORY_ALLOCATE -> allocate(sessionId, params);
        case MEMORY_RELEASE -> release(sessionId, params.requireString("handle_id"));
        case MEMORY_ACCESS -> access(sessionId, params.requireString("handle_id"));
        case MEMORY_OPTIMIZE -> optimize(params.optional("strategy", OptimizationStrategy::fromString, null));
        case MEMORY_STATUS -> memoryRegistry.status();
        case SECURITY_SET_LEVEL -> setSecurityLevel(params.require("level", SecurityLevel::fromString));
        case SECURITY_ADD_PERMISSION -> permissionPolicy.addRule(PermissionRule.builder()
                .resourceType(params.requireString("resource_type"))
                .operation(params.requireString("operation"))
                .resourcePattern(params.requireString("resource"))
                .effect(params.optional("effect", PermissionEffect::fromString, PermissionEffect.ALLOW))
                .build());
        case SECURITY_REMOVE_PERMISSION -> Map.of("removed", permissionPolicy.removeRule(
                params.requireString("resource_type"),
                params.requireString("operation"),
                params.requireString("resource")));
        case SECURITY_CHECK -> checkPermission(params);
        case SECURITY_AUDIT -> auditEvents(params.optionalInt("limit", DEFAULT_AUDIT_LIMIT));
        case TOOLS_LIST -> toolRegistry.list();
        case TOOLS_EXECUTE -> toolRegistry.invoke(
                params.requireString("tool_id"),
                params.requireString("capability"),
                params.optionalMap("parameters"));
        case TOOLS_SET_ENABLED -> toolRegistry.setEnabled(
                params.requireString("tool_id"),
                params.requireBoolean("enabled"));
        case SYSTEM_INFO -> systemInfo();
        case SYSTEM_ECHO -> params.asMap();
        case SYSTEM_SHUTDOWN -> shutdownFromRequest();
        };
    }

    // ==================== MEMORY ====================

    private MemoryHandle allocate(String sessionId, RequestParameters params) {
        MemoryCategory category = params.require("category", MemoryCategory::fromString);
        long sizeBytes = params.requireLong("size_bytes");
        String purpose = params.optionalString("purpose", "");

        return sessionTable.locked(() -> {
            sessionTable.requireActive(sessionId);
            MemoryHandle staged = memoryRegistry.allocate(sessionId, category, sizeBytes, purpose);
            try {
                sessionTable.commitOwnership(sessionId, staged.getId());
            } catch (RuntimeException e) {
                memoryRegistry.release(staged.getId());
                throw e;
            }
            return staged;
        });
    }

    private MemoryHandle release(String sessionId, String handleId) {
        return sessionTable.locked(() -> {
            sessionTable.requireActive(sessionId);
            if (!sessionTable.owns(sessionId, handleId)) {
                throw HostException.handleNotFound(handleId);
            }
            MemoryHandle released;
            try {
                released = memoryRegistry.release(handleId);
            } catch (HostException e) {
                if (e.getKind() != ErrorKind.HANDLE_NOT_FOUND) {
                    throw e;
                }
                throw new InvariantViolationException("Session " + sessionId + " owns handle " + handleId
                        + " unknown to the memory registry");
            }
            sessionTable.disown(sessionId, handleId);
            return released;
        });
    }

    private MemoryHandle access(String sessionId, String handleId) {
        return sessionTable.locked(() -> {
            sessionTable.requireActive(sessionId);
            if (!sessionTable.owns(sessionId, handleId)) {
                throw HostException.handleNotFound(handleId);
            }
            return memoryRegistry.access(handleId);
        });
    }

    /**
     * Reaps orphans left by faulted closes, then runs the registry's
     * optimization pass. Reaped handles are reported as reclaimed.
     */
    private OptimizationResult optimize(OptimizationStrategy strategy) {
        return sessionTable.locked(() -> {
            List<MemoryHandle> reaped = reapOrphans();
            OptimizationResult result = memoryRegistry.optimize(strategy);
            sessionTable.disownAll(result.getReclaimedHandles());
            if (reaped.isEmpty()) {
                return result;
            }
            List<String> reclaimed = new ArrayList<>();
            long bytesFreed = result.getBytesFreed();
            for (MemoryHandle handle : reaped) {
                reclaimed.add(handle.getId());
                bytesFreed += handle.getSizeBytes();
            }
            reclaimed.addAll(result.getReclaimedHandles());
            return OptimizationResult.builder()
                    .strategy(result.getStrategy())
                    .reclaimedHandles(List.copyOf(reclaimed))
                    .bytesFreed(bytesFreed)
                    .build();
        });
    }

    /**
     * Retries the release of every orphan. Orphans the registry no longer knows
     * are forgotten; orphans that fail again stay for the next pass.
     */
    private List<MemoryHandle> reapOrphans() {
        return sessionTable.locked(() -> {
            List<MemoryHandle> reaped = new ArrayList<>();
            for (String handleId : sessionTable.orphanedHandles()) {
                try {
                    reaped.add(memoryRegistry.release(handleId));
                    sessionTable.forgetOrphan(handleId);
                } catch (InvariantViolationException e) {
                    throw e;
                } catch (HostException e) {
                    if (e.getKind() == ErrorKind.HANDLE_NOT_FOUND) {
                        sessionTable.forgetOrphan(handleId);
                    } else {
                        log.warn("{} Orphan {} still not released: {}", LOG_PREFIX, handleId, e.getMessage());
                    }
                } catch (RuntimeException e) {
                    log.warn("{} Orphan {} still not released: {}", LOG_PREFIX, handleId, e.getMessage());
                }
            }
            if (!reaped.isEmpty()) {
                log.info("{} Reaped {} orphaned handles", LOG_PREFIX, reaped.size());
            }
            return reaped;
        });
    }

    // ==================== SECURITY ====================

    private Map<String, Object> setSecurityLevel(SecurityLevel level) {
        SecurityLevel previous = permissionPolicy.setLevel(level);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("previous", previous);
        data.put("current", level);
        return data;
    }

    private Map<String, Object> checkPermission(RequestParameters params) {
        PermissionTriple triple = new PermissionTriple(
                params.requireString("resource_type"),
                params.requireString("operation"),
                params.requireString("resource"));
        PermissionEffect verdict = permissionPolicy.evaluate(triple);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("resource_type", triple.resourceType());
        data.put("operation", triple.operation());
        data.put("resource", triple.resource());
        data.put("verdict", verdict);
        data.put("allowed", verdict == PermissionEffect.ALLOW);
        return data;
    }

    private List<AuditEvent> auditEvents(int limit) {
        if (limit <= 0) {
            throw HostException.invalidArgument("Parameter 'limit' must be positive");
        }
        return auditLog.recent(limit);
    }

    // ==================== SYSTEM ====================

    private Map<String, Object> systemInfo() {
        HostProperties.KernelProperties kernel = properties.getKernel();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", kernel.getName());
        info.put("version", kernel.getVersion());
        info.put("api_version", kernel.getApiVersion());
        info.put("running", running.get());
        info.put("uptime_ms", ManagementFactory.getRuntimeMXBean().getUptime());
        info.put("security_level", permissionPolicy.getLevel());
        info.put("live_sessions", sessionTable.size());
        info.put("owned_handles", sessionTable.ownedHandleCount());
        info.put("orphaned_handles", sessionTable.orphanedHandles().size());
        info.put("memory_used_bytes", memoryRegistry.status().getUsedBytes());
        info.put("tools", toolRegistry.list().size());
        return info;
    }

    private ShutdownReport shutdownFromRequest() {
        ShutdownReport report = shutdown(properties.getKernel().getShutdownDrainTimeout());
        if (!report.isComplete()) {
            throw new ShutdownIncompleteException(report);
        }
        return report;
    }

    /**
     * Stops accepting requests and closes every live session in parallel,
     * waiting at most {@code drainTimeout}. Sessions still live afterwards are
     * reported as stragglers. Safe to call more than once.
     */
    public ShutdownReport shutdown(Duration drainTimeout) {
        long start = clock.millis();
        boolean wasRunning = running.getAndSet(false);
        List<String> sessionIds = sessionTable.liveSessionIds();
        log.info("{} Shutting down{}: closing {} sessions (drain timeout {}ms)", LOG_PREFIX,
                wasRunning ? "" : " again", sessionIds.size(), drainTimeout.toMillis());

        List<CompletableFuture<CloseReport>> closes = sessionIds.stream()
                .map(id -> CompletableFuture.supplyAsync(() -> closeForShutdown(id), shutdownExecutor))
                .toList();

        try {
            CompletableFuture.allOf(closes.toArray(CompletableFuture[]::new))
                    .get(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{} Drain timeout of {}ms elapsed", LOG_PREFIX, drainTimeout.toMillis());
        } catch (ExecutionException e) {
            log.error("{} Session close failed during shutdown", LOG_PREFIX, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} Interrupted while draining sessions", LOG_PREFIX);
        }

        List<CloseReport> closed = new ArrayList<>();
        for (CompletableFuture<CloseReport> close : closes) {
            if (close.isDone() && !close.isCompletedExceptionally()) {
                CloseReport report = close.join();
                if (report != null) {
                    closed.add(report);
                }
            }
        }
        List<String> stragglers = sessionTable.liveSessionIds();
        if (stragglers.isEmpty()) {
            try {
                reapOrphans();
            } catch (InvariantViolationException e) {
                fatalErrorHandler.halt(e);
                throw e;
            }
        }
        ShutdownReport report = ShutdownReport.builder()
                .closed(List.copyOf(closed))
                .stragglers(stragglers)
                .elapsedMs(clock.millis() - start)
                .build();
        if (report.isComplete()) {
            log.info("{} Shutdown complete: {} sessions closed in {}ms", LOG_PREFIX, closed.size(),
                    report.getElapsedMs());
        } else {
            log.warn("{} Shutdown incomplete: {} sessions still live after {}ms: {}", LOG_PREFIX,
                    stragglers.size(), report.getElapsedMs(), stragglers);
        }
        return report;
    }

    private CloseReport closeForShutdown(String sessionId) {
        try {
            return closeSession(sessionId);
        } catch (HostException e) {
            // closed concurrently by its client
            log.debug("{} Session {} already closed during shutdown", LOG_PREFIX, sessionId);
            return null;
        } catch (InvariantViolationException e) {
            fatalErrorHandler.halt(e);
            throw e;
        }
    }
}
