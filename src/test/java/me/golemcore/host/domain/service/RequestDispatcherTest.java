package me.golemcore.host.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.host.domain.exception.HostException;
import me.golemcore.host.domain.exception.InvariantViolationException;
import me.golemcore.host.domain.model.AuditEvent;
import me.golemcore.host.domain.model.CloseReport;
import me.golemcore.host.domain.model.ErrorKind;
import me.golemcore.host.domain.model.HostRequest;
import me.golemcore.host.domain.model.HostResponse;
import me.golemcore.host.domain.model.HostSession;
import me.golemcore.host.domain.model.MemoryCategory;
import me.golemcore.host.domain.model.MemoryHandle;
import me.golemcore.host.domain.model.MemoryStatus;
import me.golemcore.host.domain.model.OptimizationResult;
import me.golemcore.host.domain.model.PermissionEffect;
import me.golemcore.host.domain.model.PermissionRule;
import me.golemcore.host.domain.model.ShutdownReport;
import me.golemcore.host.domain.model.ToolResult;
import me.golemcore.host.infrastructure.config.HostProperties;
import me.golemcore.host.port.outbound.StoragePort;
import me.golemcore.host.security.MaximumLevelGuard;
import me.golemcore.host.testsupport.MutableClock;
import me.golemcore.host.tools.CalculatorTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class RequestDispatcherTest {

    private static final long MB = 1024 * 1024;

    private HostProperties properties;
    private MutableClock clock;
    private SessionTable sessionTable;
    private MemoryRegistryService memoryRegistry;
    private PermissionPolicyService policy;
    private SecurityAuditLog auditLog;
    private JvmExitService jvmExitService;
    private RequestDispatcher dispatcher;
    private final AtomicInteger requestCounter = new AtomicInteger();

    @BeforeEach
    void setUp() {
        properties = new HostProperties();
        properties.getMemory().setMaxAllocationMb(64);
        properties.getSecurity().setAuditPersistenceEnabled(false);
        properties.getKernel().setShutdownDrainTimeout(Duration.ofSeconds(2));
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        sessionTable = new SessionTable(clock);
        memoryRegistry = spy(new MemoryRegistryService(properties, clock));
        policy = new PermissionPolicyService(properties, new MaximumLevelGuard());
        auditLog = new SecurityAuditLog(mock(StoragePort.class), new ObjectMapper(), properties, clock);
        jvmExitService = mock(JvmExitService.class);
        dispatcher = newDispatcher();
    }

    @AfterEach
    void tearDown() {
        dispatcher.destroy();
    }

    @Test
    void shouldAllocateAndReleaseWorkingMemory() {
        String sessionId = dispatcher.createSession(Map.of()).getId();

        HostResponse allocated = send(sessionId, "memory_allocate",
                Map.of("category", "Working", "size_bytes", 1_048_576, "purpose", "Image processing"));
        assertTrue(allocated.isSuccess());
        MemoryHandle handle = (MemoryHandle) allocated.getData();
        assertEquals(1_048_576, workingUsage(sessionId));

        HostResponse released = send(sessionId, "memory_release", Map.of("handle_id", handle.getId()));
        assertTrue(released.isSuccess());
        assertEquals(0, workingUsage(sessionId));
    }

    @Test
    void shouldReleaseEveryOwnedHandleOnClose() {
        String sessionId = dispatcher.createSession(Map.of("client", "test")).getId();
        List<String> handles = List.of(allocate(sessionId, 1024), allocate(sessionId, 2048),
                allocate(sessionId, 4096));

        HostResponse response = send(sessionId, "sessions_close", Map.of());

        assertTrue(response.isSuccess());
        CloseReport report = (CloseReport) response.getData();
        assertEquals(HostSession.SessionStatus.CLOSED, report.getStatus());
        assertEquals(handles.size(), report.getReleasedHandles().size());
        assertTrue(report.isClean());
        assertEquals(0, memoryRegistry.status().getHandleCount());
        assertTrue(sessionTable.find(sessionId).isEmpty());
        assertEquals(ErrorKind.SESSION_NOT_FOUND, send(sessionId, "memory_status", Map.of()).getErrorKind());
    }

    @Test
    void shouldCloseWithAggregatedFailureWhenOneReleaseFails() {
        String sessionId = dispatcher.createSession(Map.of()).getId();
        String first = allocate(sessionId, 1024);
        String second = allocate(sessionId, 1024);
        doThrow(new HostException(ErrorKind.HANDLE_NOT_FOUND, "simulated fault"))
                .when(memoryRegistry).release(second);

        CloseReport report = dispatcher.closeSession(sessionId);

        assertEquals(HostSession.SessionStatus.CLOSED, report.getStatus());
        assertEquals(List.of(first), report.getReleasedHandles());
        assertEquals(1, report.getFailures().size());
        assertEquals(second, report.getFailures().get(0).getHandleId());
        assertEquals(ErrorKind.HANDLE_NOT_FOUND, report.getFailures().get(0).getErrorKind());
        assertTrue(memoryRegistry.find(first).isEmpty());
        assertTrue(sessionTable.find(sessionId).isEmpty());
    }

    @Test
    void shouldReclaimHandleLeftByFaultedCloseWithoutHalting() {
        String sessionId = dispatcher.createSession(Map.of()).getId();
        String first = allocate(sessionId, 1024);
        String second = allocate(sessionId, 1024);
        doThrow(new IllegalStateException("simulated fault")).when(memoryRegistry).release(second);

        CloseReport report = dispatcher.closeSession(sessionId);
        assertEquals(1, report.getFailures().size());
        assertNull(report.getFailures().get(0).getErrorKind());
        assertTrue(memoryRegistry.find(second).isPresent());
        assertEquals(List.of(second), sessionTable.orphanedHandles());

        String otherSession = dispatcher.createSession(Map.of()).getId();
        clock.advance(Duration.ofSeconds(301));
        HostResponse response = send(otherSession, "memory_optimize", Map.of("strategy", "balanced"));

        assertTrue(response.isSuccess(), response.getError());
        OptimizationResult result = (OptimizationResult) response.getData();
        assertEquals(List.of(second), result.getReclaimedHandles());
        assertEquals(1024, result.getBytesFreed());
        assertTrue(memoryRegistry.find(first).isEmpty());
        assertTrue(memoryRegistry.find(second).isEmpty());
        assertEquals(0, memoryRegistry.status().getUsedBytes());
        assertTrue(sessionTable.orphanedHandles().isEmpty());
        verify(jvmExitService, never()).halt(anyInt());
        assertTrue(send(otherSession, "system_echo", Map.of()).isSuccess());
    }

    @Test
    void shouldReapOrphanOnNextOptimizationOnceReleaseRecovers() {
        String sessionId = dispatcher.createSession(Map.of()).getId();
        String handleId = allocate(sessionId, 4096);
        doThrow(new IllegalStateException("transient fault")).doCallRealMethod()
                .when(memoryRegistry).release(handleId);
        dispatcher.closeSession(sessionId);
        assertEquals(4096, memoryRegistry.status().getUsedBytes());

        String otherSession = dispatcher.createSession(Map.of()).getId();
        HostResponse response = send(otherSession, "memory_optimize", Map.of("strategy", "conservative"));

        assertTrue(response.isSuccess(), response.getError());
        OptimizationResult result = (OptimizationResult) response.getData();
        assertEquals(List.of(handleId), result.getReclaimedHandles());
        assertEquals(4096, result.getBytesFreed());
        assertEquals(0, memoryRegistry.status().getUsedBytes());
        assertTrue(sessionTable.orphanedHandles().isEmpty());
    }

    @Test
    void shouldFailSecondReleaseOfSameHandle() {
        String sessionId = dispatcher.createSession(Map.of()).getId();
        String handleId = allocate(sessionId, 1024);

        assertTrue(send(sessionId, "memory_release", Map.of("handle_id", handleId)).isSuccess());
        HostResponse second = send(sessionId, "memory_release", Map.of("handle_id", handleId));

        assertFalse(second.isSuccess());
        assertEquals(ErrorKind.HANDLE_NOT_FOUND, second.getErrorKind());
    }

    @Test
    void shouldNotReleaseHandleOwnedByAnotherSession() {
        String owner = dispatcher.createSession(Map.of()).getId();
        String other = dispatcher.createSession(Map.of()).getId();
        String handleId = allocate(owner, 1024);

        HostResponse response = send(other, "memory_release", Map.of("handle_id", handleId));

        assertEquals(ErrorKind.HANDLE_NOT_FOUND, response.getErrorKind());
        assertTrue(memoryRegistry.find(handleId).isPresent());
        assertTrue(sessionTable.owns(owner, handleId));
    }

    @Test
    void shouldDenyAndAuditWhenPolicyRejects() {
        String sessionId = dispatcher.createSession(Map.of()).getId();
        policy.addRule(PermissionRule.deny("memory", "allocate", "WORKING"));

        HostResponse response = send(sessionId, "memory_allocate",
                Map.of("category", "working", "size_bytes", 1024));

        assertEquals(ErrorKind.PERMISSION_DENIED, response.getErrorKind());
        assertEquals(0, memoryRegistry.status().getHandleCount());
        AuditEvent event = auditLog.recent(1).get(0);
        assertEquals("memory_allocate", event.getRequestType());
        assertEquals(PermissionEffect.DENY, event.getVerdict());
        assertEquals("PERMISSION_DENIED", event.getOutcome());
        assertEquals("WORKING", event.getResource());
    }

    @Test
    void shouldAuditUnknownSessionWithoutVerdict() {
        HostResponse response = send("ghost", "memory_status", Map.of());

        assertEquals(ErrorKind.SESSION_NOT_FOUND, response.getErrorKind());
        AuditEvent event = auditLog.recent(1).get(0);
        assertEquals("ghost", event.getSessionId());
        assertNull(event.getVerdict());
        assertEquals("SESSION_NOT_FOUND", event.getOutcome());
    }

    @Test
    void shouldRejectUnknownRequestType() {
        String sessionId = dispatcher.createSession(Map.of()).getId();

        HostResponse response = send(sessionId, "memory_defragment", Map.of());

        assertEquals(ErrorKind.INVALID_ARGUMENT, response.getErrorKind());
        assertEquals("No handler found for request type memory_defragment", response.getError());
    }

    @Test
    void shouldRejectMalformedParameters() {
        String sessionId = dispatcher.createSession(Map.of()).getId();

        HostResponse response = send(sessionId, "memory_allocate",
                Map.of("category", "working", "size_bytes", "lots"));

        assertEquals(ErrorKind.INVALID_ARGUMENT, response.getErrorKind());
    }

    @Test
    void shouldLeaveQuotaUnchangedOnRejectedAllocation() {
        String sessionId = dispatcher.createSession(Map.of()).getId();
        allocate(sessionId, 10 * MB);

        HostResponse response = send(sessionId, "memory_allocate",
                Map.of("category", "working", "size_bytes", 60 * MB));

        assertEquals(ErrorKind.QUOTA_EXCEEDED, response.getErrorKind());
        assertEquals(10 * MB, memoryRegistry.status().getUsedBytes());
        assertEquals(1, sessionTable.ownedHandleCount());
    }

    @Test
    void shouldDisownHandlesReclaimedByOptimization() {
        String sessionId = dispatcher.createSession(Map.of()).getId();
        HostResponse allocated = send(sessionId, "memory_allocate",
                Map.of("category", "short-term", "size_bytes", 1024));
        String handleId = ((MemoryHandle) allocated.getData()).getId();
        clock.advance(Duration.ofSeconds(301));

        HostResponse response = send(sessionId, "memory_optimize", Map.of("strategy", "balanced"));

        assertTrue(response.isSuccess());
        assertEquals(List.of(handleId), ((OptimizationResult) response.getData()).getReclaimedHandles());
        assertFalse(sessionTable.owns(sessionId, handleId));
        CloseReport report = dispatcher.closeSession(sessionId);
        assertTrue(report.getReleasedHandles().isEmpty());
        assertTrue(report.isClean());
    }

    @Test
    void shouldNeverLeaveHandlesBehindWhenAllocatingDuringClose() throws Exception {
        String sessionId = dispatcher.createSession(Map.of()).getId();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> workers = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                workers.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        send(sessionId, "memory_allocate", Map.of("category", "working", "size_bytes", 64));
                    }
                    return null;
                }));
            }
            start.countDown();
            Thread.sleep(5);
            dispatcher.closeSession(sessionId);
            for (Future<?> worker : workers) {
                worker.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        MemoryStatus status = memoryRegistry.status();
        assertEquals(0, status.getHandleCount());
        assertEquals(0, status.getUsedBytes());
        assertEquals(0, sessionTable.ownedHandleCount());
    }

    @Test
    void shouldKeepRegistryAndOwnershipConsistentWhenOptimizingDuringAllocateAndRelease() throws Exception {
        int workers = 4;
        int iterations = 100;
        long handleSize = 64;
        Queue<String> allocated = new ConcurrentLinkedQueue<>();
        Queue<String> released = new ConcurrentLinkedQueue<>();
        Queue<String> reclaimed = new ConcurrentLinkedQueue<>();
        String optimizerSession = dispatcher.createSession(Map.of()).getId();
        ExecutorService executor = Executors.newFixedThreadPool(workers + 1);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> tasks = new ArrayList<>();
        try {
            for (int t = 0; t < workers; t++) {
                String sessionId = dispatcher.createSession(Map.of()).getId();
                tasks.add(executor.submit(() -> {
                    start.await();
                    String previous = null;
                    for (int i = 0; i < iterations; i++) {
                        HostResponse allocation = send(sessionId, "memory_allocate",
                                Map.of("category", "short_term", "size_bytes", handleSize));
                        assertTrue(allocation.isSuccess(), allocation.getError());
                        String handleId = ((MemoryHandle) allocation.getData()).getId();
                        allocated.add(handleId);
                        if (previous != null) {
                            HostResponse release = send(sessionId, "memory_release",
                                    Map.of("handle_id", previous));
                            if (release.isSuccess()) {
                                released.add(previous);
                            } else {
                                assertEquals(ErrorKind.HANDLE_NOT_FOUND, release.getErrorKind());
                            }
                            previous = null;
                        } else {
                            previous = handleId;
                        }
                    }
                    return null;
                }));
            }
            tasks.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                    clock.advance(Duration.ofSeconds(61));
                    HostResponse response = send(optimizerSession, "memory_optimize",
                            Map.of("strategy", "aggressive"));
                    assertTrue(response.isSuccess(), response.getError());
                    reclaimed.addAll(((OptimizationResult) response.getData()).getReclaimedHandles());
                }
                return null;
            }));
            start.countDown();
            for (Future<?> task : tasks) {
                task.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        Set<String> gone = new HashSet<>(released);
        for (String handleId : reclaimed) {
            assertTrue(gone.add(handleId), "handle both released and reclaimed, or reclaimed twice: " + handleId);
        }
        Set<String> live = new HashSet<>(allocated);
        live.removeAll(gone);
        MemoryStatus status = memoryRegistry.status();
        assertEquals(live.size(), status.getHandleCount());
        assertEquals(live.size() * handleSize, status.getUsedBytes());
        assertEquals(status.getHandleCount(), sessionTable.ownedHandleCount());
        for (String handleId : live) {
            assertTrue(memoryRegistry.find(handleId).isPresent());
        }
        verify(jvmExitService, never()).halt(anyInt());
    }

    @Test
    void shouldDrainSessionsOnShutdownAndRefuseLaterRequests() {
        String first = dispatcher.createSession(Map.of()).getId();
        String second = dispatcher.createSession(Map.of()).getId();
        allocate(first, 1024);
        allocate(second, 2048);

        HostResponse response = send(first, "system_shutdown", Map.of());

        assertTrue(response.isSuccess());
        ShutdownReport report = (ShutdownReport) response.getData();
        assertTrue(report.isComplete());
        assertEquals(2, report.getClosed().size());
        assertEquals(0, memoryRegistry.status().getHandleCount());
        assertFalse(dispatcher.isRunning());
        assertEquals(ErrorKind.HOST_NOT_RUNNING, send(second, "system_info", Map.of()).getErrorKind());
        HostException ex = assertThrows(HostException.class, () -> dispatcher.createSession(Map.of()));
        assertEquals(ErrorKind.HOST_NOT_RUNNING, ex.getKind());
    }

    @Test
    void shouldReportStragglersWhenDrainTimesOut() throws Exception {
        properties.getKernel().setShutdownDrainTimeout(Duration.ofMillis(200));
        String stuck = dispatcher.createSession(Map.of()).getId();
        String requester = dispatcher.createSession(Map.of()).getId();
        String handleId = allocate(stuck, 1024);
        CountDownLatch unblock = new CountDownLatch(1);
        doAnswer(invocation -> {
            unblock.await(5, TimeUnit.SECONDS);
            return invocation.callRealMethod();
        }).when(memoryRegistry).release(handleId);

        try {
            HostResponse response = send(requester, "system_shutdown", Map.of());

            assertFalse(response.isSuccess());
            assertEquals(ErrorKind.SHUTDOWN_INCOMPLETE, response.getErrorKind());
            ShutdownReport report = assertInstanceOf(ShutdownReport.class, response.getData());
            assertTrue(report.getStragglers().contains(stuck));
        } finally {
            unblock.countDown();
        }
    }

    @Test
    void shouldRollBackAndHaltWhenOwnershipInvariantBreaks() {
        sessionTable = spy(new SessionTable(clock));
        dispatcher.destroy();
        dispatcher = newDispatcher();
        String sessionId = dispatcher.createSession(Map.of()).getId();
        doThrow(new InvariantViolationException("handle already owned"))
                .when(sessionTable).commitOwnership(anyString(), anyString());

        assertThrows(InvariantViolationException.class, () -> send(sessionId, "memory_allocate",
                Map.of("category", "working", "size_bytes", 1024)));

        assertEquals(0, memoryRegistry.status().getHandleCount());
        verify(jvmExitService).halt(FatalErrorHandler.EXIT_CODE);
        assertEquals("INVARIANT_VIOLATION", auditLog.recent(1).get(0).getOutcome());
        assertThrows(InvariantViolationException.class, () -> send(sessionId, "system_info", Map.of()));
    }

    @Test
    void shouldChangeSecurityLevelThroughRequests() {
        String sessionId = dispatcher.createSession(Map.of()).getId();

        HostResponse changed = send(sessionId, "security_set_level", Map.of("level", "high"));
        HostResponse denied = send(sessionId, "memory_allocate", Map.of("category", "working", "size_bytes", 1));

        assertTrue(changed.isSuccess());
        assertEquals(ErrorKind.PERMISSION_DENIED, denied.getErrorKind());
    }

    @Test
    void shouldManageRulesThroughRequests() {
        String sessionId = dispatcher.createSession(Map.of()).getId();

        assertTrue(send(sessionId, "security_add_permission", Map.of("resource_type", "file", "operation", "read",
                "resource", "/secrets/*", "effect", "deny")).isSuccess());
        HostResponse check = send(sessionId, "security_check",
                Map.of("resource_type", "file", "operation", "read", "resource", "/secrets/key"));
        HostResponse removed = send(sessionId, "security_remove_permission",
                Map.of("resource_type", "file", "operation", "read", "resource", "/secrets/*"));
        HostResponse removedAgain = send(sessionId, "security_remove_permission",
                Map.of("resource_type", "file", "operation", "read", "resource", "/secrets/*"));

        assertEquals(PermissionEffect.DENY, ((Map<?, ?>) check.getData()).get("verdict"));
        assertEquals(Map.of("removed", 1), removed.getData());
        assertTrue(removedAgain.isSuccess());
        assertEquals(Map.of("removed", 0), removedAgain.getData());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldReturnRecentAuditEvents() {
        String sessionId = dispatcher.createSession(Map.of()).getId();
        send(sessionId, "system_echo", Map.of("text", "one"));
        send(sessionId, "memory_status", Map.of());

        HostResponse response = send(sessionId, "security_audit", Map.of("limit", 2));

        List<AuditEvent> events = (List<AuditEvent>) response.getData();
        assertEquals(2, events.size());
        assertEquals("memory_status", events.get(0).getRequestType());
        assertEquals("system_echo", events.get(1).getRequestType());
        assertEquals(ErrorKind.INVALID_ARGUMENT,
                send(sessionId, "security_audit", Map.of("limit", 0)).getErrorKind());
    }

    @Test
    void shouldExecuteToolCapability() {
        String sessionId = dispatcher.createSession(Map.of()).getId();

        HostResponse response = send(sessionId, "tools_execute", Map.of("tool_id", "calculator",
                "capability", "add", "parameters", Map.of("a", 2, "b", 3)));

        assertTrue(response.isSuccess());
        assertEquals("5", ((ToolResult) response.getData()).getOutput());
        assertEquals(ErrorKind.TOOL_NOT_FOUND, send(sessionId, "tools_execute",
                Map.of("tool_id", "shell", "capability", "run")).getErrorKind());
        assertEquals(ErrorKind.CAPABILITY_NOT_FOUND, send(sessionId, "tools_execute",
                Map.of("tool_id", "calculator", "capability", "divide")).getErrorKind());
    }

    @Test
    void shouldEchoParametersAndDescribeHost() {
        String sessionId = dispatcher.createSession(Map.of()).getId();

        HostResponse echo = send(sessionId, "system_echo", Map.of("text", "hello"));
        HostResponse info = send(sessionId, "system_info", Map.of());

        assertEquals(Map.of("text", "hello"), echo.getData());
        Map<?, ?> data = (Map<?, ?>) info.getData();
        assertEquals("GolemCore Host", data.get("name"));
        assertEquals(1, data.get("live_sessions"));
    }

    private RequestDispatcher newDispatcher() {
        ToolRegistryService toolRegistry = new ToolRegistryService(List.of(new CalculatorTool()), properties, clock);
        FatalErrorHandler fatalErrorHandler = new FatalErrorHandler(jvmExitService, properties);
        return new RequestDispatcher(sessionTable, memoryRegistry, policy, auditLog, toolRegistry,
                fatalErrorHandler, properties, clock);
    }

    private HostResponse send(String sessionId, String type, Map<String, Object> parameters) {
        return dispatcher.process(sessionId, HostRequest.builder()
                .id("req-" + requestCounter.incrementAndGet())
                .type(type)
                .parameters(new HashMap<>(parameters))
                .timestamp(clock.millis())
                .build());
    }

    private String allocate(String sessionId, long sizeBytes) {
        HostResponse response = send(sessionId, "memory_allocate",
                Map.of("category", "working", "size_bytes", sizeBytes, "purpose", "test"));
        assertTrue(response.isSuccess(), response.getError());
        return ((MemoryHandle) response.getData()).getId();
    }

    private long workingUsage(String sessionId) {
        MemoryStatus status = (MemoryStatus) send(sessionId, "memory_status", Map.of()).getData();
        return status.category(MemoryCategory.WORKING).getUsedBytes();
    }
}
