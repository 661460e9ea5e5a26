package me.golemcore.host.adapter.inbound.web.controller;

import me.golemcore.host.adapter.inbound.web.dto.SystemHealthResponse;
import me.golemcore.host.domain.model.MemoryCategory;
import me.golemcore.host.domain.service.FatalErrorHandler;
import me.golemcore.host.domain.service.MemoryRegistryService;
import me.golemcore.host.domain.service.PermissionPolicyService;
import me.golemcore.host.domain.service.RequestDispatcher;
import me.golemcore.host.domain.service.SessionTable;
import me.golemcore.host.infrastructure.config.HostProperties;
import me.golemcore.host.security.MaximumLevelGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SystemControllerTest {

    private RequestDispatcher dispatcher;
    private FatalErrorHandler fatalErrorHandler;
    private SessionTable sessionTable;
    private MemoryRegistryService memoryRegistry;
    private SystemController controller;

    @BeforeEach
    void setUp() {
        HostProperties properties = new HostProperties();
        Clock clock = Clock.systemUTC();
        dispatcher = mock(RequestDispatcher.class);
        fatalErrorHandler = mock(FatalErrorHandler.class);
        sessionTable = new SessionTable(clock);
        memoryRegistry = new MemoryRegistryService(properties, clock);
        when(dispatcher.isRunning()).thenReturn(true);

        controller = new SystemController(dispatcher, sessionTable, memoryRegistry,
                new PermissionPolicyService(properties, new MaximumLevelGuard()), fatalErrorHandler, properties);
    }

    @Test
    void shouldReturnHealthStatus() {
        sessionTable.create(Map.of());
        memoryRegistry.allocate("s1", MemoryCategory.WORKING, 2048, "buffer");

        StepVerifier.create(controller.health())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    SystemHealthResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("UP", body.getStatus());
                    assertEquals("GolemCore Host", body.getName());
                    assertEquals("STANDARD", body.getSecurityLevel());
                    assertEquals(1, body.getLiveSessions());
                    assertEquals(2048, body.getMemory().getUsedBytes());
                    assertEquals(1, body.getMemory().getHandleCount());
                    assertTrue(body.getUptimeMs() >= 0);
                })
                .verifyComplete();
    }

    @Test
    void shouldReportStoppedAfterShutdown() {
        when(dispatcher.isRunning()).thenReturn(false);

        StepVerifier.create(controller.health())
                .assertNext(response -> assertEquals("STOPPED", response.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldReportFaultedHost() {
        when(fatalErrorHandler.isFaulted()).thenReturn(true);

        StepVerifier.create(controller.health())
                .assertNext(response -> assertEquals("FAULTED", response.getBody().getStatus()))
                .verifyComplete();
    }
}
