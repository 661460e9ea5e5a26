package me.golemcore.host.domain.service;

import me.golemcore.host.domain.exception.InvariantViolationException;
import me.golemcore.host.infrastructure.config.HostProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class FatalErrorHandlerTest {

    private JvmExitService jvmExitService;
    private HostProperties properties;
    private FatalErrorHandler handler;

    @BeforeEach
    void setUp() {
        jvmExitService = mock(JvmExitService.class);
        properties = new HostProperties();
        handler = new FatalErrorHandler(jvmExitService, properties);
    }

    @Test
    void shouldBeHealthyUntilFirstViolation() {
        assertFalse(handler.isFaulted());
        assertDoesNotThrow(handler::ensureHealthy);
    }

    @Test
    void shouldHaltProcessOnceAndRefuseFurtherWork() {
        handler.halt(new InvariantViolationException("handle owned twice"));
        handler.halt(new InvariantViolationException("usage negative"));

        verify(jvmExitService, times(1)).halt(FatalErrorHandler.EXIT_CODE);
        assertTrue(handler.isFaulted());
        InvariantViolationException ex = assertThrows(InvariantViolationException.class, handler::ensureHealthy);
        assertTrue(ex.getMessage().contains("handle owned twice"));
    }

    @Test
    void shouldSkipExitWhenDisabled() {
        properties.getKernel().setExitOnInvariantViolation(false);

        handler.halt(new InvariantViolationException("broken"));

        verify(jvmExitService, never()).halt(anyInt());
        assertTrue(handler.isFaulted());
    }
}
