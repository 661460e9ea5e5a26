package me.golemcore.host.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MaximumLevelGuardTest {

    private MaximumLevelGuard guard;

    @BeforeEach
    void setUp() {
        guard = new MaximumLevelGuard();
    }

    @Test
    void shouldVetoSystemLocations() {
        assertFalse(guard.permits("file", "read", "/system/config"));
        assertFalse(guard.permits("file", "write", "C:\\Windows\\system32\\drivers"));
    }

    @Test
    void shouldVetoExecutableWrites() {
        assertFalse(guard.permits("file", "write", "/tmp/payload.EXE"));
        assertFalse(guard.permits("file", "write", "/tmp/lib.dll"));
        assertTrue(guard.permits("file", "read", "/tmp/lib.dll"));
    }

    @Test
    void shouldAllowOnlyTrustedNetworkTargets() {
        assertTrue(guard.permits("network", "connect", "localhost:8080"));
        assertTrue(guard.permits("network", "connect", "127.0.0.1:5432"));
        assertTrue(guard.permits("network", "connect", "api.example.com:443"));
        assertFalse(guard.permits("network", "connect", "evil.example.com:443"));
    }

    @Test
    void shouldPassOtherResources() {
        assertTrue(guard.permits("memory", "allocate", "WORKING"));
        assertTrue(guard.permits("file", "read", "/tmp/notes.txt"));
    }
}
