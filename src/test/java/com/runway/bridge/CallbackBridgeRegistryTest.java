package com.runway.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.runway.core.remote.RemoteStore;
import com.runway.executor.ExecutionProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class CallbackBridgeRegistryTest {

    private final CallbackBridgeRegistry registry = new CallbackBridgeRegistry(
            mock(RemoteStore.class), new ObjectMapper(), null, new ExecutionProperties());

    @AfterEach
    void tearDown() {
        registry.stopAll();
    }

    @Test
    @DisplayName("one started bridge per session")
    void onePerSession() {
        var first = registry.getOrStart("s-1");
        var again = registry.getOrStart("s-1");
        var other = registry.getOrStart("s-2");

        assertSame(first, again);
        assertNotSame(first, other);
        assertTrue(first.isStarted());
        assertNotEquals(first.getPort(), other.getPort());
        assertEquals(2, registry.activeCount());
    }

    @Test
    @DisplayName("release stops the bridge and is safe for unknown sessions")
    void release() {
        var bridge = registry.getOrStart("s-1");

        registry.release("s-1");
        registry.release("s-1");
        registry.release("never-seen");

        assertFalse(bridge.isStarted());
        assertTrue(registry.find("s-1").isEmpty());
        assertEquals(0, registry.activeCount());
    }
}
