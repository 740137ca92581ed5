package com.switchyard.agents;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LaunchLockRegistryTest {

    @Test
    @DisplayName("returns the same lock for the same terminal id")
    void sameLockPerId() {
        LaunchLockRegistry registry = new LaunchLockRegistry();

        assertSame(registry.lockFor("t1"), registry.lockFor("t1"));
        assertNotSame(registry.lockFor("t1"), registry.lockFor("t2"));
        assertTrue(registry.lockFor("t1").isFair());
    }
}
