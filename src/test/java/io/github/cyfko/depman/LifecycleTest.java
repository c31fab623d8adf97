package io.github.cyfko.depman;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LifecycleTest {

    @Test
    void testFlagsMapToLifecycle() {
        assertEquals(Lifecycle.EAGER, Lifecycle.of(true, true));
        assertEquals(Lifecycle.LAZY, Lifecycle.of(false, true));
    }

    @Test
    void testNonSingleInstanceIsAlwaysFactory() {
        assertEquals(Lifecycle.FACTORY, Lifecycle.of(true, false));
        assertEquals(Lifecycle.FACTORY, Lifecycle.of(false, false));
    }
}
