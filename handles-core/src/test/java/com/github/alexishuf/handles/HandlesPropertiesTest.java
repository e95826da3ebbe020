package com.github.alexishuf.handles;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class HandlesPropertiesTest {
    private static final String TEST_PROP_NAME = "handles.test.prop";

    @AfterEach void tearDown() {
        System.clearProperty(TEST_PROP_NAME);
        HandlesProperties.refresh();
    }

    @Test void testReadDefault() {
        assertEquals(47, HandlesProperties.readProperty(TEST_PROP_NAME, 47,
                (src, val) -> Integer.parseInt(val)));
    }

    @Test void testReadProp() {
        System.setProperty(TEST_PROP_NAME, "23");
        assertEquals(23, HandlesProperties.readProperty(TEST_PROP_NAME, 47,
                (src, val) -> Integer.parseInt(val)));
    }

    @ParameterizedTest @ValueSource(strings = {"true", "TRUE", " t", "1", "y", "yes "})
    void testReadTrue(String value) {
        System.setProperty(TEST_PROP_NAME, value);
        assertTrue(HandlesProperties.readBoolean(TEST_PROP_NAME, false));
    }

    @ParameterizedTest @ValueSource(strings = {"false", "F", "0", "n", " no"})
    void testReadFalse(String value) {
        System.setProperty(TEST_PROP_NAME, value);
        assertFalse(HandlesProperties.readBoolean(TEST_PROP_NAME, true));
    }

    @Test void testBadBoolean() {
        System.setProperty(TEST_PROP_NAME, "maybe");
        var e = assertThrows(IllegalArgumentException.class,
                             () -> HandlesProperties.readBoolean(TEST_PROP_NAME, true));
        assertTrue(e.getMessage().contains("JVM property "+TEST_PROP_NAME), e.getMessage());
    }

    @Test void testRefresh() {
        System.setProperty(HandlesProperties.STACK_TRACE, "true");
        try {
            HandlesProperties.refresh();
            assertTrue(HandlesProperties.stackTrace());
            System.setProperty(HandlesProperties.STACK_TRACE, "false");
            assertTrue(HandlesProperties.stackTrace()); // cached
            HandlesProperties.refresh();
            assertFalse(HandlesProperties.stackTrace());
        } finally {
            System.clearProperty(HandlesProperties.STACK_TRACE);
        }
    }

    @Test void testChecksDefault() {
        HandlesProperties.refresh();
        if (System.getProperty(HandlesProperties.CHECKS) == null
                && System.getenv("HANDLES_CHECKS") == null) {
            assertTrue(HandlesProperties.checks());
        }
    }
}
