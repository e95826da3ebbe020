package com.github.alexishuf.handles.owned;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HandleSupportTest {

    @Test void testMakeName() {
        var probe = new Probe(1);
        String name = HandleSupport.makeName(probe);
        assertTrue(name.startsWith("Probe@"), name);
        assertEquals(name, HandleSupport.makeName(probe));
        assertTrue(HandleSupport.makeName(new Object() {}).contains("@"));
    }

    @Test void testRender() {
        assertEquals("null", HandleSupport.render(null));
        try (var s = SharedOwner.of(new Probe(1))) {
            assertEquals(s.toString(), HandleSupport.render(s));
        }
    }

    @Test void testDispose() {
        var probe = new Probe(1);
        HandleSupport.dispose(probe);
        assertEquals(1, probe.closed);
        HandleSupport.dispose(null);
        HandleSupport.dispose("not closeable");
    }

    @Test void testDisposeSwallowsAndLogsErrors() {
        AutoCloseable failing = () -> { throw new IllegalStateException("test failure, expected in logs"); };
        assertDoesNotThrow(() -> HandleSupport.dispose(failing));
        Object badToString = new AutoCloseable() {
            @Override public void close() { throw new RuntimeException("test failure, expected in logs"); }
            @Override public String toString() { throw new RuntimeException("bad toString"); }
        };
        assertDoesNotThrow(() -> HandleSupport.dispose(badToString));
    }
}
