package com.github.alexishuf.handles.owned;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class LeakDetectorTest {
    private static final Logger log = LoggerFactory.getLogger(LeakDetectorTest.class);

    private static final class Leaked {
        @Override public String toString() { return "Leaked"; }
    }

    @Test void testLeakStateTracksValue() {
        var handle = new Object();
        var state = new LeakDetector.LeakState(handle);
        assertFalse(state.holding());
        state.update(new Leaked());
        assertTrue(state.holding());
        state.update(null);
        assertFalse(state.holding());
        state.run(); // not holding: reports nothing
    }

    @Test void testDetectsLeakedHandles() throws InterruptedException {
        if (!LeakDetector.ENABLED) {
            log.warn("Will not test LeakDetector, disabled");
            return;
        }
        var bos = new ByteArrayOutputStream();
        var out = new PrintStream(bos, true, StandardCharsets.UTF_8);
        LeakDetector.reportTo(out);
        try {
            for (int i = 0; i < 1_000; i++) {
                new ExclusiveOwner<>(new Leaked());
                new SharedOwner<>(new Leaked());
                new ExclusiveOwner<>(new Leaked()).close(); // not a leak
            }
            String report = "";
            String leakedName = Leaked.class.getName();
            for (int i = 0; i < 40 && !report.contains(leakedName); i++) {
                System.gc();
                Thread.sleep(50);
                report = bos.toString(StandardCharsets.UTF_8);
            }
            assertTrue(report.contains("LEAK"), "no leak reported");
            assertTrue(report.contains(leakedName));
            assertTrue(report.contains("Owner@"));
        } finally {
            LeakDetector.reportTo(null);
        }
    }
}
