package com.github.alexishuf.handles.owned;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/** End-to-end walks through exclusive, shared and weak handles of one value. */
class OwnershipScenariosTest {

    @Test void testExclusiveMove() {
        var e1 = ExclusiveOwner.of(5);
        var e2 = e1.move();
        assertNull(e1.get());
        assertEquals(5, e2.value());
        e1.close();
        e2.close();
    }

    @Test void testSharedCopyThenWeakExpiry() {
        Probe value = new Probe(1);
        var s1 = SharedOwner.of(value);
        assertEquals(1, s1.useCount());
        var s2 = s1.share();
        assertEquals(2, s1.useCount());
        assertEquals(2, s2.useCount());
        s1.reset();
        assertEquals(1, s2.useCount());
        assertEquals(0, value.closed);

        var w = new WeakObserver<>(s2);
        s2.reset();
        assertEquals(1, value.closed);
        assertTrue(w.expired());
        try (var locked = w.lock()) {
            assertNull(locked.get());
        }
        w.close();
    }

    @Test void testControlBlockOutlivesValue() {
        try (var tracker = new Probe.Tracker()) {
            Probe foo = new Probe(1);
            var s = SharedOwner.of(foo);
            var w = new WeakObserver<>(s);
            s.reset();
            assertEquals(1, foo.closed);
            assertEquals(1, tracker.allocated.size());
            assertEquals(0, tracker.freed.size());
            assertEquals(1, tracker.allocated.get(0).getWeak());

            w.reset();
            assertEquals(1, tracker.freed.size());
            assertSame(tracker.allocated.get(0), tracker.freed.get(0));
        }
    }

    @Test void testControlBlockFreedByOwnerWhenObserversGoFirst() {
        try (var tracker = new Probe.Tracker()) {
            Probe foo = new Probe(1);
            var s = SharedOwner.of(foo);
            var w = new WeakObserver<>(s);
            w.reset();
            assertEquals(0, tracker.freed.size());
            assertEquals(0, foo.closed);
            s.reset();
            assertEquals(1, foo.closed);
            assertEquals(1, tracker.freed.size());
        }
    }

    @Test void testSelfAssignKeepsCount() {
        try (var s1 = SharedOwner.of(9);
             var s2 = s1.share()) {
            s1.assign(s1);
            assertEquals(2, s1.useCount());
            assertEquals(2, s2.useCount());
            assertEquals(9, s1.value());
        }
    }

    @Test void testLockIncrementsByOne() {
        Probe value = new Probe(1);
        try (var s = SharedOwner.of(value);
             var s2 = s.share();
             var w = s.weak()) {
            int before = w.useCount();
            try (var locked = w.lock()) {
                assertEquals(before+1, locked.useCount());
                assertSame(value, locked.get());
            }
            assertEquals(before, s2.useCount());
        }
        assertEquals(1, value.closed);
    }
}
