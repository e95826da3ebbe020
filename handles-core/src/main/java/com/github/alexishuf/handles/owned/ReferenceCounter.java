package com.github.alexishuf.handles.owned;

import com.github.alexishuf.handles.HandlesProperties;
import org.checkerframework.checker.index.qual.NonNegative;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Control block shared by all {@link SharedOwner}s and {@link WeakObserver}s of one value.
 *
 * <p>Holds two independent counts: <i>strong</i> (owners) and <i>weak</i> (observers). This
 * class knows nothing about the value and never frees itself: the handles decide, from the
 * counts, when the value dies (strong reaches zero) and when this counter is freed (both
 * counts are zero, see {@link #freeIfUnreferenced()}).</p>
 *
 * <p>There is no synchronization. Instances must be confined to a single thread or
 * externally synchronized.</p>
 */
public final class ReferenceCounter {
    private static final Logger log = LoggerFactory.getLogger(ReferenceCounter.class);
    private static final boolean CHECKS = HandlesProperties.checks();
    private static final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Observes allocation and release of {@link ReferenceCounter}s. This is the hook that
     * allows verifying that a control block is freed exactly once, and when.
     */
    public interface Listener {
        /** Called from the constructor of {@code counter}. */
        default void allocated(ReferenceCounter counter) {}

        /** Called once, when {@code counter} is freed by {@link #freeIfUnreferenced()}. */
        default void freed(ReferenceCounter counter) {}
    }

    private int strong, weak;
    private boolean freed;

    public ReferenceCounter() {
        if (!listeners.isEmpty())
            notifyListeners(this, true);
    }

    public static void addListener(Listener listener) { listeners.add(listener); }
    public static void removeListener(Listener listener) { listeners.remove(listener); }

    /** Increments the strong count. */
    public void add() {
        if (CHECKS && freed)
            throw OwnershipException.freed(this, "add()");
        ++strong;
    }

    /**
     * Decrements the strong count.
     *
     * @return the strong count after the decrement
     */
    public @NonNegative int remove() {
        if (CHECKS) {
            if (freed)      throw OwnershipException.freed(this, "remove()");
            if (strong < 1) throw OwnershipException.underflow(this, "remove()");
        }
        return --strong;
    }

    public @NonNegative int get() { return strong; }

    /** Increments the weak count. */
    public void addWeak() {
        if (CHECKS && freed)
            throw OwnershipException.freed(this, "addWeak()");
        ++weak;
    }

    /**
     * Decrements the weak count.
     *
     * @return the weak count after the decrement
     */
    public @NonNegative int removeWeak() {
        if (CHECKS) {
            if (freed)    throw OwnershipException.freed(this, "removeWeak()");
            if (weak < 1) throw OwnershipException.underflow(this, "removeWeak()");
        }
        return --weak;
    }

    public @NonNegative int getWeak() { return weak; }

    public boolean isFreed() { return freed; }

    /**
     * Frees this counter if both counts are zero and it was not freed before.
     *
     * <p>Both the strong side (after the last owner disposed the value) and the weak side
     * (after the last observer went away) call this. Whichever side drops its count to zero
     * last will free the counter.</p>
     *
     * @return {@code true} iff this call freed the counter.
     */
    public boolean freeIfUnreferenced() {
        if (freed || strong != 0 || weak != 0)
            return false;
        freed = true;
        if (!listeners.isEmpty())
            notifyListeners(this, false);
        return true;
    }

    private static void notifyListeners(ReferenceCounter counter, boolean allocated) {
        for (Listener l : listeners) {
            try {
                if (allocated) l.allocated(counter);
                else           l.freed(counter);
            } catch (Throwable t) {
                log.error("{} failed on {}({})", l, allocated ? "allocated" : "freed", counter, t);
            }
        }
    }

    @Override public String toString() {
        return HandleSupport.makeName(this)+"{strong="+strong+", weak="+weak
                +(freed ? ", freed}" : "}");
    }
}
