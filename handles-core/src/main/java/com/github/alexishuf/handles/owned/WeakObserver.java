package com.github.alexishuf.handles.owned;

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.common.returnsreceiver.qual.This;

import java.lang.ref.WeakReference;

/**
 * Observes the value of a {@link SharedOwner} without owning it.
 *
 * <p>An observer keeps the {@link ReferenceCounter} of the value alive (through the weak
 * count), but not the value: once the last {@link SharedOwner} is closed the value is
 * disposed and the observer becomes {@link #expired()}. The value can only be accessed by
 * {@link #lock()}ing the observer into a new owner:</p>
 *
 * <pre>{@code
 *     try (var owner = observer.lock()) {
 *         if (!owner.isEmpty())
 *             owner.value().refresh();
 *     }
 * }</pre>
 *
 * <p>Instances are not thread-safe.</p>
 *
 * @param <T> the value type
 */
public final class WeakObserver<T> implements AutoCloseable {
    private @Nullable WeakReference<T> target;
    private @Nullable ReferenceCounter counter;

    /** Creates an empty observer, which is always {@link #expired()}. */
    public WeakObserver() { }

    /**
     * Creates an observer of the value owned by {@code owner}.
     *
     * @param owner the owner of the value to observe. If empty, this observer is also empty
     */
    public WeakObserver(SharedOwner<? extends T> owner) {
        ReferenceCounter counter = owner.counter();
        T value = owner.get();
        if (counter != null && value != null) {
            counter.addWeak();
            this.target = new WeakReference<>(value);
            this.counter = counter;
        }
    }

    private WeakObserver(@Nullable WeakReference<T> target, @Nullable ReferenceCounter counter) {
        this.target = target;
        this.counter = counter;
    }

    @Nullable ReferenceCounter counter() { return counter; }

    /** The observed value if it is still alive, else {@code null}. */
    @Nullable T lockValue() {
        WeakReference<T> target = this.target;
        ReferenceCounter counter = this.counter;
        if (target == null || counter == null || counter.get() == 0)
            return null;
        return target.get();
    }

    /**
     * Stops observing. If the value is already dead and this was the last observer, the
     * counter is freed. No-op if already empty.
     */
    private void release() {
        ReferenceCounter counter = this.counter;
        if (counter == null)
            return;
        this.counter = null;
        this.target = null;
        counter.removeWeak();
        counter.freeIfUnreferenced();
    }

    /**
     * Creates another observer of the same value, incrementing the weak count.
     *
     * @return a new observer that must be {@link #close()}d. Empty if {@code this} is empty.
     */
    public WeakObserver<T> copy() {
        ReferenceCounter counter = this.counter;
        if (counter == null)
            return new WeakObserver<>();
        counter.addWeak();
        return new WeakObserver<>(target, counter);
    }

    /**
     * Transfers what {@code this} observes into a new observer, leaving {@code this} empty.
     * Counts do not change.
     */
    public WeakObserver<T> move() {
        var moved = new WeakObserver<>(target, counter);
        target = null;
        counter = null;
        return moved;
    }

    /**
     * Observe what {@code source} observes, after releasing what {@code this} observed.
     * {@code x.assign(x)} is a no-op.
     *
     * @param source the observer to copy
     * @return {@code this}
     */
    @SuppressWarnings("unchecked")
    public @This WeakObserver<T> assign(WeakObserver<? extends T> source) {
        if (source == this)
            return this;
        ReferenceCounter newCounter = source.counter;
        var newTarget = (WeakReference<T>)(WeakReference<?>)source.target;
        if (newCounter != null)
            newCounter.addWeak(); // before release(): this and source may share newCounter
        release();
        this.target = newCounter == null ? null : newTarget;
        this.counter = newCounter;
        return this;
    }

    /**
     * Observe the value owned by {@code owner}, after releasing what {@code this} observed.
     *
     * @param owner the owner of the value to observe. If empty, {@code this} becomes empty.
     * @return {@code this}
     */
    public @This WeakObserver<T> assign(SharedOwner<? extends T> owner) {
        ReferenceCounter newCounter = owner.counter();
        T value = owner.get();
        if (newCounter != null && value != null) {
            newCounter.addWeak();
            release();
            this.target = new WeakReference<>(value);
            this.counter = newCounter;
        } else {
            release();
        }
        return this;
    }

    /**
     * Releases what {@code this} observed and takes what {@code source} observes, leaving
     * {@code source} empty. {@code x.moveFrom(x)} is a no-op.
     *
     * @param source the observer to be emptied
     * @return {@code this}
     */
    @SuppressWarnings("unchecked")
    public @This WeakObserver<T> moveFrom(WeakObserver<? extends T> source) {
        if (source == this)
            return this;
        var newTarget = (WeakReference<T>)(WeakReference<?>)source.target;
        ReferenceCounter newCounter = source.counter;
        source.target = null;
        source.counter = null;
        release();
        this.target = newTarget;
        this.counter = newCounter;
        return this;
    }

    /** Number of owners of the observed value (strong count), {@code 0} if empty or dead. */
    public @NonNegative int useCount() {
        ReferenceCounter counter = this.counter;
        return counter == null ? 0 : counter.get();
    }

    /** Whether the observed value has been disposed, i.e., {@code useCount() == 0}. */
    public boolean expired() { return useCount() == 0; }

    public boolean isEmpty() { return counter == null; }

    /**
     * Creates a new owner of the observed value if it is still alive.
     *
     * @return a new {@link SharedOwner} of the value, or an empty one if {@link #expired()}.
     */
    public SharedOwner<T> lock() {
        return new SharedOwner<>(lockValue(), counter);
    }

    /** Stops observing the value (see {@link #close()}) and becomes empty. */
    public void reset() { release(); }

    /** Exchanges what {@code this} and {@code other} observe. */
    public void swap(WeakObserver<T> other) {
        WeakReference<T> target = this.target;
        ReferenceCounter counter = this.counter;
        this.target = other.target;
        this.counter = other.counter;
        other.target = target;
        other.counter = counter;
    }

    /**
     * Stops observing, leaving {@code this} empty. If the value is already dead and this was
     * its last observer, the {@link ReferenceCounter} is freed. May be called any number of
     * times.
     */
    @Override public void close() { release(); }

    @Override public String toString() {
        return HandleSupport.makeName(this)+"{useCount="+useCount()+(expired() ? ", expired}" : "}");
    }
}
