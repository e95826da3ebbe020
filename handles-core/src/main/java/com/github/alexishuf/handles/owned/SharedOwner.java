package com.github.alexishuf.handles.owned;

import com.github.alexishuf.handles.owned.LeakDetector.LeakState;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.mustcall.qual.Owning;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.common.returnsreceiver.qual.This;

/**
 * One of possibly many owners of a value, which is disposed when its last owner is closed.
 *
 * <p>All {@link SharedOwner}s of a value share a single {@link ReferenceCounter}, whose
 * strong count is the number of owners. Disposing a value means calling its
 * {@link AutoCloseable#close()} if it is an {@link AutoCloseable} (errors are logged, not
 * thrown) and dropping the reference to it. Values that are not {@link AutoCloseable} are
 * only dropped.</p>
 *
 * <p>Copies are made with {@link #share()}, {@link #from(SharedOwner)} and
 * {@link #assign(SharedOwner)}; transfers with {@link #move()} and
 * {@link #moveFrom(SharedOwner)}. Every copy must eventually be {@link #close()}d.</p>
 *
 * <p>Instances are not thread-safe and neither are the counters they share: all owners and
 * observers of a value must be used from one thread or externally synchronized.</p>
 *
 * @param <T> the value type
 */
public final class SharedOwner<T> implements AutoCloseable {
    private @Nullable T value;
    private @Nullable ReferenceCounter counter;
    private final @Nullable LeakState leakState;

    /** Creates an empty owner: no value, no counter. */
    public SharedOwner() {
        leakState = LeakDetector.register(this);
    }

    /**
     * Creates the first owner of {@code value}, allocating a new {@link ReferenceCounter}
     * with strong count 1.
     *
     * @param value the value to own. {@code null} creates an empty owner without a counter
     */
    public SharedOwner(@Owning @Nullable T value) {
        if (value != null) {
            this.value = value;
            this.counter = new ReferenceCounter();
            this.counter.add();
        }
        if ((leakState = LeakDetector.register(this)) != null)
            leakState.update(value);
    }

    /**
     * Creates a new owner of the value observed by {@code observer}, if it is still alive.
     *
     * @param observer a possibly expired or empty observer
     */
    public SharedOwner(WeakObserver<? extends T> observer) {
        this(observer.lockValue(), observer.counter());
    }

    /** Shares {@code value} (which must be alive) with the owners counted by {@code counter}. */
    SharedOwner(@Nullable T value, @Nullable ReferenceCounter counter) {
        if (value != null && counter != null) {
            counter.add();
            this.value = value;
            this.counter = counter;
        }
        if ((leakState = LeakDetector.register(this)) != null)
            leakState.update(this.value);
    }

    public static <T> SharedOwner<T> of(@Owning @Nullable T value) {
        return new SharedOwner<>(value);
    }

    /**
     * Creates a new owner that shares the value of {@code source}.
     *
     * @param source an owner of {@code T} or of a subtype of {@code T}.
     * @return a new owner of the same value, empty if {@code source} is empty.
     */
    public static <T> SharedOwner<T> from(SharedOwner<? extends T> source) {
        return new SharedOwner<>(source.value, source.counter);
    }

    private void set(@Nullable T value, @Nullable ReferenceCounter counter) {
        this.value = value;
        this.counter = counter;
        if (leakState != null)
            leakState.update(value);
    }

    @Nullable ReferenceCounter counter() { return counter; }

    /**
     * Removes {@code this} from the owners of its value. If it was the last owner, the
     * value is disposed and, if there are no observers left, the counter is freed.
     * {@code this} is empty before the value is disposed. No-op if already empty.
     */
    private void release() {
        T value = this.value;
        ReferenceCounter counter = this.counter;
        if (counter == null)
            return;
        set(null, null);
        if (counter.remove() == 0) {
            try {
                HandleSupport.dispose(value);
            } finally {
                counter.freeIfUnreferenced();
            }
        }
    }

    /**
     * Creates another owner of the value, incrementing the strong count.
     *
     * @return a new owner that must be {@link #close()}d. Empty if {@code this} is empty.
     */
    public SharedOwner<T> share() {
        return new SharedOwner<>(value, counter);
    }

    /**
     * Transfers value and counter into a new owner, leaving {@code this} empty. Counts do
     * not change.
     *
     * @return a new owner holding what {@code this} held
     */
    public SharedOwner<T> move() {
        var moved = new SharedOwner<T>();
        moved.set(value, counter);
        set(null, null);
        return moved;
    }

    /**
     * Makes {@code this} another owner of the value of {@code source}, after releasing what
     * {@code this} previously owned. {@code x.assign(x)} is a no-op.
     *
     * @param source owner whose value will be shared
     * @return {@code this}
     */
    public @This SharedOwner<T> assign(SharedOwner<? extends T> source) {
        if (source == this)
            return this;
        T newValue = source.value;
        ReferenceCounter newCounter = source.counter;
        if (newCounter != null)
            newCounter.add(); // before release(): this and source may share newCounter
        release();
        set(newValue, newCounter);
        return this;
    }

    /**
     * Releases what {@code this} owned and takes value and counter from {@code source},
     * which becomes empty. {@code x.moveFrom(x)} is a no-op.
     *
     * @param source owner to be emptied
     * @return {@code this}
     */
    public @This SharedOwner<T> moveFrom(SharedOwner<? extends T> source) {
        if (source == this)
            return this;
        T newValue = source.value;
        ReferenceCounter newCounter = source.counter;
        source.set(null, null);
        release();
        set(newValue, newCounter);
        return this;
    }

    /** The owned value, or {@code null} if empty. */
    public @Nullable T get() { return value; }

    /**
     * The owned value.
     *
     * @throws OwnershipException if {@code this} is empty
     */
    public T value() {
        T value = this.value;
        if (value == null)
            throw OwnershipException.empty(this);
        return value;
    }

    public boolean isEmpty() { return counter == null; }

    /** Number of owners of the value (strong count), {@code 0} if empty. */
    public @NonNegative int useCount() {
        ReferenceCounter counter = this.counter;
        return counter == null ? 0 : counter.get();
    }

    /** Releases the value (see {@link #close()}) and becomes empty. */
    public void reset() { release(); }

    /**
     * Releases the current value (see {@link #close()}) and becomes the first owner of
     * {@code newValue}, with a new {@link ReferenceCounter}.
     *
     * @param newValue the value to own. {@code null} leaves {@code this} empty.
     * @throws IllegalArgumentException if {@code newValue} is the current value and there are
     *                                  other owners of it. If {@code this} is its only owner,
     *                                  this call is a no-op.
     */
    public void reset(@Owning @Nullable T newValue) {
        if (newValue != null && newValue == value) {
            if (useCount() == 1)
                return;
            throw new IllegalArgumentException("Cannot reset() to a value shared by other owners");
        }
        release();
        if (newValue != null) {
            var newCounter = new ReferenceCounter();
            newCounter.add();
            set(newValue, newCounter);
        }
    }

    /** Exchanges values and counters of {@code this} and {@code other}. */
    public void swap(SharedOwner<T> other) {
        T value = this.value;
        ReferenceCounter counter = this.counter;
        set(other.value, other.counter);
        other.set(value, counter);
    }

    /**
     * Creates a new owner of the value, viewed as a {@code U}.
     *
     * @param type the class of the new owner type parameter
     * @return a new owner of the same value, empty if {@code this} is empty
     * @throws ClassCastException if the value is not an instance of {@code type}
     */
    public <U> SharedOwner<U> cast(Class<U> type) {
        return new SharedOwner<>(type.cast(value), counter);
    }

    /** Creates a new {@link WeakObserver} of the value owned by {@code this}. */
    public WeakObserver<T> weak() { return new WeakObserver<>(this); }

    /**
     * Removes {@code this} from the owners of its value, leaving {@code this} empty. If it was
     * the last owner, disposes the value. May be called any number of times.
     */
    @Override public void close() { release(); }

    @Override public String toString() {
        return HandleSupport.makeName(this)+"{value="+HandleSupport.render(value)
                +", useCount="+useCount()+'}';
    }
}
