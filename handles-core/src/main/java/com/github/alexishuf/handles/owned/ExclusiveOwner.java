package com.github.alexishuf.handles.owned;

import com.github.alexishuf.handles.owned.LeakDetector.LeakState;
import org.checkerframework.checker.mustcall.qual.Owning;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.common.returnsreceiver.qual.This;

/**
 * A handle that is the single owner of a value.
 *
 * <p>There is no way to duplicate an {@link ExclusiveOwner}: ownership can only be
 * transferred with {@link #move()}, {@link #from(ExclusiveOwner)} or
 * {@link #moveFrom(ExclusiveOwner)}, which leave the source empty. Closing the handle disposes
 * the value (see {@link SharedOwner} for what "dispose" means). Use as:</p>
 *
 * <pre>{@code
 *     try (var owner = ExclusiveOwner.of(new Connection())) {
 *         owner.value().send(msg);
 *         consumer.accept(owner.move()); // consumer now must close
 *     } // no-op, owner is empty after move()
 * }</pre>
 *
 * <p>Instances are not thread-safe.</p>
 *
 * @param <T> the value type
 */
public final class ExclusiveOwner<T> implements AutoCloseable {
    private @Nullable T value;
    private final @Nullable LeakState leakState;

    /** Creates an empty handle. */
    public ExclusiveOwner() {
        leakState = LeakDetector.register(this);
    }

    /**
     * Creates a handle that owns {@code value}.
     *
     * @param value the value to own, {@code null} creates an empty handle.
     */
    public ExclusiveOwner(@Owning @Nullable T value) {
        this.value = value;
        if ((leakState = LeakDetector.register(this)) != null)
            leakState.update(value);
    }

    public static <T> ExclusiveOwner<T> of(@Owning @Nullable T value) {
        return new ExclusiveOwner<>(value);
    }

    /**
     * Moves the value out of {@code source}, which may hold a subtype of {@code T}, into a
     * new handle.
     *
     * @param source handle whose value will be taken. It will be empty once this returns.
     * @return a new handle owning what {@code source} owned.
     */
    public static <T> ExclusiveOwner<T> from(ExclusiveOwner<? extends T> source) {
        return new ExclusiveOwner<>(source.release());
    }

    private void set(@Nullable T value) {
        this.value = value;
        if (leakState != null)
            leakState.update(value);
    }

    /**
     * Transfers the value into a new handle, leaving {@code this} empty.
     *
     * @return a new handle with the value of {@code this}
     */
    public ExclusiveOwner<T> move() {
        return new ExclusiveOwner<>(release());
    }

    /**
     * Disposes the current value (if any) and takes the value of {@code source}, which
     * becomes empty. {@code x.moveFrom(x)} is a no-op.
     *
     * @param source the handle to take the value from
     * @return {@code this}
     */
    public @This ExclusiveOwner<T> moveFrom(ExclusiveOwner<? extends T> source) {
        if (source != this)
            reset(source.release());
        return this;
    }

    /** The owned value, or {@code null} if empty. Ownership does not change. */
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

    public boolean isEmpty() { return value == null; }

    /**
     * Empties this handle without disposing the value. The caller becomes responsible for
     * the returned value.
     *
     * @return the value previously owned, or {@code null} if empty
     */
    public @Nullable T release() {
        T value = this.value;
        set(null);
        return value;
    }

    /** Disposes the owned value (if any) and becomes empty. */
    public void reset() { reset(null); }

    /**
     * Disposes the owned value (if any) and takes ownership of {@code newValue}.
     *
     * <p>If {@code newValue} is the currently owned value, this is a no-op.</p>
     *
     * @param newValue new value to own, {@code null} leaves this empty.
     */
    public void reset(@Owning @Nullable T newValue) {
        T old = this.value;
        if (old == newValue)
            return;
        set(newValue);
        HandleSupport.dispose(old);
    }

    /** Exchanges the values of {@code this} and {@code other}. */
    public void swap(ExclusiveOwner<T> other) {
        T mine = this.value;
        set(other.value);
        other.set(mine);
    }

    /** Equivalent to {@link #reset()}. May be called any number of times. */
    @Override public void close() { reset(null); }

    @Override public String toString() {
        return HandleSupport.makeName(this)+'{'+HandleSupport.render(value)+'}';
    }
}
