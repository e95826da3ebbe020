package com.github.alexishuf.handles.owned;

import org.checkerframework.checker.nullness.qual.Nullable;

import static com.github.alexishuf.handles.owned.HandleSupport.render;

/**
 * Signals the use of a handle or {@link ReferenceCounter} in a state where the operation
 * has no meaning: dereferencing an empty handle, or corrupting the counts of a control block.
 */
public class OwnershipException extends IllegalStateException {
    public OwnershipException(String message) {
        super(message);
    }

    public OwnershipException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }

    /** {@code handle.value()} was called while {@code handle} held nothing. */
    public static OwnershipException empty(Object handle) {
        return new OwnershipException(render(handle)+" is empty");
    }

    /** {@code counter} was mutated with {@code op} after it was freed. */
    public static OwnershipException freed(ReferenceCounter counter, String op) {
        return new OwnershipException(op+" on freed "+render(counter));
    }

    /** {@code op} would take a count of {@code counter} below zero. */
    public static OwnershipException underflow(ReferenceCounter counter, String op) {
        return new OwnershipException(op+" would make a count of "+render(counter)+" negative");
    }

    @Override public String toString() {
        return getClass().getSimpleName()+": "+getMessage();
    }
}
