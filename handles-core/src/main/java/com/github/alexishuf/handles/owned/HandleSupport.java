package com.github.alexishuf.handles.owned;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.Integer.toHexString;
import static java.lang.System.identityHashCode;

public class HandleSupport {
    private static final Logger log = LoggerFactory.getLogger(HandleSupport.class);

    /** {@code SimpleClassName@identityHash}, never calls {@code o.toString()}. */
    public static String makeName(Object o) {
        Class<?> cls = o.getClass();
        String name = cls.getSimpleName();
        if (name.isEmpty())
            name = cls.getName();
        return name+'@'+toHexString(identityHashCode(o));
    }

    /** Like {@link #makeName(Object)}, but null-safe and uses {@code toString()} of handles. */
    public static String render(@Nullable Object o) {
        if (o == null)
            return "null";
        if (o instanceof ReferenceCounter || o instanceof ExclusiveOwner<?>
                || o instanceof SharedOwner<?> || o instanceof WeakObserver<?>)
            return o.toString();
        return makeName(o);
    }

    /**
     * Ends the life of {@code value}: if it is an {@link AutoCloseable}, calls its
     * {@code close()}. Errors are logged, never thrown.
     *
     * @param value the value whose last owner went away. May be null, which is a no-op.
     */
    static void dispose(@Nullable Object value) {
        if (value instanceof AutoCloseable c) {
            try {
                c.close();
            } catch (Throwable t) {
                handleDisposeError(log, value, t);
            }
        }
    }

    public static void handleDisposeError(Logger logger, Object object, Throwable err) {
        String str;
        try {
            str = object.toString();
        } catch (Throwable strError)  {
            str = object.getClass().getName()+'@'+toHexString(identityHashCode(object));
        }
        logger.error("Error disposing {}", str, err);
    }
}
