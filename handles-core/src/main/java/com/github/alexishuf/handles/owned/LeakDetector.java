package com.github.alexishuf.handles.owned;

import com.github.alexishuf.handles.HandlesProperties;
import org.checkerframework.checker.mustcall.qual.NotOwning;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.lang.ref.Cleaner;

/**
 * Reports {@link ExclusiveOwner} and {@link SharedOwner} instances that became unreachable
 * while still holding a value, i.e., whose value will never be disposed.
 *
 * <p>Enabled by {@link HandlesProperties#detectLeaks()}. The detector only reports: it never
 * disposes the leaked value.</p>
 */
public class LeakDetector {
    private static final Logger log = LoggerFactory.getLogger(LeakDetector.class);
    private static final LeakDetector INSTANCE = new LeakDetector();
    private static final boolean STACK_TRACE = HandlesProperties.stackTrace();
    private static final boolean PRINT       = HandlesProperties.printLeaks();
    private static final boolean JFR         = HandlesProperties.jfrLeaks();

    public static final boolean ENABLED = HandlesProperties.detectLeaks();

    private volatile PrintStream out = System.err;
    private boolean notifiedIOException;
    private final Cleaner cleaner;

    private LeakDetector() {
        cleaner = Cleaner.create(r -> {
            Thread thread = new Thread(r, "LeakDetector");
            thread.setDaemon(true);
            thread.setPriority(Thread.MIN_PRIORITY);
            return thread;
        });
    }

    /**
     * Creates a {@link LeakState} for {@code handle} and registers {@code handle} for leak
     * detection, if {@link #ENABLED}.
     *
     * @param handle the handle being constructed
     * @return the {@link LeakState} the handle must {@link LeakState#update(Object)} or
     *         {@code null} if leak detection is disabled.
     */
    static @Nullable LeakState register(Object handle) {
        if (!ENABLED)
            return null;
        LeakState state = new LeakState(handle);
        INSTANCE.cleaner.register(handle, state);
        return state;
    }

    /**
     * Report leaked handles to {@code out}.
     *
     * <p>The {@link LeakDetector} thread will not close {@code out}. However, if an error
     * happens while writing to {@code out} (e.g., {@code out} being concurrently closed),
     * {@link LeakDetector} will revert to writing reports back into the default
     * destination: {@link System#err}.</p>
     *
     * @param out destination of leak reports, {@code null} restores {@link System#err}.
     */
    public static void reportTo(@NotOwning @Nullable PrintStream out) {
        INSTANCE.out = out == null ? System.err : out;
        INSTANCE.notifiedIOException = false;
    }

    private void reportPrintError() {
        PrintStream out = this.out;
        if (out.checkError() && !notifiedIOException) {
            notifiedIOException = true;
            log.error("IOException on LeakDetector output {}{}", out,
                    out != System.err ? ", reverting output to System.err" : "");
            if (out != System.err) {
                this.out = System.err;
                notifiedIOException = false;
            }
        }
    }

    /**
     * Tracks whether a handle holds a value, without holding a reference to the handle
     * itself nor to the value.
     *
     * <p>Run by the {@link Cleaner} thread once the handle becomes phantom reachable. If the
     * handle still held a value at that point, a leak is reported.</p>
     */
    static final class LeakState implements Runnable {
        private final String handleName;
        private final @Nullable Throwable origin;
        private @Nullable String valueClassName;

        LeakState(Object handle) {
            this.handleName = HandleSupport.makeName(handle);
            this.origin = STACK_TRACE ? new Throwable(handleName+" created") : null;
        }

        /**
         * Called by the handle whenever its value changes.
         *
         * @param value the value now held by the handle, {@code null} if empty
         */
        void update(@Nullable Object value) {
            valueClassName = value == null ? null : value.getClass().getName();
        }

        boolean holding() { return valueClassName != null; }

        @Override public void run() {
            if (valueClassName == null)
                return;
            if (PRINT) {
                PrintStream out = INSTANCE.out;
                try {
                    print(out);
                } catch (Throwable t) {
                    log.error("Could not print leak for {}", handleName, t);
                }
                INSTANCE.reportPrintError();
            }
            if (JFR) {
                try {
                    HandleLeak event = new HandleLeak();
                    event.handleName = handleName;
                    event.valueClassName = valueClassName;
                    event.commit();
                } catch (Throwable t) {
                    log.error("Could not record JFR leak event for {}", handleName, t);
                }
            }
        }

        private void print(PrintStream out) {
            var sb = new StringBuilder();
            sb.append("LEAK ").append(handleName).append(" holding ").append(valueClassName);
            if (origin != null) {
                sb.append(INDENT_1).append(origin.getMessage());
                for (var element : origin.getStackTrace())
                    sb.append(INDENT_2).append(element);
            }
            out.append(sb.append('\n'));
            out.flush();
        }
        private static final String INDENT_1 = "\n  ";
        private static final String INDENT_2 = "\n    ";
    }
}
