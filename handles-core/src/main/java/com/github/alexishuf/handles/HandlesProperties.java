package com.github.alexishuf.handles;

import com.github.alexishuf.handles.owned.LeakDetector;
import com.github.alexishuf.handles.owned.ReferenceCounter;
import jdk.jfr.Event;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

@SuppressWarnings("unused")
public class HandlesProperties {

    /* --- --- --- property names --- --- --- */
    public static final String CHECKS           = "handles.checks";
    public static final String DETECT_LEAKS     = "handles.leaks";
    public static final String PRINT_LEAKS      = "handles.print-leaks";
    public static final String JFR_LEAKS        = "handles.jfr";
    public static final String STACK_TRACE      = "handles.stack-trace";

    /* --- --- --- default values --- --- --- */
    public static final boolean DEF_CHECKS       = true;
    public static final boolean DEF_DETECT_LEAKS = HandlesProperties.class.desiredAssertionStatus();
    public static final boolean DEF_PRINT_LEAKS  = HandlesProperties.class.desiredAssertionStatus();
    public static final boolean DEF_JFR_LEAKS    = HandlesProperties.class.desiredAssertionStatus();
    public static final boolean DEF_STACK_TRACE  = false;

    /* --- --- --- cached values --- --- --- */
    private static Boolean CACHE_CHECKS       = null;
    private static Boolean CACHE_DETECT_LEAKS = null;
    private static Boolean CACHE_PRINT_LEAKS  = null;
    private static Boolean CACHE_JFR_LEAKS    = null;
    private static Boolean CACHE_STACK_TRACE  = null;

    /* --- --- --- internal use --- --- --- */

    protected interface Parser<T> {
        T parse(String source, String value) throws IllegalArgumentException;
    }

    protected static <T> T readProperty(String propertyName, T defaultValue,
                                        Parser<T> parser) {
        String source = "JVM property "+propertyName;
        String value = System.getProperty(propertyName);
        if (value == null) {
            String envName = propertyName.toUpperCase().replace('.', '_').replace('-', '_');
            source = "Environment var "+envName;
            value = System.getenv(envName);
        }
        return value == null ? defaultValue : parser.parse(source, value);
    }

    private static final Pattern BOOL_RX =
            Pattern.compile("(?i)\\s*(?:(t|true|1|y|yes)|(f|false|0|n|no))\\s*");
    protected static boolean readBoolean(String propertyName, boolean defaultValue) {
        return readProperty(propertyName, defaultValue, (src, val) -> {
            Matcher m = BOOL_RX.matcher(val);
            if (!m.matches())
                throw new IllegalArgumentException(src+"="+val+" is not a boolean");
            return m.group(1) != null;
        });
    }

    /* --- --- --- management --- --- --- */

    /**
     * Drops all cached property values, causing properties to be re-read from
     * {@link System#getProperty(String)} and {@link System#getenv(String)}.
     */
    public static void refresh() {
        CACHE_CHECKS       = null;
        CACHE_DETECT_LEAKS = null;
        CACHE_PRINT_LEAKS  = null;
        CACHE_JFR_LEAKS    = null;
        CACHE_STACK_TRACE  = null;
    }

    /* --- --- --- accessors --- --- --- */

    /**
     * Whether {@link ReferenceCounter} should reject decrements below zero and mutations
     * after it has been freed by throwing an {@code OwnershipException}.
     *
     * <p>For performance reasons (i.e., enabling dead-code elimination), this property is read
     * into a {@code static final} field when {@link ReferenceCounter} is loaded. Thus changing
     * the property and calling {@link #refresh()} might have no effect on the actual
     * behavior.</p>
     *
     * @return whether reference counters validate their own state transitions.
     */
    public static boolean checks() {
        Boolean v = CACHE_CHECKS;
        if (v == null)
            CACHE_CHECKS = v = readBoolean(CHECKS, DEF_CHECKS);
        return v;
    }

    /**
     * Whether leaks of exclusive and shared owner handles should be detected.
     *
     * <p>A handle is considered leaked once both conditions are satisfied: </p>
     *
     * <ul>
     *     <li>The handle still holds a value: it was not closed, reset, released or
     *         moved from</li>
     *     <li>The garbage collector has deemed the handle unreachable</li>
     * </ul>
     *
     * <p>This value is loaded into a {@code static final} field of {@link LeakDetector}
     * and thus subsequent changes are ignored.</p>
     *
     * @return whether leaked handles should be detected.
     */
    public static boolean detectLeaks() {
        Boolean v = CACHE_DETECT_LEAKS;
        if (v == null)
            CACHE_DETECT_LEAKS = v = readBoolean(DETECT_LEAKS, DEF_DETECT_LEAKS);
        return v;
    }

    /**
     * If {@link #detectLeaks()} {@code == true}, print a report for each leaked handle.
     *
     * <p>This value may be loaded into a {@code static final} field. Therefore, late changes to
     * the java property may not be reflected in actual behavior changes.</p>
     *
     * @return a boolean indicating whether a report should be printed for each detected leak.
     */
    public static boolean printLeaks() {
        Boolean v = CACHE_PRINT_LEAKS;
        if (v == null)
            CACHE_PRINT_LEAKS = v = readBoolean(PRINT_LEAKS, DEF_PRINT_LEAKS);
        return v;
    }

    /**
     * Generate a JFR event for each detected leak of a handle.
     *
     * <p>This value may be loaded into a {@code static final} final. Therefore changes at runtime
     * may not cause a behavior change.</p>
     *
     * @return a boolean indicating whether a JFR event must be {@link Event#commit()}ed for
     *         every leak.
     */
    public static boolean jfrLeaks() {
        Boolean v = CACHE_JFR_LEAKS;
        if (v == null)
            CACHE_JFR_LEAKS = v = readBoolean(JFR_LEAKS, DEF_JFR_LEAKS);
        return v;
    }

    /**
     * If {@link #detectLeaks()}{@code == true}, also capture the stack trace where each
     * tracked handle was created, so that leak reports can point to it.
     *
     * <p>The default is false, since the overhead of capturing a stack trace for every
     * handle makes even unit tests unbearably slow. Enable only to find the origin of a
     * reported leak.</p>
     *
     * @return whether creation stack traces should be captured for tracked handles.
     */
    public static boolean stackTrace() {
        Boolean v = CACHE_STACK_TRACE;
        if (v == null)
            CACHE_STACK_TRACE = v = readBoolean(STACK_TRACE, DEF_STACK_TRACE);
        return v;
    }
}
