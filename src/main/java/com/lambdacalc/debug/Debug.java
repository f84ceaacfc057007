package com.lambdacalc.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide log hub shared by the evaluator, the CLI and the RPC server.
 *
 * The reduction core never configures logging: until a front end installs a
 * sink every message is dropped, so {@code LambdaEngine} can be embedded with
 * no setup. Messages carry one of the tags below; {@link Slf4jDebugSink} turns
 * the tag into the logger name {@code lambdacalc.<tag>}.
 *
 * Per-step reduction tracing renders whole terms, which is expensive on large
 * terms. Callers guard it with {@link #enabled(DebugLevel)}.
 */
public final class Debug {

    /** Evaluation driver: summaries, step-limit warnings, per-step trace. */
    public static final String EVAL = "eval";
    /** Command-line front end. */
    public static final String CLI = "cli";
    /** RPC server connections and request failures. */
    public static final String RPC = "rpc";
    /** Config file loading. */
    public static final String CONFIG = "config";

    private static final Debug INSTANCE = new Debug();

    private static final DebugSink DISCARD = (level, tag, message, error) -> {
        // no sink installed
    };

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(DISCARD);
    private volatile DebugLevel threshold = DebugLevel.ERROR;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Stdout at INFO and above, errors with their stack trace. */
    public static void useSysOut() {
        INSTANCE.setSink(streamSink(System.out, DebugLevel.INFO), DebugLevel.INFO);
    }

    /**
     * SLF4J for everything; simplelogger.properties decides what is printed.
     * The step trace is only built when the {@code eval} logger has TRACE on.
     */
    public static void useSlf4j() {
        Slf4jDebugSink sink = new Slf4jDebugSink();
        INSTANCE.setSink(sink, sink.traceEnabled(EVAL) ? DebugLevel.TRACE : DebugLevel.DEBUG);
    }

    public static DebugSink streamSink(PrintStream out, DebugLevel minLevel) {
        return (level, tag, message, error) -> {
            if (level.ordinal() < minLevel.ordinal()) return;
            out.println("[" + level + "][" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
        };
    }

    /** Installs {@code sink} for every level; null restores the silent default. */
    public void setSink(DebugSink sink) {
        setSink(sink, DebugLevel.TRACE);
    }

    /**
     * Installs {@code sink} and records the lowest level it cares about, which is
     * what {@link #enabled(DebugLevel)} answers from. Messages below it are
     * still passed on.
     */
    public void setSink(DebugSink sink, DebugLevel lowest) {
        if (sink == null) {
            sinkRef.set(DISCARD);
            threshold = DebugLevel.ERROR;
            return;
        }
        sinkRef.set(sink);
        threshold = lowest == null ? DebugLevel.TRACE : lowest;
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    /** False when nothing would consume a message at {@code level}. */
    public boolean enabled(DebugLevel level) {
        return sinkRef.get() != DISCARD && level.ordinal() >= threshold.ordinal();
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
