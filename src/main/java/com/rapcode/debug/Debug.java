package com.rapcode.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide debug hub shared by the lexer, parser, interpreter, graph builder
 * and flowchart lowering.
 *
 * Library use is silent: records go to {@link DebugSink#SILENT} until a host
 * (the CLI, a test) installs its own sink. Records below the minimum level are
 * dropped before they reach the sink.
 */
public final class Debug {

    private static final Debug HUB = new Debug();

    private final AtomicReference<DebugSink> sink = new AtomicReference<>(DebugSink.SILENT);
    private volatile DebugLevel minimumLevel = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return HUB;
    }

    /** Installs {@code next}; {@code null} restores the silent sink. */
    public void setSink(DebugSink next) {
        sink.set(next == null ? DebugSink.SILENT : next);
    }

    public DebugSink getSink() {
        return sink.get();
    }

    public void setMinimumLevel(DebugLevel level) {
        minimumLevel = (level == null) ? DebugLevel.TRACE : level;
    }

    public DebugLevel getMinimumLevel() {
        return minimumLevel;
    }

    public boolean isEnabled(DebugLevel level) {
        return level.ordinal() >= minimumLevel.ordinal() && sink.get() != DebugSink.SILENT;
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (level.ordinal() < minimumLevel.ordinal()) return;
        DebugSink target = sink.get();
        if (target != null) target.log(level, tag, message, error);
    }
}
