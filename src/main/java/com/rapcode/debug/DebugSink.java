package com.rapcode.debug;

/** Pluggable debug output target (SLF4J, stderr, test collector, etc.). */
public interface DebugSink {

    /** Discards every record. The hub falls back to it when no sink is installed. */
    DebugSink SILENT = (level, tag, message, error) -> { };

    void log(DebugLevel level, String tag, String message, Throwable error);
}
