package com.lox.debug;

/** Pluggable debug output target (stderr, file, test collector, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
