package com.bella.debug;

/** Pluggable debug output target (SLF4J, stdout, test collector, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
