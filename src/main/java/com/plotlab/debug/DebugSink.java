package com.plotlab.debug;

/** Pluggable debug output target (stderr, test capture, host UI log, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
