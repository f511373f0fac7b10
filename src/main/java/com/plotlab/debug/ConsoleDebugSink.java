package com.plotlab.debug;

import java.io.PrintStream;

/**
 * Writes "LEVEL [tag] message" lines to a stream, dropping anything below the
 * configured minimum level.
 */
public final class ConsoleDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel minLevel;

    public ConsoleDebugSink(DebugLevel minLevel) {
        this(System.err, minLevel);
    }

    public ConsoleDebugSink(PrintStream out, DebugLevel minLevel) {
        this.out = out;
        this.minLevel = (minLevel == null) ? DebugLevel.INFO : minLevel;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(minLevel)) return;
        synchronized (out) {
            out.println(level + " [" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
        }
    }
}
