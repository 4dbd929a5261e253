package org.dxworks.codesync;

import java.io.PrintStream;

/**
 * Receives diagnostic messages from editors and the change request applier. Nothing is logged unless the caller
 * passes a sink; there is no global logging setup.
 */
@FunctionalInterface
public interface DiagnosticSink {
    DiagnosticSink NONE = message -> { };

    void report(String message);

    static DiagnosticSink to(PrintStream stream) {
        return message -> {
            synchronized (stream) {
                stream.println(message);
            }
        };
    }
}
