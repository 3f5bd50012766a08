package com.lox.script.parser;

import java.io.PrintStream;

/** Destination of the print statement. Lines are written immediately, in program order. */
public interface PrintSink {
    void println(String line);

    static PrintSink of(PrintStream stream) {
        return line -> {
            stream.println(line);
            stream.flush();
        };
    }

    static PrintSink stdout() {
        return of(System.out);
    }
}
