package com.lox.script.parser;

import java.util.Map;

public class RunResult {
    private final Map<String, Value> globals;
    private final Value value;

    public RunResult(Map<String, Value> globals, Value value) {
        this.globals = globals;
        this.value = value;
    }

    /** Global bindings after the run. */
    public Map<String, Value> globals() { return globals; }

    /** Value of a top-level return, nil when the program ran off its end. */
    public Value value() { return value; }
}
