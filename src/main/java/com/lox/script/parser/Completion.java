package com.lox.script.parser;

/**
 * Outcome of executing a statement: either it ran to completion, or a {@code return}
 * was hit and the value has to travel up to the enclosing call boundary.
 */
public final class Completion {
    public static final Completion NORMAL = new Completion(false, null);

    private final boolean returned;
    private final Value value;

    private Completion(boolean returned, Value value) {
        this.returned = returned;
        this.value = value;
    }

    public static Completion returned(Value value) {
        return new Completion(true, value == null ? Value.nil() : value);
    }

    public boolean isReturn() { return returned; }

    /** The returned value; nil for a normal completion. */
    public Value value() { return returned ? value : Value.nil(); }
}
