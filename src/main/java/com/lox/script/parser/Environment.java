package com.lox.script.parser;

import java.util.Map;
import java.util.Optional;

/**
 * Lexical scope chain used by the Interpreter. The Interpreter only talks to this
 * contract and never reaches into how bindings are stored.
 */
public interface Environment {

    /** Walks outward from this scope to the global scope. */
    Optional<Value> lookup(String name);

    /**
     * Rewrites the binding in the nearest scope that declares {@code name}.
     * Returns false when no scope in the chain declares it.
     */
    boolean assign(String name, Value value);

    /** Creates or overwrites a binding in this scope only. */
    void declare(String name, Value value);

    /** A new, empty scope whose parent is this one. */
    Environment childScope();

    /** Copy of the bindings declared directly in this scope, in declaration order. */
    Map<String, Value> snapshot();
}
