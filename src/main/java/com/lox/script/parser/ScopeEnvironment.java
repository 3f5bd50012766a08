package com.lox.script.parser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One scope of the chain: its own bindings plus a reference to the enclosing scope.
 *
 * Closures keep a reference to the scope they were declared in, so a scope stays
 * reachable for as long as any closure or active call still points at it.
 */
public class ScopeEnvironment implements Environment {

    public final ScopeEnvironment parent; // null for the global scope
    private final Map<String, Value> values = new LinkedHashMap<>();

    /** Global scope. */
    public ScopeEnvironment() {
        this.parent = null;
    }

    /** Global scope pre-populated by the host. */
    public ScopeEnvironment(Map<String, Value> initial) {
        this.parent = null;
        if (initial != null) {
            for (Map.Entry<String, Value> e : initial.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) {
                    throw new IllegalArgumentException("Initial bindings must not contain null names or values");
                }
                values.put(e.getKey(), e.getValue());
            }
        }
    }

    private ScopeEnvironment(ScopeEnvironment parent) {
        this.parent = parent;
    }

    @Override
    public Optional<Value> lookup(String name) {
        for (ScopeEnvironment scope = this; scope != null; scope = scope.parent) {
            Value v = scope.values.get(name);
            if (v != null) return Optional.of(v);
        }
        return Optional.empty();
    }

    @Override
    public boolean assign(String name, Value value) {
        for (ScopeEnvironment scope = this; scope != null; scope = scope.parent) {
            if (scope.values.containsKey(name)) {
                scope.values.put(name, value);
                return true;
            }
        }
        return false;
    }

    @Override
    public void declare(String name, Value value) {
        if (value == null) throw new IllegalArgumentException("Cannot bind null to " + name + ", use Value.nil()");
        values.put(name, value);
    }

    @Override
    public ScopeEnvironment childScope() {
        return new ScopeEnvironment(this);
    }

    @Override
    public Map<String, Value> snapshot() {
        return new LinkedHashMap<>(values);
    }

    public boolean existsInCurrentScope(String name) {
        return values.containsKey(name);
    }
}
