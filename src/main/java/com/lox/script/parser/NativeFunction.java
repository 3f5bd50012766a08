package com.lox.script.parser;

import java.util.List;

import com.lox.script.LoxScript.BuiltinFunction;

/** Host-provided function registered through LoxScript.registerFunction. */
public class NativeFunction implements LoxCallable {
    private final String name;
    private final int arity;
    private final BuiltinFunction fn;

    public NativeFunction(String name, int arity, BuiltinFunction fn) {
        if (arity < VARIADIC) throw new IllegalArgumentException("Invalid arity for " + name + ": " + arity);
        this.name = name;
        this.arity = arity;
        this.fn = fn;
    }

    @Override
    public String name() { return name; }

    @Override
    public int arity() { return arity; }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        Value result = fn.call(List.copyOf(args));
        return result == null ? Value.nil() : result;
    }

    @Override
    public String toString() {
        return "<native fn " + name + ">";
    }
}
