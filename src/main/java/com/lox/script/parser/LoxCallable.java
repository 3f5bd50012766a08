package com.lox.script.parser;

import java.util.List;

/** Anything a script can call: user functions, bound methods and host natives. */
public interface LoxCallable {

    /** Marks a callable that accepts any number of arguments. */
    int VARIADIC = -1;

    String name();

    /** Expected argument count, or {@link #VARIADIC}. */
    int arity();

    /** Arity has already been checked by the Interpreter when this is reached. */
    Value call(Interpreter interpreter, List<Value> args);
}
