package com.lox.script.parser;

import java.util.List;

import com.lox.script.parser.Statement.FunctionDecl;
import com.lox.script.parser.Statement.Param;

/**
 * A closure: the function declaration plus the Environment it was declared in.
 * The environment is held by reference, so later changes to captured variables
 * are visible inside the function.
 */
public class UserFunction implements LoxCallable {
    static final String THIS = "this";
    static final String SUPER = "super";

    final FunctionDecl declaration;
    final Environment closure;

    UserFunction(FunctionDecl declaration, Environment closure) {
        this.declaration = declaration;
        this.closure = closure;
    }

    /** Method access: a copy whose closure additionally binds {@code this}. */
    UserFunction bind(Value.ClassInstance instance) {
        Environment withThis = closure.childScope();
        withThis.declare(THIS, Value.instance(instance));
        return new UserFunction(declaration, withThis);
    }

    @Override
    public String name() { return declaration.name; }

    @Override
    public int arity() { return declaration.params.size(); }

    @Override
    public Value call(Interpreter interpreter, List<Value> args) {
        // New call frame is a child of the closure (lexical scoping), not of the caller.
        Environment frame = closure.childScope();

        List<Param> params = declaration.params;
        for (int i = 0; i < params.size(); i++) {
            Param p = params.get(i);
            Value v = args.get(i);
            if (p.implicitInteger) v = Operators.toIntegral(v);
            frame.declare(p.name, v);
        }

        Completion done = interpreter.executeBody(declaration.body.statements, frame);
        return done.value();
    }

    @Override
    public String toString() {
        return "<fn " + declaration.name + ">";
    }
}
