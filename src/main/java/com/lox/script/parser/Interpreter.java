package com.lox.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.lox.script.parser.Expr.And;
import com.lox.script.parser.Expr.Assign;
import com.lox.script.parser.Expr.BinOp;
import com.lox.script.parser.Expr.Call;
import com.lox.script.parser.Expr.ExprInterface;
import com.lox.script.parser.Expr.ExprVisitor;
import com.lox.script.parser.Expr.Getattr;
import com.lox.script.parser.Expr.Literal;
import com.lox.script.parser.Expr.Or;
import com.lox.script.parser.Expr.Setattr;
import com.lox.script.parser.Expr.Super;
import com.lox.script.parser.Expr.This;
import com.lox.script.parser.Expr.UnaryOp;
import com.lox.script.parser.Expr.Var;
import com.lox.script.parser.Statement.Block;
import com.lox.script.parser.Statement.ClassDecl;
import com.lox.script.parser.Statement.ExprStmt;
import com.lox.script.parser.Statement.FunctionDecl;
import com.lox.script.parser.Statement.If;
import com.lox.script.parser.Statement.Print;
import com.lox.script.parser.Statement.Return;
import com.lox.script.parser.Statement.Stmt;
import com.lox.script.parser.Statement.StmtVisitor;
import com.lox.script.parser.Statement.VarDecl;
import com.lox.script.parser.Statement.While;
import com.lox.script.parser.Value.ClassDescriptor;
import com.lox.script.parser.Value.ClassInstance;

/**
 * Tree-walking evaluator. Expressions yield a Value, statements yield a Completion.
 * {@code env} is the scope of whatever is currently executing; blocks and calls swap
 * it and always restore it on the way out.
 *
 * Not thread-safe; one Interpreter per run.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<Completion> {
    static final String INITIALIZER = "init";

    private final PrintSink out;
    private final int maxDepth;
    private Environment env;
    private int depth = 0;

    public Interpreter(Environment globals, PrintSink out, int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.env = globals;
        this.out = (out == null) ? PrintSink.stdout() : out;
        this.maxDepth = maxDepth;
    }

    /**
     * Runs the top-level statements in order. Stops at the first failure (the error
     * propagates) or at a top-level return, whose value is returned.
     */
    public Value execute(Program program) {
        for (Stmt stmt : program.statements) {
            Completion c = stmt.accept(this);
            if (c.isReturn()) return c.value();
        }
        return Value.nil();
    }

    public Value eval(ExprInterface expr) {
        return expr.accept(this);
    }

    /** Executes statements in {@code scope}, then restores the previous scope. */
    Completion executeBody(List<Stmt> statements, Environment scope) {
        Environment previous = this.env;
        this.env = scope;
        try {
            for (Stmt s : statements) {
                Completion c = s.accept(this);
                if (c.isReturn()) return c;
            }
            return Completion.NORMAL;
        } finally {
            this.env = previous;
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Completion visitPrintStmt(Print stmt) {
        Value value = eval(stmt.expr);
        out.println(Operators.stringify(value));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitExprStmt(ExprStmt stmt) {
        eval(stmt.expr);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitVarDeclStmt(VarDecl stmt) {
        Value value = eval(stmt.initializer);
        if (stmt.implicitInteger) value = Operators.toIntegral(value);
        env.declare(stmt.name, value);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitBlockStmt(Block stmt) {
        return executeBody(stmt.statements, env.childScope());
    }

    @Override
    public Completion visitIfStmt(If stmt) {
        if (Operators.truthy(eval(stmt.condition))) return stmt.thenBranch.accept(this);
        if (stmt.elseBranch != null) return stmt.elseBranch.accept(this);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitWhileStmt(While stmt) {
        while (Operators.truthy(eval(stmt.condition))) {
            Completion c = stmt.body.accept(this);
            if (c.isReturn()) return c;
        }
        return Completion.NORMAL;
    }

    @Override
    public Completion visitFunctionDeclStmt(FunctionDecl stmt) {
        env.declare(stmt.name, Value.func(new UserFunction(stmt, env)));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitClassDeclStmt(ClassDecl stmt) {
        ClassDescriptor superclass = null;
        if (stmt.superclassName != null) {
            Value sv = env.lookup(stmt.superclassName).orElseThrow(() ->
                    ScriptError.nameError("Undefined superclass '" + stmt.superclassName + "' for class " + stmt.name));
            if (sv.getType() != Value.Type.CLASS) {
                throw ScriptError.typeError("Superclass of " + stmt.name + " must be a class, got " + sv.getType());
            }
            superclass = sv.asClass();
        }

        // Methods close over a scope holding 'super', so super calls resolve from the
        // defining class, whatever the runtime class of 'this' is. A root class binds
        // nil there, hiding any 'super' of an enclosing method.
        Environment methodScope = env.childScope();
        methodScope.declare(UserFunction.SUPER, superclass == null ? Value.nil() : Value.clazz(superclass));

        Map<String, UserFunction> methods = new LinkedHashMap<>();
        for (FunctionDecl fn : stmt.methods) {
            methods.put(fn.name, new UserFunction(fn, methodScope));
        }

        env.declare(stmt.name, Value.clazz(new ClassDescriptor(stmt.name, superclass, methods)));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitReturnStmt(Return stmt) {
        return Completion.returned(stmt.value == null ? Value.nil() : eval(stmt.value));
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Value visitVarExpr(Var expr) {
        return env.lookup(expr.name).orElseThrow(() ->
                ScriptError.nameError("Undefined variable '" + expr.name + "'"));
    }

    @Override
    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        if (expr.implicitInteger) value = Operators.toIntegral(value);
        if (!env.assign(expr.name, value)) {
            throw ScriptError.nameError("Undefined variable '" + expr.name + "'");
        }
        return value;
    }

    @Override
    public Value visitBinOpExpr(BinOp expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        return expr.op.apply(left, right);
    }

    @Override
    public Value visitUnaryOpExpr(UnaryOp expr) {
        return expr.op.apply(eval(expr.operand));
    }

    @Override
    public Value visitAndExpr(And expr) {
        Value left = eval(expr.left);
        if (!Operators.truthy(left)) return left;
        return eval(expr.right);
    }

    @Override
    public Value visitOrExpr(Or expr) {
        Value left = eval(expr.left);
        if (Operators.truthy(left)) return left;
        return eval(expr.right);
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Value callee = eval(expr.callee);

        List<Value> args = new ArrayList<>(expr.args.size());
        for (ExprInterface a : expr.args) args.add(eval(a));

        return call(callee, args);
    }

    /** Calls a function or instantiates a class. Also the entry point for host calls. */
    public Value call(Value callee, List<Value> args) {
        switch (callee.getType()) {
            case FUNC:
                return invoke(callee.asFunc(), args);
            case CLASS:
                return instantiate(callee.asClass(), args);
            default:
                throw ScriptError.typeError("Can only call functions and classes, got " + callee.getType()
                        + " (" + Operators.stringify(callee) + ")");
        }
    }

    private Value invoke(LoxCallable fn, List<Value> args) {
        if (fn.arity() != LoxCallable.VARIADIC && fn.arity() != args.size()) {
            throw ScriptError.arityError(fn.name() + "() expects " + fn.arity() + " arguments, got " + args.size());
        }
        if (depth >= maxDepth) {
            throw new ScriptError(ScriptError.Kind.RECURSION_DEPTH,
                    "Max call depth exceeded (" + maxDepth + ") calling " + fn.name() + "()");
        }
        depth++;
        try {
            return fn.call(this, args);
        } finally {
            depth--;
        }
    }

    private Value instantiate(ClassDescriptor klass, List<Value> args) {
        ClassInstance instance = new ClassInstance(klass);
        UserFunction init = klass.findMethod(INITIALIZER);
        if (init != null) {
            invoke(init.bind(instance), args);
        } else if (!args.isEmpty()) {
            throw ScriptError.arityError(klass.name + "() expects 0 arguments, got " + args.size());
        }
        return Value.instance(instance);
    }

    @Override
    public Value visitGetattrExpr(Getattr expr) {
        Value obj = eval(expr.obj);
        ClassInstance instance = requireInstance(obj, expr.attr);

        Value field = instance.fields.get(expr.attr);
        if (field != null) return field;

        UserFunction method = instance.klass.findMethod(expr.attr);
        if (method != null) return Value.func(method.bind(instance));

        throw ScriptError.attributeError("Undefined attribute '" + expr.attr + "' on " + instance);
    }

    @Override
    public Value visitSetattrExpr(Setattr expr) {
        Value obj = eval(expr.obj);
        ClassInstance instance = requireInstance(obj, expr.attr);

        Value value = eval(expr.value);
        if (expr.implicitInteger) value = Operators.toIntegral(value);
        instance.fields.put(expr.attr, value);
        return value;
    }

    @Override
    public Value visitThisExpr(This expr) {
        return env.lookup(UserFunction.THIS).orElseThrow(() ->
                ScriptError.nameError("'this' used outside of a method"));
    }

    @Override
    public Value visitSuperExpr(Super expr) {
        Value superclass = env.lookup(UserFunction.SUPER)
                .filter(v -> v.getType() == Value.Type.CLASS)
                .orElseThrow(() -> ScriptError.nameError("'super' used outside of a subclass method"));
        Value self = env.lookup(UserFunction.THIS).orElseThrow(() ->
                ScriptError.nameError("'super' used outside of a method"));

        UserFunction method = superclass.asClass().findMethod(expr.method);
        if (method == null) {
            throw ScriptError.attributeError("Undefined superclass method '" + expr.method
                    + "' on " + superclass.asClass().name);
        }
        return Value.func(method.bind(self.asInstance()));
    }

    private static ClassInstance requireInstance(Value obj, String attr) {
        if (obj.getType() != Value.Type.INSTANCE) {
            throw ScriptError.attributeError("Only instances have attributes; cannot access '" + attr
                    + "' on " + obj.getType());
        }
        return obj.asInstance();
    }
}
