package com.lox.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.lox.debug.Debug;
import com.lox.script.parser.Expr.ExprInterface;
import com.lox.script.parser.Statement.Block;
import com.lox.script.parser.Statement.FunctionDecl;
import com.lox.script.parser.Statement.Param;
import com.lox.script.parser.Statement.Stmt;

/**
 * Converts a generic ParseTree into AST nodes, bottom-up.
 *
 * Literals are folded here, operator rules are bound to their Operators constant here,
 * and {@code for} is rewritten into {@code while}. Anything the builder does not
 * recognize is a BUILD_ERROR; there is no silent default.
 */
public class TreeBuilder {
    private static final String TAG = "TreeBuilder";

    private static final Map<String, Operators.Binary> BINARY_RULES;
    private static final Map<String, Operators.Unary> UNARY_RULES;
    static {
        Map<String, Operators.Binary> binary = new HashMap<>();
        for (Operators.Binary op : Operators.Binary.values()) binary.put(op.rule, op);
        BINARY_RULES = Collections.unmodifiableMap(binary);

        Map<String, Operators.Unary> unary = new HashMap<>();
        for (Operators.Unary op : Operators.Unary.values()) unary.put(op.rule, op);
        UNARY_RULES = Collections.unmodifiableMap(unary);
    }

    // Intermediate results that only live while a parent rule is being built.
    private static final class TypeHint {
        final String text;
        TypeHint(String text) { this.text = text; }
    }

    private static final class Nullable {
        static final Nullable INSTANCE = new Nullable();
    }

    private static final class ParamList {
        final List<Param> params;
        ParamList(List<Param> params) { this.params = params; }
    }

    private static final class ArgList {
        final List<ExprInterface> args;
        ArgList(List<ExprInterface> args) { this.args = args; }
    }

    private static final class SuperclassRef {
        final String name;
        SuperclassRef(String name) { this.name = name; }
    }

    private static final class ForClause {
        final Object part; // may be null
        ForClause(Object part) { this.part = part; }
    }

    public Program build(ParseTree tree) {
        Object result = transform(tree);
        if (!(result instanceof Program)) {
            throw ScriptError.buildError("Expected a 'program' at the root of the parse tree, got " + describe(tree));
        }
        return (Program) result;
    }

    private Object transform(ParseTree tree) {
        if (tree == null) throw ScriptError.buildError("Parse tree contains a null node");
        if (tree.isLeaf()) return leaf((ParseTree.Leaf) tree);

        ParseTree.Node node = (ParseTree.Node) tree;
        List<Object> children = new ArrayList<>(node.children.size());
        for (ParseTree child : node.children) {
            children.add(transform(child));
        }
        return rule(node.rule, children);
    }

    // -------------------------
    // Tokens
    // -------------------------

    private Object leaf(ParseTree.Leaf leaf) {
        String text = leaf.text;
        switch (leaf.token) {
            case "VAR":
                if (text.isEmpty()) throw ScriptError.buildError("Empty identifier");
                return new Expr.Var(text);
            case "NUMBER":
                return new Expr.Literal(number(text));
            case "STRING":
                if (text.length() < 2 || text.charAt(0) != '"' || text.charAt(text.length() - 1) != '"') {
                    throw ScriptError.buildError("Malformed string literal: " + text);
                }
                return new Expr.Literal(Value.string(text.substring(1, text.length() - 1)));
            case "BOOL":
                if ("true".equals(text)) return new Expr.Literal(Value.bool(true));
                if ("false".equals(text)) return new Expr.Literal(Value.bool(false));
                throw ScriptError.buildError("Malformed boolean literal: " + text);
            case "NIL":
                return new Expr.Literal(Value.nil());
            case "NULLABLE":
                return Nullable.INSTANCE;
            default:
                throw ScriptError.buildError("Unrecognized token: " + leaf.token);
        }
    }

    private static Value number(String text) {
        double d;
        try {
            d = text.contains(".") ? Double.parseDouble(text) : new java.math.BigInteger(text).doubleValue();
        } catch (NumberFormatException e) {
            throw ScriptError.buildError("Malformed number literal: " + text);
        }
        if (!Double.isFinite(d)) throw ScriptError.buildError("Number literal out of range: " + text);
        return Value.number(d);
    }

    // -------------------------
    // Rules
    // -------------------------

    private Object rule(String rule, List<Object> c) {
        Operators.Binary binary = BINARY_RULES.get(rule);
        if (binary != null) {
            arity(rule, c, 2);
            return new Expr.BinOp(expr(rule, c, 0), expr(rule, c, 1), binary);
        }
        Operators.Unary unary = UNARY_RULES.get(rule);
        if (unary != null) {
            arity(rule, c, 1);
            return new Expr.UnaryOp(unary, expr(rule, c, 0));
        }

        switch (rule) {
            case "program":
                return new Program(statements(rule, c));

            // declarations
            case "var_decl": return varDecl(c);
            case "type_hint": return typeHint(c);
            case "fun_decl": return funDecl(c);
            case "params_decl": return paramsDecl(c);
            case "param_decl": return paramDecl(c);
            case "class_decl": return classDecl(c);
            case "superclass":
                arity(rule, c, 1);
                return new SuperclassRef(name(rule, c, 0));

            // statements
            case "print_cmd":
                arity(rule, c, 1);
                return new Statement.Print(expr(rule, c, 0));
            case "expr_stmt":
                arity(rule, c, 1);
                return new Statement.ExprStmt(expr(rule, c, 0));
            case "block":
                return new Block(statements(rule, c));
            case "if_stmt": return ifStmt(c);
            case "while_stmt":
                arity(rule, c, 2);
                return new Statement.While(expr(rule, c, 0), stmt(rule, c, 1));
            case "for_stmt": return forStmt(c);
            case "for_init":
            case "for_cond":
            case "for_incr":
                if (c.size() > 1) throw malformed(rule, c);
                return new ForClause(c.isEmpty() ? null : c.get(0));
            case "return_stmt":
                if (c.size() > 1) throw malformed(rule, c);
                return new Statement.Return(c.isEmpty() ? null : expr(rule, c, 0));

            // expressions
            case "and_":
                arity(rule, c, 2);
                return new Expr.And(expr(rule, c, 0), expr(rule, c, 1));
            case "or_":
                arity(rule, c, 2);
                return new Expr.Or(expr(rule, c, 0), expr(rule, c, 1));
            case "call": {
                arity(rule, c, 2);
                if (!(c.get(1) instanceof ArgList)) throw malformed(rule, c);
                return new Expr.Call(expr(rule, c, 0), ((ArgList) c.get(1)).args);
            }
            case "params": {
                List<ExprInterface> args = new ArrayList<>(c.size());
                for (int i = 0; i < c.size(); i++) args.add(expr(rule, c, i));
                return new ArgList(args);
            }
            case "assign": {
                arity(rule, c, 2);
                String target = name(rule, c, 0);
                return new Expr.Assign(target, expr(rule, c, 1), Operators.isImplicitInteger(target));
            }
            case "getattr":
                arity(rule, c, 2);
                return new Expr.Getattr(expr(rule, c, 0), name(rule, c, 1));
            case "setattr": {
                arity(rule, c, 3);
                String attr = name(rule, c, 1);
                return new Expr.Setattr(expr(rule, c, 0), attr, expr(rule, c, 2), Operators.isImplicitInteger(attr));
            }
            case "this":
                arity(rule, c, 0);
                return new Expr.This();
            case "super_":
                arity(rule, c, 1);
                return new Expr.Super(name(rule, c, 0));

            default:
                throw ScriptError.buildError("Unrecognized grammar rule: " + rule);
        }
    }

    private Stmt varDecl(List<Object> c) {
        if (c.isEmpty() || c.size() > 3) throw malformed("var_decl", c);
        String name = name("var_decl", c, 0);
        String hint = null;
        ExprInterface init = null;

        for (int i = 1; i < c.size(); i++) {
            Object part = c.get(i);
            if (part instanceof TypeHint && hint == null && init == null) {
                hint = ((TypeHint) part).text;
            } else if (part instanceof ExprInterface && init == null) {
                init = (ExprInterface) part;
            } else {
                throw malformed("var_decl", c);
            }
        }
        if (init == null) init = new Expr.Literal(Value.nil());
        return new Statement.VarDecl(name, init, hint, Operators.isImplicitInteger(name));
    }

    private TypeHint typeHint(List<Object> c) {
        if (c.isEmpty() || c.size() > 2) throw malformed("type_hint", c);
        String text = name("type_hint", c, 0);
        if (c.size() == 2) {
            if (c.get(1) != Nullable.INSTANCE) throw malformed("type_hint", c);
            text += "?";
        }
        return new TypeHint(text);
    }

    private FunctionDecl funDecl(List<Object> c) {
        // name, params_decl, [type_hint], block
        if (c.size() < 3 || c.size() > 4) throw malformed("fun_decl", c);
        String name = name("fun_decl", c, 0);
        if (!(c.get(1) instanceof ParamList)) throw malformed("fun_decl", c);
        List<Param> params = ((ParamList) c.get(1)).params;

        String returnHint = null;
        if (c.size() == 4) {
            if (!(c.get(2) instanceof TypeHint)) throw malformed("fun_decl", c);
            returnHint = ((TypeHint) c.get(2)).text;
        }

        Object body = c.get(c.size() - 1);
        if (!(body instanceof Block)) throw malformed("fun_decl", c);
        return new FunctionDecl(name, params, (Block) body, returnHint);
    }

    private ParamList paramsDecl(List<Object> c) {
        List<Param> params = new ArrayList<>(c.size());
        for (Object part : c) {
            if (!(part instanceof Param)) throw malformed("params_decl", c);
            params.add((Param) part);
        }
        return new ParamList(params);
    }

    private Param paramDecl(List<Object> c) {
        if (c.isEmpty() || c.size() > 2) throw malformed("param_decl", c);
        String name = name("param_decl", c, 0);
        String hint = null;
        if (c.size() == 2) {
            if (!(c.get(1) instanceof TypeHint)) throw malformed("param_decl", c);
            hint = ((TypeHint) c.get(1)).text;
        }
        return new Param(name, hint, Operators.isImplicitInteger(name));
    }

    private Stmt classDecl(List<Object> c) {
        if (c.isEmpty()) throw malformed("class_decl", c);
        String name = name("class_decl", c, 0);
        String superclass = null;
        List<FunctionDecl> methods = new ArrayList<>();

        for (int i = 1; i < c.size(); i++) {
            Object part = c.get(i);
            if (part instanceof SuperclassRef && i == 1) {
                superclass = ((SuperclassRef) part).name;
            } else if (part instanceof FunctionDecl) {
                methods.add((FunctionDecl) part);
            } else {
                throw malformed("class_decl", c);
            }
        }
        return new Statement.ClassDecl(name, superclass, methods);
    }

    private Stmt ifStmt(List<Object> c) {
        if (c.size() < 2 || c.size() > 3) throw malformed("if_stmt", c);
        Stmt elseBranch = c.size() == 3 ? stmt("if_stmt", c, 2) : new Block(List.of());
        return new Statement.If(expr("if_stmt", c, 0), stmt("if_stmt", c, 1), elseBranch);
    }

    /**
     * for (init; cond; incr) body  =>  { init; while (cond) { body; incr; } }
     * A missing condition becomes the literal true.
     */
    private Stmt forStmt(List<Object> c) {
        arity("for_stmt", c, 4);
        for (int i = 0; i < 3; i++) {
            if (!(c.get(i) instanceof ForClause)) throw malformed("for_stmt", c);
        }
        Object init = ((ForClause) c.get(0)).part;
        Object cond = ((ForClause) c.get(1)).part;
        Object incr = ((ForClause) c.get(2)).part;
        Stmt body = stmt("for_stmt", c, 3);

        ExprInterface condition;
        if (cond == null) {
            condition = new Expr.Literal(Value.bool(true));
        } else if (cond instanceof ExprInterface) {
            condition = (ExprInterface) cond;
        } else {
            throw malformed("for_cond", c);
        }

        List<Stmt> loopBody = new ArrayList<>(2);
        loopBody.add(body);
        if (incr != null) {
            if (!(incr instanceof ExprInterface)) throw malformed("for_incr", c);
            loopBody.add(new Statement.ExprStmt((ExprInterface) incr));
        }

        List<Stmt> outer = new ArrayList<>(2);
        if (init != null) {
            if (init instanceof Stmt) outer.add((Stmt) init);
            else if (init instanceof ExprInterface) outer.add(new Statement.ExprStmt((ExprInterface) init));
            else throw malformed("for_init", c);
        }
        outer.add(new Statement.While(condition, new Block(loopBody)));

        Debug.get().t(TAG, "desugared for loop (init=" + (init != null) + ", cond=" + (cond != null)
                + ", incr=" + (incr != null) + ")");
        return new Block(outer);
    }

    // -------------------------
    // Child accessors
    // -------------------------

    private static List<Stmt> statements(String rule, List<Object> c) {
        List<Stmt> out = new ArrayList<>(c.size());
        for (int i = 0; i < c.size(); i++) out.add(stmt(rule, c, i));
        return out;
    }

    private static ExprInterface expr(String rule, List<Object> c, int index) {
        Object part = c.get(index);
        if (!(part instanceof ExprInterface)) {
            throw ScriptError.buildError("Rule '" + rule + "' expects an expression at position " + index
                    + ", got " + kindOf(part));
        }
        return (ExprInterface) part;
    }

    private static Stmt stmt(String rule, List<Object> c, int index) {
        Object part = c.get(index);
        if (!(part instanceof Stmt)) {
            throw ScriptError.buildError("Rule '" + rule + "' expects a statement at position " + index
                    + ", got " + kindOf(part));
        }
        return (Stmt) part;
    }

    /** Identifiers arrive as VAR leaves, i.e. already built into Var nodes. */
    private static String name(String rule, List<Object> c, int index) {
        Object part = c.get(index);
        if (!(part instanceof Expr.Var)) {
            throw ScriptError.buildError("Rule '" + rule + "' expects an identifier at position " + index
                    + ", got " + kindOf(part));
        }
        return ((Expr.Var) part).name;
    }

    private static void arity(String rule, List<Object> c, int expected) {
        if (c.size() != expected) {
            throw ScriptError.buildError("Rule '" + rule + "' expects " + expected + " children, got " + c.size());
        }
    }

    private static ScriptError malformed(String rule, List<Object> c) {
        List<String> kinds = new ArrayList<>(c.size());
        for (Object part : c) kinds.add(kindOf(part));
        return ScriptError.buildError("Malformed '" + rule + "' node: " + kinds);
    }

    private static String kindOf(Object part) {
        if (part instanceof Node) return ((Node) part).label();
        return part == null ? "null" : part.getClass().getSimpleName();
    }

    private static String describe(ParseTree tree) {
        return tree.isLeaf() ? "token " + ((ParseTree.Leaf) tree).token : "rule " + ((ParseTree.Node) tree).rule;
    }
}
