package com.lox.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Expr {

    public interface ExprInterface extends Node {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitVarExpr(Var expr);
        R visitBinOpExpr(BinOp expr);
        R visitUnaryOpExpr(UnaryOp expr);
        R visitAndExpr(And expr);
        R visitOrExpr(Or expr);
        R visitCallExpr(Call expr);
        R visitAssignExpr(Assign expr);
        R visitGetattrExpr(Getattr expr);
        R visitSetattrExpr(Setattr expr);
        R visitThisExpr(This expr);
        R visitSuperExpr(Super expr);
    }

    // -------------------------
    // Core expression nodes
    // -------------------------

    public static final class Literal implements ExprInterface {
        public final Value value;

        public Literal(Value value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        @Override
        public String label() {
            return value.getType() == Value.Type.STRING
                    ? "Literal \"" + value.asString() + "\""
                    : "Literal " + Operators.stringify(value);
        }

        @Override
        public List<Node> children() { return List.of(); }
    }

    public static final class Var implements ExprInterface {
        public final String name;

        public Var(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVarExpr(this);
        }

        @Override
        public String label() { return "Var " + name; }

        @Override
        public List<Node> children() { return List.of(); }
    }

    public static final class BinOp implements ExprInterface {
        public final ExprInterface left;
        public final ExprInterface right;
        public final Operators.Binary op;

        public BinOp(ExprInterface left, ExprInterface right, Operators.Binary op) {
            this.left = left;
            this.right = right;
            this.op = op;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinOpExpr(this);
        }

        @Override
        public String label() { return "BinOp " + op.symbol; }

        @Override
        public List<Node> children() { return List.of(left, right); }
    }

    public static final class UnaryOp implements ExprInterface {
        public final Operators.Unary op;
        public final ExprInterface operand;

        public UnaryOp(Operators.Unary op, ExprInterface operand) {
            this.op = op;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryOpExpr(this);
        }

        @Override
        public String label() { return "UnaryOp " + op.symbol; }

        @Override
        public List<Node> children() { return List.of(operand); }
    }

    public static final class And implements ExprInterface {
        public final ExprInterface left;
        public final ExprInterface right;

        public And(ExprInterface left, ExprInterface right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAndExpr(this);
        }

        @Override
        public String label() { return "And"; }

        @Override
        public List<Node> children() { return List.of(left, right); }
    }

    public static final class Or implements ExprInterface {
        public final ExprInterface left;
        public final ExprInterface right;

        public Or(ExprInterface left, ExprInterface right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitOrExpr(this);
        }

        @Override
        public String label() { return "Or"; }

        @Override
        public List<Node> children() { return List.of(left, right); }
    }

    // -------------------------
    // Calls
    // -------------------------

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final List<ExprInterface> args;

        public Call(ExprInterface callee, List<ExprInterface> args) {
            this.callee = callee;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        @Override
        public String label() { return "Call"; }

        @Override
        public List<Node> children() {
            List<Node> out = new ArrayList<>(args.size() + 1);
            out.add(callee);
            out.addAll(args);
            return out;
        }
    }

    // -------------------------
    // Assignment
    // -------------------------

    public static final class Assign implements ExprInterface {
        public final String name;
        public final ExprInterface value;
        public final boolean implicitInteger;

        public Assign(String name, ExprInterface value, boolean implicitInteger) {
            this.name = name;
            this.value = value;
            this.implicitInteger = implicitInteger;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }

        @Override
        public String label() { return "Assign " + name; }

        @Override
        public List<Node> children() { return List.of(value); }
    }

    // -------------------------
    // Objects
    // -------------------------

    public static final class Getattr implements ExprInterface {
        public final ExprInterface obj;
        public final String attr;

        public Getattr(ExprInterface obj, String attr) {
            this.obj = obj;
            this.attr = attr;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGetattrExpr(this);
        }

        @Override
        public String label() { return "Getattr " + attr; }

        @Override
        public List<Node> children() { return List.of(obj); }
    }

    public static final class Setattr implements ExprInterface {
        public final ExprInterface obj;
        public final String attr;
        public final ExprInterface value;
        public final boolean implicitInteger;

        public Setattr(ExprInterface obj, String attr, ExprInterface value, boolean implicitInteger) {
            this.obj = obj;
            this.attr = attr;
            this.value = value;
            this.implicitInteger = implicitInteger;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSetattrExpr(this);
        }

        @Override
        public String label() { return "Setattr " + attr; }

        @Override
        public List<Node> children() { return List.of(obj, value); }
    }

    public static final class This implements ExprInterface {

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitThisExpr(this);
        }

        @Override
        public String label() { return "This"; }

        @Override
        public List<Node> children() { return List.of(); }
    }

    public static final class Super implements ExprInterface {
        public final String method;

        public Super(String method) {
            this.method = method;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSuperExpr(this);
        }

        @Override
        public String label() { return "Super " + method; }

        @Override
        public List<Node> children() { return List.of(); }
    }
}
