package com.lox.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Statement {

    public interface Stmt extends Node {
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitPrintStmt(Print stmt);
        R visitExprStmt(ExprStmt stmt);
        R visitVarDeclStmt(VarDecl stmt);
        R visitBlockStmt(Block stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitFunctionDeclStmt(FunctionDecl stmt);
        R visitClassDeclStmt(ClassDecl stmt);
        R visitReturnStmt(Return stmt);
    }

    public static final class Print implements Stmt {
        public final Expr.ExprInterface expr;
        public Print(Expr.ExprInterface expr) { this.expr = expr; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitPrintStmt(this); }
        public String label() { return "Print"; }
        public List<Node> children() { return List.of(expr); }
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expr;
        public ExprStmt(Expr.ExprInterface expr) { this.expr = expr; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
        public String label() { return "ExprStmt"; }
        public List<Node> children() { return List.of(expr); }
    }

    public static final class VarDecl implements Stmt {
        public final String name;
        public final Expr.ExprInterface initializer;
        public final String typeHint; // may be null, never checked
        public final boolean implicitInteger;

        public VarDecl(String name, Expr.ExprInterface initializer, String typeHint, boolean implicitInteger) {
            this.name = name;
            this.initializer = initializer;
            this.typeHint = typeHint;
            this.implicitInteger = implicitInteger;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitVarDeclStmt(this); }
        public String label() { return "VarDecl " + name + (typeHint == null ? "" : ": " + typeHint); }
        public List<Node> children() { return List.of(initializer); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        public Block(List<Stmt> statements) { this.statements = Collections.unmodifiableList(new ArrayList<>(statements)); }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBlockStmt(this); }
        public String label() { return "Block"; }
        public List<Node> children() { return new ArrayList<>(statements); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch;

        public If(Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
        public String label() { return "If"; }
        public List<Node> children() { return List.of(condition, thenBranch, elseBranch); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt body;

        public While(Expr.ExprInterface condition, Stmt body) {
            this.condition = condition;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
        public String label() { return "While"; }
        public List<Node> children() { return List.of(condition, body); }
    }

    /** A declared parameter; the type hint is informational only. */
    public static final class Param implements Node {
        public final String name;
        public final String typeHint; // may be null
        public final boolean implicitInteger;

        public Param(String name, String typeHint, boolean implicitInteger) {
            this.name = name;
            this.typeHint = typeHint;
            this.implicitInteger = implicitInteger;
        }

        public String label() { return "Param " + name + (typeHint == null ? "" : ": " + typeHint); }
        public List<Node> children() { return List.of(); }
    }

    public static final class FunctionDecl implements Stmt {
        public final String name;
        public final List<Param> params;
        public final Block body;
        public final String returnTypeHint; // may be null

        public FunctionDecl(String name, List<Param> params, Block body, String returnTypeHint) {
            this.name = name;
            this.params = Collections.unmodifiableList(new ArrayList<>(params));
            this.body = body;
            this.returnTypeHint = returnTypeHint;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunctionDeclStmt(this); }
        public String label() { return "FunctionDecl " + name + (returnTypeHint == null ? "" : ": " + returnTypeHint); }

        public List<Node> children() {
            List<Node> out = new ArrayList<>(params);
            out.add(body);
            return out;
        }
    }

    public static final class ClassDecl implements Stmt {
        public final String name;
        public final String superclassName; // may be null
        public final List<FunctionDecl> methods;

        public ClassDecl(String name, String superclassName, List<FunctionDecl> methods) {
            this.name = name;
            this.superclassName = superclassName;
            this.methods = Collections.unmodifiableList(new ArrayList<>(methods));
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitClassDeclStmt(this); }
        public String label() { return "ClassDecl " + name + (superclassName == null ? "" : " < " + superclassName); }
        public List<Node> children() { return new ArrayList<>(methods); }
    }

    public static final class Return implements Stmt {
        public final Expr.ExprInterface value; // may be null

        public Return(Expr.ExprInterface value) { this.value = value; }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
        public String label() { return "Return"; }
        public List<Node> children() { return value == null ? List.of() : List.of(value); }
    }
}
