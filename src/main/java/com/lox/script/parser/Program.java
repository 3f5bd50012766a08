package com.lox.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.lox.script.parser.Statement.Stmt;

/** Root of the AST. Built once, then only read. */
public final class Program implements Node {
    public final List<Stmt> statements;

    public Program(List<Stmt> statements) {
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    @Override
    public String label() { return "Program"; }

    @Override
    public List<Node> children() { return new ArrayList<>(statements); }
}
