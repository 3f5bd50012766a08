package com.lox.script.parser;

import java.util.List;

/** Read-only view shared by every AST node, used by printers and cursors. */
public interface Node {

    /** Node kind plus its inline payload, e.g. {@code "Var x"} or {@code "BinOp +"}. */
    String label();

    /** Direct children in source order; empty for leaves. */
    List<Node> children();
}
