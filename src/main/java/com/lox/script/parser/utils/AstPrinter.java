package com.lox.script.parser.utils;

import com.lox.script.parser.Node;

/**
 * Indented dump of an AST, one node per line:
 *
 *   Program
 *     Print
 *       BinOp +
 *         Literal 1
 *         Literal 2
 */
public final class AstPrinter {

    private static final String INDENT = "  ";

    private AstPrinter() {}

    public static String print(Node root) {
        StringBuilder sb = new StringBuilder();
        AstCursor.of(root).stream().forEach(c -> {
            for (int i = 0; i < c.depth(); i++) sb.append(INDENT);
            sb.append(c.node().label()).append('\n');
        });
        return sb.toString();
    }
}
