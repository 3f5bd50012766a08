package com.lox.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Generic concrete-syntax tree handed from a front-end to the TreeBuilder.
 *
 * Rule nodes are named after grammar rules ("add", "var_decl", ...) and token leaves
 * after token kinds ("VAR", "NUMBER", ...). The tree carries no semantics of its own.
 */
public abstract class ParseTree {

    private ParseTree() {}

    public abstract boolean isLeaf();

    public static Node node(String rule, List<ParseTree> children) {
        return new Node(rule, children);
    }

    public static Node node(String rule, ParseTree... children) {
        List<ParseTree> list = new ArrayList<>(children.length);
        Collections.addAll(list, children);
        return new Node(rule, list);
    }

    public static Leaf leaf(String token, String text) {
        return new Leaf(token, text);
    }

    public static final class Node extends ParseTree {
        public final String rule;
        public final List<ParseTree> children;

        Node(String rule, List<ParseTree> children) {
            if (rule == null) throw new IllegalArgumentException("rule must not be null");
            this.rule = rule;
            this.children = Collections.unmodifiableList(new ArrayList<>(children == null ? List.of() : children));
        }

        @Override
        public boolean isLeaf() { return false; }

        @Override
        public String toString() {
            return rule + children;
        }
    }

    public static final class Leaf extends ParseTree {
        public final String token;
        public final String text;

        Leaf(String token, String text) {
            if (token == null) throw new IllegalArgumentException("token must not be null");
            this.token = token;
            this.text = text == null ? "" : text;
        }

        @Override
        public boolean isLeaf() { return true; }

        @Override
        public String toString() {
            return token + "(" + text + ")";
        }
    }
}
