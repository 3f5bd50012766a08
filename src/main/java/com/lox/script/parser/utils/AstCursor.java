package com.lox.script.parser.utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.lox.script.parser.Node;

/** Position in an AST: the node plus the path that led to it. */
public final class AstCursor {
    private final Node node;
    private final AstCursor parent; // null at the root
    private final int depth;

    private AstCursor(Node node, AstCursor parent) {
        this.node = node;
        this.parent = parent;
        this.depth = (parent == null) ? 0 : parent.depth + 1;
    }

    public static AstCursor of(Node root) {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        return new AstCursor(root, null);
    }

    public Node node() { return node; }

    public Optional<AstCursor> parent() { return Optional.ofNullable(parent); }

    public int depth() { return depth; }

    public List<AstCursor> children() {
        List<Node> kids = node.children();
        List<AstCursor> out = new ArrayList<>(kids.size());
        for (Node k : kids) out.add(new AstCursor(k, this));
        return out;
    }

    /** This cursor and every descendant, pre-order. */
    public Stream<AstCursor> stream() {
        return Stream.concat(Stream.of(this), children().stream().flatMap(AstCursor::stream));
    }

    public <T extends Node> List<T> find(Class<T> type) {
        return stream()
                .map(AstCursor::node)
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    /** Labels from the root down to this node. */
    public List<String> path() {
        List<String> out = new ArrayList<>();
        for (AstCursor c = this; c != null; c = c.parent) out.add(0, c.node.label());
        return out;
    }
}
