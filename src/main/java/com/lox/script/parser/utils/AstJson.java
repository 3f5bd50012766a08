package com.lox.script.parser.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lox.script.parser.Node;

/** AST as JSON for external tooling: {"node": label, "children": [...]}. */
public final class AstJson {

    private static final ObjectMapper om = new ObjectMapper();

    private AstJson() {}

    public static ObjectNode toJson(Node node) {
        ObjectNode out = om.createObjectNode();
        out.put("node", node.label());
        if (!node.children().isEmpty()) {
            ArrayNode children = out.putArray("children");
            for (Node child : node.children()) children.add(toJson(child));
        }
        return out;
    }

    public static String write(Node node) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize AST", e);
        }
    }
}
