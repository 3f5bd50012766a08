package com.lox.script.parser.utils;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lox.script.parser.ParseTree;
import com.lox.script.parser.ScriptError;

/**
 * JSON form of the generic parse tree, so any front-end can hand its output to the
 * TreeBuilder:
 *
 *   rule node  : {"rule": "add", "children": [ ... ]}
 *   token leaf : {"token": "NUMBER", "text": "42"}
 */
public final class ParseTreeJson {

    private static final ObjectMapper om = new ObjectMapper();

    private ParseTreeJson() {}

    public static ParseTree read(String json) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ScriptError(ScriptError.Kind.BUILD_ERROR, "Parse tree is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw ScriptError.buildError("Parse tree JSON is empty");
        }
        return fromJson(root);
    }

    public static ParseTree fromJson(JsonNode n) {
        if (!n.isObject()) throw ScriptError.buildError("Parse tree entries must be objects, got: " + n);

        if (n.has("token")) {
            JsonNode text = n.get("text");
            if (text != null && !text.isTextual()) throw ScriptError.buildError("Token text must be a string: " + n);
            return ParseTree.leaf(n.get("token").asText(), text == null ? "" : text.asText());
        }

        JsonNode rule = n.get("rule");
        if (rule == null || !rule.isTextual()) {
            throw ScriptError.buildError("Parse tree node needs a 'rule' or a 'token': " + n);
        }

        List<ParseTree> children = new ArrayList<>();
        JsonNode kids = n.get("children");
        if (kids != null) {
            if (!kids.isArray()) throw ScriptError.buildError("'children' must be an array in rule " + rule.asText());
            for (JsonNode child : kids) children.add(fromJson(child));
        }
        return ParseTree.node(rule.asText(), children);
    }

    public static ObjectNode toJson(ParseTree tree) {
        ObjectNode out = om.createObjectNode();
        if (tree.isLeaf()) {
            ParseTree.Leaf leaf = (ParseTree.Leaf) tree;
            out.put("token", leaf.token);
            out.put("text", leaf.text);
            return out;
        }
        ParseTree.Node node = (ParseTree.Node) tree;
        out.put("rule", node.rule);
        ArrayNode children = out.putArray("children");
        for (ParseTree child : node.children) children.add(toJson(child));
        return out;
    }

    public static String write(ParseTree tree) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize parse tree", e);
        }
    }
}
