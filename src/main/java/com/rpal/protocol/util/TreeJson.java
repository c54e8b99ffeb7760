package com.rpal.protocol.util;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rpal.script.cse.ControlBlock;
import com.rpal.script.cse.Instruction;
import com.rpal.script.cse.Value;
import com.rpal.script.parser.NodeType;
import com.rpal.script.parser.TreeNode;

/**
 * JSON transport for trees, control blocks and results.
 *
 * Tree shape:
 *   { "type": "GAMMA", "label": "gamma", "children": [ ... ] }
 *   { "type": "IDENTIFIER", "label": "<ID:x>", "value": "x" }
 *
 * {@link #readTree(String)} accepts the same shape ("label" is ignored), which lets an
 * external parser hand a raw tree to the engine.
 */
public final class TreeJson {

    private static final ObjectMapper om = new ObjectMapper();

    private TreeJson() {}

    public static ObjectNode toJson(TreeNode node) {
        ObjectNode out = om.createObjectNode();
        out.put("type", node.type.name());
        out.put("label", node.label());
        if (node.value != null) out.put("value", node.value);
        if (!node.children.isEmpty()) {
            ArrayNode kids = out.putArray("children");
            for (TreeNode c : node.children) kids.add(toJson(c));
        }
        return out;
    }

    public static ArrayNode toJson(List<ControlBlock> blocks) {
        ArrayNode out = om.createArrayNode();
        for (ControlBlock b : blocks) {
            ObjectNode o = out.addObject();
            o.put("index", b.index);
            ArrayNode ins = o.putArray("instructions");
            for (Instruction i : b.instructions) ins.add(i.toString());
        }
        return out;
    }

    /** Integers, truth values and strings map to JSON scalars, tuples to arrays, dummy to null. */
    public static JsonNode toJson(Value v) {
        switch (v.getType()) {
            case INTEGER:
                return om.getNodeFactory().numberNode(v.asInteger());
            case TRUTH:
                return om.getNodeFactory().booleanNode(v.asTruth());
            case STRING:
                return om.getNodeFactory().textNode(v.asString());
            case TUPLE: {
                ArrayNode arr = om.createArrayNode();
                for (Value item : v.asTuple()) arr.add(toJson(item));
                return arr;
            }
            case DUMMY:
                return om.getNodeFactory().nullNode();
            default:
                return om.getNodeFactory().textNode(v.toString());
        }
    }

    public static TreeNode readTree(String json) throws IOException {
        return fromJson(om.readTree(json));
    }

    public static TreeNode fromJson(JsonNode n) {
        if (n == null || !n.isObject()) throw new IllegalArgumentException("Tree node must be a JSON object");
        JsonNode typeNode = n.get("type");
        if (typeNode == null || !typeNode.isTextual()) throw new IllegalArgumentException("Tree node is missing \"type\"");

        NodeType type;
        try {
            type = NodeType.valueOf(typeNode.asText());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node type: " + typeNode.asText(), e);
        }

        if (type.isLeaf()) {
            if (n.path("children").size() > 0) throw new IllegalArgumentException("Leaf " + type + " cannot have children");
            JsonNode value = n.get("value");
            String text = value == null || value.isNull() ? null : value.asText();
            switch (type) {
                case IDENTIFIER: case STRING:
                    if (text == null) throw new IllegalArgumentException(type + " node is missing \"value\"");
                    break;
                case INTEGER:
                    if (text == null) throw new IllegalArgumentException(type + " node is missing \"value\"");
                    try {
                        Long.parseLong(text);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("INTEGER node has a non-numeric value: " + text, e);
                    }
                    break;
                default:
                    break;
            }
            return TreeNode.leaf(type, text);
        }

        List<TreeNode> kids = new ArrayList<>();
        JsonNode children = n.path("children");
        for (JsonNode c : children) kids.add(fromJson(c));
        if (!type.acceptsArity(kids.size())) {
            throw new IllegalArgumentException("Node " + type + " cannot have " + kids.size() + " children");
        }
        return TreeNode.of(type, kids);
    }

    public static String pretty(JsonNode n) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON rendering failed", e);
        }
    }
}
