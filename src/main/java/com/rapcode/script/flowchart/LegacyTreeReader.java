package com.rapcode.script.flowchart;

import com.fasterxml.jackson.databind.JsonNode;
import com.rapcode.script.parser.ErrorKind;
import com.rapcode.script.parser.RapcodeException;

/**
 * Maps the older generic flowchart tree ({@code node_type}, {@code text}, {@code attributes},
 * {@code children}) onto {@link FlowNode}s, so it is lowered by the same {@link FlowchartLowering}.
 *
 * In that tree a node's follow-up is its child without a role attribute; decision branches carry
 * {@code attributes.branch = then|else} and a loop body carries {@code attributes.loop_part = body}.
 */
public class LegacyTreeReader {

    public static boolean isLegacyTree(JsonNode root) {
        return root != null && root.isObject() && root.has("node_type");
    }

    public FlowNode read(JsonNode root) {
        if (!isLegacyTree(root)) {
            throw new RapcodeException(ErrorKind.LOWERING, "Legacy flowchart tree must be an object with 'node_type'.");
        }
        FlowNode node = node(root);
        return (node != null && node.kind == FlowNode.Kind.START) ? node : FlowNode.start(node);
    }

    private FlowNode node(JsonNode json) {
        if (json == null || json.isNull()) return null;
        String type = json.path("node_type").asText("");
        String text = json.path("text").asText("");
        JsonNode attributes = json.path("attributes");

        switch (type) {
            case "Start":
                return FlowNode.start(successor(json));
            case "End":
                return FlowNode.end();
            case "Assignment":
                return FlowNode.assignment(text, successor(json));
            case "Input": {
                String variable = attributes.path("variable").asText(text);
                String prompt = attributes.has("prompt") ? attributes.path("prompt").asText() : null;
                return FlowNode.input(variable, prompt, successor(json));
            }
            case "Output":
                return FlowNode.output(text, successor(json));
            case "If":
                return FlowNode.decision(text,
                        node(roleChild(json, "branch", "then")),
                        node(roleChild(json, "branch", "else")),
                        successor(json));
            case "Loop":
                return FlowNode.loop(null, text, node(roleChild(json, "loop_part", "body")), successor(json));
            default:
                return FlowNode.unknown(type, text, successor(json));
        }
    }

    /** The first child that carries neither a branch nor a loop_part role. */
    private FlowNode successor(JsonNode json) {
        for (JsonNode child : json.path("children")) {
            JsonNode attrs = child.path("attributes");
            if (!attrs.has("branch") && !attrs.has("loop_part")) return node(child);
        }
        return null;
    }

    private static JsonNode roleChild(JsonNode json, String attribute, String role) {
        for (JsonNode child : json.path("children")) {
            if (role.equals(child.path("attributes").path(attribute).asText(null))) return child;
        }
        return null;
    }
}
