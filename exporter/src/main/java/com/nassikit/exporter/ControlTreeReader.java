package com.nassikit.exporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.nassikit.tree.ControlNode;
import com.nassikit.tree.MethodInfo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads control-flow trees in the analyzer's JSON format.
 * <p>
 * A document is one of: an object with a {@code methods} array, an array of methods, a single
 * method (has {@code controlTree} or {@code signature}) or a bare control-tree node (has
 * {@code kind}). Missing fields read as null or empty; unknown node kinds are kept as
 * {@link ControlNode.Unknown}.
 */
public class ControlTreeReader {

    private final ObjectMapper mapper;

    public ControlTreeReader() {
        this(new ObjectMapper());
    }

    public ControlTreeReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<MethodInfo> readMethods(Path file) throws IOException {
        return readMethods(Files.readString(file));
    }

    /**
     * Read every method in a document. A bare node becomes one method named {@code structogram}.
     */
    public List<MethodInfo> readMethods(String json) {
        JsonNode root = parse(json);

        if (root.isArray()) {
            return toMethods(root, "$");
        }
        if (!root.isObject()) {
            throw ControlTreeException.notAnObject("$");
        }
        if (root.has("methods")) {
            return toMethods(root.get("methods"), "methods");
        }
        if (root.has("controlTree") || root.has("signature")) {
            return List.of(toMethod(root, "$"));
        }
        return List.of(MethodInfo.builder()
            .name("structogram")
            .controlTree(toNode(root, "$"))
            .build());
    }

    /**
     * Read a single control-tree node.
     */
    public ControlNode readNode(String json) {
        return toNode(parse(json), "$");
    }

    private JsonNode parse(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw ControlTreeException.unreadable(e);
        }
    }

    private List<MethodInfo> toMethods(JsonNode array, String field) {
        if (!array.isArray()) {
            throw ControlTreeException.notAnArray(field);
        }
        List<MethodInfo> methods = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            methods.add(toMethod(array.get(i), field + "[" + i + "]"));
        }
        return methods;
    }

    MethodInfo toMethod(JsonNode json, String where) {
        if (!json.isObject()) {
            throw ControlTreeException.notAnObject(where);
        }

        List<MethodInfo.Param> params = new ArrayList<>();
        for (JsonNode param : array(json, "params")) {
            if (param.isObject()) {
                params.add(new MethodInfo.Param(text(param, "type"), text(param, "name")));
            }
        }

        JsonNode tree = json.get("controlTree");
        return MethodInfo.builder()
            .visibility(text(json, "visibility"))
            .setStatic(json.path("isStatic").asBoolean(false))
            .returnType(text(json, "returnType"))
            .name(text(json, "name"))
            .params(params)
            .signature(text(json, "signature"))
            .controlTree(tree == null || tree.isNull() ? null : toNode(tree, where + ".controlTree"))
            .build();
    }

    ControlNode toNode(JsonNode json, String where) {
        if (!json.isObject()) {
            throw ControlTreeException.notAnObject(where);
        }

        String kind = text(json, "kind");
        if (kind == null) {
            kind = "";
        }

        switch (kind) {
            case "statement":
                return new ControlNode.Statement(text(json, "text"));
            case "sequence":
                return new ControlNode.Sequence(nodes(json, "children", where));
            case "if":
                return new ControlNode.If(text(json, "condition"),
                    nodes(json, "thenBranch", where), nodes(json, "elseBranch", where));
            case "loop":
                return new ControlNode.Loop(text(json, "loopKind"), text(json, "condition"),
                    nodes(json, "children", where));
            case "switch": {
                List<ControlNode.SwitchCase> cases = new ArrayList<>();
                int index = 0;
                for (JsonNode entry : array(json, "switchCases")) {
                    String path = where + ".switchCases[" + index++ + "]";
                    if (!entry.isObject()) {
                        throw ControlTreeException.notAnObject(path);
                    }
                    cases.add(new ControlNode.SwitchCase(text(entry, "label"), nodes(entry, "body", path)));
                }
                return new ControlNode.Switch(text(json, "condition"), cases);
            }
            case "try": {
                List<ControlNode.CatchClause> catches = new ArrayList<>();
                int index = 0;
                for (JsonNode entry : array(json, "catches")) {
                    String path = where + ".catches[" + index++ + "]";
                    if (!entry.isObject()) {
                        throw ControlTreeException.notAnObject(path);
                    }
                    catches.add(new ControlNode.CatchClause(text(entry, "exception"), nodes(entry, "body", path)));
                }
                return new ControlNode.Try(nodes(json, "children", where), catches,
                    nodes(json, "finallyBranch", where));
            }
            default:
                return new ControlNode.Unknown(kind, text(json, "text"));
        }
    }

    private List<ControlNode> nodes(JsonNode json, String field, String where) {
        List<ControlNode> nodes = new ArrayList<>();
        int index = 0;
        for (JsonNode child : array(json, field)) {
            String path = where + "." + field + "[" + index++ + "]";
            if (!child.isNull()) {
                nodes.add(toNode(child, path));
            }
        }
        return nodes;
    }

    // absent or null reads as empty; any other non-array is an error
    private static JsonNode array(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            return JsonNodeFactory.instance.arrayNode();
        }
        if (!value.isArray()) {
            throw ControlTreeException.notAnArray(field);
        }
        return value;
    }

    private static String text(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
