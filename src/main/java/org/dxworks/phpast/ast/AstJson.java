package org.dxworks.phpast.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Jackson rendering of output trees, used for the JSONL records written by the CLI.
 */
public final class AstJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private AstJson() {
    }

    public static JsonNode toJson(Object ast) {
        if (ast == null) return NODES.nullNode();
        if (ast instanceof String) return NODES.textNode((String) ast);
        if (ast instanceof Long) return NODES.numberNode((Long) ast);
        if (ast instanceof Double) return NODES.numberNode((Double) ast);
        if (!(ast instanceof AstNode)) {
            throw new IllegalArgumentException("Not an AST value: " + ast.getClass().getName());
        }

        AstNode node = (AstNode) ast;
        ObjectNode json = NODES.objectNode();
        json.put("kind", node.getKind().getAstName());
        json.put("kindCode", node.getKind().getCode());
        json.put("flags", node.getFlags());
        json.put("lineno", node.getLineno());
        if (node.getEndLineno() != null) {
            json.put("endLineno", node.getEndLineno());
        }
        if (node instanceof AstDecl) {
            json.put("name", ((AstDecl) node).getName());
        }
        if (node.getDocCommentAttribute() != null) {
            json.put("docComment", node.getDocCommentAttribute());
        }
        if (node instanceof StubNode) {
            json.put("sourceType", ((StubNode) node).getSourceType());
        }
        ObjectNode children = json.putObject("children");
        for (Map.Entry<String, Object> child : node.getChildren().entrySet()) {
            children.set(child.getKey(), toJson(child.getValue()));
        }
        return json;
    }

    public static String toJsonString(ObjectMapper mapper, Object ast) {
        try {
            return mapper.writeValueAsString(toJson(ast));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize AST", e);
        }
    }
}
