package org.dxworks.phpast.converter;

import org.treesitter.TSNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Routes a tree-sitter node to the handler registered for its type. The registry is
 * built on first use and shared by all conversions.
 */
public final class NodeDispatcher {

    private NodeDispatcher() {
    }

    private static final class Registry {
        static final Map<String, NodeHandler> HANDLERS = build();
    }

    private static Map<String, NodeHandler> build() {
        Map<String, NodeHandler> handlers = new HashMap<>();
        StatementHandlers.register(handlers);
        DeclarationHandlers.register(handlers);
        ExpressionHandlers.register(handlers);
        LiteralHandlers.register(handlers);
        return Collections.unmodifiableMap(handlers);
    }

    public static Object dispatch(TSNode node, ConversionSession session) {
        if (node == null || node.isNull()) {
            throw new InvalidNodeTypeException("Invalid type for node: expected a syntax node, got null");
        }
        if (node.isMissing()) {
            return null;
        }
        NodeHandler handler = Registry.HANDLERS.get(node.getType());
        if (handler == null) {
            return session.stub(node);
        }
        return handler.convert(node, session);
    }
}
