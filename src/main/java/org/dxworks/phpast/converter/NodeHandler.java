package org.dxworks.phpast.converter;

import org.treesitter.TSNode;

/**
 * Converts one kind of tree-sitter node. The result is an AST node, a scalar, a
 * {@link java.util.List} of siblings to splice into the enclosing list, or {@code null}.
 */
@FunctionalInterface
public interface NodeHandler {
    Object convert(TSNode node, ConversionSession session);
}
