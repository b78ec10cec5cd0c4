package org.dxworks.phpast.converter;

import org.dxworks.phpast.ast.AstNode;
import org.treesitter.TSNode;

import java.util.List;

import static org.dxworks.phpast.parser.TreeSitterNodes.isPresent;

/**
 * Line numbers for output nodes. Lines are 1-based; 0 means unknown.
 */
public final class LineResolver {

    private LineResolver() {
    }

    public static int lineOf(TSNode node) {
        return isPresent(node) ? node.getStartPoint().getRow() + 1 : 0;
    }

    public static int endLineOf(TSNode node) {
        return isPresent(node) ? node.getEndPoint().getRow() + 1 : 0;
    }

    /** The first positive line among the input nodes, else the fallback, else 0. */
    public static int firstLine(List<TSNode> nodes, int fallback) {
        for (TSNode node : nodes) {
            int line = lineOf(node);
            if (line > 0) return line;
        }
        return Math.max(fallback, 0);
    }

    /** The line of the first converted child if it is a node, else the fallback. */
    public static int firstChildLine(List<?> converted, int fallback) {
        if (!converted.isEmpty() && converted.get(0) instanceof AstNode) {
            int line = ((AstNode) converted.get(0)).getLineno();
            if (line > 0) return line;
        }
        return Math.max(fallback, 0);
    }

    /** The line of the first converted child that is a node with a known line. */
    public static int firstPositiveLine(List<?> converted, int fallback) {
        for (Object child : converted) {
            if (child instanceof AstNode && ((AstNode) child).getLineno() > 0) {
                return ((AstNode) child).getLineno();
            }
        }
        return Math.max(fallback, 0);
    }
}
