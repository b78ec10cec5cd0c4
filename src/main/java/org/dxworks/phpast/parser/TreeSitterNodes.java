package org.dxworks.phpast.parser;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Null-safe navigation over tree-sitter nodes. Comments are extras that may appear between
 * any two children, so the "named children" helpers leave them out.
 */
public final class TreeSitterNodes {

    public static final String COMMENT = "comment";

    private TreeSitterNodes() {
    }

    /** Null nodes and tokens the parser inserted to recover from an error are both absent. */
    public static boolean isPresent(TSNode node) {
        return node != null && !node.isNull() && !node.isMissing();
    }

    public static boolean isComment(TSNode node) {
        return isPresent(node) && COMMENT.equals(node.getType());
    }

    public static TSNode field(TSNode parent, String fieldName) {
        if (!isPresent(parent)) return null;
        TSNode child = parent.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    /** Named children in source order, without comments. */
    public static List<TSNode> namedChildren(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        if (!isPresent(parent)) return result;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (isPresent(child) && !isComment(child)) {
                result.add(child);
            }
        }
        return result;
    }

    /** All children, anonymous tokens included, without comments. */
    public static List<TSNode> allChildren(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        if (!isPresent(parent)) return result;
        int count = parent.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getChild(i);
            if (isPresent(child) && !isComment(child)) {
                result.add(child);
            }
        }
        return result;
    }

    public static TSNode firstNamedChild(TSNode parent) {
        List<TSNode> children = namedChildren(parent);
        return children.isEmpty() ? null : children.get(0);
    }

    public static TSNode findFirstChild(TSNode parent, String nodeType) {
        for (TSNode child : namedChildren(parent)) {
            if (nodeType.equals(child.getType())) return child;
        }
        return null;
    }

    public static TSNode findFirstChildOfTypes(TSNode parent, String... types) {
        for (TSNode child : namedChildren(parent)) {
            if (isTypeOneOf(child.getType(), types)) return child;
        }
        return null;
    }

    public static List<TSNode> findAllChildren(TSNode parent, String... types) {
        List<TSNode> result = new ArrayList<>();
        for (TSNode child : namedChildren(parent)) {
            if (isTypeOneOf(child.getType(), types)) result.add(child);
        }
        return result;
    }

    /** Whether an anonymous token with exactly this text is a direct child. */
    public static boolean hasToken(TSNode parent, SourceText text, String token) {
        for (TSNode child : allChildren(parent)) {
            if (!child.isNamed() && token.equalsIgnoreCase(text.text(child))) return true;
        }
        return false;
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        return isPresent(node) && isTypeOneOf(node.getType(), types);
    }
}
