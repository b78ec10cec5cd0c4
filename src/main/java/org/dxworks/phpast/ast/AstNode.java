package org.dxworks.phpast.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A node of the php-ast tree. Children are kept in schema order; list kinds use the keys
 * "0".."n". Child values are {@link AstNode}, {@link String}, {@link Long}, {@link Double}
 * or {@code null}.
 * <p>
 * Instances are created through {@link NodeFactory} and are never modified afterwards.
 */
public class AstNode {

    private final AstKind kind;
    private final int flags;
    private final int lineno;
    private final Map<String, Object> children;
    private final Integer endLineno;
    private final String docComment;

    AstNode(AstKind kind, int flags, Map<String, Object> children, int lineno, Integer endLineno, String docComment) {
        this.kind = kind;
        this.flags = flags;
        this.lineno = Math.max(lineno, 0);
        this.children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
        this.endLineno = endLineno;
        this.docComment = docComment;
    }

    public AstKind getKind() {
        return kind;
    }

    public int getFlags() {
        return flags;
    }

    public boolean hasFlag(int flag) {
        return (flags & flag) == flag;
    }

    public int getLineno() {
        return lineno;
    }

    /** End line of a declaration, {@code null} for other nodes. */
    public Integer getEndLineno() {
        return endLineno;
    }

    /**
     * Documentation comment kept outside the children mapping. Only set by the version 40
     * layout; at version 50 the comment is the {@code docComment} child.
     */
    public String getDocCommentAttribute() {
        return docComment;
    }

    public Map<String, Object> getChildren() {
        return children;
    }

    public boolean hasChild(String key) {
        return children.containsKey(key);
    }

    public Object getChild(String key) {
        return children.get(key);
    }

    public Object getChild(int index) {
        return children.get(String.valueOf(index));
    }

    /** The child under {@code key} when it is a node, otherwise {@code null}. */
    public AstNode getNode(String key) {
        Object child = children.get(key);
        return child instanceof AstNode ? (AstNode) child : null;
    }

    public AstNode getNode(int index) {
        return getNode(String.valueOf(index));
    }

    public List<Object> getItems() {
        return new ArrayList<>(children.values());
    }

    public int size() {
        return children.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AstNode other = (AstNode) o;
        return kind == other.kind
                && flags == other.flags
                && lineno == other.lineno
                && Objects.equals(endLineno, other.endLineno)
                && Objects.equals(docComment, other.docComment)
                && new ArrayList<>(children.keySet()).equals(new ArrayList<>(other.children.keySet()))
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, flags, lineno, children);
    }

    @Override
    public String toString() {
        return kind.getAstName() + "@" + lineno;
    }
}
