package org.dxworks.phpast.ast;

import java.util.Collections;
import java.util.Objects;

/**
 * Stands in for an input construct the converter has no handler for. The kind is always
 * {@link AstKind#STUB}; the tree-sitter node type is kept in {@link #getSourceType()}.
 */
public class StubNode extends AstNode {

    private final String sourceType;

    StubNode(String sourceType, int lineno) {
        super(AstKind.STUB, 0, Collections.emptyMap(), lineno, null, null);
        this.sourceType = sourceType;
    }

    public String getSourceType() {
        return sourceType;
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Objects.equals(sourceType, ((StubNode) o).sourceType);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Objects.hashCode(sourceType);
    }

    @Override
    public String toString() {
        return "STUB(" + sourceType + ")@" + getLineno();
    }
}
