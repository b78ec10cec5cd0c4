package org.dxworks.phpast.ast;

import java.util.Map;
import java.util.Objects;

/**
 * Declaration node of the version 40 layout: the name, the doc comment and the end line
 * are attributes rather than children, and there is no declaration id.
 */
public class AstDecl extends AstNode {

    private final String name;

    AstDecl(AstKind kind, int flags, Map<String, Object> children, int lineno, int endLineno,
            String docComment, String name) {
        super(kind, flags, children, lineno, endLineno, docComment);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public String getDocComment() {
        return getDocCommentAttribute();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Objects.equals(name, ((AstDecl) o).name);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Objects.hashCode(name);
    }
}
