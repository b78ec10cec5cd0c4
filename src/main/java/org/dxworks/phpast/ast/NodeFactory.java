package org.dxworks.phpast.ast;

import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntSupplier;

/**
 * Builds output nodes for one target version. All layout differences between version 40
 * and version 50 are decided here, so handlers never look at the version themselves.
 */
public class NodeFactory {

    public static final String DOC_COMMENT = "docComment";
    public static final String NAME = "name";
    public static final String DECL_ID = "__declId";

    /** Kinds that carry a docComment child even when there is no comment. */
    private static final Set<AstKind> ALWAYS_CARRY_DOC_COMMENT = EnumSet.of(AstKind.CONST_ELEM, AstKind.PROP_ELEM);

    /** Schema keys that may be left out of a node. */
    private static final Map<AstKind, Set<String>> OMITTABLE_KEYS = Map.of(AstKind.TRY, Set.of("catches"));

    private final AstVersion version;

    public NodeFactory(AstVersion version) {
        this.version = version;
    }

    public AstVersion getVersion() {
        return version;
    }

    public AstNode node(AstKind kind, int flags, Map<String, Object> children, int line) {
        return node(kind, flags, children, line, null);
    }

    public AstNode node(AstKind kind, int flags, Map<String, Object> children, int line, String docComment) {
        if (kind.isDeclaration()) {
            throw new IllegalArgumentException(kind.getAstName() + " must be built with decl()");
        }
        checkChildKeys(kind, children.keySet());
        boolean carriesDoc = docComment != null || ALWAYS_CARRY_DOC_COMMENT.contains(kind);
        if (!carriesDoc) {
            return new AstNode(kind, flags, children, line, null, null);
        }
        if (version.hasDeclHeaderChildren()) {
            Map<String, Object> withDoc = new LinkedHashMap<>(children);
            withDoc.put(DOC_COMMENT, docComment);
            return new AstNode(kind, flags, withDoc, line, null, null);
        }
        return new AstNode(kind, flags, children, line, null, docComment);
    }

    /** A list kind whose items are keyed by position. */
    public AstNode list(AstKind kind, int flags, Collection<?> items, int line) {
        if (!kind.isList()) {
            throw new IllegalArgumentException(kind.getAstName() + " is not a list kind");
        }
        Map<String, Object> children = new LinkedHashMap<>();
        int i = 0;
        for (Object item : items) {
            children.put(String.valueOf(i++), item);
        }
        return new AstNode(kind, flags, children, line, null, null);
    }

    /**
     * A function, method, closure or class. At version 50 the children start with name,
     * docComment and the declaration id; at version 40 those live on an {@link AstDecl}.
     */
    public AstNode decl(AstKind kind, int flags, Map<String, Object> children, int line, int endLine,
                        String docComment, String name, IntSupplier declIds) {
        if (!kind.isDeclaration()) {
            throw new IllegalArgumentException(kind.getAstName() + " is not a declaration kind");
        }
        checkChildKeys(kind, children.keySet());
        if (!version.hasDeclHeaderChildren()) {
            return new AstDecl(kind, flags, children, line, endLine, docComment, name);
        }
        Map<String, Object> ordered = new LinkedHashMap<>();
        ordered.put(NAME, name);
        ordered.put(DOC_COMMENT, docComment);
        if (version.hasDeclIds()) {
            ordered.put(DECL_ID, (long) declIds.getAsInt());
        }
        ordered.putAll(children);
        return new AstNode(kind, flags, ordered, line, endLine, null);
    }

    public StubNode stub(String sourceType, int line) {
        return new StubNode(sourceType, line);
    }

    /** Ordered children from alternating keys and values; values may be {@code null}. */
    public static Map<String, Object> children(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        Map<String, Object> children = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            children.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return children;
    }

    private static void checkChildKeys(AstKind kind, Set<String> actual) {
        if (kind.isList() || kind == AstKind.STUB) return;
        List<String> expected = kind.getChildKeys();
        Set<String> omittable = OMITTABLE_KEYS.getOrDefault(kind, Set.of());
        Set<String> missing = new HashSet<>(expected);
        missing.removeAll(actual);
        missing.removeAll(omittable);
        Set<String> extra = new HashSet<>(actual);
        extra.removeAll(expected);
        if (!missing.isEmpty() || !extra.isEmpty()) {
            throw new IllegalStateException(kind.getAstName() + " children " + actual
                    + " do not match " + expected);
        }
    }
}
