package org.dxworks.phpast.converter;

import org.dxworks.phpast.ast.AstFlags;
import org.dxworks.phpast.ast.AstKind;
import org.dxworks.phpast.ast.AstNode;
import org.dxworks.phpast.ast.AstVersion;
import org.dxworks.phpast.ast.NodeFactory;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.dxworks.phpast.ast.NodeFactory.children;
import static org.dxworks.phpast.parser.TreeSitterNodes.allChildren;
import static org.dxworks.phpast.parser.TreeSitterNodes.isTypeOneOf;
import static org.dxworks.phpast.parser.TreeSitterNodes.namedChildren;

/**
 * Maps type names, class names and modifier keywords to php-ast nodes and flags.
 */
public final class TypeFlagMapper {

    private static final Map<String, Integer> TYPE_FLAGS = new HashMap<>();
    private static final String RELATIVE_PREFIX = "namespace\\";

    private static final String[] MODIFIER_NODES = {
            "visibility_modifier", "static_modifier", "abstract_modifier", "final_modifier",
            "var_modifier", "readonly_modifier"
    };

    static {
        TYPE_FLAGS.put("null", AstFlags.TYPE_NULL);
        TYPE_FLAGS.put("bool", AstFlags.TYPE_BOOL);
        TYPE_FLAGS.put("int", AstFlags.TYPE_LONG);
        TYPE_FLAGS.put("float", AstFlags.TYPE_DOUBLE);
        TYPE_FLAGS.put("string", AstFlags.TYPE_STRING);
        TYPE_FLAGS.put("array", AstFlags.TYPE_ARRAY);
        TYPE_FLAGS.put("object", AstFlags.TYPE_OBJECT);
        TYPE_FLAGS.put("callable", AstFlags.TYPE_CALLABLE);
        TYPE_FLAGS.put("void", AstFlags.TYPE_VOID);
        TYPE_FLAGS.put("iterable", AstFlags.TYPE_ITERABLE);
    }

    private TypeFlagMapper() {
    }

    /**
     * An {@code AST_TYPE} for a primitive type name, otherwise an {@code AST_NAME}.
     *
     * @throws org.dxworks.phpast.ast.UnsupportedAstVersionException for versions other than 40 and 50
     */
    public static AstNode typeNode(String typeName, int line, int astVersion) {
        return typeNode(typeName, line, new NodeFactory(AstVersion.of(astVersion)));
    }

    static AstNode typeNode(String typeName, int line, NodeFactory factory) {
        String lower = typeName.toLowerCase(Locale.ROOT);
        Integer flags = TYPE_FLAGS.get(lower);
        if (flags == null) {
            return nameNode(typeName, line, factory);
        }
        if (flags == AstFlags.TYPE_OBJECT && !factory.getVersion().hasObjectType()) {
            return factory.node(AstKind.NAME, AstFlags.NAME_NOT_FQ, children("name", typeName), line);
        }
        return factory.node(AstKind.TYPE, flags, children(), line);
    }

    public static AstNode nullableType(AstNode type, int line, NodeFactory factory) {
        return factory.node(AstKind.NULLABLE_TYPE, 0, children("type", type), line);
    }

    /** Converts a tree-sitter type annotation; {@code null} when there is none. */
    static Object typeNode(TSNode node, ConversionSession session) {
        if (node == null || node.isNull()) return null;
        int line = session.line(node);
        switch (node.getType()) {
            case "optional_type": {
                List<TSNode> inner = namedChildren(node);
                Object type = inner.isEmpty() ? null : typeNode(inner.get(0), session);
                return session.factory().node(AstKind.NULLABLE_TYPE, 0, children("type", type), line);
            }
            case "named_type":
            case "primitive_type":
            case "bottom_type":
            case "name":
            case "qualified_name":
            case "cast_type":
                return typeNode(session.text(node).trim(), line, session.factory());
            case "union_type": {
                List<TSNode> members = namedChildren(node);
                if (members.size() == 1) return typeNode(members.get(0), session);
                return session.stub(node);
            }
            default:
                return session.stub(node);
        }
    }

    /**
     * An {@code AST_NAME} whose flag records how the name was qualified in the source:
     * a leading backslash is fully qualified, a {@code namespace\} prefix is relative.
     */
    public static AstNode nameNode(String rawName, int line, NodeFactory factory) {
        String name = rawName.trim();
        int flags;
        if (name.startsWith("\\")) {
            flags = AstFlags.NAME_FQ;
            name = name.substring(1);
        } else if (name.toLowerCase(Locale.ROOT).startsWith(RELATIVE_PREFIX)) {
            flags = AstFlags.NAME_RELATIVE;
            name = name.substring(RELATIVE_PREFIX.length());
        } else {
            flags = AstFlags.NAME_NOT_FQ;
        }
        return factory.node(AstKind.NAME, flags, children("name", name), line);
    }

    /** A name with any qualification prefix removed, e.g. for group use prefixes. */
    static String unqualified(String rawName) {
        String name = rawName.trim();
        if (name.startsWith("\\")) return name.substring(1);
        if (name.toLowerCase(Locale.ROOT).startsWith(RELATIVE_PREFIX)) return name.substring(RELATIVE_PREFIX.length());
        return name;
    }

    /**
     * Modifier keywords to {@code MODIFIER_*} bits. When {@code automaticallyAddPublic} is
     * set and no visibility keyword is present, {@code MODIFIER_PUBLIC} is added.
     */
    public static int visibilityFlags(Collection<String> modifiers, boolean automaticallyAddPublic) {
        int flags = 0;
        for (String modifier : modifiers) {
            switch (modifier.toLowerCase(Locale.ROOT)) {
                case "public":
                    flags |= AstFlags.MODIFIER_PUBLIC;
                    break;
                case "protected":
                    flags |= AstFlags.MODIFIER_PROTECTED;
                    break;
                case "private":
                    flags |= AstFlags.MODIFIER_PRIVATE;
                    break;
                case "static":
                    flags |= AstFlags.MODIFIER_STATIC;
                    break;
                case "abstract":
                    flags |= AstFlags.MODIFIER_ABSTRACT;
                    break;
                case "final":
                    flags |= AstFlags.MODIFIER_FINAL;
                    break;
                default:
                    break;
            }
        }
        int visibility = AstFlags.MODIFIER_PUBLIC | AstFlags.MODIFIER_PROTECTED | AstFlags.MODIFIER_PRIVATE;
        if (automaticallyAddPublic && (flags & visibility) == 0) {
            flags |= AstFlags.MODIFIER_PUBLIC;
        }
        return flags;
    }

    public static int classFlags(Collection<String> modifiers) {
        int flags = 0;
        for (String modifier : modifiers) {
            String lower = modifier.toLowerCase(Locale.ROOT);
            if ("abstract".equals(lower)) flags |= AstFlags.CLASS_ABSTRACT;
            if ("final".equals(lower)) flags |= AstFlags.CLASS_FINAL;
        }
        return flags;
    }

    /** Modifier keywords written directly on a declaration, in source order. */
    static List<String> modifiers(TSNode declaration, ConversionSession session) {
        List<String> modifiers = new ArrayList<>();
        for (TSNode child : allChildren(declaration)) {
            if (isTypeOneOf(child.getType(), MODIFIER_NODES)) {
                modifiers.add(session.text(child).trim().toLowerCase(Locale.ROOT));
            }
        }
        return modifiers;
    }
}
