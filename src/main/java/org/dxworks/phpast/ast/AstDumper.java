package org.dxworks.phpast.ast;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Text rendering of a tree in the layout of php-ast's {@code ast_dump()} with line numbers:
 * one node per line, children indented by four spaces, flags in symbolic form.
 */
public final class AstDumper {

    private static final String INDENT = "    ";

    private static final Map<AstKind, Map<Integer, String>> EXCLUSIVE_FLAGS = new EnumMap<>(AstKind.class);
    private static final Map<AstKind, Map<Integer, String>> COMBINABLE_FLAGS = new EnumMap<>(AstKind.class);

    static {
        Map<Integer, String> names = flagNames(
                AstFlags.NAME_FQ, "NAME_FQ", AstFlags.NAME_NOT_FQ, "NAME_NOT_FQ",
                AstFlags.NAME_RELATIVE, "NAME_RELATIVE");
        Map<Integer, String> types = flagNames(
                AstFlags.TYPE_NULL, "TYPE_NULL", AstFlags.TYPE_BOOL, "TYPE_BOOL", AstFlags.TYPE_LONG, "TYPE_LONG",
                AstFlags.TYPE_DOUBLE, "TYPE_DOUBLE", AstFlags.TYPE_STRING, "TYPE_STRING",
                AstFlags.TYPE_ARRAY, "TYPE_ARRAY", AstFlags.TYPE_OBJECT, "TYPE_OBJECT",
                AstFlags.TYPE_CALLABLE, "TYPE_CALLABLE", AstFlags.TYPE_VOID, "TYPE_VOID",
                AstFlags.TYPE_ITERABLE, "TYPE_ITERABLE");
        Map<Integer, String> unary = flagNames(
                AstFlags.UNARY_BOOL_NOT, "UNARY_BOOL_NOT", AstFlags.UNARY_BITWISE_NOT, "UNARY_BITWISE_NOT",
                AstFlags.UNARY_SILENCE, "UNARY_SILENCE", AstFlags.UNARY_PLUS, "UNARY_PLUS",
                AstFlags.UNARY_MINUS, "UNARY_MINUS");
        Map<Integer, String> binary = flagNames(
                AstFlags.BINARY_ADD, "BINARY_ADD", AstFlags.BINARY_SUB, "BINARY_SUB",
                AstFlags.BINARY_MUL, "BINARY_MUL", AstFlags.BINARY_DIV, "BINARY_DIV",
                AstFlags.BINARY_MOD, "BINARY_MOD", AstFlags.BINARY_SHIFT_LEFT, "BINARY_SHIFT_LEFT",
                AstFlags.BINARY_SHIFT_RIGHT, "BINARY_SHIFT_RIGHT", AstFlags.BINARY_CONCAT, "BINARY_CONCAT",
                AstFlags.BINARY_BITWISE_OR, "BINARY_BITWISE_OR", AstFlags.BINARY_BITWISE_AND, "BINARY_BITWISE_AND",
                AstFlags.BINARY_BITWISE_XOR, "BINARY_BITWISE_XOR", AstFlags.BINARY_BOOL_XOR, "BINARY_BOOL_XOR",
                AstFlags.BINARY_IS_IDENTICAL, "BINARY_IS_IDENTICAL",
                AstFlags.BINARY_IS_NOT_IDENTICAL, "BINARY_IS_NOT_IDENTICAL",
                AstFlags.BINARY_IS_EQUAL, "BINARY_IS_EQUAL", AstFlags.BINARY_IS_NOT_EQUAL, "BINARY_IS_NOT_EQUAL",
                AstFlags.BINARY_IS_SMALLER, "BINARY_IS_SMALLER",
                AstFlags.BINARY_IS_SMALLER_OR_EQUAL, "BINARY_IS_SMALLER_OR_EQUAL",
                AstFlags.BINARY_POW, "BINARY_POW", AstFlags.BINARY_SPACESHIP, "BINARY_SPACESHIP",
                AstFlags.BINARY_IS_GREATER, "BINARY_IS_GREATER",
                AstFlags.BINARY_IS_GREATER_OR_EQUAL, "BINARY_IS_GREATER_OR_EQUAL",
                AstFlags.BINARY_BOOL_OR, "BINARY_BOOL_OR", AstFlags.BINARY_BOOL_AND, "BINARY_BOOL_AND",
                AstFlags.BINARY_COALESCE, "BINARY_COALESCE");
        Map<Integer, String> magic = flagNames(
                AstFlags.MAGIC_LINE, "MAGIC_LINE", AstFlags.MAGIC_FILE, "MAGIC_FILE", AstFlags.MAGIC_DIR, "MAGIC_DIR",
                AstFlags.MAGIC_CLASS, "MAGIC_CLASS", AstFlags.MAGIC_TRAIT, "MAGIC_TRAIT",
                AstFlags.MAGIC_METHOD, "MAGIC_METHOD", AstFlags.MAGIC_FUNCTION, "MAGIC_FUNCTION",
                AstFlags.MAGIC_NAMESPACE, "MAGIC_NAMESPACE");
        Map<Integer, String> exec = flagNames(
                AstFlags.EXEC_EVAL, "EXEC_EVAL", AstFlags.EXEC_INCLUDE, "EXEC_INCLUDE",
                AstFlags.EXEC_INCLUDE_ONCE, "EXEC_INCLUDE_ONCE", AstFlags.EXEC_REQUIRE, "EXEC_REQUIRE",
                AstFlags.EXEC_REQUIRE_ONCE, "EXEC_REQUIRE_ONCE");
        Map<Integer, String> use = flagNames(
                AstFlags.USE_NORMAL, "USE_NORMAL", AstFlags.USE_FUNCTION, "USE_FUNCTION",
                AstFlags.USE_CONST, "USE_CONST");
        Map<Integer, String> arraySyntax = flagNames(
                AstFlags.ARRAY_SYNTAX_LIST, "ARRAY_SYNTAX_LIST", AstFlags.ARRAY_SYNTAX_LONG, "ARRAY_SYNTAX_LONG",
                AstFlags.ARRAY_SYNTAX_SHORT, "ARRAY_SYNTAX_SHORT");

        EXCLUSIVE_FLAGS.put(AstKind.NAME, names);
        EXCLUSIVE_FLAGS.put(AstKind.TYPE, types);
        EXCLUSIVE_FLAGS.put(AstKind.CAST, types);
        EXCLUSIVE_FLAGS.put(AstKind.UNARY_OP, unary);
        EXCLUSIVE_FLAGS.put(AstKind.BINARY_OP, binary);
        EXCLUSIVE_FLAGS.put(AstKind.ASSIGN_OP, binary);
        EXCLUSIVE_FLAGS.put(AstKind.MAGIC_CONST, magic);
        EXCLUSIVE_FLAGS.put(AstKind.INCLUDE_OR_EVAL, exec);
        EXCLUSIVE_FLAGS.put(AstKind.USE, use);
        EXCLUSIVE_FLAGS.put(AstKind.GROUP_USE, use);
        EXCLUSIVE_FLAGS.put(AstKind.USE_ELEM, use);
        EXCLUSIVE_FLAGS.put(AstKind.ARRAY, arraySyntax);

        Map<Integer, String> modifiers = flagNames(
                AstFlags.MODIFIER_PUBLIC, "MODIFIER_PUBLIC", AstFlags.MODIFIER_PROTECTED, "MODIFIER_PROTECTED",
                AstFlags.MODIFIER_PRIVATE, "MODIFIER_PRIVATE", AstFlags.MODIFIER_STATIC, "MODIFIER_STATIC",
                AstFlags.MODIFIER_ABSTRACT, "MODIFIER_ABSTRACT", AstFlags.MODIFIER_FINAL, "MODIFIER_FINAL");
        Map<Integer, String> functions = new LinkedHashMap<>(modifiers);
        functions.put(AstFlags.RETURNS_REF, "RETURNS_REF");
        functions.put(AstFlags.FUNC_GENERATOR, "FUNC_GENERATOR");
        Map<Integer, String> classes = flagNames(
                AstFlags.CLASS_ABSTRACT, "CLASS_ABSTRACT", AstFlags.CLASS_FINAL, "CLASS_FINAL",
                AstFlags.CLASS_TRAIT, "CLASS_TRAIT", AstFlags.CLASS_INTERFACE, "CLASS_INTERFACE",
                AstFlags.CLASS_ANONYMOUS, "CLASS_ANONYMOUS");

        COMBINABLE_FLAGS.put(AstKind.FUNC_DECL, functions);
        COMBINABLE_FLAGS.put(AstKind.METHOD, functions);
        COMBINABLE_FLAGS.put(AstKind.CLOSURE, functions);
        COMBINABLE_FLAGS.put(AstKind.PROP_DECL, modifiers);
        COMBINABLE_FLAGS.put(AstKind.CLASS_CONST_DECL, modifiers);
        COMBINABLE_FLAGS.put(AstKind.TRAIT_ALIAS, modifiers);
        COMBINABLE_FLAGS.put(AstKind.CLASS, classes);
        COMBINABLE_FLAGS.put(AstKind.PARAM, flagNames(
                AstFlags.PARAM_REF, "PARAM_REF", AstFlags.PARAM_VARIADIC, "PARAM_VARIADIC"));
        COMBINABLE_FLAGS.put(AstKind.ARRAY_ELEM, flagNames(AstFlags.ARRAY_ELEM_REF, "ARRAY_ELEM_REF"));
        COMBINABLE_FLAGS.put(AstKind.CLOSURE_VAR, flagNames(AstFlags.CLOSURE_USE_REF, "CLOSURE_USE_REF"));
    }

    private AstDumper() {
    }

    public static String dump(Object ast) {
        if (ast == null) return "null";
        if (ast instanceof String) return "\"" + ast + "\"";
        if (!(ast instanceof AstNode)) return String.valueOf(ast);

        AstNode node = (AstNode) ast;
        StringBuilder out = new StringBuilder();
        if (node instanceof StubNode) {
            out.append("STUB(").append(((StubNode) node).getSourceType()).append(')');
        } else {
            out.append(node.getKind().getAstName());
        }
        out.append(" @ ").append(node.getLineno());
        if (node.getEndLineno() != null) {
            out.append('-').append(node.getEndLineno());
        }

        String flags = formatFlags(node.getKind(), node.getFlags());
        if (flags != null) {
            out.append('\n').append("flags: ").append(flags);
        }
        if (node instanceof AstDecl) {
            AstDecl decl = (AstDecl) node;
            out.append('\n').append("name: ").append(decl.getName());
            if (decl.getDocComment() != null) {
                out.append('\n').append("docComment: ").append(decl.getDocComment());
            }
        } else if (node.getDocCommentAttribute() != null) {
            out.append('\n').append("docComment: ").append(node.getDocCommentAttribute());
        }
        for (Map.Entry<String, Object> child : node.getChildren().entrySet()) {
            out.append('\n').append(child.getKey()).append(": ").append(dump(child.getValue()));
        }
        return out.toString().replace("\n", "\n" + INDENT);
    }

    private static String formatFlags(AstKind kind, int flags) {
        Map<Integer, String> exclusive = EXCLUSIVE_FLAGS.get(kind);
        if (exclusive != null) {
            String name = exclusive.get(flags);
            return name != null ? name + " (" + flags + ")" : String.valueOf(flags);
        }
        Map<Integer, String> combinable = COMBINABLE_FLAGS.get(kind);
        if (combinable != null) {
            List<String> set = new ArrayList<>();
            for (Map.Entry<Integer, String> flag : combinable.entrySet()) {
                if ((flags & flag.getKey()) != 0) set.add(flag.getValue());
            }
            return set.isEmpty() ? String.valueOf(flags) : String.join(" | ", set) + " (" + flags + ")";
        }
        return flags != 0 ? String.valueOf(flags) : null;
    }

    private static Map<Integer, String> flagNames(Object... valuesAndNames) {
        Map<Integer, String> names = new LinkedHashMap<>();
        for (int i = 0; i < valuesAndNames.length; i += 2) {
            names.put((Integer) valuesAndNames[i], (String) valuesAndNames[i + 1]);
        }
        return names;
    }
}
