package org.dxworks.phpast.converter;

import org.dxworks.phpast.ast.AstFlags;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Operator and keyword tables shared by the parameterized handlers. Keys are the source
 * tokens, lower-cased where PHP is case-insensitive.
 */
final class Operators {

    private Operators() {
    }

    static final Map<String, Integer> BINARY = new HashMap<>();
    static final Map<String, Integer> UNARY = new HashMap<>();
    static final Map<String, Integer> CAST = new HashMap<>();
    static final Map<String, Integer> MAGIC_CONSTANTS = new HashMap<>();
    static final Map<String, Integer> INCLUDES = new HashMap<>();

    static {
        BINARY.put("+", AstFlags.BINARY_ADD);
        BINARY.put("-", AstFlags.BINARY_SUB);
        BINARY.put("*", AstFlags.BINARY_MUL);
        BINARY.put("/", AstFlags.BINARY_DIV);
        BINARY.put("%", AstFlags.BINARY_MOD);
        BINARY.put("**", AstFlags.BINARY_POW);
        BINARY.put("<<", AstFlags.BINARY_SHIFT_LEFT);
        BINARY.put(">>", AstFlags.BINARY_SHIFT_RIGHT);
        BINARY.put(".", AstFlags.BINARY_CONCAT);
        BINARY.put("|", AstFlags.BINARY_BITWISE_OR);
        BINARY.put("&", AstFlags.BINARY_BITWISE_AND);
        BINARY.put("^", AstFlags.BINARY_BITWISE_XOR);
        BINARY.put("xor", AstFlags.BINARY_BOOL_XOR);
        BINARY.put("===", AstFlags.BINARY_IS_IDENTICAL);
        BINARY.put("!==", AstFlags.BINARY_IS_NOT_IDENTICAL);
        BINARY.put("==", AstFlags.BINARY_IS_EQUAL);
        BINARY.put("!=", AstFlags.BINARY_IS_NOT_EQUAL);
        BINARY.put("<>", AstFlags.BINARY_IS_NOT_EQUAL);
        BINARY.put("<", AstFlags.BINARY_IS_SMALLER);
        BINARY.put("<=", AstFlags.BINARY_IS_SMALLER_OR_EQUAL);
        BINARY.put(">", AstFlags.BINARY_IS_GREATER);
        BINARY.put(">=", AstFlags.BINARY_IS_GREATER_OR_EQUAL);
        BINARY.put("<=>", AstFlags.BINARY_SPACESHIP);
        BINARY.put("||", AstFlags.BINARY_BOOL_OR);
        BINARY.put("or", AstFlags.BINARY_BOOL_OR);
        BINARY.put("&&", AstFlags.BINARY_BOOL_AND);
        BINARY.put("and", AstFlags.BINARY_BOOL_AND);
        BINARY.put("??", AstFlags.BINARY_COALESCE);

        UNARY.put("!", AstFlags.UNARY_BOOL_NOT);
        UNARY.put("~", AstFlags.UNARY_BITWISE_NOT);
        UNARY.put("+", AstFlags.UNARY_PLUS);
        UNARY.put("-", AstFlags.UNARY_MINUS);
        UNARY.put("@", AstFlags.UNARY_SILENCE);

        CAST.put("int", AstFlags.TYPE_LONG);
        CAST.put("integer", AstFlags.TYPE_LONG);
        CAST.put("bool", AstFlags.TYPE_BOOL);
        CAST.put("boolean", AstFlags.TYPE_BOOL);
        CAST.put("float", AstFlags.TYPE_DOUBLE);
        CAST.put("double", AstFlags.TYPE_DOUBLE);
        CAST.put("real", AstFlags.TYPE_DOUBLE);
        CAST.put("string", AstFlags.TYPE_STRING);
        CAST.put("binary", AstFlags.TYPE_STRING);
        CAST.put("array", AstFlags.TYPE_ARRAY);
        CAST.put("object", AstFlags.TYPE_OBJECT);
        CAST.put("unset", AstFlags.TYPE_NULL);

        MAGIC_CONSTANTS.put("__line__", AstFlags.MAGIC_LINE);
        MAGIC_CONSTANTS.put("__file__", AstFlags.MAGIC_FILE);
        MAGIC_CONSTANTS.put("__dir__", AstFlags.MAGIC_DIR);
        MAGIC_CONSTANTS.put("__class__", AstFlags.MAGIC_CLASS);
        MAGIC_CONSTANTS.put("__trait__", AstFlags.MAGIC_TRAIT);
        MAGIC_CONSTANTS.put("__method__", AstFlags.MAGIC_METHOD);
        MAGIC_CONSTANTS.put("__function__", AstFlags.MAGIC_FUNCTION);
        MAGIC_CONSTANTS.put("__namespace__", AstFlags.MAGIC_NAMESPACE);

        INCLUDES.put("include_expression", AstFlags.EXEC_INCLUDE);
        INCLUDES.put("include_once_expression", AstFlags.EXEC_INCLUDE_ONCE);
        INCLUDES.put("require_expression", AstFlags.EXEC_REQUIRE);
        INCLUDES.put("require_once_expression", AstFlags.EXEC_REQUIRE_ONCE);
    }

    static Integer binary(String token) {
        return token == null ? null : BINARY.get(token.toLowerCase(Locale.ROOT));
    }

    /** {@code +=} and friends map to the flag of the operator without the {@code =}. */
    static Integer assignOp(String token) {
        if (token == null || !token.endsWith("=")) return null;
        return binary(token.substring(0, token.length() - 1));
    }

    static Integer cast(String castType) {
        if (castType == null) return null;
        return CAST.get(castType.replaceAll("[()\\s]", "").toLowerCase(Locale.ROOT));
    }

    static Integer magicConstant(String name) {
        return name == null ? null : MAGIC_CONSTANTS.get(name.toLowerCase(Locale.ROOT));
    }
}
