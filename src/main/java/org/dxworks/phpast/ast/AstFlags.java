package org.dxworks.phpast.ast;

/**
 * Numeric flag values of php-ast, as exposed by the extension built against PHP 7.1.
 */
public final class AstFlags {

    private AstFlags() {
    }

    // names
    public static final int NAME_FQ = 0;
    public static final int NAME_NOT_FQ = 1;
    public static final int NAME_RELATIVE = 2;

    // modifiers on methods, properties and class constants
    public static final int MODIFIER_STATIC = 1;
    public static final int MODIFIER_ABSTRACT = 2;
    public static final int MODIFIER_FINAL = 4;
    public static final int MODIFIER_PUBLIC = 256;
    public static final int MODIFIER_PROTECTED = 512;
    public static final int MODIFIER_PRIVATE = 1024;

    // functions, methods and closures
    public static final int RETURNS_REF = 0x4000000;
    public static final int FUNC_RETURNS_REF = RETURNS_REF;
    public static final int FUNC_GENERATOR = 0x800000;

    // classes
    public static final int CLASS_FINAL = 4;
    public static final int CLASS_ABSTRACT = 32;
    public static final int CLASS_INTERFACE = 64;
    public static final int CLASS_TRAIT = 128;
    public static final int CLASS_ANONYMOUS = 256;

    // parameters
    public static final int PARAM_REF = 1;
    public static final int PARAM_VARIADIC = 2;

    // AST_TYPE and AST_CAST
    public static final int TYPE_NULL = 1;
    public static final int TYPE_BOOL = 13;
    public static final int TYPE_LONG = 4;
    public static final int TYPE_DOUBLE = 5;
    public static final int TYPE_STRING = 6;
    public static final int TYPE_ARRAY = 7;
    public static final int TYPE_OBJECT = 8;
    public static final int TYPE_CALLABLE = 14;
    public static final int TYPE_VOID = 18;
    public static final int TYPE_ITERABLE = 19;

    // AST_UNARY_OP
    public static final int UNARY_BOOL_NOT = 14;
    public static final int UNARY_BITWISE_NOT = 13;
    public static final int UNARY_SILENCE = 260;
    public static final int UNARY_PLUS = 261;
    public static final int UNARY_MINUS = 262;

    // AST_BINARY_OP and AST_ASSIGN_OP
    public static final int BINARY_ADD = 1;
    public static final int BINARY_SUB = 2;
    public static final int BINARY_MUL = 3;
    public static final int BINARY_DIV = 4;
    public static final int BINARY_MOD = 5;
    public static final int BINARY_SHIFT_LEFT = 6;
    public static final int BINARY_SHIFT_RIGHT = 7;
    public static final int BINARY_CONCAT = 8;
    public static final int BINARY_BITWISE_OR = 9;
    public static final int BINARY_BITWISE_AND = 10;
    public static final int BINARY_BITWISE_XOR = 11;
    public static final int BINARY_BOOL_XOR = 15;
    public static final int BINARY_IS_IDENTICAL = 16;
    public static final int BINARY_IS_NOT_IDENTICAL = 17;
    public static final int BINARY_IS_EQUAL = 18;
    public static final int BINARY_IS_NOT_EQUAL = 19;
    public static final int BINARY_IS_SMALLER = 20;
    public static final int BINARY_IS_SMALLER_OR_EQUAL = 21;
    public static final int BINARY_POW = 166;
    public static final int BINARY_SPACESHIP = 170;
    public static final int BINARY_IS_GREATER = 256;
    public static final int BINARY_IS_GREATER_OR_EQUAL = 257;
    public static final int BINARY_BOOL_OR = 258;
    public static final int BINARY_BOOL_AND = 259;
    public static final int BINARY_COALESCE = 260;

    // AST_MAGIC_CONST
    public static final int MAGIC_LINE = 370;
    public static final int MAGIC_FILE = 371;
    public static final int MAGIC_DIR = 372;
    public static final int MAGIC_CLASS = 373;
    public static final int MAGIC_TRAIT = 374;
    public static final int MAGIC_METHOD = 375;
    public static final int MAGIC_FUNCTION = 376;
    public static final int MAGIC_NAMESPACE = 389;

    // AST_INCLUDE_OR_EVAL
    public static final int EXEC_EVAL = 1;
    public static final int EXEC_INCLUDE = 2;
    public static final int EXEC_INCLUDE_ONCE = 4;
    public static final int EXEC_REQUIRE = 8;
    public static final int EXEC_REQUIRE_ONCE = 16;

    // AST_USE and AST_GROUP_USE
    public static final int USE_NORMAL = 361;
    public static final int USE_FUNCTION = 346;
    public static final int USE_CONST = 347;

    // AST_ARRAY
    public static final int ARRAY_SYNTAX_LIST = 1;
    public static final int ARRAY_SYNTAX_LONG = 2;
    public static final int ARRAY_SYNTAX_SHORT = 3;

    // AST_ARRAY_ELEM and AST_CLOSURE_VAR
    public static final int ARRAY_ELEM_REF = 1;
    public static final int CLOSURE_USE_REF = 1;
}
