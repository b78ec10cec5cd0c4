package org.dxworks.phpast.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * php-ast node kinds with their numeric codes (PHP 7.1 numbering) and the child keys
 * each kind carries. List kinds have no fixed keys: their children are keyed "0".."n".
 */
public enum AstKind {
    // declarations
    FUNC_DECL(66, "params", "uses", "stmts", "returnType"),
    CLOSURE(67, "params", "uses", "stmts", "returnType"),
    METHOD(68, "params", "uses", "stmts", "returnType"),
    CLASS(69, "extends", "implements", "stmts"),

    // lists
    ARG_LIST(128),
    ARRAY(129),
    ENCAPS_LIST(130),
    EXPR_LIST(131),
    STMT_LIST(132),
    IF(133),
    SWITCH_LIST(134),
    CATCH_LIST(135),
    PARAM_LIST(136),
    CLOSURE_USES(137),
    PROP_DECL(138),
    CONST_DECL(139),
    CLASS_CONST_DECL(140),
    NAME_LIST(141),
    TRAIT_ADAPTATIONS(142),
    USE(143),

    // 0 children
    MAGIC_CONST(0),
    TYPE(1),

    // 1 child
    VAR(256, "name"),
    CONST(257, "name"),
    UNPACK(258, "expr"),
    UNARY_PLUS(259, "expr"),
    UNARY_MINUS(260, "expr"),
    CAST(261, "expr"),
    EMPTY(262, "expr"),
    ISSET(263, "var"),
    SILENCE(264, "expr"),
    SHELL_EXEC(265, "expr"),
    CLONE(266, "expr"),
    EXIT(267, "expr"),
    PRINT(268, "expr"),
    INCLUDE_OR_EVAL(269, "expr"),
    UNARY_OP(270, "expr"),
    PRE_INC(271, "var"),
    PRE_DEC(272, "var"),
    POST_INC(273, "var"),
    POST_DEC(274, "var"),
    YIELD_FROM(275, "expr"),
    GLOBAL(276, "var"),
    UNSET(277, "var"),
    RETURN(278, "expr"),
    LABEL(279, "name"),
    REF(280, "var"),
    HALT_COMPILER(281, "offset"),
    ECHO(282, "expr"),
    THROW(283, "expr"),
    GOTO(284, "label"),
    BREAK(285, "depth"),
    CONTINUE(286, "depth"),

    // 2 children
    DIM(512, "expr", "dim"),
    PROP(513, "expr", "prop"),
    STATIC_PROP(514, "class", "prop"),
    CALL(515, "expr", "args"),
    CLASS_CONST(516, "class", "const"),
    ASSIGN(517, "var", "expr"),
    ASSIGN_REF(518, "var", "expr"),
    ASSIGN_OP(519, "var", "expr"),
    BINARY_OP(520, "left", "right"),
    GREATER(521, "left", "right"),
    GREATER_EQUAL(522, "left", "right"),
    AND(523, "left", "right"),
    OR(524, "left", "right"),
    ARRAY_ELEM(525, "value", "key"),
    NEW(526, "class", "args"),
    INSTANCEOF(527, "expr", "class"),
    YIELD(528, "value", "key"),
    COALESCE(529, "left", "right"),
    STATIC(530, "var", "default"),
    WHILE(531, "cond", "stmts"),
    DO_WHILE(532, "stmts", "cond"),
    IF_ELEM(533, "cond", "stmts"),
    SWITCH(534, "cond", "stmts"),
    SWITCH_CASE(535, "cond", "stmts"),
    DECLARE(536, "declares", "stmts"),
    USE_TRAIT(537, "traits", "adaptations"),
    TRAIT_PRECEDENCE(538, "method", "insteadof"),
    METHOD_REFERENCE(539, "class", "method"),
    NAMESPACE(540, "name", "stmts"),
    USE_ELEM(541, "name", "alias"),
    TRAIT_ALIAS(542, "method", "alias"),
    GROUP_USE(543, "prefix", "uses"),

    // 3 children
    METHOD_CALL(768, "expr", "method", "args"),
    STATIC_CALL(769, "class", "method", "args"),
    CONDITIONAL(770, "cond", "true", "false"),
    TRY(771, "try", "catches", "finally"),
    CATCH(772, "class", "var", "stmts"),
    PARAM(773, "type", "name", "default"),
    PROP_ELEM(774, "name", "default"),
    CONST_ELEM(775, "name", "value"),

    // 4 children
    FOR(1024, "init", "cond", "loop", "stmts"),
    FOREACH(1025, "expr", "value", "key", "stmts"),

    // kinds only php-ast defines
    NAME(2048, "name"),
    CLOSURE_VAR(2049, "name"),
    NULLABLE_TYPE(2050, "type"),

    // placeholder for input constructs without a handler
    STUB(-1);

    private static final int LIST_KIND_MIN = 128;
    private static final int LIST_KIND_MAX = 143;

    private final int code;
    private final List<String> childKeys;

    AstKind(int code, String... childKeys) {
        this.code = code;
        this.childKeys = Collections.unmodifiableList(Arrays.asList(childKeys));
    }

    public int getCode() {
        return code;
    }

    /** Fixed child keys in php-ast order; empty for list kinds and leaf kinds. */
    public List<String> getChildKeys() {
        return childKeys;
    }

    /** The php-ast constant name, e.g. {@code AST_STMT_LIST}. */
    public String getAstName() {
        return "AST_" + name();
    }

    public boolean isList() {
        return code >= LIST_KIND_MIN && code <= LIST_KIND_MAX;
    }

    public boolean isDeclaration() {
        return this == FUNC_DECL || this == CLOSURE || this == METHOD || this == CLASS;
    }

    public static AstKind fromCode(int code) {
        for (AstKind kind : values()) {
            if (kind.code == code) return kind;
        }
        throw new IllegalArgumentException("Unknown AST kind code: " + code);
    }
}
