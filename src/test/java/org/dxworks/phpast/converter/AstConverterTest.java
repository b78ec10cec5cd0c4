package org.dxworks.phpast.converter;

import org.dxworks.phpast.ast.AstDecl;
import org.dxworks.phpast.ast.AstFlags;
import org.dxworks.phpast.ast.AstKind;
import org.dxworks.phpast.ast.AstNode;
import org.dxworks.phpast.ast.AstVersion;
import org.dxworks.phpast.ast.StubNode;
import org.dxworks.phpast.ast.UnsupportedAstVersionException;
import org.dxworks.phpast.parser.ParseError;
import org.dxworks.phpast.parser.PhpParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstConverterTest {

    private final AstConverter converter = new AstConverter();

    private AstNode convert(String code) {
        return converter.parseCode(code, ConversionOptions.of(AstVersion.V50, IncompletePolicy.DROP, false), null);
    }

    @ParameterizedTest
    @ValueSource(ints = {40, 50})
    void rootIsAStatementListOnLineOne(int version) {
        AstNode root = converter.parseCode("<?php\n$x = 1;\n", version);

        assertEquals(AstKind.STMT_LIST, root.getKind());
        assertEquals(1, root.getLineno());
        assertEquals(1, root.size());
        AstNode assign = root.getNode(0);
        assertEquals(AstKind.ASSIGN, assign.getKind());
        assertEquals(2, assign.getLineno());
        assertEquals("x", assign.getNode("var").getChild("name"));
        assertEquals(1L, assign.getChild("expr"));
    }

    @Test
    void unsupportedVersionIsRejectedBeforeParsing() {
        assertThrows(UnsupportedAstVersionException.class, () -> converter.parseCode("<?php echo 1;", 45));
    }

    @Test
    void conversionIsDeterministic() {
        String code = "<?php\nfunction f($a) { return $a + 1; }\nclass C { public $p = [1, 2]; }\n";

        assertEquals(convert(code), convert(code));
    }

    @Test
    void declarationIdsFollowCompletionOrder() {
        AstNode root = convert("<?php\nfunction a() {}\nfunction b() {}\nclass C {\n    function m() {}\n}\n");

        assertEquals(0L, root.getNode(0).getChild("__declId"));
        assertEquals(1L, root.getNode(1).getChild("__declId"));
        AstNode classC = root.getNode(2);
        assertEquals(3L, classC.getChild("__declId"));
        assertEquals(2L, classC.getNode("stmts").getNode(0).getChild("__declId"));
    }

    @Test
    void declarationIdsRestartForEveryConversion() {
        String code = "<?php\nfunction a() {}\n";

        assertEquals(0L, convert(code).getNode(0).getChild("__declId"));
        assertEquals(0L, convert(code).getNode(0).getChild("__declId"));
    }

    @Test
    void version40KeepsDeclarationHeaderOutsideChildren() {
        AstNode root = converter.parseCode("<?php\n/** Doc */\nfunction a() {\n}\n", 40);

        AstNode function = root.getNode(0);
        assertTrue(function instanceof AstDecl);
        assertEquals("a", ((AstDecl) function).getName());
        assertEquals("/** Doc */", ((AstDecl) function).getDocComment());
        assertFalse(function.hasChild("__declId"));
        assertEquals(3, function.getLineno());
        assertEquals(4, function.getEndLineno());
    }

    @Test
    void echoWithSeveralOperandsBecomesSeveralEchoes() {
        AstNode root = convert("<?php echo 1, 2;");

        assertEquals(2, root.size());
        assertEquals(AstKind.ECHO, root.getNode(0).getKind());
        assertEquals(1L, root.getNode(0).getChild("expr"));
        assertEquals(1, root.getNode(0).getLineno());
        assertEquals(2L, root.getNode(1).getChild("expr"));
        assertEquals(1, root.getNode(1).getLineno());
    }

    @Test
    void byReferenceParameterFlagsFunctionAndParameter() {
        AstNode function = convert("<?php function f(&$x) {}").getNode(0);

        assertTrue(function.hasFlag(AstFlags.RETURNS_REF));
        assertNull(function.getChild("returnType"));
        AstNode param = function.getNode("params").getNode(0);
        assertEquals(AstKind.PARAM, param.getKind());
        assertTrue(param.hasFlag(AstFlags.PARAM_REF));
        assertEquals("x", param.getChild("name"));
    }

    @Test
    void byValueParametersLeaveFunctionUnflagged() {
        AstNode function = convert("<?php function f($x) {}").getNode(0);

        assertFalse(function.hasFlag(AstFlags.RETURNS_REF));
        assertEquals(0, function.getNode("params").getNode(0).getFlags());
    }

    @Test
    void methodsWithByReferenceParametersKeepTheirOwnFlags() {
        AstNode method = convert("<?php class C { public function m(&$x) {} }").getNode(0).getNode("stmts").getNode(0);

        assertFalse(method.hasFlag(AstFlags.RETURNS_REF));
        assertTrue(method.getNode("params").getNode(0).hasFlag(AstFlags.PARAM_REF));
    }

    @Test
    void referenceReturningFunction() {
        AstNode function = convert("<?php function &f(&$x) {}").getNode(0);

        assertTrue(function.hasFlag(AstFlags.RETURNS_REF));
        assertEquals("f", function.getChild("name"));
        assertTrue(function.getNode("params").getNode(0).hasFlag(AstFlags.PARAM_REF));
    }

    @Test
    void parameterTypesAndDefaults() {
        AstNode function = convert("<?php function f(int $a = 5, ...$rest): void {}").getNode(0);

        AstNode params = function.getNode("params");
        assertEquals(2, params.size());
        AstNode first = params.getNode(0);
        assertEquals(AstKind.TYPE, first.getNode("type").getKind());
        assertEquals(AstFlags.TYPE_LONG, first.getNode("type").getFlags());
        assertEquals(5L, first.getChild("default"));
        assertTrue(params.getNode(1).hasFlag(AstFlags.PARAM_VARIADIC));
        assertEquals(AstFlags.TYPE_VOID, function.getNode("returnType").getFlags());
    }

    @Test
    void tryCatchFinally() {
        AstNode tryNode = convert("<?php\ntry {\n    a();\n} catch (Exception $e) {\n} finally {\n}\n").getNode(0);

        assertEquals(AstKind.TRY, tryNode.getKind());
        assertEquals(AstKind.STMT_LIST, tryNode.getNode("try").getKind());
        AstNode catches = tryNode.getNode("catches");
        assertEquals(AstKind.CATCH_LIST, catches.getKind());
        AstNode catchNode = catches.getNode(0);
        assertEquals(AstKind.CATCH, catchNode.getKind());
        assertEquals("Exception", catchNode.getNode("class").getNode(0).getChild("name"));
        assertEquals("e", catchNode.getNode("var").getChild("name"));
        assertEquals(AstKind.STMT_LIST, tryNode.getNode("finally").getKind());
    }

    @Test
    void emptyTryWithOneCatchAndEmptyFinally() {
        AstNode tryNode = convert("<?php try { } catch (A $e) {} finally {}").getNode(0);

        assertEquals(0, tryNode.getNode("try").size());
        assertEquals(1, tryNode.getNode("catches").size());
        AstNode finallyBody = tryNode.getNode("finally");
        assertNotNull(finallyBody);
        assertEquals(0, finallyBody.size());
    }

    @Test
    void tryWithoutCatchesHasNoCatchesChild() {
        AstNode tryNode = convert("<?php\ntry {\n} finally {\n}\n").getNode(0);

        assertFalse(tryNode.hasChild("catches"));
        assertNotNull(tryNode.getChild("finally"));
    }

    @Test
    void yieldMakesTheEnclosingFunctionAGenerator() {
        AstNode function = convert("<?php function g() { if (true) { yield 1; } }").getNode(0);

        assertTrue(function.hasFlag(AstFlags.FUNC_GENERATOR));
    }

    @Test
    void yieldInsideClosureOnlyMarksTheClosure() {
        AstNode function = convert("<?php function h() { $f = function () { yield 1; }; }").getNode(0);

        assertFalse(function.hasFlag(AstFlags.FUNC_GENERATOR));
        AstNode closure = function.getNode("stmts").getNode(0).getNode("expr");
        assertEquals(AstKind.CLOSURE, closure.getKind());
        assertEquals("{closure}", closure.getChild("name"));
        assertTrue(closure.hasFlag(AstFlags.FUNC_GENERATOR));
    }

    @Test
    void methodsCanBeGenerators() {
        AstNode method = convert("<?php class C { function m() { yield 1; } }").getNode(0).getNode("stmts").getNode(0);

        assertEquals(AstKind.METHOD, method.getKind());
        assertTrue(method.hasFlag(AstFlags.FUNC_GENERATOR));
        assertTrue(method.hasFlag(AstFlags.MODIFIER_PUBLIC));
    }

    @Test
    void closureUses() {
        AstNode closure = convert("<?php $f = function ($a) use ($b, &$c) { };").getNode(0).getNode("expr");

        AstNode uses = closure.getNode("uses");
        assertEquals(AstKind.CLOSURE_USES, uses.getKind());
        assertEquals("b", uses.getNode(0).getChild("name"));
        assertEquals(0, uses.getNode(0).getFlags());
        assertEquals("c", uses.getNode(1).getChild("name"));
        assertTrue(uses.getNode(1).hasFlag(AstFlags.CLOSURE_USE_REF));
    }

    @Test
    void unsupportedConstructBecomesStub() {
        AstNode assign = convert("<?php $f = fn($x) => $x;").getNode(0);

        Object value = assign.getChild("expr");
        assertTrue(value instanceof StubNode);
        assertEquals("arrow_function", ((StubNode) value).getSourceType());
        assertEquals(AstKind.STUB, ((StubNode) value).getKind());
    }

    @Test
    void strictModeRejectsUnsupportedConstructs() {
        ConversionOptions strict = ConversionOptions.of(AstVersion.V50, IncompletePolicy.DROP, true);

        UnrecognizedNodeKindException e = assertThrows(UnrecognizedNodeKindException.class,
                () -> converter.parseCode("<?php $f = fn($x) => $x;", strict, null));
        assertEquals("arrow_function", e.getNodeType());
        assertEquals(1, e.getLine());
    }

    @Test
    void unbracedNamespaceIsFollowedByItsStatements() {
        AstNode root = convert("<?php\nnamespace A;\necho 1;\n");

        assertEquals(2, root.size());
        AstNode namespace = root.getNode(0);
        assertEquals(AstKind.NAMESPACE, namespace.getKind());
        assertEquals("A", namespace.getChild("name"));
        assertNull(namespace.getChild("stmts"));
        assertEquals(AstKind.ECHO, root.getNode(1).getKind());
    }

    @Test
    void bracedNamespaceHoldsItsStatements() {
        AstNode root = convert("<?php\nnamespace A {\n    echo 1;\n}\n");

        assertEquals(1, root.size());
        AstNode stmts = root.getNode(0).getNode("stmts");
        assertEquals(AstKind.STMT_LIST, stmts.getKind());
        assertEquals(AstKind.ECHO, stmts.getNode(0).getKind());
    }

    @Test
    void classWithParentsAndMembers() {
        AstNode classNode = convert("<?php\nabstract class C extends B implements I, J {\n"
                + "    const X = 1;\n"
                + "    var $p = 2;\n"
                + "    public static function m() {}\n"
                + "    abstract protected function n();\n"
                + "}\n").getNode(0);

        assertEquals(AstKind.CLASS, classNode.getKind());
        assertTrue(classNode.hasFlag(AstFlags.CLASS_ABSTRACT));
        assertEquals("C", classNode.getChild("name"));
        assertEquals("B", classNode.getNode("extends").getChild("name"));
        assertEquals(2, classNode.getNode("implements").size());

        AstNode members = classNode.getNode("stmts");
        AstNode constants = members.getNode(0);
        assertEquals(AstKind.CLASS_CONST_DECL, constants.getKind());
        assertTrue(constants.hasFlag(AstFlags.MODIFIER_PUBLIC));
        assertEquals("X", constants.getNode(0).getChild("name"));

        AstNode property = members.getNode(1);
        assertEquals(AstKind.PROP_DECL, property.getKind());
        assertEquals(AstFlags.MODIFIER_PUBLIC, property.getFlags());
        assertEquals("p", property.getNode(0).getChild("name"));
        assertEquals(2L, property.getNode(0).getChild("default"));
        assertTrue(property.getNode(0).hasChild("docComment"));

        AstNode method = members.getNode(2);
        assertEquals(AstFlags.MODIFIER_PUBLIC | AstFlags.MODIFIER_STATIC, method.getFlags());
        AstNode abstractMethod = members.getNode(3);
        assertTrue(abstractMethod.hasFlag(AstFlags.MODIFIER_ABSTRACT));
        assertTrue(abstractMethod.hasFlag(AstFlags.MODIFIER_PROTECTED));
        assertNull(abstractMethod.getChild("stmts"));
    }

    @Test
    void interfaceParentsAreListedAsImplements() {
        AstNode iface = convert("<?php interface I extends A, B {}").getNode(0);

        assertTrue(iface.hasFlag(AstFlags.CLASS_INTERFACE));
        assertNull(iface.getChild("extends"));
        assertEquals(2, iface.getNode("implements").size());
    }

    @Test
    void stringLiterals() {
        AstNode root = convert("<?php\n$a = 'it\\'s';\n$b = \"x\\ty\";\n$c = \"hi $name\";\n");

        assertEquals("it's", root.getNode(0).getChild("expr"));
        assertEquals("x\ty", root.getNode(1).getChild("expr"));
        AstNode encaps = root.getNode(2).getNode("expr");
        assertEquals(AstKind.ENCAPS_LIST, encaps.getKind());
        assertEquals("hi ", encaps.getChild(0));
        assertEquals(AstKind.VAR, encaps.getNode(1).getKind());
        assertEquals("name", encaps.getNode(1).getChild("name"));
    }

    @Test
    void booleanLiteralsAreConstants() {
        AstNode trueConst = convert("<?php\n$a = true;\n").getNode(0).getNode("expr");

        assertEquals(AstKind.CONST, trueConst.getKind());
        assertEquals("true", trueConst.getNode("name").getChild("name"));
        assertEquals(AstFlags.NAME_NOT_FQ, trueConst.getNode("name").getFlags());
    }

    @Test
    void useImports() {
        AstNode root = convert("<?php\nuse Foo\\Bar;\nuse Foo\\Baz as Qux;\nuse function Foo\\f;\n");

        AstNode plain = root.getNode(0);
        assertEquals(AstKind.USE, plain.getKind());
        assertEquals(AstFlags.USE_NORMAL, plain.getFlags());
        assertEquals("Foo\\Bar", plain.getNode(0).getChild("name"));
        assertNull(plain.getNode(0).getChild("alias"));
        assertEquals("Qux", root.getNode(1).getNode(0).getChild("alias"));
        assertEquals(AstFlags.USE_FUNCTION, root.getNode(2).getFlags());
    }

    @Test
    void inlineHtmlIsEchoed() {
        AstNode root = convert("<html>\n<?php echo 1;");

        AstNode html = root.getNode(0);
        assertEquals(AstKind.ECHO, html.getKind());
        assertTrue(((String) html.getChild("expr")).startsWith("<html>"));
    }

    @Test
    void syntaxErrorsRaiseByDefault() {
        PhpParseException e = assertThrows(PhpParseException.class,
                () -> converter.parseCode("<?php function (", 50));
        assertFalse(e.getErrors().isEmpty());
    }

    @Test
    void syntaxErrorsCanBeCollected() {
        List<ParseError> errors = new ArrayList<>();

        AstNode root = converter.parseCode("<?php\n$x = 1;\n$y = ;\n", 50, errors);

        assertNotNull(root);
        assertEquals(AstKind.STMT_LIST, root.getKind());
        assertFalse(errors.isEmpty());
    }

    private AstNode convertIncomplete(String code, IncompletePolicy policy) {
        List<ParseError> errors = new ArrayList<>();
        AstNode root = converter.parseCode(code, ConversionOptions.of(AstVersion.V50, policy, false), errors);
        assertFalse(errors.isEmpty());
        return root;
    }

    @Test
    void missingPropertyNameIsDroppedByDefault() {
        assertEquals(0, convertIncomplete("<?php\n$a->;\n", IncompletePolicy.DROP).size());
    }

    @Test
    void missingPropertyNameGetsAPlaceholder() {
        AstNode prop = convertIncomplete("<?php\n$a->;\n", IncompletePolicy.PLACEHOLDER).getNode(0);

        assertEquals(AstKind.PROP, prop.getKind());
        assertEquals("a", prop.getNode("expr").getChild("name"));
        assertEquals(IncompletePolicy.INCOMPLETE_PROPERTY, prop.getChild("prop"));
    }

    @Test
    void missingClassConstantNameIsDroppedByDefault() {
        assertEquals(0, convertIncomplete("<?php\nFoo::;\n", IncompletePolicy.DROP).size());
    }

    @Test
    void missingClassConstantNameGetsAPlaceholder() {
        AstNode constant = convertIncomplete("<?php\nFoo::;\n", IncompletePolicy.PLACEHOLDER).getNode(0);

        assertEquals(AstKind.CLASS_CONST, constant.getKind());
        assertEquals(IncompletePolicy.INCOMPLETE_CLASS_CONST, constant.getChild("const"));
    }

    @Test
    void missingVariableNameIsDroppedByDefault() {
        assertEquals(0, convertIncomplete("<?php\n$$;\n", IncompletePolicy.DROP).size());
    }

    @Test
    void missingVariableNameGetsAPlaceholder() {
        AstNode variable = convertIncomplete("<?php\n$$;\n", IncompletePolicy.PLACEHOLDER).getNode(0);

        assertEquals(AstKind.VAR, variable.getKind());
        assertEquals(IncompletePolicy.INCOMPLETE_VARIABLE, variable.getChild("name"));
    }

    @Test
    void ifElseifElseBecomesOneIfWithThreeElements() {
        AstNode ifNode = convert("<?php\nif ($a) {\n    f();\n} elseif ($b) {\n    g();\n} else {\n    h();\n}\n").getNode(0);

        assertEquals(AstKind.IF, ifNode.getKind());
        assertEquals(3, ifNode.size());
        AstNode first = ifNode.getNode(0);
        AstNode second = ifNode.getNode(1);
        AstNode last = ifNode.getNode(2);
        assertEquals("a", first.getNode("cond").getChild("name"));
        assertEquals("b", second.getNode("cond").getChild("name"));
        assertNull(last.getChild("cond"));
        assertEquals(2, first.getLineno());
        assertEquals(4, second.getLineno());
        assertEquals(6, last.getLineno());
        for (Object element : ifNode.getItems()) {
            AstNode stmts = ((AstNode) element).getNode("stmts");
            assertEquals(AstKind.STMT_LIST, stmts.getKind());
            assertEquals(1, stmts.size());
            assertEquals(AstKind.CALL, stmts.getNode(0).getKind());
        }
    }

    @Test
    void switchCasesAndDefault() {
        AstNode switchNode = convert("<?php\nswitch ($x) {\n    case 1:\n        f();\n        break;\n    default:\n        g();\n}\n").getNode(0);

        assertEquals(AstKind.SWITCH, switchNode.getKind());
        assertEquals("x", switchNode.getNode("cond").getChild("name"));
        AstNode cases = switchNode.getNode("stmts");
        assertEquals(AstKind.SWITCH_LIST, cases.getKind());
        assertEquals(3, cases.getLineno());
        assertEquals(2, cases.size());

        AstNode first = cases.getNode(0);
        assertEquals(AstKind.SWITCH_CASE, first.getKind());
        assertEquals(1L, first.getChild("cond"));
        assertEquals(2, first.getNode("stmts").size());
        assertEquals(AstKind.BREAK, first.getNode("stmts").getNode(1).getKind());

        AstNode fallback = cases.getNode(1);
        assertNull(fallback.getChild("cond"));
        assertEquals(6, fallback.getLineno());
        assertEquals(1, fallback.getNode("stmts").size());
    }

    @Test
    void emptyForClausesAreNull() {
        AstNode forNode = convert("<?php\nfor (;;) {\n}\n").getNode(0);

        assertEquals(AstKind.FOR, forNode.getKind());
        assertNull(forNode.getChild("init"));
        assertNull(forNode.getChild("cond"));
        assertNull(forNode.getChild("loop"));
        assertEquals(0, forNode.getNode("stmts").size());
    }

    @Test
    void forClausesWithExpressionsAreExpressionLists() {
        AstNode forNode = convert("<?php\nfor ($i = 0; ; $i++) {\n}\n").getNode(0);

        AstNode init = forNode.getNode("init");
        assertEquals(AstKind.EXPR_LIST, init.getKind());
        assertEquals(AstKind.ASSIGN, init.getNode(0).getKind());
        assertNull(forNode.getChild("cond"));
        assertEquals(AstKind.POST_INC, forNode.getNode("loop").getNode(0).getKind());
    }

    @Test
    void globalStaticAndUnsetSplitIntoOneStatementPerVariable() {
        AstNode function = convert("<?php\nfunction f() {\n    global $a, $b;\n    static $c = 1, $d;\n    unset($e, $f);\n}\n").getNode(0);

        AstNode stmts = function.getNode("stmts");
        assertEquals(6, stmts.size());
        assertEquals(AstKind.GLOBAL, stmts.getNode(0).getKind());
        assertEquals("a", stmts.getNode(0).getNode("var").getChild("name"));
        assertEquals("b", stmts.getNode(1).getNode("var").getChild("name"));

        AstNode staticC = stmts.getNode(2);
        assertEquals(AstKind.STATIC, staticC.getKind());
        assertEquals("c", staticC.getNode("var").getChild("name"));
        assertEquals(1L, staticC.getChild("default"));
        assertEquals("d", stmts.getNode(3).getNode("var").getChild("name"));
        assertNull(stmts.getNode(3).getChild("default"));

        assertEquals(AstKind.UNSET, stmts.getNode(4).getKind());
        assertEquals("e", stmts.getNode(4).getNode("var").getChild("name"));
        assertEquals("f", stmts.getNode(5).getNode("var").getChild("name"));
    }

    @Test
    void splitStatementsTakeTheLineOfTheirVariable() {
        AstNode function = convert("<?php\nfunction f() {\n    global $a,\n        $b;\n}\n").getNode(0);

        AstNode stmts = function.getNode("stmts");
        assertEquals(3, stmts.getNode(0).getLineno());
        assertEquals(4, stmts.getNode(1).getLineno());
    }

    @Test
    void heredocContentLosesTheClosingMarkerIndentation() {
        AstNode assign = convert("<?php\n$s = <<<EOT\n  hello $name\n    world\n  EOT;\n").getNode(0);

        AstNode parts = assign.getNode("expr");
        assertEquals(AstKind.ENCAPS_LIST, parts.getKind());
        assertEquals("hello ", parts.getChild("0"));
        assertEquals("name", parts.getNode(1).getChild("name"));
        assertEquals("\n  world", parts.getChild("2"));
    }

    @Test
    void nowdocContentLosesTheClosingMarkerIndentation() {
        AstNode assign = convert("<?php\n$s = <<<'EOT'\n    a\n      b\n    EOT;\n").getNode(0);

        assertEquals("a\n  b", assign.getChild("expr"));
    }
}
