package org.dxworks.phpast.ast;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.dxworks.phpast.ast.NodeFactory.children;
import static org.junit.jupiter.api.Assertions.*;

public class NodeFactoryTest {

    private final NodeFactory v40 = new NodeFactory(AstVersion.V40);
    private final NodeFactory v50 = new NodeFactory(AstVersion.V50);

    @Test
    void childKeysMustMatchTheKindSchema() {
        assertThrows(IllegalStateException.class,
                () -> v50.node(AstKind.ASSIGN, 0, children("var", null), 1));
        assertThrows(IllegalStateException.class,
                () -> v50.node(AstKind.ECHO, 0, children("expr", 1L, "extra", 2L), 1));
    }

    @Test
    void declarationsMustUseDecl() {
        assertThrows(IllegalArgumentException.class, () -> v50.node(AstKind.CLASS, 0,
                children("extends", null, "implements", null, "stmts", null), 1));
    }

    @Test
    void tryMayOmitCatches() {
        AstNode stmts = v50.list(AstKind.STMT_LIST, 0, List.of(), 1);
        AstNode tryNode = v50.node(AstKind.TRY, 0, children("try", stmts, "finally", null), 1);

        assertEquals(Arrays.asList("try", "finally"), List.copyOf(tryNode.getChildren().keySet()));
    }

    @Test
    void listItemsAreKeyedByPosition() {
        AstNode list = v50.list(AstKind.EXPR_LIST, 0, Arrays.asList(1L, null, "x"), 3);

        assertEquals(Arrays.asList("0", "1", "2"), List.copyOf(list.getChildren().keySet()));
        assertNull(list.getChild(1));
        assertEquals("x", list.getChild(2));
        assertEquals(3, list.size());
    }

    @Test
    void constantAndPropertyElementsAlwaysCarryDocComment() {
        AstNode constElem = v50.node(AstKind.CONST_ELEM, 0, children("name", "A", "value", 1L), 2);
        AstNode echo = v50.node(AstKind.ECHO, 0, children("expr", 1L), 2);

        assertTrue(constElem.hasChild(NodeFactory.DOC_COMMENT));
        assertNull(constElem.getChild(NodeFactory.DOC_COMMENT));
        assertFalse(echo.hasChild(NodeFactory.DOC_COMMENT));
    }

    @Test
    void docCommentIsAnAttributeAtVersion40() {
        AstNode propElem = v40.node(AstKind.PROP_ELEM, 0, children("name", "p", "default", null), 4, "/** doc */");

        assertFalse(propElem.hasChild(NodeFactory.DOC_COMMENT));
        assertEquals("/** doc */", propElem.getDocCommentAttribute());
    }

    @Test
    void version50DeclarationsStartWithNameDocCommentAndId() {
        AstNode params = v50.list(AstKind.PARAM_LIST, 0, List.of(), 1);
        AstNode decl = v50.decl(AstKind.FUNC_DECL, 0,
                children("params", params, "uses", null, "stmts", null, "returnType", null),
                1, 3, "/** f */", "f", () -> 7);

        assertEquals(Arrays.asList("name", "docComment", "__declId", "params", "uses", "stmts", "returnType"),
                List.copyOf(decl.getChildren().keySet()));
        assertEquals("f", decl.getChild("name"));
        assertEquals(7L, decl.getChild("__declId"));
        assertEquals(3, decl.getEndLineno());
        assertFalse(decl instanceof AstDecl);
    }

    @Test
    void version40DeclarationsKeepHeaderAsAttributes() {
        AstNode params = v40.list(AstKind.PARAM_LIST, 0, List.of(), 1);
        AstNode decl = v40.decl(AstKind.FUNC_DECL, 0,
                children("params", params, "uses", null, "stmts", null, "returnType", null),
                1, 3, null, "f", () -> {
                    throw new AssertionError("no ids at version 40");
                });

        assertTrue(decl instanceof AstDecl);
        assertEquals("f", ((AstDecl) decl).getName());
        assertEquals(Arrays.asList("params", "uses", "stmts", "returnType"), List.copyOf(decl.getChildren().keySet()));
        assertEquals(3, decl.getEndLineno());
    }

    @Test
    void childrenAreReadOnly() {
        AstNode echo = v50.node(AstKind.ECHO, 0, children("expr", 1L), 1);

        assertThrows(UnsupportedOperationException.class, () -> echo.getChildren().put("expr", 2L));
    }
}
