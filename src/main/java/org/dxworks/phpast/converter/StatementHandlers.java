package org.dxworks.phpast.converter;

import org.dxworks.phpast.ast.AstFlags;
import org.dxworks.phpast.ast.AstKind;
import org.dxworks.phpast.ast.AstNode;
import org.dxworks.phpast.ast.NodeFactory;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.dxworks.phpast.ast.NodeFactory.children;
import static org.dxworks.phpast.parser.TreeSitterNodes.allChildren;
import static org.dxworks.phpast.parser.TreeSitterNodes.field;
import static org.dxworks.phpast.parser.TreeSitterNodes.findAllChildren;
import static org.dxworks.phpast.parser.TreeSitterNodes.findFirstChild;
import static org.dxworks.phpast.parser.TreeSitterNodes.findFirstChildOfTypes;
import static org.dxworks.phpast.parser.TreeSitterNodes.firstNamedChild;
import static org.dxworks.phpast.parser.TreeSitterNodes.hasToken;
import static org.dxworks.phpast.parser.TreeSitterNodes.isNodeTypeOneOf;
import static org.dxworks.phpast.parser.TreeSitterNodes.isPresent;
import static org.dxworks.phpast.parser.TreeSitterNodes.namedChildren;

/**
 * Handlers for statements: blocks, control flow, inline HTML and namespace imports.
 */
final class StatementHandlers {

    private static final String[] USE_NAMES = {"name", "qualified_name", "namespace_name"};

    private StatementHandlers() {
    }

    static void register(Map<String, NodeHandler> handlers) {
        handlers.put("program", (node, session) -> StructureNormalizer.statementList(namedChildren(node), 1, session));
        handlers.put("php_tag", (node, session) -> null);
        handlers.put("compound_statement", StatementHandlers::block);
        handlers.put("colon_block", StatementHandlers::block);
        handlers.put("declaration_list", StatementHandlers::block);
        handlers.put("empty_statement", (node, session) -> List.of());
        handlers.put("expression_statement", (node, session) -> session.convert(firstNamedChild(node)));
        handlers.put("text", (node, session) -> inlineHtml(session.text(node), node, session));
        handlers.put("text_interpolation", StatementHandlers::textInterpolation);
        handlers.put("if_statement", StructureNormalizer::ifStatement);
        handlers.put("switch_statement", StructureNormalizer::switchStatement);
        handlers.put("while_statement", StatementHandlers::whileStatement);
        handlers.put("do_statement", StatementHandlers::doStatement);
        handlers.put("for_statement", StructureNormalizer::forStatement);
        handlers.put("foreach_statement", StatementHandlers::foreachStatement);
        handlers.put("break_statement", (node, session) -> single(AstKind.BREAK, "depth", node, session));
        handlers.put("continue_statement", (node, session) -> single(AstKind.CONTINUE, "depth", node, session));
        handlers.put("return_statement", (node, session) -> single(AstKind.RETURN, "expr", node, session));
        handlers.put("exit_statement", (node, session) -> single(AstKind.EXIT, "expr", node, session));
        handlers.put("echo_statement", StatementHandlers::echo);
        handlers.put("unset_statement", (node, session) -> perVariable(AstKind.UNSET, node, session));
        handlers.put("global_declaration", (node, session) -> perVariable(AstKind.GLOBAL, node, session));
        handlers.put("function_static_declaration", StatementHandlers::staticDeclaration);
        handlers.put("try_statement", StructureNormalizer::tryStatement);
        handlers.put("catch_clause", StructureNormalizer::catchClause);
        handlers.put("declare_statement", StatementHandlers::declare);
        handlers.put("goto_statement", (node, session) -> label(AstKind.GOTO, "label", node, session));
        handlers.put("named_label_statement", (node, session) -> label(AstKind.LABEL, "name", node, session));
        handlers.put("namespace_definition", (node, session) -> StructureNormalizer.namespace(node, List.of(), session));
        handlers.put("namespace_use_declaration", StatementHandlers::use);
    }

    /** A block used as a statement of its own. */
    private static Object block(TSNode node, ConversionSession session) {
        return StructureNormalizer.statementList(namedChildren(node), session.line(node), session);
    }

    private static AstNode single(AstKind kind, String key, TSNode node, ConversionSession session) {
        return session.factory().node(kind, 0, children(key, session.expr(firstNamedChild(node))), session.line(node));
    }

    private static AstNode label(AstKind kind, String key, TSNode node, ConversionSession session) {
        TSNode name = findFirstChild(node, "name");
        return session.factory().node(kind, 0, children(key, session.text(name)), session.line(node));
    }

    // --- inline HTML ---

    private static Object inlineHtml(String html, TSNode node, ConversionSession session) {
        if (html == null || html.isEmpty()) return null;
        return session.factory().node(AstKind.ECHO, 0, children("expr", html), session.line(node));
    }

    /** {@code ?>text<?php}: the line break right after the closing tag is not output. */
    private static Object textInterpolation(TSNode node, ConversionSession session) {
        TSNode text = findFirstChild(node, "text");
        if (text == null) return null;
        String html = session.text(text);
        if (html.startsWith("\r\n")) {
            html = html.substring(2);
        } else if (html.startsWith("\n")) {
            html = html.substring(1);
        }
        return inlineHtml(html, text, session);
    }

    // --- loops ---

    private static Object whileStatement(TSNode node, ConversionSession session) {
        int line = session.line(node);
        return session.factory().node(AstKind.WHILE, 0, children(
                "cond", session.expr(field(node, "condition")),
                "stmts", loopBody(node, line, session)), line);
    }

    private static Object doStatement(TSNode node, ConversionSession session) {
        int line = session.line(node);
        return session.factory().node(AstKind.DO_WHILE, 0, children(
                "stmts", StructureNormalizer.body(field(node, "body"), line, session),
                "cond", session.expr(field(node, "condition"))), line);
    }

    private static Object foreachStatement(TSNode node, ConversionSession session) {
        int line = session.line(node);
        int headerEnd = closingParenthesis(node);
        List<TSNode> header = new ArrayList<>();
        for (TSNode child : namedChildren(node)) {
            if (child.getEndByte() <= headerEnd) header.add(child);
        }
        TSNode expr = header.isEmpty() ? null : header.get(0);
        TSNode target = header.size() > 1 ? header.get(1) : null;
        TSNode key = null;
        TSNode value = target;
        if (isNodeTypeOneOf(target, "pair", "foreach_pair")) {
            List<TSNode> parts = namedChildren(target);
            key = parts.isEmpty() ? null : parts.get(0);
            value = parts.size() > 1 ? parts.get(parts.size() - 1) : null;
        }

        Object valueNode;
        if (isNodeTypeOneOf(value, "by_ref")) {
            Object variable = session.expr(firstNamedChild(value));
            int valueLine = variable instanceof AstNode ? ((AstNode) variable).getLineno() : line;
            valueNode = session.factory().node(AstKind.REF, 0, children("var", variable), valueLine);
        } else {
            valueNode = session.expr(value);
        }

        return session.factory().node(AstKind.FOREACH, 0, children(
                "expr", session.expr(expr),
                "value", valueNode,
                "key", session.expr(key),
                "stmts", loopBody(node, line, session)), line);
    }

    /** The body field, or for the alternative syntax the statements after the header. */
    private static AstNode loopBody(TSNode node, int line, ConversionSession session) {
        TSNode body = field(node, "body");
        if (body != null) return StructureNormalizer.body(body, line, session);
        return StructureNormalizer.statementList(StructureNormalizer.trailingStatements(node), line, session);
    }

    private static int closingParenthesis(TSNode node) {
        for (TSNode child : allChildren(node)) {
            if (!child.isNamed() && ")".equals(child.getType())) return child.getStartByte();
        }
        return node.getEndByte();
    }

    // --- statements that expand to one node per operand ---

    private static Object echo(TSNode node, ConversionSession session) {
        int line = session.line(node);
        List<Object> echoes = new ArrayList<>();
        for (TSNode operand : namedChildren(node)) {
            for (TSNode expression : ExpressionHandlers.flattenSequence(operand)) {
                echoes.add(session.factory().node(AstKind.ECHO, 0, children("expr", session.expr(expression)), line));
            }
        }
        return echoes.size() == 1 ? echoes.get(0) : echoes;
    }

    private static Object perVariable(AstKind kind, TSNode node, ConversionSession session) {
        List<Object> statements = new ArrayList<>();
        for (TSNode operand : namedChildren(node)) {
            for (TSNode variable : ExpressionHandlers.flattenSequence(operand)) {
                int line = LineResolver.firstLine(List.of(variable), session.line(node));
                statements.add(session.factory().node(kind, 0, children("var", session.expr(variable)), line));
            }
        }
        return statements.size() == 1 ? statements.get(0) : statements;
    }

    private static Object staticDeclaration(TSNode node, ConversionSession session) {
        NodeFactory factory = session.factory();
        List<Object> statements = new ArrayList<>();
        for (TSNode declaration : findAllChildren(node, "static_variable_declaration")) {
            TSNode variable = field(declaration, "name");
            if (variable == null) variable = findFirstChild(declaration, "variable_name");
            TSNode value = field(declaration, "value");
            int line = session.line(declaration);
            AstNode var = factory.node(AstKind.VAR, 0,
                    children("name", variable == null ? null : ExpressionHandlers.variableName(variable, session)), line);
            statements.add(factory.node(AstKind.STATIC, 0, children("var", var, "default", session.expr(value)), line));
        }
        return statements.size() == 1 ? statements.get(0) : statements;
    }

    // --- declare ---

    private static Object declare(TSNode node, ConversionSession session) {
        NodeFactory factory = session.factory();
        int line = session.line(node);
        String docComment = DocComments.of(node, session);

        List<Object> elements = new ArrayList<>();
        for (TSNode directive : findAllChildren(node, "declare_directive")) {
            String text = session.text(directive);
            int equals = text.indexOf('=');
            String name = (equals >= 0 ? text.substring(0, equals) : text).trim();
            List<TSNode> named = namedChildren(directive);
            Object value = named.isEmpty() ? null : session.expr(named.get(named.size() - 1));
            elements.add(factory.node(AstKind.CONST_ELEM, 0, children("name", name, "value", value),
                    session.line(directive), elements.isEmpty() ? docComment : null));
        }
        AstNode declares = factory.list(AstKind.CONST_DECL, 0, elements, line);

        TSNode body = field(node, "body");
        if (body == null) body = findFirstChildOfTypes(node, "compound_statement", "colon_block");
        AstNode stmts;
        if (isPresent(body)) {
            stmts = StructureNormalizer.body(body, line, session);
        } else {
            List<TSNode> trailing = StructureNormalizer.trailingStatements(node);
            trailing.removeIf(statement -> isNodeTypeOneOf(statement, "declare_directive"));
            stmts = trailing.isEmpty() ? null : StructureNormalizer.statementList(trailing, line, session);
        }
        return factory.node(AstKind.DECLARE, 0, children("declares", declares, "stmts", stmts), line);
    }

    // --- use imports ---

    private static Object use(TSNode node, ConversionSession session) {
        NodeFactory factory = session.factory();
        int line = session.line(node);
        int type = useType(node, session, AstFlags.USE_NORMAL);

        TSNode group = findFirstChild(node, "namespace_use_group");
        if (group != null) {
            TSNode prefix = findFirstChildOfTypes(node, USE_NAMES);
            List<Object> elements = new ArrayList<>();
            for (TSNode clause : namedChildren(group)) {
                elements.add(useElement(clause, useType(clause, session, 0), session));
            }
            AstNode uses = factory.list(AstKind.USE, 0, elements, line);
            String prefixName = prefix == null ? null : TypeFlagMapper.unqualified(session.text(prefix));
            return factory.node(AstKind.GROUP_USE, type, children("prefix", prefixName, "uses", uses), line);
        }

        List<Object> elements = new ArrayList<>();
        for (TSNode clause : findAllChildren(node, "namespace_use_clause")) {
            elements.add(useElement(clause, 0, session));
        }
        return factory.list(AstKind.USE, type, elements, line);
    }

    private static int useType(TSNode node, ConversionSession session, int fallback) {
        if (hasToken(node, session.getSourceText(), "function")) return AstFlags.USE_FUNCTION;
        if (hasToken(node, session.getSourceText(), "const")) return AstFlags.USE_CONST;
        return fallback;
    }

    /** An imported name; an alias equal to the last name segment is not recorded. */
    private static AstNode useElement(TSNode clause, int flags, ConversionSession session) {
        TSNode nameNode = findFirstChildOfTypes(clause, USE_NAMES);
        String name = nameNode == null ? null : TypeFlagMapper.unqualified(session.text(nameNode));

        TSNode aliasNode = field(clause, "alias");
        if (aliasNode == null) {
            TSNode aliasing = findFirstChild(clause, "namespace_aliasing_clause");
            aliasNode = aliasing != null ? findFirstChild(aliasing, "name") : null;
        }
        if (aliasNode == null) {
            List<TSNode> names = findAllChildren(clause, "name");
            TSNode last = names.isEmpty() ? null : names.get(names.size() - 1);
            if (last != null && nameNode != null && last.getStartByte() > nameNode.getStartByte()) aliasNode = last;
        }
        String alias = aliasNode == null ? null : session.text(aliasNode);
        if (alias != null && name != null && alias.equals(lastSegment(name))) alias = null;

        return session.factory().node(AstKind.USE_ELEM, flags, children("name", name, "alias", alias), session.line(clause));
    }

    private static String lastSegment(String name) {
        int separator = name.lastIndexOf('\\');
        return separator < 0 ? name : name.substring(separator + 1);
    }
}
