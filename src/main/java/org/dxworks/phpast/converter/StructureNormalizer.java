package org.dxworks.phpast.converter;

import org.dxworks.phpast.ast.AstKind;
import org.dxworks.phpast.ast.AstNode;
import org.dxworks.phpast.ast.NodeFactory;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.phpast.ast.NodeFactory.children;
import static org.dxworks.phpast.parser.TreeSitterNodes.allChildren;
import static org.dxworks.phpast.parser.TreeSitterNodes.field;
import static org.dxworks.phpast.parser.TreeSitterNodes.findAllChildren;
import static org.dxworks.phpast.parser.TreeSitterNodes.isNodeTypeOneOf;
import static org.dxworks.phpast.parser.TreeSitterNodes.isPresent;
import static org.dxworks.phpast.parser.TreeSitterNodes.namedChildren;

/**
 * Reshapes control-flow and namespace constructs into the flat forms php-ast uses.
 */
final class StructureNormalizer {

    private static final String NAMESPACE_DEFINITION = "namespace_definition";
    private static final String[] BLOCKS = {"compound_statement", "colon_block"};

    private StructureNormalizer() {
    }

    /**
     * An {@code AST_STMT_LIST} of the given statements. A {@code namespace X;} statement
     * takes the statements after it, up to the next namespace, as its contents. Without an
     * explicit line the list takes the line of its first statement.
     */
    static AstNode statementList(List<TSNode> statements, Integer line, ConversionSession session) {
        List<Object> converted = new ArrayList<>();
        for (int i = 0; i < statements.size(); i++) {
            TSNode statement = statements.get(i);
            if (isUnbracedNamespace(statement)) {
                int next = i + 1;
                while (next < statements.size() && !NAMESPACE_DEFINITION.equals(statements.get(next).getType())) {
                    next++;
                }
                ConversionSession.add(converted, namespace(statement, statements.subList(i + 1, next), session));
                i = next - 1;
            } else {
                ConversionSession.add(converted, session.convert(statement));
            }
        }
        int lineno = line != null ? line : LineResolver.firstPositiveLine(converted, 0);
        return session.factory().list(AstKind.STMT_LIST, 0, converted, lineno);
    }

    /**
     * The statement list of a loop, branch or function body. Braced and colon blocks are
     * unwrapped; a single statement becomes a one-element list; no body gives an empty list.
     */
    static AstNode body(TSNode body, int line, ConversionSession session) {
        if (!isPresent(body)) {
            return session.factory().list(AstKind.STMT_LIST, 0, List.of(), line);
        }
        if (isNodeTypeOneOf(body, BLOCKS)) {
            return statementList(namedChildren(body), line, session);
        }
        return statementList(List.of(body), line, session);
    }

    /** The statements of an alternative-syntax construct that follow its closing parenthesis. */
    static List<TSNode> trailingStatements(TSNode node) {
        List<TSNode> statements = new ArrayList<>();
        boolean afterHeader = false;
        for (TSNode child : allChildren(node)) {
            if (!child.isNamed()) {
                if (")".equals(child.getType()) || ":".equals(child.getType())) afterHeader = true;
                continue;
            }
            if (afterHeader) statements.add(child);
        }
        return statements;
    }

    static AstNode ifStatement(TSNode node, ConversionSession session) {
        NodeFactory factory = session.factory();
        List<Object> elements = new ArrayList<>();

        TSNode condition = field(node, "condition");
        int conditionLine = condition != null ? session.line(condition) : session.line(node);
        AstNode firstBody = body(field(node, "body"), conditionLine, session);
        elements.add(factory.node(AstKind.IF_ELEM, 0,
                children("cond", session.expr(condition), "stmts", firstBody), session.line(node)));

        for (TSNode clause : findAllChildren(node, "else_if_clause", "else_clause")) {
            int clauseLine = session.line(clause);
            Object cond = "else_if_clause".equals(clause.getType()) ? session.expr(field(clause, "condition")) : null;
            AstNode stmts = body(clauseBody(clause), clauseLine, session);
            elements.add(factory.node(AstKind.IF_ELEM, 0, children("cond", cond, "stmts", stmts), clauseLine));
        }
        return factory.list(AstKind.IF, 0, elements, session.line(node));
    }

    private static TSNode clauseBody(TSNode clause) {
        TSNode body = field(clause, "body");
        if (body != null) return body;
        List<TSNode> named = namedChildren(clause);
        if (named.isEmpty()) return null;
        TSNode last = named.get(named.size() - 1);
        return "parenthesized_expression".equals(last.getType()) ? null : last;
    }

    static AstNode switchStatement(TSNode node, ConversionSession session) {
        NodeFactory factory = session.factory();
        int line = session.line(node);
        TSNode block = field(node, "body");
        if (block == null) block = findFirst(node, "switch_block");

        List<Object> cases = new ArrayList<>();
        for (TSNode clause : findAllChildren(block, "case_statement", "default_statement")) {
            int caseLine = session.line(clause);
            List<TSNode> named = namedChildren(clause);
            Object cond = null;
            List<TSNode> statements = named;
            if ("case_statement".equals(clause.getType()) && !named.isEmpty()) {
                TSNode value = field(clause, "value");
                cond = session.expr(value != null ? value : named.get(0));
                statements = named.subList(1, named.size());
            }
            AstNode stmts = statementList(statements, caseLine, session);
            cases.add(factory.node(AstKind.SWITCH_CASE, 0, children("cond", cond, "stmts", stmts), caseLine));
        }
        AstNode caseList = factory.list(AstKind.SWITCH_LIST, 0, cases, LineResolver.firstChildLine(cases, line));
        return factory.node(AstKind.SWITCH, 0,
                children("cond", session.expr(field(node, "condition")), "stmts", caseList), line);
    }

    static AstNode tryStatement(TSNode node, ConversionSession session) {
        NodeFactory factory = session.factory();
        int line = session.line(node);
        AstNode tryBody = body(field(node, "body"), line, session);

        List<Object> catches = new ArrayList<>();
        for (TSNode clause : findAllChildren(node, "catch_clause")) {
            ConversionSession.add(catches, session.convert(clause));
        }
        TSNode finallyClause = findFirst(node, "finally_clause");
        AstNode finallyBody = finallyClause == null ? null
                : body(field(finallyClause, "body"), session.line(finallyClause), session);

        if (catches.isEmpty()) {
            return factory.node(AstKind.TRY, 0, children("try", tryBody, "finally", finallyBody), line);
        }
        AstNode catchList = factory.list(AstKind.CATCH_LIST, 0, catches, LineResolver.firstChildLine(catches, line));
        return factory.node(AstKind.TRY, 0,
                children("try", tryBody, "catches", catchList, "finally", finallyBody), line);
    }

    static AstNode catchClause(TSNode node, ConversionSession session) {
        NodeFactory factory = session.factory();
        int line = session.line(node);
        TSNode typeList = field(node, "type");
        List<TSNode> typeNodes = typeList == null ? List.of()
                : "type_list".equals(typeList.getType()) ? namedChildren(typeList) : List.of(typeList);

        List<Object> types = new ArrayList<>();
        for (TSNode type : typeNodes) {
            types.add(TypeFlagMapper.nameNode(session.text(type), session.line(type), factory));
        }
        AstNode classes = factory.list(AstKind.NAME_LIST, 0, types, line);

        TSNode variable = field(node, "name");
        AstNode var = null;
        if (variable != null) {
            int varLine = types.isEmpty() ? line : ((AstNode) types.get(types.size() - 1)).getLineno();
            var = factory.node(AstKind.VAR, 0, children("name", ExpressionHandlers.variableName(variable, session)), varLine);
        }
        AstNode stmts = body(field(node, "body"), line, session);
        return factory.node(AstKind.CATCH, 0, children("class", classes, "var", var, "stmts", stmts), line);
    }

    /** One clause of a for loop: {@code null} when empty, otherwise an expression list. */
    static AstNode forClause(TSNode clause, ConversionSession session) {
        if (!isPresent(clause)) return null;
        List<Object> expressions = new ArrayList<>();
        for (TSNode expression : ExpressionHandlers.flattenSequence(clause)) {
            ConversionSession.add(expressions, session.expr(expression));
        }
        if (expressions.isEmpty()) return null;
        return session.factory().list(AstKind.EXPR_LIST, 0, expressions,
                LineResolver.firstChildLine(expressions, session.line(clause)));
    }

    static AstNode forStatement(TSNode node, ConversionSession session) {
        int line = session.line(node);
        TSNode update = field(node, "update");
        if (update == null) update = field(node, "increment");
        TSNode bodyNode = field(node, "body");
        AstNode stmts = bodyNode != null ? body(bodyNode, line, session)
                : statementList(trailingStatements(node), line, session);
        return session.factory().node(AstKind.FOR, 0, children(
                "init", forClause(field(node, "initialize"), session),
                "cond", forClause(field(node, "condition"), session),
                "loop", forClause(update, session),
                "stmts", stmts), line);
    }

    /**
     * A namespace with its statements. A namespace whose contents reach past the line the
     * declaration ends on is written as a marker followed by its statements as siblings.
     */
    static Object namespace(TSNode node, List<TSNode> following, ConversionSession session) {
        NodeFactory factory = session.factory();
        int line = session.line(node);
        TSNode nameNode = field(node, "name");
        String name = nameNode != null ? TypeFlagMapper.unqualified(session.text(nameNode)) : null;

        TSNode bodyNode = field(node, "body");
        List<TSNode> contents = bodyNode != null ? namedChildren(bodyNode) : following;
        AstNode stmts = statementList(contents, line, session);

        Integer endOfWrapper = LineResolver.endLineOf(node);
        Integer endOfContents = null;
        for (TSNode statement : contents) {
            endOfContents = LineResolver.endLineOf(statement);
            if (endOfContents != 0 && !endOfContents.equals(endOfWrapper)) break;
        }

        if (name == null || endOfContents == null || endOfContents <= endOfWrapper) {
            return factory.node(AstKind.NAMESPACE, 0, children("name", name, "stmts", stmts), line);
        }
        List<Object> flattened = new ArrayList<>();
        flattened.add(factory.node(AstKind.NAMESPACE, 0, children("name", name, "stmts", null), line));
        flattened.addAll(stmts.getItems());
        return flattened;
    }

    private static boolean isUnbracedNamespace(TSNode statement) {
        return NAMESPACE_DEFINITION.equals(statement.getType()) && field(statement, "body") == null;
    }

    private static TSNode findFirst(TSNode parent, String type) {
        List<TSNode> found = findAllChildren(parent, type);
        return found.isEmpty() ? null : found.get(0);
    }
}
