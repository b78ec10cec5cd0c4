package org.dxworks.phpast.converter;

import org.dxworks.phpast.ast.AstFlags;
import org.dxworks.phpast.ast.AstKind;
import org.dxworks.phpast.ast.AstNode;
import org.dxworks.phpast.ast.NodeFactory;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.dxworks.phpast.ast.NodeFactory.children;
import static org.dxworks.phpast.parser.TreeSitterNodes.allChildren;
import static org.dxworks.phpast.parser.TreeSitterNodes.field;
import static org.dxworks.phpast.parser.TreeSitterNodes.findFirstChild;
import static org.dxworks.phpast.parser.TreeSitterNodes.firstNamedChild;
import static org.dxworks.phpast.parser.TreeSitterNodes.hasToken;
import static org.dxworks.phpast.parser.TreeSitterNodes.isNodeTypeOneOf;
import static org.dxworks.phpast.parser.TreeSitterNodes.isPresent;
import static org.dxworks.phpast.parser.TreeSitterNodes.namedChildren;

/**
 * Handlers for expressions: operators, calls, member access, arrays and variables.
 */
final class ExpressionHandlers {

    private static final String[] CLASS_NAME_NODES = {"name", "qualified_name", "relative_scope", "named_type"};

    private ExpressionHandlers() {
    }

    static void register(Map<String, NodeHandler> handlers) {
        handlers.put("parenthesized_expression", (node, session) -> session.expr(firstNamedChild(node)));
        handlers.put("assignment_expression", ExpressionHandlers::assignment);
        handlers.put("reference_assignment_expression", ExpressionHandlers::referenceAssignment);
        handlers.put("augmented_assignment_expression", ExpressionHandlers::augmentedAssignment);
        handlers.put("binary_expression", ExpressionHandlers::binary);
        handlers.put("unary_op_expression", ExpressionHandlers::unary);
        handlers.put("error_suppression_expression", (node, session) ->
                unaryNode(AstFlags.UNARY_SILENCE, firstNamedChild(node), node, session));
        handlers.put("update_expression", ExpressionHandlers::update);
        handlers.put("cast_expression", ExpressionHandlers::cast);
        handlers.put("clone_expression", (node, session) -> wrap(AstKind.CLONE, "expr", node, session));
        handlers.put("print_intrinsic", (node, session) -> wrap(AstKind.PRINT, "expr", node, session));
        handlers.put("throw_expression", (node, session) -> wrap(AstKind.THROW, "expr", node, session));
        handlers.put("variadic_unpacking", (node, session) -> wrap(AstKind.UNPACK, "expr", node, session));
        handlers.put("by_ref", (node, session) -> wrap(AstKind.REF, "var", node, session));
        for (String include : Operators.INCLUDES.keySet()) {
            handlers.put(include, ExpressionHandlers::include);
        }
        handlers.put("conditional_expression", ExpressionHandlers::conditional);
        handlers.put("yield_expression", ExpressionHandlers::yield);
        handlers.put("object_creation_expression", ExpressionHandlers::newExpression);
        handlers.put("function_call_expression", ExpressionHandlers::call);
        handlers.put("member_call_expression", ExpressionHandlers::methodCall);
        handlers.put("scoped_call_expression", ExpressionHandlers::staticCall);
        handlers.put("member_access_expression", ExpressionHandlers::property);
        handlers.put("scoped_property_access_expression", ExpressionHandlers::staticProperty);
        handlers.put("class_constant_access_expression", ExpressionHandlers::classConstant);
        handlers.put("subscript_expression", ExpressionHandlers::subscript);
        handlers.put("array_creation_expression", ExpressionHandlers::array);
        handlers.put("array_element_initializer", ExpressionHandlers::arrayElement);
        handlers.put("list_literal", ExpressionHandlers::list);
        handlers.put("arguments", (node, session) -> argumentList(node, session.line(node), session));
        handlers.put("argument", ExpressionHandlers::argument);
        handlers.put("variable_name", ExpressionHandlers::variable);
        handlers.put("dynamic_variable_name", ExpressionHandlers::dynamicVariable);
        handlers.put("name", ExpressionHandlers::constant);
        handlers.put("qualified_name", ExpressionHandlers::constant);
        handlers.put("relative_scope", (node, session) ->
                TypeFlagMapper.nameNode(session.text(node), session.line(node), session.factory()));
        handlers.put("sequence_expression", ExpressionHandlers::sequence);
        handlers.put("ERROR", (node, session) -> null);
    }

    private static AstNode wrap(AstKind kind, String key, TSNode node, ConversionSession session) {
        return session.factory().node(kind, 0, children(key, session.expr(firstNamedChild(node))), session.line(node));
    }

    // --- assignment ---

    private static Object assignment(TSNode node, ConversionSession session) {
        return assign(AstKind.ASSIGN, 0, node, session);
    }

    private static Object referenceAssignment(TSNode node, ConversionSession session) {
        return assign(AstKind.ASSIGN_REF, 0, node, session);
    }

    private static Object augmentedAssignment(TSNode node, ConversionSession session) {
        Integer flags = Operators.assignOp(operatorText(node, session));
        if (flags == null) return session.stub(node);
        return assign(AstKind.ASSIGN_OP, flags, node, session);
    }

    private static Object assign(AstKind kind, int flags, TSNode node, ConversionSession session) {
        List<TSNode> named = namedChildren(node);
        TSNode left = field(node, "left");
        TSNode right = field(node, "right");
        if (left == null && !named.isEmpty()) left = named.get(0);
        if (right == null && named.size() > 1) right = named.get(named.size() - 1);

        Object var = session.expr(left);
        Object expr = session.expr(right);
        if (expr == null) {
            if (!session.usesPlaceholders()) return null;
            expr = IncompletePolicy.INCOMPLETE_EXPR;
        }
        return session.factory().node(kind, flags, children("var", var, "expr", expr), session.line(node));
    }

    // --- operators ---

    private static Object binary(TSNode node, ConversionSession session) {
        List<TSNode> named = namedChildren(node);
        TSNode left = field(node, "left");
        TSNode right = field(node, "right");
        if (left == null && !named.isEmpty()) left = named.get(0);
        if (right == null && named.size() > 1) right = named.get(named.size() - 1);
        String operator = operatorText(node, session);
        int line = session.line(node);

        if ("instanceof".equalsIgnoreCase(operator)) {
            return session.factory().node(AstKind.INSTANCEOF, 0,
                    children("expr", session.expr(left), "class", classReference(right, session)), line);
        }
        Integer flags = Operators.binary(operator);
        if (flags == null) return session.stub(node);
        return session.factory().node(AstKind.BINARY_OP, flags,
                children("left", session.expr(left), "right", session.expr(right)), line);
    }

    private static Object unary(TSNode node, ConversionSession session) {
        Integer flags = Operators.UNARY.get(operatorText(node, session));
        if (flags == null) return session.stub(node);
        TSNode argument = field(node, "argument");
        return unaryNode(flags, argument != null ? argument : firstNamedChild(node), node, session);
    }

    private static AstNode unaryNode(int flags, TSNode argument, TSNode node, ConversionSession session) {
        return session.factory().node(AstKind.UNARY_OP, flags, children("expr", session.expr(argument)), session.line(node));
    }

    private static Object update(TSNode node, ConversionSession session) {
        List<TSNode> tokens = allChildren(node);
        if (tokens.isEmpty()) return session.stub(node);
        TSNode first = tokens.get(0);
        boolean prefix = !first.isNamed();
        String operator = prefix ? first.getType() : tokens.get(tokens.size() - 1).getType();
        boolean increment = "++".equals(operator);
        AstKind kind = prefix
                ? (increment ? AstKind.PRE_INC : AstKind.PRE_DEC)
                : (increment ? AstKind.POST_INC : AstKind.POST_DEC);
        return session.factory().node(kind, 0, children("var", session.expr(firstNamedChild(node))), session.line(node));
    }

    private static Object cast(TSNode node, ConversionSession session) {
        TSNode type = field(node, "type");
        if (type == null) type = findFirstChild(node, "cast_type");
        TSNode value = field(node, "value");
        if (value == null) {
            List<TSNode> named = namedChildren(node);
            value = named.isEmpty() ? null : named.get(named.size() - 1);
        }
        Integer flags = Operators.cast(session.text(type));
        if (flags == null) return session.stub(node);
        return session.factory().node(AstKind.CAST, flags, children("expr", session.expr(value)), session.line(node));
    }

    private static Object include(TSNode node, ConversionSession session) {
        int flags = Operators.INCLUDES.get(node.getType());
        return session.factory().node(AstKind.INCLUDE_OR_EVAL, flags,
                children("expr", session.expr(firstNamedChild(node))), session.line(node));
    }

    private static Object conditional(TSNode node, ConversionSession session) {
        TSNode cond = field(node, "condition");
        TSNode whenTrue = field(node, "body");
        TSNode whenFalse = field(node, "alternative");
        if (cond == null) {
            List<TSNode> named = namedChildren(node);
            cond = named.isEmpty() ? null : named.get(0);
            whenTrue = named.size() > 2 ? named.get(1) : null;
            whenFalse = named.size() > 1 ? named.get(named.size() - 1) : null;
        }
        return session.factory().node(AstKind.CONDITIONAL, 0, children(
                "cond", session.expr(cond),
                "true", session.expr(whenTrue),
                "false", session.expr(whenFalse)), session.line(node));
    }

    private static Object yield(TSNode node, ConversionSession session) {
        int line = session.line(node);
        TSNode operand = firstNamedChild(node);
        if (hasToken(node, session.getSourceText(), "from")) {
            return session.factory().node(AstKind.YIELD_FROM, 0, children("expr", session.expr(operand)), line);
        }
        Object value = null;
        Object key = null;
        if ("array_element_initializer".equals(operand == null ? null : operand.getType())) {
            List<TSNode> parts = namedChildren(operand);
            if (parts.size() > 1) {
                key = session.expr(parts.get(0));
                value = session.expr(parts.get(1));
            } else if (!parts.isEmpty()) {
                value = session.expr(parts.get(0));
            }
        } else {
            value = session.expr(operand);
        }
        return session.factory().node(AstKind.YIELD, 0, children("value", value, "key", key), line);
    }

    // --- object creation and calls ---

    private static Object newExpression(TSNode node, ConversionSession session) {
        int line = session.line(node);
        TSNode anonymous = findFirstChild(node, "anonymous_class");
        if (anonymous == null && hasToken(node, session.getSourceText(), "class")
                && findFirstChild(node, "declaration_list") != null) {
            anonymous = node;
        }
        if (anonymous != null) {
            AstNode args = argumentList(findFirstChild(anonymous, "arguments"), line, session);
            AstNode declaration = DeclarationHandlers.anonymousClass(anonymous, session);
            return session.factory().node(AstKind.NEW, 0, children("class", declaration, "args", args), line);
        }
        TSNode classNode = null;
        for (TSNode child : namedChildren(node)) {
            if (!"arguments".equals(child.getType())) {
                classNode = child;
                break;
            }
        }
        AstNode args = argumentList(findFirstChild(node, "arguments"), line, session);
        return session.factory().node(AstKind.NEW, 0,
                children("class", classReference(classNode, session), "args", args), line);
    }

    private static Object call(TSNode node, ConversionSession session) {
        int line = session.line(node);
        NodeFactory factory = session.factory();
        TSNode callee = field(node, "function");
        if (callee == null) callee = firstNamedChild(node);
        TSNode argumentsNode = field(node, "arguments");
        if (argumentsNode == null) argumentsNode = findFirstChild(node, "arguments");

        if (isNodeTypeOneOf(callee, "name")) {
            String name = session.text(callee).toLowerCase(Locale.ROOT);
            switch (name) {
                case "isset":
                    return isset(argumentValues(argumentsNode), line, session);
                case "empty":
                    return factory.node(AstKind.EMPTY, 0, children("expr", firstArgument(argumentsNode, session)), line);
                case "eval":
                    return factory.node(AstKind.INCLUDE_OR_EVAL, AstFlags.EXEC_EVAL,
                            children("expr", firstArgument(argumentsNode, session)), line);
                case "exit":
                case "die":
                    return factory.node(AstKind.EXIT, 0, children("expr", firstArgument(argumentsNode, session)), line);
                default:
                    break;
            }
        }

        Object expr = isNodeTypeOneOf(callee, "name", "qualified_name")
                ? TypeFlagMapper.nameNode(session.text(callee), session.line(callee), factory)
                : session.expr(callee);
        return factory.node(AstKind.CALL, 0,
                children("expr", expr, "args", argumentList(argumentsNode, line, session)), line);
    }

    /** {@code isset($a, $b)} is {@code isset($a) && isset($b)}. */
    private static Object isset(List<TSNode> variables, int line, ConversionSession session) {
        NodeFactory factory = session.factory();
        AstNode result = null;
        for (TSNode variable : variables) {
            AstNode check = factory.node(AstKind.ISSET, 0, children("var", session.expr(variable)), line);
            result = result == null ? check
                    : factory.node(AstKind.BINARY_OP, AstFlags.BINARY_BOOL_AND, children("left", result, "right", check), line);
        }
        return result != null ? result
                : factory.node(AstKind.ISSET, 0, children("var", null), line);
    }

    private static Object methodCall(TSNode node, ConversionSession session) {
        return session.factory().node(AstKind.METHOD_CALL, 0, children(
                "expr", session.expr(field(node, "object")),
                "method", memberName(field(node, "name"), session),
                "args", argumentList(field(node, "arguments"), session.line(node), session)), session.line(node));
    }

    private static Object staticCall(TSNode node, ConversionSession session) {
        return session.factory().node(AstKind.STATIC_CALL, 0, children(
                "class", classReference(field(node, "scope"), session),
                "method", memberName(field(node, "name"), session),
                "args", argumentList(field(node, "arguments"), session.line(node), session)), session.line(node));
    }

    static AstNode argumentList(TSNode arguments, int fallbackLine, ConversionSession session) {
        List<Object> args = new ArrayList<>();
        for (TSNode argument : namedChildren(arguments)) {
            ConversionSession.add(args, session.expr(argument));
        }
        return session.factory().list(AstKind.ARG_LIST, 0, args, LineResolver.firstChildLine(args, fallbackLine));
    }

    private static Object argument(TSNode node, ConversionSession session) {
        List<TSNode> named = namedChildren(node);
        if (named.isEmpty()) return null;
        return session.expr(named.get(named.size() - 1));
    }

    private static List<TSNode> argumentValues(TSNode arguments) {
        List<TSNode> values = new ArrayList<>();
        for (TSNode argument : namedChildren(arguments)) {
            if ("argument".equals(argument.getType())) {
                List<TSNode> inner = namedChildren(argument);
                if (!inner.isEmpty()) values.add(inner.get(inner.size() - 1));
            } else {
                values.add(argument);
            }
        }
        return values;
    }

    private static Object firstArgument(TSNode arguments, ConversionSession session) {
        List<TSNode> values = argumentValues(arguments);
        return values.isEmpty() ? null : session.expr(values.get(0));
    }

    // --- member access ---

    private static Object property(TSNode node, ConversionSession session) {
        Object prop = memberName(field(node, "name"), session);
        if (prop == null) {
            if (!session.usesPlaceholders()) return null;
            prop = IncompletePolicy.INCOMPLETE_PROPERTY;
        }
        return session.factory().node(AstKind.PROP, 0,
                children("expr", session.expr(field(node, "object")), "prop", prop), session.line(node));
    }

    private static Object staticProperty(TSNode node, ConversionSession session) {
        TSNode name = field(node, "name");
        Object prop;
        if (isNodeTypeOneOf(name, "variable_name")) {
            prop = variableName(name, session);
        } else if (isNodeTypeOneOf(name, "dynamic_variable_name")) {
            prop = session.expr(firstNamedChild(name));
        } else {
            prop = session.expr(name);
        }
        if (prop == null) {
            if (!session.usesPlaceholders()) return null;
            prop = IncompletePolicy.INCOMPLETE_PROPERTY;
        }
        return session.factory().node(AstKind.STATIC_PROP, 0,
                children("class", classReference(field(node, "scope"), session), "prop", prop), session.line(node));
    }

    private static Object classConstant(TSNode node, ConversionSession session) {
        List<TSNode> named = namedChildren(node);
        TSNode scope = named.isEmpty() ? null : named.get(0);
        String constant = null;
        if (named.size() > 1) {
            constant = session.text(named.get(named.size() - 1));
        } else {
            List<TSNode> tokens = allChildren(node);
            TSNode last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
            if (last != null && !last.isNamed() && !"::".equals(last.getType())) {
                constant = session.text(last);
            }
        }
        Object constName = constant;
        if (constName == null) {
            if (!session.usesPlaceholders()) return null;
            constName = IncompletePolicy.INCOMPLETE_CLASS_CONST;
        }
        return session.factory().node(AstKind.CLASS_CONST, 0,
                children("class", classReference(scope, session), "const", constName), session.line(node));
    }

    private static Object subscript(TSNode node, ConversionSession session) {
        List<TSNode> named = namedChildren(node);
        TSNode expr = named.isEmpty() ? null : named.get(0);
        TSNode dim = named.size() > 1 ? named.get(1) : null;
        return session.factory().node(AstKind.DIM, 0,
                children("expr", session.expr(expr), "dim", session.expr(dim)), session.line(node));
    }

    /** A member name written as an identifier is a plain string. */
    private static Object memberName(TSNode name, ConversionSession session) {
        if (!isPresent(name)) return null;
        if ("name".equals(name.getType())) return session.text(name);
        return session.expr(name);
    }

    /** Class positions take names as {@code AST_NAME}, anything else as an expression. */
    static Object classReference(TSNode node, ConversionSession session) {
        if (!isPresent(node)) return null;
        if (isNodeTypeOneOf(node, CLASS_NAME_NODES)) {
            return TypeFlagMapper.nameNode(session.text(node), session.line(node), session.factory());
        }
        return session.expr(node);
    }

    // --- arrays ---

    private static Object array(TSNode node, ConversionSession session) {
        List<TSNode> tokens = allChildren(node);
        boolean longSyntax = !tokens.isEmpty() && "array".equalsIgnoreCase(session.text(tokens.get(0)));
        List<Object> elements = new ArrayList<>();
        for (TSNode element : namedChildren(node)) {
            ConversionSession.add(elements, session.convert(element));
        }
        return session.factory().list(AstKind.ARRAY,
                longSyntax ? AstFlags.ARRAY_SYNTAX_LONG : AstFlags.ARRAY_SYNTAX_SHORT, elements, session.line(node));
    }

    private static Object arrayElement(TSNode node, ConversionSession session) {
        List<TSNode> named = namedChildren(node);
        if (named.size() == 1 && "variadic_unpacking".equals(named.get(0).getType())) {
            return session.convert(named.get(0));
        }
        TSNode key = named.size() > 1 ? named.get(0) : null;
        TSNode value = named.isEmpty() ? null : named.get(named.size() - 1);
        return arrayElementNode(key, value, session.line(node), session);
    }

    private static AstNode arrayElementNode(TSNode key, TSNode value, int line, ConversionSession session) {
        int flags = 0;
        if (isNodeTypeOneOf(value, "by_ref")) {
            flags = AstFlags.ARRAY_ELEM_REF;
            value = firstNamedChild(value);
        }
        return session.factory().node(AstKind.ARRAY_ELEM, flags,
                children("value", session.expr(value), "key", session.expr(key)), line);
    }

    /**
     * {@code list(...)} and {@code [...]} destructuring. Elements are not wrapped in their
     * own nodes, so the commas and arrows are followed to find them; empty slots stay
     * {@code null} and one trailing empty slot is dropped.
     */
    private static Object list(TSNode node, ConversionSession session) {
        List<TSNode> tokens = allChildren(node);
        boolean listSyntax = !tokens.isEmpty() && "list".equalsIgnoreCase(session.text(tokens.get(0)));
        List<Object> elements = new ArrayList<>();
        TSNode key = null;
        TSNode value = null;
        boolean open = false;
        for (TSNode token : tokens) {
            if (token.isNamed()) {
                value = token;
                continue;
            }
            switch (token.getType()) {
                case "(":
                case "[":
                    if (!open) {
                        open = true;
                        break;
                    }
                    // fall through
                case "=>":
                    key = value;
                    value = null;
                    break;
                case ",":
                case ")":
                case "]":
                    elements.add(value == null ? null : arrayElementNode(key, value, session.line(key != null ? key : value), session));
                    key = null;
                    value = null;
                    break;
                default:
                    break;
            }
        }
        if (!elements.isEmpty() && elements.get(elements.size() - 1) == null) {
            elements.remove(elements.size() - 1);
        }
        return session.factory().list(AstKind.ARRAY,
                listSyntax ? AstFlags.ARRAY_SYNTAX_LIST : AstFlags.ARRAY_SYNTAX_SHORT, elements, session.line(node));
    }

    // --- variables and names ---

    private static Object variable(TSNode node, ConversionSession session) {
        Object name = variableName(node, session);
        if (name == null) {
            if (!session.usesPlaceholders()) return null;
            name = IncompletePolicy.INCOMPLETE_VARIABLE;
        }
        return session.factory().node(AstKind.VAR, 0, children("name", name), session.line(node));
    }

    /** The name of a {@code variable_name} node without its {@code $}, or null when the name is missing. */
    static String variableName(TSNode node, ConversionSession session) {
        TSNode name = findFirstChild(node, "name");
        if (name != null) return session.text(name);
        String text = session.text(node);
        if (text.startsWith("$")) text = text.substring(1);
        return text.isEmpty() ? null : text;
    }

    private static Object dynamicVariable(TSNode node, ConversionSession session) {
        TSNode inner = firstNamedChild(node);
        Object name = isNodeTypeOneOf(inner, "variable_name") && variableName(inner, session) == null
                ? null : session.expr(inner);
        if (name == null) {
            if (!session.usesPlaceholders()) return null;
            name = IncompletePolicy.INCOMPLETE_VARIABLE;
        }
        return session.factory().node(AstKind.VAR, 0, children("name", name), session.line(node));
    }

    private static Object constant(TSNode node, ConversionSession session) {
        String text = session.text(node);
        int line = session.line(node);
        Integer magic = Operators.magicConstant(text);
        if (magic != null) {
            return session.factory().node(AstKind.MAGIC_CONST, magic, children(), line);
        }
        return session.factory().node(AstKind.CONST, 0,
                children("name", TypeFlagMapper.nameNode(text, line, session.factory())), line);
    }

    private static Object sequence(TSNode node, ConversionSession session) {
        List<Object> items = new ArrayList<>();
        for (TSNode expression : flattenSequence(node)) {
            ConversionSession.add(items, session.expr(expression));
        }
        return session.factory().list(AstKind.EXPR_LIST, 0, items, LineResolver.firstChildLine(items, session.line(node)));
    }

    /** The expressions of a comma-separated {@code sequence_expression}, in order. */
    static List<TSNode> flattenSequence(TSNode node) {
        List<TSNode> result = new ArrayList<>();
        if (!isPresent(node)) return result;
        if (!"sequence_expression".equals(node.getType())) {
            result.add(node);
            return result;
        }
        for (TSNode child : namedChildren(node)) {
            result.addAll(flattenSequence(child));
        }
        return result;
    }

    private static String operatorText(TSNode node, ConversionSession session) {
        TSNode operator = field(node, "operator");
        if (operator != null) return session.text(operator).trim();
        for (TSNode child : allChildren(node)) {
            if (!child.isNamed()) return session.text(child).trim();
        }
        return null;
    }
}
