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
import static org.dxworks.phpast.parser.TreeSitterNodes.isNodeTypeOneOf;
import static org.dxworks.phpast.parser.TreeSitterNodes.isPresent;
import static org.dxworks.phpast.parser.TreeSitterNodes.namedChildren;

/**
 * Handlers for functions, methods, closures, classes and class members.
 */
final class DeclarationHandlers {

    static final String CLOSURE_NAME = "{closure}";

    private static final String[] NAME_NODES = {"name", "qualified_name"};

    private DeclarationHandlers() {
    }

    static void register(Map<String, NodeHandler> handlers) {
        handlers.put("function_definition", DeclarationHandlers::function);
        handlers.put("method_declaration", DeclarationHandlers::method);
        handlers.put("anonymous_function", DeclarationHandlers::closure);
        handlers.put("anonymous_function_creation_expression", DeclarationHandlers::closure);
        handlers.put("class_declaration", (node, session) -> classLike(node, 0, session));
        handlers.put("interface_declaration", (node, session) -> classLike(node, AstFlags.CLASS_INTERFACE, session));
        handlers.put("trait_declaration", (node, session) -> classLike(node, AstFlags.CLASS_TRAIT, session));
        handlers.put("anonymous_class", DeclarationHandlers::anonymousClass);
        handlers.put("property_declaration", DeclarationHandlers::property);
        handlers.put("const_declaration", DeclarationHandlers::constants);
        handlers.put("use_declaration", DeclarationHandlers::traitUse);
        handlers.put("use_instead_of_clause", DeclarationHandlers::traitPrecedence);
        handlers.put("use_as_clause", DeclarationHandlers::traitAlias);
        handlers.put("formal_parameters", (node, session) -> parameters(node, session.line(node), session));
        handlers.put("simple_parameter", DeclarationHandlers::parameter);
        handlers.put("variadic_parameter", DeclarationHandlers::parameter);
        handlers.put("optional_type", TypeFlagMapper::typeNode);
        handlers.put("named_type", TypeFlagMapper::typeNode);
        handlers.put("primitive_type", TypeFlagMapper::typeNode);
    }

    // --- functions ---

    private static Object function(TSNode node, ConversionSession session) {
        int line = session.line(node);
        AstNode params = parameters(field(node, "parameters"), line, session);
        AstNode stmts = StructureNormalizer.body(field(node, "body"), line, session);
        Object returnType = TypeFlagMapper.typeNode(field(node, "return_type"), session);

        int flags = returnsReference(node) || takesReference(params) ? AstFlags.FUNC_RETURNS_REF : 0;
        if (GeneratorDetector.isGenerator(stmts)) flags |= AstFlags.FUNC_GENERATOR;

        return session.factory().decl(AstKind.FUNC_DECL, flags,
                children("params", params, "uses", null, "stmts", stmts, "returnType", returnType),
                line, LineResolver.endLineOf(node), DocComments.of(node, session),
                session.text(field(node, "name")), session::nextDeclId);
    }

    private static Object method(TSNode node, ConversionSession session) {
        int line = session.line(node);
        AstNode params = parameters(field(node, "parameters"), line, session);
        TSNode bodyNode = field(node, "body");
        AstNode stmts = isPresent(bodyNode) ? StructureNormalizer.body(bodyNode, line, session) : null;
        Object returnType = TypeFlagMapper.typeNode(field(node, "return_type"), session);

        int flags = TypeFlagMapper.visibilityFlags(TypeFlagMapper.modifiers(node, session), true);
        if (returnsReference(node)) flags |= AstFlags.FUNC_RETURNS_REF;
        if (GeneratorDetector.isGenerator(stmts)) flags |= AstFlags.FUNC_GENERATOR;

        return session.factory().decl(AstKind.METHOD, flags,
                children("params", params, "uses", null, "stmts", stmts, "returnType", returnType),
                line, LineResolver.endLineOf(node), DocComments.of(node, session),
                session.text(field(node, "name")), session::nextDeclId);
    }

    private static Object closure(TSNode node, ConversionSession session) {
        int line = session.line(node);
        AstNode params = parameters(field(node, "parameters"), line, session);
        AstNode uses = closureUses(findFirstChild(node, "anonymous_function_use_clause"), line, session);
        AstNode stmts = StructureNormalizer.body(field(node, "body"), line, session);
        Object returnType = TypeFlagMapper.typeNode(field(node, "return_type"), session);

        int flags = 0;
        if (returnsReference(node)) flags |= AstFlags.FUNC_RETURNS_REF;
        if (findFirstChild(node, "static_modifier") != null) flags |= AstFlags.MODIFIER_STATIC;
        if (GeneratorDetector.isGenerator(stmts)) flags |= AstFlags.FUNC_GENERATOR;

        return session.factory().decl(AstKind.CLOSURE, flags,
                children("params", params, "uses", uses, "stmts", stmts, "returnType", returnType),
                line, LineResolver.endLineOf(node), DocComments.of(node, session),
                CLOSURE_NAME, session::nextDeclId);
    }

    /** {@code function &f()}: the reference marker written directly on the declaration. */
    private static boolean returnsReference(TSNode node) {
        if (findFirstChild(node, "reference_modifier") != null) return true;
        for (TSNode child : allChildren(node)) {
            if ("&".equals(child.getType())) return true;
            if (isNodeTypeOneOf(child, "formal_parameters")) return false;
        }
        return false;
    }

    /** A top-level function with a by-reference parameter is flagged like {@code function &f()}. */
    private static boolean takesReference(AstNode params) {
        for (Object param : params.getItems()) {
            if (param instanceof AstNode && ((AstNode) param).hasFlag(AstFlags.PARAM_REF)) return true;
        }
        return false;
    }

    private static AstNode closureUses(TSNode clause, int line, ConversionSession session) {
        if (!isPresent(clause)) return null;
        NodeFactory factory = session.factory();
        List<Object> variables = new ArrayList<>();
        boolean byReference = false;
        for (TSNode child : allChildren(clause)) {
            if ("&".equals(child.getType())) {
                byReference = true;
            } else if (isNodeTypeOneOf(child, "by_ref")) {
                variables.add(closureVariable(firstNamedChild(child), true, session));
            } else if (isNodeTypeOneOf(child, "variable_name")) {
                variables.add(closureVariable(child, byReference, session));
                byReference = false;
            }
        }
        if (variables.isEmpty()) return null;
        return factory.list(AstKind.CLOSURE_USES, 0, variables, LineResolver.firstChildLine(variables, line));
    }

    private static AstNode closureVariable(TSNode variable, boolean byReference, ConversionSession session) {
        return session.factory().node(AstKind.CLOSURE_VAR, byReference ? AstFlags.CLOSURE_USE_REF : 0,
                children("name", ExpressionHandlers.variableName(variable, session)), session.line(variable));
    }

    // --- parameters ---

    /** The parameter list of a declaration; it takes the line of the declaration itself. */
    static AstNode parameters(TSNode formalParameters, int line, ConversionSession session) {
        List<Object> params = new ArrayList<>();
        for (TSNode parameter : namedChildren(formalParameters)) {
            ConversionSession.add(params, session.convert(parameter));
        }
        return session.factory().list(AstKind.PARAM_LIST, 0, params, line);
    }

    private static Object parameter(TSNode node, ConversionSession session) {
        int flags = 0;
        if (findFirstChild(node, "reference_modifier") != null) flags |= AstFlags.PARAM_REF;
        if ("variadic_parameter".equals(node.getType())) flags |= AstFlags.PARAM_VARIADIC;

        TSNode name = field(node, "name");
        if (name == null) name = findFirstChild(node, "variable_name");
        Object type = TypeFlagMapper.typeNode(field(node, "type"), session);
        Object defaultValue = session.expr(field(node, "default_value"));

        return session.factory().node(AstKind.PARAM, flags, children(
                "type", type,
                "name", name == null ? null : ExpressionHandlers.variableName(name, session),
                "default", defaultValue), session.line(node));
    }

    // --- classes ---

    private static Object classLike(TSNode node, int kindFlags, ConversionSession session) {
        int line = session.line(node);
        NodeFactory factory = session.factory();
        int flags = kindFlags | TypeFlagMapper.classFlags(TypeFlagMapper.modifiers(node, session));

        List<AstNode> parents = names(findFirstChild(node, "base_clause"), session);
        Object extendsNode = null;
        AstNode implementsNode;
        if (kindFlags == AstFlags.CLASS_INTERFACE) {
            implementsNode = nameList(parents, session);
        } else {
            extendsNode = parents.isEmpty() ? null : parents.get(0);
            implementsNode = nameList(names(findFirstChild(node, "class_interface_clause"), session), session);
        }
        AstNode stmts = classBody(node, line, session);

        return factory.decl(AstKind.CLASS, flags,
                children("extends", extendsNode, "implements", implementsNode, "stmts", stmts),
                line, LineResolver.endLineOf(node), DocComments.of(node, session),
                session.text(field(node, "name")), session::nextDeclId);
    }

    /**
     * The class of {@code new class(...) {...}}. The node is either the grammar's
     * {@code anonymous_class} or the creation expression holding the class parts directly.
     */
    static AstNode anonymousClass(TSNode node, ConversionSession session) {
        int line = session.line(node);
        List<AstNode> parents = names(findFirstChild(node, "base_clause"), session);
        AstNode implementsNode = nameList(names(findFirstChild(node, "class_interface_clause"), session), session);
        AstNode stmts = classBody(node, line, session);
        int flags = AstFlags.CLASS_ANONYMOUS | TypeFlagMapper.classFlags(TypeFlagMapper.modifiers(node, session));

        return session.factory().decl(AstKind.CLASS, flags,
                children("extends", parents.isEmpty() ? null : parents.get(0), "implements", implementsNode, "stmts", stmts),
                line, LineResolver.endLineOf(node), null, null, session::nextDeclId);
    }

    private static AstNode classBody(TSNode node, int line, ConversionSession session) {
        TSNode body = field(node, "body");
        if (body == null) body = findFirstChild(node, "declaration_list");
        return StructureNormalizer.statementList(namedChildren(body), line, session);
    }

    private static List<AstNode> names(TSNode clause, ConversionSession session) {
        List<AstNode> names = new ArrayList<>();
        for (TSNode name : namedChildren(clause)) {
            if (isNodeTypeOneOf(name, NAME_NODES)) {
                names.add(TypeFlagMapper.nameNode(session.text(name), session.line(name), session.factory()));
            }
        }
        return names;
    }

    private static AstNode nameList(List<AstNode> names, ConversionSession session) {
        if (names.isEmpty()) return null;
        return session.factory().list(AstKind.NAME_LIST, 0, names, names.get(0).getLineno());
    }

    // --- class members ---

    private static Object property(TSNode node, ConversionSession session) {
        NodeFactory factory = session.factory();
        int flags = TypeFlagMapper.visibilityFlags(TypeFlagMapper.modifiers(node, session), false);
        if (flags == 0) flags = AstFlags.MODIFIER_PUBLIC;
        String docComment = DocComments.of(node, session);

        List<Object> elements = new ArrayList<>();
        for (TSNode element : findAllChildren(node, "property_element")) {
            TSNode variable = field(element, "name");
            if (variable == null) variable = findFirstChild(element, "variable_name");
            TSNode defaultValue = field(element, "default_value");
            if (defaultValue == null) {
                TSNode initializer = findFirstChild(element, "property_initializer");
                defaultValue = initializer != null ? firstNamedChild(initializer) : null;
            }
            elements.add(factory.node(AstKind.PROP_ELEM, 0, children(
                    "name", variable == null ? null : ExpressionHandlers.variableName(variable, session),
                    "default", session.expr(defaultValue)),
                    session.line(element), elements.isEmpty() ? docComment : null));
        }
        return factory.list(AstKind.PROP_DECL, flags, elements, LineResolver.firstChildLine(elements, session.line(node)));
    }

    /** {@code const A = 1, B = 2;} at top level, or as class constants inside a class body. */
    private static Object constants(TSNode node, ConversionSession session) {
        NodeFactory factory = session.factory();
        String docComment = DocComments.of(node, session);
        List<Object> elements = new ArrayList<>();
        for (TSNode element : findAllChildren(node, "const_element")) {
            List<TSNode> parts = namedChildren(element);
            String name = parts.isEmpty() ? null : session.text(parts.get(0));
            TSNode value = parts.size() > 1 ? parts.get(parts.size() - 1) : null;
            elements.add(factory.node(AstKind.CONST_ELEM, 0, children("name", name, "value", session.expr(value)),
                    session.line(element), elements.isEmpty() ? docComment : null));
        }
        int line = LineResolver.firstChildLine(elements, session.line(node));
        TSNode parent = node.getParent();
        if (isNodeTypeOneOf(parent, "declaration_list")) {
            int flags = TypeFlagMapper.visibilityFlags(TypeFlagMapper.modifiers(node, session), true);
            return factory.list(AstKind.CLASS_CONST_DECL, flags, elements, line);
        }
        return factory.list(AstKind.CONST_DECL, 0, elements, line);
    }

    // --- traits ---

    private static Object traitUse(TSNode node, ConversionSession session) {
        NodeFactory factory = session.factory();
        int line = session.line(node);
        AstNode traits = factory.list(AstKind.NAME_LIST, 0, names(node, session), line);

        AstNode adaptations = null;
        TSNode useList = findFirstChild(node, "use_list");
        if (useList != null) {
            List<Object> rules = new ArrayList<>();
            for (TSNode rule : namedChildren(useList)) {
                ConversionSession.add(rules, session.convert(rule));
            }
            if (!rules.isEmpty()) {
                adaptations = factory.list(AstKind.TRAIT_ADAPTATIONS, 0, rules, LineResolver.firstChildLine(rules, line));
            }
        }
        return factory.node(AstKind.USE_TRAIT, 0, children("traits", traits, "adaptations", adaptations), line);
    }

    private static Object traitPrecedence(TSNode node, ConversionSession session) {
        int line = session.line(node);
        List<TSNode> named = namedChildren(node);
        if (named.isEmpty()) return session.stub(node);
        List<Object> insteadOf = new ArrayList<>();
        for (TSNode name : named.subList(1, named.size())) {
            insteadOf.add(TypeFlagMapper.nameNode(session.text(name), session.line(name), session.factory()));
        }
        return session.factory().node(AstKind.TRAIT_PRECEDENCE, 0, children(
                "method", methodReference(named.get(0), line, session),
                "insteadof", session.factory().list(AstKind.NAME_LIST, 0, insteadOf, line)), line);
    }

    private static Object traitAlias(TSNode node, ConversionSession session) {
        int line = session.line(node);
        List<TSNode> named = namedChildren(node);
        if (named.isEmpty()) return session.stub(node);
        int flags = TypeFlagMapper.visibilityFlags(TypeFlagMapper.modifiers(node, session), false);
        String alias = null;
        for (TSNode child : named.subList(1, named.size())) {
            if ("name".equals(child.getType())) alias = session.text(child);
        }
        return session.factory().node(AstKind.TRAIT_ALIAS, flags, children(
                "method", methodReference(named.get(0), line, session),
                "alias", alias), line);
    }

    /** {@code Trait::method} or a bare {@code method} inside a trait adaptation. */
    private static AstNode methodReference(TSNode reference, int line, ConversionSession session) {
        Object classNode = null;
        String method;
        if (isNodeTypeOneOf(reference, "class_constant_access_expression")) {
            List<TSNode> parts = namedChildren(reference);
            TSNode scope = findFirstChildOfTypes(reference, NAME_NODES);
            classNode = scope == null ? null : TypeFlagMapper.nameNode(session.text(scope), line, session.factory());
            method = session.text(parts.get(parts.size() - 1));
        } else {
            method = session.text(reference);
        }
        return session.factory().node(AstKind.METHOD_REFERENCE, 0, children("class", classNode, "method", method), line);
    }
}
