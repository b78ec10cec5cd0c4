package org.dxworks.phpast.converter;

import org.dxworks.phpast.ast.AstKind;
import org.dxworks.phpast.ast.AstNode;
import org.dxworks.phpast.ast.NodeFactory;
import org.dxworks.phpast.parser.SourceText;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * State of one conversion: target version, policies, the source text and the declaration
 * id counter. A session is created per call and handed to every handler, so independent
 * conversions never share mutable state.
 */
public class ConversionSession {

    private final SourceText text;
    private final ConversionOptions options;
    private final NodeFactory factory;
    private int nextDeclId;

    public ConversionSession(SourceText text, ConversionOptions options) {
        this.text = text;
        this.options = options;
        this.factory = new NodeFactory(options.getVersion());
        this.nextDeclId = 0;
    }

    public Object convert(TSNode node) {
        return NodeDispatcher.dispatch(node, this);
    }

    /**
     * Converts an optional expression. Absent input gives {@code null}; a sibling sequence
     * in expression position becomes an {@link AstKind#EXPR_LIST}.
     */
    public Object expr(TSNode node) {
        if (node == null || node.isNull()) return null;
        Object result = convert(node);
        if (result instanceof List) {
            List<Object> items = flatten((List<?>) result);
            return factory.list(AstKind.EXPR_LIST, 0, items, LineResolver.firstChildLine(items, line(node)));
        }
        return result;
    }

    /** Converts each node in order, splicing list results and skipping absent ones. */
    public List<Object> convertAll(List<TSNode> nodes) {
        List<Object> result = new ArrayList<>();
        for (TSNode node : nodes) {
            add(result, convert(node));
        }
        return result;
    }

    public static void add(List<Object> target, Object converted) {
        if (converted == null) return;
        if (converted instanceof List) {
            for (Object item : (List<?>) converted) {
                add(target, item);
            }
        } else {
            target.add(converted);
        }
    }

    private static List<Object> flatten(List<?> items) {
        List<Object> result = new ArrayList<>();
        add(result, items);
        return result;
    }

    public int nextDeclId() {
        return nextDeclId++;
    }

    public String text(TSNode node) {
        return text.text(node);
    }

    public SourceText getSourceText() {
        return text;
    }

    public int line(TSNode node) {
        return LineResolver.lineOf(node);
    }

    public NodeFactory factory() {
        return factory;
    }

    public boolean usesPlaceholders() {
        return options.getIncompletePolicy() == IncompletePolicy.PLACEHOLDER;
    }

    public AstNode stub(TSNode node) {
        if (options.isStrict()) {
            throw new UnrecognizedNodeKindException(node.getType(), line(node));
        }
        return factory.stub(node.getType(), line(node));
    }
}
