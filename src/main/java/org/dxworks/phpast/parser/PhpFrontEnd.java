package org.dxworks.phpast.parser;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPhp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Parses PHP source with the tree-sitter PHP grammar.
 */
public class PhpFrontEnd {

    private static final TSLanguage PHP = new TreeSitterPhp();
    private static final String BOM = "\uFEFF";
    private static final int MAX_SNIPPET = 20;

    public ParsedSource parse(String sourceCode) {
        if (sourceCode.startsWith(BOM)) {
            sourceCode = sourceCode.substring(1);
        }
        TSParser parser = new TSParser();
        parser.setLanguage(PHP);
        TSTree tree = parser.parseString(null, sourceCode);
        return new ParsedSource(new SourceText(sourceCode), tree);
    }

    /**
     * Every ERROR node and every token the parser had to insert, in source order.
     */
    public static List<ParseError> collectErrors(ParsedSource parsed) {
        List<ParseError> errors = new ArrayList<>();
        TSNode root = parsed.getRootNode();
        if (root == null || root.isNull() || !root.hasError()) return errors;

        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            int line = node.getStartPoint().getRow() + 1;
            int column = node.getStartPoint().getColumn() + 1;
            if (node.isMissing()) {
                errors.add(new ParseError("Syntax error, missing '" + node.getType() + "'", line, column));
                continue;
            }
            if (node.isError()) {
                errors.add(new ParseError("Syntax error, unexpected '" + snippet(parsed.getText(), node) + "'",
                        line, column));
                continue;
            }
            if (!node.hasError()) continue;
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getChild(i);
                if (child != null && !child.isNull()) stack.push(child);
            }
        }
        return errors;
    }

    private static String snippet(SourceText text, TSNode node) {
        String s = text.text(node).trim();
        int newline = s.indexOf('\n');
        if (newline >= 0) s = s.substring(0, newline);
        return s.length() > MAX_SNIPPET ? s.substring(0, MAX_SNIPPET) : s;
    }
}
