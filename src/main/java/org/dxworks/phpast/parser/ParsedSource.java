package org.dxworks.phpast.parser;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * A tree-sitter tree and the source it was parsed from. The tree is held here so the
 * native tree outlives every node handed out from it.
 */
public class ParsedSource {

    private final SourceText text;
    private final TSTree tree;

    public ParsedSource(SourceText text, TSTree tree) {
        this.text = text;
        this.tree = tree;
    }

    public SourceText getText() {
        return text;
    }

    public TSTree getTree() {
        return tree;
    }

    public TSNode getRootNode() {
        return tree.getRootNode();
    }

    public boolean hasErrors() {
        TSNode root = getRootNode();
        return root != null && !root.isNull() && root.hasError();
    }
}
