package org.dxworks.phpast.converter;

import org.treesitter.TSNode;

import static org.dxworks.phpast.parser.TreeSitterNodes.isComment;

/**
 * Finds the doc comment of a declaration: the nearest {@code /**} comment among the
 * comments written directly before it.
 */
final class DocComments {

    private DocComments() {
    }

    static String of(TSNode declaration, ConversionSession session) {
        if (declaration == null || declaration.isNull()) return null;
        TSNode previous = declaration.getPrevSibling();
        while (isComment(previous)) {
            String text = session.text(previous);
            if (text.startsWith("/**")) {
                return text;
            }
            previous = previous.getPrevSibling();
        }
        return null;
    }
}
