package org.dxworks.phpast.converter;

import org.dxworks.phpast.ast.AstKind;
import org.dxworks.phpast.ast.AstNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Set;

/**
 * Decides whether a function body makes its function a generator. Nested functions,
 * closures and classes are classified on their own, so the scan does not enter them.
 */
public final class GeneratorDetector {

    private static final Set<AstKind> BOUNDARIES =
            EnumSet.of(AstKind.CLASS, AstKind.FUNC_DECL, AstKind.METHOD, AstKind.CLOSURE);
    private static final Set<AstKind> YIELDS = EnumSet.of(AstKind.YIELD, AstKind.YIELD_FROM);

    private GeneratorDetector() {
    }

    public static boolean isGenerator(Object body) {
        if (!(body instanceof AstNode)) return false;
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push((AstNode) body);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            if (YIELDS.contains(node.getKind())) return true;
            for (Object child : node.getChildren().values()) {
                if (child instanceof AstNode && !BOUNDARIES.contains(((AstNode) child).getKind())) {
                    stack.push((AstNode) child);
                }
            }
        }
        return false;
    }
}
