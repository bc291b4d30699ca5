package org.nodebook.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Common contract of all parse tree elements.
 */
public interface AstNode {

    /**
     * @return The 1-based source line this element was declared on.
     */
    int line();

    /**
     * Returns the direct children of this element. The semantic resolver walks the
     * tree through this method.
     *
     * @return An unmodifiable list of children; empty for leaves.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }
}
