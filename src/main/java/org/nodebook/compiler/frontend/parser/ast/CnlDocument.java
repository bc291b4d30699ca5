package org.nodebook.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Root of the parse tree.
 *
 * @param nodes            Node declarations in source order. A node may be declared more than once.
 * @param graphDescription Text of the graph-description fence, or null if absent.
 */
public record CnlDocument(List<NodeDecl> nodes, String graphDescription) {

    public CnlDocument {
        nodes = List.copyOf(nodes);
    }
}
