package org.nodebook.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A node heading with everything declared beneath it up to the next node heading.
 *
 * @param line          Line of the heading.
 * @param baseName      The noun without modifiers.
 * @param declaredTypes Declared node type names, primary type first.
 * @param adjective     Adjective from {@code **x**}, or null.
 * @param quantifier    Quantifier from {@code ++x++}, or null.
 * @param description   Description text, empty if none was given.
 * @param morphs        The default morph first, followed by named morphs in declaration order.
 */
public record NodeDecl(int line, String baseName, List<String> declaredTypes, String adjective,
                       String quantifier, String description, List<MorphDecl> morphs) implements AstNode {

    public NodeDecl {
        declaredTypes = List.copyOf(declaredTypes);
        morphs = List.copyOf(morphs);
        description = description == null ? "" : description;
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(morphs);
    }
}
