package org.nodebook.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A group of relation and attribute declarations belonging to one morph of a node.
 *
 * @param line          Line of the morph heading; the node heading line for the default morph.
 * @param name          The morph name.
 * @param defaultMorph  True for the implicit default morph.
 * @param description   Description text, empty if none was given.
 * @param statements    Relation and attribute declarations in source order.
 * @param invalidLines  Lines inside this morph that failed classification.
 */
public record MorphDecl(int line, String name, boolean defaultMorph, String description,
                        List<AstNode> statements, List<Integer> invalidLines) implements AstNode {

    public MorphDecl {
        statements = List.copyOf(statements);
        invalidLines = List.copyOf(invalidLines);
        description = description == null ? "" : description;
    }

    @Override
    public List<AstNode> getChildren() {
        return statements;
    }
}
