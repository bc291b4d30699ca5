package org.nodebook.compiler.frontend.parser.ast;

/**
 * {@code <name> target;}
 *
 * @param line     Source line.
 * @param name     Relation type name.
 * @param target   Target node name as written.
 * @param adverb   Adverb from {@code **x**}, or null.
 * @param modality Modality from {@code [x]}, or null.
 */
public record RelationDecl(int line, String name, String target, String adverb, String modality)
        implements AstNode {
}
