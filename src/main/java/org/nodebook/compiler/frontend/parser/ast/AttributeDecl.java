package org.nodebook.compiler.frontend.parser.ast;

/**
 * {@code has name: ++quantifier++ value *unit* [modality];}
 *
 * @param line       Source line.
 * @param name       Attribute type name.
 * @param value      The literal value with all modifiers removed.
 * @param unit       Unit, or null.
 * @param modality   Modality, or null.
 * @param quantifier Quantifier, or null.
 * @param adverb     Adverb, or null.
 */
public record AttributeDecl(int line, String name, String value, String unit, String modality,
                            String quantifier, String adverb) implements AstNode {
}
