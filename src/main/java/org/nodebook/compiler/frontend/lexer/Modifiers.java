package org.nodebook.compiler.frontend.lexer;

/**
 * Inline modifier tokens extracted from a line segment. Absent modifiers are null.
 *
 * @param emphasis   Text between {@code **}: the adjective of a node, the adverb of a relation or attribute.
 * @param quantifier Text between {@code ++}.
 * @param unit       Text between single {@code *}.
 * @param modality   Text between {@code [} and {@code ]}.
 */
public record Modifiers(String emphasis, String quantifier, String unit, String modality) {

    public static final Modifiers NONE = new Modifiers(null, null, null, null);
}
