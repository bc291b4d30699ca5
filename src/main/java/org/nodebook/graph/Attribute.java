package org.nodebook.graph;

/**
 * A named value attached to a node, owned by one morph of that node.
 *
 * @param id         Stable identifier.
 * @param sourceId   Owning node id.
 * @param name       Attribute type name.
 * @param value      Value text as declared, or as computed for derived attributes.
 * @param unit       Unit, or null.
 * @param modality   Modality such as {@code observed}, or null.
 * @param quantifier Quantifier such as {@code approximately}, or null.
 * @param adverb     Adverb modifier, or null.
 * @param derived    True if computed from a function.
 * @param morphId    Morph the attribute belongs to.
 * @param expression For derived attributes, the expression the value was computed from; otherwise null.
 */
public record Attribute(String id, String sourceId, String name, String value, String unit, String modality,
                        String quantifier, String adverb, boolean derived, MorphId morphId,
                        String expression)
        implements GraphEntity {
}
