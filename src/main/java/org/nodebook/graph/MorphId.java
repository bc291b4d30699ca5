package org.nodebook.graph;

/**
 * Identifies a morph of a node. Relations and attributes reference their morph
 * through this type only, never through a loose string.
 *
 * @param value The stable morph identifier, e.g. {@code hydrogen::basic}.
 */
public record MorphId(String value) {

    public MorphId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("morph id must not be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
