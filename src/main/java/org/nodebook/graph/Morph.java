package org.nodebook.graph;

/**
 * A named perspective on a node that groups a subset of its relations and attributes.
 *
 * @param morphId     Stable identifier.
 * @param nodeId      Owning node.
 * @param name        Display name; {@value #DEFAULT_NAME} for the implicit default morph.
 * @param description Description text, may be empty.
 */
public record Morph(MorphId morphId, String nodeId, String name, String description) implements GraphEntity {

    public static final String DEFAULT_NAME = "basic";

    public Morph {
        description = description == null ? "" : description;
    }

    @Override
    public String id() {
        return morphId.value();
    }

    public boolean isDefault() {
        return DEFAULT_NAME.equals(name);
    }
}
