package org.nodebook.schema;

import java.util.List;

/**
 * A node type. Ancestry is the transitive closure over {@code parentTypes};
 * multiple inheritance is allowed, cycles are not.
 *
 * @param name        Unique type name.
 * @param description Free-text description, may be empty.
 * @param parentTypes Names of the direct parent types.
 */
public record NodeType(String name, String description, List<String> parentTypes) implements SchemaDefinition {

    public NodeType {
        description = description == null ? "" : description;
        parentTypes = parentTypes == null ? List.of() : List.copyOf(parentTypes);
    }

    public NodeType(String name, String... parentTypes) {
        this(name, "", List.of(parentTypes));
    }
}
