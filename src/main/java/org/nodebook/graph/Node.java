package org.nodebook.graph;

import java.util.List;

/**
 * A node of the knowledge graph.
 *
 * @param id          Stable identifier, reused across submissions.
 * @param baseName    The noun as declared, without modifiers.
 * @param name        Display form: quantifier and adjective followed by the base name.
 * @param role        Primary declared type, {@value #UNTYPED_ROLE} when untyped.
 * @param parentTypes Resolved ancestry: declared types and all their ancestors.
 * @param description Description text, may be empty.
 * @param adjective   Adjective modifier, or null.
 * @param quantifier  Quantifier modifier, or null.
 */
public record Node(String id, String baseName, String name, String role, List<String> parentTypes,
                   String description, String adjective, String quantifier) implements GraphEntity {

    public static final String UNTYPED_ROLE = "individual";

    public Node {
        parentTypes = parentTypes == null ? List.of() : List.copyOf(parentTypes);
        description = description == null ? "" : description;
    }
}
