package org.nodebook.schema;

import java.util.List;

/**
 * A relation type with optional domain and range restrictions.
 *
 * @param name        Unique relation name as written between angle brackets.
 * @param inverseName Name of the inverse relation, or null when unset.
 * @param symmetric   Whether {@code a name b} implies {@code b name a}.
 * @param transitive  Whether the relation is transitive.
 * @param domain      Permitted source node types; empty means unrestricted.
 * @param range       Permitted target node types; empty means unrestricted.
 * @param description Free-text description, may be empty.
 */
public record RelationType(String name, String inverseName, boolean symmetric, boolean transitive,
                           List<String> domain, List<String> range, String description)
        implements SchemaDefinition {

    public RelationType {
        domain = domain == null ? List.of() : List.copyOf(domain);
        range = range == null ? List.of() : List.copyOf(range);
        description = description == null ? "" : description;
    }

    /**
     * Creates an asymmetric, non-transitive relation type without an inverse.
     */
    public static RelationType of(String name, List<String> domain, List<String> range) {
        return new RelationType(name, null, false, false, domain, range, "");
    }

    /**
     * Creates an unrestricted symmetric relation type.
     */
    public static RelationType symmetric(String name) {
        return new RelationType(name, name, true, false, List.of(), List.of(), "");
    }

    /**
     * @return true if a symmetric type names a different inverse, which the schema forbids.
     */
    public boolean hasInconsistentInverse() {
        return symmetric && inverseName != null && !inverseName.isBlank() && !inverseName.equals(name);
    }
}
