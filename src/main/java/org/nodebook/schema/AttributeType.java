package org.nodebook.schema;

import java.util.List;

/**
 * An attribute type.
 *
 * @param name          Unique attribute name as written after {@code has}.
 * @param valueType     The type declared values must parse as.
 * @param scope         Node types the attribute applies to; empty means unrestricted.
 * @param description   Free-text description, may be empty.
 * @param unit          Default unit, or null.
 * @param allowedValues If non-empty, the only accepted literal values.
 */
public record AttributeType(String name, ValueType valueType, List<String> scope, String description,
                            String unit, List<String> allowedValues) implements SchemaDefinition {

    public AttributeType {
        scope = scope == null ? List.of() : List.copyOf(scope);
        description = description == null ? "" : description;
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }

    public static AttributeType of(String name, ValueType valueType, String... scope) {
        return new AttributeType(name, valueType, List.of(scope), "", null, List.of());
    }
}
