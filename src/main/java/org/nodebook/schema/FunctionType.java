package org.nodebook.schema;

import java.util.List;

/**
 * A derived attribute definition. The expression references attribute names of
 * the node it is evaluated on.
 *
 * @param name        Name of the derived attribute the function produces.
 * @param expression  Arithmetic expression text.
 * @param scope       Node types the function applies to; empty means every node.
 * @param description Free-text description, may be empty.
 */
public record FunctionType(String name, String expression, List<String> scope, String description)
        implements SchemaDefinition {

    public FunctionType {
        scope = scope == null ? List.of() : List.copyOf(scope);
        description = description == null ? "" : description;
    }

    public static FunctionType of(String name, String expression, String... scope) {
        return new FunctionType(name, expression, List.of(scope), "");
    }
}
