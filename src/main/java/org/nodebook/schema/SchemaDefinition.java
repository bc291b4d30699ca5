package org.nodebook.schema;

/**
 * Closed set of schema definitions consumed by the compiler.
 * <p>
 * Consumers branch over the four variants explicitly; adding a kind means revisiting
 * every resolver site.
 */
public sealed interface SchemaDefinition permits NodeType, RelationType, AttributeType, FunctionType {

    /**
     * @return The unique name of the definition within its kind.
     */
    String name();
}
