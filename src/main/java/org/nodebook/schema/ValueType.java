package org.nodebook.schema;

import java.util.Locale;

/**
 * Value types an {@link AttributeType} may declare.
 */
public enum ValueType {
    STRING,
    INTEGER,
    FLOAT,
    DATE,
    BOOLEAN;

    /**
     * Parses a schema spelling such as {@code "integer"} or {@code "Float"}.
     * {@code "number"} and {@code "double"} are accepted as aliases for {@link #FLOAT},
     * {@code "text"} for {@link #STRING}.
     *
     * @param text The schema spelling.
     * @return The value type.
     * @throws IllegalArgumentException if the spelling is unknown.
     */
    public static ValueType fromSchemaName(String text) {
        String key = text.trim().toUpperCase(Locale.ROOT);
        return switch (key) {
            case "NUMBER", "DOUBLE" -> FLOAT;
            case "TEXT" -> STRING;
            case "INT" -> INTEGER;
            case "BOOL" -> BOOLEAN;
            default -> ValueType.valueOf(key);
        };
    }
}
