package org.nodebook.schema;

/**
 * Thrown when a schema source cannot be read or a schema edit is rejected.
 * <p>
 * Schema problems found while compiling are not exceptions; they are reported as
 * diagnostics. This exception covers the store and loader boundary only.
 */
public class SchemaException extends RuntimeException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
