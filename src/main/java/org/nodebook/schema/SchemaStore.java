package org.nodebook.schema;

/**
 * Read access to the schema for the compiler. Ownership of schema edits lies with
 * the schema manager; the compiler only ever asks for an immutable snapshot.
 */
public interface SchemaStore {

    /**
     * @return The current schema as an immutable snapshot.
     */
    SchemaSnapshot snapshot();
}
