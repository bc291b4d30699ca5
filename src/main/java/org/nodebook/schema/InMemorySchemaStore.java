package org.nodebook.schema;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schema store backed by a copy-on-write snapshot reference.
 * <p>
 * Every edit publishes a complete new {@link SchemaSnapshot}. Compilations that
 * pinned the previous snapshot keep resolving against it until they finish.
 * <p>
 * <strong>Thread Safety:</strong> all operations are atomic.
 */
public class InMemorySchemaStore implements SchemaStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySchemaStore.class);

    private final AtomicReference<SchemaSnapshot> current;

    public InMemorySchemaStore() {
        this(SchemaSnapshot.empty());
    }

    public InMemorySchemaStore(SchemaSnapshot initial) {
        this.current = new AtomicReference<>(initial);
    }

    @Override
    public SchemaSnapshot snapshot() {
        return current.get();
    }

    /**
     * Adds a new definition.
     *
     * @throws SchemaException if a definition of the same kind and name already exists.
     */
    public void add(SchemaDefinition definition) {
        publish(s -> {
            if (s.contains(definition.getClass(), definition.name())) {
                throw new SchemaException(kindLabel(definition.getClass())
                        + " '" + definition.name() + "' already exists.");
            }
            return s.with(definition);
        });
        log.debug("Added {} '{}'", kindLabel(definition.getClass()), definition.name());
    }

    /**
     * Replaces the definition with the given name. Renames are allowed; the old
     * name is removed.
     *
     * @throws SchemaException if no definition of that kind and name exists.
     */
    public void update(String name, SchemaDefinition definition) {
        publish(s -> {
            if (!s.contains(definition.getClass(), name)) {
                throw new SchemaException(kindLabel(definition.getClass()) + " '" + name + "' not found.");
            }
            return s.without(definition.getClass(), name).with(definition);
        });
        log.debug("Updated {} '{}'", kindLabel(definition.getClass()), name);
    }

    /**
     * Removes a definition.
     *
     * @throws SchemaException if no definition of that kind and name exists.
     */
    public void delete(Class<? extends SchemaDefinition> kind, String name) {
        publish(s -> {
            if (!s.contains(kind, name)) {
                throw new SchemaException(kindLabel(kind) + " '" + name + "' not found.");
            }
            return s.without(kind, name);
        });
        log.debug("Deleted {} '{}'", kindLabel(kind), name);
    }

    /**
     * Replaces the whole schema, e.g. after reloading it from a file.
     */
    public void replace(SchemaSnapshot snapshot) {
        current.set(snapshot);
    }

    private void publish(UnaryOperator<SchemaSnapshot> edit) {
        current.updateAndGet(edit);
    }

    private static String kindLabel(Class<? extends SchemaDefinition> kind) {
        if (kind == NodeType.class) return "Node type";
        if (kind == RelationType.class) return "Relation type";
        if (kind == AttributeType.class) return "Attribute type";
        return "Function";
    }
}
