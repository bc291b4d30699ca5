package org.nodebook.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable view of all schema definitions at one point in time.
 * <p>
 * A compilation pins one snapshot at its start and resolves exclusively against it,
 * so schema edits made meanwhile never leak into a running compilation.
 * Edits produce a new snapshot via {@link #with(SchemaDefinition)} and
 * {@link #without(Class, String)}.
 */
public final class SchemaSnapshot {

    private static final SchemaSnapshot EMPTY = new SchemaSnapshot(Map.of(), Map.of(), Map.of(), Map.of());

    private final Map<String, NodeType> nodeTypes;
    private final Map<String, RelationType> relationTypes;
    private final Map<String, AttributeType> attributeTypes;
    private final Map<String, FunctionType> functionTypes;

    private SchemaSnapshot(Map<String, NodeType> nodeTypes,
                           Map<String, RelationType> relationTypes,
                           Map<String, AttributeType> attributeTypes,
                           Map<String, FunctionType> functionTypes) {
        this.nodeTypes = Collections.unmodifiableMap(new LinkedHashMap<>(nodeTypes));
        this.relationTypes = Collections.unmodifiableMap(new LinkedHashMap<>(relationTypes));
        this.attributeTypes = Collections.unmodifiableMap(new LinkedHashMap<>(attributeTypes));
        this.functionTypes = Collections.unmodifiableMap(new LinkedHashMap<>(functionTypes));
    }

    public static SchemaSnapshot empty() {
        return EMPTY;
    }

    /**
     * Builds a snapshot from a collection of definitions. A later definition
     * replaces an earlier one of the same kind and name.
     */
    public static SchemaSnapshot of(Collection<? extends SchemaDefinition> definitions) {
        SchemaSnapshot snapshot = EMPTY;
        for (SchemaDefinition definition : definitions) {
            snapshot = snapshot.with(definition);
        }
        return snapshot;
    }

    public static SchemaSnapshot of(SchemaDefinition... definitions) {
        return of(List.of(definitions));
    }

    public Optional<NodeType> nodeType(String name) {
        return Optional.ofNullable(nodeTypes.get(name));
    }

    public Optional<RelationType> relationType(String name) {
        return Optional.ofNullable(relationTypes.get(name));
    }

    public Optional<AttributeType> attributeType(String name) {
        return Optional.ofNullable(attributeTypes.get(name));
    }

    public Optional<FunctionType> functionType(String name) {
        return Optional.ofNullable(functionTypes.get(name));
    }

    public Collection<NodeType> nodeTypes() {
        return nodeTypes.values();
    }

    public Collection<RelationType> relationTypes() {
        return relationTypes.values();
    }

    public Collection<AttributeType> attributeTypes() {
        return attributeTypes.values();
    }

    public Collection<FunctionType> functionTypes() {
        return functionTypes.values();
    }

    /**
     * @return All definitions, grouped by kind in declaration order.
     */
    public List<SchemaDefinition> definitions() {
        List<SchemaDefinition> all = new ArrayList<>();
        all.addAll(nodeTypes.values());
        all.addAll(relationTypes.values());
        all.addAll(attributeTypes.values());
        all.addAll(functionTypes.values());
        return all;
    }

    /**
     * Returns a new snapshot containing the given definition, replacing any
     * definition of the same kind and name.
     */
    public SchemaSnapshot with(SchemaDefinition definition) {
        Map<String, NodeType> nodes = new LinkedHashMap<>(nodeTypes);
        Map<String, RelationType> relations = new LinkedHashMap<>(relationTypes);
        Map<String, AttributeType> attributes = new LinkedHashMap<>(attributeTypes);
        Map<String, FunctionType> functions = new LinkedHashMap<>(functionTypes);
        if (definition instanceof NodeType n) {
            nodes.put(n.name(), n);
        } else if (definition instanceof RelationType r) {
            relations.put(r.name(), r);
        } else if (definition instanceof AttributeType a) {
            attributes.put(a.name(), a);
        } else if (definition instanceof FunctionType f) {
            functions.put(f.name(), f);
        }
        return new SchemaSnapshot(nodes, relations, attributes, functions);
    }

    /**
     * Returns a new snapshot without the named definition of the given kind.
     *
     * @param kind The definition class.
     * @param name The definition name.
     * @return The new snapshot, or this snapshot if nothing was removed.
     */
    public SchemaSnapshot without(Class<? extends SchemaDefinition> kind, String name) {
        Map<String, NodeType> nodes = new LinkedHashMap<>(nodeTypes);
        Map<String, RelationType> relations = new LinkedHashMap<>(relationTypes);
        Map<String, AttributeType> attributes = new LinkedHashMap<>(attributeTypes);
        Map<String, FunctionType> functions = new LinkedHashMap<>(functionTypes);
        boolean removed;
        if (kind == NodeType.class) {
            removed = nodes.remove(name) != null;
        } else if (kind == RelationType.class) {
            removed = relations.remove(name) != null;
        } else if (kind == AttributeType.class) {
            removed = attributes.remove(name) != null;
        } else if (kind == FunctionType.class) {
            removed = functions.remove(name) != null;
        } else {
            throw new IllegalArgumentException("Unknown schema kind: " + kind.getName());
        }
        return removed ? new SchemaSnapshot(nodes, relations, attributes, functions) : this;
    }

    /**
     * @param kind The definition class.
     * @param name The definition name.
     * @return true if a definition of that kind and name exists.
     */
    public boolean contains(Class<? extends SchemaDefinition> kind, String name) {
        if (kind == NodeType.class) return nodeTypes.containsKey(name);
        if (kind == RelationType.class) return relationTypes.containsKey(name);
        if (kind == AttributeType.class) return attributeTypes.containsKey(name);
        if (kind == FunctionType.class) return functionTypes.containsKey(name);
        return false;
    }
}
