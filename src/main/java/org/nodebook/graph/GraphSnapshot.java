package org.nodebook.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable picture of one graph: its nodes, morphs, relations and attributes.
 * <p>
 * The diff engine compares a freshly compiled snapshot with the stored one; stores
 * advance their state with {@link #apply(ChangeList)}.
 * <p>
 * <strong>Thread Safety:</strong> immutable, safe for concurrent reads.
 */
public final class GraphSnapshot {

    /**
     * Relations and attributes of one morph.
     */
    public record MorphContents(List<Relation> relations, List<Attribute> attributes) {
    }

    private final String graphId;
    private final String description;
    private final Map<String, Node> nodes;
    private final Map<String, Morph> morphs;
    private final Map<String, Relation> relations;
    private final Map<String, Attribute> attributes;

    public GraphSnapshot(String graphId, String description, Collection<Node> nodes, Collection<Morph> morphs,
                         Collection<Relation> relations, Collection<Attribute> attributes) {
        this.graphId = graphId;
        this.description = description == null ? "" : description;
        this.nodes = index(nodes);
        this.morphs = index(morphs);
        this.relations = index(relations);
        this.attributes = index(attributes);
    }

    public static GraphSnapshot empty(String graphId) {
        return new GraphSnapshot(graphId, "", List.of(), List.of(), List.of(), List.of());
    }

    private static <T extends GraphEntity> Map<String, T> index(Collection<T> entities) {
        Map<String, T> map = new LinkedHashMap<>();
        for (T entity : entities) {
            map.put(entity.id(), entity);
        }
        return Collections.unmodifiableMap(map);
    }

    public String graphId() {
        return graphId;
    }

    public String description() {
        return description;
    }

    public Collection<Node> nodes() {
        return nodes.values();
    }

    public Collection<Morph> morphs() {
        return morphs.values();
    }

    public Collection<Relation> relations() {
        return relations.values();
    }

    public Collection<Attribute> attributes() {
        return attributes.values();
    }

    public Optional<Node> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Optional<Morph> morph(MorphId id) {
        return Optional.ofNullable(morphs.get(id.value()));
    }

    public List<Morph> morphsOf(String nodeId) {
        return morphs.values().stream().filter(m -> m.nodeId().equals(nodeId)).toList();
    }

    public List<Relation> relationsFrom(String nodeId) {
        return relations.values().stream().filter(r -> r.sourceId().equals(nodeId)).toList();
    }

    public List<Attribute> attributesOf(String nodeId) {
        return attributes.values().stream().filter(a -> a.sourceId().equals(nodeId)).toList();
    }

    /**
     * Groups the outgoing relations and attributes of a node by morph. Every morph
     * of the node appears, including empty ones.
     *
     * @param nodeId The node.
     * @return Map from morph id to its contents, in morph declaration order.
     */
    public Map<MorphId, MorphContents> neighborhood(String nodeId) {
        Map<MorphId, List<Relation>> rels = new LinkedHashMap<>();
        Map<MorphId, List<Attribute>> attrs = new LinkedHashMap<>();
        for (Morph morph : morphsOf(nodeId)) {
            rels.put(morph.morphId(), new ArrayList<>());
            attrs.put(morph.morphId(), new ArrayList<>());
        }
        for (Relation r : relationsFrom(nodeId)) {
            rels.computeIfAbsent(r.morphId(), k -> new ArrayList<>()).add(r);
            attrs.computeIfAbsent(r.morphId(), k -> new ArrayList<>());
        }
        for (Attribute a : attributesOf(nodeId)) {
            attrs.computeIfAbsent(a.morphId(), k -> new ArrayList<>()).add(a);
            rels.computeIfAbsent(a.morphId(), k -> new ArrayList<>());
        }
        Map<MorphId, MorphContents> result = new LinkedHashMap<>();
        for (MorphId id : rels.keySet()) {
            result.put(id, new MorphContents(List.copyOf(rels.get(id)), List.copyOf(attrs.get(id))));
        }
        return result;
    }

    /**
     * Applies a change list and returns the resulting snapshot.
     *
     * @param changeList The changes, in order.
     * @return The new snapshot.
     * @throws IllegalStateException if a change does not fit this snapshot
     *                               (creating an existing id, touching a missing one).
     */
    public GraphSnapshot apply(ChangeList changeList) {
        Map<String, Node> n = new LinkedHashMap<>(nodes);
        Map<String, Morph> m = new LinkedHashMap<>(morphs);
        Map<String, Relation> r = new LinkedHashMap<>(relations);
        Map<String, Attribute> a = new LinkedHashMap<>(attributes);

        for (Change change : changeList.changes()) {
            switch (change.kind()) {
                case NODE -> applyTo(n, change, Node.class);
                case MORPH -> applyTo(m, change, Morph.class);
                case RELATION -> applyTo(r, change, Relation.class);
                case ATTRIBUTE -> applyTo(a, change, Attribute.class);
            }
        }
        String newDescription = changeList.graphDescription() != null ? changeList.graphDescription() : description;
        return new GraphSnapshot(graphId, newDescription, n.values(), m.values(), r.values(), a.values());
    }

    private static <T extends GraphEntity> void applyTo(Map<String, T> map, Change change, Class<T> type) {
        String id = change.entityId();
        switch (change.type()) {
            case CREATE -> {
                if (map.containsKey(id)) {
                    throw new IllegalStateException("Cannot create " + change.kind() + " '" + id + "': already exists");
                }
                map.put(id, type.cast(change.after()));
            }
            case UPDATE -> {
                if (!map.containsKey(change.before().id())) {
                    throw new IllegalStateException("Cannot update " + change.kind() + " '" + id + "': not found");
                }
                map.remove(change.before().id());
                map.put(id, type.cast(change.after()));
            }
            case DELETE -> {
                if (map.remove(id) == null) {
                    throw new IllegalStateException("Cannot delete " + change.kind() + " '" + id + "': not found");
                }
            }
        }
    }
}
