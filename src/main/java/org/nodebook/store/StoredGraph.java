package org.nodebook.store;

import org.nodebook.graph.Attribute;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.graph.Morph;
import org.nodebook.graph.Node;
import org.nodebook.graph.Relation;

import java.util.List;

/**
 * JSON document layout of one persisted graph.
 */
record StoredGraph(String graphId, String description, List<Node> nodes, List<Morph> morphs,
                   List<Relation> relations, List<Attribute> attributes) {

    static StoredGraph from(GraphSnapshot snapshot) {
        return new StoredGraph(snapshot.graphId(), snapshot.description(), List.copyOf(snapshot.nodes()),
                List.copyOf(snapshot.morphs()), List.copyOf(snapshot.relations()),
                List.copyOf(snapshot.attributes()));
    }

    GraphSnapshot toSnapshot() {
        return new GraphSnapshot(graphId, description, orEmpty(nodes), orEmpty(morphs), orEmpty(relations),
                orEmpty(attributes));
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
