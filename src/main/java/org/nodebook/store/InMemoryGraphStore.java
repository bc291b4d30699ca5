package org.nodebook.store;

import org.nodebook.graph.GraphSnapshot;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps graphs in memory. Used for tests and embedding.
 */
public class InMemoryGraphStore extends AbstractGraphStore {

    private final ConcurrentHashMap<String, GraphSnapshot> graphs = new ConcurrentHashMap<>();

    @Override
    protected GraphSnapshot read(String graphId) {
        return graphs.get(graphId);
    }

    @Override
    protected void write(GraphSnapshot snapshot) {
        graphs.put(snapshot.graphId(), snapshot);
    }

    @Override
    public Set<String> graphIds() {
        return Set.copyOf(graphs.keySet());
    }
}
