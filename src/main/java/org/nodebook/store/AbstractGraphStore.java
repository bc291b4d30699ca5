package org.nodebook.store;

import org.nodebook.graph.ChangeList;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.graph.Node;
import org.nodebook.graph.NodeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Shared apply logic and node registry bookkeeping of the graph stores.
 * Subclasses only read and write whole snapshots.
 */
public abstract class AbstractGraphStore implements GraphStore {

    private static final Logger log = LoggerFactory.getLogger(AbstractGraphStore.class);
    private static final Pattern GRAPH_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]*$");

    private final Map<String, Set<String>> graphsByNode = new ConcurrentHashMap<>();
    private final NodeRegistry registry = nodeId ->
            Collections.unmodifiableSet(graphsByNode.getOrDefault(nodeId, Set.of()));

    /**
     * Reads a stored snapshot.
     *
     * @return The snapshot, or null if nothing is stored under the id.
     */
    protected abstract GraphSnapshot read(String graphId);

    /**
     * Replaces the stored snapshot atomically.
     */
    protected abstract void write(GraphSnapshot snapshot);

    @Override
    public GraphSnapshot loadGraphSnapshot(String graphId) {
        validateGraphId(graphId);
        GraphSnapshot stored = read(graphId);
        return stored != null ? stored : GraphSnapshot.empty(graphId);
    }

    @Override
    public synchronized GraphSnapshot applyChangeList(String graphId, ChangeList changes) {
        GraphSnapshot before = loadGraphSnapshot(graphId);
        if (changes.isEmpty()) {
            return before;
        }
        GraphSnapshot after = before.apply(changes);
        write(after);
        unindex(before);
        index(after);
        log.debug("Applied {} changes to graph '{}'", changes.changes().size(), graphId);
        return after;
    }

    @Override
    public NodeRegistry nodeRegistry() {
        return registry;
    }

    protected void index(GraphSnapshot snapshot) {
        for (Node node : snapshot.nodes()) {
            graphsByNode.computeIfAbsent(node.id(), k -> ConcurrentHashMap.newKeySet()).add(snapshot.graphId());
        }
    }

    private void unindex(GraphSnapshot snapshot) {
        for (Node node : snapshot.nodes()) {
            graphsByNode.computeIfPresent(node.id(), (k, graphs) -> {
                graphs.remove(snapshot.graphId());
                return graphs.isEmpty() ? null : graphs;
            });
        }
    }

    /**
     * @throws IllegalArgumentException if the id could escape the storage location.
     */
    protected static void validateGraphId(String graphId) {
        if (!isValidGraphId(graphId)) {
            throw new IllegalArgumentException("Invalid graph id: " + graphId);
        }
    }

    protected static boolean isValidGraphId(String graphId) {
        return graphId != null && GRAPH_ID.matcher(graphId).matches() && !graphId.contains("..");
    }
}
