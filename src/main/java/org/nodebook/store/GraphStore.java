package org.nodebook.store;

import org.nodebook.graph.ChangeList;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.graph.NodeRegistry;

import java.util.Set;

/**
 * Persistent home of compiled graphs.
 * <p>
 * Implementations must be thread-safe. Serializing submissions for one graph is the
 * caller's job; the store only guarantees that each apply is atomic.
 */
public interface GraphStore {

    /**
     * @param graphId The graph.
     * @return The stored graph, or an empty graph if none is stored under that id.
     * @throws StoreException if the graph exists but cannot be read.
     */
    GraphSnapshot loadGraphSnapshot(String graphId);

    /**
     * Applies a change list to the stored graph.
     *
     * @param graphId The graph.
     * @param changes The changes, in order.
     * @return The graph after the changes.
     * @throws StoreException        if the result cannot be persisted; the stored graph is then unchanged.
     * @throws IllegalStateException if the changes do not fit the stored graph.
     */
    GraphSnapshot applyChangeList(String graphId, ChangeList changes);

    /**
     * @return Read-only index of which graphs contain which node ids.
     */
    NodeRegistry nodeRegistry();

    /**
     * @return Ids of all stored graphs.
     */
    Set<String> graphIds();
}
