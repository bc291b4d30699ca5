package org.nodebook.graph;

import java.util.Set;

/**
 * Read-only cross-graph index of node appearances. The store owns and maintains
 * it; the compiler only queries it.
 */
@FunctionalInterface
public interface NodeRegistry {

    /**
     * @param nodeId A node id.
     * @return Ids of the graphs that currently contain the node; empty if none.
     */
    Set<String> graphsContaining(String nodeId);

    static NodeRegistry empty() {
        return nodeId -> Set.of();
    }
}
