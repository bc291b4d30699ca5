package org.nodebook.graph;

/**
 * Common supertype of everything a graph snapshot stores.
 */
public sealed interface GraphEntity permits Node, Morph, Relation, Attribute {

    /**
     * @return The stable identifier of the entity within its graph.
     */
    String id();
}
