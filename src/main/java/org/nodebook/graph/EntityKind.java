package org.nodebook.graph;

public enum EntityKind {
    NODE,
    MORPH,
    RELATION,
    ATTRIBUTE;

    static EntityKind of(GraphEntity entity) {
        if (entity instanceof Node) return NODE;
        if (entity instanceof Morph) return MORPH;
        if (entity instanceof Relation) return RELATION;
        return ATTRIBUTE;
    }
}
