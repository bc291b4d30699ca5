package org.nodebook.compiler;

/**
 * What to do when a relation names a target node that is neither declared in the
 * submission nor present in the stored graph.
 */
public enum ImplicitTargetPolicy {
    /** Create an untyped node for the target. */
    AUTO_CREATE,
    /** Reject the relation with {@code UNKNOWN_TARGET_NODE}. */
    REJECT
}
