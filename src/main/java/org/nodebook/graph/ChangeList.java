package org.nodebook.graph;

import java.util.List;

/**
 * The ordered set of operations that turns a stored graph into a newly compiled one.
 * Deletes come before updates, updates before creates.
 *
 * @param changes          The ordered changes.
 * @param graphDescription The new graph-level description, or null if unchanged.
 */
public record ChangeList(List<Change> changes, String graphDescription) {

    private static final ChangeList EMPTY = new ChangeList(List.of(), null);

    public ChangeList {
        changes = List.copyOf(changes);
    }

    public static ChangeList empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return changes.isEmpty() && graphDescription == null;
    }

    public long count(ChangeType type) {
        return changes.stream().filter(c -> c.type() == type).count();
    }

    public long count(ChangeType type, EntityKind kind) {
        return changes.stream().filter(c -> c.type() == type && c.kind() == kind).count();
    }
}
