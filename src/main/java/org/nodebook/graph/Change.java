package org.nodebook.graph;

import java.util.Objects;

/**
 * One entry of a change list.
 *
 * @param type   Create, update or delete.
 * @param kind   Kind of the affected entity.
 * @param before The stored entity before the change; null for creates.
 * @param after  The entity after the change; null for deletes.
 */
public record Change(ChangeType type, EntityKind kind, GraphEntity before, GraphEntity after) {

    public Change {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(kind, "kind");
        if (type != ChangeType.CREATE && before == null) {
            throw new IllegalArgumentException(type + " requires the previous entity");
        }
        if (type != ChangeType.DELETE && after == null) {
            throw new IllegalArgumentException(type + " requires the new entity");
        }
    }

    public static Change create(GraphEntity entity) {
        return new Change(ChangeType.CREATE, EntityKind.of(entity), null, entity);
    }

    public static Change update(GraphEntity before, GraphEntity after) {
        return new Change(ChangeType.UPDATE, EntityKind.of(after), before, after);
    }

    public static Change delete(GraphEntity entity) {
        return new Change(ChangeType.DELETE, EntityKind.of(entity), entity, null);
    }

    /**
     * @return The id of the affected entity.
     */
    public String entityId() {
        return after != null ? after.id() : before.id();
    }

    @Override
    public String toString() {
        return type + " " + kind + " " + entityId();
    }
}
