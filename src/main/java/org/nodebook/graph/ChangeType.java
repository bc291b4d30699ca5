package org.nodebook.graph;

public enum ChangeType {
    CREATE,
    UPDATE,
    DELETE
}
