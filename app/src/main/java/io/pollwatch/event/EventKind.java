package io.pollwatch.event;

/** What happened to a path between two passes. */
public enum EventKind {
    CREATE,
    MODIFY,
    DELETE,
    PERM,
    ERROR,
    NOCHANGE
}
