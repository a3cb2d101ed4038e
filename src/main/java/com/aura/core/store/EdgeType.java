package com.aura.core.store;

/**
 * Kinds of graph edges kept by the object store.
 */
public enum EdgeType {
    /** Delegation edge from a child object to its prototype. */
    PROTOTYPE
}
