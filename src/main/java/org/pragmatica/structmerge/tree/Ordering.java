package org.pragmatica.structmerge.tree;

/**
 * Whether the order of a node's children carries meaning.
 */
public enum Ordering {
    ORDERED,
    UNORDERED
}
