package org.pragmatica.structmerge.tree;

/**
 * The three inputs of a three-way merge.
 */
public enum Revision {
    ANCESTOR,
    LEFT,
    RIGHT;

    /**
     * The other derived revision. Only defined for {@link #LEFT} and {@link #RIGHT}.
     */
    public Revision opposite() {
        return switch (this) {
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
            case ANCESTOR -> throw new IllegalStateException("Ancestor has no opposite revision");
        };
    }
}
