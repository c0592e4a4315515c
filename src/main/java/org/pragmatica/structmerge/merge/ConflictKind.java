package org.pragmatica.structmerge.merge;

/**
 * Why two revisions could not be combined at a conflict anchor.
 */
public enum ConflictKind {
    /** Both sides changed the text of the same leaf differently. */
    UPDATE_UPDATE,
    /** Both sides inserted different content at the same position. */
    INSERT_INSERT,
    /** Both sides changed the same run of children differently. */
    CONTENT,
    /** One side deleted a node the other side changed or moved. */
    DELETE_MODIFY,
    /** Both sides moved the same node to different parents. */
    MOVE_MOVE,
    /** Combining the moves of both sides would place a node inside itself. */
    CYCLIC_MOVE
}
