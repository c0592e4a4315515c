package org.pragmatica.structmerge.merge;

import org.pragmatica.structmerge.tree.RevNode;

/**
 * Entry of a merged child list: a node identity to be merged further, or a conflict.
 */
sealed interface Slot {

    record Keep(RevNode id) implements Slot {}

    record Clash(ConflictRegion region) implements Slot {}
}
