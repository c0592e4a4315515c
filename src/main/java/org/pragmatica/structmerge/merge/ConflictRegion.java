package org.pragmatica.structmerge.merge;

import org.pragmatica.structmerge.tree.Revision;

/**
 * A place where the two derived revisions disagree, with the content of each revision there.
 */
public record ConflictRegion(ConflictKind kind,
                             ConflictAnchor anchor,
                             ConflictSide base,
                             ConflictSide left,
                             ConflictSide right) {

    public ConflictSide side(Revision revision) {
        return switch (revision) {
            case ANCESTOR -> base;
            case LEFT -> left;
            case RIGHT -> right;
        };
    }

    public ConflictRegion withSides(ConflictAnchor anchor, ConflictSide base, ConflictSide left, ConflictSide right) {
        return new ConflictRegion(kind, anchor, base, left, right);
    }
}
