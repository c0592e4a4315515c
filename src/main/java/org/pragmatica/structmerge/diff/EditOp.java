package org.pragmatica.structmerge.diff;

import org.pragmatica.structmerge.tree.RevNode;

/**
 * One edit transforming the ancestor tree towards a derived tree. Nodes present in the ancestor
 * are referenced by their ancestor identity, nodes that only exist in the derived tree by their
 * derived identity.
 */
public sealed interface EditOp {

    /**
     * Node the edit is filed under: the edited node, or the parent receiving an insertion.
     */
    RevNode anchor();

    /**
     * The derived subtree {@code subtree} appears as child {@code position} of {@code parent}.
     */
    record Insert(RevNode parent, int position, RevNode subtree) implements EditOp {
        @Override
        public RevNode anchor() {
            return parent;
        }
    }

    record Delete(RevNode node) implements EditOp {
        @Override
        public RevNode anchor() {
            return node;
        }
    }

    record Update(RevNode node, String oldText, String newText) implements EditOp {
        @Override
        public RevNode anchor() {
            return node;
        }
    }

    /**
     * The node becomes child {@code position} of {@code newParent}; either its parent changed or
     * it left the common order of its siblings.
     */
    record Move(RevNode node, RevNode newParent, int position) implements EditOp {
        @Override
        public RevNode anchor() {
            return node;
        }
    }
}
