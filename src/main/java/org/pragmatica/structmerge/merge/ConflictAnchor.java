package org.pragmatica.structmerge.merge;

import org.pragmatica.structmerge.tree.RevNode;

/**
 * Location of a conflict in the merged frame: a node, or a position between the children of a
 * node. Nodes are identified by their ancestor identity whenever they have one.
 */
public sealed interface ConflictAnchor {

    record Node(RevNode node) implements ConflictAnchor {
        @Override
        public String toString() {
            return node.toString();
        }
    }

    record Position(RevNode parent, int position) implements ConflictAnchor {
        @Override
        public String toString() {
            return parent + "[" + position + "]";
        }
    }
}
