package org.pragmatica.structmerge.merge;

import org.pragmatica.structmerge.tree.RevNode;

import java.util.List;

/**
 * Content one revision contributes to a conflict. All nodes belong to that revision's tree.
 */
public sealed interface ConflictSide {
    Absent ABSENT = new Absent();

    List<RevNode> nodes();

    default boolean isAbsent() {
        return nodes().isEmpty();
    }

    static ConflictSide of(List<RevNode> nodes) {
        return nodes.isEmpty() ? ABSENT : new Sequence(List.copyOf(nodes));
    }

    /**
     * The revision has nothing at the anchor.
     */
    record Absent() implements ConflictSide {
        @Override
        public List<RevNode> nodes() {
            return List.of();
        }
    }

    /**
     * The revision has a single replacement subtree.
     */
    record Subtree(RevNode node) implements ConflictSide {
        @Override
        public List<RevNode> nodes() {
            return List.of(node);
        }
    }

    /**
     * The revision has a run of sibling subtrees.
     */
    record Sequence(List<RevNode> items) implements ConflictSide {
        @Override
        public List<RevNode> nodes() {
            return items;
        }
    }
}
