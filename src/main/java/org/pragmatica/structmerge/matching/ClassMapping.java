package org.pragmatica.structmerge.matching;

import org.pragmatica.structmerge.tree.RevNode;
import org.pragmatica.structmerge.tree.Revision;
import org.pragmatica.structmerge.tree.SyntaxTree;

/**
 * Equivalence classes of nodes across the three revisions of a merge, composed from the
 * ancestor/left and ancestor/right matchings. A left node and a right node correspond when
 * both are matched to the same ancestor node.
 */
public final class ClassMapping {
    private final Matching left;
    private final Matching right;

    private ClassMapping(Matching left, Matching right) {
        this.left = left;
        this.right = right;
    }

    public static ClassMapping of(Matching left, Matching right) {
        if (left.ancestor() != right.ancestor()) {
            throw new IllegalArgumentException("Matchings refer to different ancestor trees");
        }
        return new ClassMapping(left, right);
    }

    public SyntaxTree tree(Revision revision) {
        return switch (revision) {
            case ANCESTOR -> left.ancestor();
            case LEFT -> left.derived();
            case RIGHT -> right.derived();
        };
    }

    public Matching matching(Revision side) {
        return switch (side) {
            case LEFT -> left;
            case RIGHT -> right;
            case ANCESTOR -> throw new IllegalArgumentException("The ancestor has no matching of its own");
        };
    }

    /**
     * Node of {@code target} in the same class as {@code node}, or {@code -1}.
     */
    public int map(RevNode node, Revision target) {
        if (node.revision() == target) {
            return node.index();
        }
        int ancestorNode = node.isAncestor() ? node.index() : matching(node.revision()).ancestorOf(node.index());
        if (ancestorNode < 0 || target == Revision.ANCESTOR) {
            return ancestorNode;
        }
        return matching(target).derivedOf(ancestorNode);
    }

    /**
     * Identity of the node within the merge: the ancestor node of its class if there is one,
     * otherwise the node itself.
     */
    public RevNode canonical(RevNode node) {
        if (node.isAncestor()) {
            return node;
        }
        int ancestorNode = matching(node.revision()).ancestorOf(node.index());
        return ancestorNode >= 0 ? RevNode.ancestor(ancestorNode) : node;
    }

    public String kind(RevNode node) {
        return tree(node.revision()).kind(node.index());
    }

    public String text(RevNode node) {
        return tree(node.revision()).text(node.index());
    }
}
