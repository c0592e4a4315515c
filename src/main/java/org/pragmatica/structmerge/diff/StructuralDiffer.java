package org.pragmatica.structmerge.diff;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.structmerge.matching.Matching;
import org.pragmatica.structmerge.matching.Sequences;
import org.pragmatica.structmerge.tree.RevNode;
import org.pragmatica.structmerge.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Derives the edit script of a derived tree from its matching against the ancestor.
 *
 * <p>Unmatched ancestor nodes are deleted, maximal unmatched derived subtrees are inserted under
 * their matched parent, matched leaves with different text are updated, and matched nodes move
 * when their parent changes or, under an ordered parent, when they fall outside the longest
 * common order of their siblings. Children of unordered kinds never move within their parent.
 */
public final class StructuralDiffer {
    private static final Logger logger = LogManager.getLogger(StructuralDiffer.class);

    private StructuralDiffer() {}

    public static StructuralDiffer create() {
        return new StructuralDiffer();
    }

    public EditScript diff(SyntaxTree ancestor, SyntaxTree derived, Matching matching) {
        if (matching.ancestor() != ancestor || matching.derived() != derived) {
            throw new IllegalArgumentException("Matching does not belong to the given trees");
        }
        var operations = new ArrayList<EditOp>();
        var comparator = new OperationOrder(ancestor);

        for (int node = 0; node < ancestor.size(); node++) {
            int partner = matching.derivedOf(node);
            if (partner < 0) {
                operations.add(new EditOp.Delete(RevNode.ancestor(node)));
                continue;
            }
            if ((ancestor.isLeaf(node) || derived.isLeaf(partner))
                && !ancestor.text(node).equals(derived.text(partner))) {
                operations.add(new EditOp.Update(RevNode.ancestor(node), ancestor.text(node), derived.text(partner)));
            }
            if (node != ancestor.root() && parentChanged(ancestor, derived, matching, node, partner)) {
                operations.add(new EditOp.Move(RevNode.ancestor(node),
                                               identity(derived, matching, derived.parent(partner)),
                                               derived.childIndex(partner)));
            }
            if (!ancestor.isLeaf(node) && !derived.isLeaf(partner) && !ancestor.traits(node).isUnordered()) {
                reorderings(ancestor, derived, matching, node, partner, operations);
            }
        }

        for (int node = 0; node < derived.size(); node++) {
            int parent = derived.parent(node);
            if (parent >= 0 && !matching.hasAncestor(node) && matching.hasAncestor(parent)) {
                operations.add(new EditOp.Insert(RevNode.ancestor(matching.ancestorOf(parent)),
                                                 derived.childIndex(node),
                                                 RevNode.of(derived.revision(), node)));
            }
        }

        operations.sort(comparator);
        logger.debug("{} revision differs from ancestor by {} operations", derived.revision(), operations.size());
        return new EditScript(matching, operations);
    }

    private static boolean parentChanged(SyntaxTree ancestor, SyntaxTree derived, Matching matching, int node, int partner) {
        int derivedParent = derived.parent(partner);
        return derivedParent < 0 || matching.ancestorOf(derivedParent) != ancestor.parent(node);
    }

    /**
     * Children staying under the same parent but leaving the longest common order move within it.
     */
    private static void reorderings(SyntaxTree ancestor,
                                    SyntaxTree derived,
                                    Matching matching,
                                    int node,
                                    int partner,
                                    List<EditOp> operations) {
        var children = ancestor.children(node);
        var positions = new int[children.size()];
        for (int i = 0; i < positions.length; i++) {
            int matched = matching.derivedOf(children.get(i));
            positions[i] = matched >= 0 && derived.parent(matched) == partner ? derived.childIndex(matched) : -1;
        }
        var inOrder = new boolean[positions.length];
        for (int position : Sequences.longestIncreasing(positions)) {
            inOrder[position] = true;
        }
        for (int i = 0; i < positions.length; i++) {
            if (positions[i] >= 0 && !inOrder[i]) {
                operations.add(new EditOp.Move(RevNode.ancestor(children.get(i)), RevNode.ancestor(node), positions[i]));
            }
        }
    }

    private static RevNode identity(SyntaxTree derived, Matching matching, int derivedNode) {
        int ancestorNode = derivedNode < 0 ? -1 : matching.ancestorOf(derivedNode);
        return ancestorNode >= 0 ? RevNode.ancestor(ancestorNode) : RevNode.of(derived.revision(), derivedNode);
    }

    /**
     * Ancestor document order of the anchor, then deletions, updates, moves and insertions, then
     * position.
     */
    private record OperationOrder(SyntaxTree ancestor) implements Comparator<EditOp> {
        @Override
        public int compare(EditOp first, EditOp second) {
            int byAnchor = Integer.compare(first.anchor().index(), second.anchor().index());
            if (byAnchor != 0) {
                return byAnchor;
            }
            int byRank = Integer.compare(rank(first), rank(second));
            return byRank != 0 ? byRank : Integer.compare(position(first), position(second));
        }

        private static int rank(EditOp operation) {
            if (operation instanceof EditOp.Delete) {
                return 0;
            }
            if (operation instanceof EditOp.Update) {
                return 1;
            }
            if (operation instanceof EditOp.Move) {
                return 2;
            }
            return 3;
        }

        private int position(EditOp operation) {
            if (operation instanceof EditOp.Insert insert) {
                return insert.position();
            }
            if (operation instanceof EditOp.Move move) {
                return move.position();
            }
            return Math.max(ancestor.childIndex(operation.anchor().index()), 0);
        }
    }
}
