package org.pragmatica.structmerge.merge;

import org.pragmatica.structmerge.error.InvariantViolationException;
import org.pragmatica.structmerge.matching.ClassMapping;
import org.pragmatica.structmerge.tree.RevNode;
import org.pragmatica.structmerge.tree.Revision;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of merging three trees, together with the class mapping its nodes refer through.
 */
public record MergedTree(MergedNode root, ClassMapping classes) {

    /**
     * Conflict regions in document order.
     */
    public List<ConflictRegion> conflicts() {
        var result = new ArrayList<ConflictRegion>();
        var pending = new ArrayDeque<MergedNode>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (node instanceof MergedNode.Conflict conflict) {
                result.add(conflict.region());
            } else if (node instanceof MergedNode.Mixed mixed) {
                pushReversed(pending, mixed.children());
            } else if (node instanceof MergedNode.Commutative commutative) {
                pushReversed(pending, commutative.elements());
            }
        }
        return result;
    }

    /**
     * Checks that no ancestor content is lost or duplicated: every ancestor node both derived
     * revisions keep under its original parent is present in the merged tree, either outside
     * conflicts or inside one, and no ancestor node appears more than once outside conflicts.
     *
     * @throws InvariantViolationException if the check fails
     */
    public MergedTree verify() {
        var ancestor = classes.tree(Revision.ANCESTOR);
        var outside = new int[ancestor.size()];
        var inConflict = new boolean[ancestor.size()];
        var pending = new ArrayDeque<MergedNode>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (node instanceof MergedNode.Exact exact) {
                countSubtree(exact.source(), outside);
            } else if (node instanceof MergedNode.Mixed mixed) {
                count(mixed.layout(), outside);
                mixed.children().forEach(pending::push);
            } else if (node instanceof MergedNode.Commutative commutative) {
                count(commutative.layout(), outside);
                commutative.elements().forEach(pending::push);
            } else if (node instanceof MergedNode.Conflict conflict) {
                var region = conflict.region();
                for (var side : List.of(region.base(), region.left(), region.right())) {
                    side.nodes().forEach(id -> markSubtree(id, inConflict));
                }
            }
        }

        for (int node = 0; node < ancestor.size(); node++) {
            if (outside[node] > 1) {
                throw new InvariantViolationException("Ancestor node " + node + " (" + ancestor.kind(node)
                                                      + ") appears " + outside[node] + " times in the merged tree");
            }
            boolean kept = staysInPlace(node, Revision.LEFT) && staysInPlace(node, Revision.RIGHT);
            if (kept && outside[node] == 0 && !inConflict[node]) {
                throw new InvariantViolationException("Ancestor node " + node + " (" + ancestor.kind(node)
                                                      + ") kept by both revisions is missing from the merged tree");
            }
        }
        return this;
    }

    private boolean staysInPlace(int node, Revision side) {
        int partner = classes.map(RevNode.ancestor(node), side);
        if (partner < 0) {
            return false;
        }
        int parent = classes.tree(Revision.ANCESTOR).parent(node);
        int partnerParent = classes.tree(side).parent(partner);
        if (parent < 0 || partnerParent < 0) {
            return parent < 0 && partnerParent < 0;
        }
        return classes.map(RevNode.of(side, partnerParent), Revision.ANCESTOR) == parent;
    }

    private void count(RevNode id, int[] counts) {
        int node = classes.map(id, Revision.ANCESTOR);
        if (node >= 0) {
            counts[node]++;
        }
    }

    private void countSubtree(RevNode id, int[] counts) {
        int end = id.index() + classes.tree(id.revision()).subtreeSize(id.index());
        for (int node = id.index(); node < end; node++) {
            count(RevNode.of(id.revision(), node), counts);
        }
    }

    private void markSubtree(RevNode id, boolean[] marks) {
        int end = id.index() + classes.tree(id.revision()).subtreeSize(id.index());
        for (int node = id.index(); node < end; node++) {
            int ancestorNode = classes.map(RevNode.of(id.revision(), node), Revision.ANCESTOR);
            if (ancestorNode >= 0) {
                marks[ancestorNode] = true;
            }
        }
    }

    private static void pushReversed(ArrayDeque<MergedNode> pending, List<MergedNode> nodes) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            pending.push(nodes.get(i));
        }
    }
}
