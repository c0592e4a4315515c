package org.pragmatica.structmerge.merge;

import org.pragmatica.structmerge.diff.EditScript;
import org.pragmatica.structmerge.matching.ClassMapping;
import org.pragmatica.structmerge.tree.RevNode;
import org.pragmatica.structmerge.tree.Revision;
import org.pragmatica.structmerge.tree.SyntaxTree;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Finds moves that cannot be applied together: the same node moved to different parents by
 * the two sides, and moves that combined would place a node inside its own subtree.
 *
 * <p>Each such move is reported as one region: the smallest ancestor subtree that holds the
 * node's old position and both of its new parents, kept by both sides, and that no other
 * move of either side enters or leaves. The merger emits a region as a single conflict
 * between the two revisions of that subtree.
 */
public final class MoveResolver {
    private final ClassMapping classes;
    private final EditScript left;
    private final EditScript right;
    private final SyntaxTree ancestor;

    private MoveResolver(ClassMapping classes, EditScript left, EditScript right) {
        this.classes = classes;
        this.left = left;
        this.right = right;
        this.ancestor = classes.tree(Revision.ANCESTOR);
    }

    /**
     * Roots of the ancestor subtrees to emit as move conflicts, with the reason. Regions never
     * nest.
     */
    public static Map<Integer, ConflictKind> resolve(ClassMapping classes, EditScript left, EditScript right) {
        return new MoveResolver(classes, left, right).regions();
    }

    private Map<Integer, ConflictKind> regions() {
        var conflicting = new TreeMap<Integer, ConflictKind>();
        for (int node = 0; node < ancestor.size(); node++) {
            if (left.relocates(node) && right.relocates(node) && !target(left, node).equals(target(right, node))) {
                conflicting.put(node, ConflictKind.MOVE_MOVE);
            }
        }
        for (int node = 0; node < ancestor.size(); node++) {
            if ((left.relocates(node) || right.relocates(node)) && !conflicting.containsKey(node) && insideItself(node)) {
                conflicting.put(node, ConflictKind.CYCLIC_MOVE);
            }
        }

        var result = new TreeMap<Integer, ConflictKind>();
        for (var entry : conflicting.entrySet()) {
            add(result, enclosingRegion(entry.getKey()), entry.getValue());
        }
        return result;
    }

    private void add(TreeMap<Integer, ConflictKind> regions, int root, ConflictKind kind) {
        for (int region : regions.keySet()) {
            if (ancestor.isAncestorOrSelf(region, root)) {
                return;
            }
        }
        regions.keySet().removeIf(region -> ancestor.isAncestorOf(root, region));
        regions.put(root, kind);
    }

    // === Regions ===

    private int enclosingRegion(int node) {
        int root = commonAncestor(ancestor.parent(node), inAncestor(target(left, node)));
        root = commonAncestor(root, inAncestor(target(right, node)));
        var widened = widen(root);
        while (widened != root) {
            root = widened;
            widened = widen(root);
        }
        return root;
    }

    /**
     * The next larger candidate region, or {@code node} itself when it is closed: kept by both
     * sides and not crossed by any relocation.
     */
    private int widen(int node) {
        if (node == ancestor.root()) {
            return node;
        }
        if (left.partner(node) < 0 || right.partner(node) < 0) {
            return ancestor.parent(node);
        }
        for (int other = 0; other < ancestor.size(); other++) {
            for (var script : List.of(left, right)) {
                if (!script.relocates(other)) {
                    continue;
                }
                int target = inAncestor(target(script, other));
                if (ancestor.isAncestorOrSelf(node, other) != ancestor.isAncestorOrSelf(node, target)) {
                    return commonAncestor(commonAncestor(node, ancestor.parent(other)), target);
                }
            }
        }
        return node;
    }

    /**
     * Closest ancestor node standing for a node of the merge: the node itself, or the class of
     * its nearest derived ancestor present in the ancestor tree.
     */
    private int inAncestor(RevNode node) {
        var current = node;
        while (!current.isAncestor()) {
            int parent = classes.tree(current.revision()).parent(current.index());
            if (parent < 0) {
                return ancestor.root();
            }
            current = classes.canonical(RevNode.of(current.revision(), parent));
        }
        return current.index();
    }

    private int commonAncestor(int first, int second) {
        int a = first;
        int b = second;
        while (ancestor.depth(a) > ancestor.depth(b)) {
            a = ancestor.parent(a);
        }
        while (ancestor.depth(b) > ancestor.depth(a)) {
            b = ancestor.parent(b);
        }
        while (a != b) {
            a = ancestor.parent(a);
            b = ancestor.parent(b);
        }
        return a;
    }

    // === Moves ===

    private RevNode target(EditScript script, int node) {
        return script.moveOf(node)
                     .map(move -> classes.canonical(move.newParent()))
                     .orElseGet(() -> RevNode.ancestor(ancestor.parent(node)));
    }

    private boolean insideItself(int node) {
        var start = RevNode.ancestor(node);
        int budget = ancestor.size()
                     + classes.tree(Revision.LEFT).size()
                     + classes.tree(Revision.RIGHT).size();
        var current = parentAfterMerge(start);
        while (current != null && budget-- > 0) {
            if (current.equals(start)) {
                return true;
            }
            current = parentAfterMerge(current);
        }
        return false;
    }

    /**
     * Parent of a node once the moves of both sides are applied, {@code null} for the root.
     */
    private RevNode parentAfterMerge(RevNode node) {
        if (!node.isAncestor()) {
            var tree = classes.tree(node.revision());
            int parent = tree.parent(node.index());
            return parent < 0 ? null : classes.canonical(RevNode.of(node.revision(), parent));
        }
        int index = node.index();
        if (left.relocates(index)) {
            return target(left, index);
        }
        if (right.relocates(index)) {
            return target(right, index);
        }
        int parent = ancestor.parent(index);
        return parent < 0 ? null : RevNode.ancestor(parent);
    }
}
