package org.pragmatica.structmerge.merge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.structmerge.diff.EditScript;
import org.pragmatica.structmerge.error.InvariantViolationException;
import org.pragmatica.structmerge.matching.ClassMapping;
import org.pragmatica.structmerge.tree.KindTraits;
import org.pragmatica.structmerge.tree.RevNode;
import org.pragmatica.structmerge.tree.Revision;
import org.pragmatica.structmerge.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Combines the edit scripts of the left and right revisions against their common ancestor.
 *
 * <p>The merge walks the ancestor tree top-down from the root. Leaves take the text of the side
 * that changed them. Ordered child lists are merged three-way, unordered ones as sets. A merged
 * node whose children are exactly those of one revision collapses back into a verbatim copy of
 * that revision's node, so untouched regions keep their original text. Moves that cannot be
 * combined turn the smallest subtree enclosing them into one conflict, see {@link MoveResolver}.
 *
 * <p>Recursion depth follows the depth of the syntax trees, which the parser bounds.
 */
public final class ThreeWayMerger {
    private static final Logger logger = LogManager.getLogger(ThreeWayMerger.class);

    private ThreeWayMerger() {}

    public static ThreeWayMerger create() {
        return new ThreeWayMerger();
    }

    public MergeResult merge(SyntaxTree ancestor, EditScript left, EditScript right) {
        if (left.ancestor() != ancestor || right.ancestor() != ancestor) {
            throw new IllegalArgumentException("Edit scripts must be relative to the given ancestor");
        }
        if (left.side() != Revision.LEFT || right.side() != Revision.RIGHT) {
            throw new IllegalArgumentException("Expected left and right edit scripts, got "
                                               + left.side() + " and " + right.side());
        }
        var classes = ClassMapping.of(left.matching(), right.matching());
        var moveRegions = MoveResolver.resolve(classes, left, right);
        if (!moveRegions.isEmpty()) {
            logger.debug("Conflicting moves in {} regions: {}", moveRegions.size(), moveRegions);
        }

        var root = new Run(classes, left, right, moveRegions).mergeRoot();
        var result = MergeResult.of(new MergedTree(root, classes).verify());
        logger.debug("Merged {} left and {} right operations into {} conflicts",
                     left.size(), right.size(), result.regions().size());
        return result;
    }

    /**
     * State of one merge.
     */
    private static final class Run {
        private final ClassMapping classes;
        private final EditScript left;
        private final EditScript right;
        private final Map<Integer, ConflictKind> moveRegions;
        private final ChildListMerger lists;
        private final SyntaxTree ancestor;
        private final boolean[] placed;

        private Run(ClassMapping classes, EditScript left, EditScript right, Map<Integer, ConflictKind> moveRegions) {
            this.classes = classes;
            this.left = left;
            this.right = right;
            this.moveRegions = moveRegions;
            this.lists = new ChildListMerger(classes, left, right);
            this.ancestor = classes.tree(Revision.ANCESTOR);
            this.placed = new boolean[ancestor.size()];
        }

        private MergedNode mergeRoot() {
            int root = ancestor.root();
            int leftRoot = left.partner(root);
            int rightRoot = right.partner(root);
            if (leftRoot < 0 || rightRoot < 0) {
                throw new InvariantViolationException("Roots of the three revisions do not correspond");
            }
            return convert(RevNode.ancestor(root)).orElseThrow();
        }

        private Optional<MergedNode> convert(RevNode id) {
            if (!id.isAncestor()) {
                return Optional.of(inserted(id));
            }
            int node = id.index();
            int leftNode = left.partner(node);
            int rightNode = right.partner(node);
            var moveKind = moveRegions.get(node);
            if (moveKind != null) {
                place(node);
                return Optional.of(moveRegion(moveKind, node, leftNode, rightNode));
            }
            if (leftNode >= 0 && rightNode >= 0) {
                place(node);
                return Optional.of(mergeMatched(node, leftNode, rightNode));
            }
            if (leftNode < 0 && rightNode < 0) {
                return Optional.empty();
            }
            var keeping = leftNode >= 0 ? left : right;
            if (keeping.changes(node)) {
                place(node);
                return Optional.of(new MergedNode.Conflict(lists.deleteModify(id)));
            }
            return Optional.empty();
        }

        /**
         * Both revisions of a subtree holding moves that cannot be combined. Identical revisions
         * need no conflict.
         */
        private MergedNode moveRegion(ConflictKind kind, int node, int leftNode, int rightNode) {
            var leftId = RevNode.of(Revision.LEFT, leftNode);
            var rightId = RevNode.of(Revision.RIGHT, rightNode);
            if (classes.text(leftId).equals(classes.text(rightId))) {
                return new MergedNode.Exact(leftId);
            }
            var id = RevNode.ancestor(node);
            return new MergedNode.Conflict(new ConflictRegion(kind,
                                                              new ConflictAnchor.Node(id),
                                                              new ConflictSide.Subtree(id),
                                                              new ConflictSide.Subtree(leftId),
                                                              new ConflictSide.Subtree(rightId)));
        }

        /**
         * Subtree inserted by one side. Nodes it adopted from the ancestor are merged in place.
         */
        private MergedNode inserted(RevNode id) {
            var tree = classes.tree(id.revision());
            int node = id.index();
            if (tree.isLeaf(node) || !adoptsAncestorNodes(id)) {
                return new MergedNode.Exact(id);
            }
            var children = new ArrayList<MergedNode>();
            for (int child : tree.children(node)) {
                convert(classes.canonical(RevNode.of(id.revision(), child))).ifPresent(children::add);
            }
            return new MergedNode.Mixed(id, children);
        }

        private boolean adoptsAncestorNodes(RevNode id) {
            var tree = classes.tree(id.revision());
            var matching = classes.matching(id.revision());
            int end = id.index() + tree.subtreeSize(id.index());
            for (int node = id.index(); node < end; node++) {
                if (matching.hasAncestor(node)) {
                    return true;
                }
            }
            return false;
        }

        private MergedNode mergeMatched(int node, int leftNode, int rightNode) {
            var leftTree = left.derived();
            var rightTree = right.derived();
            if (ancestor.isLeaf(node) || leftTree.isLeaf(leftNode) || rightTree.isLeaf(rightNode)) {
                return mergeLeaf(node, leftNode, rightNode);
            }
            var baseIds = childIds(Revision.ANCESTOR, node);
            var leftIds = childIds(Revision.LEFT, leftNode);
            var rightIds = childIds(Revision.RIGHT, rightNode);
            var traits = ancestor.traits(node);

            if (traits.isUnordered()) {
                var baseElements = elements(baseIds, traits);
                var leftElements = elements(leftIds, traits);
                var rightElements = elements(rightIds, traits);
                var slots = lists.mergeUnordered(baseElements, leftElements, rightElements);
                var layout = layout(node, leftNode, rightNode, keptIds(slots), leftElements, rightElements);
                return commutative(layout, convertAll(slots), traits);
            }
            var slots = lists.mergeOrdered(RevNode.ancestor(node), baseIds, leftIds, rightIds);
            var layout = layout(node, leftNode, rightNode, keptIds(slots), leftIds, rightIds);
            return mixed(layout, convertAll(slots));
        }

        private MergedNode mergeLeaf(int node, int leftNode, int rightNode) {
            var baseText = ancestor.text(node);
            var leftText = left.derived().text(leftNode);
            var rightText = right.derived().text(rightNode);
            if (leftText.equals(baseText)) {
                return new MergedNode.Exact(RevNode.of(Revision.RIGHT, rightNode));
            }
            if (rightText.equals(baseText) || leftText.equals(rightText)) {
                return new MergedNode.Exact(RevNode.of(Revision.LEFT, leftNode));
            }
            return new MergedNode.Conflict(new ConflictRegion(ConflictKind.UPDATE_UPDATE,
                                                              new ConflictAnchor.Node(RevNode.ancestor(node)),
                                                              new ConflictSide.Subtree(RevNode.ancestor(node)),
                                                              new ConflictSide.Subtree(RevNode.of(Revision.LEFT, leftNode)),
                                                              new ConflictSide.Subtree(RevNode.of(Revision.RIGHT, rightNode))));
        }

        // === Child lists ===

        private List<RevNode> childIds(Revision revision, int node) {
            var tree = classes.tree(revision);
            var result = new ArrayList<RevNode>(tree.childCount(node));
            for (int child : tree.children(node)) {
                result.add(classes.canonical(RevNode.of(revision, child)));
            }
            return result;
        }

        private List<RevNode> elements(List<RevNode> ids, KindTraits traits) {
            var result = new ArrayList<RevNode>(ids.size());
            for (var id : ids) {
                if (!traits.isPunctuation(classes.kind(id))) {
                    result.add(id);
                }
            }
            return result;
        }

        private List<MergedNode> convertAll(List<Slot> slots) {
            var result = new ArrayList<MergedNode>(slots.size());
            for (var slot : slots) {
                if (slot instanceof Slot.Keep keep) {
                    convert(keep.id()).ifPresent(result::add);
                } else {
                    result.add(new MergedNode.Conflict(((Slot.Clash) slot).region()));
                }
            }
            return result;
        }

        private static List<RevNode> keptIds(List<Slot> slots) {
            var result = new ArrayList<RevNode>(slots.size());
            for (var slot : slots) {
                if (slot instanceof Slot.Keep keep) {
                    result.add(keep.id());
                }
            }
            return result;
        }

        // === Layout ===

        /**
         * Revision whose node supplies the text between merged children: preferably one whose
         * children are exactly the merged ones, then one that reformatted the node, then one that
         * changed it at all.
         */
        private RevNode layout(int node,
                               int leftNode,
                               int rightNode,
                               List<RevNode> merged,
                               List<RevNode> leftIds,
                               List<RevNode> rightIds) {
            var leftTree = left.derived();
            var rightTree = right.derived();
            var leftLayout = RevNode.of(Revision.LEFT, leftNode);
            var rightLayout = RevNode.of(Revision.RIGHT, rightNode);

            boolean leftFits = merged.equals(leftIds);
            boolean rightFits = merged.equals(rightIds);
            if (leftFits != rightFits) {
                return leftFits ? leftLayout : rightLayout;
            }
            var baseGaps = ancestor.gaps(node);
            boolean leftFormats = !baseGaps.equals(leftTree.gaps(leftNode));
            boolean rightFormats = !baseGaps.equals(rightTree.gaps(rightNode));
            if (leftFormats != rightFormats) {
                return leftFormats ? leftLayout : rightLayout;
            }
            var baseText = ancestor.text(node);
            boolean rightChanges = !baseText.equals(rightTree.text(rightNode));
            boolean leftChanges = !baseText.equals(leftTree.text(leftNode));
            return rightChanges && !leftChanges ? rightLayout : leftLayout;
        }

        private MergedNode mixed(RevNode layout, List<MergedNode> children) {
            var tree = classes.tree(layout.revision());
            if (corresponds(children, layout, tree.children(layout.index()))) {
                return new MergedNode.Exact(layout);
            }
            return new MergedNode.Mixed(layout, children);
        }

        private MergedNode commutative(RevNode layout, List<MergedNode> elements, KindTraits traits) {
            var tree = classes.tree(layout.revision());
            var layoutElements = new ArrayList<Integer>();
            for (int child : tree.children(layout.index())) {
                if (!traits.isPunctuation(tree.kind(child))) {
                    layoutElements.add(child);
                }
            }
            if (corresponds(elements, layout, layoutElements)) {
                return new MergedNode.Exact(layout);
            }
            return new MergedNode.Commutative(layout, elements);
        }

        /**
         * Whether the merged nodes are verbatim copies of the given children of the layout node.
         */
        private boolean corresponds(List<MergedNode> merged, RevNode layout, List<Integer> children) {
            if (merged.size() != children.size()) {
                return false;
            }
            for (int i = 0; i < merged.size(); i++) {
                var target = RevNode.of(layout.revision(), children.get(i));
                if (!(merged.get(i) instanceof MergedNode.Exact exact)) {
                    return false;
                }
                var source = exact.source();
                boolean same = source.equals(target)
                               || (classes.map(source, target.revision()) == target.index()
                                   && classes.text(source).equals(classes.text(target)));
                if (!same) {
                    return false;
                }
            }
            return true;
        }

        private void place(int node) {
            if (placed[node]) {
                throw new InvariantViolationException("Ancestor node " + node + " (" + ancestor.kind(node)
                                                      + ") placed twice in the merged tree");
            }
            placed[node] = true;
        }
    }
}
