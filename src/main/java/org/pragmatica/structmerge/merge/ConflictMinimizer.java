package org.pragmatica.structmerge.merge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.structmerge.matching.ClassMapping;
import org.pragmatica.structmerge.tree.RevNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shrinks conflict regions to the smallest part where the derived revisions really differ.
 *
 * <p>Two narrowing steps are applied until neither makes progress:
 * <ul>
 *     <li>sequence sides drop their common leading and trailing items;</li>
 *     <li>subtree sides of the same kind descend into the only child where they differ, or
 *     drop common leading and trailing children when their arity differs.</li>
 * </ul>
 * The context removed from a region is returned as merged nodes, so the region can be replaced
 * in its parent without changing the rendered text outside the conflict.
 */
public final class ConflictMinimizer {
    private static final Logger logger = LogManager.getLogger(ConflictMinimizer.class);

    private final ClassMapping classes;

    private ConflictMinimizer(ClassMapping classes) {
        this.classes = classes;
    }

    public static ConflictMinimizer create(ClassMapping classes) {
        return new ConflictMinimizer(classes);
    }

    /**
     * A narrowed region together with the merged nodes replacing the original region.
     */
    public record Narrowing(List<MergedNode> replacement, ConflictRegion region) {
        public Narrowing {
            replacement = List.copyOf(replacement);
        }
    }

    public ConflictRegion minimize(ConflictRegion region) {
        return narrow(region).region();
    }

    public Narrowing narrow(ConflictRegion region) {
        var steps = new ArrayList<Step>();
        var current = region;
        var step = step(current);
        while (step.isPresent()) {
            steps.add(step.get());
            current = step.get().inner();
            step = step(current);
        }

        List<MergedNode> replacement = List.of(new MergedNode.Conflict(current));
        for (int i = steps.size() - 1; i >= 0; i--) {
            replacement = steps.get(i).wrap(replacement);
        }
        if (!steps.isEmpty()) {
            logger.debug("Narrowed {} conflict at {} in {} steps to {}", region.kind(), region.anchor(),
                         steps.size(), current.anchor());
        }
        return new Narrowing(replacement, current);
    }

    /**
     * Minimizes every conflict of the merge result.
     */
    public MergeResult minimize(MergeResult result) {
        if (result.isClean()) {
            return result;
        }
        var root = result.tree().root();
        var rewritten = rewrite(root);
        var newRoot = rewritten.size() == 1 ? rewritten.get(0) : root;
        return MergeResult.of(new MergedTree(newRoot, result.tree().classes()));
    }

    private List<MergedNode> rewrite(MergedNode node) {
        if (node instanceof MergedNode.Conflict conflict) {
            return narrow(conflict.region()).replacement();
        }
        if (node instanceof MergedNode.Mixed mixed) {
            return List.of(new MergedNode.Mixed(mixed.layout(), rewriteAll(mixed.children())));
        }
        if (node instanceof MergedNode.Commutative commutative) {
            return List.of(new MergedNode.Commutative(commutative.layout(), rewriteAll(commutative.elements())));
        }
        return List.of(node);
    }

    private List<MergedNode> rewriteAll(List<MergedNode> nodes) {
        var result = new ArrayList<MergedNode>(nodes.size());
        for (var node : nodes) {
            result.addAll(rewrite(node));
        }
        return result;
    }

    // === Steps ===

    private Optional<Step> step(ConflictRegion region) {
        if (region.left() instanceof ConflictSide.Subtree left && region.right() instanceof ConflictSide.Subtree right) {
            return subtreeStep(region, left.node(), right.node());
        }
        return sequenceStep(region);
    }

    private Optional<Step> sequenceStep(ConflictRegion region) {
        var left = region.left().nodes();
        var right = region.right().nodes();
        var base = region.base().nodes();
        int prefix = commonPrefix(left, right);
        int suffix = commonSuffix(left, right, prefix);
        var innerLeft = left.subList(prefix, left.size() - suffix);
        var innerRight = right.subList(prefix, right.size() - suffix);
        if (innerLeft.isEmpty() && innerRight.isEmpty()) {
            return Optional.empty();
        }

        boolean singles = innerLeft.size() == 1 && innerRight.size() == 1
                          && classes.kind(innerLeft.get(0)).equals(classes.kind(innerRight.get(0)));
        if (prefix + suffix == 0 && !singles) {
            return Optional.empty();
        }

        int basePrefix = matchingPrefix(base, left, prefix);
        int baseSuffix = matchingSuffix(base, left, Math.min(suffix, base.size() - basePrefix));
        var innerBase = base.subList(basePrefix, base.size() - baseSuffix);

        var before = exact(left.subList(0, prefix));
        var after = exact(left.subList(left.size() - suffix, left.size()));

        if (singles) {
            var leftItem = innerLeft.get(0);
            var rightItem = innerRight.get(0);
            var baseSide = innerBase.size() == 1 && classes.kind(innerBase.get(0)).equals(classes.kind(leftItem))
                           ? new ConflictSide.Subtree(innerBase.get(0))
                           : ConflictSide.of(innerBase);
            var inner = region.withSides(new ConflictAnchor.Node(classes.canonical(leftItem)),
                                         baseSide,
                                         new ConflictSide.Subtree(leftItem),
                                         new ConflictSide.Subtree(rightItem));
            return Optional.of(new Step(before, Optional.empty(), after, inner));
        }

        var inner = region.withSides(shift(region.anchor(), basePrefix),
                                     ConflictSide.of(innerBase),
                                     ConflictSide.of(innerLeft),
                                     ConflictSide.of(innerRight));
        return Optional.of(new Step(before, Optional.empty(), after, inner));
    }

    private Optional<Step> subtreeStep(ConflictRegion region, RevNode left, RevNode right) {
        var leftTree = classes.tree(left.revision());
        var rightTree = classes.tree(right.revision());
        if (!classes.kind(left).equals(classes.kind(right))
            || leftTree.isLeaf(left.index())
            || rightTree.isLeaf(right.index())) {
            return Optional.empty();
        }
        var leftChildren = children(left);
        var rightChildren = children(right);
        var base = baseSubtree(region, left);

        if (leftChildren.size() == rightChildren.size()) {
            return differingChild(region, left, right, leftChildren, rightChildren, base);
        }

        int prefix = commonPrefix(leftChildren, rightChildren);
        int suffix = commonSuffix(leftChildren, rightChildren, prefix);
        if (prefix + suffix == 0 || !sameGaps(left, right, prefix, suffix)) {
            return Optional.empty();
        }
        var innerLeft = leftChildren.subList(prefix, leftChildren.size() - suffix);
        var innerRight = rightChildren.subList(prefix, rightChildren.size() - suffix);

        ConflictSide baseSide = region.base();
        int position = prefix;
        if (base.isPresent()) {
            var baseChildren = children(base.get());
            int basePrefix = matchingPrefix(baseChildren, leftChildren, prefix);
            int baseSuffix = matchingSuffix(baseChildren, leftChildren,
                                            Math.min(suffix, baseChildren.size() - basePrefix));
            baseSide = ConflictSide.of(baseChildren.subList(basePrefix, baseChildren.size() - baseSuffix));
            position = basePrefix;
        }
        var inner = region.withSides(new ConflictAnchor.Position(classes.canonical(left), position),
                                     baseSide,
                                     ConflictSide.of(innerLeft),
                                     ConflictSide.of(innerRight));
        return Optional.of(new Step(exact(leftChildren.subList(0, prefix)),
                                    Optional.of(left),
                                    exact(leftChildren.subList(leftChildren.size() - suffix, leftChildren.size())),
                                    inner));
    }

    private Optional<Step> differingChild(ConflictRegion region,
                                          RevNode left,
                                          RevNode right,
                                          List<RevNode> leftChildren,
                                          List<RevNode> rightChildren,
                                          Optional<RevNode> base) {
        if (!classes.tree(left.revision()).gaps(left.index())
                    .equals(classes.tree(right.revision()).gaps(right.index()))) {
            return Optional.empty();
        }
        int differing = -1;
        for (int i = 0; i < leftChildren.size(); i++) {
            if (!sameText(leftChildren.get(i), rightChildren.get(i))) {
                if (differing >= 0) {
                    return Optional.empty();
                }
                differing = i;
            }
        }
        if (differing < 0) {
            return Optional.empty();
        }

        var leftChild = leftChildren.get(differing);
        ConflictSide baseSide = region.base();
        if (base.isPresent()) {
            var baseChildren = children(base.get());
            baseSide = baseChildren.size() == leftChildren.size()
                       ? new ConflictSide.Subtree(baseChildren.get(differing))
                       : region.base();
        }
        var inner = region.withSides(new ConflictAnchor.Node(classes.canonical(leftChild)),
                                     baseSide,
                                     new ConflictSide.Subtree(leftChild),
                                     new ConflictSide.Subtree(rightChildren.get(differing)));
        return Optional.of(new Step(exact(leftChildren.subList(0, differing)),
                                    Optional.of(left),
                                    exact(leftChildren.subList(differing + 1, leftChildren.size())),
                                    inner));
    }

    /**
     * Base subtree of the region when it can be narrowed along with the sides.
     */
    private Optional<RevNode> baseSubtree(ConflictRegion region, RevNode left) {
        if (region.base() instanceof ConflictSide.Subtree base
            && classes.kind(base.node()).equals(classes.kind(left))
            && !classes.tree(base.node().revision()).isLeaf(base.node().index())) {
            return Optional.of(base.node());
        }
        return Optional.empty();
    }

    // === Helpers ===

    private boolean sameGaps(RevNode left, RevNode right, int prefix, int suffix) {
        var leftTree = classes.tree(left.revision());
        var rightTree = classes.tree(right.revision());
        int leftCount = leftTree.childCount(left.index());
        int rightCount = rightTree.childCount(right.index());
        for (int i = 0; i <= prefix; i++) {
            if (!leftTree.gap(left.index(), i).equals(rightTree.gap(right.index(), i))) {
                return false;
            }
        }
        for (int i = 0; i <= suffix; i++) {
            if (!leftTree.gap(left.index(), leftCount - i).equals(rightTree.gap(right.index(), rightCount - i))) {
                return false;
            }
        }
        return true;
    }

    private List<RevNode> children(RevNode node) {
        var tree = classes.tree(node.revision());
        var result = new ArrayList<RevNode>(tree.childCount(node.index()));
        for (int child : tree.children(node.index())) {
            result.add(RevNode.of(node.revision(), child));
        }
        return result;
    }

    private int commonPrefix(List<RevNode> left, List<RevNode> right) {
        int limit = Math.min(left.size(), right.size());
        int prefix = 0;
        while (prefix < limit && sameText(left.get(prefix), right.get(prefix))) {
            prefix++;
        }
        return prefix;
    }

    private int commonSuffix(List<RevNode> left, List<RevNode> right, int prefix) {
        int limit = Math.min(left.size(), right.size()) - prefix;
        int suffix = 0;
        while (suffix < limit
               && sameText(left.get(left.size() - 1 - suffix), right.get(right.size() - 1 - suffix))) {
            suffix++;
        }
        return suffix;
    }

    /**
     * Number of leading base items equal to the first {@code limit} items of the reference.
     */
    private int matchingPrefix(List<RevNode> base, List<RevNode> reference, int limit) {
        int count = 0;
        while (count < Math.min(limit, base.size()) && sameText(base.get(count), reference.get(count))) {
            count++;
        }
        return count;
    }

    private int matchingSuffix(List<RevNode> base, List<RevNode> reference, int limit) {
        int count = 0;
        while (count < limit
               && sameText(base.get(base.size() - 1 - count), reference.get(reference.size() - 1 - count))) {
            count++;
        }
        return count;
    }

    private boolean sameText(RevNode first, RevNode second) {
        return classes.text(first).equals(classes.text(second));
    }

    private static ConflictAnchor shift(ConflictAnchor anchor, int offset) {
        if (anchor instanceof ConflictAnchor.Position position) {
            return new ConflictAnchor.Position(position.parent(), position.position() + offset);
        }
        return anchor;
    }

    private static List<MergedNode> exact(List<RevNode> nodes) {
        var result = new ArrayList<MergedNode>(nodes.size());
        for (var node : nodes) {
            result.add(new MergedNode.Exact(node));
        }
        return result;
    }

    /**
     * One narrowing: the inner region is surrounded by context, optionally inside a layout node.
     */
    private record Step(List<MergedNode> before, Optional<RevNode> layout, List<MergedNode> after, ConflictRegion inner) {
        List<MergedNode> wrap(List<MergedNode> replacement) {
            var nodes = new ArrayList<MergedNode>(before.size() + replacement.size() + after.size());
            nodes.addAll(before);
            nodes.addAll(replacement);
            nodes.addAll(after);
            if (layout.isPresent()) {
                return List.of(new MergedNode.Mixed(layout.get(), nodes));
            }
            return nodes;
        }
    }
}
