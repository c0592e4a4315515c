package org.pragmatica.structmerge.matching;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.structmerge.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Aligns the nodes of an ancestor tree with the nodes of a derived tree.
 *
 * <p>Matching runs in four phases:
 * <ol>
 *     <li>exact: subtrees with a structural hash unique among the unmatched nodes of both trees
 *     are matched wholesale, largest first;</li>
 *     <li>approximate: unmatched interior nodes of the same kind are paired by the share of
 *     matched descendants they have in common, boosted by equal identity keys;</li>
 *     <li>recovery: below every matched pair, remaining children are paired by hash and then
 *     by kind, respecting the order of the already matched children for ordered kinds;</li>
 *     <li>leftover: duplicated subtrees still unpaired under a matched parent are paired with an
 *     identical child of the parent's partner, closest position first.</li>
 * </ol>
 * All choices are deterministic. The matcher holds no state between calls.
 */
public final class TreeMatcher {
    private static final Logger logger = LogManager.getLogger(TreeMatcher.class);

    public static final double DEFAULT_THRESHOLD = 0.5;

    private static final Comparator<Candidate> BEST_FIRST = Comparator.comparingDouble(Candidate::score)
                                                                      .reversed()
                                                                      .thenComparingDouble(Candidate::distance)
                                                                      .thenComparingInt(Candidate::ancestorNode)
                                                                      .thenComparingInt(Candidate::derivedNode);

    private final double threshold;

    private TreeMatcher(double threshold) {
        this.threshold = threshold;
    }

    public static TreeMatcher create(double similarityThreshold) {
        return new TreeMatcher(similarityThreshold);
    }

    public static TreeMatcher withDefaults() {
        return create(DEFAULT_THRESHOLD);
    }

    public double threshold() {
        return threshold;
    }

    public Matching match(SyntaxTree ancestor, SyntaxTree derived) {
        var run = new Run(ancestor, derived);
        run.execute();
        var matching = new Matching(ancestor, derived, run.forward, run.backward);
        logger.debug("Matched {} pairs between {} ancestor and {} {} nodes",
                     matching.pairCount(), ancestor.size(), derived.size(), derived.revision());
        return matching;
    }

    private record Candidate(int ancestorNode, int derivedNode, double score, double distance) {}

    /**
     * State of one matching invocation.
     */
    private final class Run {
        private final SyntaxTree ancestor;
        private final SyntaxTree derived;
        private final int[] forward;
        private final int[] backward;
        private final int[] ancestorWeights;
        private final int[] derivedWeights;
        private final Map<Long, List<Integer>> ancestorsByHash;
        private final Map<Long, List<Integer>> derivedByHash;

        private Run(SyntaxTree ancestor, SyntaxTree derived) {
            this.ancestor = ancestor;
            this.derived = derived;
            this.forward = Sequences.filled(ancestor.size(), -1);
            this.backward = Sequences.filled(derived.size(), -1);
            this.ancestorWeights = weights(ancestor);
            this.derivedWeights = weights(derived);
            this.ancestorsByHash = byHash(ancestor);
            this.derivedByHash = byHash(derived);
        }

        private void execute() {
            if (ancestor.isomorphic(0, derived, 0)) {
                matchSubtree(0, 0);
                return;
            }
            if (ancestor.kind(0).equals(derived.kind(0))) {
                link(0, 0);
            }
            exactPhase();
            approximatePhase();
            recoveryPhase();
            leftoverPhase();
        }

        // === Exact phase ===

        private void exactPhase() {
            for (int node : largestFirst()) {
                if (forward[node] >= 0) {
                    continue;
                }
                long hash = ancestor.hash(node);
                if (countUnmatched(ancestorsByHash.get(hash), forward) != 1) {
                    continue;
                }
                var candidates = derivedByHash.getOrDefault(hash, List.of());
                if (countUnmatched(candidates, backward) != 1) {
                    continue;
                }
                int partner = firstUnmatched(candidates, backward);
                if (ancestor.isomorphic(node, derived, partner) && consistent(node, partner)) {
                    matchSubtree(node, partner);
                }
            }
        }

        // === Approximate phase ===

        private void approximatePhase() {
            var byIdentity = derivedByIdentity();
            int accepted;
            do {
                var candidates = new ArrayList<Candidate>();
                for (int node = 1; node < ancestor.size(); node++) {
                    if (forward[node] < 0 && !ancestor.isLeaf(node)) {
                        collectCandidates(node, byIdentity, candidates);
                    }
                }
                candidates.sort(BEST_FIRST);
                accepted = 0;
                for (var candidate : candidates) {
                    int node = candidate.ancestorNode();
                    int partner = candidate.derivedNode();
                    if (forward[node] < 0 && backward[partner] < 0 && consistent(node, partner)) {
                        link(node, partner);
                        accepted++;
                    }
                }
            } while (accepted > 0);
        }

        private void collectCandidates(int node, Map<String, List<Integer>> byIdentity, List<Candidate> candidates) {
            var considered = new HashSet<Integer>();
            int end = node + ancestor.subtreeSize(node);
            for (int descendant = node + 1; descendant < end; descendant++) {
                if (forward[descendant] < 0 || !isWeighted(ancestor, descendant)) {
                    continue;
                }
                for (int up = derived.parent(forward[descendant]); up >= 0 && considered.add(up); up = derived.parent(up)) {
                    consider(node, up, candidates);
                }
            }
            ancestor.identityKey(node)
                    .map(key -> byIdentity.getOrDefault(identity(ancestor.kind(node), key), List.of()))
                    .ifPresent(partners -> partners.stream()
                                                   .filter(considered::add)
                                                   .forEach(partner -> consider(node, partner, candidates)));
        }

        private void consider(int node, int partner, List<Candidate> candidates) {
            if (backward[partner] >= 0
                || derived.isLeaf(partner)
                || !ancestor.kind(node).equals(derived.kind(partner))) {
                return;
            }
            double score = similarity(node, partner);
            if (score >= threshold) {
                candidates.add(new Candidate(node, partner, score, distance(node, partner)));
            }
        }

        private double similarity(int node, int partner) {
            var key = ancestor.identityKey(node);
            var partnerKey = derived.identityKey(partner);
            double bonus = 0.0;
            if (key.isPresent() && partnerKey.isPresent()) {
                if (!key.get().equals(partnerKey.get())) {
                    return -1.0;
                }
                bonus = 1.0;
            }
            int total = ancestorWeights[node] + derivedWeights[partner];
            if (total == 0) {
                return bonus;
            }
            int common = 0;
            int end = node + ancestor.subtreeSize(node);
            for (int descendant = node + 1; descendant < end; descendant++) {
                if (forward[descendant] >= 0
                    && isWeighted(ancestor, descendant)
                    && derived.isAncestorOf(partner, forward[descendant])) {
                    common++;
                }
            }
            return 2.0 * common / total + bonus;
        }

        // === Recovery phase ===

        private void recoveryPhase() {
            // Pairs created for children have larger indices and are visited later in the same pass.
            for (int node = 0; node < ancestor.size(); node++) {
                int partner = forward[node];
                if (partner < 0 || ancestor.isLeaf(node) || derived.isLeaf(partner)) {
                    continue;
                }
                if (ancestor.traits(node).isUnordered()) {
                    recoverUnordered(node, partner);
                } else {
                    recoverOrdered(node, partner);
                }
            }
        }

        private void recoverOrdered(int node, int partner) {
            var children = ancestor.children(node);
            var partnerChildren = derived.children(partner);
            var positions = new int[children.size()];
            for (int i = 0; i < positions.length; i++) {
                int matched = forward[children.get(i)];
                positions[i] = matched >= 0 && derived.parent(matched) == partner ? derived.childIndex(matched) : -1;
            }
            int previous = -1;
            int previousPartner = -1;
            for (int anchor : Sequences.longestIncreasing(positions)) {
                recoverGap(children.subList(previous + 1, anchor),
                           partnerChildren.subList(previousPartner + 1, positions[anchor]));
                previous = anchor;
                previousPartner = positions[anchor];
            }
            recoverGap(children.subList(previous + 1, children.size()),
                       partnerChildren.subList(previousPartner + 1, partnerChildren.size()));
        }

        private void recoverGap(List<Integer> nodes, List<Integer> partners) {
            var open = unmatched(nodes, forward);
            var openPartners = unmatched(partners, backward);
            if (open.isEmpty() || openPartners.isEmpty()) {
                return;
            }
            for (var pair : Sequences.commonSubsequence(open.size(), openPartners.size(),
                                                        (i, j) -> ancestor.isomorphic(open.get(i), derived, openPartners.get(j)))) {
                int node = open.get(pair[0]);
                int partner = openPartners.get(pair[1]);
                if (consistent(node, partner)) {
                    matchSubtree(node, partner);
                }
            }
            var rest = unmatched(open, forward);
            var restPartners = unmatched(openPartners, backward);
            for (var pair : Sequences.commonSubsequence(rest.size(), restPartners.size(),
                                                        (i, j) -> compatible(rest.get(i), restPartners.get(j)))) {
                int node = rest.get(pair[0]);
                int partner = restPartners.get(pair[1]);
                if (consistent(node, partner)) {
                    link(node, partner);
                }
            }
        }

        private void recoverUnordered(int node, int partner) {
            var children = unmatched(ancestor.children(node), forward);
            var partnerChildren = unmatched(derived.children(partner), backward);
            for (int child : children) {
                for (int candidate : partnerChildren) {
                    if (backward[candidate] < 0
                        && ancestor.isomorphic(child, derived, candidate)
                        && consistent(child, candidate)) {
                        matchSubtree(child, candidate);
                        break;
                    }
                }
            }
            for (int child : children) {
                if (forward[child] >= 0) {
                    continue;
                }
                boolean literal = ancestor.isLiteral(child);
                if (!literal && ancestor.identityKey(child).isEmpty()) {
                    continue;
                }
                for (int candidate : partnerChildren) {
                    if (backward[candidate] < 0
                        && literal == derived.isLiteral(candidate)
                        && compatible(child, candidate)
                        && consistent(child, candidate)) {
                        link(child, candidate);
                        break;
                    }
                }
            }
        }

        private boolean compatible(int node, int partner) {
            if (!ancestor.kind(node).equals(derived.kind(partner))
                || ancestor.isLeaf(node) != derived.isLeaf(partner)) {
                return false;
            }
            var key = ancestor.identityKey(node);
            var partnerKey = derived.identityKey(partner);
            return key.isEmpty() || partnerKey.isEmpty() || key.get().equals(partnerKey.get());
        }

        // === Leftover phase ===

        private void leftoverPhase() {
            for (int node : largestFirst()) {
                if (forward[node] >= 0 || ancestor.isLiteral(node) || !parentMatched(node)) {
                    continue;
                }
                int best = -1;
                double bestDistance = Double.MAX_VALUE;
                for (int candidate : derived.children(forward[ancestor.parent(node)])) {
                    if (backward[candidate] >= 0
                        || !ancestor.isomorphic(node, derived, candidate)
                        || !consistent(node, candidate)) {
                        continue;
                    }
                    double candidateDistance = distance(node, candidate);
                    if (candidateDistance < bestDistance) {
                        best = candidate;
                        bestDistance = candidateDistance;
                    }
                }
                if (best >= 0) {
                    matchSubtree(node, best);
                }
            }
        }

        private boolean parentMatched(int node) {
            int parent = ancestor.parent(node);
            return parent >= 0 && forward[parent] >= 0;
        }

        // === Bookkeeping ===

        private void link(int node, int partner) {
            forward[node] = partner;
            backward[partner] = node;
        }

        private void matchSubtree(int node, int partner) {
            int size = ancestor.subtreeSize(node);
            for (int offset = 0; offset < size; offset++) {
                if (forward[node + offset] < 0 && backward[partner + offset] < 0) {
                    link(node + offset, partner + offset);
                }
            }
        }

        /**
         * Whether pairing the two nodes keeps every ancestor/descendant relation between matched
         * nodes intact.
         */
        private boolean consistent(int node, int partner) {
            for (int up = ancestor.parent(node); up >= 0; up = ancestor.parent(up)) {
                if (forward[up] >= 0 && derived.isAncestorOf(partner, forward[up])) {
                    return false;
                }
            }
            int end = node + ancestor.subtreeSize(node);
            for (int descendant = node + 1; descendant < end; descendant++) {
                if (forward[descendant] >= 0 && derived.isAncestorOrSelf(forward[descendant], partner)) {
                    return false;
                }
            }
            return true;
        }

        private double distance(int node, int partner) {
            return Math.abs((double) node / ancestor.size() - (double) partner / derived.size());
        }

        private List<Integer> largestFirst() {
            var order = new ArrayList<Integer>(ancestor.size());
            for (int node = 0; node < ancestor.size(); node++) {
                order.add(node);
            }
            order.sort(Comparator.comparingInt((Integer node) -> ancestor.subtreeSize(node))
                                 .reversed()
                                 .thenComparingInt(node -> node));
            return order;
        }

        private Map<String, List<Integer>> derivedByIdentity() {
            var result = new HashMap<String, List<Integer>>();
            for (int node = 0; node < derived.size(); node++) {
                int current = node;
                derived.identityKey(node)
                       .ifPresent(key -> result.computeIfAbsent(identity(derived.kind(current), key), k -> new ArrayList<>())
                                               .add(current));
            }
            return result;
        }
    }

    private static String identity(String kind, String key) {
        return kind + '\u0000' + key;
    }

    /**
     * Keywords and punctuation carry no identity, only the remaining descendants count towards
     * similarity.
     */
    private static boolean isWeighted(SyntaxTree tree, int node) {
        return !tree.isLiteral(node);
    }

    private static int[] weights(SyntaxTree tree) {
        var weights = new int[tree.size()];
        for (int node = tree.size() - 1; node > 0; node--) {
            weights[tree.parent(node)] += weights[node] + (isWeighted(tree, node) ? 1 : 0);
        }
        return weights;
    }

    private static Map<Long, List<Integer>> byHash(SyntaxTree tree) {
        var result = new HashMap<Long, List<Integer>>();
        for (int node = 0; node < tree.size(); node++) {
            result.computeIfAbsent(tree.hash(node), k -> new ArrayList<>()).add(node);
        }
        return result;
    }

    private static int countUnmatched(List<Integer> nodes, int[] partners) {
        int count = 0;
        for (int node : nodes) {
            if (partners[node] < 0 && ++count > 1) {
                break;
            }
        }
        return count;
    }

    private static int firstUnmatched(List<Integer> nodes, int[] partners) {
        for (int node : nodes) {
            if (partners[node] < 0) {
                return node;
            }
        }
        return -1;
    }

    private static List<Integer> unmatched(List<Integer> nodes, int[] partners) {
        var result = new ArrayList<Integer>(nodes.size());
        for (int node : nodes) {
            if (partners[node] < 0) {
                result.add(node);
            }
        }
        return result;
    }
}
