package org.pragmatica.structmerge.matching;

import org.pragmatica.structmerge.error.InvariantViolationException;
import org.pragmatica.structmerge.tree.SyntaxTree;

/**
 * Partial injective correspondence between the nodes of the ancestor tree and the nodes of one
 * derived tree. Absent partners are reported as {@code -1}.
 */
public final class Matching {
    private final SyntaxTree ancestor;
    private final SyntaxTree derived;
    private final int[] forward;
    private final int[] backward;
    private final int pairs;

    Matching(SyntaxTree ancestor, SyntaxTree derived, int[] forward, int[] backward) {
        this.ancestor = ancestor;
        this.derived = derived;
        this.forward = forward.clone();
        this.backward = backward.clone();
        int count = 0;
        for (int partner : forward) {
            if (partner >= 0) {
                count++;
            }
        }
        this.pairs = count;
    }

    public SyntaxTree ancestor() {
        return ancestor;
    }

    public SyntaxTree derived() {
        return derived;
    }

    /**
     * Partner of an ancestor node in the derived tree, or {@code -1}.
     */
    public int derivedOf(int ancestorNode) {
        return forward[ancestorNode];
    }

    /**
     * Partner of a derived node in the ancestor tree, or {@code -1}.
     */
    public int ancestorOf(int derivedNode) {
        return backward[derivedNode];
    }

    public boolean hasDerived(int ancestorNode) {
        return forward[ancestorNode] >= 0;
    }

    public boolean hasAncestor(int derivedNode) {
        return backward[derivedNode] >= 0;
    }

    public int pairCount() {
        return pairs;
    }

    /**
     * Check that the matching is injective, pairs only nodes of the same kind and never maps an
     * ancestor/descendant pair onto a descendant/ancestor pair.
     *
     * @throws InvariantViolationException when one of these properties does not hold
     */
    public Matching verify() {
        for (int node = 0; node < forward.length; node++) {
            int partner = forward[node];
            if (partner < 0) {
                continue;
            }
            if (backward[partner] != node) {
                throw new InvariantViolationException("Matching is not injective at ancestor node " + node);
            }
            if (!ancestor.kind(node).equals(derived.kind(partner))) {
                throw new InvariantViolationException("Matched nodes " + node + " and " + partner
                                                      + " have different kinds '" + ancestor.kind(node)
                                                      + "' and '" + derived.kind(partner) + "'");
            }
            int enclosing = nearestMatchedAncestor(node);
            if (enclosing >= 0 && derived.isAncestorOrSelf(partner, forward[enclosing])) {
                throw new InvariantViolationException("Matching inverts ancestor " + enclosing + " and node " + node);
            }
        }
        for (int node = 0; node < backward.length; node++) {
            int partner = backward[node];
            if (partner >= 0 && forward[partner] != node) {
                throw new InvariantViolationException("Matching is not injective at derived node " + node);
            }
        }
        return this;
    }

    private int nearestMatchedAncestor(int node) {
        int current = ancestor.parent(node);
        while (current >= 0 && forward[current] < 0) {
            current = ancestor.parent(current);
        }
        return current;
    }

    @Override
    public String toString() {
        return "Matching[" + ancestor.revision() + "->" + derived.revision() + ", " + pairs + " pairs]";
    }
}
