package org.pragmatica.structmerge.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Flattens a {@link CstNode} produced by the PEG engine into a {@link SyntaxTree}.
 *
 * <ul>
 *     <li>anonymous combinator nodes and nodes of hidden rules (name starting with {@code _})
 *     are spliced into their parent;</li>
 *     <li>anonymous literals become leaves whose kind is the literal text;</li>
 *     <li>nodes of atomic kinds become leaves;</li>
 *     <li>interior nodes without children are dropped;</li>
 *     <li>interior spans are recomputed from their children, the root covers the whole text.</li>
 * </ul>
 *
 * <p>The traversal uses an explicit stack, nesting depth of the input does not grow the call stack.
 */
public final class TreeBuilder {
    private static final String HIDDEN_PREFIX = "_";

    private final KindTable kindTable;

    private TreeBuilder(KindTable kindTable) {
        this.kindTable = kindTable;
    }

    public static TreeBuilder create(KindTable kindTable) {
        return new TreeBuilder(kindTable);
    }

    public SyntaxTree build(CstNode root, String source, Revision revision) {
        var builder = SyntaxTree.builder(revision, source, kindTable);
        var pending = new ArrayDeque<Pending>();

        if (root instanceof CstNode.NonTerminal nonTerminal && !kindTable.isAtomic(nonTerminal.rule())) {
            builder.add(nonTerminal.rule(), SourceSpan.covering(source), -1, false);
            pushReversed(pending, effectiveChildren(nonTerminal), 0);
        } else {
            builder.add(kindOf(root), SourceSpan.covering(source), -1, true);
        }

        while (!pending.isEmpty()) {
            var next = pending.pop();
            var node = next.node();
            if (node instanceof CstNode.NonTerminal nonTerminal) {
                addInterior(builder, pending, nonTerminal, next.parent());
            } else {
                builder.add(kindOf(node), node.span(), next.parent(), true);
            }
        }

        recomputeSpans(builder);
        return builder.build();
    }

    private void addInterior(SyntaxTree.Builder builder,
                             Deque<Pending> pending,
                             CstNode.NonTerminal node,
                             int parent) {
        if (kindTable.isAtomic(node.rule())) {
            if (!node.span().isEmpty()) {
                builder.add(node.rule(), node.span(), parent, true);
            }
            return;
        }
        var children = effectiveChildren(node);
        if (children.isEmpty()) {
            return;
        }
        int index = builder.add(node.rule(), node.span(), parent, false);
        pushReversed(pending, children, index);
    }

    private static List<CstNode> effectiveChildren(CstNode.NonTerminal node) {
        var result = new ArrayList<CstNode>();
        var work = new ArrayDeque<CstNode>();
        for (int i = node.children().size() - 1; i >= 0; i--) {
            work.push(node.children().get(i));
        }
        while (!work.isEmpty()) {
            var child = work.pop();
            if (child instanceof CstNode.NonTerminal nested && isTransparent(nested)) {
                for (int i = nested.children().size() - 1; i >= 0; i--) {
                    work.push(nested.children().get(i));
                }
            } else {
                result.add(child);
            }
        }
        return result;
    }

    private static boolean isTransparent(CstNode.NonTerminal node) {
        return node.isAnonymous() || node.rule().startsWith(HIDDEN_PREFIX);
    }

    private static void pushReversed(Deque<Pending> pending, List<CstNode> children, int parent) {
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(new Pending(children.get(i), parent));
        }
    }

    private static String kindOf(CstNode node) {
        if (!node.isAnonymous()) {
            return node.rule();
        }
        if (node instanceof CstNode.Terminal terminal) {
            return terminal.text();
        }
        if (node instanceof CstNode.Token token) {
            return token.text();
        }
        return "";
    }

    private static void recomputeSpans(SyntaxTree.Builder builder) {
        int n = builder.size();
        var first = new SourceLocation[n];
        var last = new SourceLocation[n];
        // Children follow their parent in pre-order, so descending order finalizes children first.
        for (int node = n - 1; node > 0; node--) {
            if (!builder.isLeaf(node) && first[node] != null) {
                builder.span(node, SourceSpan.of(first[node], last[node]));
            }
            var span = builder.span(node);
            int parent = builder.parent(node);
            first[parent] = span.start();
            if (last[parent] == null) {
                last[parent] = span.end();
            }
        }
    }

    private record Pending(CstNode node, int parent) {}
}
