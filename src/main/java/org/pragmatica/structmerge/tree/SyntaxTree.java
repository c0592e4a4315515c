package org.pragmatica.structmerge.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Immutable syntax tree of one revision stored as an arena of nodes.
 *
 * <p>Nodes are addressed by their pre-order index: the root is {@code 0}, a node's
 * descendants occupy the indices {@code (i, i + subtreeSize(i))}. Every node has a kind,
 * a span into the revision text, an ordered list of children, and a structural hash
 * computed from its kind, its leaf text and its children's hashes (whitespace between
 * nodes does not contribute to the hash).
 */
public final class SyntaxTree {
    private static final long HASH_SEED = 0xcbf29ce484222325L;
    private static final long HASH_PRIME = 0x100000001b3L;
    private static final int[] NO_CHILDREN = new int[0];

    private final Revision revision;
    private final String source;
    private final KindTable kindTable;
    private final String[] kinds;
    private final SourceSpan[] spans;
    private final boolean[] leaves;
    private final int[] parents;
    private final int[][] children;
    private final int[] childIndices;
    private final int[] sizes;
    private final int[] depths;
    private final long[] hashes;
    private final String[] identityKeys;

    private SyntaxTree(Revision revision,
                       String source,
                       KindTable kindTable,
                       String[] kinds,
                       SourceSpan[] spans,
                       boolean[] leaves,
                       int[] parents) {
        this.revision = revision;
        this.source = source;
        this.kindTable = kindTable;
        this.kinds = kinds;
        this.spans = spans;
        this.leaves = leaves;
        this.parents = parents;

        int n = kinds.length;
        this.children = new int[n][];
        this.childIndices = new int[n];
        this.sizes = new int[n];
        this.depths = new int[n];
        this.hashes = new long[n];
        this.identityKeys = new String[n];
        link();
        summarize();
    }

    public Revision revision() {
        return revision;
    }

    public String source() {
        return source;
    }

    public KindTable kindTable() {
        return kindTable;
    }

    public int size() {
        return kinds.length;
    }

    public int root() {
        return 0;
    }

    public String kind(int node) {
        return kinds[node];
    }

    public KindTraits traits(int node) {
        return kindTable.traits(kinds[node]);
    }

    public SourceSpan span(int node) {
        return spans[node];
    }

    public int start(int node) {
        return spans[node].startOffset();
    }

    public int end(int node) {
        return spans[node].endOffset();
    }

    public String text(int node) {
        return spans[node].extract(source);
    }

    public boolean isLeaf(int node) {
        return leaves[node];
    }

    /**
     * Whether the node is a keyword or punctuation leaf: a leaf whose kind is its own text.
     */
    public boolean isLiteral(int node) {
        return leaves[node] && kinds[node].contentEquals(source.subSequence(start(node), end(node)));
    }

    /**
     * Parent of the node, {@code -1} for the root.
     */
    public int parent(int node) {
        return parents[node];
    }

    public int childCount(int node) {
        return children[node].length;
    }

    public int child(int node, int position) {
        return children[node][position];
    }

    public List<Integer> children(int node) {
        var result = new ArrayList<Integer>(children[node].length);
        for (int child : children[node]) {
            result.add(child);
        }
        return result;
    }

    /**
     * Position of the node among its parent's children, {@code -1} for the root.
     */
    public int childIndex(int node) {
        return childIndices[node];
    }

    public int subtreeSize(int node) {
        return sizes[node];
    }

    public int depth(int node) {
        return depths[node];
    }

    public long hash(int node) {
        return hashes[node];
    }

    public Optional<String> identityKey(int node) {
        return Optional.ofNullable(identityKeys[node]);
    }

    public boolean isAncestorOf(int ancestor, int node) {
        return ancestor < node && node < ancestor + sizes[ancestor];
    }

    public boolean isAncestorOrSelf(int ancestor, int node) {
        return ancestor == node || isAncestorOf(ancestor, node);
    }

    /**
     * Text between the child at {@code position - 1} and the child at {@code position}.
     * Position {@code 0} gives the text between the node start and its first child,
     * position {@code childCount} the text between the last child and the node end.
     */
    public String gap(int node, int position) {
        var kids = children[node];
        int from = position == 0 ? start(node) : end(kids[position - 1]);
        int to = position == kids.length ? end(node) : start(kids[position]);
        return source.substring(from, to);
    }

    /**
     * All gaps of an interior node, from the leading one to the trailing one.
     */
    public List<String> gaps(int node) {
        var result = new ArrayList<String>(children[node].length + 1);
        for (int position = 0; position <= children[node].length; position++) {
            result.add(gap(node, position));
        }
        return result;
    }

    /**
     * Structural equality of two subtrees: same kinds, same leaf texts, same shape.
     * Whitespace between nodes is ignored.
     */
    public boolean isomorphic(int node, SyntaxTree other, int otherNode) {
        if (hashes[node] != other.hashes[otherNode] || sizes[node] != other.sizes[otherNode]) {
            return false;
        }
        for (int offset = 0; offset < sizes[node]; offset++) {
            int mine = node + offset;
            int theirs = otherNode + offset;
            if (!kinds[mine].equals(other.kinds[theirs])
                || leaves[mine] != other.leaves[theirs]
                || children[mine].length != other.children[theirs].length) {
                return false;
            }
            if (leaves[mine] && !text(mine).equals(other.text(theirs))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (int node = 0; node < size(); node++) {
            sb.append("  ".repeat(depths[node]))
              .append(kinds[node])
              .append(' ')
              .append(spans[node]);
            if (leaves[node]) {
                sb.append(" '").append(text(node)).append('\'');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private void link() {
        int n = kinds.length;
        var counts = new int[n];
        for (int node = 1; node < n; node++) {
            counts[parents[node]]++;
        }
        for (int node = 0; node < n; node++) {
            children[node] = counts[node] == 0 ? NO_CHILDREN : new int[counts[node]];
        }
        var fill = new int[n];
        childIndices[0] = -1;
        for (int node = 1; node < n; node++) {
            int parent = parents[node];
            childIndices[node] = fill[parent];
            children[parent][fill[parent]++] = node;
            depths[node] = depths[parent] + 1;
        }
    }

    private void summarize() {
        // Pre-order indices: every child has a larger index than its parent.
        for (int node = kinds.length - 1; node >= 0; node--) {
            var kids = children[node];
            int size = 1;
            long hash = mix(HASH_SEED, kinds[node].hashCode());
            if (leaves[node]) {
                hash = mix(hash, text(node).hashCode());
            }
            for (int child : kids) {
                size += sizes[child];
                hash = mix(hash, hashes[child]);
            }
            sizes[node] = size;
            hashes[node] = mix(hash, kids.length);
            identityKeys[node] = findIdentityKey(node);
        }
    }

    private String findIdentityKey(int node) {
        var childKind = kindTable.traits(kinds[node]).identityChildKind();
        if (childKind.isEmpty()) {
            return null;
        }
        for (int child : children[node]) {
            if (kinds[child].equals(childKind.get())) {
                return text(child);
            }
        }
        return null;
    }

    private static long mix(long hash, long value) {
        return (hash ^ value) * HASH_PRIME;
    }

    static Builder builder(Revision revision, String source, KindTable kindTable) {
        return new Builder(revision, source, kindTable);
    }

    /**
     * Accumulates nodes in pre-order.
     */
    static final class Builder {
        private final Revision revision;
        private final String source;
        private final KindTable kindTable;
        private final List<String> kinds = new ArrayList<>();
        private final List<SourceSpan> spans = new ArrayList<>();
        private final List<Boolean> leaves = new ArrayList<>();
        private int[] parents = new int[64];

        private Builder(Revision revision, String source, KindTable kindTable) {
            this.revision = revision;
            this.source = source;
            this.kindTable = kindTable;
        }

        int add(String kind, SourceSpan span, int parent, boolean leaf) {
            int index = kinds.size();
            if (index == parents.length) {
                parents = Arrays.copyOf(parents, index * 2);
            }
            kinds.add(kind);
            spans.add(span);
            leaves.add(leaf);
            parents[index] = parent;
            return index;
        }

        void span(int node, SourceSpan span) {
            spans.set(node, span);
        }

        SourceSpan span(int node) {
            return spans.get(node);
        }

        int parent(int node) {
            return parents[node];
        }

        boolean isLeaf(int node) {
            return leaves.get(node);
        }

        int size() {
            return kinds.size();
        }

        SyntaxTree build() {
            int n = kinds.size();
            var leafFlags = new boolean[n];
            for (int node = 0; node < n; node++) {
                leafFlags[node] = leaves.get(node);
            }
            return new SyntaxTree(revision,
                                  source,
                                  kindTable,
                                  kinds.toArray(new String[0]),
                                  spans.toArray(new SourceSpan[0]),
                                  leafFlags,
                                  Arrays.copyOf(parents, n));
        }
    }
}
