package org.pragmatica.structmerge.tree;

/**
 * Reference to a node of one revision's tree: the revision plus the node's pre-order index.
 */
public record RevNode(Revision revision, int index) implements Comparable<RevNode> {

    public static RevNode ancestor(int index) {
        return new RevNode(Revision.ANCESTOR, index);
    }

    public static RevNode of(Revision revision, int index) {
        return new RevNode(revision, index);
    }

    public boolean isAncestor() {
        return revision == Revision.ANCESTOR;
    }

    @Override
    public int compareTo(RevNode other) {
        int byRevision = revision.compareTo(other.revision);
        return byRevision != 0 ? byRevision : Integer.compare(index, other.index);
    }

    @Override
    public String toString() {
        return revision.name().charAt(0) + "#" + index;
    }
}
