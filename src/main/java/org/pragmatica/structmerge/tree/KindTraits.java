package org.pragmatica.structmerge.tree;

import java.util.Optional;

/**
 * Merge-relevant capabilities of one node kind.
 *
 * @param atomic            the node is collapsed into a single leaf when the tree is built
 * @param ordering          whether the order of children is significant
 * @param separator         literal separating elements of an unordered node (may be empty)
 * @param open              literal opening an unordered node (may be empty)
 * @param close             literal closing an unordered node (may be empty)
 * @param identityChildKind kind of the child whose text identifies the node among its siblings
 */
public record KindTraits(boolean atomic,
                         Ordering ordering,
                         String separator,
                         String open,
                         String close,
                         Optional<String> identityChildKind) {

    public static final KindTraits DEFAULT = new KindTraits(false, Ordering.ORDERED, "", "", "", Optional.empty());

    public boolean isUnordered() {
        return ordering == Ordering.UNORDERED;
    }

    /**
     * Whether a child of the given kind is punctuation of an unordered node rather than an element.
     */
    public boolean isPunctuation(String childKind) {
        return isUnordered()
               && (childKind.equals(separator) || childKind.equals(open) || childKind.equals(close));
    }

    public KindTraits asAtomic() {
        return new KindTraits(true, ordering, separator, open, close, identityChildKind);
    }

    public KindTraits asUnordered(String separator, String open, String close) {
        return new KindTraits(atomic, Ordering.UNORDERED, separator, open, close, identityChildKind);
    }

    public KindTraits withIdentity(String childKind) {
        return new KindTraits(atomic, ordering, separator, open, close, Optional.of(childKind));
    }
}
