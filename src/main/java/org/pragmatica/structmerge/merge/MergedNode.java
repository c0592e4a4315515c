package org.pragmatica.structmerge.merge;

import org.pragmatica.structmerge.tree.RevNode;

import java.util.List;
import java.util.Optional;

/**
 * Node of the merged tree. Merged nodes refer back to the revision trees they were built from;
 * the renderer copies text from there.
 */
public sealed interface MergedNode {

    /**
     * Revision node standing for the start of this node when computing surrounding whitespace.
     */
    Optional<RevNode> first();

    /**
     * Revision node standing for the end of this node when computing surrounding whitespace.
     */
    Optional<RevNode> last();

    /**
     * A subtree taken unchanged from one revision.
     */
    record Exact(RevNode source) implements MergedNode {
        @Override
        public Optional<RevNode> first() {
            return Optional.of(source);
        }

        @Override
        public Optional<RevNode> last() {
            return Optional.of(source);
        }
    }

    /**
     * An ordered node whose children were merged. The layout node supplies the text around and
     * between the children.
     */
    record Mixed(RevNode layout, List<MergedNode> children) implements MergedNode {
        public Mixed {
            children = List.copyOf(children);
        }

        @Override
        public Optional<RevNode> first() {
            return Optional.of(layout);
        }

        @Override
        public Optional<RevNode> last() {
            return Optional.of(layout);
        }
    }

    /**
     * A node of an unordered kind: elements are rendered between the layout node's delimiters,
     * separated by its separator.
     */
    record Commutative(RevNode layout, List<MergedNode> elements) implements MergedNode {
        public Commutative {
            elements = List.copyOf(elements);
        }

        @Override
        public Optional<RevNode> first() {
            return Optional.of(layout);
        }

        @Override
        public Optional<RevNode> last() {
            return Optional.of(layout);
        }
    }

    record Conflict(ConflictRegion region) implements MergedNode {
        @Override
        public Optional<RevNode> first() {
            return firstPresent(region.left(), region.right(), region.base(), 0);
        }

        @Override
        public Optional<RevNode> last() {
            return firstPresent(region.left(), region.right(), region.base(), -1);
        }

        private static Optional<RevNode> firstPresent(ConflictSide left, ConflictSide right, ConflictSide base, int index) {
            for (var side : List.of(left, right, base)) {
                var nodes = side.nodes();
                if (!nodes.isEmpty()) {
                    return Optional.of(index < 0 ? nodes.get(nodes.size() - 1) : nodes.get(index));
                }
            }
            return Optional.empty();
        }
    }
}
