package org.pragmatica.structmerge.render;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.structmerge.matching.ClassMapping;
import org.pragmatica.structmerge.merge.ConflictRegion;
import org.pragmatica.structmerge.merge.ConflictSide;
import org.pragmatica.structmerge.merge.MergeResult;
import org.pragmatica.structmerge.merge.MergedNode;
import org.pragmatica.structmerge.merge.MergedTree;
import org.pragmatica.structmerge.tree.RevNode;
import org.pragmatica.structmerge.tree.Revision;
import org.pragmatica.structmerge.tree.SyntaxTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Turns a merged tree back into source text.
 *
 * <p>Verbatim nodes copy the text of their revision. Merged nodes take the text around and
 * between their children from a layout node; where two children were not neighbours in any
 * revision, the surrounding whitespace of either child is reused. Conflicts are printed as
 * marker blocks starting at the beginning of a line.
 *
 * <p>The traversal keeps its own stack, deep trees do not grow the call stack.
 */
public final class SourceRenderer {
    private static final Logger logger = LogManager.getLogger(SourceRenderer.class);
    private static final String FALLBACK_GAP = " ";

    private final MarkerStyle style;

    private SourceRenderer(MarkerStyle style) {
        this.style = style;
    }

    public static SourceRenderer create(MarkerStyle style) {
        return new SourceRenderer(style);
    }

    public static SourceRenderer withDefaults() {
        return create(MarkerStyle.DEFAULT);
    }

    public MarkerStyle style() {
        return style;
    }

    public String render(MergeResult result) {
        return render(result.tree());
    }

    public String render(MergedTree tree) {
        var text = render(tree.root(), new ClassFrame(tree.classes()));
        logger.debug("Rendered merged tree into {} characters", text.length());
        return text;
    }

    /**
     * Renders a parsed tree through the same path as merged trees. For a correctly parsed tree
     * the result equals its source text.
     */
    public String renderExploded(SyntaxTree tree) {
        var nodes = new MergedNode[tree.size()];
        for (int node = tree.size() - 1; node >= 0; node--) {
            var id = RevNode.of(tree.revision(), node);
            if (tree.isLeaf(node)) {
                nodes[node] = new MergedNode.Exact(id);
                continue;
            }
            var traits = tree.traits(node);
            var children = new ArrayList<MergedNode>();
            var elements = new ArrayList<MergedNode>();
            for (int child : tree.children(node)) {
                children.add(nodes[child]);
                if (!traits.isPunctuation(tree.kind(child))) {
                    elements.add(nodes[child]);
                }
                nodes[child] = null;
            }
            nodes[node] = traits.isUnordered() && !elements.isEmpty()
                          ? new MergedNode.Commutative(id, elements)
                          : new MergedNode.Mixed(id, children);
        }
        return render(nodes[tree.root()], new TreeFrame(tree));
    }

    /**
     * Text of one side of a conflict.
     */
    public String renderSide(ConflictSide side, ClassMapping classes) {
        return sequence(side.nodes(), new ClassFrame(classes));
    }

    // === Traversal ===

    private String render(MergedNode root, Frame frame) {
        var lineBreak = root.first()
                            .map(node -> lineBreak(frame.tree(node.revision()).source()))
                            .orElse("\n");
        var out = new Output(style, lineBreak);
        var pending = new ArrayDeque<Piece>();
        pending.push(new Piece.Node(root));

        while (!pending.isEmpty()) {
            var piece = pending.pop();
            if (piece instanceof Piece.Text text) {
                out.append(text.text());
                continue;
            }
            var node = ((Piece.Node) piece).node();
            if (node instanceof MergedNode.Exact exact) {
                out.append(text(frame, exact.source()));
            } else if (node instanceof MergedNode.Mixed mixed) {
                pushReversed(pending, mixedPieces(frame, mixed));
            } else if (node instanceof MergedNode.Commutative commutative) {
                pushReversed(pending, commutativePieces(frame, commutative));
            } else if (node instanceof MergedNode.Conflict conflict) {
                conflict(out, frame, conflict.region());
            }
        }
        return out.toString();
    }

    private List<Piece> mixedPieces(Frame frame, MergedNode.Mixed mixed) {
        var layout = mixed.layout();
        var tree = frame.tree(layout.revision());
        int childCount = tree.childCount(layout.index());
        var children = mixed.children();

        var pieces = new ArrayList<Piece>(children.size() * 2 + 2);
        pieces.add(new Piece.Text(tree.gap(layout.index(), 0)));
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                pieces.add(new Piece.Text(gap(frame, Optional.of(layout), children.get(i - 1), children.get(i))));
            }
            pieces.add(new Piece.Node(children.get(i)));
        }
        if (childCount > 0) {
            pieces.add(new Piece.Text(tree.gap(layout.index(), childCount)));
        }
        return pieces;
    }

    private List<Piece> commutativePieces(Frame frame, MergedNode.Commutative commutative) {
        var layout = commutative.layout();
        var tree = frame.tree(layout.revision());
        var traits = tree.traits(layout.index());
        var elements = commutative.elements();
        var pieces = new ArrayList<Piece>(elements.size() * 2 + 2);

        if (elements.isEmpty()) {
            pieces.add(new Piece.Text(traits.open() + traits.close()));
            return pieces;
        }

        var layoutElements = new ArrayList<Integer>();
        for (int child : tree.children(layout.index())) {
            if (!traits.isPunctuation(tree.kind(child))) {
                layoutElements.add(child);
            }
        }
        var source = tree.source();
        if (layoutElements.isEmpty()) {
            pieces.add(new Piece.Text(traits.open()));
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) {
                    pieces.add(new Piece.Text(traits.separator() + " "));
                }
                pieces.add(new Piece.Node(elements.get(i)));
            }
            pieces.add(new Piece.Text(traits.close()));
            return pieces;
        }

        int firstElement = layoutElements.get(0);
        int lastElement = layoutElements.get(layoutElements.size() - 1);
        var leading = source.substring(tree.start(layout.index()), tree.start(firstElement));
        var trailing = source.substring(tree.end(lastElement), tree.end(layout.index()));
        var defaultSeparator = defaultSeparator(tree, layoutElements, leading, traits.open(), traits.separator());

        pieces.add(new Piece.Text(leading));
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                var between = separatorInLayout(frame, layout.revision(), layoutElements,
                                                 elements.get(i - 1), elements.get(i));
                pieces.add(new Piece.Text(between.orElse(defaultSeparator)));
            }
            pieces.add(new Piece.Node(elements.get(i)));
        }
        pieces.add(new Piece.Text(trailing));
        return pieces;
    }

    private static String defaultSeparator(SyntaxTree tree,
                                           List<Integer> layoutElements,
                                           String leading,
                                           String open,
                                           String separator) {
        if (layoutElements.size() >= 2) {
            return tree.source().substring(tree.end(layoutElements.get(0)), tree.start(layoutElements.get(1)));
        }
        int openAt = leading.lastIndexOf(open);
        var afterOpen = open.isEmpty() || openAt < 0 ? "" : leading.substring(openAt + open.length());
        return separator + (afterOpen.isEmpty() ? " " : afterOpen);
    }

    /**
     * Text between two elements when they are neighbours in the layout node.
     */
    private static Optional<String> separatorInLayout(Frame frame,
                                                      Revision revision,
                                                      List<Integer> layoutElements,
                                                      MergedNode previous,
                                                      MergedNode next) {
        var last = previous.last();
        var first = next.first();
        if (last.isEmpty() || first.isEmpty()) {
            return Optional.empty();
        }
        int from = layoutElements.indexOf(frame.map(last.get(), revision));
        int to = layoutElements.indexOf(frame.map(first.get(), revision));
        if (from < 0 || to != from + 1) {
            return Optional.empty();
        }
        var tree = frame.tree(revision);
        return Optional.of(tree.source().substring(tree.end(layoutElements.get(from)), tree.start(layoutElements.get(to))));
    }

    // === Whitespace between siblings ===

    private static String gap(Frame frame, Optional<RevNode> layout, MergedNode previous, MergedNode next) {
        var last = previous.last();
        var first = next.first();
        if (last.isPresent() && first.isPresent()) {
            var inLayout = layout.flatMap(node -> layoutGap(frame, node, last.get(), first.get()));
            if (inLayout.isPresent()) {
                return inLayout.get();
            }
            var adjacent = adjacentGap(frame, last.get(), first.get());
            if (adjacent.isPresent()) {
                return adjacent.get();
            }
        }
        return first.flatMap(node -> leadingGap(frame, node))
                    .or(() -> last.flatMap(node -> trailingGap(frame, node)))
                    .orElse(last.isPresent() && first.isPresent() ? FALLBACK_GAP : "");
    }

    private static Optional<String> layoutGap(Frame frame, RevNode layout, RevNode last, RevNode first) {
        var tree = frame.tree(layout.revision());
        int previous = frame.map(last, layout.revision());
        int next = frame.map(first, layout.revision());
        if (previous < 0 || next < 0
            || tree.parent(previous) != layout.index()
            || tree.parent(next) != layout.index()
            || tree.childIndex(next) != tree.childIndex(previous) + 1) {
            return Optional.empty();
        }
        return Optional.of(tree.gap(layout.index(), tree.childIndex(next)));
    }

    private static Optional<String> adjacentGap(Frame frame, RevNode last, RevNode first) {
        if (last.revision() != first.revision()) {
            return Optional.empty();
        }
        var tree = frame.tree(last.revision());
        int parent = tree.parent(last.index());
        if (parent < 0
            || tree.parent(first.index()) != parent
            || tree.childIndex(first.index()) != tree.childIndex(last.index()) + 1) {
            return Optional.empty();
        }
        return Optional.of(tree.gap(parent, tree.childIndex(first.index())));
    }

    private static Optional<String> leadingGap(Frame frame, RevNode node) {
        var tree = frame.tree(node.revision());
        int parent = tree.parent(node.index());
        int position = parent < 0 ? 0 : tree.childIndex(node.index());
        if (position == 0) {
            return Optional.empty();
        }
        return Optional.of(tree.gap(parent, position));
    }

    private static Optional<String> trailingGap(Frame frame, RevNode node) {
        var tree = frame.tree(node.revision());
        int parent = tree.parent(node.index());
        if (parent < 0 || tree.childIndex(node.index()) >= tree.childCount(parent) - 1) {
            return Optional.empty();
        }
        return Optional.of(tree.gap(parent, tree.childIndex(node.index()) + 1));
    }

    // === Conflicts ===

    private void conflict(Output out, Frame frame, ConflictRegion region) {
        var left = sequence(region.left().nodes(), frame);
        var base = sequence(region.base().nodes(), frame);
        var right = sequence(region.right().nodes(), frame);
        out.conflict(left, base, right);
    }

    private static String sequence(List<RevNode> nodes, Frame frame) {
        var result = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                result.append(gap(frame,
                                  Optional.empty(),
                                  new MergedNode.Exact(nodes.get(i - 1)),
                                  new MergedNode.Exact(nodes.get(i))));
            }
            result.append(text(frame, nodes.get(i)));
        }
        return result.toString();
    }

    private static String text(Frame frame, RevNode node) {
        return frame.tree(node.revision()).text(node.index());
    }

    /**
     * Line terminator of a text: the one ending its first line, {@code "\n"} for single-line text.
     */
    public static String lineBreak(String source) {
        int newline = source.indexOf('\n');
        return newline > 0 && source.charAt(newline - 1) == '\r' ? "\r\n" : "\n";
    }

    private static void pushReversed(Deque<Piece> pending, List<Piece> pieces) {
        for (int i = pieces.size() - 1; i >= 0; i--) {
            pending.push(pieces.get(i));
        }
    }

    private sealed interface Piece {
        record Text(String text) implements Piece {}

        record Node(MergedNode node) implements Piece {}
    }

    /**
     * Revision trees a merged node refers to.
     */
    private interface Frame {
        SyntaxTree tree(Revision revision);

        int map(RevNode node, Revision target);
    }

    private record ClassFrame(ClassMapping classes) implements Frame {
        @Override
        public SyntaxTree tree(Revision revision) {
            return classes.tree(revision);
        }

        @Override
        public int map(RevNode node, Revision target) {
            return classes.map(node, target);
        }
    }

    private record TreeFrame(SyntaxTree tree) implements Frame {
        @Override
        public SyntaxTree tree(Revision revision) {
            return tree;
        }

        @Override
        public int map(RevNode node, Revision target) {
            return node.revision() == target ? node.index() : -1;
        }
    }

    /**
     * Rendered text. A conflict block ends with a line break, so one line break right after it
     * is dropped. Marker lines end with the line terminator of the layout revision.
     */
    private static final class Output {
        private final StringBuilder text = new StringBuilder();
        private final MarkerStyle style;
        private final String lineBreak;
        private boolean afterBlock;

        private Output(MarkerStyle style, String lineBreak) {
            this.style = style;
            this.lineBreak = lineBreak;
        }

        void append(String value) {
            if (value.isEmpty()) {
                return;
            }
            int from = 0;
            if (afterBlock) {
                afterBlock = false;
                if (value.startsWith("\r\n")) {
                    from = 2;
                } else if (value.startsWith("\n")) {
                    from = 1;
                }
            }
            text.append(value, from, value.length());
        }

        void conflict(String left, String base, String right) {
            var indent = startLine();
            marker(style.leftMarker());
            content(indent, left);
            if (style.diff3()) {
                marker(style.baseMarker());
                content(indent, base);
            }
            marker(style.separatorMarker());
            content(indent, right);
            marker(style.rightMarker());
            afterBlock = true;
        }

        /**
         * Moves to the start of a line. Indentation of a line holding only whitespace is removed
         * and returned so it can be applied to the conflict content.
         */
        private String startLine() {
            int lineStart = text.lastIndexOf("\n") + 1;
            var current = text.substring(lineStart);
            if (current.isBlank()) {
                text.setLength(lineStart);
                return current;
            }
            int end = text.length();
            while (end > lineStart && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\t')) {
                end--;
            }
            text.setLength(end);
            text.append(lineBreak);
            return "";
        }

        private void marker(String line) {
            text.append(line).append(lineBreak);
        }

        private void content(String indent, String value) {
            if (value.isEmpty()) {
                return;
            }
            text.append(indent).append(value);
            if (!value.endsWith("\n")) {
                text.append(lineBreak);
            }
        }

        @Override
        public String toString() {
            return text.toString();
        }
    }
}
