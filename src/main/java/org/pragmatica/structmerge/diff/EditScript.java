package org.pragmatica.structmerge.diff;

import org.pragmatica.structmerge.matching.Matching;
import org.pragmatica.structmerge.tree.RevNode;
import org.pragmatica.structmerge.tree.Revision;
import org.pragmatica.structmerge.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered edits of one derived revision against the ancestor, indexed by ancestor node.
 */
public final class EditScript {
    private final Matching matching;
    private final List<EditOp> operations;
    private final Set<Integer> deleted = new HashSet<>();
    private final Map<Integer, EditOp.Update> updates = new HashMap<>();
    private final Map<Integer, EditOp.Move> moves = new HashMap<>();
    private final Map<Integer, List<EditOp.Insert>> inserts = new HashMap<>();

    EditScript(Matching matching, List<EditOp> operations) {
        this.matching = matching;
        this.operations = List.copyOf(operations);
        for (var operation : operations) {
            index(operation);
        }
    }

    private void index(EditOp operation) {
        if (operation instanceof EditOp.Delete delete) {
            deleted.add(delete.node().index());
        } else if (operation instanceof EditOp.Update update) {
            updates.put(update.node().index(), update);
        } else if (operation instanceof EditOp.Move move) {
            moves.put(move.node().index(), move);
        } else if (operation instanceof EditOp.Insert insert && insert.parent().isAncestor()) {
            inserts.computeIfAbsent(insert.parent().index(), k -> new ArrayList<>()).add(insert);
        }
    }

    public Revision side() {
        return matching.derived().revision();
    }

    public SyntaxTree ancestor() {
        return matching.ancestor();
    }

    public SyntaxTree derived() {
        return matching.derived();
    }

    public Matching matching() {
        return matching;
    }

    public List<EditOp> operations() {
        return operations;
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public int size() {
        return operations.size();
    }

    public boolean isDeleted(int ancestorNode) {
        return deleted.contains(ancestorNode);
    }

    public Optional<EditOp.Update> updateOf(int ancestorNode) {
        return Optional.ofNullable(updates.get(ancestorNode));
    }

    public Optional<EditOp.Move> moveOf(int ancestorNode) {
        return Optional.ofNullable(moves.get(ancestorNode));
    }

    public List<EditOp.Insert> insertsUnder(int ancestorNode) {
        return inserts.getOrDefault(ancestorNode, List.of());
    }

    /**
     * Derived partner of an ancestor node, or {@code -1} when the node was deleted.
     */
    public int partner(int ancestorNode) {
        return matching.derivedOf(ancestorNode);
    }

    /**
     * Whether the node ended up under a different parent in the derived revision.
     */
    public boolean relocates(int ancestorNode) {
        var move = moves.get(ancestorNode);
        return move != null
               && !move.newParent().equals(RevNode.ancestor(ancestor().parent(ancestorNode)));
    }

    /**
     * Whether the derived revision keeps the node but changes it: its text differs or it moved.
     */
    public boolean changes(int ancestorNode) {
        int partner = partner(ancestorNode);
        if (partner < 0) {
            return false;
        }
        return moves.containsKey(ancestorNode)
               || !ancestor().text(ancestorNode).equals(derived().text(partner));
    }

    @Override
    public String toString() {
        return "EditScript[" + side() + ", " + operations + "]";
    }
}
