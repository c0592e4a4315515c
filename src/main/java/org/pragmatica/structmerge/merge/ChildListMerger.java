package org.pragmatica.structmerge.merge;

import org.pragmatica.structmerge.diff.EditScript;
import org.pragmatica.structmerge.matching.ClassMapping;
import org.pragmatica.structmerge.matching.Sequences;
import org.pragmatica.structmerge.tree.RevNode;
import org.pragmatica.structmerge.tree.Revision;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the child lists of one node. Lists hold node identities: ancestor identities for nodes
 * present in the ancestor, derived identities for nodes a side inserted.
 */
final class ChildListMerger {
    private final ClassMapping classes;
    private final EditScript left;
    private final EditScript right;

    ChildListMerger(ClassMapping classes, EditScript left, EditScript right) {
        this.classes = classes;
        this.left = left;
        this.right = right;
    }

    // === Ordered lists ===

    /**
     * Three-way merge of ordered lists. Ancestor entries kept in the same order by both sides are
     * synchronisation points; between them, a run changed by one side only takes that side's
     * version, identical changes apply once, anything else conflicts at the run's position.
     */
    List<Slot> mergeOrdered(RevNode parent, List<RevNode> base, List<RevNode> leftIds, List<RevNode> rightIds) {
        var inLeft = alignment(base, leftIds);
        var inRight = alignment(base, rightIds);
        var result = new ArrayList<Slot>();
        int baseFrom = 0;
        int leftFrom = 0;
        int rightFrom = 0;

        for (int i = 0; i < base.size(); i++) {
            if (inLeft[i] < 0 || inRight[i] < 0) {
                continue;
            }
            chunk(parent, baseFrom,
                  base.subList(baseFrom, i),
                  leftIds.subList(leftFrom, inLeft[i]),
                  rightIds.subList(rightFrom, inRight[i]),
                  result);
            result.add(new Slot.Keep(base.get(i)));
            baseFrom = i + 1;
            leftFrom = inLeft[i] + 1;
            rightFrom = inRight[i] + 1;
        }
        chunk(parent, baseFrom,
              base.subList(baseFrom, base.size()),
              leftIds.subList(leftFrom, leftIds.size()),
              rightIds.subList(rightFrom, rightIds.size()),
              result);
        return withoutDuplicates(result);
    }

    private void chunk(RevNode parent,
                       int position,
                       List<RevNode> base,
                       List<RevNode> leftChunk,
                       List<RevNode> rightChunk,
                       List<Slot> result) {
        if (base.isEmpty() && leftChunk.isEmpty() && rightChunk.isEmpty()) {
            return;
        }
        if (leftChunk.equals(base)) {
            take(parent, position, base, leftChunk, rightChunk, Revision.RIGHT, result);
        } else if (rightChunk.equals(base)) {
            take(parent, position, base, leftChunk, rightChunk, Revision.LEFT, result);
        } else if (sameContent(leftChunk, rightChunk)) {
            keepAll(leftChunk, result);
        } else {
            var kind = base.isEmpty() ? ConflictKind.INSERT_INSERT : ConflictKind.CONTENT;
            result.add(new Slot.Clash(chunkConflict(kind, parent, position, base, leftChunk, rightChunk)));
        }
    }

    /**
     * Take the run of {@code side}, unless it deletes a node the other side changed.
     */
    private void take(RevNode parent,
                      int position,
                      List<RevNode> base,
                      List<RevNode> leftChunk,
                      List<RevNode> rightChunk,
                      Revision side,
                      List<Slot> result) {
        var taken = side == Revision.LEFT ? leftChunk : rightChunk;
        for (var id : base) {
            if (!taken.contains(id) && deletedAgainstChange(id.index(), side)) {
                result.add(new Slot.Clash(chunkConflict(ConflictKind.DELETE_MODIFY, parent, position, base, leftChunk, rightChunk)));
                return;
            }
        }
        keepAll(taken, result);
    }

    private boolean sameContent(List<RevNode> leftChunk, List<RevNode> rightChunk) {
        if (leftChunk.size() != rightChunk.size()) {
            return false;
        }
        for (int i = 0; i < leftChunk.size(); i++) {
            var leftId = leftChunk.get(i);
            var rightId = rightChunk.get(i);
            if (leftId.equals(rightId)) {
                continue;
            }
            if (leftId.isAncestor() || rightId.isAncestor() || !classes.text(leftId).equals(classes.text(rightId))) {
                return false;
            }
        }
        return true;
    }

    private ConflictRegion chunkConflict(ConflictKind kind,
                                         RevNode parent,
                                         int position,
                                         List<RevNode> base,
                                         List<RevNode> leftChunk,
                                         List<RevNode> rightChunk) {
        return new ConflictRegion(kind,
                                  new ConflictAnchor.Position(parent, position),
                                  ConflictSide.of(base),
                                  ConflictSide.of(inRevision(leftChunk, Revision.LEFT)),
                                  ConflictSide.of(inRevision(rightChunk, Revision.RIGHT)));
    }

    /**
     * For every ancestor entry, its index in {@code derived} along a longest common subsequence,
     * or {@code -1}.
     */
    private static int[] alignment(List<RevNode> base, List<RevNode> derived) {
        var positions = new HashMap<RevNode, Integer>();
        for (int i = 0; i < base.size(); i++) {
            positions.put(base.get(i), i);
        }
        var inBase = new int[derived.size()];
        for (int j = 0; j < derived.size(); j++) {
            inBase[j] = positions.getOrDefault(derived.get(j), -1);
        }
        var result = new int[base.size()];
        Arrays.fill(result, -1);
        for (int j : Sequences.longestIncreasing(inBase)) {
            result[inBase[j]] = j;
        }
        return result;
    }

    private static List<Slot> withoutDuplicates(List<Slot> slots) {
        var seen = new HashSet<RevNode>();
        var result = new ArrayList<Slot>(slots.size());
        for (var slot : slots) {
            if (!(slot instanceof Slot.Keep keep) || seen.add(keep.id())) {
                result.add(slot);
            }
        }
        return result;
    }

    // === Unordered lists ===

    /**
     * Set merge of the elements of an unordered node. Deletions of either side apply, additions
     * of both sides are kept with left additions first where both sides add at the same place,
     * and an addition textually identical to one of the other side is kept once. The order of
     * the elements follows the left list, or the right one when left kept the elements as they
     * were.
     */
    List<Slot> mergeUnordered(List<RevNode> base, List<RevNode> leftIds, List<RevNode> rightIds) {
        if (leftIds.equals(base) && !rightIds.equals(base)) {
            return mergeUnordered(base, rightIds, Revision.RIGHT, leftIds);
        }
        return mergeUnordered(base, leftIds, Revision.LEFT, rightIds);
    }

    private List<Slot> mergeUnordered(List<RevNode> base, List<RevNode> leading, Revision leadingSide, List<RevNode> following) {
        var followingSide = leadingSide.opposite();
        var baseSet = Set.copyOf(base);
        var leadingSet = Set.copyOf(leading);
        var followingSet = Set.copyOf(following);
        var leadingAdditions = new HashSet<RevNode>();
        var result = new ArrayList<Slot>();

        for (var id : leading) {
            if (!baseSet.contains(id)) {
                result.add(new Slot.Keep(id));
                leadingAdditions.add(id);
            } else if (followingSet.contains(id)) {
                result.add(new Slot.Keep(id));
            } else if (deletedAgainstChange(id.index(), followingSide)) {
                result.add(new Slot.Clash(deleteModify(id)));
            }
        }
        for (int i = 0; i < base.size(); i++) {
            var id = base.get(i);
            if (!leadingSet.contains(id) && followingSet.contains(id) && deletedAgainstChange(id.index(), leadingSide)) {
                result.add(insertionPoint(result, base, i), new Slot.Clash(deleteModify(id)));
            }
        }

        int cursor = 0;
        for (var id : following) {
            if (baseSet.contains(id)) {
                int index = indexOf(result, id);
                if (index >= 0) {
                    cursor = index + 1;
                }
                continue;
            }
            if (duplicatesAddition(id, leadingAdditions)) {
                continue;
            }
            while (cursor < result.size() && isAddition(result.get(cursor), leadingAdditions)) {
                cursor++;
            }
            result.add(cursor++, new Slot.Keep(id));
        }
        return result;
    }

    private boolean duplicatesAddition(RevNode id, Set<RevNode> additions) {
        var text = classes.text(id);
        return additions.stream().anyMatch(addition -> classes.text(addition).equals(text));
    }

    private static boolean isAddition(Slot slot, Set<RevNode> additions) {
        return slot instanceof Slot.Keep keep && additions.contains(keep.id());
    }

    private static int insertionPoint(List<Slot> result, List<RevNode> base, int baseIndex) {
        for (int i = baseIndex - 1; i >= 0; i--) {
            int index = indexOf(result, base.get(i));
            if (index >= 0) {
                return index + 1;
            }
        }
        return 0;
    }

    static int indexOf(List<Slot> slots, RevNode id) {
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i) instanceof Slot.Keep keep && keep.id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    // === Shared ===

    /**
     * Whether {@code deleting} removed the ancestor node while the other side changed or moved it.
     */
    private boolean deletedAgainstChange(int ancestorNode, Revision deleting) {
        var deleter = deleting == Revision.LEFT ? left : right;
        var other = deleting == Revision.LEFT ? right : left;
        return deleter.partner(ancestorNode) < 0 && other.changes(ancestorNode);
    }

    ConflictRegion deleteModify(RevNode id) {
        int node = id.index();
        return new ConflictRegion(ConflictKind.DELETE_MODIFY,
                                  new ConflictAnchor.Node(id),
                                  new ConflictSide.Subtree(id),
                                  sideOf(left, node),
                                  sideOf(right, node));
    }

    static ConflictSide sideOf(EditScript script, int ancestorNode) {
        int partner = script.partner(ancestorNode);
        return partner < 0 ? ConflictSide.ABSENT : new ConflictSide.Subtree(RevNode.of(script.side(), partner));
    }

    private List<RevNode> inRevision(List<RevNode> ids, Revision side) {
        var script = side == Revision.LEFT ? left : right;
        var result = new ArrayList<RevNode>(ids.size());
        for (var id : ids) {
            result.add(id.isAncestor() ? RevNode.of(side, script.partner(id.index())) : id);
        }
        return result;
    }

    private static void keepAll(List<RevNode> ids, List<Slot> result) {
        for (var id : ids) {
            result.add(new Slot.Keep(id));
        }
    }
}
