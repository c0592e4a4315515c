package org.pragmatica.structmerge.diff;

import org.junit.jupiter.api.Test;
import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.lang.LanguageProfile;
import org.pragmatica.structmerge.lang.Languages;
import org.pragmatica.structmerge.matching.TreeMatcher;
import org.pragmatica.structmerge.tree.RevNode;
import org.pragmatica.structmerge.tree.Revision;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class StructuralDifferTest {

    private static final LanguageProfile JSON = Languages.json();

    private static EditScript diff(String ancestorText, String derivedText) throws ParseException {
        var ancestor = JSON.parse(ancestorText, Revision.ANCESTOR);
        var derived = JSON.parse(derivedText, Revision.LEFT);
        var matching = TreeMatcher.withDefaults().match(ancestor, derived);
        return StructuralDiffer.create().diff(ancestor, derived, matching);
    }

    @Test
    void diff_unchangedText_isEmpty() throws ParseException {
        var script = diff("{\"a\": [1, 2]}", "{\"a\": [1, 2]}");

        assertTrue(script.isEmpty());
        assertEquals(Revision.LEFT, script.side());
        assertFalse(script.changes(1));
    }

    @Test
    void diff_changedLeaf_producesSingleUpdate() throws ParseException {
        var script = diff("{\"a\": 1}", "{\"a\": 2}");

        assertEquals(List.of(new EditOp.Update(RevNode.ancestor(6), "1", "2")), script.operations());
        assertTrue(script.updateOf(6).isPresent());
        assertTrue(script.changes(6));
        assertFalse(script.changes(4));
        assertFalse(script.relocates(6));
    }

    @Test
    void diff_addedMember_insertsUnderObject() throws ParseException {
        var script = diff("{\"a\": 1, \"b\": 2}", "{\"a\": 1, \"b\": 2, \"c\": 3}");

        assertEquals(List.of(new EditOp.Insert(RevNode.ancestor(1), 4, RevNode.of(Revision.LEFT, 12)),
                             new EditOp.Insert(RevNode.ancestor(1), 5, RevNode.of(Revision.LEFT, 13))),
                     script.operations());
        assertThat(script.insertsUnder(1)).hasSize(2);
        assertThat(script.insertsUnder(3)).isEmpty();
    }

    @Test
    void diff_removedMember_deletesEveryNodeOfIt() throws ParseException {
        var script = diff("{\"a\": 1, \"b\": 2, \"c\": 3}", "{\"a\": 1, \"b\": 2}");

        assertThat(script.operations()).allMatch(EditOp.Delete.class::isInstance);
        assertThat(script.operations()).extracting(op -> op.anchor().index())
                                       .containsExactly(12, 13, 14, 15, 16);
        assertTrue(script.isDeleted(13));
        assertEquals(-1, script.partner(13));
        assertFalse(script.changes(13));
    }

    @Test
    void diff_reorderedArray_movesElementOutOfCommonOrder() throws ParseException {
        var script = diff("[1, 2, 3]", "[3, 1, 2]");

        assertEquals(List.of(new EditOp.Insert(RevNode.ancestor(1), 2, RevNode.of(Revision.LEFT, 4)),
                             new EditOp.Delete(RevNode.ancestor(6)),
                             new EditOp.Move(RevNode.ancestor(7), RevNode.ancestor(1), 1)),
                     script.operations());
        assertTrue(script.moveOf(7).isPresent());
        assertFalse(script.relocates(7));
        assertTrue(script.changes(7));
    }

    @Test
    void diff_operationsAreOrderedByAnchor() throws ParseException {
        var script = diff("{\"a\": [1, 2], \"b\": {\"c\": 3}}", "{\"b\": {\"c\": 4, \"d\": 5}, \"a\": [2]}");

        var anchors = script.operations().stream().map(op -> op.anchor().index()).toList();
        assertThat(anchors).isSorted();
    }

    @Test
    void diff_foreignMatching_isRejected() throws ParseException {
        var ancestor = JSON.parse("[1]", Revision.ANCESTOR);
        var derived = JSON.parse("[2]", Revision.LEFT);
        var matching = TreeMatcher.withDefaults().match(ancestor, derived);
        var other = JSON.parse("[1]", Revision.ANCESTOR);

        assertThrows(IllegalArgumentException.class, () -> StructuralDiffer.create().diff(other, derived, matching));
    }
}
