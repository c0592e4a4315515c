package org.pragmatica.structmerge.merge;

import org.junit.jupiter.api.Test;
import org.pragmatica.structmerge.ParsedMerge;
import org.pragmatica.structmerge.diff.EditScript;
import org.pragmatica.structmerge.diff.StructuralDiffer;
import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.lang.LanguageProfile;
import org.pragmatica.structmerge.lang.Languages;
import org.pragmatica.structmerge.matching.ClassMapping;
import org.pragmatica.structmerge.matching.TreeMatcher;
import org.pragmatica.structmerge.render.MarkerStyle;
import org.pragmatica.structmerge.render.SourceRenderer;
import org.pragmatica.structmerge.tree.Revision;
import org.pragmatica.structmerge.tree.SyntaxTree;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class MoveResolverTest {

    private static final LanguageProfile JSON = Languages.json();

    private static final String NESTED_BASE = "{\"a\": {\"x\": [1, 2, 3, 4]}, \"b\": {}, \"c\": {}}";
    private static final String MOVED_TO_B = "{\"a\": {}, \"b\": {\"x\": [1, 2, 3, 4]}, \"c\": {}}";
    private static final String MOVED_TO_C = "{\"a\": {}, \"b\": {}, \"c\": {\"x\": [1, 2, 3, 4]}}";

    private static final String LISTS_BASE = "[[\"a1\", \"a2\", \"a3\"], [\"b1\", \"b2\", \"b3\"]]";
    private static final String B_INSIDE_A = "[[\"a1\", \"a2\", \"a3\", [\"b1\", \"b2\", \"b3\"]]]";
    private static final String A_INSIDE_B = "[[\"b1\", \"b2\", \"b3\", [\"a1\", \"a2\", \"a3\"]]]";

    private record Scripts(SyntaxTree ancestor, EditScript left, EditScript right) {
        ClassMapping classes() {
            return ClassMapping.of(left.matching(), right.matching());
        }
    }

    private static Scripts scripts(String base, String left, String right) throws ParseException {
        var ancestor = JSON.parse(base, Revision.ANCESTOR);
        return new Scripts(ancestor,
                           script(ancestor, JSON.parse(left, Revision.LEFT)),
                           script(ancestor, JSON.parse(right, Revision.RIGHT)));
    }

    private static EditScript script(SyntaxTree ancestor, SyntaxTree derived) {
        var matching = TreeMatcher.withDefaults().match(ancestor, derived).verify();
        return StructuralDiffer.create().diff(ancestor, derived, matching);
    }

    private static Map<Integer, ConflictKind> regions(String base, String left, String right) throws ParseException {
        var scripts = scripts(base, left, right);
        return MoveResolver.resolve(scripts.classes(), scripts.left(), scripts.right());
    }

    private static MergeResult merge(String base, String left, String right) throws ParseException {
        var scripts = scripts(base, left, right);
        var merged = ThreeWayMerger.create().merge(scripts.ancestor(), scripts.left(), scripts.right());
        return ConflictMinimizer.create(merged.tree().classes()).minimize(merged);
    }

    private static String render(MergeResult result) {
        return SourceRenderer.withDefaults().render(result);
    }

    private static String withoutWhitespace(String text) {
        return text.replaceAll("\\s", "");
    }

    /**
     * Taking one side of every conflict must give back that revision's content.
     */
    private static void assertSidesRecoverable(String rendered, String left, String right) throws ParseException {
        var parsed = ParsedMerge.parse(rendered, MarkerStyle.DEFAULT);

        assertEquals(withoutWhitespace(left), withoutWhitespace(parsed.reconstruct(Revision.LEFT)));
        assertEquals(withoutWhitespace(right), withoutWhitespace(parsed.reconstruct(Revision.RIGHT)));
    }

    // === Moves of one side ===

    @Test
    void resolve_moveOnOneSide_reportsNothing() throws ParseException {
        assertThat(regions(NESTED_BASE, MOVED_TO_B, NESTED_BASE)).isEmpty();
    }

    @Test
    void merge_moveOnOneSide_appliesMoveAndOtherChanges() throws ParseException {
        var base = "{\"a\": {\"x\": [1, 2, 3, 4]}, \"b\": {}}";
        var left = "{\"a\": {}, \"b\": {\"x\": [1, 2, 3, 4]}}";
        var right = "{\"a\": {\"x\": [1, 2, 3, 4]}, \"b\": {}, \"d\": 1}";

        var result = merge(base, left, right);

        assertTrue(result.isClean());
        assertEquals("{\"a\": {}, \"b\": {\"x\": [1, 2, 3, 4]}, \"d\": 1}", render(result));
    }

    @Test
    void merge_sameMoveOnBothSides_appliesOnce() throws ParseException {
        assertThat(regions(NESTED_BASE, MOVED_TO_B, MOVED_TO_B)).isEmpty();

        var result = merge(NESTED_BASE, MOVED_TO_B, MOVED_TO_B);

        assertTrue(result.isClean());
        assertEquals(MOVED_TO_B, render(result));
    }

    // === Moves to different places ===

    @Test
    void resolve_sameNodeMovedToDifferentParents_reportsOneRegionAtCommonObject() throws ParseException {
        var ancestor = JSON.parse(NESTED_BASE, Revision.ANCESTOR);

        var regions = regions(NESTED_BASE, MOVED_TO_B, MOVED_TO_C);

        assertThat(regions).hasSize(1);
        var entry = regions.entrySet().iterator().next();
        assertEquals(ConflictKind.MOVE_MOVE, entry.getValue());
        assertEquals("Object", ancestor.kind(entry.getKey()));
        assertEquals(ancestor.child(ancestor.root(), 0), entry.getKey());
    }

    @Test
    void merge_sameNodeMovedToDifferentParents_keepsEveryValueOnce() throws ParseException {
        var result = merge(NESTED_BASE, MOVED_TO_B, MOVED_TO_C);

        assertFalse(result.isClean());
        assertThat(result.regions()).hasSize(1);
        assertEquals(ConflictKind.MOVE_MOVE, result.regions().get(0).kind());
        assertSidesRecoverable(render(result), MOVED_TO_B, MOVED_TO_C);
    }

    // === Cycles ===

    @Test
    void resolve_listsNestedIntoEachOther_reportsOneCyclicRegion() throws ParseException {
        var ancestor = JSON.parse(LISTS_BASE, Revision.ANCESTOR);

        var regions = regions(LISTS_BASE, B_INSIDE_A, A_INSIDE_B);

        assertThat(regions).hasSize(1);
        var entry = regions.entrySet().iterator().next();
        assertEquals(ConflictKind.CYCLIC_MOVE, entry.getValue());
        assertEquals("Array", ancestor.kind(entry.getKey()));
        assertEquals(ancestor.child(ancestor.root(), 0), entry.getKey());
    }

    @Test
    void merge_listsNestedIntoEachOther_keepsEachListOnce() throws ParseException {
        var result = merge(LISTS_BASE, B_INSIDE_A, A_INSIDE_B);

        assertThat(result.regions()).hasSize(1);
        var rendered = render(result);
        var parsed = ParsedMerge.parse(rendered, MarkerStyle.DEFAULT);
        for (var side : new Revision[]{Revision.LEFT, Revision.RIGHT}) {
            var text = parsed.reconstruct(side);
            assertThat(text.split("\"a1\"", -1)).hasSize(2);
            assertThat(text.split("\"b1\"", -1)).hasSize(2);
        }
        assertSidesRecoverable(rendered, B_INSIDE_A, A_INSIDE_B);
    }
}
