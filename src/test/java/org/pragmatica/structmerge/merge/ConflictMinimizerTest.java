package org.pragmatica.structmerge.merge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pragmatica.structmerge.diff.StructuralDiffer;
import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.lang.LanguageProfile;
import org.pragmatica.structmerge.lang.Languages;
import org.pragmatica.structmerge.matching.ClassMapping;
import org.pragmatica.structmerge.matching.TreeMatcher;
import org.pragmatica.structmerge.tree.RevNode;
import org.pragmatica.structmerge.tree.Revision;
import org.pragmatica.structmerge.tree.SyntaxTree;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ConflictMinimizerTest {

    private static final LanguageProfile JSON = Languages.json();

    private SyntaxTree ancestor;
    private SyntaxTree left;
    private SyntaxTree right;
    private ClassMapping classes;

    @BeforeEach
    void setUp() throws ParseException {
        ancestor = JSON.parse("{\"a\": 1, \"b\": 2}", Revision.ANCESTOR);
        left = JSON.parse("{\"a\": 1, \"b\": 3}", Revision.LEFT);
        right = JSON.parse("{\"a\": 1, \"b\": 4}", Revision.RIGHT);
        var matcher = TreeMatcher.withDefaults();
        classes = ClassMapping.of(matcher.match(ancestor, left), matcher.match(ancestor, right));
    }

    private static ConflictRegion wholeObject() {
        return new ConflictRegion(ConflictKind.CONTENT,
                                  new ConflictAnchor.Node(RevNode.ancestor(1)),
                                  new ConflictSide.Subtree(RevNode.ancestor(1)),
                                  new ConflictSide.Subtree(RevNode.of(Revision.LEFT, 1)),
                                  new ConflictSide.Subtree(RevNode.of(Revision.RIGHT, 1)));
    }

    // === Subtree narrowing ===

    @Test
    void minimize_descendsToTheOnlyDifferingLeaf() {
        var region = ConflictMinimizer.create(classes).minimize(wholeObject());

        assertEquals(ConflictKind.CONTENT, region.kind());
        assertEquals(new ConflictAnchor.Node(RevNode.ancestor(11)), region.anchor());
        assertEquals(new ConflictSide.Subtree(RevNode.ancestor(11)), region.base());
        assertEquals(new ConflictSide.Subtree(RevNode.of(Revision.LEFT, 11)), region.left());
        assertEquals(new ConflictSide.Subtree(RevNode.of(Revision.RIGHT, 11)), region.right());
    }

    @Test
    void narrow_wrapsRemovedContextInLayoutNodes() {
        var narrowing = ConflictMinimizer.create(classes).narrow(wholeObject());

        assertThat(narrowing.replacement()).hasSize(1);
        var object = (MergedNode.Mixed) narrowing.replacement().get(0);
        assertEquals(RevNode.of(Revision.LEFT, 1), object.layout());
        assertThat(object.children()).hasSize(5);
        assertEquals(new MergedNode.Exact(RevNode.of(Revision.LEFT, 2)), object.children().get(0));

        var member = (MergedNode.Mixed) object.children().get(3);
        assertEquals(RevNode.of(Revision.LEFT, 8), member.layout());
        assertEquals(List.of(new MergedNode.Exact(RevNode.of(Revision.LEFT, 9)),
                             new MergedNode.Exact(RevNode.of(Revision.LEFT, 10)),
                             new MergedNode.Conflict(narrowing.region())),
                     member.children());
    }

    @Test
    void minimize_isIdempotent() {
        var minimizer = ConflictMinimizer.create(classes);
        var once = minimizer.minimize(wholeObject());

        assertEquals(once, minimizer.minimize(once));
        assertEquals(List.of(new MergedNode.Conflict(once)), minimizer.narrow(once).replacement());
    }

    @Test
    void minimize_leafConflict_staysUnchanged() {
        var region = new ConflictRegion(ConflictKind.UPDATE_UPDATE,
                                        new ConflictAnchor.Node(RevNode.ancestor(11)),
                                        new ConflictSide.Subtree(RevNode.ancestor(11)),
                                        new ConflictSide.Subtree(RevNode.of(Revision.LEFT, 11)),
                                        new ConflictSide.Subtree(RevNode.of(Revision.RIGHT, 11)));

        assertEquals(region, ConflictMinimizer.create(classes).minimize(region));
    }

    @Test
    void minimize_deleteAgainstModify_staysUnchanged() {
        var region = new ConflictRegion(ConflictKind.DELETE_MODIFY,
                                        new ConflictAnchor.Node(RevNode.ancestor(8)),
                                        new ConflictSide.Subtree(RevNode.ancestor(8)),
                                        ConflictSide.ABSENT,
                                        new ConflictSide.Subtree(RevNode.of(Revision.RIGHT, 8)));

        assertEquals(region, ConflictMinimizer.create(classes).minimize(region));
    }

    // === Sequence narrowing ===

    @Test
    void minimize_sequenceSides_dropCommonPrefix() throws ParseException {
        var base = JSON.parse("[1]", Revision.ANCESTOR);
        var leftTree = JSON.parse("[1, 2]", Revision.LEFT);
        var rightTree = JSON.parse("[1, 3]", Revision.RIGHT);
        var matcher = TreeMatcher.withDefaults();
        var differ = StructuralDiffer.create();
        var leftScript = differ.diff(base, leftTree, matcher.match(base, leftTree));
        var rightScript = differ.diff(base, rightTree, matcher.match(base, rightTree));
        var merged = ThreeWayMerger.create().merge(base, leftScript, rightScript);

        var minimized = ConflictMinimizer.create(merged.tree().classes()).minimize(merged);

        assertThat(minimized.regions()).hasSize(1);
        var region = minimized.regions().get(0);
        assertEquals(ConflictKind.INSERT_INSERT, region.kind());
        assertEquals(new ConflictSide.Subtree(RevNode.of(Revision.LEFT, 5)), region.left());
        assertEquals(new ConflictSide.Subtree(RevNode.of(Revision.RIGHT, 5)), region.right());
        assertTrue(region.base().isAbsent());
        assertEquals(new ConflictAnchor.Node(RevNode.of(Revision.LEFT, 5)), region.anchor());
    }

    @Test
    void minimize_cleanResult_isReturnedAsIs() throws ParseException {
        var base = JSON.parse("[1]", Revision.ANCESTOR);
        var leftTree = JSON.parse("[1]", Revision.LEFT);
        var rightTree = JSON.parse("[1]", Revision.RIGHT);
        var matcher = TreeMatcher.withDefaults();
        var differ = StructuralDiffer.create();
        var merged = ThreeWayMerger.create().merge(base,
                                                   differ.diff(base, leftTree, matcher.match(base, leftTree)),
                                                   differ.diff(base, rightTree, matcher.match(base, rightTree)));

        assertSame(merged, ConflictMinimizer.create(merged.tree().classes()).minimize(merged));
    }
}
