package org.pragmatica.structmerge;

import org.junit.jupiter.api.Test;
import org.pragmatica.structmerge.error.MergeError;
import org.pragmatica.structmerge.lang.LanguageRegistry;
import org.pragmatica.structmerge.lang.Languages;
import org.pragmatica.structmerge.merge.ConflictKind;
import org.pragmatica.structmerge.parser.ParserConfig;
import org.pragmatica.structmerge.tree.Revision;
import org.pragmatica.structmerge.tree.SourceLocation;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class StructuralMergeTest {

    private static final String BUILD_BASE = """
        load("@rules_rust//rust:defs.bzl", "rust_library")

        rust_library(
            name = "lib",
            srcs = ["src/lib.rs"],
            deps = [
                "@crates//:log",
                "@crates//:serde",
            ],
        )""";

    private static final String BUILD_LEFT = """
        load("@rules_rust//rust:defs.bzl", "rust_library")

        rust_library(
            name = "lib",
            srcs = ["src/lib.rs"],
            deps = [
                "@crates//:anyhow",
                "@crates//:log",
                "@crates//:serde",
            ],
        )""";

    private static final String BUILD_RIGHT = """
        load("@rules_rust//rust:defs.bzl", "rust_library")
        load("@rules_cc//cc:defs.bzl", "cc_library")

        rust_library(
            name = "lib",
            srcs = ["src/lib.rs"],
            deps = [
                "@crates//:log",
                "@crates//:serde",
            ],
        )""";

    private static MergeOutcome.Merged merged(MergeOutcome outcome) {
        assertThat(outcome).isInstanceOf(MergeOutcome.Merged.class);
        return (MergeOutcome.Merged) outcome;
    }

    private static MergeError unavailable(MergeOutcome outcome) {
        assertThat(outcome).isInstanceOf(MergeOutcome.StructuralMergeUnavailable.class);
        return ((MergeOutcome.StructuralMergeUnavailable) outcome).error();
    }

    // === Clean merges ===

    @Test
    void merge_buildFileChangedOnBothSides_combinesChanges() {
        var outcome = merged(StructuralMerge.withDefaults().merge(Languages.STARLARK, BUILD_BASE, BUILD_LEFT, BUILD_RIGHT));

        assertTrue(outcome.isClean());
        assertEquals("""
                     load("@rules_rust//rust:defs.bzl", "rust_library")
                     load("@rules_cc//cc:defs.bzl", "cc_library")

                     rust_library(
                         name = "lib",
                         srcs = ["src/lib.rs"],
                         deps = [
                             "@crates//:anyhow",
                             "@crates//:log",
                             "@crates//:serde",
                         ],
                     )""", outcome.mergedText());
        assertEquals(new MergeStatistics(0, 0, false, MergeStatistics.STRUCTURED), outcome.statistics());
    }

    @Test
    void merge_dependenciesAddedOnBothSides_keepsBothLeftFirst() {
        var outcome = merged(StructuralMerge.withDefaults()
                                            .merge(Languages.STARLARK,
                                                   "deps = [\"a\", \"b\"]\n",
                                                   "deps = [\"a\", \"b\", \"c\"]\n",
                                                   "deps = [\"a\", \"b\", \"d\"]\n"));

        assertTrue(outcome.isClean());
        assertEquals("deps = [\"a\", \"b\", \"c\", \"d\"]\n", outcome.mergedText());
        assertFalse(outcome.statistics().hasAdditionalIssues());
    }

    @Test
    void merge_rightOnlyReorder_takesRightText() {
        var outcome = merged(StructuralMerge.withDefaults()
                                            .merge(Languages.STARLARK,
                                                   "y = 1\nx = [\"a\", \"b\"]",
                                                   "y = 1\nx = [\"a\", \"b\"]",
                                                   "y = 1\nx = [\"b\", \"a\"]"));

        assertTrue(outcome.isClean());
        assertEquals("y = 1\nx = [\"b\", \"a\"]", outcome.mergedText());
    }

    @Test
    void merge_unchangedRevisions_returnsInputVerbatim() {
        var text = "{\n  \"name\" : \"x\",\n  \"tags\": [ ]\n}\n";

        var outcome = merged(StructuralMerge.withDefaults().merge(Languages.JSON, text, text, text));

        assertEquals(text, outcome.mergedText());
        assertEquals(text, outcome.text().orElseThrow());
        assertTrue(outcome.statistics().isClean());
    }

    @Test
    void merge_parallelExecutor_producesSameText() {
        var pool = Executors.newFixedThreadPool(3);
        try {
            var sequential = StructuralMerge.withDefaults();
            var parallel = StructuralMerge.builder().executor(pool).build();

            var expected = merged(sequential.merge(Languages.STARLARK, BUILD_BASE, BUILD_LEFT, BUILD_RIGHT));
            var actual = merged(parallel.merge(Languages.STARLARK, BUILD_BASE, BUILD_LEFT, BUILD_RIGHT));

            assertEquals(expected.mergedText(), actual.mergedText());
        } finally {
            pool.shutdownNow();
        }
    }

    // === Conflicts ===

    @Test
    void merge_conflictingLeafChanges_reportsMarkersAndStatistics() {
        var outcome = merged(StructuralMerge.withDefaults()
                                            .merge(Languages.JSON,
                                                   "{\"a\": 1, \"b\": 2}",
                                                   "{\"a\": 10, \"b\": 2}",
                                                   "{\"a\": 20, \"b\": 2}"));

        assertFalse(outcome.isClean());
        assertEquals("{\"a\":\n<<<<<<< LEFT\n10\n||||||| BASE\n1\n=======\n20\n>>>>>>> RIGHT\n, \"b\": 2}",
                     outcome.mergedText());
        assertEquals(1, outcome.statistics().conflictCount());
        assertEquals(5, outcome.statistics().conflictMass());
        assertFalse(outcome.statistics().hasAdditionalIssues());
        assertEquals(ConflictKind.UPDATE_UPDATE, outcome.result().regions().get(0).kind());
    }

    @Test
    void merge_conflictWithWindowsLineEnds_keepsThemOnMarkerLines() {
        var outcome = merged(StructuralMerge.withDefaults()
                                            .merge(Languages.JSON,
                                                   "{\r\n  \"a\": 1\r\n}\r\n",
                                                   "{\r\n  \"a\": 2\r\n}\r\n",
                                                   "{\r\n  \"a\": 3\r\n}\r\n"));

        assertEquals("{\r\n  \"a\":\r\n<<<<<<< LEFT\r\n2\r\n||||||| BASE\r\n1\r\n=======\r\n3\r\n>>>>>>> RIGHT\r\n}\r\n",
                     outcome.mergedText());
        assertThat(outcome.mergedText().replace("\r\n", "")).doesNotContain("\n");
    }

    @Test
    void merge_configuredMarkers_areUsed() {
        var config = MergeConfig.builder()
                                .conflictMarkerSize(3)
                                .diff3(false)
                                .revisionNames("ours", "base", "theirs")
                                .build();
        var merge = StructuralMerge.builder().config(config).build();

        var outcome = merged(merge.merge(Languages.JSON, "[1]", "[2]", "[3]"));

        assertEquals("[\n<<< ours\n2\n===\n3\n>>> theirs\n]", outcome.mergedText());
    }

    @Test
    void merge_sameKeyAddedWithDifferentValues_reportsAdditionalIssue() {
        var outcome = merged(StructuralMerge.withDefaults()
                                            .merge(Languages.JSON,
                                                   "{\"a\": 1}",
                                                   "{\"a\": 1, \"c\": 1}",
                                                   "{\"a\": 1, \"c\": 2}"));

        assertTrue(outcome.isClean());
        assertTrue(outcome.statistics().hasAdditionalIssues());
        assertThat(outcome.mergedText()).contains("\"c\": 1").contains("\"c\": 2");
    }

    @Test
    void revisionsReparse_sideThatDoesNotParse_isAnIssue() {
        var merge = StructuralMerge.withDefaults();
        var text = "[1,\n<<<<<<< LEFT\n2,\n||||||| BASE\n3\n=======\n4\n>>>>>>> RIGHT\n]";

        assertFalse(merge.revisionsReparse(Languages.json(), text));
        assertTrue(merge.revisionsReparse(Languages.json(), text.replace("2,", "2")));
    }

    @Test
    void revisionsReparse_sideWithDuplicateKey_isAnIssue() {
        var text = "{\"a\": 1,\n<<<<<<< LEFT\n\"a\": 2\n||||||| BASE\n\"b\": 2\n=======\n\"b\": 3\n>>>>>>> RIGHT\n}";

        assertFalse(StructuralMerge.withDefaults().revisionsReparse(Languages.json(), text));
    }

    // === Solving conflicted text ===

    @Test
    void solve_lineBasedConflictOnNeighbouringMembers_resolvesIt() {
        var conflicted = """
            {
            <<<<<<< LEFT
              "a": 10,
              "b": 2
            ||||||| BASE
              "a": 1,
              "b": 2
            =======
              "a": 1,
              "b": 20
            >>>>>>> RIGHT
            }""";

        var outcome = merged(StructuralMerge.withDefaults().solve(Languages.JSON, conflicted));

        assertTrue(outcome.isClean());
        assertEquals("{\n  \"a\": 10,\n  \"b\": 20\n}", outcome.mergedText());
        assertEquals(MergeStatistics.STRUCTURED, outcome.statistics().method());
    }

    @Test
    void solve_structuredResultWithDuplicateKey_keepsOriginalConflict() {
        var conflicted = """
            {
            <<<<<<< LEFT
              "a": 1,
              "c": 1
            ||||||| BASE
              "a": 1
            =======
              "a": 1,
              "c": 2
            >>>>>>> RIGHT
            }""";

        var error = unavailable(StructuralMerge.withDefaults().solve(Languages.JSON, conflicted));

        assertEquals(new MergeError.NoBetterSolution(1), error);
    }

    @Test
    void solve_twoWayMarkers_areRejected() {
        var conflicted = "[\n<<<<<<< LEFT\n1\n=======\n2\n>>>>>>> RIGHT\n]";

        var error = unavailable(StructuralMerge.withDefaults().solve(Languages.JSON, conflicted));

        assertThat(error).isInstanceOf(MergeError.UnreadableConflicts.class);
        assertThat(error.message()).contains("no base section");
    }

    @Test
    void solve_unknownLanguage_isUnavailable() {
        var error = unavailable(StructuralMerge.withDefaults().solve("cobol", "x"));

        assertEquals(new MergeError.UnsupportedLanguage("cobol"), error);
    }

    @Test
    void selectBest_prefersLeastMassWithoutIssues() {
        var structured = new MergeStatistics(1, 5, true, MergeStatistics.STRUCTURED);
        var original = new MergeStatistics(1, 40, false, MergeStatistics.FROM_PARSED_ORIGINAL);
        var other = new MergeStatistics(2, 30, false, "other");

        assertSame(other, StructuralMerge.selectBest(List.of(structured, original, other)));
    }

    @Test
    void selectBest_allWithIssues_takesLeastMass() {
        var structured = new MergeStatistics(1, 5, true, MergeStatistics.STRUCTURED);
        var original = new MergeStatistics(1, 40, true, MergeStatistics.FROM_PARSED_ORIGINAL);

        assertSame(structured, StructuralMerge.selectBest(List.of(original, structured)));
        assertThrows(IllegalArgumentException.class, () -> StructuralMerge.selectBest(List.of()));
    }

    // === Unavailable merges ===

    @Test
    void merge_deeplyNestedRevision_failsToParseInsteadOfOverflowing() {
        int depth = 1000;
        var deep = "[".repeat(depth) + "]".repeat(depth);

        var error = unavailable(StructuralMerge.withDefaults().merge(Languages.JSON, "[]", deep, "[]"));

        assertThat(error).isInstanceOf(MergeError.ParseFailure.class);
        assertEquals(Revision.LEFT, ((MergeError.ParseFailure) error).revision());
        assertThat(error.message()).contains("nested deeper than " + ParserConfig.DEFAULT_MAX_RULE_DEPTH);
    }

    @Test
    void merge_languageWithShallowNestingLimit_rejectsModerateNesting() {
        var shallow = Languages.json().withParserConfig(ParserConfig.DEFAULT.withMaxRuleDepth(8));

        var error = unavailable(StructuralMerge.withDefaults().merge(shallow, "[]", "[[[[[[1]]]]]]", "[]"));

        assertThat(error.message()).contains("nested deeper than 8");
        assertTrue(StructuralMerge.withDefaults().merge(shallow, "[]", "[1]", "[]") instanceof MergeOutcome.Merged);
    }

    @Test
    void roundTripMismatch_renderedTextDiverges_pointsAtFirstDifference() throws Exception {
        var tree = Languages.json().parse("[1, 2]\n", Revision.RIGHT);

        var mismatch = StructuralMerge.roundTripMismatch(tree, "[1, 3]\n");

        assertEquals(Optional.of(new MergeError.RoundTripMismatch(Revision.RIGHT, SourceLocation.of("[1, 2]\n", 4))),
                     mismatch);
        assertThat(mismatch.orElseThrow().message()).startsWith("Rendering right revision diverges");
        assertEquals(Optional.empty(), StructuralMerge.roundTripMismatch(tree, "[1, 2]\n"));
    }

    @Test
    void merge_unknownLanguage_isUnavailable() {
        var outcome = StructuralMerge.withDefaults().merge("cobol", "a", "b", "c");

        assertEquals(new MergeError.UnsupportedLanguage("cobol"), unavailable(outcome));
        assertTrue(outcome.text().isEmpty());
    }

    @Test
    void merge_unparsableRevision_reportsWhichOne() {
        var error = unavailable(StructuralMerge.withDefaults().merge(Languages.JSON, "[1]", "[1", "[2]"));

        assertThat(error).isInstanceOf(MergeError.ParseFailure.class);
        assertEquals(Revision.LEFT, ((MergeError.ParseFailure) error).revision());
        assertThat(error.message()).startsWith("Failed to parse left revision");
    }

    @Test
    void merge_registryWithoutLanguage_isUnavailable() {
        var merge = StructuralMerge.builder().registry(LanguageRegistry.empty().register(Languages.json())).build();

        var error = unavailable(merge.merge(Languages.STARLARK, BUILD_BASE, BUILD_LEFT, BUILD_RIGHT));

        assertThat(error.message()).contains("starlark");
    }
}
