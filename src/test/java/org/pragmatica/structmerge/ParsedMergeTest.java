package org.pragmatica.structmerge;

import org.junit.jupiter.api.Test;
import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.render.MarkerStyle;
import org.pragmatica.structmerge.tree.Revision;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ParsedMergeTest {

    private static final String CONFLICTED = """
        [
          1,
        <<<<<<< LEFT
          2,
          3
        ||||||| BASE
          2
        =======
          4
        >>>>>>> RIGHT
        ]
        """;

    @Test
    void parse_diff3Block_splitsTextAndConflict() throws ParseException {
        var parsed = ParsedMerge.parse(CONFLICTED, MarkerStyle.DEFAULT);

        assertThat(parsed.sections()).containsExactly(new ParsedMerge.Section.Text("[\n  1,\n"),
                                                      new ParsedMerge.Section.Conflict("  2,\n  3\n", "  2\n", "  4\n"),
                                                      new ParsedMerge.Section.Text("]\n"));
        assertEquals(1, parsed.conflictCount());
        assertEquals(17, parsed.conflictMass());
    }

    @Test
    void reconstruct_takesOneSideOfEveryConflict() throws ParseException {
        var parsed = ParsedMerge.parse(CONFLICTED, MarkerStyle.DEFAULT);

        assertEquals("[\n  1,\n  2,\n  3\n]\n", parsed.reconstruct(Revision.LEFT));
        assertEquals("[\n  1,\n  2\n]\n", parsed.reconstruct(Revision.ANCESTOR));
        assertEquals("[\n  1,\n  4\n]\n", parsed.reconstruct(Revision.RIGHT));
    }

    @Test
    void parse_textWithoutMarkers_isOneTextSection() throws ParseException {
        var parsed = ParsedMerge.parse("{\"a\": 1}", MarkerStyle.DEFAULT);

        assertEquals(0, parsed.conflictCount());
        assertEquals(0, parsed.conflictMass());
        assertEquals("{\"a\": 1}", parsed.reconstruct(Revision.RIGHT));
    }

    @Test
    void parse_windowsLineEndsAndCustomLabels_areAccepted() throws ParseException {
        var text = "a\r\n<<<<<<< ours\r\nb\r\n||||||| merged common ancestors\r\nc\r\n=======\r\nd\r\n>>>>>>> theirs\r\ne";

        var parsed = ParsedMerge.parse(text, MarkerStyle.DEFAULT);

        assertEquals("a\r\nb\r\ne", parsed.reconstruct(Revision.LEFT));
        assertEquals("a\r\nd\r\ne", parsed.reconstruct(Revision.RIGHT));
    }

    @Test
    void parse_markerSizeFollowsStyle() throws ParseException {
        var style = new MarkerStyle(3, true, "L", "B", "R");
        var text = "<<< L\nx\n||| B\ny\n===\nz\n>>> R\n<<<<<<< not a marker of this size\n";

        var parsed = ParsedMerge.parse(text, style);

        assertEquals(1, parsed.conflictCount());
        assertEquals("x\n<<<<<<< not a marker of this size\n", parsed.reconstruct(Revision.LEFT));
    }

    // === Malformed markers ===

    @Test
    void parse_twoWayBlock_isRejected() {
        var exception = assertThrows(ParseException.class,
                                     () -> ParsedMerge.parse("<<<<<<< LEFT\na\n=======\nb\n>>>>>>> RIGHT\n", MarkerStyle.DEFAULT));

        assertThat(exception.getMessage()).contains("no base section").contains("at 3:1");
    }

    @Test
    void parse_unclosedBlock_isRejected() {
        var exception = assertThrows(ParseException.class,
                                     () -> ParsedMerge.parse("x\n<<<<<<< LEFT\na\n||||||| BASE\n", MarkerStyle.DEFAULT));

        assertThat(exception.getMessage()).contains("not closed");
    }

    @Test
    void parse_strayClosingMarker_isRejected() {
        assertThrows(ParseException.class, () -> ParsedMerge.parse("a\n>>>>>>> RIGHT\n", MarkerStyle.DEFAULT));
    }
}
