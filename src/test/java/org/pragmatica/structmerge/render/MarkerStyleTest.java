package org.pragmatica.structmerge.render;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarkerStyleTest {

    @Test
    void defaultStyle_usesGitMarkers() {
        var style = MarkerStyle.DEFAULT;

        assertEquals("<<<<<<< LEFT", style.leftMarker());
        assertEquals("||||||| BASE", style.baseMarker());
        assertEquals("=======", style.separatorMarker());
        assertEquals(">>>>>>> RIGHT", style.rightMarker());
        assertTrue(style.diff3());
    }

    @Test
    void customStyle_changesSizeAndLabels() {
        var style = new MarkerStyle(3, false, "ours", "", "theirs");

        assertEquals("<<< ours", style.leftMarker());
        assertEquals("|||", style.baseMarker());
        assertEquals("===", style.separatorMarker());
        assertEquals(">>> theirs", style.rightMarker());
    }

    @Test
    void nonPositiveSize_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MarkerStyle(0, true, "L", "B", "R"));
    }
}
