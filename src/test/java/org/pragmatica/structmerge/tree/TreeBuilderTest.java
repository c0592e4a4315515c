package org.pragmatica.structmerge.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.lang.LanguageProfile;
import org.pragmatica.structmerge.lang.Languages;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TreeBuilderTest {

    private static final String JSON_GRAMMAR = """
        Document <- _Value
        _Value   <- Object / Array / Number
        Object   <- '{' (Member (',' Member)*)? '}'
        Member   <- Key ':' _Value
        Key      <- < [a-z]+ >
        Array    <- '[' (_Value (',' _Value)*)? ']'
        Number   <- < [0-9]+ >
        %whitespace <- [ \\n]*
        """;

    @Test
    void build_splicesHiddenAndAnonymousNodes() throws ParseException {
        var tree = Languages.json().parse("{\"a\": [1, true]}", Revision.ANCESTOR);

        assertEquals(List.of("Document", "Object", "{", "Member", "String", ":", "Array",
                             "[", "Number", ",", "Literal", "]", "}"),
                     kinds(tree));
        assertThat(kinds(tree)).noneMatch(kind -> kind.startsWith("_") || kind.isEmpty());
    }

    @Test
    void build_linksParentsAndChildren() throws ParseException {
        var tree = Languages.json().parse("{\"a\": [1, true]}", Revision.LEFT);

        assertEquals(Revision.LEFT, tree.revision());
        assertEquals(-1, tree.parent(0));
        assertEquals(List.of(2, 3, 12), tree.children(1));
        assertEquals(List.of(4, 5, 6), tree.children(3));
        assertEquals(1, tree.childIndex(5));
        assertEquals(13, tree.subtreeSize(0));
        assertEquals(6, tree.subtreeSize(6));
        assertTrue(tree.isAncestorOf(1, 10));
        assertFalse(tree.isAncestorOf(6, 12));
        assertEquals(4, tree.depth(8));
    }

    @Test
    void build_recomputesInteriorSpansFromChildren() throws ParseException {
        var tree = Languages.json().parse("\n  {\"a\": [1, true]}  \n", Revision.ANCESTOR);

        assertEquals("{\"a\": [1, true]}", tree.text(1));
        assertEquals("\"a\": [1, true]", tree.text(3));
        assertEquals("[1, true]", tree.text(6));
        assertEquals("\n  ", tree.gap(0, 0));
        assertEquals("  \n", tree.gap(0, 1));
        assertEquals(List.of("", "", " ", ""), tree.gaps(3));
    }

    @Test
    void build_marksLiteralLeaves() throws ParseException {
        var tree = Languages.json().parse("{\"a\": [1, true]}", Revision.ANCESTOR);

        assertTrue(tree.isLiteral(2));
        assertTrue(tree.isLiteral(5));
        assertFalse(tree.isLiteral(4));
        assertFalse(tree.isLiteral(10));
        assertFalse(tree.isLiteral(3));
    }

    @Test
    void build_computesIdentityKeys() throws ParseException {
        var tree = Languages.json().parse("{\"a\": [1, true]}", Revision.ANCESTOR);

        assertEquals("\"a\"", tree.identityKey(3).orElseThrow());
        assertTrue(tree.identityKey(1).isEmpty());
    }

    @Test
    void hash_ignoresWhitespaceBetweenNodes() throws ParseException {
        var compact = Languages.json().parse("{\"a\":[1,true]}", Revision.ANCESTOR);
        var spaced = Languages.json().parse("{ \"a\" : [ 1 , true ] }\n", Revision.LEFT);
        var changed = Languages.json().parse("{\"a\":[2,true]}", Revision.RIGHT);

        assertEquals(compact.hash(0), spaced.hash(0));
        assertTrue(compact.isomorphic(0, spaced, 0));
        assertNotEquals(compact.hash(0), changed.hash(0));
        assertFalse(compact.isomorphic(0, changed, 0));
        assertTrue(compact.isomorphic(4, changed, 4));
    }

    @Test
    void build_atomicKindBecomesLeaf() throws ParseException {
        var kinds = KindTable.builder().atomic("Array").build();
        var profile = LanguageProfile.create("test", List.of(), JSON_GRAMMAR, kinds);

        var tree = profile.parse("{a: [1, 2], b: 3}", Revision.ANCESTOR);

        assertEquals(List.of("Document", "Object", "{", "Member", "Key", ":", "Array", ",",
                             "Member", "Key", ":", "Number", "}"),
                     kinds(tree));
        assertTrue(tree.isLeaf(6));
        assertEquals("[1, 2]", tree.text(6));
    }

    @Test
    void build_singleLeafDocument() throws ParseException {
        var tree = Languages.json().parse(" 42 ", Revision.ANCESTOR);

        assertEquals(2, tree.size());
        assertEquals("Number", tree.kind(1));
        assertEquals(" ", tree.gap(0, 0));
        assertEquals(" ", tree.gap(0, 1));
    }

    @Test
    void build_nestedArrays_keepAllLevels() throws ParseException {
        int depth = 100;
        var text = "[".repeat(depth) + "]".repeat(depth);

        var tree = Languages.json().parse(text, Revision.ANCESTOR);

        int deepest = 0;
        for (int node = 0; node < tree.size(); node++) {
            deepest = Math.max(deepest, tree.depth(node));
        }
        assertEquals(text, tree.text(0));
        assertEquals(1 + 3 * depth, tree.size());
        assertEquals(depth + 1, deepest);
    }

    private static List<String> kinds(SyntaxTree tree) {
        var result = new ArrayList<String>();
        for (int node = 0; node < tree.size(); node++) {
            result.add(tree.kind(node));
        }
        return result;
    }
}
