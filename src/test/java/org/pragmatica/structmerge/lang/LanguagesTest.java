package org.pragmatica.structmerge.lang;

import org.junit.jupiter.api.Test;
import org.pragmatica.structmerge.error.ParseError;
import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.render.SourceRenderer;
import org.pragmatica.structmerge.tree.Revision;
import org.pragmatica.structmerge.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LanguagesTest {

    private static final String JSON_SAMPLE = """
        {
          "name": "structmerge",
          "version": 1.5e3,
          "tags": ["merge", "ast", "\\"quoted\\""],
          "nested": {"empty": {}, "list": [], "flag": false, "none": null},
          "count": -12
        }
        """;

    private static final String STARLARK_SAMPLE = """
        # Build file
        load("//tools:defs.bzl", "cc_binary")

        NAME = 'app'

        cc_binary(
            name = NAME,  # trailing comment
            srcs = glob(["*.cc"]) + ["main.cc"],
            copts = {"opt": "-O2", "dbg": "-g"},
            deps = [],
            visibility = ["//visibility:public",],
        )
        """;

    private final SourceRenderer renderer = SourceRenderer.withDefaults();

    @Test
    void json_parsesAndRendersBack() throws ParseException {
        var tree = Languages.json().parse(JSON_SAMPLE, Revision.ANCESTOR);

        assertEquals(JSON_SAMPLE, renderer.renderExploded(tree));
        assertThat(kinds(tree)).contains("Object", "Member", "Array", "String", "Number", "Literal");
    }

    @Test
    void json_objectsAreUnordered() {
        var kinds = Languages.json().kindTable();

        assertTrue(kinds.isUnordered("Object"));
        assertFalse(kinds.isUnordered("Array"));
        assertEquals("String", kinds.traits("Member").identityChildKind().orElseThrow());
    }

    @Test
    void json_rejectsMalformedInput() {
        var exception = assertThrows(ParseException.class,
                                     () -> Languages.json().parse("{\"a\": }", Revision.LEFT));

        assertInstanceOf(ParseError.UnexpectedInput.class, exception.error());
    }

    @Test
    void starlark_parsesAndRendersBack() throws ParseException {
        var tree = Languages.starlark().parse(STARLARK_SAMPLE, Revision.ANCESTOR);

        assertEquals(STARLARK_SAMPLE, renderer.renderExploded(tree));
        assertThat(kinds(tree)).contains("Module", "Load", "Assignment", "ExpressionStatement", "Call",
                                         "Arguments", "KeywordArgument", "Concatenation", "List", "Dict",
                                         "Entry", "String", "Identifier");
    }

    @Test
    void starlark_statementsAreChildrenOfModule() throws ParseException {
        var tree = Languages.starlark().parse(STARLARK_SAMPLE, Revision.ANCESTOR);

        var statements = tree.children(tree.root())
                             .stream()
                             .map(tree::kind)
                             .toList();
        assertEquals(List.of("Load", "Assignment", "ExpressionStatement"), statements);
    }

    @Test
    void starlark_keywordArgumentsAreIdentifiedByName() throws ParseException {
        var tree = Languages.starlark().parse("f(name = 'x', deps = [])", Revision.ANCESTOR);

        var keys = new ArrayList<String>();
        for (int node = 0; node < tree.size(); node++) {
            if (tree.kind(node).equals("KeywordArgument")) {
                keys.add(tree.identityKey(node).orElseThrow());
            }
        }
        assertEquals(List.of("name", "deps"), keys);
    }

    @Test
    void starlark_rejectsUnbalancedCall() {
        assertThrows(ParseException.class, () -> Languages.starlark().parse("f(a = 1", Revision.RIGHT));
    }

    private static List<String> kinds(SyntaxTree tree) {
        var result = new ArrayList<String>();
        for (int node = 0; node < tree.size(); node++) {
            result.add(tree.kind(node));
        }
        return result;
    }
}
