package org.pragmatica.structmerge.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.structmerge.error.ParseError;
import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.grammar.GrammarParser;
import org.pragmatica.structmerge.tree.CstNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PegEngineTest {

    @Test
    void parse_simpleLiteral_namesNodeAfterRule() throws ParseException {
        var node = engine("Root <- 'hello'").parseCst("hello");

        assertInstanceOf(CstNode.Terminal.class, node);
        assertEquals("Root", node.rule());
        assertEquals("hello", ((CstNode.Terminal) node).text());
    }

    @Test
    void parse_simpleLiteral_failsOnMismatch() throws ParseException {
        var parser = engine("Root <- 'hello'");

        var exception = assertThrows(ParseException.class, () -> parser.parseCst("world"));
        assertInstanceOf(ParseError.UnexpectedInput.class, exception.error());
        assertEquals(0, exception.error().location().offset());
    }

    @Test
    void parse_characterClasses_matchRangesAndComplements() throws ParseException {
        var digit = engine("Digit <- [0-9]");
        var nonDigit = engine("NonDigit <- [^0-9]");

        assertDoesNotThrow(() -> digit.parseCst("5"));
        assertThrows(ParseException.class, () -> digit.parseCst("a"));
        assertDoesNotThrow(() -> nonDigit.parseCst("a"));
        assertThrows(ParseException.class, () -> nonDigit.parseCst("5"));
    }

    @Test
    void parse_anyChar_failsAtEndOfInput() throws ParseException {
        var parser = engine("Any <- .");

        assertDoesNotThrow(() -> parser.parseCst("x"));
        var exception = assertThrows(ParseException.class, () -> parser.parseCst(""));
        assertInstanceOf(ParseError.UnexpectedEof.class, exception.error());
    }

    @Test
    void parse_choice_triesAlternativesInOrder() throws ParseException {
        var parser = engine("Choice <- 'ab' / 'a'");

        assertEquals("ab", ((CstNode.Terminal) parser.parseCst("ab")).text());
        assertEquals("a", ((CstNode.Terminal) parser.parseCst("a")).text());
    }

    @Test
    void parse_zeroOrMore_acceptsEmptyInput() throws ParseException {
        var node = engine("Stars <- 'a'*").parseCst("");

        assertInstanceOf(CstNode.NonTerminal.class, node);
        assertEquals("Stars", node.rule());
        assertThat(((CstNode.NonTerminal) node).children()).isEmpty();
    }

    @Test
    void parse_sequenceWithWhitespace_keepsCombinatorsAnonymous() throws ParseException {
        var node = engine("""
            Pair <- Word ',' Word
            Word <- < [a-z]+ >
            %whitespace <- [ ]*
            """).parseCst("ab , cd");

        var pair = (CstNode.NonTerminal) node;
        assertEquals("Pair", pair.rule());
        assertThat(pair.children()).hasSize(3);

        var first = pair.children().get(0);
        var comma = pair.children().get(1);
        assertInstanceOf(CstNode.Token.class, first);
        assertEquals("Word", first.rule());
        assertTrue(comma.isAnonymous());
        assertEquals(3, comma.span().startOffset());
        assertEquals("cd", ((CstNode.Token) pair.children().get(2)).text());
    }

    @Test
    void parse_trailingInput_reportsUnexpectedInput() throws ParseException {
        var parser = engine("""
            Pair <- Word ',' Word
            Word <- < [a-z]+ >
            %whitespace <- [ ]*
            """);

        var exception = assertThrows(ParseException.class, () -> parser.parseCst("ab , cd !"));
        assertInstanceOf(ParseError.UnexpectedInput.class, exception.error());
        assertEquals(8, exception.error().location().offset());
    }

    @Test
    void parse_hiddenRule_keepsItsName() throws ParseException {
        var node = engine("""
            List <- _Item+
            _Item <- Number
            Number <- < [0-9]+ >
            %whitespace <- [ ]*
            """).parseCst("1 2");

        var list = (CstNode.NonTerminal) node;
        assertEquals("List", list.rule());
        assertThat(list.children()).hasSize(2)
                                   .allMatch(child -> child.rule().equals("_Item"));
    }

    @Test
    void parse_deepNesting_failsBeyondLimit() throws ParseException {
        var grammar = GrammarParser.parse("Nested <- '(' Nested ')' / 'x'");
        var shallow = PegEngine.create(grammar, ParserConfig.DEFAULT);
        var limited = PegEngine.create(grammar, ParserConfig.DEFAULT.withMaxRuleDepth(3));

        assertDoesNotThrow(() -> shallow.parseCst("((((x))))"));
        var exception = assertThrows(ParseException.class, () -> limited.parseCst("((((x))))"));
        assertInstanceOf(ParseError.SemanticError.class, exception.error());
        assertThat(exception.getMessage()).contains("nested deeper than 3");
    }

    @Test
    void parse_unknownStartRule_fails() throws ParseException {
        var parser = engine("Root <- 'x'");

        var exception = assertThrows(ParseException.class, () -> parser.parseCst("x", "Missing"));
        assertThat(exception.getMessage()).contains("Unknown rule: Missing");
    }

    @Test
    void parse_withoutPackrat_producesSameTree() throws ParseException {
        var grammar = GrammarParser.parse("""
            Sum <- Term ('+' Term)*
            Term <- < [0-9]+ >
            %whitespace <- [ ]*
            """);
        var cached = PegEngine.create(grammar, ParserConfig.DEFAULT);
        var uncached = PegEngine.create(grammar, ParserConfig.DEFAULT.withPackrat(false));

        assertEquals(cached.parseCst("1 + 2 + 3"), uncached.parseCst("1 + 2 + 3"));
    }

    private static PegEngine engine(String grammarText) throws ParseException {
        return PegEngine.create(GrammarParser.parse(grammarText), ParserConfig.DEFAULT);
    }
}
