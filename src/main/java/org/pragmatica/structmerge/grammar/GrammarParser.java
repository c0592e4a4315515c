package org.pragmatica.structmerge.grammar;

import org.pragmatica.structmerge.error.ParseError;
import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.tree.SourceLocation;
import org.pragmatica.structmerge.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parser for PEG grammar syntax.
 * Converts grammar text into Grammar object.
 */
public final class GrammarParser {
    private static final Map<Class<?>, String> OPERATOR_NAMES = Map.ofEntries(
        Map.entry(GrammarToken.LeftArrow.class, "'<-'"),
        Map.entry(GrammarToken.Slash.class, "'/'"),
        Map.entry(GrammarToken.Ampersand.class, "'&'"),
        Map.entry(GrammarToken.Exclamation.class, "'!'"),
        Map.entry(GrammarToken.Question.class, "'?'"),
        Map.entry(GrammarToken.Star.class, "'*'"),
        Map.entry(GrammarToken.Plus.class, "'+'"),
        Map.entry(GrammarToken.Dot.class, "'.'"),
        Map.entry(GrammarToken.LParen.class, "'('"),
        Map.entry(GrammarToken.RParen.class, "')'"),
        Map.entry(GrammarToken.LAngle.class, "'<'"),
        Map.entry(GrammarToken.RAngle.class, "'>'"),
        Map.entry(GrammarToken.StringLiteral.class, "string literal"),
        Map.entry(GrammarToken.CharClassLiteral.class, "character class"),
        Map.entry(GrammarToken.Eof.class, "end of input"));

    private final List<GrammarToken> tokens;
    private int pos;

    private GrammarParser(List<GrammarToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse grammar text into a validated Grammar object.
     */
    public static Grammar parse(String grammarText) throws ParseException {
        var tokens = GrammarLexer.tokenize(grammarText);

        for (var token : tokens) {
            if (token instanceof GrammarToken.Error error) {
                throw new ParseException(new ParseError.SemanticError(error.span().start(), error.message()));
            }
        }

        return new GrammarParser(tokens).parseGrammar().validate();
    }

    private Grammar parseGrammar() throws ParseException {
        var rules = new ArrayList<Rule>();
        Optional<Expression> whitespace = Optional.empty();

        while (!isAtEnd()) {
            var token = peek();

            if (token instanceof GrammarToken.Directive directive) {
                advance();
                var expr = parseDirective();
                if (!directive.name().equals("whitespace")) {
                    throw new ParseException(new ParseError.SemanticError(
                        directive.span().start(), "Unknown directive '%" + directive.name() + "'"));
                }
                whitespace = Optional.of(expr);
            } else if (token instanceof GrammarToken.Identifier) {
                rules.add(parseRule());
            } else {
                throw unexpected(token, "rule definition or directive");
            }
        }

        return new Grammar(List.copyOf(rules), whitespace);
    }

    private Expression parseDirective() throws ParseException {
        expect(GrammarToken.LeftArrow.class, "'<-'");
        return parseExpression();
    }

    private Rule parseRule() throws ParseException {
        var start = peek().span().start();
        var id = (GrammarToken.Identifier) peek();
        advance();

        expect(GrammarToken.LeftArrow.class, "'<-'");

        var expression = parseExpression();
        var span = SourceSpan.of(start, currentLocation());
        return new Rule(span, id.name(), expression);
    }

    private Expression parseExpression() throws ParseException {
        return parseChoice();
    }

    private Expression parseChoice() throws ParseException {
        var start = peek().span().start();
        var alternatives = new ArrayList<Expression>();

        alternatives.add(parseSequence());

        while (peek() instanceof GrammarToken.Slash) {
            advance();
            alternatives.add(parseSequence());
        }

        if (alternatives.size() == 1) {
            return alternatives.get(0);
        }
        var span = SourceSpan.of(start, currentLocation());
        return new Expression.Choice(span, List.copyOf(alternatives));
    }

    private Expression parseSequence() throws ParseException {
        var start = peek().span().start();
        var elements = new ArrayList<Expression>();

        while (isSequenceElement()) {
            elements.add(parsePrefix());
        }

        if (elements.isEmpty()) {
            throw unexpected(peek(), "expression");
        }

        if (elements.size() == 1) {
            return elements.get(0);
        }
        var span = SourceSpan.of(start, currentLocation());
        return new Expression.Sequence(span, List.copyOf(elements));
    }

    private boolean isSequenceElement() {
        var token = peek();
        // Identifier followed by <- is a new rule definition, not a reference
        if (token instanceof GrammarToken.Identifier) {
            return !isRuleDefinitionStart();
        }
        return token instanceof GrammarToken.StringLiteral
            || token instanceof GrammarToken.CharClassLiteral
            || token instanceof GrammarToken.Dot
            || token instanceof GrammarToken.LParen
            || token instanceof GrammarToken.LAngle
            || token instanceof GrammarToken.Ampersand
            || token instanceof GrammarToken.Exclamation;
    }

    private boolean isRuleDefinitionStart() {
        return pos + 1 < tokens.size() && tokens.get(pos + 1) instanceof GrammarToken.LeftArrow;
    }

    private Expression parsePrefix() throws ParseException {
        var start = peek().span().start();

        if (peek() instanceof GrammarToken.Ampersand) {
            advance();
            var inner = parseSuffix();
            return new Expression.And(SourceSpan.of(start, currentLocation()), inner);
        }

        if (peek() instanceof GrammarToken.Exclamation) {
            advance();
            var inner = parseSuffix();
            return new Expression.Not(SourceSpan.of(start, currentLocation()), inner);
        }

        return parseSuffix();
    }

    private Expression parseSuffix() throws ParseException {
        var start = peek().span().start();
        var expr = parsePrimary();

        while (true) {
            if (peek() instanceof GrammarToken.Star) {
                advance();
                expr = new Expression.ZeroOrMore(SourceSpan.of(start, currentLocation()), expr);
            } else if (peek() instanceof GrammarToken.Plus) {
                advance();
                expr = new Expression.OneOrMore(SourceSpan.of(start, currentLocation()), expr);
            } else if (peek() instanceof GrammarToken.Question) {
                advance();
                expr = new Expression.Optional(SourceSpan.of(start, currentLocation()), expr);
            } else {
                return expr;
            }
        }
    }

    private Expression parsePrimary() throws ParseException {
        var token = peek();
        var start = token.span().start();

        if (token instanceof GrammarToken.Identifier id) {
            advance();
            return new Expression.Reference(token.span(), id.name());
        }

        if (token instanceof GrammarToken.StringLiteral str) {
            advance();
            return new Expression.Literal(token.span(), str.value());
        }

        if (token instanceof GrammarToken.CharClassLiteral cc) {
            advance();
            return new Expression.CharClass(token.span(), cc.pattern(), cc.negated());
        }

        if (token instanceof GrammarToken.Dot) {
            advance();
            return new Expression.Any(token.span());
        }

        if (token instanceof GrammarToken.LParen) {
            advance();
            var inner = parseExpression();
            expect(GrammarToken.RParen.class, "')'");
            return new Expression.Group(SourceSpan.of(start, currentLocation()), inner);
        }

        if (token instanceof GrammarToken.LAngle) {
            advance();
            var inner = parseExpression();
            expect(GrammarToken.RAngle.class, "'>'");
            return new Expression.TokenBoundary(SourceSpan.of(start, currentLocation()), inner);
        }

        throw unexpected(token, "expression");
    }

    private boolean isAtEnd() {
        return peek() instanceof GrammarToken.Eof;
    }

    private GrammarToken peek() {
        return tokens.get(pos);
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    private void expect(Class<? extends GrammarToken> tokenClass, String description) throws ParseException {
        if (!tokenClass.isInstance(peek())) {
            throw unexpected(peek(), description);
        }
        advance();
    }

    private SourceLocation currentLocation() {
        return peek().span().start();
    }

    private static ParseException unexpected(GrammarToken token, String expected) {
        if (token instanceof GrammarToken.Eof) {
            return new ParseException(new ParseError.UnexpectedEof(token.span().start(), expected));
        }
        return new ParseException(new ParseError.UnexpectedInput(token.span().start(), describe(token), expected));
    }

    private static String describe(GrammarToken token) {
        if (token instanceof GrammarToken.Identifier id) {
            return "identifier '" + id.name() + "'";
        }
        if (token instanceof GrammarToken.Directive directive) {
            return "directive '%" + directive.name() + "'";
        }
        return OPERATOR_NAMES.getOrDefault(token.getClass(), "token");
    }
}
