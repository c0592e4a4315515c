package org.pragmatica.structmerge.parser;

import org.pragmatica.structmerge.error.ParseError;
import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.grammar.Expression;
import org.pragmatica.structmerge.grammar.Grammar;
import org.pragmatica.structmerge.grammar.Rule;
import org.pragmatica.structmerge.tree.CstNode;
import org.pragmatica.structmerge.tree.SourceLocation;
import org.pragmatica.structmerge.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * PEG parsing engine - interprets Grammar to parse input text into a lossless CST.
 *
 * <p>Nodes produced by combinators (sequences, repetitions, literals, token boundaries) are
 * anonymous. A rule gives its name to an anonymous result; when the result already belongs to
 * another rule, the rule node wraps it. The engine holds no per-parse state and may be shared
 * between threads.
 */
public final class PegEngine implements Parser {

    private final Grammar grammar;
    private final ParserConfig config;
    private final Map<String, Rule> rules;

    private PegEngine(Grammar grammar, ParserConfig config) {
        this.grammar = grammar;
        this.config = config;
        this.rules = grammar.ruleMap();
    }

    public static PegEngine create(Grammar grammar, ParserConfig config) {
        return new PegEngine(grammar, config);
    }

    public Grammar grammar() {
        return grammar;
    }

    @Override
    public CstNode parseCst(String input) throws ParseException {
        var startRule = grammar.startRule();
        if (startRule.isEmpty()) {
            throw new ParseException(new ParseError.SemanticError(SourceLocation.START, "No start rule defined in grammar"));
        }
        return parseCst(input, startRule.get().name());
    }

    @Override
    public CstNode parseCst(String input, String startRule) throws ParseException {
        var rule = rules.get(startRule);
        if (rule == null) {
            throw new ParseException(new ParseError.SemanticError(SourceLocation.START, "Unknown rule: " + startRule));
        }

        var ctx = ParsingContext.create(input, config);
        ParseResult result;
        try {
            result = parseRule(ctx, rule);
        } catch (NestingLimitExceeded e) {
            throw new ParseException(new ParseError.SemanticError(
                e.location, "Input nested deeper than " + config.maxRuleDepth() + " rules"));
        }

        if (result instanceof ParseResult.Failure) {
            throw new ParseException(furthestError(ctx));
        }

        skipWhitespace(ctx);

        if (!ctx.isAtEnd()) {
            if (ctx.furthestPos() > ctx.pos()) {
                throw new ParseException(furthestError(ctx));
            }
            throw new ParseException(new ParseError.UnexpectedInput(ctx.location(),
                                                                     String.valueOf(ctx.peek()),
                                                                     "end of input"));
        }

        if (result instanceof ParseResult.Success success) {
            return success.node();
        }
        return new CstNode.NonTerminal(SourceSpan.at(SourceLocation.START), rule.name(), List.of());
    }

    private static ParseError furthestError(ParsingContext ctx) {
        var location = ctx.furthestLocation();
        var expected = ctx.furthestExpected().isEmpty() ? "valid input" : ctx.furthestExpected();
        if (location.offset() >= ctx.input().length()) {
            return new ParseError.UnexpectedEof(location, expected);
        }
        return new ParseError.UnexpectedInput(location,
                                              String.valueOf(ctx.input().charAt(location.offset())),
                                              expected);
    }

    // === Rule Parsing ===

    private ParseResult parseRule(ParsingContext ctx, Rule rule) {
        var startPos = ctx.pos();
        var startLoc = ctx.location();

        // Check packrat cache at START position
        var cached = ctx.getCachedAt(rule.name(), startPos);
        if (cached.isPresent()) {
            var result = cached.get();
            if (result instanceof ParseResult.Success success) {
                ctx.restoreLocation(success.endLocation());
            }
            return result;
        }

        if (!ctx.enterRule()) {
            throw new NestingLimitExceeded(startLoc);
        }
        try {
            skipWhitespace(ctx);
            var contentLoc = ctx.location();
            var result = parseExpression(ctx, rule.expression());

            ParseResult outcome;
            if (result instanceof ParseResult.Success success) {
                outcome = ParseResult.Success.of(wrapWithRuleName(success.node(), rule), ctx.location());
            } else if (result instanceof ParseResult.PredicateSuccess) {
                var empty = new CstNode.NonTerminal(SourceSpan.at(contentLoc), rule.name(), List.of());
                outcome = ParseResult.Success.of(empty, ctx.location());
            } else {
                ctx.restoreLocation(startLoc);
                outcome = result;
            }
            ctx.cacheAt(rule.name(), startPos, outcome);
            return outcome;
        } finally {
            ctx.exitRule();
        }
    }

    // === Expression Parsing ===

    private ParseResult parseExpression(ParsingContext ctx, Expression expr) {
        if (expr instanceof Expression.Literal lit) {
            return parseLiteral(ctx, lit);
        }
        if (expr instanceof Expression.CharClass cc) {
            return parseCharClass(ctx, cc);
        }
        if (expr instanceof Expression.Any) {
            return parseAny(ctx);
        }
        if (expr instanceof Expression.Reference ref) {
            return parseReference(ctx, ref);
        }
        if (expr instanceof Expression.Sequence seq) {
            return parseSequence(ctx, seq);
        }
        if (expr instanceof Expression.Choice choice) {
            return parseChoice(ctx, choice);
        }
        if (expr instanceof Expression.ZeroOrMore zom) {
            return parseRepeated(ctx, zom.expression(), false);
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return parseRepeated(ctx, oom.expression(), true);
        }
        if (expr instanceof Expression.Optional opt) {
            return parseOptional(ctx, opt);
        }
        if (expr instanceof Expression.And and) {
            return parseAnd(ctx, and);
        }
        if (expr instanceof Expression.Not not) {
            return parseNot(ctx, not);
        }
        if (expr instanceof Expression.TokenBoundary tb) {
            return parseTokenBoundary(ctx, tb);
        }
        return parseExpression(ctx, ((Expression.Group) expr).expression());
    }

    // === Terminal Parsers ===

    private ParseResult parseLiteral(ParsingContext ctx, Expression.Literal lit) {
        var text = lit.text();
        if (ctx.remaining() < text.length()) {
            ctx.updateFurthest("'" + text + "'");
            return ParseResult.Failure.at(ctx.location(), "'" + text + "'");
        }

        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != ctx.peek(i)) {
                ctx.updateFurthest("'" + text + "'");
                return ParseResult.Failure.at(ctx.location(), "'" + text + "'");
            }
        }

        var startLoc = ctx.location();
        for (int i = 0; i < text.length(); i++) {
            ctx.advance();
        }

        var node = new CstNode.Terminal(ctx.spanFrom(startLoc), "", text);
        return ParseResult.Success.of(node, ctx.location());
    }

    private ParseResult parseCharClass(ParsingContext ctx, Expression.CharClass cc) {
        var description = "[" + (cc.negated() ? "^" : "") + cc.pattern() + "]";
        if (ctx.isAtEnd()) {
            ctx.updateFurthest(description);
            return ParseResult.Failure.at(ctx.location(), description);
        }

        char c = ctx.peek();
        boolean matches = matchesCharClass(c, cc.pattern()) != cc.negated();

        if (!matches) {
            ctx.updateFurthest(description);
            return ParseResult.Failure.at(ctx.location(), description);
        }

        var startLoc = ctx.location();
        ctx.advance();
        var node = new CstNode.Terminal(ctx.spanFrom(startLoc), "", String.valueOf(c));
        return ParseResult.Success.of(node, ctx.location());
    }

    private static boolean matchesCharClass(char c, String pattern) {
        int i = 0;
        while (i < pattern.length()) {
            int consumed = 1;
            char start = pattern.charAt(i);
            if (start == '\\' && i + 1 < pattern.length()) {
                consumed = escapeLength(pattern, i);
                start = decodeEscape(pattern, i);
            }

            int rangeDash = i + consumed;
            if (rangeDash + 1 < pattern.length() && pattern.charAt(rangeDash) == '-') {
                int endIndex = rangeDash + 1;
                char end = pattern.charAt(endIndex);
                int endConsumed = 1;
                if (end == '\\' && endIndex + 1 < pattern.length()) {
                    endConsumed = escapeLength(pattern, endIndex);
                    end = decodeEscape(pattern, endIndex);
                }
                if (c >= start && c <= end) {
                    return true;
                }
                i = endIndex + endConsumed;
            } else {
                if (c == start) {
                    return true;
                }
                i += consumed;
            }
        }
        return false;
    }

    private static int escapeLength(String pattern, int index) {
        return pattern.charAt(index + 1) == 'u' && index + 6 <= pattern.length() ? 6 : 2;
    }

    private static char decodeEscape(String pattern, int index) {
        char escaped = pattern.charAt(index + 1);
        switch (escaped) {
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 't':
                return '\t';
            case 'u':
                if (index + 6 <= pattern.length()) {
                    try {
                        return (char) Integer.parseInt(pattern.substring(index + 2, index + 6), 16);
                    } catch (NumberFormatException e) {
                        return 'u';
                    }
                }
                return 'u';
            default:
                return escaped;
        }
    }

    private ParseResult parseAny(ParsingContext ctx) {
        if (ctx.isAtEnd()) {
            ctx.updateFurthest("any character");
            return ParseResult.Failure.at(ctx.location(), "any character");
        }

        var startLoc = ctx.location();
        char c = ctx.advance();
        var node = new CstNode.Terminal(ctx.spanFrom(startLoc), "", String.valueOf(c));
        return ParseResult.Success.of(node, ctx.location());
    }

    // === Combinator Parsers ===

    private ParseResult parseReference(ParsingContext ctx, Expression.Reference ref) {
        return parseRule(ctx, rules.get(ref.ruleName()));
    }

    private ParseResult parseSequence(ParsingContext ctx, Expression.Sequence seq) {
        var startLoc = ctx.location();
        var children = new ArrayList<CstNode>();

        for (var element : seq.elements()) {
            var beforeWs = ctx.location();
            // Skip whitespace between elements, but NOT before predicates
            if (!isPredicate(element)) {
                skipWhitespace(ctx);
            }
            var afterWs = ctx.pos();
            var result = parseExpression(ctx, element);
            if (result.isFailure()) {
                ctx.restoreLocation(startLoc);
                return result;
            }
            if (ctx.pos() == afterWs) {
                // An element that matched nothing must not swallow the whitespace before it
                ctx.restoreLocation(beforeWs);
            }
            if (result instanceof ParseResult.Success success) {
                children.add(success.node());
            }
        }

        var node = new CstNode.NonTerminal(ctx.spanFrom(startLoc), "", children);
        return ParseResult.Success.of(node, ctx.location());
    }

    private ParseResult parseChoice(ParsingContext ctx, Expression.Choice choice) {
        var startLoc = ctx.location();
        ParseResult lastFailure = null;

        for (var alt : choice.alternatives()) {
            var result = parseExpression(ctx, alt);
            if (result.isSuccess()) {
                return result;
            }
            lastFailure = result;
            ctx.restoreLocation(startLoc);
        }

        return lastFailure != null
               ? lastFailure
               : ParseResult.Failure.at(ctx.location(), "one of alternatives");
    }

    private ParseResult parseRepeated(ParsingContext ctx, Expression element, boolean atLeastOnce) {
        var startLoc = ctx.location();
        var children = new ArrayList<CstNode>();

        if (atLeastOnce) {
            var first = parseExpression(ctx, element);
            if (first.isFailure()) {
                return first;
            }
            if (first instanceof ParseResult.Success success) {
                children.add(success.node());
            }
        }

        while (true) {
            var beforeLoc = ctx.location();
            skipWhitespace(ctx);
            var afterWs = ctx.pos();

            var result = parseExpression(ctx, element);
            if (result.isFailure() || ctx.pos() == afterWs) {
                ctx.restoreLocation(beforeLoc);
                break;
            }
            if (result instanceof ParseResult.Success success) {
                children.add(success.node());
            }
        }

        var node = new CstNode.NonTerminal(ctx.spanFrom(startLoc), "", children);
        return ParseResult.Success.of(node, ctx.location());
    }

    private ParseResult parseOptional(ParsingContext ctx, Expression.Optional opt) {
        var startLoc = ctx.location();
        var result = parseExpression(ctx, opt.expression());

        if (result.isSuccess()) {
            return result;
        }

        // Optional always succeeds - return empty node on no match
        ctx.restoreLocation(startLoc);
        var node = new CstNode.NonTerminal(SourceSpan.at(startLoc), "", List.of());
        return ParseResult.Success.of(node, ctx.location());
    }

    private static boolean isPredicate(Expression expr) {
        if (expr instanceof Expression.Group grp) {
            return isPredicate(grp.expression());
        }
        return expr instanceof Expression.And || expr instanceof Expression.Not;
    }

    // === Predicate Parsers ===

    private ParseResult parseAnd(ParsingContext ctx, Expression.And and) {
        var startLoc = ctx.location();
        var result = parseExpression(ctx, and.expression());
        ctx.restoreLocation(startLoc); // Always restore - predicates don't consume

        if (result.isSuccess()) {
            return new ParseResult.PredicateSuccess(startLoc);
        }
        return result;
    }

    private ParseResult parseNot(ParsingContext ctx, Expression.Not not) {
        var startLoc = ctx.location();
        var result = parseExpression(ctx, not.expression());
        ctx.restoreLocation(startLoc); // Always restore - predicates don't consume

        if (result.isSuccess()) {
            return ParseResult.Failure.at(startLoc, "not " + describeExpression(not.expression()));
        }
        return new ParseResult.PredicateSuccess(startLoc);
    }

    // === Special Parsers ===

    private ParseResult parseTokenBoundary(ParsingContext ctx, Expression.TokenBoundary tb) {
        var startLoc = ctx.location();
        var startPos = ctx.pos();

        // Disable whitespace skipping inside token boundary
        ctx.enterTokenBoundary();
        try {
            var result = parseExpression(ctx, tb.expression());
            if (result.isFailure()) {
                return result;
            }

            var text = ctx.substring(startPos, ctx.pos());
            var node = new CstNode.Token(ctx.spanFrom(startLoc), "", text);
            return ParseResult.Success.of(node, ctx.location());
        } finally {
            ctx.exitTokenBoundary();
        }
    }

    // === Helpers ===

    private void skipWhitespace(ParsingContext ctx) {
        // Don't skip whitespace inside token boundaries or during whitespace parsing
        if (grammar.whitespace().isEmpty() || ctx.isSkippingWhitespace() || ctx.inTokenBoundary()) {
            return;
        }

        ctx.enterWhitespaceSkip();
        try {
            // Match one element at a time so that an empty match terminates the loop
            var innerExpr = extractInnerExpression(grammar.whitespace().get());

            while (!ctx.isAtEnd()) {
                var startLoc = ctx.location();
                var result = parseExpression(ctx, innerExpr);
                if (result.isFailure()) {
                    ctx.restoreLocation(startLoc);
                    break;
                }
                if (ctx.pos() == startLoc.offset()) {
                    break;
                }
            }
        } finally {
            ctx.exitWhitespaceSkip();
        }
    }

    private static Expression extractInnerExpression(Expression expr) {
        if (expr instanceof Expression.ZeroOrMore zom) {
            return zom.expression();
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return oom.expression();
        }
        if (expr instanceof Expression.Optional opt) {
            return opt.expression();
        }
        return expr;
    }

    private static CstNode wrapWithRuleName(CstNode node, Rule rule) {
        var ruleName = rule.name();
        if (rule.isHidden()) {
            // Hidden rule nodes are spliced away later, anonymous leaves keep their literal kind
            var children = node instanceof CstNode.NonTerminal nt && nt.isAnonymous() ? nt.children() : List.of(node);
            return new CstNode.NonTerminal(node.span(), ruleName, children);
        }
        if (!node.isAnonymous()) {
            return new CstNode.NonTerminal(node.span(), ruleName, List.of(node));
        }
        if (node instanceof CstNode.Terminal t) {
            return new CstNode.Terminal(t.span(), ruleName, t.text());
        }
        if (node instanceof CstNode.Token tok) {
            return new CstNode.Token(tok.span(), ruleName, tok.text());
        }
        var nt = (CstNode.NonTerminal) node;
        return new CstNode.NonTerminal(nt.span(), ruleName, nt.children());
    }

    private static String describeExpression(Expression expr) {
        if (expr instanceof Expression.Literal lit) {
            return "'" + lit.text() + "'";
        }
        if (expr instanceof Expression.CharClass cc) {
            return "[" + cc.pattern() + "]";
        }
        if (expr instanceof Expression.Any) {
            return ".";
        }
        if (expr instanceof Expression.Reference ref) {
            return ref.ruleName();
        }
        return "expression";
    }

    private static final class NestingLimitExceeded extends RuntimeException {
        private final transient SourceLocation location;

        private NestingLimitExceeded(SourceLocation location) {
            super(null, null, false, false);
            this.location = location;
        }
    }
}
