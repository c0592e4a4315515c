package org.pragmatica.structmerge.grammar;

import org.pragmatica.structmerge.tree.SourceSpan;

/**
 * Token types for grammar lexer.
 */
public sealed interface GrammarToken {
    SourceSpan span();

    // Identifiers and literals
    record Identifier(SourceSpan span, String name) implements GrammarToken {}

    record StringLiteral(SourceSpan span, String value) implements GrammarToken {}

    record CharClassLiteral(SourceSpan span, String pattern, boolean negated) implements GrammarToken {}

    // Operators
    record LeftArrow(SourceSpan span) implements GrammarToken {}

    record Slash(SourceSpan span) implements GrammarToken {}

    record Ampersand(SourceSpan span) implements GrammarToken {}

    record Exclamation(SourceSpan span) implements GrammarToken {}

    record Question(SourceSpan span) implements GrammarToken {}

    record Star(SourceSpan span) implements GrammarToken {}

    record Plus(SourceSpan span) implements GrammarToken {}

    record Dot(SourceSpan span) implements GrammarToken {}

    // Delimiters
    record LParen(SourceSpan span) implements GrammarToken {}

    record RParen(SourceSpan span) implements GrammarToken {}

    record LAngle(SourceSpan span) implements GrammarToken {}

    record RAngle(SourceSpan span) implements GrammarToken {}

    // Special
    record Directive(SourceSpan span, String name) implements GrammarToken {}

    record Eof(SourceSpan span) implements GrammarToken {}

    record Error(SourceSpan span, String message) implements GrammarToken {}
}
