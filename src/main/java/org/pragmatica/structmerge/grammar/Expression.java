package org.pragmatica.structmerge.grammar;

import org.pragmatica.structmerge.tree.SourceSpan;

import java.util.List;

/**
 * PEG expression types - the building blocks of grammar rules.
 */
public sealed interface Expression {

    /**
     * Source location of this expression in the grammar.
     */
    SourceSpan span();

    /**
     * Directly nested expressions, empty for terminals.
     */
    default List<Expression> operands() {
        return List.of();
    }

    // === Terminals ===

    /**
     * Literal string match: 'text' or "text"
     */
    record Literal(SourceSpan span, String text) implements Expression {}

    /**
     * Character class: [a-z], [^a-z]
     */
    record CharClass(SourceSpan span, String pattern, boolean negated) implements Expression {}

    /**
     * Any character: .
     */
    record Any(SourceSpan span) implements Expression {}

    /**
     * Rule reference: RuleName
     */
    record Reference(SourceSpan span, String ruleName) implements Expression {}

    // === Combinators ===

    /**
     * Sequence: e1 e2 e3
     */
    record Sequence(SourceSpan span, List<Expression> elements) implements Expression {
        @Override
        public List<Expression> operands() {
            return elements;
        }
    }

    /**
     * Ordered choice: e1 / e2 / e3
     */
    record Choice(SourceSpan span, List<Expression> alternatives) implements Expression {
        @Override
        public List<Expression> operands() {
            return alternatives;
        }
    }

    // === Repetition ===

    /**
     * Zero or more: e*
     */
    record ZeroOrMore(SourceSpan span, Expression expression) implements Expression {
        @Override
        public List<Expression> operands() {
            return List.of(expression);
        }
    }

    /**
     * One or more: e+
     */
    record OneOrMore(SourceSpan span, Expression expression) implements Expression {
        @Override
        public List<Expression> operands() {
            return List.of(expression);
        }
    }

    /**
     * Optional: e?
     */
    record Optional(SourceSpan span, Expression expression) implements Expression {
        @Override
        public List<Expression> operands() {
            return List.of(expression);
        }
    }

    // === Predicates ===

    /**
     * Positive lookahead: &e
     */
    record And(SourceSpan span, Expression expression) implements Expression {
        @Override
        public List<Expression> operands() {
            return List.of(expression);
        }
    }

    /**
     * Negative lookahead: !e
     */
    record Not(SourceSpan span, Expression expression) implements Expression {
        @Override
        public List<Expression> operands() {
            return List.of(expression);
        }
    }

    // === Special ===

    /**
     * Token boundary: &lt; e &gt; - the matched text becomes a single leaf
     */
    record TokenBoundary(SourceSpan span, Expression expression) implements Expression {
        @Override
        public List<Expression> operands() {
            return List.of(expression);
        }
    }

    /**
     * Grouping: ( e )
     */
    record Group(SourceSpan span, Expression expression) implements Expression {
        @Override
        public List<Expression> operands() {
            return List.of(expression);
        }
    }
}
