package org.pragmatica.structmerge.grammar;

import org.pragmatica.structmerge.error.ParseError;
import org.pragmatica.structmerge.error.ParseException;
import org.pragmatica.structmerge.tree.SourceLocation;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A complete PEG grammar - collection of rules with directives.
 */
public record Grammar(List<Rule> rules, Optional<Expression> whitespace) {
    /**
     * Get rule by name.
     */
    public Optional<Rule> rule(String name) {
        return rules.stream()
                    .filter(r -> r.name().equals(name))
                    .findFirst();
    }

    /**
     * The start rule is the first rule of the grammar.
     */
    public Optional<Rule> startRule() {
        return rules.isEmpty() ? Optional.empty() : Optional.of(rules.get(0));
    }

    /**
     * Build a lookup map for efficient rule access.
     */
    public Map<String, Rule> ruleMap() {
        return rules.stream()
                    .collect(Collectors.toMap(Rule::name, Function.identity(), (first, second) -> first));
    }

    /**
     * Validate the grammar: at least one rule, no undefined references.
     */
    public Grammar validate() throws ParseException {
        var start = startRule();
        if (start.isEmpty()) {
            throw new ParseException(new ParseError.SemanticError(
                SourceLocation.START, "Grammar defines no rules"));
        }
        if (start.get().isHidden()) {
            throw new ParseException(new ParseError.SemanticError(
                start.get().span().start(), "Start rule '" + start.get().name() + "' must not be hidden"));
        }
        var ruleNames = rules.stream()
                             .map(Rule::name)
                             .collect(Collectors.toSet());
        for (var rule : rules) {
            var undefined = findUndefinedReference(rule.expression(), ruleNames);
            if (undefined.isPresent()) {
                var ref = undefined.get();
                throw new ParseException(new ParseError.SemanticError(
                    ref.span().start(), "Undefined rule reference: '" + ref.ruleName() + "'"));
            }
        }
        if (whitespace.isPresent()) {
            var undefined = findUndefinedReference(whitespace.get(), ruleNames);
            if (undefined.isPresent()) {
                throw new ParseException(new ParseError.SemanticError(
                    undefined.get().span().start(),
                    "Undefined rule reference: '" + undefined.get().ruleName() + "'"));
            }
        }
        return this;
    }

    private static Optional<Expression.Reference> findUndefinedReference(Expression root, Set<String> ruleNames) {
        var work = new ArrayDeque<Expression>();
        work.push(root);
        while (!work.isEmpty()) {
            var expr = work.pop();
            if (expr instanceof Expression.Reference ref && !ruleNames.contains(ref.ruleName())) {
                return Optional.of(ref);
            }
            var operands = expr.operands();
            for (int i = operands.size() - 1; i >= 0; i--) {
                work.push(operands.get(i));
            }
        }
        return Optional.empty();
    }
}
