package org.pragmatica.structmerge.tree;

import java.util.List;

/**
 * Concrete Syntax Tree node as produced by the PEG engine, before it is flattened
 * into a {@link SyntaxTree}. Nodes produced by combinators rather than rules carry
 * an empty rule name.
 */
public sealed interface CstNode {
    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * The rule name that produced this node, empty for anonymous nodes.
     */
    String rule();

    default boolean isAnonymous() {
        return rule().isEmpty();
    }

    /**
     * Terminal node - a leaf that matched literal text.
     */
    record Terminal(SourceSpan span, String rule, String text) implements CstNode {}

    /**
     * Non-terminal node - an interior node with children.
     */
    record NonTerminal(SourceSpan span, String rule, List<CstNode> children) implements CstNode {}

    /**
     * Token node - result of token boundary operator {@code < >}.
     * Captures the matched text as a single unit.
     */
    record Token(SourceSpan span, String rule, String text) implements CstNode {}
}
