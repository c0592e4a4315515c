package org.pragmatica.structmerge.grammar;

import org.pragmatica.structmerge.tree.SourceSpan;

/**
 * A grammar rule: Name &lt;- Expression
 */
public record Rule(SourceSpan span, String name, Expression expression) {
    /**
     * Hidden rules do not produce their own node, their children are attached to the enclosing node.
     */
    public boolean isHidden() {
        return name.startsWith("_");
    }
}
