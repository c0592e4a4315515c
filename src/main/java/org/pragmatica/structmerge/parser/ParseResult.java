package org.pragmatica.structmerge.parser;

import org.pragmatica.structmerge.tree.CstNode;
import org.pragmatica.structmerge.tree.SourceLocation;

/**
 * Result of parsing an expression - either success with a node or failure.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Successful parse with CST node and new position.
     */
    record Success(CstNode node, SourceLocation endLocation) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        public static Success of(CstNode node, SourceLocation endLocation) {
            return new Success(node, endLocation);
        }
    }

    /**
     * Failed parse - no match at current position.
     */
    record Failure(SourceLocation location, String expected) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        public static Failure at(SourceLocation location, String expected) {
            return new Failure(location, expected);
        }
    }

    /**
     * Special result for predicates - matched but consumed no input.
     */
    record PredicateSuccess(SourceLocation location) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }
}
