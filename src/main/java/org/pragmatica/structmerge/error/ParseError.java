package org.pragmatica.structmerge.error;

import org.pragmatica.structmerge.tree.SourceLocation;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Unexpected input error.
     */
    record UnexpectedInput(SourceLocation location, String found, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(SourceLocation location, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }

    /**
     * Grammar-level error: undefined rule, malformed grammar text, nesting limit.
     */
    record SemanticError(SourceLocation location, String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }
}
