package org.pragmatica.structmerge.error;

import org.pragmatica.structmerge.tree.Revision;
import org.pragmatica.structmerge.tree.SourceLocation;

/**
 * Reasons why a structural merge is unavailable for a set of revisions. The caller is
 * expected to fall back to a line-based merge.
 */
public sealed interface MergeError {
    String message();

    /**
     * One of the revisions does not parse under the language grammar.
     */
    record ParseFailure(Revision revision, ParseError error) implements MergeError {
        @Override
        public String message() {
            return "Failed to parse " + revision.name().toLowerCase() + " revision: " + error.message();
        }
    }

    /**
     * Rendering the unmodified tree of a revision does not reproduce its text.
     */
    record RoundTripMismatch(Revision revision, SourceLocation location) implements MergeError {
        @Override
        public String message() {
            return "Rendering " + revision.name().toLowerCase() + " revision diverges from its text at " + location;
        }
    }

    /**
     * An internal consistency check failed during the merge.
     */
    record InvariantViolation(String detail) implements MergeError {
        @Override
        public String message() {
            return "Internal invariant violated: " + detail;
        }
    }

    /**
     * No language is registered under the requested name or for the file path.
     */
    record UnsupportedLanguage(String language) implements MergeError {
        @Override
        public String message() {
            return "No structural merge support for '" + language + "'";
        }
    }

    /**
     * The conflict markers of a text to solve cannot be read.
     */
    record UnreadableConflicts(ParseError error) implements MergeError {
        @Override
        public String message() {
            return "Failed to read conflict markers: " + error.message();
        }
    }

    /**
     * Merging the revisions again does not improve on the conflicts of the text to solve.
     */
    record NoBetterSolution(int conflictCount) implements MergeError {
        @Override
        public String message() {
            return "Structural merge does not improve on the " + conflictCount + " conflict(s) of the given text";
        }
    }
}
