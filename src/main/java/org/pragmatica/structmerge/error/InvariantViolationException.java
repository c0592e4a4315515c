package org.pragmatica.structmerge.error;

/**
 * An internal consistency check failed: a matching lost injectivity, a node was placed twice
 * in the merged tree, and the like. The merge in progress must not produce output.
 */
public class InvariantViolationException extends RuntimeException {
    public InvariantViolationException(String message) {
        super(message);
    }
}
