package org.pragmatica.structmerge.error;

/**
 * Raised when grammar text or input text cannot be parsed.
 */
public class ParseException extends Exception {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
