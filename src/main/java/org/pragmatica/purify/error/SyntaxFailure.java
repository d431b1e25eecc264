package org.pragmatica.purify.error;

/**
 * Unwinds a parser on the first fatal error. Parsers throw it internally and turn it into a
 * failed {@link ParseOutcome} at their public entry points; it never reaches callers.
 */
public final class SyntaxFailure extends RuntimeException {
    private final transient ParseError error;

    public SyntaxFailure(ParseError error) {
        super(error.message(), null, false, false);
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
