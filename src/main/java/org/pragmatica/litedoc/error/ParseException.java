package org.pragmatica.litedoc.error;

import org.pragmatica.litedoc.tree.SourceSpan;

/**
 * Thrown by the strict entry point on the first fatal diagnostic.
 */
public class ParseException extends IllegalArgumentException {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.toString());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    public ParseErrorKind kind() {
        return error.kind();
    }

    public SourceSpan span() {
        return error.span();
    }
}
