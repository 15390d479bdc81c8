package org.pragmatica.litedoc.error;

import org.pragmatica.litedoc.tree.SourceSpan;

/**
 * Containers, list items or quotes nested deeper than the configured maximum.
 * Thrown by both entry points; there is no recovery for it.
 */
public final class NestingDepthException extends ParseException {
    private final int limit;

    public NestingDepthException(SourceSpan span, int limit) {
        super(ParseError.of(ParseErrorKind.NESTING_TOO_DEEP, span, "nesting exceeds maximum depth of " + limit));
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
