package org.pragmatica.litedoc.error;

import org.pragmatica.litedoc.tree.SourceSpan;

/**
 * A diagnostic produced while parsing.
 *
 * @param kind    structural cause
 * @param span    span of the offending construct, always within the source
 * @param message human-readable description
 */
public record ParseError(ParseErrorKind kind, SourceSpan span, String message) {

    public static ParseError of(ParseErrorKind kind, SourceSpan span, String message) {
        return new ParseError(kind, span, message);
    }

    /**
     * Render this error with the offending source line and an underline.
     *
     * @param source   the text that was parsed
     * @param filename name shown in the location line, may be {@code null}
     */
    public String format(String source, String filename) {
        return DiagnosticFormatter.format(this, source, filename);
    }

    @Override
    public String toString() {
        return kind.display() + ": " + message + " at bytes " + span;
    }
}
