package org.pragmatica.litedoc.parser;

import org.pragmatica.litedoc.error.DiagnosticFormatter;
import org.pragmatica.litedoc.error.ParseError;
import org.pragmatica.litedoc.error.ParseErrorKind;
import org.pragmatica.litedoc.tree.Document;

import java.util.List;

/**
 * Result of parsing with error recovery - a best-effort document plus the diagnostics
 * collected on the way.
 *
 * <p>The document is always present. When the input was valid for the profile,
 * {@code errors} is empty and {@link #ok()} returns {@code true}.
 *
 * @param document the parsed document, possibly built with recovery strategies applied
 * @param errors   diagnostics sorted by the start of their span
 */
public record ParseResult(Document document, List<ParseError> errors) {
    public ParseResult {
        errors = List.copyOf(errors);
    }

    public boolean ok() {
        return errors.isEmpty();
    }

    public boolean hasError(ParseErrorKind kind) {
        return errors.stream()
                     .anyMatch(e -> e.kind() == kind);
    }

    public int errorCount() {
        return errors.size();
    }

    /**
     * Format all diagnostics against the source they were produced from.
     *
     * @param source   the parsed text
     * @param filename name for the location lines, may be {@code null}
     */
    public String formatDiagnostics(String source, String filename) {
        return DiagnosticFormatter.formatAll(errors, source, filename);
    }

    /**
     * Format all diagnostics with default filename "input".
     */
    public String formatDiagnostics(String source) {
        return formatDiagnostics(source, "input");
    }
}
