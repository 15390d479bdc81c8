package org.pragmatica.litedoc.error;

import org.pragmatica.litedoc.tree.SourceMap;

import java.util.List;

/**
 * Renders diagnostics in compiler style.
 *
 * <p>Example output:
 * <pre>
 * error[E001]: unterminated container
 *   --> guide.ld:3:1
 *   |
 * 3 | ::callout type=note
 *   | ^^^^^^^^^^^^^^^^^^^ '::callout' is not closed
 *   |
 * </pre>
 */
public final class DiagnosticFormatter {
    private static final int MAX_LINES = 4;

    private DiagnosticFormatter() {}

    public static String format(ParseError error, String source, String filename) {
        var map = SourceMap.of(source);
        var start = map.locate(Math.min(error.span().start(), map.byteLength()));
        var end = map.locate(Math.min(error.span().end(), map.byteLength()));

        int firstLine = start.line();
        int lastLine = end.line();
        // A span ending right after a newline does not touch the next line.
        if (lastLine > firstLine && end.column() == 1) {
            lastLine--;
        }
        int shownLast = Math.min(lastLine, firstLine + MAX_LINES - 1);
        int gutterWidth = String.valueOf(shownLast).length();

        var sb = new StringBuilder();
        sb.append("error[").append(error.kind().code()).append("]: ").append(error.kind().display()).append("\n");
        sb.append(" ".repeat(gutterWidth + 1)).append("--> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(start.line()).append(":").append(start.column()).append("\n");
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum = firstLine; lineNum <= shownLast; lineNum++) {
            var content = lineContent(source, map, lineNum);
            int fromCol = lineNum == firstLine ? start.column() : 1;
            int toCol = lineNum == lastLine && end.line() == lastLine ? end.column() : content.length() + 1;
            int width = Math.max(1, toCol - fromCol);

            sb.append(String.format("%" + gutterWidth + "d", lineNum)).append(" | ").append(content).append("\n");
            sb.append(" ".repeat(gutterWidth)).append(" | ")
              .append(" ".repeat(fromCol - 1))
              .append("^".repeat(width));
            if (lineNum == shownLast && !error.message().isEmpty()) {
                sb.append(" ").append(error.message());
            }
            sb.append("\n");
        }
        if (shownLast < lastLine) {
            sb.append(" ".repeat(gutterWidth)).append(" | ...\n");
        }
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        return sb.toString();
    }

    /**
     * Render several diagnostics, separated by newlines.
     */
    public static String formatAll(List<ParseError> errors, String source, String filename) {
        if (errors.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var error : errors) {
            sb.append(format(error, source, filename)).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form: {@code file:line:col: error[code]: message}.
     */
    public static String formatSimple(ParseError error, String source, String filename) {
        var loc = SourceMap.of(source).locate(error.span().start());
        return String.format("%s:%d:%d: error[%s]: %s",
                             filename == null ? "input" : filename,
                             loc.line(),
                             loc.column(),
                             error.kind().code(),
                             error.message());
    }

    private static String lineContent(String source, SourceMap map, int line) {
        int from = map.lineStart(line);
        int to = source.indexOf('\n', from);
        if (to < 0) {
            to = source.length();
        }
        if (to > from && source.charAt(to - 1) == '\r') {
            to--;
        }
        return source.substring(from, to);
    }
}
