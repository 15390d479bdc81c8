package org.pragmatica.litedoc.parser;

import java.util.Optional;

/**
 * Line classification rules shared by the block-level parsers.
 */
final class LineClassifier {
    private static final int MAX_BLOCK_INDENT = 3;
    private static final int MIN_FENCE_LENGTH = 3;
    private static final int MIN_BREAK_MARKERS = 3;

    private LineClassifier() {}

    /**
     * An open code or math fence.
     *
     * @param marker backtick, tilde or dollar
     * @param length run length of the opening fence
     * @param info   text after the fence, stripped
     */
    record Fence(char marker, int length, String info) {
        Optional<String> language() {
            if (info.isEmpty()) {
                return Optional.empty();
            }
            int space = 0;
            while (space < info.length() && !Character.isWhitespace(info.charAt(space))) {
                space++;
            }
            return Optional.of(info.substring(0, space));
        }
    }

    static LineKind classify(Line line, Profile profile) {
        if (line.isBlank()) {
            return LineKind.BLANK;
        }
        if (line.indent() > MAX_BLOCK_INDENT) {
            return LineKind.TEXT;
        }
        if (isDirectiveClose(line)) {
            return LineKind.DIRECTIVE_CLOSE;
        }
        if (isDirectiveOpen(line)) {
            return LineKind.DIRECTIVE_OPEN;
        }
        var fence = fence(line);
        if (fence.isPresent()) {
            if (fence.get().marker() == '$') {
                return profile.recognizes(Construct.MATH) ? LineKind.MATH_FENCE : LineKind.TEXT;
            }
            return LineKind.CODE_FENCE;
        }
        if (headingLevel(line) > 0) {
            return LineKind.HEADING;
        }
        if (isThematicBreak(line)) {
            return LineKind.THEMATIC_BREAK;
        }
        if (ListMarker.parse(line.text()).isPresent()) {
            return LineKind.LIST_ITEM;
        }
        var trimmed = line.trimmed();
        if (trimmed.startsWith(">") && profile.recognizes(Construct.QUOTE)) {
            return LineKind.QUOTE;
        }
        if (trimmed.startsWith("|")) {
            return LineKind.TABLE_ROW;
        }
        if (isHtmlStart(trimmed) && profile.recognizes(Construct.HTML)) {
            return LineKind.HTML;
        }
        return LineKind.TEXT;
    }

    static boolean isDirectiveClose(Line line) {
        return line.indent() <= MAX_BLOCK_INDENT && line.trimmed().equals("::");
    }

    static boolean isDirectiveOpen(Line line) {
        if (line.indent() > MAX_BLOCK_INDENT) {
            return false;
        }
        var trimmed = line.trimmed();
        return trimmed.length() > 2 && trimmed.startsWith("::") && isAsciiLetter(trimmed.charAt(2));
    }

    static Optional<Fence> fence(Line line) {
        var trimmed = line.stripLeading().text();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        char marker = trimmed.charAt(0);
        if (marker != '`' && marker != '~' && marker != '$') {
            return Optional.empty();
        }
        int run = runLength(trimmed, 0, marker);
        int minimum = marker == '$' ? 2 : MIN_FENCE_LENGTH;
        if (run < minimum) {
            return Optional.empty();
        }
        var info = trimmed.substring(run).strip();
        if (marker == '`' && info.indexOf('`') >= 0) {
            return Optional.empty();
        }
        if (marker == '$' && !info.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Fence(marker, run, info));
    }

    static boolean closesFence(Line line, Fence fence) {
        if (line.indent() > MAX_BLOCK_INDENT) {
            return false;
        }
        var trimmed = line.trimmed();
        int run = runLength(trimmed, 0, fence.marker());
        return run >= fence.length() && run == trimmed.length();
    }

    /**
     * Number of leading {@code #} characters of an ATX heading line, or 0 when the line is not one.
     * The count may exceed 6; callers report and clamp.
     */
    static int headingLevel(Line line) {
        var text = line.stripLeading().text();
        int level = runLength(text, 0, '#');
        if (level == 0) {
            return 0;
        }
        if (level < text.length() && !Line.isSpace(text.charAt(level))) {
            return 0;
        }
        return level;
    }

    static boolean isThematicBreak(Line line) {
        var trimmed = line.trimmed();
        if (trimmed.isEmpty()) {
            return false;
        }
        char marker = trimmed.charAt(0);
        if (marker != '-' && marker != '*' && marker != '_') {
            return false;
        }
        int count = 0;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == marker) {
                count++;
            } else if (!Line.isSpace(c)) {
                return false;
            }
        }
        return count >= MIN_BREAK_MARKERS;
    }

    /**
     * Separator row of a table: pipe-separated cells made of {@code -} and {@code :} only.
     */
    static boolean isTableSeparator(Line line) {
        var trimmed = line.trimmed();
        if (!trimmed.contains("-")) {
            return false;
        }
        boolean sawCell = false;
        for (var cell : TableParser.splitCells(trimmed)) {
            var content = cell.strip();
            if (content.isEmpty()) {
                return false;
            }
            for (int i = 0; i < content.length(); i++) {
                char c = content.charAt(i);
                if (c != '-' && c != ':') {
                    return false;
                }
            }
            sawCell = true;
        }
        return sawCell && (trimmed.startsWith("|") || trimmed.contains("|"));
    }

    static boolean isHtmlStart(String trimmed) {
        if (trimmed.length() < 2 || trimmed.charAt(0) != '<') {
            return false;
        }
        char c = trimmed.charAt(1);
        if (!(isAsciiLetter(c) || c == '/' || c == '!')) {
            return false;
        }
        int close = trimmed.indexOf('>');
        // <https://...> at line start is an autolink, not markup.
        return close < 0 || !trimmed.substring(1, close).contains(":");
    }

    static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static int runLength(String text, int from, char c) {
        int i = from;
        while (i < text.length() && text.charAt(i) == c) {
            i++;
        }
        return i - from;
    }
}
