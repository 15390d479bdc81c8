package org.pragmatica.litedoc.parser;

import org.pragmatica.litedoc.tree.ListKind;

import java.util.Optional;

/**
 * List item marker at the start of a line: {@code -}, {@code *}, {@code +}, or
 * one to nine digits followed by {@code .} or {@code )}; then a space or end of line.
 *
 * @param kind          ordered or unordered
 * @param number        the ordinal of an ordered marker
 * @param contentOffset index in the line text where the item content starts
 */
record ListMarker(ListKind kind, Optional<Long> number, int contentOffset) {
    private static final int MAX_ORDINAL_DIGITS = 9;
    private static final int MAX_CONTENT_PADDING = 4;

    static Optional<ListMarker> parse(String text) {
        int i = leadingSpaces(text);
        if (i > 3 || i >= text.length()) {
            return Optional.empty();
        }
        char c = text.charAt(i);
        if (c == '-' || c == '*' || c == '+') {
            return finish(text, i + 1, ListKind.UNORDERED, Optional.empty());
        }
        int digits = countDigits(text, i);
        if (digits == 0 || digits > MAX_ORDINAL_DIGITS || !isOrderedDelimiter(text, i + digits)) {
            return Optional.empty();
        }
        long number = Long.parseLong(text.substring(i, i + digits));
        return finish(text, i + digits + 1, ListKind.ORDERED, Optional.of(number));
    }

    /**
     * An ordered marker whose number has too many digits, e.g. {@code 1234567890. text}.
     */
    static boolean isOverlongOrdered(String text) {
        int i = leadingSpaces(text);
        int digits = countDigits(text, i);
        int after = i + digits + 1;
        return i <= 3
               && digits > MAX_ORDINAL_DIGITS
               && isOrderedDelimiter(text, i + digits)
               && (after >= text.length() || Line.isSpace(text.charAt(after)));
    }

    /**
     * A marker character directly followed by content, e.g. {@code -item} or {@code 2.item}.
     */
    static boolean isMissingSpace(String text) {
        int i = leadingSpaces(text);
        if (i >= text.length() - 1) {
            return false;
        }
        char c = text.charAt(i);
        if (c == '-' || c == '+') {
            char next = text.charAt(i + 1);
            return !Line.isSpace(next) && next != c;
        }
        int digits = countDigits(text, i);
        int after = i + digits + 1;
        return digits > 0
               && isOrderedDelimiter(text, i + digits)
               && after < text.length()
               && !Line.isSpace(text.charAt(after));
    }

    private static Optional<ListMarker> finish(String text, int markerEnd, ListKind kind, Optional<Long> number) {
        if (markerEnd == text.length()) {
            return Optional.of(new ListMarker(kind, number, markerEnd));
        }
        if (!Line.isSpace(text.charAt(markerEnd))) {
            return Optional.empty();
        }
        int spaces = 0;
        while (markerEnd + spaces < text.length() && Line.isSpace(text.charAt(markerEnd + spaces))) {
            spaces++;
        }
        if (markerEnd + spaces == text.length() || spaces > MAX_CONTENT_PADDING) {
            spaces = 1;
        }
        return Optional.of(new ListMarker(kind, number, markerEnd + spaces));
    }

    private static boolean isOrderedDelimiter(String text, int index) {
        return index < text.length() && (text.charAt(index) == '.' || text.charAt(index) == ')');
    }

    private static int leadingSpaces(String text) {
        int i = 0;
        while (i < text.length() && text.charAt(i) == ' ') {
            i++;
        }
        return i;
    }

    private static int countDigits(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isDigit(text.charAt(i)) && text.charAt(i) < 0x80) {
            i++;
        }
        return i - from;
    }
}
