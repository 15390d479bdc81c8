package org.pragmatica.litedoc.parser;

/**
 * A view of one source line. {@code text} is always {@code source.substring(start, end)};
 * stripping a prefix advances {@code start} so positions keep pointing into the source.
 *
 * @param text  line content without the terminator
 * @param start character index of the first content character
 * @param end   character index just past the content (before {@code \r\n} or {@code \n})
 * @param next  character index just past the terminator
 */
record Line(String text, int start, int end, int next) {
    private static final int TAB_STOP = 4;

    boolean isBlank() {
        return text.isBlank();
    }

    String trimmed() {
        return text.strip();
    }

    /**
     * Leading whitespace width in columns, tabs advancing to the next multiple of four.
     */
    int indent() {
        int columns = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ' ') {
                columns++;
            } else if (c == '\t') {
                columns += TAB_STOP - columns % TAB_STOP;
            } else {
                break;
            }
        }
        return columns;
    }

    /**
     * Remove leading whitespace worth at most {@code columns} columns.
     */
    Line stripIndent(int columns) {
        int removed = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int width = c == ' ' ? 1 : c == '\t' ? TAB_STOP - removed % TAB_STOP : 0;
            if (width == 0 || removed + width > columns) {
                break;
            }
            removed += width;
            i++;
        }
        return drop(i);
    }

    Line stripLeading() {
        int i = 0;
        while (i < text.length() && isSpace(text.charAt(i))) {
            i++;
        }
        return drop(i);
    }

    Line stripTrailing() {
        int i = text.length();
        while (i > 0 && isSpace(text.charAt(i - 1))) {
            i--;
        }
        return i == text.length() ? this : new Line(text.substring(0, i), start, start + i, next);
    }

    Line drop(int chars) {
        if (chars == 0) {
            return this;
        }
        int n = Math.min(chars, text.length());
        return new Line(text.substring(n), start + n, end, next);
    }

    /**
     * Zero-length line at this line's start, used to separate paragraphs in synthesized bodies.
     */
    Line blank() {
        return new Line("", start, start, start);
    }

    static boolean isSpace(char c) {
        return c == ' ' || c == '\t';
    }
}
