package org.pragmatica.litedoc.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits input into lines. A {@code \r} directly before {@code \n} belongs to the terminator.
 */
final class LineScanner {
    private static final int DEFAULT_LINE_CAPACITY = 64;

    private LineScanner() {}

    static List<Line> scan(String input) {
        var lines = new ArrayList<Line>(DEFAULT_LINE_CAPACITY);
        int pos = 0;
        int length = input.length();
        while (pos < length) {
            int newline = input.indexOf('\n', pos);
            int end = newline < 0 ? length : newline;
            int next = newline < 0 ? length : newline + 1;
            int contentEnd = end > pos && input.charAt(end - 1) == '\r' ? end - 1 : end;
            lines.add(new Line(input.substring(pos, contentEnd), pos, contentEnd, next));
            pos = next;
        }
        return lines;
    }
}
