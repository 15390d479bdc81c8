package org.pragmatica.litedoc.parser;

import java.util.List;

/**
 * Text of a leaf block assembled from one or more line segments, joined by {@code \n}.
 *
 * <p>Each character of the assembled text knows the source range it came from, so inline
 * spans can be mapped back even when quote markers or indentation were removed between
 * segments. A joining newline maps to the line terminator it replaces.
 */
final class LeafText {
    private final String text;
    private final int[] starts;
    private final int[] ends;
    private final int origin;

    private LeafText(String text, int[] starts, int[] ends, int origin) {
        this.text = text;
        this.starts = starts;
        this.ends = ends;
        this.origin = origin;
    }

    static LeafText of(Line line) {
        return of(List.of(line));
    }

    static LeafText of(List<Line> lines) {
        var builder = new StringBuilder();
        int total = 0;
        for (var line : lines) {
            total += line.text().length() + 1;
        }
        var starts = new int[Math.max(total - 1, 0)];
        var ends = new int[starts.length];
        int v = 0;
        for (int j = 0; j < lines.size(); j++) {
            var line = lines.get(j);
            if (j > 0) {
                var previous = lines.get(j - 1);
                int terminatorEnd = Math.max(previous.end(), Math.min(previous.next(), line.start()));
                builder.append('\n');
                starts[v] = previous.end();
                ends[v] = terminatorEnd;
                v++;
            }
            var segment = line.text();
            builder.append(segment);
            for (int k = 0; k < segment.length(); k++) {
                starts[v] = line.start() + k;
                ends[v] = line.start() + k + 1;
                v++;
            }
        }
        int origin = lines.isEmpty() ? 0 : lines.get(0).start();
        return new LeafText(builder.toString(), starts, ends, origin);
    }

    /**
     * Contiguous slice of the source, e.g. a quoted attribute value.
     */
    static LeafText slice(String source, int start, int end) {
        return of(new Line(source.substring(start, end), start, end, end));
    }

    String text() {
        return text;
    }

    int length() {
        return text.length();
    }

    char charAt(int index) {
        return text.charAt(index);
    }

    /**
     * Source character index where the assembled range {@code [from, to)} starts.
     */
    int sourceStart(int from, int to) {
        if (from == to) {
            return sourceEnd(from, to);
        }
        return starts[from];
    }

    /**
     * Source character index where the assembled range {@code [from, to)} ends.
     */
    int sourceEnd(int from, int to) {
        if (to > 0) {
            return ends[to - 1];
        }
        return starts.length > 0 ? starts[0] : origin;
    }
}
