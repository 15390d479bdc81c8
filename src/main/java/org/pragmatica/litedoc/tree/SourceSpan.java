package org.pragmatica.litedoc.tree;

/**
 * A range of UTF-8 byte offsets in source text, from start (inclusive) to end (exclusive).
 * Spans are plain values and hold no reference to the text they were taken from.
 */
public record SourceSpan(int start, int end) {

    public static final SourceSpan EMPTY = new SourceSpan(0, 0);

    public SourceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span " + start + ".." + end);
        }
    }

    public static SourceSpan of(int start, int end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(int offset) {
        return new SourceSpan(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public boolean encloses(SourceSpan other) {
        return other.start >= start && other.end <= end;
    }

    public SourceSpan merge(SourceSpan other) {
        return new SourceSpan(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
