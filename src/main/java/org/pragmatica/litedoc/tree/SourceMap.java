package org.pragmatica.litedoc.tree;

import java.util.Arrays;

/**
 * Maps character indices of a Java string to UTF-8 byte offsets, and byte offsets to
 * line/column locations.
 *
 * <p>The parser works on {@code char} indices internally; every span it emits goes
 * through {@link #span(int, int)} so node spans are byte offsets into the UTF-8 encoding
 * of the source text. For pure ASCII input no offset table is allocated.
 */
public final class SourceMap {
    private final int length;
    private final int[] byteOffsets;
    private final int[] lineStarts;

    private SourceMap(int length, int[] byteOffsets, int[] lineStarts) {
        this.length = length;
        this.byteOffsets = byteOffsets;
        this.lineStarts = lineStarts;
    }

    public static SourceMap of(String source) {
        int length = source.length();
        int[] offsets = null;
        int lines = 1;
        for (int i = 0; i < length; i++) {
            char c = source.charAt(i);
            if (c == '\n') {
                lines++;
            }
            if (c >= 0x80 && offsets == null) {
                offsets = new int[length + 1];
                for (int j = 0; j <= i; j++) {
                    offsets[j] = j;
                }
            }
            if (offsets != null) {
                offsets[i + 1] = offsets[i] + utf8Length(source, i);
            }
        }
        var lineStarts = new int[lines];
        int line = 1;
        for (int i = 0; i < length; i++) {
            if (source.charAt(i) == '\n') {
                lineStarts[line++] = i + 1;
            }
        }
        return new SourceMap(length, offsets, lineStarts);
    }

    // A surrogate pair encodes to four bytes, two are attributed to each half.
    // An unpaired surrogate is encoded as the one-byte replacement '?'.
    private static int utf8Length(String source, int index) {
        char c = source.charAt(index);
        if (c < 0x80) {
            return 1;
        }
        if (Character.isHighSurrogate(c)) {
            return index + 1 < source.length() && Character.isLowSurrogate(source.charAt(index + 1)) ? 2 : 1;
        }
        if (Character.isLowSurrogate(c)) {
            return index > 0 && Character.isHighSurrogate(source.charAt(index - 1)) ? 2 : 1;
        }
        return c < 0x800 ? 2 : 3;
    }

    /**
     * Length of the source in characters.
     */
    public int length() {
        return length;
    }

    /**
     * Length of the source in UTF-8 bytes.
     */
    public int byteLength() {
        return byteOffset(length);
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public int byteOffset(int charIndex) {
        if (charIndex < 0 || charIndex > length) {
            throw new IndexOutOfBoundsException("Character index " + charIndex + " outside 0.." + length);
        }
        return byteOffsets == null ? charIndex : byteOffsets[charIndex];
    }

    /**
     * Character index of the first character starting at or after the given byte offset.
     */
    public int charIndex(int byteOffset) {
        if (byteOffsets == null) {
            return Math.min(Math.max(byteOffset, 0), length);
        }
        int idx = Arrays.binarySearch(byteOffsets, byteOffset);
        if (idx >= 0) {
            // Offsets are strictly increasing, so an exact hit is unique.
            return idx;
        }
        return Math.min(-idx - 1, length);
    }

    public SourceSpan span(int charStart, int charEnd) {
        return SourceSpan.of(byteOffset(charStart), byteOffset(charEnd));
    }

    public SourceLocation locate(int byteOffset) {
        int charIdx = charIndex(byteOffset);
        int lineIdx = Arrays.binarySearch(lineStarts, charIdx);
        if (lineIdx < 0) {
            lineIdx = -lineIdx - 2;
        }
        return SourceLocation.at(lineIdx + 1, charIdx - lineStarts[lineIdx] + 1, byteOffset(charIdx));
    }

    /**
     * Character index at which the given 1-based line starts.
     */
    public int lineStart(int line) {
        return lineStarts[line - 1];
    }
}
