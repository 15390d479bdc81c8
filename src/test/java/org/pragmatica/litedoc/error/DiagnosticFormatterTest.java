package org.pragmatica.litedoc.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.litedoc.tree.SourceSpan;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticFormatterTest {

    private static final ParseError UNCLOSED =
        ParseError.of(ParseErrorKind.UNTERMINATED_CONTAINER, SourceSpan.of(0, 9), "'::callout' is not closed");

    @Test
    void format_underlinesSpan() {
        var formatted = DiagnosticFormatter.format(UNCLOSED, "::callout\ntext", "doc.ld");

        assertEquals("""
                     error[E001]: unterminated container
                       --> doc.ld:1:1
                       |
                     1 | ::callout
                       | ^^^^^^^^^ '::callout' is not closed
                       |
                     """, formatted);
    }

    @Test
    void format_columnsOnLaterLine() {
        var error = ParseError.of(ParseErrorKind.MALFORMED_TABLE, SourceSpan.of(5, 7), "bad cell");

        var formatted = DiagnosticFormatter.format(error, "ab\ncdef", null);

        assertThat(formatted).contains("--> 2:3\n")
                             .contains("2 | cdef\n")
                             .contains("  |   ^^ bad cell\n");
    }

    @Test
    void format_countsMultiByteCharactersOnce() {
        var error = ParseError.of(ParseErrorKind.INVALID_LIST_MARKER, SourceSpan.of(3, 4), "here");

        var formatted = DiagnosticFormatter.format(error, "é x", "f");

        assertThat(formatted).contains("--> f:1:3\n")
                             .contains("  |   ^ here\n");
    }

    @Test
    void format_emptySpanStillShowsCaret() {
        var error = ParseError.of(ParseErrorKind.MALFORMED_TABLE, SourceSpan.at(2), "missing");

        assertThat(DiagnosticFormatter.format(error, "ab", "f")).contains("  |   ^ missing\n");
    }

    @Test
    void formatSimple_singleLine() {
        var error = ParseError.of(ParseErrorKind.INVALID_HEADING_LEVEL, SourceSpan.of(5, 7), "too deep");

        assertEquals("doc.ld:2:3: error[E005]: too deep", DiagnosticFormatter.formatSimple(error, "ab\ncdef", "doc.ld"));
        assertEquals("input:1:1: error[E001]: '::callout' is not closed",
                     DiagnosticFormatter.formatSimple(UNCLOSED, "::callout", null));
    }

    @Test
    void formatAll_joinsDiagnostics() {
        assertEquals("", DiagnosticFormatter.formatAll(List.of(), "x", "f"));

        var all = DiagnosticFormatter.formatAll(List.of(UNCLOSED, UNCLOSED), "::callout", "f");
        assertEquals(2, all.split("error\\[E001]").length - 1);
    }

    @Test
    void errorKinds_haveDistinctCodes() {
        assertThat(ParseErrorKind.values()).extracting(ParseErrorKind::code)
                                           .containsExactly("E001", "E002", "E003", "E004", "E005", "E006", "E007");
        assertEquals("unterminated container: '::callout' is not closed at bytes 0..9", UNCLOSED.toString());
    }
}
