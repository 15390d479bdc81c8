package org.pragmatica.litedoc.parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DirectiveHeaderTest {

    private static DirectiveHeader header(String text) {
        return DirectiveHeader.parse(new Line(text, 0, text.length(), text.length())).orElseThrow();
    }

    @Test
    void parse_nameAndAttributes() {
        var header = header("::callout type=warning title=\"Read \\\"this\\\"\" collapsed");

        assertEquals("callout", header.name());
        assertEquals(Optional.of("warning"), header.attribute("type"));
        assertEquals(Optional.of("Read \"this\""), header.attribute("title"));
        assertTrue(header.flag("collapsed"));
        assertTrue(header.attribute("collapsed").isEmpty());
        assertEquals(List.of("type", "title", "collapsed"), List.copyOf(header.attributes().keySet()));
    }

    @Test
    void quotedValue_keepsRawSourceRange() {
        var attribute = header("::figure caption=\"A b\"").rawAttribute("caption").orElseThrow();

        assertEquals("A b", attribute.value());
        assertEquals(18, attribute.rawStart());
        assertEquals(21, attribute.rawEnd());
    }

    @Test
    void repeatedKey_keepsLastValue() {
        assertEquals(Optional.of("b"), header("::callout type=a type=b").attribute("type"));
    }

    @Test
    void unterminatedQuote_runsToEndOfLine() {
        assertEquals(Optional.of("open end"), header("::callout title=\"open end").attribute("title"));
    }

    @Test
    void noAttributes() {
        var header = header("  ::quote");

        assertEquals("quote", header.name());
        assertTrue(header.attributes().isEmpty());
        assertFalse(header.flag("anything"));
    }

    @Test
    void parse_rejectsNonDirectiveLines() {
        for (var text : List.of("::", "::9", "text ::callout", "     ::callout")) {
            assertTrue(DirectiveHeader.parse(new Line(text, 0, text.length(), text.length())).isEmpty(), text);
        }
    }
}
