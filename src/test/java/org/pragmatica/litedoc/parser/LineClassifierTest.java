package org.pragmatica.litedoc.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pragmatica.litedoc.tree.ListKind;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LineClassifierTest {

    private static Line line(String text) {
        return new Line(text, 0, text.length(), text.length());
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
        "'';BLANK",
        "'   ';BLANK",
        "'    # indented';TEXT",
        "::;DIRECTIVE_CLOSE",
        "'  ::  ';DIRECTIVE_CLOSE",
        "::callout type=note;DIRECTIVE_OPEN",
        "::1st;TEXT",
        "```java;CODE_FENCE",
        "~~~;CODE_FENCE",
        "``` a`b;TEXT",
        "$$;MATH_FENCE",
        "## Title;HEADING",
        "#hashtag;TEXT",
        "---;THEMATIC_BREAK",
        "* * *;THEMATIC_BREAK",
        "- item;LIST_ITEM",
        "12) item;LIST_ITEM",
        "-item;TEXT",
        "> quote;QUOTE",
        "| a | b |;TABLE_ROW",
        "<div class=\"x\">;HTML",
        "<https://example.com>;TEXT",
        "plain words;TEXT"
    })
    void classify_underLitedoc(String text, LineKind expected) {
        assertEquals(expected, LineClassifier.classify(line(text), Profile.LITEDOC));
    }

    @Test
    void mathFence_isTextWithoutMath() {
        assertEquals(LineKind.TEXT, LineClassifier.classify(line("$$"), Profile.MD));
    }

    @Test
    void fence_languageIsFirstInfoWord() {
        var fence = LineClassifier.fence(line("````java title=x")).orElseThrow();

        assertEquals('`', fence.marker());
        assertEquals(4, fence.length());
        assertEquals(Optional.of("java"), fence.language());
        assertTrue(LineClassifier.fence(line("```")).orElseThrow().language().isEmpty());
    }

    @Test
    void closesFence_needsSameMarkerAndLength() {
        var fence = LineClassifier.fence(line("````")).orElseThrow();

        assertFalse(LineClassifier.closesFence(line("```"), fence));
        assertFalse(LineClassifier.closesFence(line("~~~~"), fence));
        assertFalse(LineClassifier.closesFence(line("```` x"), fence));
        assertTrue(LineClassifier.closesFence(line("`````"), fence));
    }

    @Test
    void headingLevel_mayExceedSix() {
        assertEquals(7, LineClassifier.headingLevel(line("####### deep")));
        assertEquals(1, LineClassifier.headingLevel(line("#")));
        assertEquals(0, LineClassifier.headingLevel(line("#x")));
    }

    @Test
    void tableSeparator() {
        assertTrue(LineClassifier.isTableSeparator(line("|:--|--:|")));
        assertTrue(LineClassifier.isTableSeparator(line("--- | :-:")));
        assertFalse(LineClassifier.isTableSeparator(line("| a |")));
        assertFalse(LineClassifier.isTableSeparator(line("---")));
    }

    // === List markers ===

    @Test
    void listMarker_contentOffset() {
        assertEquals(new ListMarker(ListKind.UNORDERED, Optional.empty(), 2), ListMarker.parse("- x").orElseThrow());
        assertEquals(new ListMarker(ListKind.ORDERED, Optional.of(12L), 5), ListMarker.parse("12)  x").orElseThrow());
        assertEquals(2, ListMarker.parse("-      x").orElseThrow().contentOffset());
        assertEquals(1, ListMarker.parse("-").orElseThrow().contentOffset());
    }

    @Test
    void listMarker_rejectsNonMarkers() {
        assertTrue(ListMarker.parse("-x").isEmpty());
        assertTrue(ListMarker.parse("1234567890. x").isEmpty());
        assertTrue(ListMarker.parse("    - x").isEmpty());
        assertTrue(ListMarker.parse("1:x").isEmpty());
    }

    @Test
    void listMarker_malformedShapes() {
        assertTrue(ListMarker.isOverlongOrdered("1234567890. x"));
        assertFalse(ListMarker.isOverlongOrdered("123. x"));
        assertTrue(ListMarker.isMissingSpace("-x"));
        assertTrue(ListMarker.isMissingSpace("2.x"));
        assertFalse(ListMarker.isMissingSpace("*x"));
        assertFalse(ListMarker.isMissingSpace("--"));
        assertFalse(ListMarker.isMissingSpace("- x"));
    }
}
