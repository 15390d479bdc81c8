package org.pragmatica.litedoc.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.litedoc.LiteDoc;
import org.pragmatica.litedoc.error.NestingDepthException;
import org.pragmatica.litedoc.error.ParseError;
import org.pragmatica.litedoc.error.ParseErrorKind;
import org.pragmatica.litedoc.error.ParseException;
import org.pragmatica.litedoc.error.RecoveryStrategy;
import org.pragmatica.litedoc.tree.Block;
import org.pragmatica.litedoc.tree.Inline;
import org.pragmatica.litedoc.tree.SourceSpan;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ErrorRecoveryTest {

    // === Unterminated containers ===

    @Test
    void unterminatedCallout_keepsItsChildren() {
        var result = LiteDoc.parseWithRecovery("::callout type=warning\nInside text");

        assertThat(result.errors()).singleElement()
                                   .satisfies(e -> {
                                       assertEquals(ParseErrorKind.UNTERMINATED_CONTAINER, e.kind());
                                       assertEquals(SourceSpan.of(0, 22), e.span());
                                   });
        var callout = (Block.Callout) result.document().blocks().get(0);
        assertEquals("warning", callout.kind());
        assertEquals(SourceSpan.of(0, 34), callout.span());
        assertThat(callout.blocks()).singleElement().isInstanceOf(Block.Paragraph.class);
    }

    @Test
    void closeLine_bindsToInnermostContainer() {
        var result = LiteDoc.parseWithRecovery("::callout\n::quote\ninner\n::");

        assertThat(result.errors()).singleElement()
                                   .satisfies(e -> assertEquals(SourceSpan.of(0, 9), e.span()));
        var callout = (Block.Callout) result.document().blocks().get(0);
        var quote = (Block.Quote) callout.blocks().get(0);
        assertThat(quote.blocks()).singleElement().isInstanceOf(Block.Paragraph.class);
    }

    @Test
    void unterminatedListDirective_keepsItems() {
        var result = LiteDoc.parseWithRecovery("::list\n- a\n- b");

        assertTrue(result.hasError(ParseErrorKind.UNTERMINATED_CONTAINER));
        var list = (Block.ListBlock) result.document().blocks().get(0);
        assertThat(list.items()).hasSize(2);
        assertEquals(SourceSpan.of(0, 13), list.span());
    }

    @Test
    void unterminatedFence_runsToEndOfInput() {
        var result = LiteDoc.parseWithRecovery("```java\ncode");

        assertThat(result.errors()).singleElement()
                                   .satisfies(e -> assertEquals(SourceSpan.of(0, 7), e.span()));
        var code = (Block.CodeBlock) result.document().blocks().get(0);
        assertEquals(Optional.of("java"), code.language());
        assertEquals("code", code.content());
        assertEquals(SourceSpan.of(0, 12), code.span());
    }

    @Test
    void strayCloseLine_isPlainText() {
        var result = LiteDoc.parseWithRecovery("::\ntext");

        assertTrue(result.ok());
        assertThat(result.document().blocks()).singleElement().isInstanceOf(Block.Paragraph.class);
    }

    // === Unknown directives ===

    @Test
    void unknownDirective_becomesRawBlockWithDiagnostic() {
        var result = LiteDoc.parseWithRecovery("::chart\ndata\n::");

        assertThat(result.errors()).singleElement()
                                   .satisfies(e -> {
                                       assertEquals(ParseErrorKind.UNKNOWN_DIRECTIVE, e.kind());
                                       assertEquals(SourceSpan.of(0, 7), e.span());
                                   });
        var raw = (Block.RawBlock) result.document().blocks().get(0);
        assertEquals(Optional.of("chart"), raw.directive());
        assertEquals("data", raw.content());
        assertEquals(SourceSpan.of(0, 15), raw.span());
    }

    @Test
    void extendedDirective_passesThroughMarkdownSilently() {
        var result = LiteDoc.parseWithRecovery("::callout\ntext\n::", Profile.MD);

        assertTrue(result.ok());
        var raw = (Block.RawBlock) result.document().blocks().get(0);
        assertEquals(Optional.of("callout"), raw.directive());
    }

    @Test
    void extendedDirective_isFatalUnderStrictMarkdown() {
        var exception = assertThrows(ParseException.class,
                                     () -> LiteDoc.parse("::callout\ntext\n::", Profile.MD_STRICT));

        assertEquals(ParseErrorKind.UNKNOWN_DIRECTIVE, exception.kind());
        assertEquals(SourceSpan.of(0, 9), exception.span());
    }

    // === Headings ===

    @Test
    void headingLevel_isClamped() {
        var result = LiteDoc.parseWithRecovery("####### deep");

        assertThat(result.errors()).singleElement()
                                   .satisfies(e -> {
                                       assertEquals(ParseErrorKind.INVALID_HEADING_LEVEL, e.kind());
                                       assertEquals(SourceSpan.of(0, 12), e.span());
                                   });
        var heading = (Block.Heading) result.document().blocks().get(0);
        assertEquals(6, heading.level());
        assertEquals(new Inline.Text(SourceSpan.of(8, 12), "deep"), heading.content().get(0));
    }

    @Test
    void headingLevel_isNotFatalOutsideStrictProfile() {
        var document = LiteDoc.parse("####### deep");

        assertEquals(6, ((Block.Heading) document.blocks().get(0)).level());
    }

    @Test
    void strictEntryPoint_throwsFirstFatalError() {
        var exception = assertThrows(ParseException.class,
                                     () -> LiteDoc.parse("text\n\n####### a\n\n####### b", Profile.MD_STRICT));

        assertEquals(ParseErrorKind.INVALID_HEADING_LEVEL, exception.kind());
        assertEquals(SourceSpan.of(6, 15), exception.span());
    }

    // === Configured recovery ===

    @Test
    void headingLevelTreatedAsText_becomesParagraph() {
        var parser = LiteDoc.builder()
                            .recovery(ParseErrorKind.INVALID_HEADING_LEVEL, RecoveryStrategy.TREAT_AS_TEXT)
                            .build();

        var result = parser.parseWithRecovery("####### deep\nnext");

        assertThat(result.errors()).extracting(ParseError::kind)
                                   .containsExactly(ParseErrorKind.INVALID_HEADING_LEVEL);
        var paragraph = (Block.Paragraph) result.document().blocks().get(0);
        assertEquals(1, result.document().size());
        assertEquals(new Inline.Text(SourceSpan.of(0, 12), "####### deep"), paragraph.content().get(0));
    }

    @Test
    void unknownDirectiveTreatedAsText_becomesParagraphs() {
        var parser = LiteDoc.builder()
                            .recovery(ParseErrorKind.UNKNOWN_DIRECTIVE, RecoveryStrategy.TREAT_AS_TEXT)
                            .build();

        var result = parser.parseWithRecovery("::widget\nbody\n::");

        assertThat(result.errors()).extracting(ParseError::kind)
                                   .containsExactly(ParseErrorKind.UNKNOWN_DIRECTIVE);
        assertThat(result.document().blocks()).hasSize(2)
                                              .allMatch(b -> b instanceof Block.Paragraph);
    }

    @Test
    void defaultRecovery_substitutesRawBlock() {
        var result = LiteDoc.builder().build().parseWithRecovery("::widget\nbody\n::");

        assertThat(result.document().blocks()).singleElement().isInstanceOf(Block.RawBlock.class);
    }

    @Test
    void builderRecovery_rejectsUnsupportedStrategy() {
        var builder = LiteDoc.builder();

        assertThrows(IllegalArgumentException.class,
                     () -> builder.recovery(ParseErrorKind.MALFORMED_TABLE, RecoveryStrategy.CLAMP_LEVEL));
    }

    // === Ordering and formatting ===

    @Test
    void errors_areOrderedBySourceOffset() {
        var result = LiteDoc.parseWithRecovery("::callout\n####### h");

        assertThat(result.errors()).extracting(ParseError::kind)
                                   .containsExactly(ParseErrorKind.UNTERMINATED_CONTAINER,
                                                    ParseErrorKind.INVALID_HEADING_LEVEL);
    }

    @Test
    void diagnostics_areFormattedWithCodes() {
        var source = "::callout\n####### h";
        var formatted = LiteDoc.parseWithRecovery(source).formatDiagnostics(source, "doc.ld");

        assertThat(formatted).contains("error[E001]: unterminated container")
                             .contains("--> doc.ld:1:1")
                             .contains("error[E005]: invalid heading level")
                             .contains("--> doc.ld:2:1");
    }

    // === Nesting limit ===

    @Test
    void nestedCallouts_overLimitAbortBothEntryPoints() {
        var parser = LiteDoc.builder().maxNestingDepth(3).build();
        var input = "::callout\n::callout\n::callout\n::callout\nx\n::\n::\n::\n::";

        var exception = assertThrows(NestingDepthException.class, () -> parser.parseWithRecovery(input));
        assertEquals(ParseErrorKind.NESTING_TOO_DEEP, exception.kind());
        assertEquals(SourceSpan.of(30, 39), exception.span());
        assertEquals(3, exception.limit());
        assertThrows(NestingDepthException.class, () -> parser.parse(input));
    }

    @Test
    void nestedCallouts_atLimitParse() {
        var parser = LiteDoc.builder().maxNestingDepth(3).build();

        var result = parser.parseWithRecovery("::callout\n::callout\n::callout\nx\n::\n::\n::");

        assertTrue(result.ok());
    }

    @Test
    void nestedListItems_countTowardsLimit() {
        var parser = LiteDoc.builder().maxNestingDepth(3).build();

        assertThrows(NestingDepthException.class, () -> parser.parse("- a\n  - b\n    - c\n      - d"));
        assertEquals(1, parser.parse("- a\n  - b\n    - c").size());
    }

    @Test
    void quoteMarkers_countTowardsDefaultLimit() {
        assertThrows(NestingDepthException.class, () -> LiteDoc.parseWithRecovery(">".repeat(65) + " deep"));

        var result = LiteDoc.parseWithRecovery(">".repeat(64) + " deep");
        assertTrue(result.ok());
    }
}
