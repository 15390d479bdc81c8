package org.pragmatica.litedoc.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.litedoc.LiteDoc;
import org.pragmatica.litedoc.error.ParseErrorKind;
import org.pragmatica.litedoc.tree.Block;
import org.pragmatica.litedoc.tree.Inline;
import org.pragmatica.litedoc.tree.SourceSpan;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class BlockParserTest {

    private static List<Block> blocks(String input) {
        return LiteDoc.parse(input).blocks();
    }

    private static String plain(List<Inline> content) {
        var sb = new StringBuilder();
        for (var inline : content) {
            if (inline instanceof Inline.Text text) {
                sb.append(text.content());
            } else if (inline instanceof Inline.SoftBreak) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    // === Headings and paragraphs ===

    @Test
    void heading_closingSequenceIsRemoved() {
        var heading = assertInstanceOf(Block.Heading.class, blocks("## Title ##").get(0));

        assertEquals(2, heading.level());
        assertEquals("Title", plain(heading.content()));
        assertEquals(SourceSpan.of(0, 11), heading.span());
    }

    @Test
    void hashWithoutSpace_isParagraph() {
        assertInstanceOf(Block.Paragraph.class, blocks("#hashtag").get(0));
    }

    @Test
    void consecutiveTextLines_formOneParagraph() {
        var result = blocks("first line\nsecond line\n\nnext paragraph");

        assertThat(result).hasSize(2);
        var first = (Block.Paragraph) result.get(0);
        assertEquals("first line\nsecond line", plain(first.content()));
        assertEquals(SourceSpan.of(0, 22), first.span());
    }

    @Test
    void paragraph_endsAtHeading() {
        var result = blocks("text\n# Heading");

        assertThat(result).hasSize(2);
        assertInstanceOf(Block.Heading.class, result.get(1));
    }

    @Test
    void strayCloseLine_isParagraphText() {
        var paragraph = assertInstanceOf(Block.Paragraph.class, blocks("::").get(0));

        assertEquals("::", plain(paragraph.content()));
    }

    // === Thematic breaks ===

    @Test
    void thematicBreak_variants() {
        var result = blocks("---\n\n***\n\n_ _ _");

        assertThat(result).hasSize(3)
                          .allSatisfy(block -> assertInstanceOf(Block.ThematicBreak.class, block));
    }

    @Test
    void thematicBreak_takesPriorityOverListMarker() {
        var result = blocks("* * *");

        assertThat(result).singleElement().isInstanceOf(Block.ThematicBreak.class);
    }

    // === Fenced blocks ===

    @Test
    void codeFence_keepsRawContentAndLanguage() {
        var code = assertInstanceOf(Block.CodeBlock.class, blocks("```python\nprint(1)\n*x*\n```").get(0));

        assertEquals("python", code.language().orElseThrow());
        assertEquals("print(1)\n*x*", code.content());
        assertEquals(SourceSpan.of(0, 26), code.span());
    }

    @Test
    void codeFence_closesOnlyOnLongEnoughFence() {
        var code = assertInstanceOf(Block.CodeBlock.class, blocks("~~~~\n~~~\ninside\n~~~~~").get(0));

        assertTrue(code.language().isEmpty());
        assertEquals("~~~\ninside", code.content());
    }

    @Test
    void codeFence_unterminatedKeepsContentToEnd() {
        var result = LiteDoc.parseWithRecovery("```\nline one\nline two");

        assertTrue(result.hasError(ParseErrorKind.UNTERMINATED_CONTAINER));
        var code = (Block.CodeBlock) result.document().blocks().get(0);
        assertEquals("line one\nline two", code.content());
    }

    @Test
    void mathFence_underLitedoc() {
        var math = assertInstanceOf(Block.MathBlock.class, blocks("$$\nx^2 + y^2\n$$").get(0));

        assertEquals("x^2 + y^2", math.content());
    }

    @Test
    void mathFence_isTextUnderMarkdown() {
        var result = LiteDoc.parse("$$\nx\n$$", Profile.MD).blocks();

        assertThat(result).singleElement().isInstanceOf(Block.Paragraph.class);
    }

    @Test
    void mathDirective_keepsRawContent() {
        var math = assertInstanceOf(Block.MathBlock.class, blocks("::math\nE = mc^2\n::").get(0));

        assertEquals("E = mc^2", math.content());
        assertEquals(SourceSpan.of(0, 18), math.span());
    }

    // === Quotes ===

    @Test
    void quoteLines_stripMarkers() {
        var quote = assertInstanceOf(Block.Quote.class, blocks("> a\n> b").get(0));

        var paragraph = (Block.Paragraph) quote.blocks().get(0);
        assertEquals("a\nb", plain(paragraph.content()));
        assertEquals(SourceSpan.of(2, 7), paragraph.span());
        assertEquals(SourceSpan.of(0, 7), quote.span());
    }

    @Test
    void quoteLines_nest() {
        var outer = assertInstanceOf(Block.Quote.class, blocks("> > inner").get(0));

        var inner = assertInstanceOf(Block.Quote.class, outer.blocks().get(0));
        assertInstanceOf(Block.Paragraph.class, inner.blocks().get(0));
    }

    @Test
    void quoteDirective_parsesBodyAsBlocks() {
        var quote = assertInstanceOf(Block.Quote.class, blocks("::quote\n# Title\n\nBody\n::").get(0));

        assertThat(quote.blocks()).hasSize(2);
        assertInstanceOf(Block.Heading.class, quote.blocks().get(0));
    }

    // === Containers ===

    @Test
    void callout_withQuotedTitleAndNestedQuote() {
        var input = """
            ::callout type=warning title="Heads up"
            ::quote
            Inner
            ::
            ::""";

        var callout = assertInstanceOf(Block.Callout.class, blocks(input).get(0));

        assertEquals("warning", callout.kind());
        assertEquals("Heads up", callout.title().orElseThrow());
        var quote = assertInstanceOf(Block.Quote.class, callout.blocks().get(0));
        assertInstanceOf(Block.Paragraph.class, quote.blocks().get(0));
        assertEquals(SourceSpan.of(0, input.length()), callout.span());
    }

    @Test
    void callout_withoutTypeDefaultsToNote() {
        var callout = assertInstanceOf(Block.Callout.class, blocks("::callout\ntext\n::").get(0));

        assertEquals("note", callout.kind());
        assertTrue(callout.title().isEmpty());
    }

    @Test
    void figure_captionIsInlineParsed() {
        var figure = assertInstanceOf(Block.Figure.class,
                                      blocks("::figure src=img.png alt=\"A cat\" caption=\"A *small* cat\"\n::").get(0));

        assertEquals("img.png", figure.src().orElseThrow());
        assertEquals("A cat", figure.alt().orElseThrow());
        assertTrue(figure.blocks().isEmpty());
        var caption = figure.caption().orElseThrow();
        assertThat(caption).hasAtLeastOneElementOfType(Inline.Emphasis.class);
        assertEquals(SourceSpan.of(42, 55), caption.get(0).span().merge(caption.get(caption.size() - 1).span()));
    }

    @Test
    void htmlLines_runUntilBlankLine() {
        var result = blocks("<div>\nhi\n</div>\n\nafter");

        var html = assertInstanceOf(Block.HtmlBlock.class, result.get(0));
        assertEquals("<div>\nhi\n</div>", html.content());
        assertInstanceOf(Block.Paragraph.class, result.get(1));
    }

    @Test
    void htmlDirective_keepsBody() {
        var html = assertInstanceOf(Block.HtmlBlock.class, blocks("::html\n<b>x</b>\n::").get(0));

        assertEquals("<b>x</b>", html.content());
    }

    @Test
    void footnotes_collectDefinitionsWithContinuations() {
        var input = """
            ::footnotes
            [^1]: First note.
            [^long]: Second
                continued here.
            ::""";

        var footnotes = assertInstanceOf(Block.Footnotes.class, blocks(input).get(0));

        assertThat(footnotes.definitions()).extracting(Block.FootnoteDef::id).containsExactly("1", "long");
        var second = (Block.Paragraph) footnotes.definitions().get(1).blocks().get(0);
        assertEquals("Second\ncontinued here.", plain(second.content()));
    }

    @Test
    void nestedDirectiveCloseLines_stayInsideCollectedBody() {
        var input = """
            ::list
            - item
              ::callout
              inside
              ::
            ::
            after""";

        var result = blocks(input);

        assertThat(result).hasSize(2);
        var list = assertInstanceOf(Block.ListBlock.class, result.get(0));
        var item = list.items().get(0);
        assertInstanceOf(Block.Callout.class, item.blocks().get(1));
        assertInstanceOf(Block.Paragraph.class, result.get(1));
    }

    @Test
    void fencedCloseLine_doesNotCloseDirective() {
        var input = """
            ::list
            - item

              ```
              ::
              ```
            ::""";

        var result = LiteDoc.parseWithRecovery(input);

        assertTrue(result.ok());
        var list = (Block.ListBlock) result.document().blocks().get(0);
        var code = assertInstanceOf(Block.CodeBlock.class, list.items().get(0).blocks().get(1));
        assertEquals("::", code.content());
    }

    // === Profile directive ===

    @Test
    void profileDirective_selectsProfile() {
        var result = LiteDoc.parseWithRecovery("@profile md\n::callout\nx\n::");

        assertTrue(result.ok());
        assertEquals(Profile.MD, result.document().profile());
        assertInstanceOf(Block.RawBlock.class, result.document().blocks().get(0));
    }

    @Test
    void profileDirective_ignoredWhenDisabled() {
        var parser = LiteDoc.builder().headerDirectives(false).build();

        var document = parser.parse("@profile md\ntext");

        assertEquals(Profile.LITEDOC, document.profile());
        assertThat(document.blocks()).hasSize(1);
    }
}
