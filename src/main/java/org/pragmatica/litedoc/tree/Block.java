package org.pragmatica.litedoc.tree;

import java.util.List;
import java.util.Optional;

/**
 * Block node - a structural unit of a document.
 *
 * <p>The set of variants is closed. Supporting records ({@link ListItem}, {@link TableRow},
 * {@link TableCell}, {@link FootnoteDef}) carry spans too but are not blocks themselves.
 */
public sealed interface Block {
    /**
     * The source span covered by this block.
     */
    SourceSpan span();

    /**
     * ATX heading, level 1 to 6.
     */
    record Heading(SourceSpan span, int level, List<Inline> content) implements Block {
        public Heading {
            if (level < 1 || level > 6) {
                throw new IllegalArgumentException("Heading level out of range: " + level);
            }
            content = List.copyOf(content);
        }
    }

    record Paragraph(SourceSpan span, List<Inline> content) implements Block {
        public Paragraph {
            content = List.copyOf(content);
        }
    }

    /**
     * Ordered or unordered list. {@code start} is present for ordered lists only.
     */
    record ListBlock(SourceSpan span, ListKind kind, Optional<Long> start, List<ListItem> items) implements Block {
        public ListBlock {
            items = List.copyOf(items);
        }
    }

    /**
     * Fenced code. Content is raw and excludes the fence lines.
     */
    record CodeBlock(SourceSpan span, Optional<String> language, String content) implements Block {}

    /**
     * Admonition block; {@code kind} is free-form (note, warning, tip, ...).
     */
    record Callout(SourceSpan span, String kind, Optional<String> title, List<Block> blocks) implements Block {
        public Callout {
            blocks = List.copyOf(blocks);
        }
    }

    record Quote(SourceSpan span, List<Block> blocks) implements Block {
        public Quote {
            blocks = List.copyOf(blocks);
        }
    }

    record Figure(SourceSpan span,
                  Optional<String> src,
                  Optional<String> alt,
                  List<Block> blocks,
                  Optional<List<Inline>> caption) implements Block {
        public Figure {
            blocks = List.copyOf(blocks);
            caption = caption.map(List::copyOf);
        }
    }

    /**
     * Table. Every row has exactly {@code alignments.size()} cells.
     */
    record Table(SourceSpan span, List<ColumnAlignment> alignments, List<TableRow> rows) implements Block {
        public Table {
            alignments = List.copyOf(alignments);
            rows = List.copyOf(rows);
        }

        public int columnCount() {
            return alignments.size();
        }
    }

    record Footnotes(SourceSpan span, List<FootnoteDef> definitions) implements Block {
        public Footnotes {
            definitions = List.copyOf(definitions);
        }
    }

    record MathBlock(SourceSpan span, String content) implements Block {}

    record ThematicBreak(SourceSpan span) implements Block {}

    record HtmlBlock(SourceSpan span, String content) implements Block {}

    /**
     * Content passed through without interpretation, e.g. the body of an unknown directive.
     */
    record RawBlock(SourceSpan span, Optional<String> directive, String content) implements Block {}

    /**
     * List item; {@code checked} is present for task items.
     */
    record ListItem(SourceSpan span, List<Block> blocks, Optional<Boolean> checked) {
        public ListItem {
            blocks = List.copyOf(blocks);
        }
    }

    record TableRow(SourceSpan span, boolean header, List<TableCell> cells) {
        public TableRow {
            cells = List.copyOf(cells);
        }
    }

    record TableCell(SourceSpan span, List<Inline> content) {
        public TableCell {
            content = List.copyOf(content);
        }
    }

    record FootnoteDef(SourceSpan span, String id, List<Block> blocks) {
        public FootnoteDef {
            blocks = List.copyOf(blocks);
        }
    }
}
