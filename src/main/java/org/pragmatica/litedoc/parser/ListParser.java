package org.pragmatica.litedoc.parser;

import org.pragmatica.litedoc.error.ParseErrorKind;
import org.pragmatica.litedoc.tree.Block;
import org.pragmatica.litedoc.tree.ListKind;
import org.pragmatica.litedoc.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lists, both bare (contiguous marker lines) and as the body of a {@code ::list} directive.
 *
 * <p>An item owns the text after its marker plus every following line indented to its
 * content column, and lazy text lines continuing its paragraph. The collected body is
 * block-parsed one level deeper, so sub-lists and further paragraphs nest naturally.
 */
final class ListParser {
    private final ParsingContext ctx;
    private final List<Line> lines;
    private final int depth;
    private final boolean directive;

    private ListParser(ParsingContext ctx, List<Line> lines, int depth, boolean directive) {
        this.ctx = ctx;
        this.lines = lines;
        this.depth = depth;
        this.directive = directive;
    }

    record Parsed(Block.ListBlock list, int next) {}

    /**
     * Parse the bare list whose first marker line is at {@code pos}. The list ends at a line
     * that is neither an item of the same kind nor part of the last item.
     */
    static Parsed parseBare(ParsingContext ctx, List<Line> lines, int pos, int depth) {
        var parser = new ListParser(ctx, lines, depth, false);
        var first = ListMarker.parse(lines.get(pos).text()).orElseThrow();
        var items = new ArrayList<Block.ListItem>();
        int i = pos;
        int lastEnd = lines.get(pos).end();
        while (i < lines.size()) {
            var marker = parser.itemMarker(lines.get(i));
            if (marker.isEmpty() || marker.get().kind() != first.kind()) {
                break;
            }
            var item = new Item(lines.get(i));
            i = parser.collectItem(i, marker.get(), item);
            items.add(parser.build(item));
            lastEnd = item.last.end();
            int resume = skipBlank(lines, i);
            var nextMarker = resume < lines.size() ? parser.itemMarker(lines.get(resume)) : Optional.<ListMarker>empty();
            if (resume > i && (nextMarker.isEmpty() || nextMarker.get().kind() != first.kind())) {
                break;
            }
            i = resume;
        }
        var span = ctx.span(lines.get(pos).start(), lastEnd);
        return new Parsed(new Block.ListBlock(span, first.kind(), first.number(), items), i);
    }

    /**
     * Parse the body of a {@code ::list} directive. Lines that are neither items nor item
     * continuations are reported and kept as paragraph text of the current item.
     */
    static Block.ListBlock parseDirective(ParsingContext ctx,
                                          DirectiveHeader header,
                                          List<Line> body,
                                          SourceSpan span,
                                          int depth) {
        var parser = new ListParser(ctx, body, depth, true);
        var firstMarker = body.stream()
                              .map(parser::itemMarker)
                              .flatMap(Optional::stream)
                              .findFirst();
        var kind = header.flag("ordered")
                   ? ListKind.ORDERED
                   : header.flag("unordered")
                     ? ListKind.UNORDERED
                     : firstMarker.map(ListMarker::kind).orElse(ListKind.UNORDERED);
        var start = kind == ListKind.ORDERED
                    ? Optional.of(startNumber(header).or(() -> firstMarker.flatMap(ListMarker::number)).orElse(1L))
                    : Optional.<Long>empty();

        var items = new ArrayList<Item>();
        int i = 0;
        while (i < body.size()) {
            var line = body.get(i);
            if (line.isBlank()) {
                i++;
                continue;
            }
            var marker = parser.itemMarker(line);
            if (marker.isPresent()) {
                var item = new Item(line);
                i = parser.collectItem(i, marker.get(), item);
                items.add(item);
                continue;
            }
            ctx.report(ParseErrorKind.INVALID_LIST_MARKER, ctx.span(line), "expected a list item marker");
            if (items.isEmpty()) {
                items.add(new Item(line));
            }
            items.get(items.size() - 1).addText(line.stripLeading().stripTrailing());
            i++;
        }
        var built = new ArrayList<Block.ListItem>(items.size());
        for (var item : items) {
            built.add(parser.build(item));
        }
        return new Block.ListBlock(span, kind, start, built);
    }

    private static Optional<Long> startNumber(DirectiveHeader header) {
        return header.attribute("start")
                     .flatMap(value -> {
                         try {
                             return Optional.of(Long.parseLong(value));
                         } catch (NumberFormatException e) {
                             return Optional.empty();
                         }
                     });
    }

    private Optional<ListMarker> itemMarker(Line line) {
        if (LineClassifier.classify(line, ctx.profile()) != LineKind.LIST_ITEM) {
            return Optional.empty();
        }
        return ListMarker.parse(line.text());
    }

    /**
     * Collect the lines of the item starting at {@code pos} into {@code item}.
     *
     * @return index of the first line after the item
     */
    private int collectItem(int pos, ListMarker marker, Item item) {
        int column = marker.contentOffset();
        var content = lines.get(pos).drop(column);
        item.checked = taskState(content);
        if (item.checked.isPresent()) {
            content = content.drop(Math.min(4, content.text().length()));
        }
        item.addLine(content);

        int i = pos + 1;
        boolean sawBlank = false;
        while (i < lines.size()) {
            var line = lines.get(i);
            if (line.isBlank()) {
                int resume = skipBlank(lines, i);
                if (resume < lines.size() && lines.get(resume).indent() >= column) {
                    for (int b = i; b < resume; b++) {
                        item.addLine(lines.get(b).blank());
                    }
                    sawBlank = true;
                    i = resume;
                    continue;
                }
                break;
            }
            if (line.indent() >= column) {
                item.addLine(line.stripIndent(column));
                i++;
                continue;
            }
            if (!sawBlank && isLazyContinuation(line, item)) {
                item.addLine(line.stripLeading());
                i++;
                continue;
            }
            break;
        }
        return i;
    }

    private boolean isLazyContinuation(Line line, Item item) {
        if (!item.endsWithText(ctx.profile())) {
            return false;
        }
        if (LineClassifier.classify(line, ctx.profile()) != LineKind.TEXT) {
            return false;
        }
        return !directive || !(ListMarker.isMissingSpace(line.text()) || ListMarker.isOverlongOrdered(line.text()));
    }

    private Optional<Boolean> taskState(Line content) {
        if (!ctx.recognizes(Construct.TASK_ITEM)) {
            return Optional.empty();
        }
        var text = content.text();
        if (text.length() < 3 || text.charAt(0) != '[' || text.charAt(2) != ']') {
            return Optional.empty();
        }
        if (text.length() > 3 && !Line.isSpace(text.charAt(3))) {
            return Optional.empty();
        }
        return switch (text.charAt(1)) {
            case ' ' -> Optional.of(false);
            case 'x', 'X' -> Optional.of(true);
            default -> Optional.empty();
        };
    }

    private Block.ListItem build(Item item) {
        ctx.checkDepth(depth + 1, item.marker);
        var blocks = new ArrayList<Block>();
        for (var part : item.parts) {
            if (part.text()) {
                var line = part.lines().get(0);
                blocks.add(new Block.Paragraph(ctx.span(line), ctx.inlines(LeafText.of(line))));
            } else {
                blocks.addAll(BlockParser.parse(ctx, part.lines(), depth + 1));
            }
        }
        var span = ctx.span(item.marker.start(), Math.max(item.marker.start(), item.last.end()));
        return new Block.ListItem(span, blocks, item.checked);
    }

    private static int skipBlank(List<Line> lines, int i) {
        while (i < lines.size() && lines.get(i).isBlank()) {
            i++;
        }
        return i;
    }

    /**
     * A run of body lines to block-parse, or one line forced to be a paragraph.
     */
    private record Part(List<Line> lines, boolean text) {}

    private static final class Item {
        private final Line marker;
        private final List<Part> parts = new ArrayList<>();
        private Optional<Boolean> checked = Optional.empty();
        private Line last;

        private Item(Line marker) {
            this.marker = marker;
            this.last = marker;
        }

        void addLine(Line line) {
            if (parts.isEmpty() || parts.get(parts.size() - 1).text()) {
                parts.add(new Part(new ArrayList<>(), false));
            }
            parts.get(parts.size() - 1).lines().add(line);
            if (!line.isBlank()) {
                last = line;
            }
        }

        void addText(Line line) {
            parts.add(new Part(List.of(line), true));
            last = line;
        }

        boolean endsWithText(Profile profile) {
            if (parts.isEmpty()) {
                return false;
            }
            var part = parts.get(parts.size() - 1);
            if (part.text()) {
                return true;
            }
            var lastLine = part.lines().get(part.lines().size() - 1);
            return !lastLine.isBlank() && LineClassifier.classify(lastLine, profile) == LineKind.TEXT;
        }
    }
}
