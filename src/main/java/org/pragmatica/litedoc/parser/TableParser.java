package org.pragmatica.litedoc.parser;

import org.pragmatica.litedoc.error.ParseErrorKind;
import org.pragmatica.litedoc.tree.Block;
import org.pragmatica.litedoc.tree.ColumnAlignment;
import org.pragmatica.litedoc.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipe tables: a header row, a separator row of {@code -} and {@code :} cells, then data rows.
 * The header fixes the column count; other rows are padded or truncated to it.
 */
final class TableParser {
    private final ParsingContext ctx;

    private TableParser(ParsingContext ctx) {
        this.ctx = ctx;
    }

    record Parsed(Block.Table table, int next) {}

    /**
     * Cell range within a row's text, trimmed of surrounding whitespace.
     */
    record CellRange(int start, int end) {}

    /**
     * Whether a bare table starts at {@code pos}: a pipe row followed by a separator row.
     */
    static boolean startsAt(List<Line> lines, int pos) {
        return pos + 1 < lines.size()
               && isRow(lines.get(pos))
               && LineClassifier.isTableSeparator(lines.get(pos + 1));
    }

    static Parsed parseBare(ParsingContext ctx, List<Line> lines, int pos) {
        var header = lines.get(pos);
        var separator = lines.get(pos + 1);
        var data = new ArrayList<Line>();
        int next = pos + 2;
        while (next < lines.size() && isRow(lines.get(next)) && !LineClassifier.isDirectiveClose(lines.get(next))) {
            data.add(lines.get(next));
            next++;
        }
        var last = data.isEmpty() ? separator : data.get(data.size() - 1);
        var table = new TableParser(ctx).build(ctx.span(header, last), header, alignments(separator), data);
        return new Parsed(table, next);
    }

    /**
     * Body of a {@code ::table} directive. Problems are reported as malformed tables and the
     * offending lines skipped.
     */
    static Block.Table parseDirective(ParsingContext ctx, DirectiveHeader header, List<Line> body, SourceSpan span) {
        var rows = new ArrayList<Line>();
        for (var line : body) {
            if (line.isBlank()) {
                continue;
            }
            if (isRow(line)) {
                rows.add(line);
            } else {
                ctx.report(ParseErrorKind.MALFORMED_TABLE, ctx.span(line), "line is not a table row");
            }
        }
        if (rows.isEmpty()) {
            ctx.report(ParseErrorKind.MALFORMED_TABLE, ctx.span(header.line()), "table has no rows");
            return new Block.Table(span, List.of(), List.of());
        }
        var parser = new TableParser(ctx);
        var first = rows.get(0);
        if (rows.size() > 1 && LineClassifier.isTableSeparator(rows.get(1))) {
            return parser.build(span, first, alignments(rows.get(1)), rows.subList(2, rows.size()));
        }
        ctx.report(ParseErrorKind.MALFORMED_TABLE, ctx.span(first), "table header is not followed by a separator row");
        return parser.build(span, first, List.of(), rows.subList(1, rows.size()));
    }

    private Block.Table build(SourceSpan span, Line header, List<ColumnAlignment> separatorAlignments, List<Line> data) {
        int columns = cellRanges(header.text()).size();
        var alignments = new ArrayList<ColumnAlignment>(columns);
        for (int i = 0; i < columns; i++) {
            alignments.add(i < separatorAlignments.size() ? separatorAlignments.get(i) : ColumnAlignment.NONE);
        }
        var rows = new ArrayList<Block.TableRow>(data.size() + 1);
        rows.add(row(header, true, columns));
        for (var line : data) {
            rows.add(row(line, false, columns));
        }
        return new Block.Table(span, alignments, rows);
    }

    private Block.TableRow row(Line line, boolean header, int columns) {
        var row = line.stripLeading().stripTrailing();
        var ranges = cellRanges(row.text());
        if (ranges.size() != columns && !ctx.profile().normalizesRaggedTables()) {
            ctx.report(ParseErrorKind.MALFORMED_TABLE,
                       ctx.span(row),
                       "row has " + ranges.size() + " cells, expected " + columns);
        }
        var cells = new ArrayList<Block.TableCell>(columns);
        for (int i = 0; i < columns; i++) {
            if (i < ranges.size()) {
                var range = ranges.get(i);
                var cell = new Line(row.text().substring(range.start(), range.end()),
                                    row.start() + range.start(),
                                    row.start() + range.end(),
                                    row.start() + range.end());
                cells.add(new Block.TableCell(ctx.span(cell), ctx.inlines(LeafText.of(cell))));
            } else {
                cells.add(new Block.TableCell(ctx.span(row.end(), row.end()), List.of()));
            }
        }
        return new Block.TableRow(ctx.span(row), header, cells);
    }

    static List<ColumnAlignment> alignments(Line separator) {
        var result = new ArrayList<ColumnAlignment>();
        for (var cell : splitCells(separator.trimmed())) {
            var content = cell.strip();
            boolean left = content.startsWith(":");
            boolean right = content.endsWith(":") && content.length() > 1;
            result.add(left && right
                       ? ColumnAlignment.CENTER
                       : left
                         ? ColumnAlignment.LEFT
                         : right ? ColumnAlignment.RIGHT : ColumnAlignment.NONE);
        }
        return result;
    }

    static List<String> splitCells(String text) {
        var cells = new ArrayList<String>();
        for (var range : cellRanges(text)) {
            cells.add(text.substring(range.start(), range.end()));
        }
        return cells;
    }

    /**
     * Split a row on unescaped pipes. A leading and a trailing pipe are optional.
     */
    static List<CellRange> cellRanges(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && Line.isSpace(text.charAt(start))) {
            start++;
        }
        while (end > start && Line.isSpace(text.charAt(end - 1))) {
            end--;
        }
        if (start < end && text.charAt(start) == '|') {
            start++;
        }
        if (end > start && text.charAt(end - 1) == '|' && !isEscaped(text, end - 1)) {
            end--;
        }
        var ranges = new ArrayList<CellRange>();
        int cellStart = start;
        for (int i = start; i <= end; i++) {
            if (i == end || (text.charAt(i) == '|' && !isEscaped(text, i))) {
                ranges.add(trim(text, cellStart, i));
                cellStart = i + 1;
            }
        }
        return ranges;
    }

    private static CellRange trim(String text, int start, int end) {
        while (start < end && Line.isSpace(text.charAt(start))) {
            start++;
        }
        while (end > start && Line.isSpace(text.charAt(end - 1))) {
            end--;
        }
        return new CellRange(start, end);
    }

    private static boolean isEscaped(String text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private static boolean isRow(Line line) {
        return line.indent() <= 3 && line.trimmed().startsWith("|");
    }
}
