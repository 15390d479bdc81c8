package org.pragmatica.litedoc.parser;

import org.pragmatica.litedoc.error.ParseErrorKind;
import org.pragmatica.litedoc.tree.Block;
import org.pragmatica.litedoc.tree.Inline;
import org.pragmatica.litedoc.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Line-oriented block parser.
 *
 * <p>Callout, quote and figure directives stay open on an explicit stack while their body
 * is parsed line by line; {@code ::} closes the innermost one. Other directives collect
 * their body up to the matching close line first and hand it to a dedicated parser.
 * List items and {@code >} quotes are parsed one level deeper by a nested parser over
 * the stripped lines. All of them share one depth counter.
 */
final class BlockParser {
    private static final Pattern FOOTNOTE_DEFINITION = Pattern.compile("\\[\\^([^\\]\\s]+)]:[ \\t]?");
    private static final int FOOTNOTE_INDENT = 4;

    private final ParsingContext ctx;
    private final List<Line> lines;
    private final int depth;
    private final List<Block> blocks = new ArrayList<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private int pos;

    private BlockParser(ParsingContext ctx, List<Line> lines, int depth) {
        this.ctx = ctx;
        this.lines = lines;
        this.depth = depth;
    }

    /**
     * Parse {@code lines} into blocks nested {@code depth} levels below the document.
     */
    static List<Block> parse(ParsingContext ctx, List<Line> lines, int depth) {
        return new BlockParser(ctx, lines, depth).parseAll();
    }

    private List<Block> parseAll() {
        while (pos < lines.size()) {
            var line = lines.get(pos);
            switch (LineClassifier.classify(line, ctx.profile())) {
                case BLANK -> pos++;
                case DIRECTIVE_CLOSE -> closeContainer(line);
                case DIRECTIVE_OPEN -> directive(line);
                case CODE_FENCE -> fenced(line, false);
                case MATH_FENCE -> fenced(line, true);
                case HEADING -> heading(line);
                case THEMATIC_BREAK -> thematicBreak(line);
                case LIST_ITEM -> list();
                case QUOTE -> quoteLines(line);
                case TABLE_ROW -> tableOrParagraph();
                case HTML -> html();
                case TEXT -> text(line);
            }
        }
        closeUnterminated();
        return blocks;
    }

    private int currentDepth() {
        return depth + frames.size();
    }

    private void add(Block block) {
        if (frames.isEmpty()) {
            blocks.add(block);
        } else {
            frames.peek().children.add(block);
        }
    }

    // === Leaf blocks ===

    private void heading(Line line) {
        var stripped = line.stripLeading().stripTrailing();
        int level = LineClassifier.headingLevel(line);
        if (level > 6) {
            var kind = ParseErrorKind.INVALID_HEADING_LEVEL;
            var strategy = ctx.recover(kind, ctx.span(stripped), "heading level " + level + " exceeds 6");
            switch (strategy) {
                case CLAMP_LEVEL -> level = 6;
                case TREAT_AS_TEXT -> {
                    paragraph();
                    return;
                }
                default -> throw ctx.unsupported(strategy, kind);
            }
        }
        var content = withoutClosingSequence(stripped.drop(LineClassifier.headingLevel(line)).stripLeading());
        add(new Block.Heading(ctx.span(stripped), level, ctx.inlines(LeafText.of(content))));
        pos++;
    }

    private static Line withoutClosingSequence(Line content) {
        var text = content.text();
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '#') {
            end--;
        }
        if (end == text.length() || (end > 0 && !Line.isSpace(text.charAt(end - 1)))) {
            return content;
        }
        return new Line(text.substring(0, end), content.start(), content.start() + end, content.next()).stripTrailing();
    }

    private void thematicBreak(Line line) {
        add(new Block.ThematicBreak(ctx.span(line.stripLeading().stripTrailing())));
        pos++;
    }

    private void text(Line line) {
        if (ListMarker.isOverlongOrdered(line.text())) {
            ctx.report(ParseErrorKind.INVALID_LIST_MARKER,
                       ctx.span(line.stripLeading().stripTrailing()),
                       "ordered list number has more than 9 digits");
        }
        paragraph();
    }

    // The first line is taken whatever its kind; the paragraph then runs over text lines.
    private void paragraph() {
        var collected = new ArrayList<Line>();
        collected.add(lines.get(pos).stripLeading());
        pos++;
        while (pos < lines.size() && continuesParagraph(pos)) {
            collected.add(lines.get(pos).stripLeading());
            pos++;
        }
        int last = collected.size() - 1;
        collected.set(last, collected.get(last).stripTrailing());
        add(new Block.Paragraph(ctx.span(collected.get(0), collected.get(last)), ctx.inlines(collected)));
    }

    // A pipe row that does not start a table is plain text.
    private boolean continuesParagraph(int index) {
        return switch (LineClassifier.classify(lines.get(index), ctx.profile())) {
            case TEXT -> true;
            case TABLE_ROW -> !TableParser.startsAt(lines, index);
            default -> false;
        };
    }

    private void fenced(Line open, boolean math) {
        var fence = LineClassifier.fence(open).orElseThrow();
        int indent = open.indent();
        var content = new ArrayList<String>();
        Line last = open;
        Line close = null;
        pos++;
        while (pos < lines.size()) {
            var line = lines.get(pos++);
            if (LineClassifier.closesFence(line, fence)) {
                close = line;
                break;
            }
            content.add(line.stripIndent(indent).text());
            last = line;
        }
        var start = open.stripLeading();
        if (close == null) {
            ctx.report(ParseErrorKind.UNTERMINATED_CONTAINER,
                       ctx.span(start),
                       (math ? "math" : "code") + " fence is not closed");
        } else {
            last = close.stripTrailing();
        }
        var span = ctx.span(start, last);
        var text = String.join("\n", content);
        add(math ? new Block.MathBlock(span, text) : new Block.CodeBlock(span, fence.language(), text));
    }

    private void html() {
        var first = lines.get(pos);
        var content = new ArrayList<String>();
        Line last = first;
        while (pos < lines.size() && !lines.get(pos).isBlank() && !LineClassifier.isDirectiveClose(lines.get(pos))) {
            last = lines.get(pos++);
            content.add(last.text());
        }
        add(new Block.HtmlBlock(ctx.span(first.stripLeading(), last), String.join("\n", content)));
    }

    private void tableOrParagraph() {
        if (!ctx.recognizes(Construct.TABLE) || !TableParser.startsAt(lines, pos)) {
            paragraph();
            return;
        }
        var parsed = TableParser.parseBare(ctx, lines, pos);
        add(parsed.table());
        pos = parsed.next();
    }

    // === Nested blocks ===

    private void list() {
        var parsed = ListParser.parseBare(ctx, lines, pos, currentDepth());
        add(parsed.list());
        pos = parsed.next();
    }

    private void quoteLines(Line first) {
        ctx.checkDepth(currentDepth() + 1, first);
        var stripped = new ArrayList<Line>();
        Line last = first;
        while (pos < lines.size() && LineClassifier.classify(lines.get(pos), ctx.profile()) == LineKind.QUOTE) {
            last = lines.get(pos++);
            var body = last.stripLeading().drop(1);
            stripped.add(body.text().startsWith(" ") ? body.drop(1) : body);
        }
        var children = parse(ctx, stripped, currentDepth() + 1);
        add(new Block.Quote(ctx.span(first.stripLeading(), last.stripTrailing()), children));
    }

    // === Directives ===

    private void directive(Line line) {
        var header = DirectiveHeader.parse(line).orElseThrow();
        ctx.checkDepth(currentDepth() + 1, line);
        var directive = Directive.lookup(header.name(), ctx.profile());
        if (directive.isEmpty()) {
            unknownDirective(header);
            return;
        }
        if (directive.get().blockBody()) {
            frames.push(new Frame(directive.get(), header));
            pos++;
            return;
        }
        var kind = directive.get();
        var body = collectBody(kind != Directive.MATH && kind != Directive.HTML);
        var span = body.span(ctx);
        if (body.close().isEmpty()) {
            unterminated(header);
        }
        switch (kind) {
            case LIST -> add(ListParser.parseDirective(ctx, header, body.lines(), span, currentDepth()));
            case TABLE -> add(TableParser.parseDirective(ctx, header, body.lines(), span));
            case FOOTNOTES -> add(footnotes(body.lines(), span));
            case MATH -> add(new Block.MathBlock(span, body.text()));
            case HTML -> add(new Block.HtmlBlock(span, body.text()));
            default -> throw new IllegalStateException("Directive " + kind + " has a block body");
        }
    }

    private void unknownDirective(DirectiveHeader header) {
        if (ctx.profile().toleratesUnknownDirectives()) {
            raw(header);
            return;
        }
        var kind = ParseErrorKind.UNKNOWN_DIRECTIVE;
        var strategy = ctx.recover(kind,
                                   ctx.span(header.line().stripLeading()),
                                   "unknown directive '::" + header.name() + "'");
        switch (strategy) {
            case SUBSTITUTE_RAW -> raw(header);
            case TREAT_AS_TEXT -> paragraph();
            default -> throw ctx.unsupported(strategy, kind);
        }
    }

    private void raw(DirectiveHeader header) {
        var body = collectBody(true);
        if (body.close().isEmpty()) {
            unterminated(header);
        }
        add(new Block.RawBlock(body.span(ctx), Optional.of(header.name()), body.text()));
    }

    private void unterminated(DirectiveHeader header) {
        ctx.report(ParseErrorKind.UNTERMINATED_CONTAINER,
                   ctx.span(header.line().stripLeading().stripTrailing()),
                   "'::" + header.name() + "' is not closed");
    }

    /**
     * Collect the lines up to the close line of the directive opened at {@code pos}. When
     * {@code nested}, inner directive opens and fenced blocks keep their own close lines
     * inside the body.
     */
    private Body collectBody(boolean nested) {
        var header = lines.get(pos);
        var body = new ArrayList<Line>();
        int level = 0;
        LineClassifier.Fence fence = null;
        int i = pos + 1;
        while (i < lines.size()) {
            var line = lines.get(i++);
            if (nested && fence != null) {
                if (LineClassifier.closesFence(line, fence)) {
                    fence = null;
                }
                body.add(line);
                continue;
            }
            if (nested && opensFence(line)) {
                fence = LineClassifier.fence(line).orElseThrow();
            } else if (nested && LineClassifier.isDirectiveOpen(line)) {
                level++;
            } else if (LineClassifier.isDirectiveClose(line)) {
                if (level == 0) {
                    pos = i;
                    return new Body(header, body, Optional.of(line));
                }
                level--;
            }
            body.add(line);
        }
        pos = lines.size();
        return new Body(header, body, Optional.empty());
    }

    private boolean opensFence(Line line) {
        var kind = LineClassifier.classify(line, ctx.profile());
        return kind == LineKind.CODE_FENCE || kind == LineKind.MATH_FENCE;
    }

    private Block.Footnotes footnotes(List<Line> body, SourceSpan span) {
        var definitions = new ArrayList<Block.FootnoteDef>();
        String id = null;
        var definition = new ArrayList<Line>();
        for (var line : body) {
            var stripped = line.stripLeading();
            var matcher = FOOTNOTE_DEFINITION.matcher(stripped.text());
            if (line.indent() <= 3 && matcher.lookingAt()) {
                if (id != null) {
                    definitions.add(footnote(id, definition));
                }
                id = matcher.group(1);
                definition = new ArrayList<>();
                definition.add(stripped.drop(matcher.end()));
            } else if (id != null) {
                definition.add(line.isBlank() ? line.blank() : line.stripIndent(FOOTNOTE_INDENT));
            }
        }
        if (id != null) {
            definitions.add(footnote(id, definition));
        }
        return new Block.Footnotes(span, definitions);
    }

    private Block.FootnoteDef footnote(String id, List<Line> definition) {
        var first = definition.get(0);
        var last = first;
        for (var line : definition) {
            if (!line.isBlank()) {
                last = line;
            }
        }
        var children = parse(ctx, definition, currentDepth() + 1);
        return new Block.FootnoteDef(ctx.span(first, last), id, children);
    }

    // === Open containers ===

    private void closeContainer(Line line) {
        if (frames.isEmpty()) {
            paragraph();
            return;
        }
        var frame = frames.pop();
        add(frame.build(ctx, line.stripTrailing().end()));
        pos++;
    }

    private void closeUnterminated() {
        int end = 0;
        for (var line : lines) {
            if (!line.isBlank()) {
                end = line.stripTrailing().end();
            }
        }
        while (!frames.isEmpty()) {
            var frame = frames.pop();
            unterminated(frame.header);
            add(frame.build(ctx, end));
        }
    }

    /**
     * An open callout, quote or figure and the blocks parsed into it so far.
     */
    private static final class Frame {
        private final Directive directive;
        private final DirectiveHeader header;
        private final List<Block> children = new ArrayList<>();

        private Frame(Directive directive, DirectiveHeader header) {
            this.directive = directive;
            this.header = header;
        }

        Block build(ParsingContext ctx, int end) {
            var open = header.line().stripLeading();
            var span = ctx.span(open.start(), Math.max(open.end(), end));
            return switch (directive) {
                case CALLOUT -> new Block.Callout(span,
                                                  header.attribute("type").orElse("note"),
                                                  header.attribute("title"),
                                                  children);
                case QUOTE -> new Block.Quote(span, children);
                case FIGURE -> new Block.Figure(span,
                                                header.attribute("src"),
                                                header.attribute("alt"),
                                                children,
                                                caption(ctx));
                default -> throw new IllegalStateException("Directive " + directive + " has a line body");
            };
        }

        private Optional<List<Inline>> caption(ParsingContext ctx) {
            return header.rawAttribute("caption")
                         .map(a -> ctx.inlines(LeafText.slice(ctx.source(), a.rawStart(), a.rawEnd())));
        }
    }

    /**
     * Collected body of a line-body directive; {@code close} is empty when the input ended first.
     */
    private record Body(Line header, List<Line> lines, Optional<Line> close) {
        String text() {
            var joined = new StringBuilder();
            for (int i = 0; i < lines.size(); i++) {
                if (i > 0) {
                    joined.append('\n');
                }
                joined.append(lines.get(i).text());
            }
            return joined.toString();
        }

        SourceSpan span(ParsingContext ctx) {
            var open = header.stripLeading();
            int end = open.stripTrailing().end();
            if (close.isPresent()) {
                end = close.get().stripTrailing().end();
            } else {
                for (var line : lines) {
                    if (!line.isBlank()) {
                        end = line.stripTrailing().end();
                    }
                }
            }
            return ctx.span(open.start(), Math.max(open.start(), end));
        }
    }
}
