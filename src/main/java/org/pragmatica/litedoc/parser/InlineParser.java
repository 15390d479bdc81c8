package org.pragmatica.litedoc.parser;

import org.pragmatica.litedoc.tree.Inline;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Inline parser for one leaf text.
 *
 * <p>Scans left to right, producing a doubly linked list of slots: finished nodes and
 * pending delimiter runs ({@code *}, {@code ~~}). Delimiter runs are matched afterwards,
 * closer by closer, against the nearest compatible opener; the slots between them become
 * the children of the new container node. Never fails: anything that does not form a
 * construct is kept as literal text.
 *
 * <p>Container nodes nest at most {@code maxDepth} levels. A closer whose match would nest
 * deeper is left as literal text, and link labels are parsed one level down.
 */
final class InlineParser {
    private static final Pattern BARE_URL = Pattern.compile("https?://[A-Za-z0-9\\-._~:/?#\\[\\]@!$&'()*+,;=%]+");
    private static final Pattern EMAIL = Pattern.compile(
        "[A-Za-z0-9.!#$%&'*+/=?^_`{|}~\\-]+@[A-Za-z0-9](?:[A-Za-z0-9\\-]*[A-Za-z0-9])?(?:\\.[A-Za-z0-9](?:[A-Za-z0-9\\-]*[A-Za-z0-9])?)*");
    private static final String URL_TRAILING_PUNCTUATION = ".,:;!?'\"";
    private static final String ASCII_PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

    private final ParsingContext ctx;
    private final LeafText leaf;
    private final String text;
    private final int from;
    private final int to;
    private final boolean linksEnabled;
    private final int maxDepth;

    private final StringBuilder pending = new StringBuilder();
    private int pendingStart = -1;
    private int pendingEnd = -1;

    private Slot head;
    private Slot tail;
    private int ordinal;
    private int depth;

    private InlineParser(ParsingContext ctx, LeafText leaf, int from, int to, boolean linksEnabled, int maxDepth) {
        this.ctx = ctx;
        this.leaf = leaf;
        this.text = leaf.text();
        this.from = from;
        this.to = to;
        this.linksEnabled = linksEnabled;
        this.maxDepth = maxDepth;
    }

    static InlineParser create(ParsingContext ctx, LeafText leaf) {
        return new InlineParser(ctx, leaf, 0, leaf.length(), true, ctx.maxNestingDepth());
    }

    private InlineParser label(int labelFrom, int labelTo) {
        return new InlineParser(ctx, leaf, labelFrom, labelTo, false, maxDepth - 1);
    }

    List<Inline> parse() {
        int i = from;
        while (i < to) {
            i = switch (text.charAt(i)) {
                case '\\' -> escape(i);
                case '\n' -> lineBreak(i);
                case '`' -> codeSpan(i);
                case '*' -> delimiterRun(i, '*');
                case '~' -> delimiterRun(i, '~');
                case '[' -> bracket(i);
                case '<' -> angle(i);
                case 'h' -> bareUrl(i);
                default -> literal(i, i + 1);
            };
        }
        flush();
        processEmphasis();
        depth = depthBetween(head, null);
        return collect(head, null);
    }

    // === Scanning ===

    private int escape(int i) {
        if (i + 1 < to) {
            char next = text.charAt(i + 1);
            if (next == '\n') {
                emit(new Inline.HardBreak(ctx.span(leaf, i, i + 2)));
                return i + 2;
            }
            if (ASCII_PUNCTUATION.indexOf(next) >= 0) {
                append(next, i, i + 2);
                return i + 2;
            }
        }
        return literal(i, i + 1);
    }

    private int lineBreak(int i) {
        int spaces = 0;
        if (pendingEnd == i) {
            while (spaces < pending.length() && pending.charAt(pending.length() - 1 - spaces) == ' ') {
                spaces++;
            }
            pending.setLength(pending.length() - spaces);
            pendingEnd = i - spaces;
            if (pending.length() == 0) {
                pendingStart = -1;
                pendingEnd = -1;
            }
        }
        if (spaces >= 2) {
            emit(new Inline.HardBreak(ctx.span(leaf, i - spaces, i + 1)));
        } else {
            emit(new Inline.SoftBreak(ctx.span(leaf, i, i + 1)));
        }
        return i + 1;
    }

    private int codeSpan(int i) {
        int run = runLength(i, '`');
        if (!ctx.recognizes(Construct.CODE_SPAN)) {
            return literal(i, i + run);
        }
        int j = i + run;
        while (j < to) {
            if (text.charAt(j) != '`') {
                j++;
                continue;
            }
            int closing = runLength(j, '`');
            if (closing == run) {
                emit(new Inline.CodeSpan(ctx.span(leaf, i, j + run), codeContent(text.substring(i + run, j))));
                return j + run;
            }
            j += closing;
        }
        return literal(i, i + run);
    }

    private static String codeContent(String raw) {
        var content = raw.replace('\n', ' ');
        if (content.length() >= 2
            && content.charAt(0) == ' '
            && content.charAt(content.length() - 1) == ' '
            && !content.isBlank()) {
            return content.substring(1, content.length() - 1);
        }
        return content;
    }

    private int delimiterRun(int i, char marker) {
        int run = runLength(i, marker);
        boolean enabled = marker == '*'
                          ? ctx.recognizes(Construct.EMPHASIS) || ctx.recognizes(Construct.STRONG)
                          : run >= 2 && ctx.recognizes(Construct.STRIKETHROUGH);
        boolean canOpen = i + run < to && !Character.isWhitespace(text.charAt(i + run));
        boolean canClose = i > from && !Character.isWhitespace(text.charAt(i - 1));
        if (!enabled || !(canOpen || canClose)) {
            return literal(i, i + run);
        }
        flush();
        link(Slot.delimiter(new Delimiter(marker, i, run, canOpen, canClose, ordinal++)));
        return i + run;
    }

    private int bracket(int i) {
        if (i + 1 < to && text.charAt(i + 1) == '[' && linksEnabled && ctx.recognizes(Construct.WIKI_LINK)) {
            int end = wikiLink(i);
            if (end > 0) {
                return end;
            }
        }
        if (i + 1 < to && text.charAt(i + 1) == '^' && ctx.recognizes(Construct.FOOTNOTE_REF)) {
            int end = footnoteRef(i);
            if (end > 0) {
                return end;
            }
        }
        if (linksEnabled && ctx.recognizes(Construct.LINK)) {
            int end = inlineLink(i);
            if (end > 0) {
                return end;
            }
        }
        return literal(i, i + 1);
    }

    private int wikiLink(int i) {
        int close = text.indexOf("]]", i + 2);
        if (close < 0 || close + 2 > to || close == i + 2) {
            return -1;
        }
        var content = text.substring(i + 2, close);
        if (content.indexOf('\n') >= 0) {
            return -1;
        }
        int pipe = content.indexOf('|');
        int labelEnd = pipe < 0 ? close : i + 2 + pipe;
        var destination = (pipe < 0 ? content : content.substring(pipe + 1)).strip();
        if (destination.isEmpty()) {
            return -1;
        }
        var parser = label(i + 2, labelEnd);
        var label = parser.parse();
        emit(new Inline.Link(ctx.span(leaf, i, close + 2), label, destination), parser.depth + 1);
        return close + 2;
    }

    private int footnoteRef(int i) {
        int j = i + 2;
        while (j < to && text.charAt(j) != ']') {
            char c = text.charAt(j);
            if (Character.isWhitespace(c) || c == '[' || c == '^') {
                return -1;
            }
            j++;
        }
        if (j >= to || j == i + 2) {
            return -1;
        }
        emit(new Inline.FootnoteRef(ctx.span(leaf, i, j + 1), text.substring(i + 2, j)));
        return j + 1;
    }

    private int inlineLink(int i) {
        int close = matchingBracket(i);
        if (close < 0 || close + 1 >= to || text.charAt(close + 1) != '(') {
            return -1;
        }
        int j = skipSpaces(close + 2);
        int destStart;
        int destEnd;
        if (j < to && text.charAt(j) == '<') {
            destStart = j + 1;
            destEnd = text.indexOf('>', destStart);
            if (destEnd < 0 || destEnd >= to || text.substring(destStart, destEnd).indexOf('\n') >= 0) {
                return -1;
            }
            j = destEnd + 1;
        } else {
            destStart = j;
            int depth = 0;
            while (j < to) {
                char c = text.charAt(j);
                if (Character.isWhitespace(c) || (c == ')' && depth == 0)) {
                    break;
                }
                depth += c == '(' ? 1 : c == ')' ? -1 : 0;
                j++;
            }
            destEnd = j;
        }
        j = skipSpaces(j);
        if (j >= to || text.charAt(j) != ')') {
            return -1;
        }
        var parser = label(i + 1, close);
        var label = parser.parse();
        emit(new Inline.Link(ctx.span(leaf, i, j + 1), label, text.substring(destStart, destEnd)), parser.depth + 1);
        return j + 1;
    }

    private int matchingBracket(int open) {
        int depth = 0;
        for (int j = open; j < to; j++) {
            char c = text.charAt(j);
            if (c == '\\') {
                j++;
            } else if (c == '[') {
                depth++;
            } else if (c == ']' && --depth == 0) {
                return j;
            }
        }
        return -1;
    }

    private int angle(int i) {
        if (!ctx.recognizes(Construct.AUTOLINK)) {
            return literal(i, i + 1);
        }
        int j = i + 1;
        while (j < to && text.charAt(j) != '>') {
            char c = text.charAt(j);
            if (Character.isWhitespace(c) || c == '<') {
                return literal(i, i + 1);
            }
            j++;
        }
        if (j >= to || j == i + 1) {
            return literal(i, i + 1);
        }
        var destination = text.substring(i + 1, j);
        if (destination.contains("://") || destination.startsWith("mailto:") || EMAIL.matcher(destination).matches()) {
            emit(new Inline.AutoLink(ctx.span(leaf, i, j + 1), destination));
            return j + 1;
        }
        return literal(i, i + 1);
    }

    private int bareUrl(int i) {
        if (!ctx.recognizes(Construct.BARE_URL)
            || !text.startsWith("http", i)
            || (i > from && Character.isLetterOrDigit(text.charAt(i - 1)))) {
            return literal(i, i + 1);
        }
        var matcher = BARE_URL.matcher(text).region(i, to);
        if (!matcher.lookingAt()) {
            return literal(i, i + 1);
        }
        int end = trimUrl(i, matcher.end());
        if (text.indexOf("://", i) + 3 >= end) {
            return literal(i, i + 1);
        }
        emit(new Inline.AutoLink(ctx.span(leaf, i, end), text.substring(i, end)));
        return end;
    }

    private int trimUrl(int start, int end) {
        while (end > start) {
            char last = text.charAt(end - 1);
            if (URL_TRAILING_PUNCTUATION.indexOf(last) >= 0) {
                end--;
            } else if (last == ')' && count(start, end, ')') > count(start, end, '(')) {
                end--;
            } else {
                break;
            }
        }
        return end;
    }

    private int count(int start, int end, char c) {
        int n = 0;
        for (int j = start; j < end; j++) {
            if (text.charAt(j) == c) {
                n++;
            }
        }
        return n;
    }

    // === Emphasis matching ===

    private void processEmphasis() {
        int starBottom = -1;
        int tildeBottom = -1;
        var slot = head;
        while (slot != null) {
            var closer = slot.delimiter;
            if (closer == null || !closer.canClose || closer.count == 0) {
                slot = slot.next;
                continue;
            }
            int bottom = closer.marker == '*' ? starBottom : tildeBottom;
            var openerSlot = findOpener(slot, closer, bottom);
            if (openerSlot == null) {
                if (closer.marker == '*') {
                    starBottom = closer.ordinal - 1;
                } else {
                    tildeBottom = closer.ordinal - 1;
                }
                slot = slot.next;
                continue;
            }
            int nested = depthBetween(openerSlot.next, slot) + 1;
            if (nested > maxDepth) {
                slot = slot.next;
                continue;
            }
            var opener = openerSlot.delimiter;
            int use = closer.marker == '~' || (opener.count >= 2 && closer.count >= 2) ? 2 : 1;
            var children = collect(openerSlot.next, slot);
            var span = ctx.span(leaf, opener.start + opener.count - use, closer.start + use);
            Inline node = closer.marker == '~'
                          ? new Inline.Strikethrough(span, children)
                          : use == 2
                            ? new Inline.Strong(span, children)
                            : new Inline.Emphasis(span, children);
            opener.count -= use;
            closer.start += use;
            closer.count -= use;

            var nodeSlot = Slot.node(node, nested);
            openerSlot.next = nodeSlot;
            nodeSlot.prev = openerSlot;
            nodeSlot.next = slot;
            slot.prev = nodeSlot;
            if (opener.count == 0) {
                unlink(openerSlot);
            }
            if (closer.count == 0) {
                var next = slot.next;
                unlink(slot);
                slot = next;
            }
        }
    }

    private static Slot findOpener(Slot closerSlot, Delimiter closer, int bottom) {
        for (var p = closerSlot.prev; p != null; p = p.prev) {
            var candidate = p.delimiter;
            if (candidate == null || candidate.marker != closer.marker || !candidate.canOpen) {
                continue;
            }
            if (candidate.ordinal <= bottom) {
                return null;
            }
            if (candidate.count == 0) {
                continue;
            }
            if (closer.marker == '~' && (candidate.count < 2 || closer.count < 2)) {
                continue;
            }
            return p;
        }
        return null;
    }

    private static int depthBetween(Slot first, Slot stop) {
        int deepest = 0;
        for (var s = first; s != null && s != stop; s = s.next) {
            deepest = Math.max(deepest, s.depth);
        }
        return deepest;
    }

    // Slots in [first, stop) as nodes; leftover delimiters become text, touching texts merge.
    private List<Inline> collect(Slot first, Slot stop) {
        var result = new ArrayList<Inline>();
        for (var s = first; s != null && s != stop; s = s.next) {
            Inline node = s.node;
            if (s.delimiter != null) {
                if (s.delimiter.count == 0) {
                    continue;
                }
                var d = s.delimiter;
                node = new Inline.Text(ctx.span(leaf, d.start, d.start + d.count),
                                       String.valueOf(d.marker).repeat(d.count));
            }
            int last = result.size() - 1;
            if (node instanceof Inline.Text next
                && last >= 0
                && result.get(last) instanceof Inline.Text previous
                && previous.span().end() == next.span().start()) {
                result.set(last, new Inline.Text(previous.span().merge(next.span()),
                                                 previous.content() + next.content()));
            } else {
                result.add(node);
            }
        }
        return result;
    }

    // === Slots and pending text ===

    private int literal(int start, int end) {
        for (int j = start; j < end; j++) {
            append(text.charAt(j), j, j + 1);
        }
        return end;
    }

    private void append(char c, int rawStart, int rawEnd) {
        if (pendingStart < 0) {
            pendingStart = rawStart;
        }
        pending.append(c);
        pendingEnd = rawEnd;
    }

    private void flush() {
        if (pendingStart < 0) {
            return;
        }
        link(Slot.node(new Inline.Text(ctx.span(leaf, pendingStart, pendingEnd), pending.toString()), 0));
        pending.setLength(0);
        pendingStart = -1;
        pendingEnd = -1;
    }

    private void emit(Inline node) {
        emit(node, 0);
    }

    private void emit(Inline node, int nodeDepth) {
        flush();
        link(Slot.node(node, nodeDepth));
    }

    private void link(Slot slot) {
        if (tail == null) {
            head = slot;
        } else {
            tail.next = slot;
            slot.prev = tail;
        }
        tail = slot;
    }

    private void unlink(Slot slot) {
        if (slot.prev == null) {
            head = slot.next;
        } else {
            slot.prev.next = slot.next;
        }
        if (slot.next == null) {
            tail = slot.prev;
        } else {
            slot.next.prev = slot.prev;
        }
    }

    private int runLength(int i, char c) {
        int j = i;
        while (j < to && text.charAt(j) == c) {
            j++;
        }
        return j - i;
    }

    private int skipSpaces(int i) {
        while (i < to && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static final class Slot {
        private Inline node;
        private Delimiter delimiter;
        private int depth;
        private Slot prev;
        private Slot next;

        static Slot node(Inline node, int depth) {
            var slot = new Slot();
            slot.node = node;
            slot.depth = depth;
            return slot;
        }

        static Slot delimiter(Delimiter delimiter) {
            var slot = new Slot();
            slot.delimiter = delimiter;
            return slot;
        }
    }

    private static final class Delimiter {
        private final char marker;
        private final boolean canOpen;
        private final boolean canClose;
        private final int ordinal;
        private int start;
        private int count;

        Delimiter(char marker, int start, int count, boolean canOpen, boolean canClose, int ordinal) {
            this.marker = marker;
            this.start = start;
            this.count = count;
            this.canOpen = canOpen;
            this.canClose = canClose;
            this.ordinal = ordinal;
        }
    }
}
