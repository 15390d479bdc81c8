package org.pragmatica.litedoc.parser;

import org.pragmatica.litedoc.error.ParseErrorKind;
import org.pragmatica.litedoc.tree.MetaValue;
import org.pragmatica.litedoc.tree.Metadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Front matter: an opening line {@code --- meta ---}, {@code key: value} lines and a closing
 * {@code ---}. Malformed values are reported and kept as raw strings.
 */
final class MetadataParser {
    static final String OPENING = "--- meta ---";
    static final String CLOSING = "---";

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final ParsingContext ctx;

    private MetadataParser(ParsingContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Extraction outcome; {@code next} is the first line after the section and any blank
     * lines following it.
     */
    record Extracted(Optional<Metadata> metadata, int next) {}

    static Extracted extract(ParsingContext ctx, List<Line> lines, int pos) {
        if (pos >= lines.size() || !lines.get(pos).text().stripTrailing().equals(OPENING)) {
            return new Extracted(Optional.empty(), pos);
        }
        return new MetadataParser(ctx).section(lines, pos);
    }

    private Extracted section(List<Line> lines, int pos) {
        var opening = lines.get(pos);
        int closing = findClosing(lines, pos + 1);
        int end;
        if (closing < 0) {
            ctx.report(ParseErrorKind.MALFORMED_METADATA, ctx.span(opening), "front matter is not closed with '---'");
            end = pos + 1;
            while (end < lines.size() && isEntry(lines.get(end))) {
                end++;
            }
        } else {
            end = closing;
        }

        var entries = new LinkedHashMap<String, MetaValue>();
        for (int i = pos + 1; i < end; i++) {
            entry(lines.get(i), entries);
        }

        var last = closing >= 0 ? lines.get(closing) : lines.get(end - 1);
        var metadata = Metadata.of(entries, ctx.span(opening, last));
        int next = closing >= 0 ? closing + 1 : end;
        while (next < lines.size() && lines.get(next).isBlank()) {
            next++;
        }
        return new Extracted(Optional.of(metadata), next);
    }

    // The closing line must come before the first blank line of the section.
    private static int findClosing(List<Line> lines, int from) {
        for (int i = from; i < lines.size(); i++) {
            var line = lines.get(i);
            if (line.text().stripTrailing().equals(CLOSING)) {
                return i;
            }
            if (line.isBlank()) {
                return -1;
            }
        }
        return -1;
    }

    private static boolean isEntry(Line line) {
        int colon = line.text().indexOf(':');
        return colon > 0 && !line.text().substring(0, colon).isBlank();
    }

    private void entry(Line line, Map<String, MetaValue> entries) {
        var text = line.text();
        int colon = text.indexOf(':');
        if (colon < 0) {
            ctx.report(ParseErrorKind.MALFORMED_METADATA, ctx.span(line), "expected 'key: value'");
            return;
        }
        var key = text.substring(0, colon).strip();
        if (key.isEmpty()) {
            ctx.report(ParseErrorKind.MALFORMED_METADATA, ctx.span(line), "empty metadata key");
            return;
        }
        var value = value(text.substring(colon + 1).strip(), line);
        if (entries.containsKey(key)) {
            ctx.report(ParseErrorKind.MALFORMED_METADATA, ctx.span(line), "duplicate metadata key '" + key + "'");
        }
        entries.put(key, value);
    }

    private MetaValue value(String raw, Line line) {
        if (raw.startsWith("[")) {
            if (!raw.endsWith("]")) {
                ctx.report(ParseErrorKind.MALFORMED_METADATA, ctx.span(line), "unclosed list value");
                return MetaValue.of(raw);
            }
            var items = new ArrayList<MetaValue>();
            for (var item : splitItems(raw.substring(1, raw.length() - 1))) {
                items.add(scalar(item, line));
            }
            return new MetaValue.Seq(items);
        }
        return scalar(raw, line);
    }

    private MetaValue scalar(String raw, Line line) {
        if (raw.startsWith("\"") || raw.startsWith("'")) {
            return unquote(raw).<MetaValue>map(MetaValue.Str::new)
                               .orElseGet(() -> {
                                   ctx.report(ParseErrorKind.MALFORMED_METADATA,
                                              ctx.span(line),
                                              "malformed quoted string " + raw);
                                   return MetaValue.of(raw);
                               });
        }
        if (raw.equals("true") || raw.equals("false")) {
            return new MetaValue.Bool(Boolean.parseBoolean(raw));
        }
        if (INTEGER.matcher(raw).matches()) {
            try {
                return MetaValue.of(Long.parseLong(raw));
            } catch (NumberFormatException e) {
                ctx.report(ParseErrorKind.MALFORMED_METADATA, ctx.span(line), "integer out of range: " + raw);
                return MetaValue.of(raw);
            }
        }
        if (FLOAT.matcher(raw).matches()) {
            return new MetaValue.Float(Double.parseDouble(raw));
        }
        return MetaValue.of(raw);
    }

    /**
     * Content of a quoted string, or empty when it is unterminated or followed by more text.
     */
    static Optional<String> unquote(String raw) {
        char quote = raw.charAt(0);
        var result = new StringBuilder();
        int i = 1;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == quote) {
                return i == raw.length() - 1 ? Optional.of(result.toString()) : Optional.empty();
            }
            if (c == '\\' && i + 1 < raw.length()) {
                char next = raw.charAt(i + 1);
                switch (next) {
                    case 'n' -> result.append('\n');
                    case 't' -> result.append('\t');
                    case '"', '\'', '\\' -> result.append(next);
                    default -> result.append(c).append(next);
                }
                i += 2;
                continue;
            }
            result.append(c);
            i++;
        }
        return Optional.empty();
    }

    private static List<String> splitItems(String inner) {
        var items = new ArrayList<String>();
        char quote = 0;
        int start = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == ',') {
                addItem(items, inner.substring(start, i));
                start = i + 1;
            }
        }
        addItem(items, inner.substring(start));
        return items;
    }

    private static void addItem(List<String> items, String item) {
        var trimmed = item.strip();
        if (!trimmed.isEmpty()) {
            items.add(trimmed);
        }
    }
}
