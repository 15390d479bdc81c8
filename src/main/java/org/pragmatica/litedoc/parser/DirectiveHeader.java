package org.pragmatica.litedoc.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Opening line of a container directive: {@code ::name key=value key="quoted value" flag}.
 *
 * @param name       directive name
 * @param attributes attributes in declaration order; a repeated key keeps the last value
 * @param line       the opening line
 */
record DirectiveHeader(String name, Map<String, Attribute> attributes, Line line) {

    /**
     * Attribute value. {@code rawStart}/{@code rawEnd} are source character indices of the
     * value as written, without surrounding quotes and with escapes unprocessed.
     */
    record Attribute(String value, int rawStart, int rawEnd, boolean flag) {}

    static Optional<DirectiveHeader> parse(Line line) {
        if (!LineClassifier.isDirectiveOpen(line)) {
            return Optional.empty();
        }
        var text = line.text();
        int pos = text.indexOf("::") + 2;
        int nameStart = pos;
        while (pos < text.length() && isNameChar(text.charAt(pos))) {
            pos++;
        }
        var name = text.substring(nameStart, pos);
        var attributes = new LinkedHashMap<String, Attribute>();
        while (pos < text.length()) {
            pos = skipSpaces(text, pos);
            if (pos >= text.length()) {
                break;
            }
            int keyStart = pos;
            while (pos < text.length() && isNameChar(text.charAt(pos))) {
                pos++;
            }
            var key = text.substring(keyStart, pos);
            if (key.isEmpty()) {
                pos = skipToken(text, pos);
                continue;
            }
            if (pos >= text.length() || text.charAt(pos) != '=') {
                if (pos < text.length() && !Line.isSpace(text.charAt(pos))) {
                    pos = skipToken(text, pos);
                    continue;
                }
                attributes.put(key, new Attribute("", line.start() + keyStart, line.start() + pos, true));
                continue;
            }
            pos++;
            if (pos < text.length() && text.charAt(pos) == '"') {
                pos = quoted(text, pos + 1, key, line, attributes);
            } else {
                int valueStart = pos;
                pos = skipToken(text, pos);
                attributes.put(key, new Attribute(text.substring(valueStart, pos),
                                                  line.start() + valueStart,
                                                  line.start() + pos,
                                                  false));
            }
        }
        return Optional.of(new DirectiveHeader(name, Collections.unmodifiableMap(attributes), line));
    }

    private static int quoted(String text, int pos, String key, Line line, Map<String, Attribute> attributes) {
        var value = new StringBuilder();
        int valueStart = pos;
        while (pos < text.length() && text.charAt(pos) != '"') {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length() && (text.charAt(pos + 1) == '"' || text.charAt(pos + 1) == '\\')) {
                value.append(text.charAt(pos + 1));
                pos += 2;
            } else {
                value.append(c);
                pos++;
            }
        }
        int valueEnd = Math.min(pos, text.length());
        attributes.put(key, new Attribute(value.toString(), line.start() + valueStart, line.start() + valueEnd, false));
        return Math.min(pos + 1, text.length());
    }

    Optional<String> attribute(String key) {
        return Optional.ofNullable(attributes.get(key))
                       .filter(a -> !a.flag())
                       .map(Attribute::value);
    }

    Optional<Attribute> rawAttribute(String key) {
        return Optional.ofNullable(attributes.get(key))
                       .filter(a -> !a.flag());
    }

    boolean flag(String key) {
        return attributes.containsKey(key) && attributes.get(key).flag();
    }

    private static boolean isNameChar(char c) {
        return LineClassifier.isAsciiLetter(c) || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }

    private static int skipSpaces(String text, int pos) {
        while (pos < text.length() && Line.isSpace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static int skipToken(String text, int pos) {
        while (pos < text.length() && !Line.isSpace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }
}
