package org.pragmatica.litedoc.parser;

/**
 * Syntax constructs whose recognition depends on the profile.
 */
public enum Construct {
    HEADING,
    PARAGRAPH,
    LIST,
    TASK_ITEM,
    CODE_BLOCK,
    QUOTE,
    THEMATIC_BREAK,
    TABLE,
    HTML,
    CALLOUT,
    FIGURE,
    FOOTNOTES,
    MATH,
    EMPHASIS,
    STRONG,
    STRIKETHROUGH,
    CODE_SPAN,
    LINK,
    WIKI_LINK,
    AUTOLINK,
    BARE_URL,
    FOOTNOTE_REF
}
