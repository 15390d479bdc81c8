package org.pragmatica.litedoc.parser;

/**
 * Classification of a line at a block boundary.
 */
enum LineKind {
    BLANK,
    HEADING,
    THEMATIC_BREAK,
    DIRECTIVE_OPEN,
    DIRECTIVE_CLOSE,
    CODE_FENCE,
    MATH_FENCE,
    QUOTE,
    LIST_ITEM,
    TABLE_ROW,
    HTML,
    TEXT
}
