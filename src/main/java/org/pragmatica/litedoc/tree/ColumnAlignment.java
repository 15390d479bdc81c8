package org.pragmatica.litedoc.tree;

/**
 * Column alignment taken from a table separator row ({@code :--}, {@code :-:}, {@code --:}).
 */
public enum ColumnAlignment {
    NONE,
    LEFT,
    CENTER,
    RIGHT
}
