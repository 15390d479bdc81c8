package org.pragmatica.litedoc.error;

/**
 * What the parser does after reporting a diagnostic.
 */
public enum RecoveryStrategy {
    /**
     * Close the open container where the failure was detected, keeping its children.
     */
    CLOSE_AT_FAILURE,

    /**
     * Keep the construct's body as an uninterpreted raw block.
     */
    SUBSTITUTE_RAW,

    /**
     * Pad short table rows with empty cells and truncate long ones.
     */
    NORMALIZE_ROWS,

    /**
     * Keep the metadata value as its raw string.
     */
    KEEP_RAW_VALUE,

    /**
     * Clamp the heading level to 6.
     */
    CLAMP_LEVEL,

    /**
     * Parse the line as plain paragraph text.
     */
    TREAT_AS_TEXT,

    /**
     * No recovery; parsing stops.
     */
    ABORT
}
