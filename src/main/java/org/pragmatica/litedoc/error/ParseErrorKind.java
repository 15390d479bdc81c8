package org.pragmatica.litedoc.error;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Structural cause of a parse diagnostic.
 *
 * <p>Each kind lists the recoveries the parser knows how to apply for it; the first one
 * is the default.
 */
public enum ParseErrorKind {
    UNTERMINATED_CONTAINER("E001", "unterminated container", RecoveryStrategy.CLOSE_AT_FAILURE),
    UNKNOWN_DIRECTIVE("E002", "unknown directive", RecoveryStrategy.SUBSTITUTE_RAW, RecoveryStrategy.TREAT_AS_TEXT),
    MALFORMED_TABLE("E003", "malformed table", RecoveryStrategy.NORMALIZE_ROWS),
    MALFORMED_METADATA("E004", "malformed metadata", RecoveryStrategy.KEEP_RAW_VALUE),
    INVALID_HEADING_LEVEL("E005", "invalid heading level", RecoveryStrategy.CLAMP_LEVEL, RecoveryStrategy.TREAT_AS_TEXT),
    INVALID_LIST_MARKER("E006", "invalid list marker", RecoveryStrategy.TREAT_AS_TEXT),
    /**
     * Containers nested deeper than the configured limit. Never recovered.
     */
    NESTING_TOO_DEEP("E007", "nesting too deep", RecoveryStrategy.ABORT);

    private final String code;
    private final String display;
    private final RecoveryStrategy defaultStrategy;
    private final Set<RecoveryStrategy> supported;

    ParseErrorKind(String code, String display, RecoveryStrategy defaultStrategy, RecoveryStrategy... alternatives) {
        this.code = code;
        this.display = display;
        this.defaultStrategy = defaultStrategy;
        this.supported = Collections.unmodifiableSet(EnumSet.of(defaultStrategy, alternatives));
    }

    public String code() {
        return code;
    }

    public String display() {
        return display;
    }

    public RecoveryStrategy defaultStrategy() {
        return defaultStrategy;
    }

    public boolean supports(RecoveryStrategy strategy) {
        return supported.contains(strategy);
    }

    public Set<RecoveryStrategy> supportedStrategies() {
        return supported;
    }
}
