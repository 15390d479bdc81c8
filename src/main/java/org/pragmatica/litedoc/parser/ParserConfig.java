package org.pragmatica.litedoc.parser;

import org.pragmatica.litedoc.error.RecoveryPolicy;

/**
 * Parser configuration options.
 *
 * @param profile          profile used unless the document selects another one
 * @param maxNestingDepth  deepest allowed nesting of containers, list items, quotes and inline spans
 * @param headerDirectives whether leading {@code @profile} and {@code @modules} lines are interpreted
 * @param recoveryPolicy   recovery applied for each kind of diagnostic
 */
public record ParserConfig(
    Profile profile,
    int maxNestingDepth,
    boolean headerDirectives,
    RecoveryPolicy recoveryPolicy
) {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

    public static final ParserConfig DEFAULT = new ParserConfig(
        Profile.LITEDOC,
        DEFAULT_MAX_NESTING_DEPTH,
        true,
        RecoveryPolicy.DEFAULT
    );

    public ParserConfig {
        if (profile == null) {
            throw new IllegalArgumentException("Profile must not be null");
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Maximum nesting depth must be at least 1, got " + maxNestingDepth);
        }
        if (recoveryPolicy == null) {
            throw new IllegalArgumentException("Recovery policy must not be null");
        }
    }

    public static ParserConfig forProfile(Profile profile) {
        return new ParserConfig(profile, DEFAULT_MAX_NESTING_DEPTH, true, RecoveryPolicy.DEFAULT);
    }
}
