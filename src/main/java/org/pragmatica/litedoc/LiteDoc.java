package org.pragmatica.litedoc;

import org.pragmatica.litedoc.error.ParseErrorKind;
import org.pragmatica.litedoc.error.RecoveryPolicy;
import org.pragmatica.litedoc.error.RecoveryStrategy;
import org.pragmatica.litedoc.parser.DocumentParser;
import org.pragmatica.litedoc.parser.ParseResult;
import org.pragmatica.litedoc.parser.Parser;
import org.pragmatica.litedoc.parser.ParserConfig;
import org.pragmatica.litedoc.parser.Profile;
import org.pragmatica.litedoc.tree.Document;

/**
 * Entry point for parsing LiteDoc and Markdown documents.
 *
 * <p>Example usage:
 * <pre>{@code
 * var document = LiteDoc.parse("""
 *     --- meta ---
 *     title: "Release notes"
 *     ---
 *
 *     ::callout type=warning
 *     Back up your data **first**.
 *     ::
 *     """);
 *
 * var result = LiteDoc.parseWithRecovery(text, Profile.MD);
 * if (!result.ok()) {
 *     System.err.println(result.formatDiagnostics(text));
 * }
 * }</pre>
 */
public final class LiteDoc {
    private LiteDoc() {}

    /**
     * Parse with the {@link Profile#LITEDOC} profile.
     *
     * @throws org.pragmatica.litedoc.error.ParseException on the first fatal diagnostic
     */
    public static Document parse(String text) {
        return parse(text, Profile.LITEDOC);
    }

    /**
     * Parse with the given profile.
     *
     * @throws org.pragmatica.litedoc.error.ParseException on the first fatal diagnostic
     */
    public static Document parse(String text, Profile profile) {
        return parser(profile).parse(text);
    }

    /**
     * Parse with the {@link Profile#LITEDOC} profile, collecting diagnostics.
     */
    public static ParseResult parseWithRecovery(String text) {
        return parseWithRecovery(text, Profile.LITEDOC);
    }

    /**
     * Parse with the given profile, collecting diagnostics.
     */
    public static ParseResult parseWithRecovery(String text, Profile profile) {
        return parser(profile).parseWithRecovery(text);
    }

    /**
     * Create a reusable parser with default options for the given profile.
     */
    public static Parser parser(Profile profile) {
        return DocumentParser.create(ParserConfig.forProfile(profile));
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Profile profile = Profile.LITEDOC;
        private int maxNestingDepth = ParserConfig.DEFAULT_MAX_NESTING_DEPTH;
        private boolean headerDirectives = true;
        private RecoveryPolicy recoveryPolicy = RecoveryPolicy.DEFAULT;

        private Builder() {}

        public Builder profile(Profile profile) {
            this.profile = profile;
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            this.maxNestingDepth = depth;
            return this;
        }

        /**
         * Whether leading {@code @profile name} and {@code @modules a, b} lines are read as
         * header directives. When disabled they are ordinary paragraph text.
         */
        public Builder headerDirectives(boolean enabled) {
            this.headerDirectives = enabled;
            return this;
        }

        /**
         * Apply {@code strategy} instead of the default recovery for {@code kind}.
         *
         * @throws IllegalArgumentException when the strategy cannot be applied to that kind
         */
        public Builder recovery(ParseErrorKind kind, RecoveryStrategy strategy) {
            this.recoveryPolicy = recoveryPolicy.with(kind, strategy);
            return this;
        }

        public Parser build() {
            return DocumentParser.create(new ParserConfig(profile, maxNestingDepth, headerDirectives, recoveryPolicy));
        }
    }
}
