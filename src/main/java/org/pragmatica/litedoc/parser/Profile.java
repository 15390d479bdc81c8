package org.pragmatica.litedoc.parser;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Dialect profile. Answers which constructs are recognized and how strictly
 * malformed input is treated. All lookups are pure.
 */
public enum Profile {
    /**
     * Native syntax: container directives, callouts, figures, footnotes, math, wiki links.
     */
    LITEDOC("litedoc", EnumSet.allOf(Construct.class), false, false),

    /**
     * Markdown core. Extended directives pass through as raw blocks without diagnostics.
     */
    MD("md", Core.CONSTRUCTS, false, true),

    /**
     * Markdown core; every diagnostic is fatal for the strict entry point.
     */
    MD_STRICT("md-strict", Core.CONSTRUCTS, true, false);

    private final String directiveName;
    private final Set<Construct> constructs;
    private final boolean strict;
    private final boolean toleratesUnknownDirectives;

    Profile(String directiveName, Set<Construct> constructs, boolean strict, boolean toleratesUnknownDirectives) {
        this.directiveName = directiveName;
        this.constructs = Collections.unmodifiableSet(constructs);
        this.strict = strict;
        this.toleratesUnknownDirectives = toleratesUnknownDirectives;
    }

    public boolean recognizes(Construct construct) {
        return constructs.contains(construct);
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Whether unknown directives become raw blocks silently instead of reporting a diagnostic.
     */
    public boolean toleratesUnknownDirectives() {
        return toleratesUnknownDirectives;
    }

    /**
     * Whether ragged table rows are padded or truncated without a diagnostic.
     */
    public boolean normalizesRaggedTables() {
        return !strict;
    }

    /**
     * Name used by the {@code @profile} directive.
     */
    public String directiveName() {
        return directiveName;
    }

    public static Optional<Profile> fromName(String name) {
        for (var profile : values()) {
            if (profile.directiveName.equals(name)) {
                return Optional.of(profile);
            }
        }
        return Optional.empty();
    }

    private static final class Core {
        private static final Set<Construct> CONSTRUCTS = EnumSet.of(
            Construct.HEADING,
            Construct.PARAGRAPH,
            Construct.LIST,
            Construct.TASK_ITEM,
            Construct.CODE_BLOCK,
            Construct.QUOTE,
            Construct.THEMATIC_BREAK,
            Construct.TABLE,
            Construct.HTML,
            Construct.EMPHASIS,
            Construct.STRONG,
            Construct.STRIKETHROUGH,
            Construct.CODE_SPAN,
            Construct.LINK,
            Construct.AUTOLINK,
            Construct.BARE_URL);
    }
}
