package org.pragmatica.litedoc.parser;

import java.util.Optional;

/**
 * Known container directives.
 */
enum Directive {
    LIST("list", Construct.LIST, false),
    CALLOUT("callout", Construct.CALLOUT, true),
    QUOTE("quote", Construct.QUOTE, true),
    FIGURE("figure", Construct.FIGURE, true),
    TABLE("table", Construct.TABLE, false),
    FOOTNOTES("footnotes", Construct.FOOTNOTES, false),
    MATH("math", Construct.MATH, false),
    HTML("html", Construct.HTML, false);

    private final String directiveName;
    private final Construct construct;
    private final boolean blockBody;

    Directive(String directiveName, Construct construct, boolean blockBody) {
        this.directiveName = directiveName;
        this.construct = construct;
        this.blockBody = blockBody;
    }

    /**
     * Whether the body is parsed as blocks while the directive is open, rather than
     * collected up to the closing line first.
     */
    boolean blockBody() {
        return blockBody;
    }

    /**
     * The directive with the given name, if the profile recognizes it.
     */
    static Optional<Directive> lookup(String name, Profile profile) {
        for (var directive : values()) {
            if (directive.directiveName.equals(name) && profile.recognizes(directive.construct)) {
                return Optional.of(directive);
            }
        }
        return Optional.empty();
    }
}
