package org.pragmatica.litedoc.parser;

import org.pragmatica.litedoc.tree.Document;

/**
 * Parser interface - parses document text under a fixed configuration.
 * Implementations hold no per-call state and may be shared between threads.
 */
public interface Parser {

    /**
     * Parse input, failing on the first fatal diagnostic.
     *
     * @throws org.pragmatica.litedoc.error.ParseException if a fatal diagnostic is reported
     * @throws org.pragmatica.litedoc.error.NestingDepthException if nesting exceeds the configured limit
     */
    Document parse(String input);

    /**
     * Parse input, collecting diagnostics instead of failing. The returned document is a
     * best-effort tree built with the recovery strategies of each diagnostic applied.
     *
     * @throws org.pragmatica.litedoc.error.NestingDepthException if nesting exceeds the configured limit
     */
    ParseResult parseWithRecovery(String input);

    /**
     * Configuration this parser was built with.
     */
    ParserConfig config();

    default Profile profile() {
        return config().profile();
    }
}
