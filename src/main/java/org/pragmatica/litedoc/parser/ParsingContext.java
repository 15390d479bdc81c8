package org.pragmatica.litedoc.parser;

import org.pragmatica.litedoc.error.NestingDepthException;
import org.pragmatica.litedoc.error.ParseError;
import org.pragmatica.litedoc.error.ParseErrorKind;
import org.pragmatica.litedoc.error.RecoveryStrategy;
import org.pragmatica.litedoc.tree.Inline;
import org.pragmatica.litedoc.tree.SourceMap;
import org.pragmatica.litedoc.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-call parsing state: the source, its byte map, the effective profile and
 * the diagnostics collected so far.
 */
final class ParsingContext {
    private static final Logger LOG = LoggerFactory.getLogger(ParsingContext.class);

    private final String source;
    private final SourceMap sourceMap;
    private final ParserConfig config;
    private final Profile profile;
    private final List<ParseError> errors;

    private ParsingContext(String source, ParserConfig config, Profile profile) {
        this.source = source;
        this.sourceMap = SourceMap.of(source);
        this.config = config;
        this.profile = profile;
        this.errors = new ArrayList<>();
    }

    static ParsingContext create(String source, ParserConfig config, Profile profile) {
        return new ParsingContext(source, config, profile);
    }

    String source() {
        return source;
    }

    Profile profile() {
        return profile;
    }

    boolean recognizes(Construct construct) {
        return profile.recognizes(construct);
    }

    // === Spans ===

    SourceSpan span(int charStart, int charEnd) {
        return sourceMap.span(charStart, charEnd);
    }

    SourceSpan span(Line line) {
        return span(line.start(), line.end());
    }

    SourceSpan span(Line first, Line last) {
        return span(first.start(), Math.max(first.start(), last.end()));
    }

    SourceSpan span(LeafText text, int from, int to) {
        int start = text.sourceStart(from, to);
        return span(start, Math.max(start, text.sourceEnd(from, to)));
    }

    SourceSpan documentSpan() {
        return SourceSpan.of(0, sourceMap.byteLength());
    }

    // === Diagnostics ===

    /**
     * Record a diagnostic and return the recovery the configured policy selects for it.
     * Callers reporting a kind that supports more than one recovery dispatch on the result.
     */
    RecoveryStrategy recover(ParseErrorKind kind, SourceSpan span, String message) {
        var strategy = config.recoveryPolicy().strategyFor(kind, profile);
        errors.add(ParseError.of(kind, span, message));
        LOG.debug("{} at {}: {} -> {}", kind, span, message, strategy);
        return strategy;
    }

    /**
     * Record a diagnostic of a kind whose only supported recovery is the one the caller applies.
     */
    void report(ParseErrorKind kind, SourceSpan span, String message) {
        recover(kind, span, message);
    }

    IllegalStateException unsupported(RecoveryStrategy strategy, ParseErrorKind kind) {
        return new IllegalStateException("Recovery " + strategy + " cannot be applied to " + kind);
    }

    List<ParseError> errors() {
        return List.copyOf(errors);
    }

    // === Nesting ===

    int maxNestingDepth() {
        return config.maxNestingDepth();
    }

    /**
     * Fail when {@code depth} exceeds the configured maximum.
     *
     * @throws NestingDepthException when the limit is exceeded
     */
    void checkDepth(int depth, Line at) {
        if (depth > config.maxNestingDepth()) {
            var span = span(at);
            LOG.debug("Nesting depth {} exceeds limit {} at {}", depth, config.maxNestingDepth(), span);
            throw new NestingDepthException(span, config.maxNestingDepth());
        }
    }

    // === Inline ===

    List<Inline> inlines(LeafText text) {
        return InlineParser.create(this, text).parse();
    }

    List<Inline> inlines(List<Line> lines) {
        return inlines(LeafText.of(lines));
    }
}
