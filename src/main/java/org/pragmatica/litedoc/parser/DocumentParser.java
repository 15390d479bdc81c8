package org.pragmatica.litedoc.parser;

import org.pragmatica.litedoc.error.ParseError;
import org.pragmatica.litedoc.error.ParseException;
import org.pragmatica.litedoc.tree.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Parser implementation: reads the header directives, extracts front matter, parses
 * blocks and shapes the result for either entry point.
 *
 * <p>The header is an optional {@code @profile name} line followed by an optional
 * {@code @modules a, b} line, starting on the first line of the input. Blank lines after
 * an accepted directive are skipped, so front matter may follow them.
 */
public final class DocumentParser implements Parser {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentParser.class);
    private static final String PROFILE_DIRECTIVE = "@profile";
    private static final String MODULES_DIRECTIVE = "@modules";

    private final ParserConfig config;

    private DocumentParser(ParserConfig config) {
        this.config = config;
    }

    public static DocumentParser create(ParserConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Parser configuration must not be null");
        }
        return new DocumentParser(config);
    }

    @Override
    public Document parse(String input) {
        var result = parseWithRecovery(input);
        var profile = result.document().profile();
        var fatal = result.errors()
                          .stream()
                          .filter(e -> config.recoveryPolicy().isFatal(e.kind(), profile))
                          .findFirst();
        if (fatal.isPresent()) {
            throw new ParseException(fatal.get());
        }
        return result.document();
    }

    @Override
    public ParseResult parseWithRecovery(String input) {
        if (input == null) {
            throw new IllegalArgumentException("Input must not be null");
        }
        var lines = LineScanner.scan(input);
        int pos = 0;
        var profile = config.profile();
        List<Module> modules = List.of();
        if (config.headerDirectives()) {
            if (pos < lines.size()) {
                var selected = profileDirective(lines.get(pos));
                if (selected.isPresent()) {
                    profile = selected.get();
                    pos = skipBlank(lines, pos + 1);
                }
            }
            if (pos < lines.size()) {
                var declared = modulesDirective(lines.get(pos));
                if (declared.isPresent()) {
                    modules = declared.get();
                    pos = skipBlank(lines, pos + 1);
                }
            }
        }
        var ctx = ParsingContext.create(input, config, profile);
        var extracted = MetadataParser.extract(ctx, lines, pos);
        var blocks = BlockParser.parse(ctx, lines.subList(extracted.next(), lines.size()), 0);
        var document = new Document(profile, modules, extracted.metadata(), blocks, ctx.documentSpan());

        var errors = new ArrayList<ParseError>(ctx.errors());
        errors.sort(Comparator.comparingInt(e -> e.span().start()));
        LOG.debug("Parsed {} bytes with profile {}: {} blocks, {} diagnostics",
                  document.span().length(),
                  profile.directiveName(),
                  blocks.size(),
                  errors.size());
        return new ParseResult(document, errors);
    }

    @Override
    public ParserConfig config() {
        return config;
    }

    /**
     * Profile named by a {@code @profile name} line. An unknown name leaves the line as text.
     */
    static Optional<Profile> profileDirective(Line line) {
        var trimmed = line.trimmed();
        if (!trimmed.startsWith(PROFILE_DIRECTIVE + " ")) {
            return Optional.empty();
        }
        return Profile.fromName(trimmed.substring(PROFILE_DIRECTIVE.length()).strip());
    }

    /**
     * Modules listed by an {@code @modules a, b} line. Unknown names are ignored and
     * repeated ones kept once; the line is a directive even when nothing in it is known.
     */
    static Optional<List<Module>> modulesDirective(Line line) {
        var trimmed = line.trimmed();
        if (!trimmed.equals(MODULES_DIRECTIVE) && !trimmed.startsWith(MODULES_DIRECTIVE + " ")) {
            return Optional.empty();
        }
        var modules = new LinkedHashSet<Module>();
        for (var name : trimmed.substring(MODULES_DIRECTIVE.length()).split(",")) {
            var module = Module.fromName(name.strip());
            if (module.isPresent()) {
                modules.add(module.get());
            } else if (!name.isBlank()) {
                LOG.debug("Ignoring unknown module '{}'", name.strip());
            }
        }
        return Optional.of(List.copyOf(modules));
    }

    private static int skipBlank(List<Line> lines, int pos) {
        while (pos < lines.size() && lines.get(pos).isBlank()) {
            pos++;
        }
        return pos;
    }
}
