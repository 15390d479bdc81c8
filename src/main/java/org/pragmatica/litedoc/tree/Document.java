package org.pragmatica.litedoc.tree;

import org.pragmatica.litedoc.parser.Module;
import org.pragmatica.litedoc.parser.Profile;

import java.util.List;
import java.util.Optional;

/**
 * Root of a parsed document. Immutable; the span covers the whole input.
 *
 * @param profile  profile the document was parsed with (after any {@code @profile} directive)
 * @param modules  modules declared by an {@code @modules} line, in declaration order
 * @param metadata front matter, if the document opens with one
 * @param blocks   top-level blocks in source order
 * @param span     span of the entire input
 */
public record Document(Profile profile,
                       List<Module> modules,
                       Optional<Metadata> metadata,
                       List<Block> blocks,
                       SourceSpan span) {
    public Document {
        modules = List.copyOf(modules);
        blocks = List.copyOf(blocks);
    }

    public boolean hasModule(Module module) {
        return modules.contains(module);
    }

    public int size() {
        return blocks.size();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    @Override
    public String toString() {
        return "Document(profile=" + profile + ", modules=" + modules + ", blocks=" + blocks.size()
               + ", metadata=" + metadata.map(Metadata::size).orElse(0) + ")";
    }
}
