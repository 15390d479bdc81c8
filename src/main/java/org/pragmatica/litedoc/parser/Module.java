package org.pragmatica.litedoc.parser;

import java.util.Optional;

/**
 * Optional feature a document declares with an {@code @modules} header line.
 *
 * <p>Declared modules are recorded on the document for consumers; which constructs are
 * recognized is decided by the {@link Profile} alone.
 */
public enum Module {
    TABLES("tables"),
    FOOTNOTES("footnotes"),
    MATH("math"),
    TASKS("tasks"),
    STRIKETHROUGH("strikethrough"),
    AUTOLINK("autolink"),
    HTML("html");

    private final String directiveName;

    Module(String directiveName) {
        this.directiveName = directiveName;
    }

    /**
     * Name used in the {@code @modules} list.
     */
    public String directiveName() {
        return directiveName;
    }

    public static Optional<Module> fromName(String name) {
        for (var module : values()) {
            if (module.directiveName.equals(name)) {
                return Optional.of(module);
            }
        }
        return Optional.empty();
    }
}
