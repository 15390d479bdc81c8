package org.pragmatica.litedoc.tree;

import java.util.List;

/**
 * Inline node - a unit of parsed text inside a leaf block.
 * Container variants own their children, so inline structure is a tree.
 */
public sealed interface Inline {
    /**
     * The source span covered by this node, including its delimiters.
     */
    SourceSpan span();

    /**
     * Plain text. Escapes are already resolved, so content may differ from the source slice.
     */
    record Text(SourceSpan span, String content) implements Inline {}

    /**
     * Emphasized text ({@code *text*}).
     */
    record Emphasis(SourceSpan span, List<Inline> children) implements Inline {
        public Emphasis {
            children = List.copyOf(children);
        }
    }

    /**
     * Strong text ({@code **text**}).
     */
    record Strong(SourceSpan span, List<Inline> children) implements Inline {
        public Strong {
            children = List.copyOf(children);
        }
    }

    /**
     * Struck-through text ({@code ~~text~~}).
     */
    record Strikethrough(SourceSpan span, List<Inline> children) implements Inline {
        public Strikethrough {
            children = List.copyOf(children);
        }
    }

    /**
     * Inline code. Content is never parsed further.
     */
    record CodeSpan(SourceSpan span, String content) implements Inline {}

    /**
     * Hyperlink with a label and a destination.
     */
    record Link(SourceSpan span, List<Inline> label, String destination) implements Inline {
        public Link {
            label = List.copyOf(label);
        }
    }

    /**
     * URI recognized without explicit link syntax, or in angle brackets.
     */
    record AutoLink(SourceSpan span, String destination) implements Inline {}

    /**
     * Reference to a footnote definition. The definition may be missing.
     */
    record FootnoteRef(SourceSpan span, String id) implements Inline {}

    record HardBreak(SourceSpan span) implements Inline {}

    record SoftBreak(SourceSpan span) implements Inline {}
}
