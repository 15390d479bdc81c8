package org.pragmatica.litedoc.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Front-matter entries in declaration order.
 */
public final class Metadata {
    private final Map<String, MetaValue> entries;
    private final SourceSpan span;

    private Metadata(Map<String, MetaValue> entries, SourceSpan span) {
        this.entries = entries;
        this.span = span;
    }

    public static Metadata of(Map<String, MetaValue> entries, SourceSpan span) {
        return new Metadata(Collections.unmodifiableMap(new LinkedHashMap<>(entries)), span);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public Optional<MetaValue> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public MetaValue get(String key, MetaValue defaultValue) {
        return entries.getOrDefault(key, defaultValue);
    }

    /**
     * Plain Java value for the key, see {@link MetaValue#unwrap()}.
     */
    public Optional<Object> value(String key) {
        return get(key).map(MetaValue::unwrap);
    }

    public Optional<String> string(String key) {
        return get(key).filter(MetaValue.Str.class::isInstance)
                       .map(v -> ((MetaValue.Str) v).value());
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public Map<String, MetaValue> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Span of the whole front-matter section, delimiter lines included.
     */
    public SourceSpan span() {
        return span;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Metadata other && entries.equals(other.entries) && span.equals(other.span);
    }

    @Override
    public int hashCode() {
        return entries.hashCode() * 31 + span.hashCode();
    }

    @Override
    public String toString() {
        return "Metadata" + entries;
    }
}
