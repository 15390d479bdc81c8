package org.pragmatica.litedoc.tree;

import java.util.List;

/**
 * Typed front-matter value.
 */
public sealed interface MetaValue {

    /**
     * The value as a plain Java object: {@link String}, {@link Long}, {@link Double},
     * {@link Boolean} or {@link List} of those.
     */
    Object unwrap();

    static MetaValue of(String value) {
        return new Str(value);
    }

    static MetaValue of(long value) {
        return new Int(value);
    }

    record Str(String value) implements MetaValue {
        @Override
        public Object unwrap() {
            return value;
        }
    }

    record Int(long value) implements MetaValue {
        @Override
        public Object unwrap() {
            return value;
        }
    }

    record Float(double value) implements MetaValue {
        @Override
        public Object unwrap() {
            return value;
        }
    }

    record Bool(boolean value) implements MetaValue {
        @Override
        public Object unwrap() {
            return value;
        }
    }

    record Seq(List<MetaValue> items) implements MetaValue {
        public Seq {
            items = List.copyOf(items);
        }

        @Override
        public Object unwrap() {
            return items.stream()
                        .map(MetaValue::unwrap)
                        .toList();
        }
    }
}
