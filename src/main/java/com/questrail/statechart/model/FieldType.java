package com.questrail.statechart.model;

import java.util.List;
import java.util.Objects;

/**
 * FieldType
 * -----------------------------------------------------------------------------
 * Declared domain of a context or payload field.
 *
 * <h2>Encoding</h2>
 * Every field value is carried as a {@code long} at runtime:
 * <ul>
 *   <li>{@link Bool}: {@code 0} (false) or {@code 1} (true)</li>
 *   <li>{@link IntRange}: the integer itself</li>
 *   <li>{@link Enumeration}: the 0-based ordinal of the variant</li>
 * </ul>
 *
 * Because every domain is a closed interval of longs, the determinism analyzer
 * can reason about all three uniformly as bounded integer domains.
 */
public sealed interface FieldType
        permits FieldType.Bool, FieldType.IntRange, FieldType.Enumeration
{
    /** Smallest encoded value in the domain. */
    long min();

    /** Largest encoded value in the domain. */
    long max();

    /** Whether ordering comparisons ({@code <}, {@code <=}, ...) are meaningful. */
    boolean ordered();

    default boolean contains(long encoded) {
        return encoded >= min() && encoded <= max();
    }

    static FieldType bool() {
        return Bool.INSTANCE;
    }

    static FieldType range(long min, long max) {
        return new IntRange(min, max);
    }

    static FieldType enumeration(String name, String... variants) {
        return new Enumeration(name, List.of(variants));
    }

    /** Two-valued boolean domain. */
    record Bool() implements FieldType {
        static final Bool INSTANCE = new Bool();

        @Override public long min() { return 0; }
        @Override public long max() { return 1; }
        @Override public boolean ordered() { return false; }

        @Override
        public String toString() {
            return "bool";
        }
    }

    /** Bounded integer range, both ends inclusive. */
    record IntRange(long min, long max) implements FieldType {
        public IntRange {
            if (min > max) {
                throw new IllegalArgumentException("empty range: " + min + ".." + max);
            }
        }

        @Override public boolean ordered() { return true; }

        @Override
        public String toString() {
            return "int[" + min + ".." + max + "]";
        }
    }

    /** Enumeration with variants encoded by declaration position. */
    record Enumeration(String name, List<String> variants) implements FieldType {
        public Enumeration {
            Objects.requireNonNull(name, "name");
            variants = List.copyOf(variants);
            if (variants.isEmpty()) {
                throw new IllegalArgumentException("enum " + name + " has no variants");
            }
            if (variants.stream().distinct().count() != variants.size()) {
                throw new IllegalArgumentException("enum " + name + " has duplicate variants");
            }
        }

        @Override public long min() { return 0; }
        @Override public long max() { return variants.size() - 1L; }
        @Override public boolean ordered() { return false; }

        /**
         * Returns the ordinal of the named variant, or {@code -1} if it does not exist.
         */
        public int ordinalOf(String variant) {
            return variants.indexOf(variant);
        }

        @Override
        public String toString() {
            return "enum " + name;
        }
    }
}
