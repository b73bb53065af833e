package com.questrail.statechart.model;

import java.util.Objects;

/**
 * Literal operand of a guard comparison.
 *
 * Enumeration literals are resolved to an ordinal by the builder; an unresolved
 * ordinal ({@code -1}) is left in place for the analyzer to report as a type
 * mismatch rather than failing the build.
 */
public sealed interface Literal
        permits Literal.IntLiteral, Literal.BoolLiteral, Literal.EnumLiteral
{
    /** Value in the runtime {@code long} encoding. */
    long encoded();

    record IntLiteral(long value) implements Literal {
        @Override
        public long encoded() {
            return value;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record BoolLiteral(boolean value) implements Literal {
        @Override
        public long encoded() {
            return value ? 1 : 0;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record EnumLiteral(String variant, int ordinal) implements Literal {
        public EnumLiteral {
            Objects.requireNonNull(variant, "variant");
        }

        public boolean resolved() {
            return ordinal >= 0;
        }

        @Override
        public long encoded() {
            return ordinal;
        }

        @Override
        public String toString() {
            return variant;
        }
    }
}
