package com.questrail.statechart.model;

import java.util.Objects;

/**
 * Value expression used by inline assignments and by event arguments of
 * {@code raise} / {@code send}. Never part of a guard.
 */
public sealed interface ValueExpr
        permits ValueExpr.Const, ValueExpr.Ref, ValueExpr.Binary
{
    enum ArithOp {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%");

        private final String symbol;

        ArithOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * Applies the operator. Division and remainder by zero raise
         * {@link ArithmeticException}.
         */
        public long apply(long left, long right) {
            return switch (this) {
                case ADD -> Math.addExact(left, right);
                case SUB -> Math.subtractExact(left, right);
                case MUL -> Math.multiplyExact(left, right);
                case DIV -> left / right;
                case MOD -> left % right;
            };
        }
    }

    record Const(long value) implements ValueExpr {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record Ref(FieldRef field) implements ValueExpr {
        public Ref {
            Objects.requireNonNull(field, "field");
        }

        @Override
        public String toString() {
            return field.toString();
        }
    }

    record Binary(ArithOp op, ValueExpr left, ValueExpr right) implements ValueExpr {
        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "(" + left + " " + op.symbol() + " " + right + ")";
        }
    }

    /** Whether this expression uses arithmetic (as opposed to a plain constant or reference). */
    default boolean isArithmetic() {
        return this instanceof Binary;
    }
}
