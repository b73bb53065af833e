package com.questrail.statechart.model;

/**
 * Comparison operators permitted between a field and a literal.
 */
public enum CompareOp
{
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    private final String symbol;

    CompareOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** Equality operators are the only ones legal on booleans and enumerations. */
    public boolean isEquality() {
        return this == EQ || this == NE;
    }

    /** Logical complement: {@code !(a op b) == (a op.negate() b)}. */
    public CompareOp negate() {
        return switch (this) {
            case EQ -> NE;
            case NE -> EQ;
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
        };
    }

    public boolean test(long left, long right) {
        return switch (this) {
            case EQ -> left == right;
            case NE -> left != right;
            case LT -> left < right;
            case LE -> left <= right;
            case GT -> left > right;
            case GE -> left >= right;
        };
    }
}
