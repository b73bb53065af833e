package com.questrail.statechart.model;

import java.util.Objects;

/**
 * Static factory for guard expressions and field references.
 *
 * <p>
 * Expressions built here refer to fields and externs by name only; they are
 * resolved against the machine's declarations by {@link MachineBuilder#build()}.
 * </p>
 *
 * <pre>
 *   and(gt(payload("speed"), 0), not(extern("overheated")))
 * </pre>
 */
public final class Guards
{
    private Guards() {
    }

    public static FieldRef ctx(String name) {
        return new FieldRef(FieldRef.Scope.CONTEXT, name, -1, null);
    }

    public static FieldRef payload(String name) {
        return new FieldRef(FieldRef.Scope.PAYLOAD, name, -1, null);
    }

    public static Guard extern(String name) {
        return new Guard.ExternRef(name, -1);
    }

    public static Guard not(Guard operand) {
        return new Guard.Not(operand);
    }

    /** Left-associated conjunction of one or more guards. */
    public static Guard and(Guard first, Guard... rest) {
        Guard g = Objects.requireNonNull(first, "first");
        for (Guard r : rest) {
            g = new Guard.And(g, r);
        }
        return g;
    }

    /** Left-associated disjunction of one or more guards. */
    public static Guard or(Guard first, Guard... rest) {
        Guard g = Objects.requireNonNull(first, "first");
        for (Guard r : rest) {
            g = new Guard.Or(g, r);
        }
        return g;
    }

    public static Guard compare(FieldRef field, CompareOp op, Literal literal) {
        return new Guard.Compare(field, op, literal);
    }

    public static Guard eq(FieldRef field, long value) {
        return compare(field, CompareOp.EQ, new Literal.IntLiteral(value));
    }

    public static Guard ne(FieldRef field, long value) {
        return compare(field, CompareOp.NE, new Literal.IntLiteral(value));
    }

    public static Guard lt(FieldRef field, long value) {
        return compare(field, CompareOp.LT, new Literal.IntLiteral(value));
    }

    public static Guard le(FieldRef field, long value) {
        return compare(field, CompareOp.LE, new Literal.IntLiteral(value));
    }

    public static Guard gt(FieldRef field, long value) {
        return compare(field, CompareOp.GT, new Literal.IntLiteral(value));
    }

    public static Guard ge(FieldRef field, long value) {
        return compare(field, CompareOp.GE, new Literal.IntLiteral(value));
    }

    public static Guard isTrue(FieldRef field) {
        return compare(field, CompareOp.EQ, new Literal.BoolLiteral(true));
    }

    public static Guard isFalse(FieldRef field) {
        return compare(field, CompareOp.EQ, new Literal.BoolLiteral(false));
    }

    /** Enumeration equality against a variant name. */
    public static Guard is(FieldRef field, String variant) {
        return compare(field, CompareOp.EQ, new Literal.EnumLiteral(variant, -1));
    }

    public static Guard isNot(FieldRef field, String variant) {
        return compare(field, CompareOp.NE, new Literal.EnumLiteral(variant, -1));
    }
}
