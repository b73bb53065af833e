package com.questrail.statechart.model;

import java.util.List;

/**
 * Static factory for actions and value expressions. Names are resolved by
 * {@link MachineBuilder#build()}.
 */
public final class Actions
{
    private Actions() {
    }

    public static Action call(String extern) {
        return new Action.Call(extern, -1);
    }

    public static Action raise(String event, ValueExpr... args) {
        return new Action.Raise(event, -1, List.of(args));
    }

    public static Action send(String machine, String event, ValueExpr... args) {
        return new Action.Send(machine, event, List.of(args));
    }

    public static Action defer(String event) {
        return new Action.Defer(event, -1);
    }

    public static Action assign(FieldRef target, ValueExpr value) {
        return new Action.Assign(target, value);
    }

    public static Action assign(FieldRef target, long value) {
        return new Action.Assign(target, new ValueExpr.Const(value));
    }

    // ---------------------------------------------------------------------
    // Value expressions
    // ---------------------------------------------------------------------

    public static ValueExpr value(long constant) {
        return new ValueExpr.Const(constant);
    }

    public static ValueExpr value(FieldRef field) {
        return new ValueExpr.Ref(field);
    }

    public static ValueExpr add(ValueExpr left, ValueExpr right) {
        return new ValueExpr.Binary(ValueExpr.ArithOp.ADD, left, right);
    }

    public static ValueExpr sub(ValueExpr left, ValueExpr right) {
        return new ValueExpr.Binary(ValueExpr.ArithOp.SUB, left, right);
    }

    public static ValueExpr mul(ValueExpr left, ValueExpr right) {
        return new ValueExpr.Binary(ValueExpr.ArithOp.MUL, left, right);
    }

    public static ValueExpr div(ValueExpr left, ValueExpr right) {
        return new ValueExpr.Binary(ValueExpr.ArithOp.DIV, left, right);
    }

    public static ValueExpr mod(ValueExpr left, ValueExpr right) {
        return new ValueExpr.Binary(ValueExpr.ArithOp.MOD, left, right);
    }
}
