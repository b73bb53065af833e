package com.questrail.statechart.analysis;

import com.questrail.statechart.model.CompareOp;
import com.questrail.statechart.model.FieldRef;
import com.questrail.statechart.model.FieldType;
import com.questrail.statechart.model.Guard;
import com.questrail.statechart.model.Guards;
import com.questrail.statechart.model.Literal;
import org.junit.jupiter.api.Test;

import static com.questrail.statechart.model.Guards.and;
import static com.questrail.statechart.model.Guards.eq;
import static com.questrail.statechart.model.Guards.extern;
import static com.questrail.statechart.model.Guards.ge;
import static com.questrail.statechart.model.Guards.gt;
import static com.questrail.statechart.model.Guards.isFalse;
import static com.questrail.statechart.model.Guards.isTrue;
import static com.questrail.statechart.model.Guards.le;
import static com.questrail.statechart.model.Guards.lt;
import static com.questrail.statechart.model.Guards.ne;
import static com.questrail.statechart.model.Guards.not;
import static com.questrail.statechart.model.Guards.or;
import static org.junit.jupiter.api.Assertions.*;

/**
 * GuardSolverTests
 * -----------------------------------------------------------------------------
 * Field references are built pre-resolved; the solver never looks names up.
 */
class GuardSolverTests
{
    private static final FieldRef X = new FieldRef(FieldRef.Scope.CONTEXT, "x", 0, FieldType.range(0, 10));
    private static final FieldRef Y = new FieldRef(FieldRef.Scope.CONTEXT, "y", 1, FieldType.range(-5, 5));
    private static final FieldRef ARMED = new FieldRef(FieldRef.Scope.CONTEXT, "armed", 2, FieldType.bool());
    private static final FieldRef MODE = new FieldRef(FieldRef.Scope.CONTEXT, "mode", 3,
            FieldType.enumeration("Mode", "OFF", "AUTO", "MANUAL"));
    private static final FieldRef EVT_X = new FieldRef(FieldRef.Scope.PAYLOAD, "x", 0, FieldType.range(0, 10));

    private final GuardSolver solver = new GuardSolver();

    private static Guard mode(CompareOp op, String variant, int ordinal) {
        return Guards.compare(MODE, op, new Literal.EnumLiteral(variant, ordinal));
    }

    // ---------------------------------------------------------------------
    // Constants and single comparisons
    // ---------------------------------------------------------------------

    @Test
    void constants() {
        assertTrue(solver.tautology(Guard.TRUE));
        assertTrue(solver.contradiction(Guard.FALSE));
        assertTrue(solver.disjoint(Guard.TRUE, Guard.FALSE));
        assertFalse(solver.disjoint(Guard.TRUE, Guard.TRUE));
    }

    @Test
    void comparisonsAreJudgedAgainstTheFieldDomain() {
        assertTrue(solver.satisfiable(gt(X, 5)));
        assertFalse(solver.tautology(gt(X, 5)));
        assertTrue(solver.contradiction(gt(X, 10)));
        assertTrue(solver.tautology(ge(X, 0)));
        assertTrue(solver.tautology(le(Y, 5)));
        assertTrue(solver.contradiction(lt(Y, -5)));
    }

    // ---------------------------------------------------------------------
    // Connectives
    // ---------------------------------------------------------------------

    @Test
    void conjunctionNarrowsOneField() {
        assertTrue(solver.contradiction(and(gt(X, 5), lt(X, 3))));
        assertTrue(solver.satisfiable(and(gt(X, 5), lt(X, 7))));
        assertTrue(solver.contradiction(and(gt(X, 5), lt(X, 7), ne(X, 6))));
        assertTrue(solver.contradiction(and(eq(X, 4), not(eq(X, 4)))));
    }

    @Test
    void disjunctionCoveringTheDomainIsATautology() {
        assertTrue(solver.tautology(or(le(X, 5), gt(X, 5))));
        assertFalse(solver.tautology(or(lt(X, 5), gt(X, 5))));
        assertTrue(solver.tautology(or(lt(X, 5), eq(X, 5), gt(X, 5))));
        assertTrue(solver.tautology(or(isTrue(ARMED), isFalse(ARMED))));
    }

    @Test
    void distinctFieldsAreIndependent() {
        assertTrue(solver.satisfiable(and(gt(X, 9), lt(Y, -4))));
        assertFalse(solver.disjoint(gt(X, 5), lt(Y, 0)));
    }

    @Test
    void contextAndPayloadFieldsWithTheSameIndexAreDistinct() {
        assertTrue(solver.satisfiable(and(gt(X, 5), lt(EVT_X, 3))));
    }

    @Test
    void disjointness() {
        assertTrue(solver.disjoint(lt(X, 5), ge(X, 5)));
        assertFalse(solver.disjoint(lt(X, 6), gt(X, 4)));
        assertTrue(solver.disjoint(isTrue(ARMED), isFalse(ARMED)));
        assertTrue(solver.disjoint(and(isTrue(ARMED), gt(X, 3)), or(isFalse(ARMED), lt(X, 2))));
    }

    // ---------------------------------------------------------------------
    // Enumerations and externs
    // ---------------------------------------------------------------------

    @Test
    void enumerationVariantsPartitionTheDomain() {
        Guard offOrAuto = or(mode(CompareOp.EQ, "OFF", 0), mode(CompareOp.EQ, "AUTO", 1));

        assertFalse(solver.tautology(offOrAuto));
        assertTrue(solver.tautology(or(offOrAuto, mode(CompareOp.EQ, "MANUAL", 2))));
        assertTrue(solver.disjoint(mode(CompareOp.EQ, "AUTO", 1), mode(CompareOp.NE, "AUTO", 1)));
    }

    @Test
    void externsAreOpaqueButConsistent() {
        Guard ready = extern("ready");

        assertTrue(solver.satisfiable(ready));
        assertFalse(solver.tautology(ready));
        assertTrue(solver.contradiction(and(ready, not(ready))));
        assertTrue(solver.tautology(or(ready, not(ready))));
        assertFalse(solver.disjoint(ready, extern("clear")));
        assertTrue(solver.disjoint(and(ready, gt(X, 2)), not(ready)));
    }

    // ---------------------------------------------------------------------
    // Limits
    // ---------------------------------------------------------------------

    @Test
    void expansionBeyondTheTermLimitIsTooComplex() {
        Guard g = null;
        for (int i = 0; i < 13; i++) {
            FieldRef f = new FieldRef(FieldRef.Scope.CONTEXT, "f" + i, 10 + i, FieldType.range(0, 3));
            Guard pair = or(eq(f, 0), eq(f, 1));
            g = g == null ? pair : and(g, pair);
        }
        Guard wide = g;

        assertThrows(GuardSolver.TooComplexException.class, () -> solver.satisfiable(wide));
    }

    @Test
    void unresolvedFieldsAreRejected() {
        assertThrows(IllegalStateException.class, () -> solver.satisfiable(gt(Guards.ctx("x"), 1)));
    }
}
