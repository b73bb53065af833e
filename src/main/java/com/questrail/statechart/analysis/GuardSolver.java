package com.questrail.statechart.analysis;

import com.questrail.statechart.model.CompareOp;
import com.questrail.statechart.model.FieldRef;
import com.questrail.statechart.model.FieldType;
import com.questrail.statechart.model.Guard;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * GuardSolver
 * -----------------------------------------------------------------------------
 * Decides satisfiability of guard expressions over the declared field domains.
 *
 * <h2>Method</h2>
 * <ol>
 *   <li>The guard is put into negation normal form; negated comparisons are
 *       rewritten with the complementary operator.</li>
 *   <li>The result is expanded into disjunctive normal form.</li>
 *   <li>Each conjunction is satisfiable iff, for every field it constrains,
 *       the intersection of the permitted {@link DomainSet}s is non-empty and
 *       no extern atom occurs with both polarities.</li>
 * </ol>
 *
 * <h2>Externs</h2>
 * Extern predicates are opaque atoms identified by name. Two references are
 * related only when they are the same atom or its exact negation; anything
 * else is assumed to be independently true or false.
 *
 * <h2>Complexity bound</h2>
 * DNF expansion is capped at {@link #MAX_TERMS} conjunctions. Past the cap
 * {@link TooComplexException} is thrown and the caller must treat the
 * question as unprovable.
 */
public final class GuardSolver
{
    public static final int MAX_TERMS = 4096;

    /** DNF expansion exceeded {@link #MAX_TERMS}. */
    public static final class TooComplexException extends RuntimeException
    {
        TooComplexException(String message) {
            super(message);
        }
    }

    /** Atom of a normalized guard: one comparison or one (possibly negated) extern. */
    private sealed interface Atom permits FieldAtom, ExternAtom {}

    private record FieldAtom(FieldRef.Scope scope, int index, FieldType type, CompareOp op, long literal)
            implements Atom {}

    private record ExternAtom(String name, boolean positive) implements Atom {}

    private record FieldKey(FieldRef.Scope scope, int index) {}

    /** {@code sat(g)}: some assignment of fields and externs makes the guard true. */
    public boolean satisfiable(Guard guard) {
        Objects.requireNonNull(guard, "guard");
        for (List<Atom> term : dnf(guard, false)) {
            if (termSatisfiable(term)) {
                return true;
            }
        }
        return false;
    }

    /** No assignment makes the guard true. */
    public boolean contradiction(Guard guard) {
        return !satisfiable(guard);
    }

    /** Every assignment makes the guard true. */
    public boolean tautology(Guard guard) {
        return !satisfiable(new Guard.Not(guard));
    }

    /** No assignment makes both guards true. */
    public boolean disjoint(Guard a, Guard b) {
        return !satisfiable(new Guard.And(a, b));
    }

    // ---------------------------------------------------------------------
    // Normalization
    // ---------------------------------------------------------------------

    /**
     * Expands {@code guard} (negated when {@code negate}) into a list of
     * conjunctions. An empty list is {@code false}; a list holding one empty
     * conjunction is {@code true}.
     */
    private List<List<Atom>> dnf(Guard guard, boolean negate) {
        if (guard instanceof Guard.Constant c) {
            return (c.value() != negate) ? List.of(List.of()) : List.of();
        }
        if (guard instanceof Guard.ExternRef e) {
            return List.of(List.of(new ExternAtom(e.name(), !negate)));
        }
        if (guard instanceof Guard.Not n) {
            return dnf(n.operand(), !negate);
        }
        if (guard instanceof Guard.Compare c) {
            FieldRef f = c.field();
            CompareOp op = negate ? c.op().negate() : c.op();
            FieldType type = f.type();
            if (type == null) {
                throw new IllegalStateException("Unresolved field reference: " + f);
            }
            return List.of(List.of(new FieldAtom(f.scope(), f.index(), type, op, c.literal().encoded())));
        }
        Guard left;
        Guard right;
        boolean conjunction;
        if (guard instanceof Guard.And a) {
            left = a.left();
            right = a.right();
            conjunction = !negate;
        } else {
            Guard.Or o = (Guard.Or) guard;
            left = o.left();
            right = o.right();
            conjunction = negate;
        }
        List<List<Atom>> l = dnf(left, negate);
        List<List<Atom>> r = dnf(right, negate);
        if (!conjunction) {
            return bounded(concat(l, r));
        }
        if ((long) l.size() * r.size() > MAX_TERMS) {
            throw new TooComplexException("Guard expands to more than " + MAX_TERMS + " terms: " + guard);
        }
        List<List<Atom>> product = new ArrayList<>(l.size() * r.size());
        for (List<Atom> x : l) {
            for (List<Atom> y : r) {
                List<Atom> term = concat(x, y);
                // prune contradictory terms early to keep the product small
                if (termSatisfiable(term)) {
                    product.add(term);
                }
            }
        }
        return product;
    }

    private static List<List<Atom>> bounded(List<List<Atom>> terms) {
        if (terms.size() > MAX_TERMS) {
            throw new TooComplexException("Guard expands to more than " + MAX_TERMS + " terms");
        }
        return terms;
    }

    private static <T> List<T> concat(List<T> a, List<T> b) {
        List<T> out = new ArrayList<>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return out;
    }

    // ---------------------------------------------------------------------
    // Conjunction satisfiability
    // ---------------------------------------------------------------------

    private static boolean termSatisfiable(List<Atom> term) {
        Map<FieldKey, DomainSet> domains = new HashMap<>();
        Map<String, Boolean> externs = new HashMap<>();
        for (Atom atom : term) {
            if (atom instanceof ExternAtom e) {
                Boolean prev = externs.putIfAbsent(e.name(), e.positive());
                if (prev != null && prev != e.positive()) {
                    return false;
                }
                continue;
            }
            FieldAtom f = (FieldAtom) atom;
            FieldKey key = new FieldKey(f.scope(), f.index());
            DomainSet current = domains.get(key);
            if (current == null) {
                current = DomainSet.range(f.type().min(), f.type().max());
            }
            DomainSet narrowed = current.intersect(DomainSet.of(f.type().min(), f.type().max(), f.op(), f.literal()));
            if (narrowed.isEmpty()) {
                return false;
            }
            domains.put(key, narrowed);
        }
        return true;
    }
}
