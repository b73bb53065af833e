package com.questrail.statechart.model;

import java.util.Objects;

/**
 * Guard
 * -----------------------------------------------------------------------------
 * Side-effect-free boolean condition attached to a transition.
 *
 * <h2>Grammar</h2>
 * <pre>
 *   guard := constant
 *          | extern-pure-reference
 *          | !guard
 *          | field (== | != | &lt; | &lt;= | &gt; | &gt;=) literal
 *          | guard &amp;&amp; guard
 *          | guard || guard
 * </pre>
 * Parenthesized grouping is expressed by the shape of the tree.
 *
 * <h2>Why so small</h2>
 * The grammar deliberately admits no arithmetic and no side effects so that
 * pairwise disjointness of guards can be decided statically over the declared
 * field domains. Extern references are opaque: the analyzer only knows that a
 * reference equals itself and contradicts its own negation.
 */
public sealed interface Guard
        permits Guard.Constant, Guard.ExternRef, Guard.Not, Guard.Compare, Guard.And, Guard.Or
{
    Guard TRUE = new Constant(true);
    Guard FALSE = new Constant(false);

    /** Absent guard or literal {@code true}/{@code false}. */
    record Constant(boolean value) implements Guard {
        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /**
     * Reference to an externally supplied pure predicate.
     *
     * @param name extern name; the identity used by the analyzer
     * @param slot dense slot in the machine's extern guard table, {@code -1} while unresolved
     */
    record ExternRef(String name, int slot) implements Guard {
        public ExternRef {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name + "()";
        }
    }

    record Not(Guard operand) implements Guard {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public String toString() {
            return "!(" + operand + ")";
        }
    }

    record Compare(FieldRef field, CompareOp op, Literal literal) implements Guard {
        public Compare {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(literal, "literal");
        }

        @Override
        public String toString() {
            return field + " " + op.symbol() + " " + literal;
        }
    }

    record And(Guard left, Guard right) implements Guard {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "(" + left + " && " + right + ")";
        }
    }

    record Or(Guard left, Guard right) implements Guard {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public String toString() {
            return "(" + left + " || " + right + ")";
        }
    }

    /** True for the absent guard (and for a literal {@code true}). */
    default boolean isTrivial() {
        return this instanceof Constant c && c.value();
    }
}
