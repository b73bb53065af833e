package com.questrail.statechart.runtime;

import com.questrail.statechart.model.FieldDecl;
import com.questrail.statechart.model.FieldType;
import com.questrail.statechart.model.Machine;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Context
 * -----------------------------------------------------------------------------
 * Typed per-instance variables, stored in one {@code long} per declared field.
 *
 * <h2>Encoding</h2>
 * <ul>
 *   <li>bool: 0 or 1</li>
 *   <li>integer range: the value itself</li>
 *   <li>enumeration: the variant ordinal</li>
 * </ul>
 * Every field starts at zero when zero is in its domain, else at its minimum.
 * Writes outside the declared domain are rejected with
 * {@link IllegalArgumentException}.
 */
public final class Context
{
    private final List<FieldDecl> fields;
    private final Machine machine;
    private final long[] values;

    Context(Machine machine) {
        this.machine = Objects.requireNonNull(machine, "machine");
        this.fields = machine.contextFields();
        this.values = new long[fields.size()];
        for (FieldDecl f : fields) {
            FieldType t = f.type();
            values[f.index()] = t.contains(0) ? 0 : t.min();
        }
    }

    public int size() {
        return values.length;
    }

    public long get(int index) {
        return values[index];
    }

    public long get(String fieldName) {
        return values[field(fieldName).index()];
    }

    public boolean getBoolean(String fieldName) {
        return get(fieldName) != 0;
    }

    /** Variant name of an enumeration field. */
    public String getVariant(String fieldName) {
        FieldDecl f = field(fieldName);
        if (!(f.type() instanceof FieldType.Enumeration e)) {
            throw new IllegalArgumentException(fieldName + " is not an enumeration");
        }
        return e.variants().get((int) values[f.index()]);
    }

    public void set(int index, long value) {
        FieldDecl f = fields.get(index);
        if (!f.type().contains(value)) {
            throw new IllegalArgumentException(
                    "Value " + value + " outside " + f.type() + " of context field " + f.name());
        }
        values[index] = value;
    }

    public void set(String fieldName, long value) {
        set(field(fieldName).index(), value);
    }

    public void setBoolean(String fieldName, boolean value) {
        set(fieldName, value ? 1 : 0);
    }

    public void setVariant(String fieldName, String variant) {
        FieldDecl f = field(fieldName);
        if (!(f.type() instanceof FieldType.Enumeration e)) {
            throw new IllegalArgumentException(fieldName + " is not an enumeration");
        }
        int ordinal = e.ordinalOf(variant);
        if (ordinal < 0) {
            throw new IllegalArgumentException("Unknown variant '" + variant + "' of " + e);
        }
        values[f.index()] = ordinal;
    }

    /** Whether {@code value} lies in the domain of field {@code index}. */
    boolean accepts(int index, long value) {
        return fields.get(index).type().contains(value);
    }

    FieldDecl decl(int index) {
        return fields.get(index);
    }

    public long[] snapshot() {
        return values.clone();
    }

    private FieldDecl field(String fieldName) {
        return machine.findContextField(fieldName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown context field: " + fieldName));
    }

    @Override
    public String toString() {
        return "Context" + Arrays.toString(values);
    }
}
