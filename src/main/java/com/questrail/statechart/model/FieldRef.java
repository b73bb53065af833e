package com.questrail.statechart.model;

import java.util.Objects;

/**
 * Reference to a context field or to a field of the triggering event's payload.
 *
 * <p>
 * References are created by name (see {@link Guards#ctx(String)} and
 * {@link Guards#payload(String)}) and resolved to an index and a type by
 * {@link MachineBuilder#build()}. Runtime evaluation only ever uses the index.
 * </p>
 *
 * @param scope where the field lives
 * @param name  declared field name
 * @param index resolved position, {@code -1} while unresolved
 * @param type  resolved domain, {@code null} while unresolved
 */
public record FieldRef(Scope scope, String name, int index, FieldType type)
{
    public enum Scope {
        CONTEXT,
        PAYLOAD
    }

    public FieldRef {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(name, "name");
    }

    public boolean resolved() {
        return index >= 0 && type != null;
    }

    FieldRef resolve(FieldDecl decl) {
        return new FieldRef(scope, name, decl.index(), decl.type());
    }

    @Override
    public String toString() {
        return (scope == Scope.CONTEXT ? "ctx." : "evt.") + name;
    }
}
