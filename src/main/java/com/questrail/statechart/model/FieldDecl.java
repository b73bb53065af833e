package com.questrail.statechart.model;

import java.util.Objects;

/**
 * Declaration of a typed field: either a context field or an event payload field.
 *
 * @param name  field name, unique within its owner
 * @param type  declared domain
 * @param index 0-based position within its owner; {@code -1} before the
 *              owning event or machine has been assembled
 */
public record FieldDecl(String name, FieldType type, int index)
{
    public FieldDecl {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static FieldDecl of(String name, FieldType type) {
        return new FieldDecl(name, type, -1);
    }

    FieldDecl at(int position) {
        return new FieldDecl(name, type, position);
    }
}
