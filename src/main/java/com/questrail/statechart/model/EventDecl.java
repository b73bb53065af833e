package com.questrail.statechart.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declaration of an event type with its ordered, typed payload fields.
 */
public final class EventDecl
{
    private final String name;
    private final int index;
    private final List<FieldDecl> fields;

    EventDecl(String name, int index, List<FieldDecl> fields) {
        this.name = Objects.requireNonNull(name, "name");
        this.index = index;
        this.fields = List.copyOf(fields);
    }

    public String name() {
        return name;
    }

    /** Dense handle of this event within its machine. */
    public int index() {
        return index;
    }

    public List<FieldDecl> fields() {
        return fields;
    }

    public int width() {
        return fields.size();
    }

    public Optional<FieldDecl> field(String fieldName) {
        for (FieldDecl f : fields) {
            if (f.name().equals(fieldName)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return name + fields.stream().map(f -> f.name() + ":" + f.type()).toList();
    }
}
