package com.di.silverline.warehouse;

/**
 * A column as the warehouse reports it. {@code type} is the GoogleSQL standard type name
 * (e.g. {@code STRING}, {@code TIMESTAMP}, {@code DATE}).
 */
public record ColumnSpec(String name, String type, boolean required) {

    public static ColumnSpec nullable(String name, String type) {
        return new ColumnSpec(name, type, false);
    }

    /** Type comparison used for schema unification; nullability is not part of it. */
    public boolean sameTypeAs(ColumnSpec other) {
        return other != null && type != null && type.equalsIgnoreCase(other.type);
    }
}
