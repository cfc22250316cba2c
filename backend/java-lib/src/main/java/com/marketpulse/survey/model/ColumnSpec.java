package com.marketpulse.survey.model;

import java.util.Objects;

public final class ColumnSpec {
    private final String name;
    private final ColumnType type;
    private final ColumnRole role;

    public ColumnSpec(String name, ColumnType type, ColumnRole role) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be blank");
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        this.role = Objects.requireNonNull(role, "role");
    }

    public static ColumnSpec label(String name) {
        return new ColumnSpec(name, ColumnType.TEXT, ColumnRole.LABEL);
    }

    public static ColumnSpec measure(String name) {
        return new ColumnSpec(name, ColumnType.NUMERIC, ColumnRole.MEASURE);
    }

    public static ColumnSpec total(String name) {
        return new ColumnSpec(name, ColumnType.NUMERIC, ColumnRole.TOTAL);
    }

    public static ColumnSpec text(String name) {
        return new ColumnSpec(name, ColumnType.TEXT, ColumnRole.ATTRIBUTE);
    }

    public static ColumnSpec identifier(String name, ColumnType type) {
        return new ColumnSpec(name, type, ColumnRole.IDENTIFIER);
    }

    public static ColumnSpec flag(String name) {
        return new ColumnSpec(name, ColumnType.BOOLEAN, ColumnRole.FLAG);
    }

    public String getName() {
        return name;
    }

    public ColumnType getType() {
        return type;
    }

    public ColumnRole getRole() {
        return role;
    }

    public boolean isNumeric() {
        return type == ColumnType.NUMERIC;
    }

    public boolean isText() {
        return type == ColumnType.TEXT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnSpec)) {
            return false;
        }
        ColumnSpec other = (ColumnSpec) o;
        return name.equals(other.name) && type == other.type && role == other.role;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, role);
    }

    @Override
    public String toString() {
        return String.format("ColumnSpec{name='%s', type=%s, role=%s}", name, type, role);
    }
}
