package com.marketpulse.survey.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One row of a normalized table: column values plus level and cell flags
 * Values are String, Double, Boolean or null. Rows are immutable; the with* methods return copies.
 */
public final class TableRow {
    private final int sourceRowIndex;
    private final RowLevel level;
    private final Map<String, Object> values;
    private final Map<String, Set<CellFlag>> flags;

    public TableRow(int sourceRowIndex, RowLevel level, Map<String, Object> values,
            Map<String, Set<CellFlag>> flags) {
        this.sourceRowIndex = sourceRowIndex;
        this.level = level;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values != null ? values : Map.of()));
        Map<String, Set<CellFlag>> flagCopy = new LinkedHashMap<>();
        if (flags != null) {
            flags.forEach((column, set) -> {
                if (set != null && !set.isEmpty()) {
                    flagCopy.put(column, Collections.unmodifiableSet(EnumSet.copyOf(set)));
                }
            });
        }
        this.flags = Collections.unmodifiableMap(flagCopy);
    }

    // Flat row without hierarchy or flags
    public TableRow(int sourceRowIndex, Map<String, Object> values) {
        this(sourceRowIndex, null, values, Map.of());
    }

    public int getSourceRowIndex() {
        return sourceRowIndex;
    }

    /**
     * Hierarchy level, or null for rows of a flat table
     */
    public RowLevel getLevel() {
        return level;
    }

    public boolean hasLevel() {
        return level != null;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean isMissing(String column) {
        return values.get(column) == null;
    }

    public Double getNumber(String column) {
        Object value = values.get(column);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return null;
    }

    public String getText(String column) {
        Object value = values.get(column);
        return value != null ? value.toString() : null;
    }

    public Map<String, Set<CellFlag>> getFlags() {
        return flags;
    }

    public Set<CellFlag> getFlags(String column) {
        return flags.getOrDefault(column, Set.of());
    }

    public boolean hasFlag(String column, CellFlag flag) {
        return getFlags(column).contains(flag);
    }

    public TableRow withValue(String column, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(column, value);
        return new TableRow(sourceRowIndex, level, copy, flags);
    }

    public TableRow withValue(String column, Object value, CellFlag addedFlag) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(column, value);
        Map<String, Set<CellFlag>> flagCopy = new LinkedHashMap<>(flags);
        EnumSet<CellFlag> columnFlags = EnumSet.noneOf(CellFlag.class);
        columnFlags.addAll(getFlags(column));
        columnFlags.add(addedFlag);
        flagCopy.put(column, columnFlags);
        return new TableRow(sourceRowIndex, level, copy, flagCopy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TableRow)) {
            return false;
        }
        TableRow other = (TableRow) o;
        return sourceRowIndex == other.sourceRowIndex && level == other.level
                && values.equals(other.values) && flags.equals(other.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceRowIndex, level, values, flags);
    }

    @Override
    public String toString() {
        return String.format("TableRow{source=%d, level=%s, values=%s}", sourceRowIndex, level, values);
    }
}
