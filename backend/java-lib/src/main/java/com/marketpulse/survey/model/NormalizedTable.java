package com.marketpulse.survey.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable table produced by assembly or cleaning
 * Rows keep source order. Cleaning never edits a table in place; it builds a new one via
 * {@link #withRows(List)} or {@link #withColumns(List, List)}.
 */
public final class NormalizedTable {
    private final String name;
    private final List<ColumnSpec> columns;
    private final List<TableRow> rows;
    private final List<QualityIssue> issues;

    public NormalizedTable(String name, List<ColumnSpec> columns, List<TableRow> rows, List<QualityIssue> issues) {
        this.name = name != null ? name : "";
        this.columns = List.copyOf(columns != null ? columns : List.of());
        this.rows = List.copyOf(rows != null ? rows : List.of());
        this.issues = List.copyOf(issues != null ? issues : List.of());

        Map<String, ColumnSpec> byName = new LinkedHashMap<>();
        for (ColumnSpec column : this.columns) {
            if (byName.put(column.getName(), column) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column.getName());
            }
        }
        for (TableRow row : this.rows) {
            for (String key : row.getValues().keySet()) {
                if (!byName.containsKey(key)) {
                    throw new IllegalArgumentException(
                            String.format("Row %d has a value for unknown column '%s'", row.getSourceRowIndex(), key));
                }
            }
        }
    }

    public NormalizedTable(String name, List<ColumnSpec> columns, List<TableRow> rows) {
        this(name, columns, rows, List.of());
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<ColumnSpec> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        return columns.stream().map(ColumnSpec::getName).collect(Collectors.toList());
    }

    public ColumnSpec findColumn(String columnName) {
        for (ColumnSpec column : columns) {
            if (column.getName().equals(columnName)) {
                return column;
            }
        }
        return null;
    }

    public boolean hasColumn(String columnName) {
        return findColumn(columnName) != null;
    }

    public List<ColumnSpec> getNumericColumns() {
        return columns.stream().filter(ColumnSpec::isNumeric).collect(Collectors.toList());
    }

    /**
     * Columns explicitly marked as row identifiers; labels repeat across sections and never count
     */
    public List<String> getIdentifierColumns() {
        return namesWithRole(ColumnRole.IDENTIFIER);
    }

    private List<String> namesWithRole(ColumnRole role) {
        return columns.stream()
                .filter(c -> c.getRole() == role)
                .map(ColumnSpec::getName)
                .collect(Collectors.toList());
    }

    public List<TableRow> getRows() {
        return rows;
    }

    public TableRow getRow(int index) {
        return rows.get(index);
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<QualityIssue> getIssues() {
        return issues;
    }

    public List<QualityIssue> getIssues(IssueKind kind) {
        return issues.stream().filter(i -> i.getKind() == kind).collect(Collectors.toList());
    }

    /**
     * Rows of one hierarchy level, in source order
     */
    public List<TableRow> rowsByLevel(RowLevel level) {
        return rows.stream().filter(r -> r.getLevel() == level).collect(Collectors.toList());
    }

    /**
     * Sums a numeric column over the rows of a single level
     * Summing one level at a time keeps section totals from being added to their own descendants.
     */
    public double sumByLevel(String columnName, RowLevel level) {
        requireColumn(columnName);
        double sum = 0.0;
        for (TableRow row : rowsByLevel(level)) {
            Double value = row.getNumber(columnName);
            if (value != null) {
                sum += value;
            }
        }
        return sum;
    }

    public List<Object> columnValues(String columnName) {
        requireColumn(columnName);
        List<Object> values = new ArrayList<>(rows.size());
        for (TableRow row : rows) {
            values.add(row.get(columnName));
        }
        return values;
    }

    /**
     * Non-missing numeric values of a column, in row order
     */
    public List<Double> numericValues(String columnName) {
        requireColumn(columnName);
        List<Double> values = new ArrayList<>(rows.size());
        for (TableRow row : rows) {
            Double value = row.getNumber(columnName);
            if (value != null && !value.isNaN()) {
                values.add(value);
            }
        }
        return values;
    }

    public NormalizedTable withRows(List<TableRow> newRows) {
        return new NormalizedTable(name, columns, newRows, issues);
    }

    public NormalizedTable withColumns(List<ColumnSpec> newColumns, List<TableRow> newRows) {
        return new NormalizedTable(name, newColumns, newRows, issues);
    }

    public NormalizedTable withIssues(List<QualityIssue> newIssues) {
        return new NormalizedTable(name, columns, rows, newIssues);
    }

    private void requireColumn(String columnName) {
        if (!hasColumn(columnName)) {
            throw new IllegalArgumentException("Unknown column: " + columnName);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NormalizedTable)) {
            return false;
        }
        NormalizedTable other = (NormalizedTable) o;
        return name.equals(other.name) && columns.equals(other.columns) && rows.equals(other.rows)
                && issues.equals(other.issues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, columns, rows, issues);
    }

    @Override
    public String toString() {
        return String.format("NormalizedTable{name='%s', rows=%d, columns=%d, issues=%d}",
                name, rows.size(), columns.size(), issues.size());
    }

    /**
     * Builds flat tables row by row, mainly for callers that bring their own records
     */
    public static final class Builder {
        private final String name;
        private final List<ColumnSpec> columns = new ArrayList<>();
        private final List<TableRow> rows = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder column(ColumnSpec column) {
            columns.add(column);
            return this;
        }

        /**
         * Adds a row whose values follow the declared column order
         */
        public Builder row(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException(
                        String.format("Expected %d values but got %d", columns.size(), values.length));
            }
            Map<String, Object> rowValues = new LinkedHashMap<>();
            for (int i = 0; i < values.length; i++) {
                Object value = values[i];
                if (value instanceof Number && !(value instanceof Double)) {
                    value = ((Number) value).doubleValue();
                }
                rowValues.put(columns.get(i).getName(), value);
            }
            rows.add(new TableRow(rows.size(), rowValues));
            return this;
        }

        public NormalizedTable build() {
            return new NormalizedTable(name, Collections.unmodifiableList(columns), rows);
        }
    }
}
