package com.marketpulse.survey.model;

import java.util.Objects;

/**
 * A single quality finding, located by table row and column
 * A row index of -1 marks a column-wide finding; a null column marks a row-wide one
 */
public final class QualityIssue {
    private final IssueKind kind;
    private final int rowIndex;
    private final String column;
    private final Severity severity;
    private final String message;

    public QualityIssue(IssueKind kind, int rowIndex, String column, Severity severity, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.rowIndex = rowIndex;
        this.column = column;
        this.severity = severity != null ? severity : Severity.WARNING;
        this.message = message != null ? message : "";
    }

    public IssueKind getKind() {
        return kind;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    public String getColumn() {
        return column;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public boolean hasColumn() {
        return column != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QualityIssue)) {
            return false;
        }
        QualityIssue other = (QualityIssue) o;
        return kind == other.kind && rowIndex == other.rowIndex && Objects.equals(column, other.column)
                && severity == other.severity && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, rowIndex, column, severity, message);
    }

    @Override
    public String toString() {
        return String.format("QualityIssue{kind=%s, row=%d, column=%s, severity=%s, message='%s'}",
                kind, rowIndex, column, severity, message);
    }
}
