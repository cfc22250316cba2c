package com.marketpulse.survey.quality;

import java.util.Objects;

/**
 * One audit-log entry of the cleaning pipeline
 * A null column means the action applied to whole rows rather than one column.
 */
public final class CleaningAction {
    private final ActionKind kind;
    private final String column;
    private final int affectedRowCount;
    private final String strategyUsed;
    private final String detail;

    public CleaningAction(ActionKind kind, String column, int affectedRowCount, String strategyUsed, String detail) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.column = column;
        this.affectedRowCount = affectedRowCount;
        this.strategyUsed = strategyUsed != null ? strategyUsed : "";
        this.detail = detail != null ? detail : "";
    }

    public ActionKind getKind() {
        return kind;
    }

    public String getColumn() {
        return column;
    }

    public int getAffectedRowCount() {
        return affectedRowCount;
    }

    public String getStrategyUsed() {
        return strategyUsed;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CleaningAction)) {
            return false;
        }
        CleaningAction other = (CleaningAction) o;
        return kind == other.kind && affectedRowCount == other.affectedRowCount
                && Objects.equals(column, other.column) && strategyUsed.equals(other.strategyUsed)
                && detail.equals(other.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, column, affectedRowCount, strategyUsed, detail);
    }

    @Override
    public String toString() {
        return String.format("CleaningAction{kind=%s, column=%s, rows=%d, strategy=%s, detail='%s'}",
                kind, column, affectedRowCount, strategyUsed, detail);
    }
}
