package com.marketpulse.survey.quality;

import com.marketpulse.survey.model.NormalizedTable;

import java.util.List;
import java.util.Locale;

/**
 * Quality of a table before and after cleaning, with the audit log in between
 */
public final class QualityReport {
    private final QualityAssessment before;
    private final QualityAssessment after;
    private final CleaningResult cleaning;

    public QualityReport(QualityAssessment before, QualityAssessment after, CleaningResult cleaning) {
        this.before = before;
        this.after = after;
        this.cleaning = cleaning;
    }

    public QualityAssessment getBefore() {
        return before;
    }

    public QualityAssessment getAfter() {
        return after;
    }

    public CleaningResult getCleaning() {
        return cleaning;
    }

    public NormalizedTable getCleanTable() {
        return cleaning.getTable();
    }

    public List<CleaningAction> getActions() {
        return cleaning.getActions();
    }

    public double getScoreDelta() {
        return after.getScore().getOverall() - before.getScore().getOverall();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "QualityReport{before=%.2f, after=%.2f, rows %d -> %d, actions=%d}",
                before.getScore().getOverall(), after.getScore().getOverall(), before.getRowCount(),
                after.getRowCount(), cleaning.getActions().size());
    }
}
