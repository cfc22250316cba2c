package com.marketpulse.survey.quality;

import com.marketpulse.survey.model.IssueKind;
import com.marketpulse.survey.model.QualityIssue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of one analysis pass over a table
 */
public final class QualityAssessment {
    private final int rowCount;
    private final Map<String, MissingValueStats> missingValues;
    private final List<Integer> duplicateRows;
    private final Map<String, List<Integer>> outliers;
    private final QualityScore score;
    private final List<QualityIssue> issues;

    public QualityAssessment(int rowCount, Map<String, MissingValueStats> missingValues, List<Integer> duplicateRows,
            Map<String, List<Integer>> outliers, QualityScore score, List<QualityIssue> issues) {
        this.rowCount = rowCount;
        this.missingValues = Collections.unmodifiableMap(new LinkedHashMap<>(missingValues));
        this.duplicateRows = List.copyOf(duplicateRows);
        Map<String, List<Integer>> outlierCopy = new LinkedHashMap<>();
        outliers.forEach((column, rows) -> outlierCopy.put(column, List.copyOf(rows)));
        this.outliers = Collections.unmodifiableMap(outlierCopy);
        this.score = score;
        this.issues = List.copyOf(issues);
    }

    public int getRowCount() {
        return rowCount;
    }

    /**
     * Columns with at least one missing value, in column order
     */
    public Map<String, MissingValueStats> getMissingValues() {
        return missingValues;
    }

    public List<Integer> getDuplicateRows() {
        return duplicateRows;
    }

    public Map<String, List<Integer>> getOutliers() {
        return outliers;
    }

    public int getOutlierCount() {
        return outliers.values().stream().mapToInt(List::size).sum();
    }

    public int getMissingCount() {
        return missingValues.values().stream().mapToInt(MissingValueStats::getCount).sum();
    }

    public QualityScore getScore() {
        return score;
    }

    public List<QualityIssue> getIssues() {
        return issues;
    }

    public List<QualityIssue> getIssues(IssueKind kind) {
        return issues.stream().filter(i -> i.getKind() == kind).collect(Collectors.toList());
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("QualityAssessment{rows=%d, missing=%d, duplicates=%d, outliers=%d, score=%s}",
                rowCount, getMissingCount(), duplicateRows.size(), getOutlierCount(), score);
    }
}
