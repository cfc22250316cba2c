package com.marketpulse.survey.quality;

import com.marketpulse.survey.InvalidConfigurationException;
import com.marketpulse.survey.model.ColumnRole;
import com.marketpulse.survey.model.ColumnSpec;
import com.marketpulse.survey.model.IssueKind;
import com.marketpulse.survey.model.NormalizedTable;
import com.marketpulse.survey.model.QualityIssue;
import com.marketpulse.survey.model.Severity;
import com.marketpulse.survey.model.TableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Read-only quality analysis: missing values, duplicates, IQR outliers and the weighted score
 * Analysis never modifies the table and may be repeated any number of times.
 */
public class QualityAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(QualityAnalyzer.class);

    private final double outlierMultiplier;
    private final List<String> keyColumns;

    public QualityAnalyzer(double outlierMultiplier, List<String> keyColumns) {
        OutlierBounds.requireValidMultiplier(outlierMultiplier);
        this.outlierMultiplier = outlierMultiplier;
        this.keyColumns = keyColumns != null ? List.copyOf(keyColumns) : List.of();
    }

    public QualityAnalyzer(CleaningConfig config) {
        this(config.getOutlierMultiplier(), config.getDuplicateKeyColumns());
    }

    public QualityAnalyzer() {
        this(1.5, List.of());
    }

    /**
     * Full analysis pass, including the table's own checksum annotations
     */
    public QualityAssessment analyze(NormalizedTable table) {
        Map<String, MissingValueStats> missing = detectMissing(table);
        List<Integer> duplicates = detectDuplicates(table, keyColumns);
        Map<String, List<Integer>> outliers = detectAllOutliers(table, outlierMultiplier);
        QualityScore score = computeQualityScore(table);

        List<QualityIssue> issues = new ArrayList<>();
        missing.values().forEach(stats -> issues.add(new QualityIssue(IssueKind.MISSING_VALUE, -1,
                stats.getColumn(), stats.getPercentage() >= 50.0 ? Severity.ERROR : Severity.WARNING,
                String.format(Locale.ROOT, "%d missing values (%.1f%%)", stats.getCount(), stats.getPercentage()))));
        duplicates.forEach(row -> issues.add(new QualityIssue(IssueKind.DUPLICATE, row, null, Severity.WARNING,
                "Row shares its key with another row")));
        outliers.forEach((column, rows) -> rows.forEach(row -> issues.add(new QualityIssue(IssueKind.OUTLIER,
                row, column, Severity.INFO, "Value outside the IQR fence"))));
        issues.addAll(table.getIssues());

        logger.info("Analyzed table '{}': {} rows, {} columns with missing values, {} duplicate rows, "
                        + "{} outlier cells, overall score {}",
                table.getName(), table.getRowCount(), missing.size(), duplicates.size(),
                outliers.values().stream().mapToInt(List::size).sum(),
                String.format(Locale.ROOT, "%.2f", score.getOverall()));
        return new QualityAssessment(table.getRowCount(), missing, duplicates, outliers, score, issues);
    }

    /**
     * Missing-value statistics for each column that has any; an empty table yields an empty map
     */
    public Map<String, MissingValueStats> detectMissing(NormalizedTable table) {
        Map<String, MissingValueStats> result = new LinkedHashMap<>();
        int rowCount = table.getRowCount();
        if (rowCount == 0) {
            return result;
        }
        for (String column : table.getColumnNames()) {
            List<Integer> missingRows = new ArrayList<>();
            for (int i = 0; i < rowCount; i++) {
                if (isMissingValue(table.getRow(i).get(column))) {
                    missingRows.add(i);
                }
            }
            if (!missingRows.isEmpty()) {
                double percentage = missingRows.size() * 100.0 / rowCount;
                result.put(column, new MissingValueStats(column, missingRows.size(), percentage, missingRows));
            }
        }
        return result;
    }

    /**
     * Indices of every row whose key is shared with at least one other row, ascending
     *
     * @param keyColumns key columns; when empty the table's identifier columns are used, else the full row
     * @throws InvalidConfigurationException if a key column does not exist
     */
    public List<Integer> detectDuplicates(NormalizedTable table, List<String> keyColumns) {
        List<String> keys = resolveKeyColumns(table, keyColumns);
        Map<List<Object>, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < table.getRowCount(); i++) {
            groups.computeIfAbsent(rowKey(table.getRow(i), keys), k -> new ArrayList<>()).add(i);
        }
        Set<Integer> duplicates = new TreeSet<>();
        for (List<Integer> members : groups.values()) {
            if (members.size() > 1) {
                duplicates.addAll(members);
            }
        }
        return new ArrayList<>(duplicates);
    }

    /**
     * Rows whose value in the column lies strictly outside [Q1 - m*IQR, Q3 + m*IQR]
     *
     * @throws InvalidConfigurationException if the column is unknown or not numeric, or the
     *                                       multiplier is not positive
     */
    public List<Integer> detectOutliers(NormalizedTable table, String column, double multiplier) {
        OutlierBounds.requireValidMultiplier(multiplier);
        requireNumericColumn(table, column);
        List<Double> values = table.numericValues(column);
        List<Integer> outliers = new ArrayList<>();
        if (values.isEmpty()) {
            return outliers;
        }
        OutlierBounds bounds = OutlierBounds.of(values, multiplier);
        for (int i = 0; i < table.getRowCount(); i++) {
            Double value = table.getRow(i).getNumber(column);
            if (value != null && !value.isNaN() && bounds.isOutlier(value)) {
                outliers.add(i);
            }
        }
        return outliers;
    }

    public List<Integer> detectOutliers(NormalizedTable table, String column) {
        return detectOutliers(table, column, outlierMultiplier);
    }

    /**
     * Outlier rows for every measured numeric column, keeping only columns that have outliers
     */
    public Map<String, List<Integer>> detectAllOutliers(NormalizedTable table, double multiplier) {
        Map<String, List<Integer>> result = new LinkedHashMap<>();
        for (String column : outlierCandidateColumns(table)) {
            List<Integer> rows = detectOutliers(table, column, multiplier);
            if (!rows.isEmpty()) {
                result.put(column, rows);
            }
        }
        return result;
    }

    /**
     * Weighted score; every component of an empty table is 0
     */
    public QualityScore computeQualityScore(NormalizedTable table) {
        int rowCount = table.getRowCount();
        if (rowCount == 0) {
            return QualityScore.empty();
        }

        long totalCells = (long) rowCount * table.getColumnCount();
        long nonNullCells = 0;
        for (TableRow row : table.getRows()) {
            for (String column : table.getColumnNames()) {
                if (!isMissingValue(row.get(column))) {
                    nonNullCells++;
                }
            }
        }
        double completeness = totalCells == 0 ? 0.0 : nonNullCells * 100.0 / totalCells;

        List<String> keys = resolveKeyColumns(table, keyColumns);
        Set<List<Object>> distinctKeys = new HashSet<>();
        for (TableRow row : table.getRows()) {
            distinctKeys.add(rowKey(row, keys));
        }
        double uniqueness = distinctKeys.size() * 100.0 / rowCount;

        Set<Integer> outlierRows = new HashSet<>();
        detectAllOutliers(table, outlierMultiplier).values().forEach(outlierRows::addAll);
        double validity = (rowCount - outlierRows.size()) * 100.0 / rowCount;

        return new QualityScore(completeness, uniqueness, validity);
    }

    public double getOutlierMultiplier() {
        return outlierMultiplier;
    }

    public List<String> getKeyColumns() {
        return keyColumns;
    }

    static boolean isMissingValue(Object value) {
        return value == null || (value instanceof Double && ((Double) value).isNaN());
    }

    /**
     * Requested keys, else identifier columns, else every column
     */
    static List<String> resolveKeyColumns(NormalizedTable table, List<String> requested) {
        if (requested != null && !requested.isEmpty()) {
            for (String column : requested) {
                if (!table.hasColumn(column)) {
                    throw new InvalidConfigurationException(
                            String.format("Unknown key column '%s' for table '%s'", column, table.getName()));
                }
            }
            return requested;
        }
        List<String> identifiers = table.getIdentifierColumns();
        return identifiers.isEmpty() ? table.getColumnNames() : identifiers;
    }

    static List<Object> rowKey(TableRow row, List<String> keys) {
        List<Object> key = new ArrayList<>(keys.size());
        for (String column : keys) {
            key.add(row.get(column));
        }
        return key;
    }

    /**
     * Numeric columns eligible for outlier checks: everything numeric except identifiers
     */
    static List<String> outlierCandidateColumns(NormalizedTable table) {
        return table.getColumns().stream()
                .filter(ColumnSpec::isNumeric)
                .filter(c -> c.getRole() != ColumnRole.IDENTIFIER)
                .map(ColumnSpec::getName)
                .collect(Collectors.toList());
    }

    static ColumnSpec requireNumericColumn(NormalizedTable table, String column) {
        ColumnSpec spec = table.findColumn(column);
        if (spec == null) {
            throw new InvalidConfigurationException(
                    String.format("Unknown column '%s' for table '%s'", column, table.getName()));
        }
        if (!spec.isNumeric()) {
            throw new InvalidConfigurationException(
                    String.format("Column '%s' is %s, not numeric", column, spec.getType()));
        }
        return spec;
    }
}
