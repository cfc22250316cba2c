package com.marketpulse.survey.extractor;

import com.marketpulse.survey.model.CellFlag;
import com.marketpulse.survey.model.ClassifiedRow;
import com.marketpulse.survey.model.ColumnSpec;
import com.marketpulse.survey.model.IssueKind;
import com.marketpulse.survey.model.NormalizedCell;
import com.marketpulse.survey.model.NormalizedTable;
import com.marketpulse.survey.model.QualityIssue;
import com.marketpulse.survey.model.Severity;
import com.marketpulse.survey.model.TableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Combines classified rows into an immutable normalized table
 * Rows are re-sorted by source index first, so classification may run out of order.
 */
public class TableAssembler {
    private static final Logger logger = LoggerFactory.getLogger(TableAssembler.class);

    private final NormalizerConfig config;

    public TableAssembler(NormalizerConfig config) {
        this.config = config;
    }

    /**
     * Assemble with generated column names col_1..col_n
     */
    public NormalizedTable assemble(List<ClassifiedRow> classifiedRows) {
        int width = 0;
        for (ClassifiedRow row : classifiedRows) {
            width = Math.max(width, row.getCells().size());
        }
        List<String> names = new ArrayList<>(width);
        for (int i = 1; i <= width; i++) {
            names.add("col_" + i);
        }
        return assemble(classifiedRows, names, "");
    }

    /**
     * Keep the rows not marked as dropped, in source order, and annotate checksum deviations
     *
     * @param classifiedRows   rows from the classifier, in any order
     * @param valueColumnNames names of the value columns, label column excluded
     * @param tableName        name carried by the resulting table
     * @return the assembled table; checksum problems are attached as issues, never raised
     */
    public NormalizedTable assemble(List<ClassifiedRow> classifiedRows, List<String> valueColumnNames,
            String tableName) {
        List<ClassifiedRow> ordered = new ArrayList<>(classifiedRows);
        ordered.sort(Comparator.comparingInt(ClassifiedRow::getSourceRowIndex));

        int valueCount = valueColumnNames.size();
        int totalIndex = config.resolveTotalIndex(valueCount);
        String labelColumn = config.getLabelColumnName();

        List<ColumnSpec> columns = new ArrayList<>(valueCount + 1);
        columns.add(ColumnSpec.label(labelColumn));
        for (int i = 0; i < valueCount; i++) {
            String name = valueColumnNames.get(i);
            columns.add(i == totalIndex ? ColumnSpec.total(name) : ColumnSpec.measure(name));
        }

        List<TableRow> rows = new ArrayList<>();
        List<QualityIssue> issues = new ArrayList<>();
        for (ClassifiedRow source : ordered) {
            if (!source.isKept()) {
                continue;
            }
            if (!hasAnyValue(source, valueCount)) {
                logger.warn("Skipping kept row {} '{}': no numeric values", source.getSourceRowIndex(),
                        source.getLabel());
                continue;
            }
            if (totalIndex >= 0 && !source.getCell(totalIndex).hasValue()) {
                logger.warn("Skipping kept row {} '{}': total is empty", source.getSourceRowIndex(),
                        source.getLabel());
                continue;
            }

            Map<String, Object> values = new LinkedHashMap<>();
            Map<String, Set<CellFlag>> flags = new LinkedHashMap<>();
            values.put(labelColumn, source.getLabel());
            for (int i = 0; i < valueCount; i++) {
                NormalizedCell cell = source.getCell(i);
                String name = valueColumnNames.get(i);
                values.put(name, cell.getValue());
                if (!cell.getFlags().isEmpty()) {
                    flags.put(name, cell.getFlags());
                }
            }

            QualityIssue checksum = checkTotal(source, rows.size(), valueColumnNames, totalIndex);
            if (checksum != null) {
                issues.add(checksum);
            }
            rows.add(new TableRow(source.getSourceRowIndex(), source.getLevel(), values, flags));
        }

        logger.info("Assembled table '{}': {} of {} rows kept, {} checksum issues",
                tableName, rows.size(), ordered.size(), issues.size());
        return new NormalizedTable(tableName, columns, rows, issues);
    }

    private QualityIssue checkTotal(ClassifiedRow row, int tableRowIndex, List<String> valueColumnNames,
            int totalIndex) {
        ChecksumMode mode = config.getChecksumMode();
        if (mode == ChecksumMode.NONE || totalIndex < 0) {
            return null;
        }
        double total = row.getCell(totalIndex).getValue();
        double sum = 0.0;
        for (int i = 0; i < valueColumnNames.size(); i++) {
            if (i == totalIndex) {
                continue;
            }
            Double value = row.getCell(i).getValue();
            if (value != null) {
                sum += value;
            }
        }

        double checksum;
        double expected;
        if (mode == ChecksumMode.PERCENT_SHARES) {
            if (total == 0.0) {
                return null;
            }
            checksum = sum / total * 100.0;
            expected = 100.0;
        } else {
            checksum = sum;
            expected = total;
        }

        double deviation = Math.abs(checksum - expected);
        if (deviation <= config.getChecksumTolerance()) {
            return null;
        }
        String message = String.format(Locale.ROOT,
                "Row '%s': categories sum to %.2f but declared total is %.2f (deviation %.2f, tolerance %.2f)",
                row.getLabel(), checksum, expected, deviation, config.getChecksumTolerance());
        logger.warn(message);
        return new QualityIssue(IssueKind.CHECKSUM_MISMATCH, tableRowIndex, valueColumnNames.get(totalIndex),
                Severity.WARNING, message);
    }

    private static boolean hasAnyValue(ClassifiedRow row, int valueCount) {
        for (int i = 0; i < valueCount; i++) {
            if (row.getCell(i).hasValue()) {
                return true;
            }
        }
        return false;
    }
}
