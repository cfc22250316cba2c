package com.marketpulse.survey.quality;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.marketpulse.survey.model.CellFlag;
import com.marketpulse.survey.model.ColumnSpec;
import com.marketpulse.survey.model.NormalizedTable;
import com.marketpulse.survey.model.QualityIssue;
import com.marketpulse.survey.model.TableRow;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON rendering of tables and quality reports for loaders and report renderers
 */
public final class QualityReportJson {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private QualityReportJson() {
    }

    public static String toJson(QualityReport report) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("table", report.getCleanTable().getName());
        root.put("before", assessment(report.getBefore()));
        root.put("after", assessment(report.getAfter()));
        root.put("scoreDelta", report.getScoreDelta());
        root.put("finalStage", report.getCleaning().getStage().name());
        List<Map<String, Object>> actions = new ArrayList<>();
        for (CleaningAction action : report.getActions()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("kind", action.getKind().name());
            node.put("column", action.getColumn());
            node.put("affectedRows", action.getAffectedRowCount());
            node.put("strategy", action.getStrategyUsed());
            node.put("detail", action.getDetail());
            actions.add(node);
        }
        root.put("actions", actions);
        return write(root);
    }

    /**
     * Rows as column-to-value maps plus level and per-column flags
     */
    public static String tableToJson(NormalizedTable table) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("name", table.getName());
        List<Map<String, Object>> columns = new ArrayList<>();
        for (ColumnSpec column : table.getColumns()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("name", column.getName());
            node.put("type", column.getType().name());
            node.put("role", column.getRole().name());
            columns.add(node);
        }
        root.put("columns", columns);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (TableRow row : table.getRows()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("sourceRow", row.getSourceRowIndex());
            node.put("level", row.hasLevel() ? row.getLevel().name() : null);
            node.put("values", row.getValues());
            Map<String, List<String>> flags = new LinkedHashMap<>();
            for (Map.Entry<String, Set<CellFlag>> entry : row.getFlags().entrySet()) {
                List<String> names = new ArrayList<>();
                entry.getValue().forEach(flag -> names.add(flag.name()));
                flags.put(entry.getKey(), names);
            }
            node.put("flags", flags);
            rows.add(node);
        }
        root.put("rows", rows);
        root.put("issues", issues(table.getIssues()));
        return write(root);
    }

    private static Map<String, Object> assessment(QualityAssessment assessment) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("rows", assessment.getRowCount());
        QualityScore score = assessment.getScore();
        Map<String, Object> scoreNode = new LinkedHashMap<>();
        scoreNode.put("overall", score.getOverall());
        scoreNode.put("completeness", score.getCompleteness());
        scoreNode.put("uniqueness", score.getUniqueness());
        scoreNode.put("validity", score.getValidity());
        node.put("score", scoreNode);
        Map<String, Object> missing = new LinkedHashMap<>();
        assessment.getMissingValues().forEach((column, stats) -> {
            Map<String, Object> statsNode = new LinkedHashMap<>();
            statsNode.put("count", stats.getCount());
            statsNode.put("percentage", stats.getPercentage());
            statsNode.put("sampleRows", stats.getSampleRowIndices());
            missing.put(column, statsNode);
        });
        node.put("missing", missing);
        node.put("duplicateRows", assessment.getDuplicateRows());
        node.put("outliers", assessment.getOutliers());
        node.put("issues", issues(assessment.getIssues()));
        return node;
    }

    private static List<Map<String, Object>> issues(List<QualityIssue> issues) {
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (QualityIssue issue : issues) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("kind", issue.getKind().name());
            node.put("row", issue.getRowIndex());
            node.put("column", issue.getColumn());
            node.put("severity", issue.getSeverity().name());
            node.put("message", issue.getMessage());
            nodes.add(node);
        }
        return nodes;
    }

    private static String write(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write quality JSON", e);
        }
    }
}
