package com.marketpulse.survey.quality;

import com.marketpulse.survey.InvalidConfigurationException;
import com.marketpulse.survey.model.CellFlag;
import com.marketpulse.survey.model.ColumnRole;
import com.marketpulse.survey.model.ColumnSpec;
import com.marketpulse.survey.model.ColumnType;
import com.marketpulse.survey.model.NormalizedTable;
import com.marketpulse.survey.model.TableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Linear cleaning pipeline: RAW, MISSING_HANDLED, DEDUPLICATED, OUTLIERS_HANDLED, CLEAN
 * <p>
 * Every stage takes the current {@link CleaningResult} and returns a new one; tables are never
 * modified in place. Policy arguments are validated before any row is read. A stage whose target
 * has already been reached returns its input unchanged, so reruns and out-of-order calls are no-ops.
 * Stages may be skipped.
 */
public class QualityCleaner {
    private static final Logger logger = LoggerFactory.getLogger(QualityCleaner.class);

    public static final String UNKNOWN = "Unknown";
    public static final String OUTLIER_FLAG_SUFFIX = "_is_outlier";

    // Text columns missing at least this share get UNKNOWN instead of the mode
    private static final double MODE_MISSING_LIMIT = 50.0;
    private static final int MAX_LOGGED_KEYS = 20;
    private static final String NO_CHANGES = "no changes";

    public CleaningResult start(NormalizedTable table) {
        return CleaningResult.raw(Objects.requireNonNull(table, "table"));
    }

    /**
     * Run every stage enabled in the config, in pipeline order
     */
    public CleaningResult clean(NormalizedTable table, CleaningConfig config) {
        CleaningResult state = start(table);
        if (config.isHandleMissing()) {
            state = handleMissing(state, config.getMissingStrategy(), config.getFillDefaults(),
                    config.getRequiredColumns());
        }
        if (config.isRemoveDuplicates()) {
            state = removeDuplicates(state, config.getDuplicateKeyColumns(), config.getKeepPolicy());
        }
        if (config.isHandleOutliers()) {
            state = handleOutliers(state, config.getOutlierMethod(), config.getOutlierColumns(),
                    config.getOutlierMultiplier());
        }
        return finish(state);
    }

    public CleaningResult handleMissing(CleaningResult state, MissingStrategy strategy) {
        return handleMissing(state, strategy, Map.of(), List.of());
    }

    /**
     * @param defaults        per-column fill values, required for FILL_DEFAULT
     * @param requiredColumns columns a row must have for DROP; empty means every column
     * @throws InvalidConfigurationException for a null strategy, unknown columns or unusable defaults
     */
    public CleaningResult handleMissing(CleaningResult state, MissingStrategy strategy, Map<String, Object> defaults,
            List<String> requiredColumns) {
        Objects.requireNonNull(state, "state");
        if (strategy == null) {
            throw new InvalidConfigurationException("A missing-value strategy is required");
        }
        NormalizedTable table = state.getTable();
        Map<String, Object> fillValues = strategy == MissingStrategy.FILL_DEFAULT
                ? convertDefaults(table, defaults) : Map.of();
        List<String> required = requiredColumns != null ? requiredColumns : List.of();
        if (strategy == MissingStrategy.DROP) {
            required.forEach(column -> requireColumn(table, column));
        }

        if (state.getStage().hasReached(CleaningStage.MISSING_HANDLED)) {
            logger.debug("Missing values already handled for table '{}', skipping", table.getName());
            return state;
        }

        List<CleaningAction> actions = new ArrayList<>();
        NormalizedTable result;
        switch (strategy) {
            case SMART:
                result = fillSmart(table, actions);
                break;
            case DROP:
                result = dropIncomplete(table, required.isEmpty() ? table.getColumnNames() : required, actions);
                break;
            case FILL_DEFAULT:
                result = fillDefaults(table, fillValues, actions);
                break;
            default:
                throw new InvalidConfigurationException("Unsupported missing-value strategy: " + strategy);
        }
        if (actions.isEmpty()) {
            ActionKind kind = strategy == MissingStrategy.DROP
                    ? ActionKind.MISSING_ROWS_DROPPED : ActionKind.MISSING_FILLED;
            actions.add(new CleaningAction(kind, null, 0, strategy.name(), NO_CHANGES));
        }
        logActions(table, actions);
        return state.advance(result, CleaningStage.MISSING_HANDLED, actions);
    }

    /**
     * Keep one row per key, preserving the order of the kept rows
     *
     * @param keyColumns key columns; when empty the identifier columns are used, else the full row
     * @throws InvalidConfigurationException for a null keep policy or an unknown key column
     */
    public CleaningResult removeDuplicates(CleaningResult state, List<String> keyColumns, KeepPolicy keep) {
        Objects.requireNonNull(state, "state");
        if (keep == null) {
            throw new InvalidConfigurationException("A keep policy is required");
        }
        NormalizedTable table = state.getTable();
        List<String> keys = QualityAnalyzer.resolveKeyColumns(table, keyColumns);

        if (state.getStage().hasReached(CleaningStage.DEDUPLICATED)) {
            logger.debug("Table '{}' already deduplicated, skipping", table.getName());
            return state;
        }

        List<TableRow> rows = table.getRows();
        Map<List<Object>, Integer> keeper = new HashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            List<Object> key = QualityAnalyzer.rowKey(rows.get(i), keys);
            if (keep == KeepPolicy.LAST || !keeper.containsKey(key)) {
                keeper.put(key, i);
            }
        }

        List<TableRow> kept = new ArrayList<>();
        List<String> removedKeys = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            List<Object> key = QualityAnalyzer.rowKey(rows.get(i), keys);
            if (keeper.get(key) == i) {
                kept.add(rows.get(i));
            } else {
                removedKeys.add(describeKey(keys, key));
            }
        }

        String detail = removedKeys.isEmpty() ? NO_CHANGES : "removed " + summarize(removedKeys);
        List<CleaningAction> actions = List.of(new CleaningAction(ActionKind.DUPLICATES_REMOVED,
                keys.size() == 1 ? keys.get(0) : null, removedKeys.size(), "KEEP_" + keep.name(), detail));
        logActions(table, actions);
        return state.advance(table.withRows(kept), CleaningStage.DEDUPLICATED, actions);
    }

    /**
     * Cap, remove or flag IQR outliers, recomputing each column's bounds from the current table
     *
     * @param columns columns to treat; empty means every numeric non-identifier column
     * @throws InvalidConfigurationException for a null method, a non-positive multiplier, unknown or
     *                                       non-numeric columns, or a flag column name that is taken
     */
    public CleaningResult handleOutliers(CleaningResult state, OutlierMethod method, List<String> columns,
            double multiplier) {
        Objects.requireNonNull(state, "state");
        if (method == null) {
            throw new InvalidConfigurationException("An outlier method is required");
        }
        OutlierBounds.requireValidMultiplier(multiplier);
        NormalizedTable table = state.getTable();
        List<String> targets = columns == null || columns.isEmpty()
                ? candidateColumns(table) : columns;
        for (String column : targets) {
            QualityAnalyzer.requireNumericColumn(table, column);
            if (method == OutlierMethod.FLAG) {
                ColumnSpec existing = table.findColumn(column + OUTLIER_FLAG_SUFFIX);
                if (existing != null && existing.getRole() != ColumnRole.FLAG) {
                    throw new InvalidConfigurationException(String.format(
                            "Cannot flag outliers of '%s': column '%s' already exists", column,
                            existing.getName()));
                }
            }
        }

        if (state.getStage().hasReached(CleaningStage.OUTLIERS_HANDLED)) {
            logger.debug("Outliers already handled for table '{}', skipping", table.getName());
            return state;
        }

        List<CleaningAction> actions = new ArrayList<>();
        NormalizedTable current = table;
        for (String column : targets) {
            List<Double> values = current.numericValues(column);
            if (values.isEmpty()) {
                logger.debug("Column '{}' has no values, no outlier bounds", column);
                continue;
            }
            OutlierBounds bounds = OutlierBounds.of(values, multiplier);
            switch (method) {
                case CAP:
                    current = cap(current, column, bounds, actions);
                    break;
                case REMOVE:
                    current = remove(current, column, bounds, actions);
                    break;
                case FLAG:
                    current = flag(current, column, bounds, actions);
                    break;
                default:
                    throw new InvalidConfigurationException("Unsupported outlier method: " + method);
            }
        }
        if (actions.isEmpty()) {
            actions.add(new CleaningAction(actionKind(method), null, 0, method.name(), NO_CHANGES));
        }
        logActions(table, actions);
        return state.advance(current, CleaningStage.OUTLIERS_HANDLED, actions);
    }

    public CleaningResult finish(CleaningResult state) {
        Objects.requireNonNull(state, "state");
        if (state.getStage() == CleaningStage.CLEAN) {
            return state;
        }
        NormalizedTable table = state.getTable();
        if (table.isEmpty()) {
            logger.warn("Table '{}' has no rows left after cleaning", table.getName());
        }
        logger.info("Cleaning of table '{}' finished: {} rows, {} actions", table.getName(), table.getRowCount(),
                state.getActions().size());
        return state.advance(table, CleaningStage.CLEAN, List.of());
    }

    private NormalizedTable fillSmart(NormalizedTable table, List<CleaningAction> actions) {
        List<TableRow> rows = new ArrayList<>(table.getRows());
        int rowCount = rows.size();
        for (ColumnSpec column : table.getColumns()) {
            if (column.getRole() == ColumnRole.FLAG || column.getType() == ColumnType.BOOLEAN) {
                continue;
            }
            String name = column.getName();
            List<Integer> missing = missingRows(rows, name);
            if (missing.isEmpty()) {
                continue;
            }

            Object fill;
            String strategy;
            if (column.isNumeric()) {
                List<Double> present = table.numericValues(name);
                if (present.isEmpty()) {
                    logger.debug("Column '{}' has no values to take a median from, left as is", name);
                    continue;
                }
                fill = Percentiles.median(present);
                strategy = "SMART_MEDIAN";
            } else {
                double missingPercentage = missing.size() * 100.0 / rowCount;
                Object mode = missingPercentage < MODE_MISSING_LIMIT ? mode(rows, name) : null;
                if (mode != null) {
                    fill = mode;
                    strategy = "SMART_MODE";
                } else {
                    fill = UNKNOWN;
                    strategy = "SMART_UNKNOWN";
                }
            }
            for (int index : missing) {
                rows.set(index, rows.get(index).withValue(name, fill, CellFlag.IMPUTED));
            }
            actions.add(new CleaningAction(ActionKind.MISSING_FILLED, name, missing.size(), strategy,
                    "filled with " + fill));
        }
        return table.withRows(rows);
    }

    private NormalizedTable dropIncomplete(NormalizedTable table, List<String> required,
            List<CleaningAction> actions) {
        List<TableRow> kept = table.getRows().stream()
                .filter(row -> required.stream().noneMatch(c -> QualityAnalyzer.isMissingValue(row.get(c))))
                .collect(Collectors.toList());
        int dropped = table.getRowCount() - kept.size();
        if (dropped > 0) {
            actions.add(new CleaningAction(ActionKind.MISSING_ROWS_DROPPED, null, dropped,
                    MissingStrategy.DROP.name(), "required columns " + required));
        }
        return table.withRows(kept);
    }

    private NormalizedTable fillDefaults(NormalizedTable table, Map<String, Object> fillValues,
            List<CleaningAction> actions) {
        List<TableRow> rows = new ArrayList<>(table.getRows());
        for (Map.Entry<String, Object> entry : fillValues.entrySet()) {
            String name = entry.getKey();
            List<Integer> missing = missingRows(rows, name);
            if (missing.isEmpty()) {
                continue;
            }
            for (int index : missing) {
                rows.set(index, rows.get(index).withValue(name, entry.getValue(), CellFlag.IMPUTED));
            }
            actions.add(new CleaningAction(ActionKind.MISSING_FILLED, name, missing.size(),
                    MissingStrategy.FILL_DEFAULT.name(), "filled with " + entry.getValue()));
        }
        return table.withRows(rows);
    }

    private Map<String, Object> convertDefaults(NormalizedTable table, Map<String, Object> defaults) {
        if (defaults == null || defaults.isEmpty()) {
            throw new InvalidConfigurationException("FILL_DEFAULT needs at least one per-column default");
        }
        Map<String, Object> converted = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : defaults.entrySet()) {
            ColumnSpec column = requireColumn(table, entry.getKey());
            Object value = entry.getValue();
            if (value == null) {
                throw new InvalidConfigurationException("Default for column '" + column.getName() + "' is null");
            }
            converted.put(column.getName(), convertDefault(column, value));
        }
        return converted;
    }

    private static Object convertDefault(ColumnSpec column, Object value) {
        switch (column.getType()) {
            case NUMERIC:
                if (value instanceof Number) {
                    return ((Number) value).doubleValue();
                }
                try {
                    return Double.parseDouble(value.toString().strip());
                } catch (NumberFormatException e) {
                    throw new InvalidConfigurationException(String.format(
                            "Default '%s' for numeric column '%s' is not a number", value, column.getName()), e);
                }
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                return Boolean.parseBoolean(value.toString().strip());
            default:
                return value.toString();
        }
    }

    private NormalizedTable cap(NormalizedTable table, String column, OutlierBounds bounds,
            List<CleaningAction> actions) {
        List<TableRow> rows = new ArrayList<>(table.getRows());
        int capped = 0;
        for (int i = 0; i < rows.size(); i++) {
            Double value = rows.get(i).getNumber(column);
            if (value != null && !value.isNaN() && bounds.isOutlier(value)) {
                rows.set(i, rows.get(i).withValue(column, bounds.clamp(value)));
                capped++;
            }
        }
        if (capped > 0) {
            actions.add(new CleaningAction(ActionKind.OUTLIERS_CAPPED, column, capped, OutlierMethod.CAP.name(),
                    describeBounds(bounds)));
        }
        return table.withRows(rows);
    }

    private NormalizedTable remove(NormalizedTable table, String column, OutlierBounds bounds,
            List<CleaningAction> actions) {
        List<TableRow> kept = new ArrayList<>();
        for (TableRow row : table.getRows()) {
            Double value = row.getNumber(column);
            if (value == null || value.isNaN() || !bounds.isOutlier(value)) {
                kept.add(row);
            }
        }
        int removed = table.getRowCount() - kept.size();
        if (removed > 0) {
            actions.add(new CleaningAction(ActionKind.OUTLIERS_REMOVED, column, removed,
                    OutlierMethod.REMOVE.name(), describeBounds(bounds)));
        }
        return table.withRows(kept);
    }

    private NormalizedTable flag(NormalizedTable table, String column, OutlierBounds bounds,
            List<CleaningAction> actions) {
        String flagColumn = column + OUTLIER_FLAG_SUFFIX;
        List<ColumnSpec> columns = new ArrayList<>(table.getColumns());
        if (!table.hasColumn(flagColumn)) {
            columns.add(ColumnSpec.flag(flagColumn));
        }
        List<TableRow> rows = new ArrayList<>();
        int flagged = 0;
        for (TableRow row : table.getRows()) {
            Double value = row.getNumber(column);
            boolean outlier = value != null && !value.isNaN() && bounds.isOutlier(value);
            if (outlier) {
                flagged++;
            }
            rows.add(row.withValue(flagColumn, outlier));
        }
        actions.add(new CleaningAction(ActionKind.OUTLIERS_FLAGGED, column, flagged, OutlierMethod.FLAG.name(),
                String.format("%s in column %s", describeBounds(bounds), flagColumn)));
        return table.withColumns(columns, rows);
    }

    private static List<String> candidateColumns(NormalizedTable table) {
        Set<String> flagColumns = new HashSet<>();
        for (ColumnSpec column : table.getColumns()) {
            if (column.getRole() == ColumnRole.FLAG) {
                flagColumns.add(column.getName());
            }
        }
        return QualityAnalyzer.outlierCandidateColumns(table).stream()
                .filter(c -> !flagColumns.contains(c))
                .collect(Collectors.toList());
    }

    private static List<Integer> missingRows(List<TableRow> rows, String column) {
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            if (QualityAnalyzer.isMissingValue(rows.get(i).get(column))) {
                missing.add(i);
            }
        }
        return missing;
    }

    /**
     * Most frequent value; ties go to the smallest value by its text form
     */
    private static Object mode(List<TableRow> rows, String column) {
        Map<Object, Integer> counts = new HashMap<>();
        for (TableRow row : rows) {
            Object value = row.get(column);
            if (!QualityAnalyzer.isMissingValue(value)) {
                counts.merge(value, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .min(Comparator.<Map.Entry<Object, Integer>>comparingInt(e -> -e.getValue())
                        .thenComparing(e -> e.getKey().toString()))
                .map(Map.Entry::getKey)
                .orElse(null);
    }

    private static ColumnSpec requireColumn(NormalizedTable table, String column) {
        ColumnSpec spec = table.findColumn(column);
        if (spec == null) {
            throw new InvalidConfigurationException(
                    String.format("Unknown column '%s' for table '%s'", column, table.getName()));
        }
        return spec;
    }

    private static ActionKind actionKind(OutlierMethod method) {
        switch (method) {
            case REMOVE:
                return ActionKind.OUTLIERS_REMOVED;
            case FLAG:
                return ActionKind.OUTLIERS_FLAGGED;
            default:
                return ActionKind.OUTLIERS_CAPPED;
        }
    }

    private static String describeKey(List<String> keys, List<Object> key) {
        if (keys.size() == 1) {
            return String.valueOf(key.get(0));
        }
        return key.toString();
    }

    private static String summarize(List<String> keys) {
        if (keys.size() <= MAX_LOGGED_KEYS) {
            return keys.toString();
        }
        return String.format("%s and %d more", keys.subList(0, MAX_LOGGED_KEYS), keys.size() - MAX_LOGGED_KEYS);
    }

    private static String describeBounds(OutlierBounds bounds) {
        return String.format(Locale.ROOT, "bounds [%.4f, %.4f]", bounds.getLower(), bounds.getUpper());
    }

    private static void logActions(NormalizedTable table, List<CleaningAction> actions) {
        for (CleaningAction action : actions) {
            logger.info("Table '{}': {} on {} affected {} rows ({})", table.getName(), action.getKind(),
                    action.getColumn() != null ? action.getColumn() : "all columns", action.getAffectedRowCount(),
                    action.getDetail());
        }
    }
}
