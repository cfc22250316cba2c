package com.marketpulse.survey.extractor;

import com.marketpulse.survey.InvalidConfigurationException;
import com.marketpulse.survey.model.RawGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

/**
 * Finds the real header row below the title and metadata rows of an export sheet
 * Never fails: when nothing qualifies the configured default row is returned with
 * confident=false.
 */
public class TableLocator {
    private static final Logger logger = LoggerFactory.getLogger(TableLocator.class);

    private static final Set<String> QUINTILE_LABELS = Set.of("5", "4", "3", "2", "1");

    private final NormalizerConfig config;
    private final CellNormalizer cellNormalizer;

    public TableLocator(NormalizerConfig config) {
        this.config = config;
        this.cellNormalizer = new CellNormalizer(config);
    }

    public Anchor detectAnchorRow(RawGrid grid) {
        return detectAnchorRow(grid, config.getAnchorMaxScanRows());
    }

    /**
     * Detect the header row within the first rows of a grid
     * A row qualifies when it has enough non-empty cells and the row below it holds a number,
     * or when it carries the quintile labels 5..1 in adjacent cells. The earliest qualifying row
     * wins since titles and metadata always come before the header.
     *
     * @param grid        the raw sheet
     * @param maxScanRows how many leading rows to inspect
     * @return the anchor; a low-confidence fallback when no row qualifies
     */
    public Anchor detectAnchorRow(RawGrid grid, int maxScanRows) {
        if (maxScanRows <= 0) {
            throw new InvalidConfigurationException("maxScanRows must be positive: " + maxScanRows);
        }
        int limit = Math.min(maxScanRows, grid.getRowCount());

        for (int row = 0; row < limit; row++) {
            if (isHeaderFollowedByData(grid, row)) {
                logger.info("Anchor row {} detected in sheet '{}' (header followed by data)",
                        row, grid.getSheetName());
                return Anchor.detected(row, Anchor.Method.HEADER_THEN_DATA);
            }
            if (hasQuintileLabels(grid, row)) {
                logger.info("Anchor row {} detected in sheet '{}' (quintile labels)", row, grid.getSheetName());
                return Anchor.detected(row, Anchor.Method.QUINTILE_LABELS);
            }
        }

        logger.warn("No anchor row found in first {} rows of sheet '{}', using default row {}",
                limit, grid.getSheetName(), config.getDefaultAnchorRow());
        return Anchor.fallback(config.getDefaultAnchorRow());
    }

    private boolean isHeaderFollowedByData(RawGrid grid, int row) {
        if (grid.countNonEmpty(row) < config.getMinHeaderCells()) {
            return false;
        }
        int next = row + 1;
        if (next >= grid.getRowCount()) {
            return false;
        }
        for (int c = 0; c < grid.getColumnCount(); c++) {
            if (cellNormalizer.isNumeric(grid.getCell(next, c))) {
                return true;
            }
        }
        return false;
    }

    private boolean hasQuintileLabels(RawGrid grid, int row) {
        int width = QUINTILE_LABELS.size();
        for (int start = 0; start + width <= grid.getColumnCount(); start++) {
            Set<String> window = new HashSet<>();
            for (int c = start; c < start + width; c++) {
                window.add(labelText(grid.getCell(row, c)));
            }
            if (window.equals(QUINTILE_LABELS)) {
                return true;
            }
        }
        return false;
    }

    // Numeric cells read as 5.0 must still match the label "5"
    private static String labelText(Object cell) {
        if (cell == null) {
            return "";
        }
        if (cell instanceof Number) {
            double value = ((Number) cell).doubleValue();
            if (Double.isFinite(value) && value == Math.rint(value)) {
                return BigDecimal.valueOf(value).toBigInteger().toString();
            }
        }
        return cell.toString().strip();
    }
}
