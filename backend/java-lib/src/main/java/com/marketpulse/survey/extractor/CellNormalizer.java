package com.marketpulse.survey.extractor;

import com.marketpulse.survey.model.NormalizedCell;
import com.marketpulse.survey.model.RawGrid;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses raw spreadsheet cells into typed values with quality flags
 * Parenthesized numerals mark low reliability and are never negated; negative results are
 * stored as absolute values. Unparsable text becomes an empty cell, never an error.
 */
public class CellNormalizer {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private final Set<String> suppressedMarkers;

    public CellNormalizer(NormalizerConfig config) {
        this.suppressedMarkers = config.getSuppressedMarkers();
    }

    public CellNormalizer() {
        this(NormalizerConfig.defaults());
    }

    /**
     * Normalize one raw cell
     *
     * @param raw a String, Number or null as read from the grid
     * @return the parsed cell; empty when the cell is blank or unparsable
     */
    public NormalizedCell normalizeCell(Object raw) {
        if (RawGrid.isEmptyCell(raw)) {
            return NormalizedCell.empty();
        }
        if (raw instanceof NormalizedCell) {
            return (NormalizedCell) raw;
        }
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            if (!Double.isFinite(value)) {
                return NormalizedCell.empty();
            }
            return NormalizedCell.of(Math.abs(value));
        }
        if (!(raw instanceof String)) {
            return NormalizedCell.empty();
        }

        String text = ((String) raw).replace('\u00A0', ' ').strip();
        if (suppressedMarkers.contains(text)) {
            return NormalizedCell.suppressed();
        }
        if (hasErrorMargin(text)) {
            return NormalizedCell.errorMargin();
        }

        boolean lowReliability = false;
        if (text.length() > 2 && text.startsWith("(") && text.endsWith(")")) {
            lowReliability = true;
            text = text.substring(1, text.length() - 1).strip();
        }

        // Thousands separators and digit-group spaces
        text = text.replace(",", "").replace(" ", "").replace("\u2009", "");
        if (!NUMBER.matcher(text).matches()) {
            return NormalizedCell.empty();
        }

        double value = Math.abs(Double.parseDouble(text));
        if (!Double.isFinite(value)) {
            return NormalizedCell.empty();
        }
        return lowReliability ? NormalizedCell.lowReliability(value) : NormalizedCell.of(value);
    }

    /**
     * Normalize every cell of a row except the label column
     */
    public List<NormalizedCell> normalizeValues(Object[] row, int labelColumnIndex) {
        List<NormalizedCell> cells = new ArrayList<>(Math.max(0, row.length - 1));
        for (int c = 0; c < row.length; c++) {
            if (c != labelColumnIndex) {
                cells.add(normalizeCell(row[c]));
            }
        }
        return cells;
    }

    /**
     * Whether the raw cell parses to a number
     */
    public boolean isNumeric(Object raw) {
        return normalizeCell(raw).hasValue();
    }

    public static boolean hasErrorMargin(String text) {
        return text != null && text.contains(NormalizerConfig.ERROR_MARGIN_MARKER);
    }
}
