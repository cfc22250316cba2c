package com.marketpulse.survey.extractor;

import com.marketpulse.survey.model.CellFlag;
import com.marketpulse.survey.model.ClassifiedRow;
import com.marketpulse.survey.model.DropReason;
import com.marketpulse.survey.model.NormalizedCell;
import com.marketpulse.survey.model.RowLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides per row whether it is kept and at which hierarchy level
 * Stateless: the outcome depends only on the row's own label and cells, so rows can be
 * classified in any order or in parallel.
 */
public class RowClassifier {
    private static final Logger logger = LoggerFactory.getLogger(RowClassifier.class);

    private final NormalizerConfig config;

    public RowClassifier(NormalizerConfig config) {
        this.config = config;
    }

    public ClassifiedRow classifyRow(String label, List<NormalizedCell> cells) {
        return classifyRow(-1, label, cells);
    }

    /**
     * Classify one row; the first matching rule wins
     * Error-margin rows, titles and aggregate keywords, numbered footnotes and blank labels are
     * dropped. Everything else gets a hierarchy level and is kept unless its total cell is empty.
     *
     * @param sourceRowIndex row index in the source grid, carried through for ordering
     * @param label          the row label
     * @param cells          the row's normalized value cells, label column excluded
     * @return the classified row
     */
    public ClassifiedRow classifyRow(int sourceRowIndex, String label, List<NormalizedCell> cells) {
        String text = label != null ? label.strip() : "";

        if (CellNormalizer.hasErrorMargin(text) || hasErrorMarginCell(cells)) {
            return drop(sourceRowIndex, text, RowLevel.ERROR_MARGIN, DropReason.ERROR_MARGIN, cells);
        }
        if (isGarbage(text)) {
            return drop(sourceRowIndex, text, RowLevel.GARBAGE, DropReason.GARBAGE, cells);
        }
        if (isFootnote(text)) {
            return drop(sourceRowIndex, text, RowLevel.FOOTNOTE, DropReason.FOOTNOTE, cells);
        }
        if (text.isEmpty()) {
            return drop(sourceRowIndex, text, RowLevel.BLANK, DropReason.BLANK, cells);
        }

        RowLevel level = detectLevel(text);

        int totalIndex = config.resolveTotalIndex(cells.size());
        if (config.hasTotalColumn()) {
            if (totalIndex < 0 || !cells.get(totalIndex).hasValue()) {
                return drop(sourceRowIndex, text, level, DropReason.MISSING_TOTAL, cells);
            }
        } else if (cells.stream().noneMatch(NormalizedCell::hasValue)) {
            return drop(sourceRowIndex, text, level, DropReason.NO_VALUES, cells);
        }

        return ClassifiedRow.kept(sourceRowIndex, text, level, cells);
    }

    /**
     * Hierarchy level of a label
     * Sections name a known top-level area and are either qualified ("excl.", "total") or short;
     * details carry a comma or a long description; everything else is a subcategory.
     */
    public RowLevel detectLevel(String label) {
        String lower = label.toLowerCase(Locale.ROOT);
        int words = wordCount(label);

        boolean namesSection = config.getSectionKeywords().stream().anyMatch(lower::contains);
        if (namesSection) {
            boolean qualified = config.getSectionQualifiers().stream().anyMatch(lower::contains);
            if (qualified || words <= config.getSectionMaxWords()) {
                return RowLevel.SECTION;
            }
        }
        if (label.contains(",") || words >= config.getDetailMinWords()) {
            return RowLevel.DETAIL;
        }
        return RowLevel.SUBCATEGORY;
    }

    private boolean isGarbage(String text) {
        if (config.getGarbageKeywords().contains(text.toLowerCase(Locale.ROOT))) {
            return true;
        }
        for (Pattern pattern : config.getTitlePatterns()) {
            if (pattern.matcher(text).matches()) {
                return true;
            }
        }
        return false;
    }

    // Numbered notes such as "(1) In 2018 ...", then configured source notes
    private boolean isFootnote(String text) {
        if (text.length() > 2 && text.charAt(0) == '(' && Character.isDigit(text.charAt(1))) {
            return true;
        }
        for (Pattern pattern : config.getFootnotePatterns()) {
            if (pattern.matcher(text).matches()) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasErrorMarginCell(List<NormalizedCell> cells) {
        for (NormalizedCell cell : cells) {
            if (cell.hasFlag(CellFlag.ERROR_MARGIN)) {
                return true;
            }
        }
        return false;
    }

    private static int wordCount(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static ClassifiedRow drop(int sourceRowIndex, String label, RowLevel level, DropReason reason,
            List<NormalizedCell> cells) {
        logger.debug("Dropping row {} '{}': {}", sourceRowIndex, label, reason);
        return ClassifiedRow.dropped(sourceRowIndex, label, level, reason, cells);
    }
}
