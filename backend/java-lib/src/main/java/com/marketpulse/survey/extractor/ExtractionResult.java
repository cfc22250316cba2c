package com.marketpulse.survey.extractor;

import com.marketpulse.survey.model.ClassifiedRow;
import com.marketpulse.survey.model.DropReason;
import com.marketpulse.survey.model.NormalizedTable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of normalizing one sheet: the anchor, every classified row and the assembled table
 */
public class ExtractionResult {
    private final Anchor anchor;
    private final NormalizedTable table;
    private final List<ClassifiedRow> classifiedRows;
    private final Map<DropReason, Integer> dropCounts;

    public ExtractionResult(Anchor anchor, NormalizedTable table, List<ClassifiedRow> classifiedRows) {
        this.anchor = anchor;
        this.table = table;
        this.classifiedRows = List.copyOf(classifiedRows);

        Map<DropReason, Integer> counts = new EnumMap<>(DropReason.class);
        for (ClassifiedRow row : this.classifiedRows) {
            if (!row.isKept()) {
                counts.merge(row.getDropReason(), 1, Integer::sum);
            }
        }
        this.dropCounts = Collections.unmodifiableMap(counts);
    }

    public Anchor getAnchor() {
        return anchor;
    }

    public NormalizedTable getTable() {
        return table;
    }

    public List<ClassifiedRow> getClassifiedRows() {
        return classifiedRows;
    }

    /**
     * Number of dropped rows per reason; reasons with no drops are absent
     */
    public Map<DropReason, Integer> getDropCounts() {
        return dropCounts;
    }

    public int getDropCount(DropReason reason) {
        return dropCounts.getOrDefault(reason, 0);
    }

    public int getDroppedRowCount() {
        return dropCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public String toString() {
        return String.format("ExtractionResult{anchor=%s, keptRows=%d, droppedRows=%d, drops=%s}",
                anchor, table.getRowCount(), getDroppedRowCount(), dropCounts);
    }
}
