package com.marketpulse.survey.model;

import java.util.List;

/**
 * A source row after normalization and classification
 */
public class ClassifiedRow {
    private final int sourceRowIndex;
    private final String label;
    private final RowLevel level;
    private final RowAction action;
    private final DropReason dropReason;
    private final List<NormalizedCell> cells;

    public ClassifiedRow(int sourceRowIndex, String label, RowLevel level, RowAction action,
            DropReason dropReason, List<NormalizedCell> cells) {
        this.sourceRowIndex = sourceRowIndex;
        this.label = label != null ? label : "";
        this.level = level;
        this.action = action;
        this.dropReason = dropReason != null ? dropReason : DropReason.NONE;
        this.cells = cells != null ? List.copyOf(cells) : List.of();
    }

    public static ClassifiedRow kept(int sourceRowIndex, String label, RowLevel level, List<NormalizedCell> cells) {
        return new ClassifiedRow(sourceRowIndex, label, level, RowAction.KEEP, DropReason.NONE, cells);
    }

    public static ClassifiedRow dropped(int sourceRowIndex, String label, RowLevel level, DropReason reason,
            List<NormalizedCell> cells) {
        return new ClassifiedRow(sourceRowIndex, label, level, RowAction.DROP, reason, cells);
    }

    public int getSourceRowIndex() {
        return sourceRowIndex;
    }

    public String getLabel() {
        return label;
    }

    public RowLevel getLevel() {
        return level;
    }

    public RowAction getAction() {
        return action;
    }

    public DropReason getDropReason() {
        return dropReason;
    }

    public List<NormalizedCell> getCells() {
        return cells;
    }

    public boolean isKept() {
        return action == RowAction.KEEP;
    }

    public NormalizedCell getCell(int index) {
        if (index >= 0 && index < cells.size()) {
            return cells.get(index);
        }
        return NormalizedCell.empty();
    }

    @Override
    public String toString() {
        return String.format("ClassifiedRow{row=%d, label='%s', level=%s, action=%s, reason=%s}",
                sourceRowIndex, label, level, action, dropReason);
    }
}
