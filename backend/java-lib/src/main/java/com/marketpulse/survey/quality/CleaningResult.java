package com.marketpulse.survey.quality;

import com.marketpulse.survey.model.NormalizedTable;

import java.util.ArrayList;
import java.util.List;

/**
 * A table at a given cleaning stage together with the audit log that produced it
 * Immutable: each stage returns a new result whose log extends the previous one.
 */
public final class CleaningResult {
    private final NormalizedTable table;
    private final CleaningStage stage;
    private final List<CleaningAction> actions;

    public CleaningResult(NormalizedTable table, CleaningStage stage, List<CleaningAction> actions) {
        this.table = table;
        this.stage = stage;
        this.actions = List.copyOf(actions);
    }

    public static CleaningResult raw(NormalizedTable table) {
        return new CleaningResult(table, CleaningStage.RAW, List.of());
    }

    CleaningResult advance(NormalizedTable newTable, CleaningStage newStage, List<CleaningAction> newActions) {
        List<CleaningAction> log = new ArrayList<>(actions);
        log.addAll(newActions);
        return new CleaningResult(newTable, newStage, log);
    }

    public NormalizedTable getTable() {
        return table;
    }

    public CleaningStage getStage() {
        return stage;
    }

    public List<CleaningAction> getActions() {
        return actions;
    }

    @Override
    public String toString() {
        return String.format("CleaningResult{stage=%s, rows=%d, actions=%d}", stage, table.getRowCount(),
                actions.size());
    }
}
