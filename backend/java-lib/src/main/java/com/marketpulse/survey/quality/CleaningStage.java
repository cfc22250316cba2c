package com.marketpulse.survey.quality;

/**
 * Cleaning progress of a table; stages only move forward
 */
public enum CleaningStage {
    RAW,
    MISSING_HANDLED,
    DEDUPLICATED,
    OUTLIERS_HANDLED,
    CLEAN;

    public boolean hasReached(CleaningStage stage) {
        return compareTo(stage) >= 0;
    }
}
