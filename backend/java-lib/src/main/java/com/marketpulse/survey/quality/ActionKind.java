package com.marketpulse.survey.quality;

public enum ActionKind {
    MISSING_FILLED,
    MISSING_ROWS_DROPPED,
    DUPLICATES_REMOVED,
    OUTLIERS_CAPPED,
    OUTLIERS_REMOVED,
    OUTLIERS_FLAGGED
}
