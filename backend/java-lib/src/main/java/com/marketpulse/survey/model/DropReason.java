package com.marketpulse.survey.model;

/**
 * Why a row was left out of the assembled table
 */
public enum DropReason {
    NONE,
    ERROR_MARGIN,
    GARBAGE,
    FOOTNOTE,
    BLANK,
    // Total cell is empty: a spacer or sub-breakdown row
    MISSING_TOTAL,
    NO_VALUES
}
