package com.marketpulse.survey.model;

/**
 * What a column means to aggregation and quality checks
 */
public enum ColumnRole {
    /** Row label of a survey table; doubles as the row identifier */
    LABEL,
    /** Explicit identifier column of a flat table */
    IDENTIFIER,
    /** Category value (quintile, store type, ...) */
    MEASURE,
    /** Declared total of the category values */
    TOTAL,
    /** Descriptive column that takes no part in checksums */
    ATTRIBUTE,
    /** Sidecar column added by outlier flagging */
    FLAG
}
