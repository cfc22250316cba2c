package com.marketpulse.survey.model;

public enum IssueKind {
    MISSING_VALUE,
    DUPLICATE,
    OUTLIER,
    CHECKSUM_MISMATCH
}
