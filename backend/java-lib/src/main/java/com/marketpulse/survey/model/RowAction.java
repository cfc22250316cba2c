package com.marketpulse.survey.model;

public enum RowAction {
    KEEP,
    DROP
}
