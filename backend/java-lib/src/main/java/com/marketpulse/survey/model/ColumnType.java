package com.marketpulse.survey.model;

public enum ColumnType {
    TEXT,
    NUMERIC,
    BOOLEAN
}
