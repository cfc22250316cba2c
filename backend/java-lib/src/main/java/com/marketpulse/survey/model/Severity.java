package com.marketpulse.survey.model;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
