package com.marketpulse.survey.model;

/**
 * Quality markers attached to a normalized cell
 */
public enum CellFlag {
    /** Withheld by the publisher ("..", "-"), stored as absent rather than zero */
    SUPPRESSED,
    /** Parenthesized numeral: the statistic is less trustworthy, the sign is unchanged */
    LOW_RELIABILITY,
    /** Cell expresses a statistical margin ("±") rather than a data point */
    ERROR_MARGIN,
    /** Value was filled in by missing-value handling */
    IMPUTED
}
