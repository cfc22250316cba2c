package com.marketpulse.survey.extractor;

/**
 * How category columns relate to a row's declared total
 */
public enum ChecksumMode {
    /** No checksum is computed */
    NONE,
    /** Category values are percentages whose sum should equal the total cell (normally 100) */
    DECLARED_TOTAL,
    /** Category values are amounts; their shares of the total cell should add up to 100 */
    PERCENT_SHARES
}
