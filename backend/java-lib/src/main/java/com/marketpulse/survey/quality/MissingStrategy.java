package com.marketpulse.survey.quality;

import com.marketpulse.survey.ConfigValues;

public enum MissingStrategy {
    /** Mode (or "Unknown") for text columns, median for numeric columns */
    SMART,
    /** Remove rows missing a required field */
    DROP,
    /** Fill with caller-supplied per-column defaults */
    FILL_DEFAULT;

    /**
     * @throws com.marketpulse.survey.InvalidConfigurationException for unknown names
     */
    public static MissingStrategy fromName(String name) {
        return ConfigValues.parseEnum(MissingStrategy.class, name, "missingStrategy");
    }
}
