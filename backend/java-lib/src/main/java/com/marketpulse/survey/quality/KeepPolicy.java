package com.marketpulse.survey.quality;

import com.marketpulse.survey.ConfigValues;

/**
 * Which member of a duplicate group survives deduplication
 */
public enum KeepPolicy {
    FIRST,
    LAST;

    public static KeepPolicy fromName(String name) {
        return ConfigValues.parseEnum(KeepPolicy.class, name, "keep");
    }
}
