package com.marketpulse.survey.quality;

import com.marketpulse.survey.ConfigValues;

public enum OutlierMethod {
    /** Winsorize: clamp values into the IQR fence */
    CAP,
    /** Drop rows outside the fence */
    REMOVE,
    /** Keep rows and add a boolean sidecar column */
    FLAG;

    public static OutlierMethod fromName(String name) {
        return ConfigValues.parseEnum(OutlierMethod.class, name, "outlierMethod");
    }
}
