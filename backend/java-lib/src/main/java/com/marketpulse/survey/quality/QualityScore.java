package com.marketpulse.survey.quality;

import java.util.Locale;

/**
 * Weighted fitness score of a table, every component in [0, 100]
 * overall = 0.40 completeness + 0.30 uniqueness + 0.30 validity. An empty table scores 0
 * on every component.
 */
public final class QualityScore {
    public static final double COMPLETENESS_WEIGHT = 0.40;
    public static final double UNIQUENESS_WEIGHT = 0.30;
    public static final double VALIDITY_WEIGHT = 0.30;

    private static final QualityScore EMPTY = new QualityScore(0.0, 0.0, 0.0);

    private final double completeness;
    private final double uniqueness;
    private final double validity;
    private final double overall;

    public QualityScore(double completeness, double uniqueness, double validity) {
        this.completeness = clamp(completeness);
        this.uniqueness = clamp(uniqueness);
        this.validity = clamp(validity);
        this.overall = clamp(COMPLETENESS_WEIGHT * this.completeness
                + UNIQUENESS_WEIGHT * this.uniqueness
                + VALIDITY_WEIGHT * this.validity);
    }

    public static QualityScore empty() {
        return EMPTY;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }

    public double getCompleteness() {
        return completeness;
    }

    public double getUniqueness() {
        return uniqueness;
    }

    public double getValidity() {
        return validity;
    }

    public double getOverall() {
        return overall;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "QualityScore{overall=%.2f, completeness=%.2f, uniqueness=%.2f, validity=%.2f}",
                overall, completeness, uniqueness, validity);
    }
}
