package com.marketpulse.survey.quality;

import com.marketpulse.survey.InvalidConfigurationException;

import java.util.List;
import java.util.Locale;

/**
 * Interquartile-range fence [Q1 - m*IQR, Q3 + m*IQR] of one column
 */
public final class OutlierBounds {
    private final double q1;
    private final double q3;
    private final double multiplier;

    private OutlierBounds(double q1, double q3, double multiplier) {
        this.q1 = q1;
        this.q3 = q3;
        this.multiplier = multiplier;
    }

    /**
     * @param values     non-missing column values; must not be empty
     * @param multiplier IQR multiplier, 1.5 for review-grade detection, 3.0 for conservative capping
     * @throws InvalidConfigurationException if the multiplier is not a positive number
     */
    public static OutlierBounds of(List<Double> values, double multiplier) {
        requireValidMultiplier(multiplier);
        return new OutlierBounds(Percentiles.percentile(values, 0.25), Percentiles.percentile(values, 0.75),
                multiplier);
    }

    static void requireValidMultiplier(double multiplier) {
        if (!Double.isFinite(multiplier) || multiplier <= 0) {
            throw new InvalidConfigurationException("Outlier multiplier must be a positive number: " + multiplier);
        }
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    public double getIqr() {
        return q3 - q1;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public double getLower() {
        return q1 - multiplier * getIqr();
    }

    public double getUpper() {
        return q3 + multiplier * getIqr();
    }

    /**
     * True only for values strictly outside the fence
     */
    public boolean isOutlier(double value) {
        return value < getLower() || value > getUpper();
    }

    public double clamp(double value) {
        return Math.max(getLower(), Math.min(getUpper(), value));
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "OutlierBounds{q1=%.4f, q3=%.4f, multiplier=%.2f, lower=%.4f, upper=%.4f}",
                q1, q3, multiplier, getLower(), getUpper());
    }
}
