package com.marketpulse.survey.quality;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Percentiles with linear interpolation between closest ranks
 */
final class Percentiles {

    private Percentiles() {
    }

    /**
     * @param values   the sample, in any order; must not be empty
     * @param fraction the percentile as a fraction in [0, 1]
     */
    static double percentile(List<Double> values, double fraction) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute a percentile of no values");
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        double position = fraction * (sorted.size() - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double lowerValue = sorted.get(lower);
        return lowerValue + (sorted.get(upper) - lowerValue) * (position - lower);
    }

    static double median(List<Double> values) {
        return percentile(values, 0.5);
    }
}
