package com.marketpulse.survey.quality;

import java.util.List;
import java.util.Locale;

/**
 * Missing-value count of one column with up to ten sample row indices
 */
public final class MissingValueStats {
    public static final int MAX_SAMPLES = 10;

    private final String column;
    private final int count;
    private final double percentage;
    private final List<Integer> sampleRowIndices;

    public MissingValueStats(String column, int count, double percentage, List<Integer> sampleRowIndices) {
        this.column = column;
        this.count = count;
        this.percentage = percentage;
        List<Integer> samples = sampleRowIndices != null ? sampleRowIndices : List.of();
        this.sampleRowIndices = List.copyOf(samples.subList(0, Math.min(MAX_SAMPLES, samples.size())));
    }

    public String getColumn() {
        return column;
    }

    public int getCount() {
        return count;
    }

    public double getPercentage() {
        return percentage;
    }

    public List<Integer> getSampleRowIndices() {
        return sampleRowIndices;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "MissingValueStats{column='%s', count=%d, percentage=%.2f}",
                column, count, percentage);
    }
}
