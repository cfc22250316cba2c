package com.marketpulse.survey.quality;

import com.marketpulse.survey.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OutlierBoundsTest {

    private static final List<Double> SAMPLE = List.of(10.0, 12.0, 11.0, 13.0, 1000.0);

    @Test
    void shouldInterpolateQuartiles() {
        OutlierBounds bounds = OutlierBounds.of(SAMPLE, 1.5);

        assertThat(bounds.getQ1()).isEqualTo(11.0);
        assertThat(bounds.getQ3()).isEqualTo(13.0);
        assertThat(bounds.getLower()).isEqualTo(8.0);
        assertThat(bounds.getUpper()).isEqualTo(16.0);
    }

    @Test
    void shouldTreatBoundsAsInclusive() {
        OutlierBounds bounds = OutlierBounds.of(SAMPLE, 1.5);

        assertThat(bounds.isOutlier(16.0)).isFalse();
        assertThat(bounds.isOutlier(8.0)).isFalse();
        assertThat(bounds.isOutlier(16.01)).isTrue();
        assertThat(bounds.clamp(1000.0)).isEqualTo(16.0);
        assertThat(bounds.clamp(12.0)).isEqualTo(12.0);
    }

    @Test
    void shouldComputeMedianOfEvenSample() {
        assertThat(Percentiles.median(List.of(4.0, 1.0, 3.0, 2.0))).isCloseTo(2.5, within(1e-9));
        assertThat(Percentiles.percentile(List.of(7.0), 0.25)).isEqualTo(7.0);
    }

    @Test
    void shouldRejectInvalidMultipliers() {
        assertThatThrownBy(() -> OutlierBounds.of(SAMPLE, 0.0)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> OutlierBounds.of(SAMPLE, -1.5)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> OutlierBounds.of(SAMPLE, Double.NaN))
                .isInstanceOf(InvalidConfigurationException.class);
    }
}
