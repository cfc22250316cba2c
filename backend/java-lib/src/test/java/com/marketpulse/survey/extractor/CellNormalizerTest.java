package com.marketpulse.survey.extractor;

import com.marketpulse.survey.model.CellFlag;
import com.marketpulse.survey.model.NormalizedCell;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CellNormalizerTest {

    private final CellNormalizer normalizer = new CellNormalizer();

    @Nested
    @DisplayName("empty and suppressed cells")
    class EmptyCells {

        @Test
        void shouldTreatBlankAndNanAsEmpty() {
            assertThat(normalizer.normalizeCell(null)).isEqualTo(NormalizedCell.empty());
            assertThat(normalizer.normalizeCell("   ")).isEqualTo(NormalizedCell.empty());
            assertThat(normalizer.normalizeCell("NaN")).isEqualTo(NormalizedCell.empty());
            assertThat(normalizer.normalizeCell(Double.NaN)).isEqualTo(NormalizedCell.empty());
        }

        @Test
        void shouldMarkSuppressedValuesWithoutZeroing() {
            NormalizedCell dots = normalizer.normalizeCell("..");
            NormalizedCell dash = normalizer.normalizeCell(" - ");

            assertThat(dots.getValue()).isNull();
            assertThat(dots.hasFlag(CellFlag.SUPPRESSED)).isTrue();
            assertThat(dash.getValue()).isNull();
            assertThat(dash.hasFlag(CellFlag.SUPPRESSED)).isTrue();
        }

        @Test
        void shouldReturnEmptyWithoutFlagsForUnparsableText() {
            NormalizedCell cell = normalizer.normalizeCell("n/a (see note)");

            assertThat(cell.hasValue()).isFalse();
            assertThat(cell.getFlags()).isEmpty();
        }

        @Test
        void shouldFlagErrorMarginCells() {
            NormalizedCell cell = normalizer.normalizeCell("±1.3");

            assertThat(cell.getValue()).isNull();
            assertThat(cell.hasFlag(CellFlag.ERROR_MARGIN)).isTrue();
        }
    }

    @Nested
    @DisplayName("numeric cells")
    class NumericCells {

        @Test
        void shouldKeepParenthesizedValuePositiveAndFlagLowReliability() {
            // WHEN
            NormalizedCell cell = normalizer.normalizeCell("(5.2)");

            // THEN
            assertThat(cell.getValue()).isEqualTo(5.2);
            assertThat(cell.hasFlag(CellFlag.LOW_RELIABILITY)).isTrue();
        }

        @Test
        void shouldStripThousandsSeparators() {
            assertThat(normalizer.normalizeCell("12,345.6").getValue()).isEqualTo(12345.6);
            assertThat(normalizer.normalizeCell("1 234").getValue()).isEqualTo(1234.0);
            assertThat(normalizer.normalizeCell("(2,500)").getValue()).isEqualTo(2500.0);
        }

        @Test
        void shouldStoreNegativeNumbersAsAbsoluteValues() {
            assertThat(normalizer.normalizeCell("-7.5").getValue()).isEqualTo(7.5);
            assertThat(normalizer.normalizeCell(-3).getValue()).isEqualTo(3.0);
        }

        @Test
        void shouldNotPassNegativeValueThroughPrebuiltCell() {
            NormalizedCell built = NormalizedCell.of(-12.5, Set.of(CellFlag.LOW_RELIABILITY));

            NormalizedCell normalized = normalizer.normalizeCell(built);

            assertThat(normalized.getValue()).isEqualTo(12.5);
            assertThat(normalized.hasFlag(CellFlag.LOW_RELIABILITY)).isTrue();
            assertThat(normalizer.normalizeCell(NormalizedCell.of(-4.0)).getValue()).isEqualTo(4.0);
            assertThat(NormalizedCell.lowReliability(-1.0).getValue()).isEqualTo(1.0);
        }

        @Test
        void shouldAcceptNumbersAndNonBreakingSpaces() {
            assertThat(normalizer.normalizeCell(42).getValue()).isEqualTo(42.0);
            assertThat(normalizer.normalizeCell("\u00A030.4\u00A0").getValue()).isEqualTo(30.4);
        }

        @Test
        void shouldBeIdempotentOnNormalizedValues() {
            for (Object raw : List.of("(5.2)", "11.4", "..", 17, "1,000")) {
                NormalizedCell once = normalizer.normalizeCell(raw);
                NormalizedCell twice = normalizer.normalizeCell(once);
                assertThat(twice).isEqualTo(once);
                if (once.hasValue()) {
                    assertThat(normalizer.normalizeCell(once.getValue()).getValue()).isEqualTo(once.getValue());
                }
            }
        }
    }

    @Test
    void shouldSkipLabelColumnWhenNormalizingRow() {
        Object[] row = {"Food", "30.4", "(1.1)", null};

        List<NormalizedCell> cells = normalizer.normalizeValues(row, 0);

        assertThat(cells).hasSize(3);
        assertThat(cells.get(0).getValue()).isEqualTo(30.4);
        assertThat(cells.get(1).hasFlag(CellFlag.LOW_RELIABILITY)).isTrue();
        assertThat(cells.get(2).hasValue()).isFalse();
    }

    @Test
    void shouldUseConfiguredSuppressedMarkers() {
        CellNormalizer custom = new CellNormalizer(NormalizerConfig.builder()
                .suppressedMarkers(List.of("x"))
                .build());

        assertThat(custom.normalizeCell("x").hasFlag(CellFlag.SUPPRESSED)).isTrue();
        assertThat(custom.normalizeCell("..").getFlags()).isEmpty();
    }
}
