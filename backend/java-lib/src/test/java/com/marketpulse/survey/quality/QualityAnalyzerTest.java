package com.marketpulse.survey.quality;

import com.marketpulse.survey.InvalidConfigurationException;
import com.marketpulse.survey.model.ColumnSpec;
import com.marketpulse.survey.model.ColumnType;
import com.marketpulse.survey.model.IssueKind;
import com.marketpulse.survey.model.NormalizedTable;
import com.marketpulse.survey.model.QualityIssue;
import com.marketpulse.survey.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class QualityAnalyzerTest {

    private final QualityAnalyzer analyzer = new QualityAnalyzer();

    private static NormalizedTable amounts(Double... values) {
        NormalizedTable.Builder builder = NormalizedTable.builder("amounts")
                .column(ColumnSpec.identifier("id", ColumnType.NUMERIC))
                .column(ColumnSpec.measure("amount"));
        for (int i = 0; i < values.length; i++) {
            builder.row(i + 1, values[i]);
        }
        return builder.build();
    }

    @Nested
    @DisplayName("outliers")
    class Outliers {

        @Test
        void shouldFlagOnlyTheExtremeValue() {
            // GIVEN
            NormalizedTable table = amounts(10.0, 12.0, 11.0, 13.0, 1000.0);

            // WHEN
            List<Integer> outliers = analyzer.detectOutliers(table, "amount", 1.5);

            // THEN
            assertThat(outliers).containsExactly(4);
        }

        @Test
        void shouldNeverGrowWithLargerMultiplier() {
            NormalizedTable table = amounts(1.0, 2.0, 2.5, 3.0, 3.2, 8.0, 15.0, 40.0, null, 120.0);

            int previous = Integer.MAX_VALUE;
            for (double multiplier : new double[]{0.1, 0.5, 1.0, 1.5, 3.0, 10.0}) {
                List<Integer> outliers = analyzer.detectOutliers(table, "amount", multiplier);
                assertThat(outliers.size()).isLessThanOrEqualTo(previous);
                previous = outliers.size();
            }
        }

        @Test
        void shouldIgnoreMissingValues() {
            NormalizedTable table = amounts(null, null);

            assertThat(analyzer.detectOutliers(table, "amount", 1.5)).isEmpty();
        }

        @Test
        void shouldRejectBadArguments() {
            NormalizedTable table = amounts(1.0, 2.0);
            NormalizedTable withText = NormalizedTable.builder("t")
                    .column(ColumnSpec.text("city"))
                    .row("Haifa")
                    .build();

            assertThatThrownBy(() -> analyzer.detectOutliers(table, "amount", 0))
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> analyzer.detectOutliers(table, "price", 1.5))
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> analyzer.detectOutliers(withText, "city", 1.5))
                    .isInstanceOf(InvalidConfigurationException.class);
            assertThatThrownBy(() -> new QualityAnalyzer(-1.0, List.of()))
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        void shouldSkipIdentifierColumns() {
            NormalizedTable table = amounts(10.0, 12.0, 11.0, 13.0, 1000.0);

            Map<String, List<Integer>> outliers = analyzer.detectAllOutliers(table, 1.5);

            assertThat(outliers).containsOnlyKeys("amount");
        }
    }

    @Nested
    @DisplayName("missing values and duplicates")
    class MissingAndDuplicates {

        @Test
        void shouldReportMissingCountsPerColumn() {
            NormalizedTable table = amounts(1.0, null, 3.0, null);

            Map<String, MissingValueStats> missing = analyzer.detectMissing(table);

            assertThat(missing).containsOnlyKeys("amount");
            MissingValueStats stats = missing.get("amount");
            assertThat(stats.getCount()).isEqualTo(2);
            assertThat(stats.getPercentage()).isEqualTo(50.0);
            assertThat(stats.getSampleRowIndices()).containsExactly(1, 3);
        }

        @Test
        void shouldCapMissingSamples() {
            Double[] values = new Double[25];
            NormalizedTable table = amounts(values);

            MissingValueStats stats = analyzer.detectMissing(table).get("amount");

            assertThat(stats.getCount()).isEqualTo(25);
            assertThat(stats.getSampleRowIndices()).hasSize(MissingValueStats.MAX_SAMPLES);
        }

        @Test
        void shouldGroupDuplicatesByKeyColumns() {
            NormalizedTable table = NormalizedTable.builder("orders")
                    .column(ColumnSpec.identifier("id", ColumnType.NUMERIC))
                    .column(ColumnSpec.text("v"))
                    .row(1, "A")
                    .row(1, "B")
                    .row(2, "C")
                    .row(1, "D")
                    .build();

            assertThat(analyzer.detectDuplicates(table, List.of("id"))).containsExactly(0, 1, 3);
            assertThat(analyzer.detectDuplicates(table, List.of())).containsExactly(0, 1, 3);
            assertThat(analyzer.detectDuplicates(table, List.of("id", "v"))).isEmpty();
        }

        @Test
        void shouldUseWholeRowWithoutIdentifiers() {
            NormalizedTable table = NormalizedTable.builder("flat")
                    .column(ColumnSpec.text("city"))
                    .column(ColumnSpec.measure("income"))
                    .row("Haifa", 10)
                    .row("Haifa", 10)
                    .row("Haifa", 11)
                    .build();

            assertThat(analyzer.detectDuplicates(table, null)).containsExactly(0, 1);
        }

        @Test
        void shouldCompareWholeRowsWhenOnlyLabelsRepeat() {
            NormalizedTable table = NormalizedTable.builder("spend")
                    .column(ColumnSpec.label("category"))
                    .column(ColumnSpec.measure("total"))
                    .row("Other", 4.0)
                    .row("Bread", 7.0)
                    .row("Other", 9.0)
                    .row("Bread", 7.0)
                    .build();

            assertThat(analyzer.detectDuplicates(table, null)).containsExactly(1, 3);
            assertThat(analyzer.computeQualityScore(table).getUniqueness()).isCloseTo(75.0, within(1e-9));
        }

        @Test
        void shouldRejectUnknownKeyColumn() {
            assertThatThrownBy(() -> analyzer.detectDuplicates(amounts(1.0), List.of("name")))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("name");
        }
    }

    @Nested
    @DisplayName("quality score")
    class Score {

        @Test
        void shouldWeighComponents() {
            // 10 rows, 2 columns, one missing amount, one duplicate id, one outlier
            NormalizedTable table = NormalizedTable.builder("scored")
                    .column(ColumnSpec.identifier("id", ColumnType.NUMERIC))
                    .column(ColumnSpec.measure("amount"))
                    .row(1, 10.0).row(2, 11.0).row(3, 12.0).row(4, 10.5).row(5, 11.5)
                    .row(6, 12.5).row(7, 11.0).row(8, null).row(9, 500.0).row(9, 10.0)
                    .build();

            QualityScore score = analyzer.computeQualityScore(table);

            assertThat(score.getCompleteness()).isCloseTo(95.0, within(1e-9));
            assertThat(score.getUniqueness()).isCloseTo(90.0, within(1e-9));
            assertThat(score.getValidity()).isCloseTo(90.0, within(1e-9));
            assertThat(score.getOverall()).isCloseTo(0.4 * 95 + 0.3 * 90 + 0.3 * 90, within(1e-9));
        }

        @Test
        void shouldScoreEmptyTableAsZero() {
            NormalizedTable empty = amounts();

            QualityScore score = analyzer.computeQualityScore(empty);

            assertThat(score.getCompleteness()).isZero();
            assertThat(score.getUniqueness()).isZero();
            assertThat(score.getValidity()).isZero();
            assertThat(score.getOverall()).isZero();
        }

        @Test
        void shouldStayWithinBounds() {
            List<NormalizedTable> tables = List.of(amounts(1.0), amounts(null, null, null),
                    amounts(1.0, 1.0, 1.0, 900.0), amounts(5.0, null, 7.0, 1e9, 0.0));

            for (NormalizedTable table : tables) {
                QualityScore score = analyzer.computeQualityScore(table);
                for (double component : new double[]{score.getCompleteness(), score.getUniqueness(),
                        score.getValidity(), score.getOverall()}) {
                    assertThat(component).isBetween(0.0, 100.0);
                }
            }
        }
    }

    @Test
    void shouldCollectIssuesInOnePass() {
        NormalizedTable table = amounts(10.0, 12.0, null, 13.0, 1000.0, 11.0)
                .withIssues(List.of(new QualityIssue(IssueKind.CHECKSUM_MISMATCH, 0, "amount", Severity.WARNING,
                        "sum off")));

        QualityAssessment assessment = analyzer.analyze(table);

        assertThat(assessment.getRowCount()).isEqualTo(6);
        assertThat(assessment.getMissingCount()).isEqualTo(1);
        assertThat(assessment.getOutliers()).containsEntry("amount", List.of(4));
        assertThat(assessment.getIssues(IssueKind.MISSING_VALUE)).hasSize(1);
        assertThat(assessment.getIssues(IssueKind.OUTLIER)).extracting(QualityIssue::getRowIndex).containsExactly(4);
        assertThat(assessment.getIssues(IssueKind.CHECKSUM_MISMATCH)).hasSize(1);
        assertThat(assessment.getIssues(IssueKind.DUPLICATE)).isEmpty();
    }

    @Test
    void shouldNotModifyAnalyzedTable() {
        NormalizedTable table = amounts(10.0, null, 1000.0);
        NormalizedTable copy = amounts(10.0, null, 1000.0);

        analyzer.analyze(table);
        analyzer.analyze(table);

        assertThat(table).isEqualTo(copy);
    }
}
