package com.marketpulse.survey.extractor;

import com.marketpulse.survey.model.CellFlag;
import com.marketpulse.survey.model.ClassifiedRow;
import com.marketpulse.survey.model.ColumnRole;
import com.marketpulse.survey.model.DropReason;
import com.marketpulse.survey.model.IssueKind;
import com.marketpulse.survey.model.NormalizedCell;
import com.marketpulse.survey.model.NormalizedTable;
import com.marketpulse.survey.model.QualityIssue;
import com.marketpulse.survey.model.RowLevel;
import com.marketpulse.survey.model.TableRow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TableAssemblerTest {

    private static final List<String> SHOP_COLUMNS = List.of(
            "special_shop", "supermarket_chain", "grocery", "market", "other", "total");

    private final NormalizerConfig percentConfig = NormalizerConfig.builder()
            .checksumMode(ChecksumMode.PERCENT_SHARES)
            .build();

    @Test
    void shouldNotRaiseChecksumMismatchWithinTolerance() {
        // GIVEN
        ClassifiedRow food = kept(5, "Food", RowLevel.SECTION, 30.4, 51.1, 11.4, 4.1, 2.1, 100.0);

        // WHEN
        NormalizedTable table = new TableAssembler(percentConfig).assemble(List.of(food), SHOP_COLUMNS, "shops");

        // THEN
        assertThat(table.getRowCount()).isEqualTo(1);
        assertThat(table.getIssues(IssueKind.CHECKSUM_MISMATCH)).isEmpty();
        assertThat(table.getRow(0).getNumber("supermarket_chain")).isEqualTo(51.1);
    }

    @Test
    void shouldAnnotateChecksumMismatchBeyondTolerance() {
        ClassifiedRow bread = kept(6, "Bread", RowLevel.SUBCATEGORY, 30.0, 40.0, 10.0, 5.0, 5.0, 100.0);

        NormalizedTable table = new TableAssembler(percentConfig).assemble(List.of(bread), SHOP_COLUMNS, "shops");

        List<QualityIssue> issues = table.getIssues(IssueKind.CHECKSUM_MISMATCH);
        assertThat(issues).hasSize(1);
        assertThat(issues.get(0).getRowIndex()).isZero();
        assertThat(issues.get(0).getColumn()).isEqualTo("total");
        assertThat(table.getRowCount()).isEqualTo(1);
    }

    @Test
    void shouldCompareAgainstDeclaredTotal() {
        NormalizerConfig declared = NormalizerConfig.builder()
                .checksumMode(ChecksumMode.DECLARED_TOTAL)
                .checksumTolerance(0.5)
                .build();
        List<ClassifiedRow> rows = List.of(
                kept(1, "Rent", RowLevel.SUBCATEGORY, 1200.0, 800.0, 2000.0),
                kept(2, "Repairs", RowLevel.SUBCATEGORY, 100.0, 50.0, 170.0));

        NormalizedTable table = new TableAssembler(declared).assemble(rows, List.of("a", "b", "total"), "costs");

        assertThat(table.getIssues(IssueKind.CHECKSUM_MISMATCH))
                .extracting(QualityIssue::getRowIndex)
                .containsExactly(1);
    }

    @Test
    void shouldKeepSourceOrderAndSkipDroppedRows() {
        // GIVEN
        List<ClassifiedRow> rows = new ArrayList<>(List.of(
                kept(3, "Food", RowLevel.SECTION, 10.0, 20.0, 30.0),
                kept(4, "Bread", RowLevel.SUBCATEGORY, 4.0, 6.0, 10.0),
                ClassifiedRow.dropped(5, "± 0.3", RowLevel.ERROR_MARGIN, DropReason.ERROR_MARGIN, List.of()),
                kept(6, "White bread, sliced", RowLevel.DETAIL, 1.0, 2.0, 3.0)));
        Collections.reverse(rows);

        // WHEN
        NormalizedTable table = new TableAssembler(NormalizerConfig.defaults())
                .assemble(rows, List.of("a", "b", "total"), "food");

        // THEN
        assertThat(table.getRows()).extracting(TableRow::getSourceRowIndex).containsExactly(3, 4, 6);
        assertThat(table.columnValues("category")).containsExactly("Food", "Bread", "White bread, sliced");
        assertThat(table.findColumn("category").getRole()).isEqualTo(ColumnRole.LABEL);
        assertThat(table.findColumn("total").getRole()).isEqualTo(ColumnRole.TOTAL);
        assertThat(table.findColumn("a").getRole()).isEqualTo(ColumnRole.MEASURE);
    }

    @Test
    void shouldExposeLevelsWithoutDoubleCounting() {
        List<ClassifiedRow> rows = List.of(
                kept(1, "Food", RowLevel.SECTION, 10.0, 20.0, 30.0),
                kept(2, "Bread", RowLevel.SUBCATEGORY, 4.0, 6.0, 10.0),
                kept(3, "Dairy", RowLevel.SUBCATEGORY, 6.0, 14.0, 20.0),
                kept(4, "Housing", RowLevel.SECTION, 50.0, 20.0, 70.0));

        NormalizedTable table = new TableAssembler(NormalizerConfig.defaults())
                .assemble(rows, List.of("a", "b", "total"), "spend");

        assertThat(table.rowsByLevel(RowLevel.SECTION)).hasSize(2);
        assertThat(table.sumByLevel("total", RowLevel.SECTION)).isEqualTo(100.0);
        assertThat(table.sumByLevel("total", RowLevel.SUBCATEGORY)).isEqualTo(30.0);
    }

    @Test
    void shouldSkipKeptRowsWithoutValuesOrTotal() {
        ClassifiedRow noValues = ClassifiedRow.kept(1, "Empty", RowLevel.SUBCATEGORY,
                List.of(NormalizedCell.empty(), NormalizedCell.empty(), NormalizedCell.empty()));
        ClassifiedRow noTotal = ClassifiedRow.kept(2, "Partial", RowLevel.SUBCATEGORY,
                List.of(NormalizedCell.of(1.0), NormalizedCell.of(2.0), NormalizedCell.empty()));

        NormalizedTable table = new TableAssembler(NormalizerConfig.defaults())
                .assemble(List.of(noValues, noTotal), List.of("a", "b", "total"), "t");

        assertThat(table.isEmpty()).isTrue();
    }

    @Test
    void shouldCarryCellFlagsIntoRows() {
        ClassifiedRow row = ClassifiedRow.kept(1, "Alcoholic beverages", RowLevel.SUBCATEGORY,
                List.of(NormalizedCell.lowReliability(5.2), NormalizedCell.suppressed(), NormalizedCell.of(9.0)));

        NormalizedTable table = new TableAssembler(NormalizerConfig.defaults())
                .assemble(List.of(row), List.of("a", "b", "total"), "t");

        assertThat(table.getRow(0).hasFlag("a", CellFlag.LOW_RELIABILITY)).isTrue();
        assertThat(table.getRow(0).hasFlag("b", CellFlag.SUPPRESSED)).isTrue();
        assertThat(table.getRow(0).isMissing("b")).isTrue();
    }

    @Test
    void shouldGeneratePositionalNames() {
        NormalizedTable table = new TableAssembler(NormalizerConfig.defaults())
                .assemble(List.of(kept(0, "Rent", RowLevel.SUBCATEGORY, 1.0, 2.0)));

        assertThat(table.getColumnNames()).containsExactly("category", "col_1", "col_2");
    }

    private static ClassifiedRow kept(int index, String label, RowLevel level, double... values) {
        List<NormalizedCell> cells = new ArrayList<>();
        for (double value : values) {
            cells.add(NormalizedCell.of(value));
        }
        return ClassifiedRow.kept(index, label, level, cells);
    }
}
