package com.marketpulse.survey.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NormalizedTableTest {

    private static NormalizedTable households() {
        return NormalizedTable.builder("households")
                .column(ColumnSpec.identifier("id", ColumnType.NUMERIC))
                .column(ColumnSpec.text("city"))
                .column(ColumnSpec.measure("income"))
                .row(1, "Tel Aviv", 12000)
                .row(2, null, 9500.5)
                .row(3, "Haifa", null)
                .build();
    }

    @Test
    void shouldBuildRowsInDeclaredOrder() {
        NormalizedTable table = households();

        assertThat(table.getColumnNames()).containsExactly("id", "city", "income");
        assertThat(table.getRowCount()).isEqualTo(3);
        assertThat(table.getRow(0).get("income")).isEqualTo(12000.0);
        assertThat(table.getRow(1).isMissing("city")).isTrue();
        assertThat(table.getRow(2).getSourceRowIndex()).isEqualTo(2);
        assertThat(table.getRow(0).hasLevel()).isFalse();
    }

    @Test
    void shouldReportNumericValuesWithoutMissing() {
        assertThat(households().numericValues("income")).containsExactly(12000.0, 9500.5);
    }

    @Test
    void shouldNotTreatLabelColumnAsIdentifier() {
        NormalizedTable labelled = NormalizedTable.builder("t")
                .column(ColumnSpec.label("category"))
                .column(ColumnSpec.measure("total"))
                .row("Food", 1.0)
                .build();

        assertThat(households().getIdentifierColumns()).containsExactly("id");
        assertThat(labelled.getIdentifierColumns()).isEmpty();
        assertThat(labelled.getNumericColumns()).extracting(ColumnSpec::getName).containsExactly("total");
    }

    @Test
    void shouldNotChangeOriginalWhenDerivingCopies() {
        NormalizedTable table = households();
        TableRow changed = table.getRow(1).withValue("city", "Eilat", CellFlag.IMPUTED);

        NormalizedTable copy = table.withRows(List.of(table.getRow(0), changed));

        assertThat(table.getRow(1).isMissing("city")).isTrue();
        assertThat(copy.getRowCount()).isEqualTo(2);
        assertThat(copy.getRow(1).getText("city")).isEqualTo("Eilat");
        assertThat(copy.getRow(1).hasFlag("city", CellFlag.IMPUTED)).isTrue();
        assertThat(copy).isNotEqualTo(table);
    }

    @Test
    void shouldRejectInconsistentStructure() {
        List<ColumnSpec> duplicated = List.of(ColumnSpec.text("a"), ColumnSpec.measure("a"));
        TableRow stray = new TableRow(0, Map.of("b", 1.0));

        assertThatThrownBy(() -> new NormalizedTable("t", duplicated, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new NormalizedTable("t", List.of(ColumnSpec.text("a")), List.of(stray)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'b'");
        assertThatThrownBy(() -> households().columnValues("missing"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSumOneLevelOnly() {
        List<ColumnSpec> columns = List.of(ColumnSpec.label("category"), ColumnSpec.total("total"));
        List<TableRow> rows = List.of(
                new TableRow(0, RowLevel.SECTION, Map.of("category", "Food", "total", 30.0), Map.of()),
                new TableRow(1, RowLevel.SUBCATEGORY, Map.of("category", "Bread", "total", 12.0), Map.of()),
                new TableRow(2, RowLevel.SUBCATEGORY, Map.of("category", "Dairy", "total", 18.0), Map.of()));

        NormalizedTable table = new NormalizedTable("spend", columns, rows);

        assertThat(table.sumByLevel("total", RowLevel.SECTION)).isEqualTo(30.0);
        assertThat(table.sumByLevel("total", RowLevel.SUBCATEGORY)).isEqualTo(30.0);
        assertThat(table.sumByLevel("total", RowLevel.DETAIL)).isZero();
    }
}
