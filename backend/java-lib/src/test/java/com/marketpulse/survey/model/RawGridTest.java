package com.marketpulse.survey.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RawGridTest {

    @Test
    void shouldPadRaggedRows() {
        RawGrid grid = RawGrid.of(List.of(
                Arrays.asList("Title"),
                Arrays.asList("Item", "a", "b")));

        assertThat(grid.getRowCount()).isEqualTo(2);
        assertThat(grid.getColumnCount()).isEqualTo(3);
        assertThat(grid.getCell(0, 2)).isNull();
        assertThat(grid.getCell(5, 0)).isNull();
        assertThat(grid.getRow(0)).hasSize(3);
    }

    @Test
    void shouldNotExposeInternalRows() {
        RawGrid grid = RawGrid.of(List.of(Arrays.asList("a", "b")));

        grid.getRow(0)[0] = "changed";

        assertThat(grid.getCell(0, 0)).isEqualTo("a");
    }

    @Test
    void shouldCountOnlyNonEmptyCells() {
        RawGrid grid = RawGrid.of(List.of(Arrays.asList("x", " ", null, "nan", Double.NaN, 0)));

        assertThat(grid.countNonEmpty(0)).isEqualTo(2);
        assertThat(RawGrid.isEmptyCell(0)).isFalse();
    }
}
