package com.marketpulse.survey.extractor;

import com.marketpulse.survey.InvalidConfigurationException;
import com.marketpulse.survey.model.RawGrid;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableLocatorTest {

    private final TableLocator locator = new TableLocator(NormalizerConfig.defaults());

    @Test
    void shouldFindHeaderFollowedByData() {
        // GIVEN
        RawGrid grid = RawGrid.of(List.of(
                row("TABLE 1.1 - Money expenditure per household"),
                row("Source: household expenditure survey"),
                row(),
                row("Item", "Special shop", "Supermarket chain", "Grocery", "Market", "Total"),
                row("Food", "30.4", "51.1", "11.4", "7.1", "100.0")));

        // WHEN
        Anchor anchor = locator.detectAnchorRow(grid, 20);

        // THEN
        assertThat(anchor.getRowIndex()).isEqualTo(3);
        assertThat(anchor.isConfident()).isTrue();
        assertThat(anchor.getMethod()).isEqualTo(Anchor.Method.HEADER_THEN_DATA);
    }

    @Test
    void shouldFindQuintileLabelRow() {
        RawGrid grid = RawGrid.of(List.of(
                row("Quintiles of net income per standard person"),
                row(null, 5, "4", 3.0, "2", "1", "Total"),
                row("Households in population", null, null, null, null, null, null)));

        Anchor anchor = locator.detectAnchorRow(grid, 20);

        assertThat(anchor.getRowIndex()).isEqualTo(1);
        assertThat(anchor.getMethod()).isEqualTo(Anchor.Method.QUINTILE_LABELS);
    }

    @Test
    void shouldPreferEarliestQualifyingRow() {
        RawGrid grid = RawGrid.of(List.of(
                row("a", "b", "c", "d", "e"),
                row("1", "2", "3", "4", "5"),
                row("Food", "1", "2", "3", "4")));

        Anchor anchor = locator.detectAnchorRow(grid, 20);

        assertThat(anchor.getRowIndex()).isEqualTo(0);
    }

    @Test
    void shouldFallBackToDefaultRowWithLowConfidence() {
        RawGrid grid = RawGrid.of(List.of(
                row("Title"),
                row("Subtitle"),
                row("x", "y")));

        Anchor anchor = locator.detectAnchorRow(grid, 20);

        assertThat(anchor.isConfident()).isFalse();
        assertThat(anchor.getRowIndex()).isEqualTo(NormalizerConfig.defaults().getDefaultAnchorRow());
        assertThat(anchor.getMethod()).isEqualTo(Anchor.Method.FALLBACK);
    }

    @Test
    void shouldOnlyScanConfiguredWindow() {
        RawGrid grid = RawGrid.of(List.of(
                row("Title"),
                row("Notes"),
                row("Item", "a", "b", "c", "d", "e"),
                row("Food", "1", "2", "3", "4", "5")));

        assertThat(locator.detectAnchorRow(grid, 2).isConfident()).isFalse();
        assertThat(locator.detectAnchorRow(grid, 3).getRowIndex()).isEqualTo(2);
    }

    @Test
    void shouldNotFailOnEmptyGrid() {
        Anchor anchor = locator.detectAnchorRow(RawGrid.of(List.of()), 20);

        assertThat(anchor.isConfident()).isFalse();
    }

    @Test
    void shouldRejectNonPositiveScanWindow() {
        RawGrid grid = RawGrid.of(List.of(row("Title")));

        assertThatThrownBy(() -> locator.detectAnchorRow(grid, 0))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("maxScanRows");
    }

    private static List<Object> row(Object... cells) {
        return Arrays.asList(cells);
    }
}
