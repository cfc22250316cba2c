package com.marketpulse.survey.model;

/**
 * Classification of a source row
 * SECTION, SUBCATEGORY and DETAIL form the hierarchy; the rest only occur on dropped rows
 */
public enum RowLevel {
    SECTION(0),
    SUBCATEGORY(1),
    DETAIL(2),
    FOOTNOTE(-1),
    BLANK(-1),
    ERROR_MARGIN(-1),
    GARBAGE(-1);

    private final int depth;

    RowLevel(int depth) {
        this.depth = depth;
    }

    /**
     * Hierarchy depth: 0 for sections, 1 for subcategories, 2 for details, -1 otherwise
     */
    public int getDepth() {
        return depth;
    }

    public boolean isHierarchical() {
        return depth >= 0;
    }
}
