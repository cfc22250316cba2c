package com.marketpulse.survey.model;

import java.util.List;

/**
 * Raw cell grid read from one spreadsheet sheet
 * Cells are String, Number or null, addressed by (row, column)
 */
public class RawGrid {
    private final Object[][] cells;
    private final int rowCount;
    private final int columnCount;
    private final String sheetName;

    // Constructor with cells and sheet name
    public RawGrid(Object[][] cells, String sheetName) {
        Object[][] source = cells != null ? cells : new Object[0][0];
        int width = 0;
        for (Object[] row : source) {
            if (row != null) {
                width = Math.max(width, row.length);
            }
        }
        this.cells = new Object[source.length][];
        for (int r = 0; r < source.length; r++) {
            Object[] padded = new Object[width];
            if (source[r] != null) {
                System.arraycopy(source[r], 0, padded, 0, source[r].length);
            }
            this.cells[r] = padded;
        }
        this.rowCount = source.length;
        this.columnCount = width;
        this.sheetName = sheetName != null ? sheetName : "";
    }

    // Simple constructor
    public RawGrid(Object[][] cells) {
        this(cells, "");
    }

    public static RawGrid of(List<? extends List<?>> rows) {
        Object[][] cells = new Object[rows.size()][];
        for (int r = 0; r < rows.size(); r++) {
            List<?> row = rows.get(r);
            cells[r] = row != null ? row.toArray() : new Object[0];
        }
        return new RawGrid(cells);
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public String getSheetName() {
        return sheetName;
    }

    public boolean hasSheetName() {
        return !sheetName.isEmpty();
    }

    // Out-of-range addresses read as empty cells
    public Object getCell(int row, int column) {
        if (row >= 0 && row < rowCount && column >= 0 && column < columnCount) {
            return cells[row][column];
        }
        return null;
    }

    public Object[] getRow(int row) {
        if (row < 0 || row >= rowCount) {
            return new Object[columnCount];
        }
        return cells[row].clone();
    }

    /**
     * Whether a raw cell carries no content: null, a blank string or NaN
     */
    public static boolean isEmptyCell(Object cell) {
        if (cell == null) {
            return true;
        }
        if (cell instanceof String) {
            String text = ((String) cell).strip();
            return text.isEmpty() || text.equalsIgnoreCase("nan");
        }
        if (cell instanceof Double) {
            return ((Double) cell).isNaN();
        }
        if (cell instanceof Float) {
            return ((Float) cell).isNaN();
        }
        return false;
    }

    public int countNonEmpty(int row) {
        int count = 0;
        for (int c = 0; c < columnCount; c++) {
            if (!isEmptyCell(getCell(row, c))) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return String.format("RawGrid{sheet='%s', rows=%d, columns=%d}", sheetName, rowCount, columnCount);
    }
}
