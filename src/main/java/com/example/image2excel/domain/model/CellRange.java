package com.example.image2excel.domain.model;

/**
 * Rectangular block of cells in 1-based, inclusive spreadsheet coordinates.
 */
public record CellRange(int startColumn, int endColumn, int startRow, int endRow) {

    public CellRange {
        if (startColumn < 1 || startRow < 1 || endColumn < startColumn || endRow < startRow) {
            throw new IllegalArgumentException("Invalid cell range: columns " + startColumn + ".." + endColumn
                    + ", rows " + startRow + ".." + endRow);
        }
    }

	/**
	 * Creates a range covering one column from row 1 down to {@code rows}.
	 *
	 * @param column 1-based column
	 * @param rows   number of rows, at least 1
	 * @return single-column range
	 */
    public static CellRange column(int column, int rows) {
        return new CellRange(column, column, 1, rows);
    }

    public boolean isSingleColumn() {
        return startColumn == endColumn;
    }
}
