package com.example.image2excel.domain.model;

/**
 * Sheet-wide sizing and view settings for the image sheet.
 *
 * @param rowHeight         row height in points, applied as the sheet default
 * @param columnWidth       column width in characters, applied as the sheet default
 * @param zoomPercent       initial zoom
 * @param hiddenColumnStart first hidden column (1-based), or 0 when the grid fills every column
 * @param hiddenColumnEnd   last hidden column (1-based), the format's last column
 * @param showGridLines     whether grid lines are drawn
 * @param showHeadings      whether row and column headings are drawn
 */
public record DocumentLayout(
        double rowHeight,
        double columnWidth,
        int zoomPercent,
        int hiddenColumnStart,
        int hiddenColumnEnd,
        boolean showGridLines,
        boolean showHeadings
) {

    public boolean hasHiddenColumns() {
        return hiddenColumnStart > 0 && hiddenColumnStart <= hiddenColumnEnd;
    }
}
