package com.example.image2excel.interfaces.api;

import com.example.image2excel.domain.model.GradientRule;
import com.example.image2excel.domain.model.GridDocument;
import com.example.image2excel.domain.model.MetadataTable;

import java.util.List;

/**
 * API-layer DTO summarizing a conversion without the cell values.
 *
 * @param gridWidth         number of grid columns
 * @param gridHeight        number of grid rows
 * @param spreadsheetRange  A1-style block holding the grid
 * @param zoomPercent       initial zoom of the image sheet
 * @param rules             one entry per color rule
 * @param information       Information sheet rows, in order
 */
public record ConversionDescription(
        int gridWidth,
        int gridHeight,
        String spreadsheetRange,
        int zoomPercent,
        List<RuleSummary> rules,
        List<MetadataTable.Entry> information
) {

    /**
     * One color rule: its channel, the full-intensity color and how many ranges it covers.
     */
    public record RuleSummary(String channel, String color, int rangeCount) {

        static RuleSummary of(GradientRule rule) {
            return new RuleSummary(rule.channel().name(), rule.channel().fullColorHex(), rule.ranges().size());
        }
    }

	/**
	 * Builds the description of a finished document.
	 *
	 * @param document      finished document
	 * @param gridRange     A1-style block holding the grid
	 * @return description ready to serialize
	 */
    public static ConversionDescription of(GridDocument document, String gridRange) {
        return new ConversionDescription(
                document.grid().width(),
                document.grid().height(),
                gridRange,
                document.layout().zoomPercent(),
                document.rules().stream().map(RuleSummary::of).toList(),
                document.metadata().entries()
        );
    }
}
