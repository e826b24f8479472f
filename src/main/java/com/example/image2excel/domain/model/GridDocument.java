package com.example.image2excel.domain.model;

import java.util.List;

/**
 * Finished in-memory spreadsheet: the image grid with its color rules and layout, plus the
 * information table. Handed once to the workbook writer.
 */
public record GridDocument(
        ChannelGrid grid,
        List<GradientRule> rules,
        DocumentLayout layout,
        MetadataTable metadata
) {

    public static final String IMAGE_SHEET = "Image";
    public static final String INFORMATION_SHEET = "Information";

    public GridDocument {
        rules = List.copyOf(rules);
    }
}
