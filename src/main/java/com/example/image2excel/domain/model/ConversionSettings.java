package com.example.image2excel.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fully resolved settings for one run: configured defaults, the selected preset and per-run
 * overrides already merged. Components read settings only from this value.
 *
 * @param inputFile       image file or directory to convert
 * @param outputFile      explicit workbook file or directory, empty to derive it from the input
 * @param outputWidth     desired image width in pixels
 * @param outputHeight    desired image height in pixels
 * @param outputZoom      initial sheet zoom in percent
 * @param outputColWidth  column width in characters
 * @param outputRowHeight row height in points
 * @param enlarge         whether images smaller than the desired size are enlarged
 * @param preset          name of the applied preset, {@code null} when none
 * @param batchMode       whether the input names a directory
 * @param maxImagePixels  largest accepted width times height
 */
public record ConversionSettings(
        String inputFile,
        String outputFile,
        int outputWidth,
        int outputHeight,
        double outputZoom,
        double outputColWidth,
        double outputRowHeight,
        boolean enlarge,
        String preset,
        boolean batchMode,
        long maxImagePixels
) {

    public boolean hasOutputFile() {
        return outputFile != null && !outputFile.isBlank();
    }

    public ConversionSettings withBatchMode(boolean newBatchMode) {
        return new ConversionSettings(inputFile, outputFile, outputWidth, outputHeight, outputZoom,
                outputColWidth, outputRowHeight, enlarge, preset, newBatchMode, maxImagePixels);
    }

	/**
	 * Lists every effective setting under its command line name, in a stable order.
	 *
	 * @return ordered setting name to display value
	 */
    public Map<String, String> describe() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("input_file", nullToEmpty(inputFile));
        values.put("output_file", nullToEmpty(outputFile));
        values.put("output_zoom", String.valueOf(outputZoom));
        values.put("output_col_width", String.valueOf(outputColWidth));
        values.put("output_row_height", String.valueOf(outputRowHeight));
        values.put("output_height", String.valueOf(outputHeight));
        values.put("output_width", String.valueOf(outputWidth));
        values.put("enlarge", String.valueOf(enlarge));
        values.put("preset", preset == null ? "None" : preset);
        values.put("batch_mode", String.valueOf(batchMode));
        values.put("max_image_pixels", String.valueOf(maxImagePixels));
        return values;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
