package com.example.image2excel.domain.model;

/**
 * Per-run overrides supplied on the command line or with an upload. {@code null} fields keep the
 * configured defaults.
 */
public record ConversionRequest(
        String inputFile,
        String outputFile,
        Integer outputWidth,
        Integer outputHeight,
        Double outputZoom,
        Double outputColWidth,
        Double outputRowHeight,
        Boolean enlarge,
        String preset
) {

    public static ConversionRequest forInput(String inputFile) {
        return new ConversionRequest(inputFile, null, null, null, null, null, null, null, null);
    }
}
