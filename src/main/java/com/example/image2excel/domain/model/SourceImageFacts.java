package com.example.image2excel.domain.model;

/**
 * Facts about the source file reported on the Information sheet.
 *
 * @param location       path or upload name of the source image
 * @param fileSizeBytes  size of the encoded file
 * @param format         format name reported by the decoder, e.g. {@code png}
 * @param originalWidth  width before resizing
 * @param originalHeight height before resizing
 */
public record SourceImageFacts(
        String location,
        long fileSizeBytes,
        String format,
        int originalWidth,
        int originalHeight
) {
}
