package com.example.image2excel.domain.model;

import java.nio.file.Path;

/**
 * Result of converting one input file.
 *
 * @param inputFile      image that was converted
 * @param outputFile     workbook path, {@code null} when the run failed before it was derived
 * @param finalState     {@link ConversionState#DONE} or {@link ConversionState#FAILED}
 * @param failedIn       stage that failed, {@code null} on success
 * @param failureMessage message reported for the failure, {@code null} on success
 */
public record ConversionOutcome(
        Path inputFile,
        Path outputFile,
        ConversionState finalState,
        ConversionState failedIn,
        String failureMessage
) {

    public static ConversionOutcome done(Path inputFile, Path outputFile) {
        return new ConversionOutcome(inputFile, outputFile, ConversionState.DONE, null, null);
    }

    public static ConversionOutcome failed(Path inputFile, Path outputFile, ConversionState failedIn, String message) {
        return new ConversionOutcome(inputFile, outputFile, ConversionState.FAILED, failedIn, message);
    }

    public boolean processed() {
        return finalState == ConversionState.DONE;
    }
}
