package com.example.image2excel.domain.model;

/**
 * Stages a single image conversion passes through, in order.
 */
public enum ConversionState {
    LOADING,
    PLANNING,
    NORMALIZING,
    POPULATING,
    STYLING_METADATA,
    PERSISTING,
    DONE,
    FAILED
}
