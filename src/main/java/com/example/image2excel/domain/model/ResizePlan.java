package com.example.image2excel.domain.model;

/**
 * Outcome of the resize-to-fit computation.
 *
 * @param targetWidth  width after resizing, at least 1
 * @param targetHeight height after resizing, at least 1
 * @param scaleFactor  applied factor; 1.0 means the image keeps its size
 */
public record ResizePlan(int targetWidth, int targetHeight, double scaleFactor) {

    public boolean changesSize(int width, int height) {
        return width != targetWidth || height != targetHeight;
    }
}
