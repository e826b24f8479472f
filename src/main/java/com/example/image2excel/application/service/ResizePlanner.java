package com.example.image2excel.application.service;

import com.example.image2excel.domain.model.ResizePlan;
import org.springframework.stereotype.Service;

/**
 * Computes the aspect-preserving size an image is scaled to before it becomes a grid.
 */
@Service
public class ResizePlanner {

	/**
	 * Plans the resize-to-fit of a {@code width x height} image into the desired bounds.
	 * The limiting axis decides the factor, so the aspect ratio is kept. Without
	 * {@code allowEnlarge} the factor never exceeds 1.
	 *
	 * @param width         source width, positive
	 * @param height        source height, positive
	 * @param desiredWidth  bounding width, positive
	 * @param desiredHeight bounding height, positive
	 * @param allowEnlarge  whether images smaller than the bounds may grow
	 * @return target dimensions, each at least 1, and the applied factor
	 */
    public ResizePlan plan(int width, int height, int desiredWidth, int desiredHeight, boolean allowEnlarge) {
        requirePositive(width, "width");
        requirePositive(height, "height");
        requirePositive(desiredWidth, "desiredWidth");
        requirePositive(desiredHeight, "desiredHeight");

        double horizontalFactor = (double) desiredWidth / width;
        double verticalFactor = (double) desiredHeight / height;
        if (!allowEnlarge) {
            horizontalFactor = Math.min(1.0, horizontalFactor);
            verticalFactor = Math.min(1.0, verticalFactor);
        }

        double scaleFactor = Math.min(horizontalFactor, verticalFactor);
        int targetWidth = (int) Math.max(1, Math.round(width * scaleFactor));
        int targetHeight = (int) Math.max(1, Math.round(height * scaleFactor));
        return new ResizePlan(targetWidth, targetHeight, scaleFactor);
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
