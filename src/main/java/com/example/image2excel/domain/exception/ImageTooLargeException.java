package com.example.image2excel.domain.exception;

/**
 * Raised when an image header announces more pixels than the configured ceiling allows.
 * Thrown before any pixel data is decoded.
 */
public class ImageTooLargeException extends DomainException {

    private final long pixelCount;
    private final long maxPixels;

	/**
	 * Creates the exception describing the offending dimensions.
	 *
	 * @param width     width read from the image header
	 * @param height    height read from the image header
	 * @param maxPixels configured pixel ceiling
	 */
    public ImageTooLargeException(int width, int height, long maxPixels) {
        super(String.format("Image is too large to process (%d x %d exceeds %,d pixels), please try a smaller image.",
                width, height, maxPixels));
        this.pixelCount = (long) width * height;
        this.maxPixels = maxPixels;
    }

    public long getPixelCount() {
        return pixelCount;
    }

    public long getMaxPixels() {
        return maxPixels;
    }
}
