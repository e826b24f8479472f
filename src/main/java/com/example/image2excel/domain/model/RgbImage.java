package com.example.image2excel.domain.model;

import java.util.Arrays;

/**
 * Immutable RGB raster. Produced by the resampler after resizing and RGB normalization,
 * consumed once by the grid populator.
 */
public final class RgbImage {

    private final int width;
    private final int height;
    private final int[] pixels;

    private RgbImage(int width, int height, int[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

	/**
	 * Creates an image from row-major packed {@code 0xRRGGBB} values.
	 *
	 * @param width  image width, at least 1
	 * @param height image height, at least 1
	 * @param packed row-major pixels, {@code width * height} entries; copied
	 * @return immutable image
	 */
    public static RgbImage ofPacked(int width, int height, int[] packed) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + " x " + height);
        }
        if (packed.length != Math.multiplyExact(width, height)) {
            throw new IllegalArgumentException("Expected " + width * height + " pixels but got " + packed.length);
        }
        int[] copy = new int[packed.length];
        for (int i = 0; i < packed.length; i++) {
            copy[i] = packed[i] & 0xFFFFFF;
        }
        return new RgbImage(width, height, copy);
    }

	/**
	 * Creates an image where every pixel has the same color.
	 *
	 * @param width  image width
	 * @param height image height
	 * @param color  fill color
	 * @return immutable image
	 */
    public static RgbImage filled(int width, int height, Rgb color) {
        int[] packed = new int[Math.multiplyExact(width, height)];
        Arrays.fill(packed, color.packed());
        return ofPacked(width, height, packed);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public Rgb pixelAt(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside " + width + " x " + height);
        }
        return Rgb.fromPacked(pixels[y * width + x]);
    }
}
