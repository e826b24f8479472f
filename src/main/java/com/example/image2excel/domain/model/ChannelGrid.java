package com.example.image2excel.domain.model;

/**
 * Matrix of per-channel intensities: {@code 3 * imageWidth} columns by {@code imageHeight} rows.
 * Created fully populated by the grid populator and read-only afterwards. Indices are 0-based.
 */
public final class ChannelGrid {

    private final int width;
    private final int height;
    private final int[] values;

    private ChannelGrid(int width, int height, int[] values) {
        this.width = width;
        this.height = height;
        this.values = values;
    }

	/**
	 * Wraps a fully written row-major value buffer. The buffer is taken over, not copied, so the
	 * caller must not keep writing to it.
	 *
	 * @param width  number of grid columns
	 * @param height number of grid rows
	 * @param values row-major values, {@code width * height} entries
	 * @return read-only grid
	 */
    public static ChannelGrid adopt(int width, int height, int[] values) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + " x " + height);
        }
        if (values.length != Math.multiplyExact(width, height)) {
            throw new IllegalArgumentException("Expected " + width * height + " cells but got " + values.length);
        }
        return new ChannelGrid(width, height, values);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int value(int column, int row) {
        if (column < 0 || column >= width || row < 0 || row >= height) {
            throw new IndexOutOfBoundsException("Cell (" + column + ", " + row + ") outside " + width + " x " + height);
        }
        return values[row * width + column];
    }
}
