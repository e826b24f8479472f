package com.example.image2excel.domain.model;

/**
 * Bijection between grid columns and (pixel column, channel) pairs.
 * Every pixel occupies three consecutive columns ordered red, green, blue, so column {@code c}
 * holds channel {@code c mod 3} of pixel {@code c div 3}. All indices are 0-based.
 */
public final class ChannelMapper {

    private ChannelMapper() {
    }

	/**
	 * Returns the pixel column shown by a grid column.
	 *
	 * @param column 0-based grid column
	 * @return 0-based pixel x coordinate
	 */
    public static int pixelX(int column) {
        requireNonNegative(column, "column");
        return column / ColorChannel.COUNT;
    }

	/**
	 * Returns the channel shown by a grid column.
	 *
	 * @param column 0-based grid column
	 * @return channel drawn in that column
	 */
    public static ColorChannel channel(int column) {
        requireNonNegative(column, "column");
        return ColorChannel.ofIndex(column % ColorChannel.COUNT);
    }

	/**
	 * Returns the grid column holding one channel of one pixel column.
	 *
	 * @param pixelX  0-based pixel x coordinate
	 * @param channel channel to address
	 * @return 0-based grid column
	 */
    public static int column(int pixelX, ColorChannel channel) {
        requireNonNegative(pixelX, "pixelX");
        return pixelX * ColorChannel.COUNT + channel.index();
    }

    /**
     * @return number of grid columns needed for an image of the given width
     */
    public static int gridWidth(int imageWidth) {
        requireNonNegative(imageWidth, "imageWidth");
        return Math.multiplyExact(imageWidth, ColorChannel.COUNT);
    }

    private static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }
}
