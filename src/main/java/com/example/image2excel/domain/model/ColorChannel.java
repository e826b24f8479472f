package com.example.image2excel.domain.model;

/**
 * Color channels in the fixed order they cycle through the grid columns.
 * The ordinal is the channel index used by {@link ChannelMapper}; never reorder the constants.
 */
public enum ColorChannel {
    RED(0xFF0000),
    GREEN(0x00FF00),
    BLUE(0x0000FF);

    /**
     * Number of channels, and therefore of grid columns per pixel.
     */
    public static final int COUNT = 3;

    private static final ColorChannel[] BY_INDEX = values();

    private final int fullColor;

    ColorChannel(int fullColor) {
        this.fullColor = fullColor;
    }

    public int index() {
        return ordinal();
    }

    /**
     * @return packed 0xRRGGBB value of the channel at full intensity
     */
    public int fullColor() {
        return fullColor;
    }

    /**
     * @return six digit upper-case hex form of {@link #fullColor()}, e.g. {@code FF0000}
     */
    public String fullColorHex() {
        return String.format("%06X", fullColor);
    }

	/**
	 * Resolves a channel from its index.
	 *
	 * @param index 0 for red, 1 for green, 2 for blue
	 * @return matching channel
	 * @throws IllegalArgumentException when the index is outside 0..2
	 */
    public static ColorChannel ofIndex(int index) {
        if (index < 0 || index >= COUNT) {
            throw new IllegalArgumentException("Channel index out of range: " + index);
        }
        return BY_INDEX[index];
    }
}
