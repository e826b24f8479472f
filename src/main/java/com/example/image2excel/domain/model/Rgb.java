package com.example.image2excel.domain.model;

/**
 * One pixel as three 8-bit intensities.
 */
public record Rgb(int red, int green, int blue) {

    public Rgb {
        requireByte(red, "red");
        requireByte(green, "green");
        requireByte(blue, "blue");
    }

	/**
	 * Unpacks a {@code 0xRRGGBB} value; any bits above the low 24 (alpha) are ignored.
	 *
	 * @param packed packed pixel value
	 * @return pixel triple
	 */
    public static Rgb fromPacked(int packed) {
        return new Rgb((packed >> 16) & 0xFF, (packed >> 8) & 0xFF, packed & 0xFF);
    }

    public int packed() {
        return (red << 16) | (green << 8) | blue;
    }

    public int component(ColorChannel channel) {
        return switch (channel) {
            case RED -> red;
            case GREEN -> green;
            case BLUE -> blue;
        };
    }

    private static void requireByte(int value, String name) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " must be within 0..255: " + value);
        }
    }
}
