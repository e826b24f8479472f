package com.example.image2excel.infrastructure.image;

import java.awt.image.BufferedImage;

/**
 * Image as returned by the decoder, before any resizing or RGB normalization.
 *
 * @param format    format name reported by the reader, upper case (e.g. {@code PNG})
 * @param colorMode short description of the pixel layout: {@code RGB}, {@code RGBA}, {@code L} or {@code P}
 * @param image     decoded raster
 */
public record DecodedImage(String format, String colorMode, BufferedImage image) {

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
