package com.example.image2excel.infrastructure.image;

import com.example.image2excel.domain.exception.ImageTooLargeException;
import com.example.image2excel.domain.exception.UnsupportedImageFormatException;
import com.example.image2excel.infrastructure.exception.ImageDecodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

/**
 * Infrastructure service that decodes image bytes with the installed ImageIO readers.
 * The image header is inspected first so oversized images are rejected before their pixels are read.
 */
@Service
public class ImageIoDecoder {

    private static final Logger log = LoggerFactory.getLogger(ImageIoDecoder.class);

    /**
     * Decodes the first image stored in {@code bytes}.
     *
     * @param bytes     encoded image
     * @param fileName  name used in error messages
     * @param maxPixels largest accepted {@code width * height}
     * @return decoded image with its format and color mode
     * @throws UnsupportedImageFormatException when no reader recognizes the bytes
     * @throws ImageTooLargeException          when the header announces more than {@code maxPixels} pixels
     * @throws ImageDecodingException          when the reader fails on corrupt or truncated data
     */
    public DecodedImage decode(byte[] bytes, String fileName, long maxPixels) {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            if (input == null) {
                throw new UnsupportedImageFormatException(fileName);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new UnsupportedImageFormatException(fileName);
            }

            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if ((long) width * height > maxPixels) {
                    throw new ImageTooLargeException(width, height, maxPixels);
                }

                BufferedImage image = reader.read(0);
                String format = reader.getFormatName().toUpperCase(Locale.ROOT);
                String colorMode = describeColorMode(image.getColorModel());
                log.debug("Decoded {} as {} {} x {} ({})", fileName, format, width, height, colorMode);
                return new DecodedImage(format, colorMode, image);
            } finally {
                reader.dispose();
            }
        } catch (IOException ex) {
            throw new ImageDecodingException("Unable to decode the image " + fileName + ".", ex);
        }
    }

    /**
     * Maps an AWT color model onto the short mode names shown in logs.
     *
     * @param colorModel color model of the decoded raster
     * @return {@code P}, {@code L}, {@code RGBA} or {@code RGB}
     */
    private String describeColorMode(ColorModel colorModel) {
        if (colorModel instanceof IndexColorModel) {
            return "P";
        }
        if (colorModel.getColorSpace().getType() == ColorSpace.TYPE_GRAY) {
            return colorModel.hasAlpha() ? "LA" : "L";
        }
        return colorModel.hasAlpha() ? "RGBA" : "RGB";
    }
}
