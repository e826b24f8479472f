package com.example.image2excel.infrastructure.image;

import com.example.image2excel.domain.model.ResizePlan;
import com.example.image2excel.domain.model.RgbImage;
import org.springframework.stereotype.Service;

import java.awt.Graphics2D;
import java.awt.Image;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Turns a decoded image into the plain RGB raster the grid is built from.
 */
@Service
public class AwtImageResampler {

	/**
	 * Resolves the decoded pixels to literal RGB triples.
	 * Palette, gray and alpha images are read through {@link BufferedImage#getRGB}, which looks colors up
	 * in the palette without dithering; alpha is dropped.
	 *
	 * @param decoded image as returned by the decoder
	 * @return a new {@link BufferedImage#TYPE_INT_RGB} raster, or the decoded one when it already is
	 */
    public BufferedImage normalize(DecodedImage decoded) {
        BufferedImage source = decoded.image();
        if (source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        int width = source.getWidth();
        int height = source.getHeight();
        int[] argb = source.getRGB(0, 0, width, height, null, 0, width);

        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        rgb.setRGB(0, 0, width, height, argb, 0, width);
        return rgb;
    }

	/**
	 * Scales a normalized raster to the planned size and copies it into an immutable {@link RgbImage}.
	 * Reductions use area averaging, enlargements bicubic interpolation; an unchanged size keeps the
	 * exact pixel values.
	 *
	 * @param rgb  normalized raster
	 * @param plan planned target size
	 * @return resized image
	 */
    public RgbImage resize(BufferedImage rgb, ResizePlan plan) {
        BufferedImage target = plan.changesSize(rgb.getWidth(), rgb.getHeight())
                ? scale(rgb, plan.targetWidth(), plan.targetHeight(), plan.scaleFactor() < 1.0)
                : rgb;
        int width = target.getWidth();
        int height = target.getHeight();
        return RgbImage.ofPacked(width, height, target.getRGB(0, 0, width, height, null, 0, width));
    }

    private BufferedImage scale(BufferedImage source, int width, int height, boolean reducing) {
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2 = scaled.createGraphics();
        try {
            if (reducing) {
                Image smooth = source.getScaledInstance(width, height, Image.SCALE_AREA_AVERAGING);
                g2.drawImage(smooth, 0, 0, null);
            } else {
                g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
                g2.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
                g2.drawImage(source, 0, 0, width, height, null);
            }
        } finally {
            g2.dispose();
        }
        return scaled;
    }
}
