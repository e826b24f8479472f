package com.example.image2excel.application.service;

import com.example.image2excel.domain.model.ChannelGrid;
import com.example.image2excel.domain.model.ChannelMapper;
import com.example.image2excel.domain.model.ColorChannel;
import com.example.image2excel.domain.model.Rgb;
import com.example.image2excel.domain.model.RgbImage;
import org.springframework.stereotype.Service;

/**
 * Writes the channel intensities of an RGB image into a grid, three cells per pixel.
 */
@Service
public class GridPopulator {

	/**
	 * Builds the grid for an already resized and RGB-normalized image.
	 * Each pixel is read once and spread over its red, green and blue columns.
	 *
	 * @param image source raster
	 * @return grid of {@code 3 * width} columns by {@code height} rows
	 */
    public ChannelGrid populate(RgbImage image) {
        int gridWidth = ChannelMapper.gridWidth(image.width());
        int gridHeight = image.height();
        int[] values = new int[Math.multiplyExact(gridWidth, gridHeight)];

        for (int row = 0; row < gridHeight; row++) {
            int rowOffset = row * gridWidth;
            for (int pixelX = 0; pixelX < image.width(); pixelX++) {
                Rgb pixel = image.pixelAt(pixelX, row);
                for (ColorChannel channel : ColorChannel.values()) {
                    values[rowOffset + ChannelMapper.column(pixelX, channel)] = pixel.component(channel);
                }
            }
        }
        return ChannelGrid.adopt(gridWidth, gridHeight, values);
    }
}
