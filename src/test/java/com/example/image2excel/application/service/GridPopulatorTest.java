package com.example.image2excel.application.service;

import com.example.image2excel.domain.model.ChannelGrid;
import com.example.image2excel.domain.model.Rgb;
import com.example.image2excel.domain.model.RgbImage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for spreading pixels over channel columns.
 */
class GridPopulatorTest {

    private final GridPopulator populator = new GridPopulator();

    /**
     * Ensures a white 2x2 image becomes a 6x2 grid of 255 values.
     */
    @Test
    void populateFillsEveryCell() {
        ChannelGrid grid = populator.populate(RgbImage.filled(2, 2, new Rgb(255, 255, 255)));

        assertThat(grid.width()).isEqualTo(6);
        assertThat(grid.height()).isEqualTo(2);
        for (int row = 0; row < grid.height(); row++) {
            for (int column = 0; column < grid.width(); column++) {
                assertThat(grid.value(column, row)).isEqualTo(255);
            }
        }
    }

    /**
     * Ensures each pixel lands in its own red, green and blue columns.
     */
    @Test
    void populatePlacesChannelsInOrder() {
        int[] pixels = {
                0xF08080, 0x0A141E,
                0x000000, 0x112233
        };
        ChannelGrid grid = populator.populate(RgbImage.ofPacked(2, 2, pixels));

        assertThat(new int[]{grid.value(0, 0), grid.value(1, 0), grid.value(2, 0)}).containsExactly(240, 128, 128);
        assertThat(new int[]{grid.value(3, 0), grid.value(4, 0), grid.value(5, 0)}).containsExactly(10, 20, 30);
        assertThat(new int[]{grid.value(3, 1), grid.value(4, 1), grid.value(5, 1)}).containsExactly(0x11, 0x22, 0x33);
        assertThat(grid.value(1, 1)).isZero();
    }
}
