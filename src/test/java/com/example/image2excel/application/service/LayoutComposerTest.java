package com.example.image2excel.application.service;

import com.example.image2excel.TestFixtures;
import com.example.image2excel.application.exception.UseCaseValidationException;
import com.example.image2excel.domain.model.ChannelGrid;
import com.example.image2excel.domain.model.ConversionSettings;
import com.example.image2excel.domain.model.DocumentLayout;
import com.example.image2excel.domain.model.MetadataTable;
import com.example.image2excel.domain.model.ResizePlan;
import com.example.image2excel.domain.model.Rgb;
import com.example.image2excel.domain.model.RgbImage;
import com.example.image2excel.domain.model.SourceImageFacts;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the image sheet layout and the information table.
 */
class LayoutComposerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);
    private final LayoutComposer composer = new LayoutComposer(clock);
    private final GridPopulator populator = new GridPopulator();

    /**
     * Ensures sizes come from the settings and the columns after the grid are hidden.
     */
    @Test
    void composeHidesTrailingColumns() {
        ChannelGrid grid = populator.populate(RgbImage.filled(2, 2, new Rgb(1, 2, 3)));

        DocumentLayout layout = composer.compose(grid, TestFixtures.settings("in.png"));

        assertThat(layout.rowHeight()).isEqualTo(13.5);
        assertThat(layout.columnWidth()).isEqualTo(0.5);
        assertThat(layout.zoomPercent()).isEqualTo(100);
        assertThat(layout.hiddenColumnStart()).isEqualTo(7);
        assertThat(layout.hiddenColumnEnd()).isEqualTo(16384);
        assertThat(layout.hasHiddenColumns()).isTrue();
        assertThat(layout.showGridLines()).isFalse();
        assertThat(layout.showHeadings()).isFalse();
    }

    /**
     * Ensures the hidden block shrinks to the last column for the widest image and disappears
     * when the grid fills every column.
     */
    @Test
    void composeHidesNothingWhenGridFillsAllColumns() {
        ChannelGrid widest = populator.populate(RgbImage.filled(5461, 1, new Rgb(0, 0, 0)));
        ChannelGrid full = ChannelGrid.adopt(16384, 1, new int[16384]);

        DocumentLayout widestLayout = composer.compose(widest, TestFixtures.settings("wide.png"));
        DocumentLayout fullLayout = composer.compose(full, TestFixtures.settings("wide.png"));

        assertThat(widestLayout.hiddenColumnStart()).isEqualTo(16384);
        assertThat(widestLayout.hasHiddenColumns()).isTrue();
        assertThat(fullLayout.hiddenColumnStart()).isZero();
        assertThat(fullLayout.hasHiddenColumns()).isFalse();
    }

    /**
     * Ensures the zoom is kept inside the range the sheet view accepts.
     */
    @Test
    void composeClampsZoom() {
        ChannelGrid grid = populator.populate(RgbImage.filled(1, 1, new Rgb(0, 0, 0)));
        ConversionSettings zoomedIn = new ConversionSettings("in.png", "", 160, 120, 1000.0, 0.5, 13.5,
                false, null, false, 100L);
        ConversionSettings zoomedOut = new ConversionSettings("in.png", "", 160, 120, 2.0, 0.5, 13.5,
                false, null, false, 100L);

        assertThat(composer.compose(grid, zoomedIn).zoomPercent()).isEqualTo(400);
        assertThat(composer.compose(grid, zoomedOut).zoomPercent()).isEqualTo(10);
    }

    /**
     * Ensures grids beyond the sheet limits are rejected.
     */
    @Test
    void requireFitsRejectsOversizedGrids() {
        composer.requireFits(16384, 1_048_576);

        assertThrows(UseCaseValidationException.class, () -> composer.requireFits(16385, 1));
        assertThrows(UseCaseValidationException.class, () -> composer.requireFits(3, 1_048_577));
    }

    /**
     * Ensures the information table lists the file, resize and settings facts in order.
     */
    @Test
    void describeListsFactsThenSettings() {
        ChannelGrid grid = populator.populate(RgbImage.filled(1, 1, new Rgb(240, 128, 128)));
        SourceImageFacts source = new SourceImageFacts("images/coral.png", 1_234_567L, "PNG", 1, 1);
        ResizePlan plan = new ResizePlan(1, 1, 1.0);

        MetadataTable table = composer.describe(source, plan, grid, "images/coral.xlsx", TestFixtures.settings("images/coral.png"));

        assertThat(table.entries()).extracting(MetadataTable.Entry::label).startsWith(
                "File & Image Properties:",
                "Image File",
                "File Size",
                "Format",
                "Original Resolution (W x H)",
                "Resizing Factor",
                "Resized Resolution (W x H)",
                "Spreadsheet Range",
                "Spreadsheet File",
                "Generated at",
                "",
                "Program Arguments & Configuration:",
                "input_file");
        assertThat(table.valueOf("File Size")).isEqualTo("1,234,567");
        assertThat(table.valueOf("Original Resolution (W x H)")).isEqualTo("1 x 1");
        assertThat(table.valueOf("Resizing Factor")).isEqualTo("100.0%");
        assertThat(table.valueOf("Resized Resolution (W x H)")).isEqualTo("1 x 1");
        assertThat(table.valueOf("Spreadsheet Range")).isEqualTo("A1:C1");
        assertThat(table.valueOf("Spreadsheet File")).isEqualTo("images/coral.xlsx");
        assertThat(table.valueOf("Generated at")).isEqualTo("Mar 05 2024 02:07:09 PM");
        assertThat(table.valueOf("output_width")).isEqualTo("160");
        assertThat(table.valueOf("enlarge")).isEqualTo("false");
        assertThat(table.valueOf("presets")).isNull();
    }

    /**
     * Ensures reductions are reported as a percentage with one decimal.
     */
    @Test
    void describeFormatsResizeFactor() {
        ChannelGrid grid = populator.populate(RgbImage.filled(160, 80, new Rgb(0, 0, 0)));
        SourceImageFacts source = new SourceImageFacts("wide.png", 10L, "PNG", 1000, 500);

        MetadataTable table = composer.describe(source, new ResizePlan(160, 80, 0.16), grid, "wide.xlsx",
                TestFixtures.settings("wide.png"));

        assertThat(table.valueOf("Resizing Factor")).isEqualTo("16.0%");
        assertThat(table.valueOf("Resized Resolution (W x H)")).isEqualTo("160 x 80");
        assertThat(table.valueOf("Spreadsheet Range")).isEqualTo("A1:RL80");
    }
}
