package com.example.image2excel.application.service;

import com.example.image2excel.application.exception.UseCaseValidationException;
import com.example.image2excel.domain.model.ChannelGrid;
import com.example.image2excel.domain.model.ConversionSettings;
import com.example.image2excel.domain.model.DocumentLayout;
import com.example.image2excel.domain.model.MetadataTable;
import com.example.image2excel.domain.model.ResizePlan;
import com.example.image2excel.domain.model.SourceImageFacts;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.util.CellRangeAddress;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Assembles the sheet layout and the information table of a converted image.
 */
@Service
public class LayoutComposer {

    static final SpreadsheetVersion FORMAT = SpreadsheetVersion.EXCEL2007;
    static final int MIN_ZOOM = 10;
    static final int MAX_ZOOM = 400;

    private static final DateTimeFormatter GENERATED_AT_FORMATTER =
            DateTimeFormatter.ofPattern("MMM dd yyyy hh:mm:ss a", Locale.US);

    private final Clock clock;

    /**
     * @param clock source of the "Generated at" timestamp
     */
    public LayoutComposer(Clock clock) {
        this.clock = clock;
    }

	/**
	 * Rejects grids the xlsx format cannot hold. Called as soon as the target size is known so
	 * an oversized grid is never populated.
	 *
	 * @param gridWidth  planned number of grid columns
	 * @param gridHeight planned number of grid rows
	 * @throws UseCaseValidationException when the grid exceeds the sheet limits
	 */
    public void requireFits(int gridWidth, int gridHeight) {
        if (gridWidth > FORMAT.getMaxColumns() || gridHeight > FORMAT.getMaxRows()) {
            throw new UseCaseValidationException(String.format(
                    "A %d x %d grid does not fit in a sheet of %d columns and %d rows, please choose a smaller output size.",
                    gridWidth, gridHeight, FORMAT.getMaxColumns(), FORMAT.getMaxRows()));
        }
    }

	/**
	 * Computes the sheet-wide sizing and view settings. Every column right of the grid is hidden
	 * up to the last column of the format.
	 *
	 * @param grid     populated grid
	 * @param settings resolved run settings
	 * @return layout of the image sheet
	 */
    public DocumentLayout compose(ChannelGrid grid, ConversionSettings settings) {
        requireFits(grid.width(), grid.height());

        int lastColumn = FORMAT.getMaxColumns();
        int hiddenColumnStart = grid.width() < lastColumn ? grid.width() + 1 : 0;
        int zoom = (int) Math.max(MIN_ZOOM, Math.min(MAX_ZOOM, Math.round(settings.outputZoom())));

        return new DocumentLayout(
                settings.outputRowHeight(),
                settings.outputColWidth(),
                zoom,
                hiddenColumnStart,
                lastColumn,
                false,
                false
        );
    }

	/**
	 * Builds the information table: source file facts, resize facts, the generated range and
	 * file, followed by every effective setting.
	 *
	 * @param source      facts about the decoded source file
	 * @param plan        applied resize plan
	 * @param grid        populated grid
	 * @param outputFile  location the workbook is written to
	 * @param settings    resolved run settings
	 * @return ordered information table
	 */
    public MetadataTable describe(SourceImageFacts source,
                                  ResizePlan plan,
                                  ChannelGrid grid,
                                  String outputFile,
                                  ConversionSettings settings) {
        MetadataTable.Builder table = MetadataTable.builder()
                .section("File & Image Properties:")
                .add("Image File", source.location())
                .add("File Size", String.format(Locale.US, "%,d", source.fileSizeBytes()))
                .add("Format", source.format())
                .add("Original Resolution (W x H)", resolution(source.originalWidth(), source.originalHeight()))
                .add("Resizing Factor", String.format(Locale.ROOT, "%.1f%%", plan.scaleFactor() * 100.0))
                .add("Resized Resolution (W x H)", resolution(plan.targetWidth(), plan.targetHeight()))
                .add("Spreadsheet Range", gridRange(grid))
                .add("Spreadsheet File", outputFile)
                .add("Generated at", GENERATED_AT_FORMATTER.format(LocalDateTime.now(clock)))
                .blank()
                .section("Program Arguments & Configuration:");
        settings.describe().forEach(table::add);
        return table.build();
    }

	/**
	 * Formats the address block holding the grid, e.g. {@code A1:C1}.
	 *
	 * @param grid populated grid
	 * @return A1-style range
	 */
    public static String gridRange(ChannelGrid grid) {
        return new CellRangeAddress(0, grid.height() - 1, 0, grid.width() - 1).formatAsString();
    }

    private static String resolution(int width, int height) {
        return width + " x " + height;
    }
}
