package com.example.image2excel.application.service;

import com.example.image2excel.TestFixtures;
import com.example.image2excel.domain.exception.ImageFileRequiredException;
import com.example.image2excel.domain.model.ColorChannel;
import com.example.image2excel.domain.model.ConversionOutcome;
import com.example.image2excel.domain.model.ConversionSettings;
import com.example.image2excel.domain.model.ConversionState;
import com.example.image2excel.domain.model.GridDocument;
import com.example.image2excel.infrastructure.excel.PoiWorkbookWriter;
import com.example.image2excel.infrastructure.image.AwtImageResampler;
import com.example.image2excel.infrastructure.image.ImageIoDecoder;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Runs whole conversions through the real decoder, resampler and writer.
 */
class ImageConversionServiceTest {

    @TempDir
    Path tempDir;

    private final ImageConversionService service = new ImageConversionService(
            new ImageIoDecoder(),
            new AwtImageResampler(),
            new ResizePlanner(),
            new GridPopulator(),
            new GradientRuleGenerator(),
            new LayoutComposer(Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC)),
            new PoiWorkbookWriter());

    /**
     * Ensures a single pixel turns into three channel cells and a saved workbook.
     */
    @Test
    void convertSinglePixelImage() throws Exception {
        Path input = TestFixtures.writePng(tempDir.resolve("coral.png"),
                TestFixtures.solid(1, 1, TestFixtures.LIGHT_CORAL));

        ConversionOutcome outcome = service.convert(input, TestFixtures.settings(input.toString()));

        assertThat(outcome.processed()).isTrue();
        assertThat(outcome.finalState()).isEqualTo(ConversionState.DONE);
        assertThat(outcome.outputFile()).isEqualTo(tempDir.resolve("coral.xlsx"));
        try (InputStream in = Files.newInputStream(outcome.outputFile());
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            XSSFSheet image = workbook.getSheet(GridDocument.IMAGE_SHEET);
            assertThat(image.getRow(0).getCell(0).getNumericCellValue()).isEqualTo(240.0);
            assertThat(image.getRow(0).getCell(1).getNumericCellValue()).isEqualTo(128.0);
            assertThat(image.getRow(0).getCell(2).getNumericCellValue()).isEqualTo(128.0);
            assertThat(workbook.getSheet(GridDocument.INFORMATION_SHEET)).isNotNull();
        }
    }

    /**
     * Ensures the in-memory document reports the resize facts.
     */
    @Test
    void buildDocumentDescribesSourceAndResize() {
        byte[] png = TestFixtures.png(TestFixtures.solid(1, 1, TestFixtures.LIGHT_CORAL));

        GridDocument document = service.buildDocument(png, "coral.png", TestFixtures.settings("coral.png"));

        assertThat(document.grid().width()).isEqualTo(3);
        assertThat(document.grid().height()).isEqualTo(1);
        assertThat(document.rules()).hasSize(ColorChannel.COUNT);
        assertThat(document.metadata().valueOf("Format")).isEqualTo("PNG");
        assertThat(document.metadata().valueOf("Original Resolution (W x H)")).isEqualTo("1 x 1");
        assertThat(document.metadata().valueOf("Resizing Factor")).isEqualTo("100.0%");
        assertThat(document.metadata().valueOf("Spreadsheet File")).isEqualTo("coral.xlsx");
    }

    /**
     * Ensures wide images are shrunk to fit the desired box.
     */
    @Test
    void buildDocumentShrinksToFit() {
        byte[] png = TestFixtures.png(TestFixtures.solid(400, 200, 0x336699));

        GridDocument document = service.buildDocument(png, "wide.png", TestFixtures.settings("wide.png"));

        assertThat(document.grid().width()).isEqualTo(480);
        assertThat(document.grid().height()).isEqualTo(80);
        assertThat(document.grid().value(0, 0)).isCloseTo(0x33, within(1));
        assertThat(document.grid().value(1, 0)).isCloseTo(0x66, within(1));
        assertThat(document.grid().value(2, 0)).isCloseTo(0x99, within(1));
        assertThat(document.metadata().valueOf("Resizing Factor")).isEqualTo("40.0%");
    }

    @Test
    void buildDocumentRequiresBytes() {
        assertThrows(ImageFileRequiredException.class,
                () -> service.buildDocument(new byte[0], "empty.png", TestFixtures.settings("empty.png")));
    }

    @Test
    void missingInputFailsWhileLoading() {
        Path input = tempDir.resolve("missing.png");

        ConversionOutcome outcome = service.convert(input, TestFixtures.settings(input.toString()));

        assertThat(outcome.processed()).isFalse();
        assertThat(outcome.finalState()).isEqualTo(ConversionState.FAILED);
        assertThat(outcome.failedIn()).isEqualTo(ConversionState.LOADING);
        assertThat(outcome.failureMessage()).contains("missing.png");
    }

    @Test
    void nonImageFailsWhileLoading() throws Exception {
        Path input = Files.writeString(tempDir.resolve("notes.txt"), "not an image");

        ConversionOutcome outcome = service.convert(input, TestFixtures.settings(input.toString()));

        assertThat(outcome.failedIn()).isEqualTo(ConversionState.LOADING);
        assertThat(Files.exists(tempDir.resolve("notes.xlsx"))).isFalse();
    }

    /**
     * Ensures the pixel ceiling stops the run before anything is written.
     */
    @Test
    void oversizedImageProducesNoWorkbook() throws Exception {
        Path input = TestFixtures.writePng(tempDir.resolve("big.png"), TestFixtures.solid(4, 4, 0xFFFFFF));

        ConversionOutcome outcome = service.convert(input,
                TestFixtures.settings(input.toString(), "", 10L));

        assertThat(outcome.failedIn()).isEqualTo(ConversionState.LOADING);
        assertThat(Files.exists(tempDir.resolve("big.xlsx"))).isFalse();
    }

    /**
     * Ensures a grid wider than the sheet allows fails before any cell is populated.
     */
    @Test
    void gridBeyondSheetLimitsFailsWhilePlanning() throws Exception {
        Path input = TestFixtures.writePng(tempDir.resolve("panorama.png"), TestFixtures.solid(6000, 1, 0x808080));
        ConversionSettings settings = new ConversionSettings(input.toString(), "", 6000, 1, 100.0, 0.5, 13.5,
                true, null, false, 24_000_000L);

        ConversionOutcome outcome = service.convert(input, settings);

        assertThat(outcome.processed()).isFalse();
        assertThat(outcome.failedIn()).isEqualTo(ConversionState.PLANNING);
        assertThat(outcome.failureMessage()).contains("18000 x 1");
        assertThat(Files.exists(tempDir.resolve("panorama.xlsx"))).isFalse();
    }

    @Test
    void missingOutputDirectoryFailsWhilePersisting() throws Exception {
        Path input = TestFixtures.writePng(tempDir.resolve("coral.png"),
                TestFixtures.solid(1, 1, TestFixtures.LIGHT_CORAL));
        Path output = tempDir.resolve("nowhere").resolve("coral.xlsx");

        ConversionOutcome outcome = service.convert(input,
                TestFixtures.settings(input.toString(), output.toString(), 24_000_000L));

        assertThat(outcome.failedIn()).isEqualTo(ConversionState.PERSISTING);
        assertThat(outcome.outputFile()).isEqualTo(output);
        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void resolveOutputFileReplacesExtension() {
        Path input = Path.of("images", "photo.jpeg");

        assertThat(service.resolveOutputFile(input, TestFixtures.settings(input.toString())))
                .isEqualTo(Path.of("images", "photo.xlsx"));
    }

    @Test
    void resolveOutputFilePrefersExplicitTarget() {
        ConversionSettings settings = TestFixtures.settings("photo.jpeg", "out/result.xlsx", 24_000_000L);

        assertThat(service.resolveOutputFile(Path.of("photo.jpeg"), settings))
                .isEqualTo(Path.of("out/result.xlsx"));
    }

    @Test
    void resolveOutputFileUsesDirectoryInBatchMode() {
        ConversionSettings batch = TestFixtures.settings("images", "out", 24_000_000L).withBatchMode(true);
        ConversionSettings batchWithoutTarget = TestFixtures.settings("images").withBatchMode(true);
        Path input = tempDir.resolve("photo.gif");

        assertThat(service.resolveOutputFile(input, batch)).isEqualTo(Path.of("out", "photo.xlsx"));
        assertThat(service.resolveOutputFile(input, batchWithoutTarget)).isEqualTo(tempDir.resolve("photo.xlsx"));
    }

    @Test
    void workbookNameKeepsDotFiles() {
        assertThat(ImageConversionService.workbookName("archive.tar.png")).isEqualTo("archive.tar.xlsx");
        assertThat(ImageConversionService.workbookName("README")).isEqualTo("README.xlsx");
        assertThat(ImageConversionService.workbookName(".hidden")).isEqualTo(".hidden.xlsx");
    }
}
