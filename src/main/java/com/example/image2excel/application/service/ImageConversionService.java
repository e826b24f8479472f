package com.example.image2excel.application.service;

import com.example.image2excel.application.exception.ApplicationException;
import com.example.image2excel.domain.exception.DomainException;
import com.example.image2excel.domain.exception.ImageFileRequiredException;
import com.example.image2excel.domain.exception.ImageNotFoundException;
import com.example.image2excel.domain.exception.ImagePathRequiredException;
import com.example.image2excel.domain.model.ChannelGrid;
import com.example.image2excel.domain.model.ChannelMapper;
import com.example.image2excel.domain.model.ConversionOutcome;
import com.example.image2excel.domain.model.ConversionSettings;
import com.example.image2excel.domain.model.ConversionState;
import com.example.image2excel.domain.model.DocumentLayout;
import com.example.image2excel.domain.model.GradientRule;
import com.example.image2excel.domain.model.GridDocument;
import com.example.image2excel.domain.model.MetadataTable;
import com.example.image2excel.domain.model.ResizePlan;
import com.example.image2excel.domain.model.RgbImage;
import com.example.image2excel.domain.model.SourceImageFacts;
import com.example.image2excel.infrastructure.excel.PoiWorkbookWriter;
import com.example.image2excel.infrastructure.exception.ImageDecodingException;
import com.example.image2excel.infrastructure.exception.InfrastructureException;
import com.example.image2excel.infrastructure.image.AwtImageResampler;
import com.example.image2excel.infrastructure.image.DecodedImage;
import com.example.image2excel.infrastructure.image.ImageIoDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Application-layer service that converts one image into a spreadsheet.
 * It runs the stages of {@link ConversionState} in order: decode, plan the resize, normalize to RGB,
 * populate the grid, build the color rules, layout and information table, then persist.
 */
@Service
public class ImageConversionService {

    private static final Logger log = LoggerFactory.getLogger(ImageConversionService.class);
    static final String WORKBOOK_EXTENSION = ".xlsx";

    private final ImageIoDecoder decoder;
    private final AwtImageResampler resampler;
    private final ResizePlanner resizePlanner;
    private final GridPopulator gridPopulator;
    private final GradientRuleGenerator ruleGenerator;
    private final LayoutComposer layoutComposer;
    private final PoiWorkbookWriter workbookWriter;

    public ImageConversionService(ImageIoDecoder decoder,
                                  AwtImageResampler resampler,
                                  ResizePlanner resizePlanner,
                                  GridPopulator gridPopulator,
                                  GradientRuleGenerator ruleGenerator,
                                  LayoutComposer layoutComposer,
                                  PoiWorkbookWriter workbookWriter) {
        this.decoder = decoder;
        this.resampler = resampler;
        this.resizePlanner = resizePlanner;
        this.gridPopulator = gridPopulator;
        this.ruleGenerator = ruleGenerator;
        this.layoutComposer = layoutComposer;
        this.workbookWriter = workbookWriter;
    }

    /**
     * Converts an image file and saves the workbook. Expected failures are logged and reported in
     * the outcome instead of being thrown, so one bad file never stops a batch.
     *
     * @param inputFile image to convert
     * @param settings  resolved run settings
     * @return outcome carrying the stage a failure happened in
     */
    public ConversionOutcome convert(Path inputFile, ConversionSettings settings) {
        Progress progress = new Progress();
        Path outputFile = null;
        try {
            if (inputFile == null) {
                throw new ImagePathRequiredException();
            }
            log.info("Loading image file \"{}\"...", inputFile);
            byte[] bytes = readImageFile(inputFile);
            outputFile = resolveOutputFile(inputFile, settings);

            GridDocument document = build(bytes, inputFile.toString(), outputFile.toString(), settings, progress);

            progress.enter(ConversionState.PERSISTING);
            log.info("Saving spreadsheet to \"{}\"...", outputFile);
            workbookWriter.save(document, outputFile);
            progress.enter(ConversionState.DONE);
            return ConversionOutcome.done(inputFile, outputFile);
        } catch (DomainException | ApplicationException | InfrastructureException ex) {
            log.error("Conversion of \"{}\" failed while {}: {}", inputFile, progress.current, ex.getMessage());
            log.debug("Conversion failure details", ex);
            return ConversionOutcome.failed(inputFile, outputFile, progress.current, ex.getMessage());
        }
    }

    /**
     * Builds the document for uploaded bytes without persisting it. Failures propagate to the caller.
     *
     * @param bytes    encoded image
     * @param fileName original file name, used for the information sheet and the workbook name
     * @param settings resolved run settings
     * @return finished in-memory document
     * @throws ImageFileRequiredException when no bytes were supplied
     */
    public GridDocument buildDocument(byte[] bytes, String fileName, ConversionSettings settings) {
        if (bytes == null || bytes.length == 0) {
            throw new ImageFileRequiredException();
        }
        String name = fileName == null || fileName.isBlank() ? "upload" : fileName;
        return build(bytes, name, workbookName(name), settings, new Progress());
    }

    /**
     * Derives where the workbook of {@code inputFile} is written. An explicit output file wins; in
     * batch mode the output names a directory (defaulting to the input's own) that receives
     * {@code <name>.xlsx}; otherwise the input's extension is replaced with {@code .xlsx}.
     *
     * @param inputFile image being converted
     * @param settings  resolved run settings
     * @return workbook path
     */
    public Path resolveOutputFile(Path inputFile, ConversionSettings settings) {
        String fileName = inputFile.getFileName().toString();
        if (settings.batchMode()) {
            Path directory = settings.hasOutputFile() ? Path.of(settings.outputFile()) : inputFile.toAbsolutePath().getParent();
            return directory.resolve(workbookName(fileName));
        }
        if (settings.hasOutputFile()) {
            return Path.of(settings.outputFile());
        }
        return inputFile.resolveSibling(workbookName(fileName));
    }

    /**
     * Replaces the extension of a file name with {@code .xlsx}.
     *
     * @param fileName image file name
     * @return workbook file name
     */
    public static String workbookName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return base + WORKBOOK_EXTENSION;
    }

    private GridDocument build(byte[] bytes,
                               String location,
                               String outputLocation,
                               ConversionSettings settings,
                               Progress progress) {
        progress.enter(ConversionState.LOADING);
        DecodedImage decoded = decoder.decode(bytes, location, settings.maxImagePixels());
        SourceImageFacts source = new SourceImageFacts(location, bytes.length, decoded.format(),
                decoded.width(), decoded.height());

        progress.enter(ConversionState.PLANNING);
        ResizePlan plan = resizePlanner.plan(decoded.width(), decoded.height(),
                settings.outputWidth(), settings.outputHeight(), settings.enlarge());
        layoutComposer.requireFits(ChannelMapper.gridWidth(plan.targetWidth()), plan.targetHeight());

        progress.enter(ConversionState.NORMALIZING);
        BufferedImage rgb = resampler.normalize(decoded);
        log.info("Resizing image ({} x {}) to ({} x {})...", decoded.width(), decoded.height(),
                plan.targetWidth(), plan.targetHeight());
        RgbImage resized = resampler.resize(rgb, plan);

        progress.enter(ConversionState.POPULATING);
        ChannelGrid grid = gridPopulator.populate(resized);

        progress.enter(ConversionState.STYLING_METADATA);
        List<GradientRule> rules = ruleGenerator.generate(grid.width(), grid.height());
        DocumentLayout layout = layoutComposer.compose(grid, settings);
        MetadataTable metadata = layoutComposer.describe(source, plan, grid, outputLocation, settings);
        log.debug("Built {} x {} grid with {} color rules for {}", grid.width(), grid.height(), rules.size(), location);
        return new GridDocument(grid, rules, layout, metadata);
    }

    private byte[] readImageFile(Path inputFile) {
        if (!Files.isRegularFile(inputFile)) {
            throw new ImageNotFoundException(inputFile.toAbsolutePath().toString());
        }
        try {
            return Files.readAllBytes(inputFile);
        } catch (IOException ex) {
            throw new ImageDecodingException("Unable to read the image file " + inputFile + ".", ex);
        }
    }

    /**
     * Stage reached by one conversion, reported when it fails.
     */
    private static final class Progress {

        private ConversionState current = ConversionState.LOADING;

        void enter(ConversionState state) {
            log.debug("Entering {}", state);
            current = state;
        }
    }
}
