package com.example.image2excel.application.service;

import com.example.image2excel.application.exception.BatchOutputValidationException;
import com.example.image2excel.domain.exception.ImageNotFoundException;
import com.example.image2excel.domain.exception.ImagePathRequiredException;
import com.example.image2excel.domain.model.BatchSummary;
import com.example.image2excel.domain.model.ConversionOutcome;
import com.example.image2excel.domain.model.ConversionSettings;
import com.example.image2excel.infrastructure.exception.InputListingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Application-layer service that runs a conversion for a single image or for every file directly
 * inside a directory. Files are converted one after another and independently of each other.
 */
@Service
public class BatchConversionService {

    private static final Logger log = LoggerFactory.getLogger(BatchConversionService.class);

    private final ImageConversionService conversionService;
    private final Clock clock;

    public BatchConversionService(ImageConversionService conversionService, Clock clock) {
        this.conversionService = conversionService;
        this.clock = clock;
    }

	/**
	 * Converts the input named by the settings. A directory switches on batch mode: its regular files
	 * are converted in name order, subdirectories are skipped, and non-image files simply count as
	 * seen but not processed.
	 *
	 * @param settings resolved run settings
	 * @return counters and per-file outcomes
	 * @throws ImagePathRequiredException     when no input is named
	 * @throws ImageNotFoundException         when the input does not exist
	 * @throws BatchOutputValidationException when a batch output target is not an existing directory
	 * @throws InputListingException          when the input directory cannot be listed
	 */
    public BatchSummary run(ConversionSettings settings) {
        if (settings.inputFile() == null || settings.inputFile().isBlank()) {
            throw new ImagePathRequiredException();
        }
        Path input = Path.of(settings.inputFile());
        Instant start = clock.instant();

        List<Path> files;
        ConversionSettings effective;
        if (Files.isDirectory(input)) {
            effective = settings.withBatchMode(true);
            if (settings.hasOutputFile() && !Files.isDirectory(Path.of(settings.outputFile()))) {
                throw new BatchOutputValidationException("Batch output target \"" + settings.outputFile()
                        + "\" does not exist or is not a directory.");
            }
            log.info("Batch processing image files in \"{}\".", input);
            files = listFiles(input);
        } else if (Files.isRegularFile(input)) {
            effective = settings.withBatchMode(false);
            files = List.of(input);
        } else {
            throw new ImageNotFoundException(input.toAbsolutePath().toString());
        }

        int filesSeen = 0;
        int filesProcessed = 0;
        List<ConversionOutcome> outcomes = new ArrayList<>();
        for (Path file : files) {
            if (!Files.isRegularFile(file)) {
                continue;
            }
            filesSeen++;
            ConversionOutcome outcome = conversionService.convert(file, effective);
            outcomes.add(outcome);
            if (outcome.processed()) {
                filesProcessed++;
            }
        }

        BatchSummary summary = new BatchSummary(filesSeen, filesProcessed,
                Duration.between(start, clock.instant()), outcomes);
        log.info("Files seen: {}", summary.filesSeen());
        log.info("Files processed: {}", summary.filesProcessed());
        log.info("Elapsed time: {}", summary.elapsedDescription());
        return summary;
    }

    private List<Path> listFiles(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.sorted().toList();
        } catch (IOException ex) {
            throw new InputListingException("Unable to list the files in " + directory + ".", ex);
        }
    }
}
