package com.example.image2excel.interfaces.cli;

import com.example.image2excel.application.exception.ApplicationException;
import com.example.image2excel.application.exception.UseCaseValidationException;
import com.example.image2excel.application.service.BatchConversionService;
import com.example.image2excel.application.service.SettingsResolver;
import com.example.image2excel.domain.exception.DomainException;
import com.example.image2excel.domain.model.ConversionRequest;
import com.example.image2excel.domain.model.ConversionSettings;
import com.example.image2excel.infrastructure.exception.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Interfaces-layer command line entry: {@code <input_file> [output_file]} with optional
 * {@code --output_width}, {@code --output_height}, {@code --output_zoom}, {@code --output_col_width},
 * {@code --output_row_height}, {@code --enlarge}/{@code --no-enlarge} and {@code --preset} options.
 * Does nothing when no positional argument is given, so the HTTP API can run on its own.
 */
@Component
public class ConversionCommandLineRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ConversionCommandLineRunner.class);
    private static final int MAX_POSITIONAL_ARGUMENTS = 2;

    private final SettingsResolver settingsResolver;
    private final BatchConversionService batchConversionService;

    public ConversionCommandLineRunner(SettingsResolver settingsResolver, BatchConversionService batchConversionService) {
        this.settingsResolver = settingsResolver;
        this.batchConversionService = batchConversionService;
    }

	/**
	 * Resolves the settings and converts the named file or directory. Failures that stop the whole
	 * run (unknown preset, missing input, unusable batch output) are reported and end the run.
	 *
	 * @param args parsed application arguments
	 */
    @Override
    public void run(ApplicationArguments args) {
        if (args.getNonOptionArgs().isEmpty()) {
            return;
        }
        log.info("image2excel: Converts image file into a spreadsheet of individual Red, Green, Blue cells.");

        try {
            ConversionSettings settings = settingsResolver.resolve(toRequest(args));
            batchConversionService.run(settings);
        } catch (DomainException | ApplicationException | InfrastructureException ex) {
            log.error(ex.getMessage());
        }
    }

	/**
	 * Translates the command line into per-run overrides.
	 *
	 * @param args parsed application arguments
	 * @return request with {@code null} for every option that was not given
	 * @throws UseCaseValidationException when there are more than two positional arguments, or an
	 *                                    option has no value or a numeric option cannot be parsed
	 */
    ConversionRequest toRequest(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.size() > MAX_POSITIONAL_ARGUMENTS) {
            throw new UseCaseValidationException("Expected <input_file> [output_file] but got " + positional
                    + ". Options take their value as --name=value.");
        }
        String outputFile = positional.size() > 1 ? positional.get(1) : null;
        Double width = numberOption(args, "output_width");
        Double height = numberOption(args, "output_height");
        return new ConversionRequest(
                positional.get(0),
                outputFile,
                width == null ? null : (int) Math.round(width),
                height == null ? null : (int) Math.round(height),
                numberOption(args, "output_zoom"),
                numberOption(args, "output_col_width"),
                numberOption(args, "output_row_height"),
                enlargeOption(args),
                stringOption(args, "preset")
        );
    }

    private static Boolean enlargeOption(ApplicationArguments args) {
        if (args.containsOption("no-enlarge")) {
            return Boolean.FALSE;
        }
        if (!args.containsOption("enlarge")) {
            return null;
        }
        List<String> values = args.getOptionValues("enlarge");
        return values.isEmpty() || Boolean.parseBoolean(values.get(values.size() - 1));
    }

    private static Double numberOption(ApplicationArguments args, String name) {
        String value = stringOption(args, name);
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException ex) {
            throw new UseCaseValidationException("Option --" + name + " expects a number but got \"" + value + "\".");
        }
    }

    private static String stringOption(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return null;
        }
        List<String> values = args.getOptionValues(name);
        if (values.isEmpty()) {
            throw new UseCaseValidationException("Option --" + name + " expects a value, use --" + name + "=<value>.");
        }
        return values.get(values.size() - 1);
    }
}
