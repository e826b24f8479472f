package com.example.image2excel.application.service;

import com.example.image2excel.application.exception.UseCaseValidationException;
import com.example.image2excel.config.ConverterProperties;
import com.example.image2excel.domain.model.ConversionRequest;
import com.example.image2excel.domain.model.ConversionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Objects;

/**
 * Merges configured defaults, per-run overrides and an optional preset into one
 * {@link ConversionSettings} value. A preset wins over explicit width, height and zoom.
 */
@Service
public class SettingsResolver {

    private static final Logger log = LoggerFactory.getLogger(SettingsResolver.class);

    private final ConverterProperties properties;

    public SettingsResolver(ConverterProperties properties) {
        this.properties = properties;
    }

	/**
	 * Resolves the settings of one run.
	 *
	 * @param request per-run overrides
	 * @return validated settings; {@code batchMode} is left {@code false} for the batch runner to decide
	 * @throws UseCaseValidationException when the preset is unknown or a size is not positive
	 */
    public ConversionSettings resolve(ConversionRequest request) {
        int width = Objects.requireNonNullElse(request.outputWidth(), properties.outputWidth());
        int height = Objects.requireNonNullElse(request.outputHeight(), properties.outputHeight());
        double zoom = Objects.requireNonNullElse(request.outputZoom(), properties.outputZoom());

        String presetName = normalizePreset(request.preset());
        if (presetName != null) {
            ConverterProperties.Preset preset = properties.presets().get(presetName);
            if (preset == null) {
                throw new UseCaseValidationException("Unknown preset \"" + request.preset()
                        + "\", expected one of " + properties.presets().keySet() + ".");
            }
            log.info("Using \"{}\" preset.", presetName);
            width = Objects.requireNonNullElse(preset.outputWidth(), width);
            height = Objects.requireNonNullElse(preset.outputHeight(), height);
            zoom = Objects.requireNonNullElse(preset.outputZoom(), zoom);
        }

        ConversionSettings settings = new ConversionSettings(
                request.inputFile(),
                Objects.requireNonNullElse(request.outputFile(), ""),
                width,
                height,
                zoom,
                Objects.requireNonNullElse(request.outputColWidth(), properties.outputColWidth()),
                Objects.requireNonNullElse(request.outputRowHeight(), properties.outputRowHeight()),
                Objects.requireNonNullElse(request.enlarge(), properties.enlarge()),
                presetName,
                false,
                properties.maxImagePixels()
        );
        validate(settings);
        return settings;
    }

    private void validate(ConversionSettings settings) {
        if (settings.outputWidth() <= 0 || settings.outputHeight() <= 0) {
            throw new UseCaseValidationException("Output width and height must be positive.");
        }
        if (settings.outputZoom() <= 0) {
            throw new UseCaseValidationException("Output zoom must be positive.");
        }
        if (settings.outputColWidth() <= 0 || settings.outputRowHeight() <= 0) {
            throw new UseCaseValidationException("Column width and row height must be positive.");
        }
        if (settings.maxImagePixels() <= 0) {
            throw new UseCaseValidationException("The image pixel limit must be positive.");
        }
    }

    private static String normalizePreset(String preset) {
        if (preset == null || preset.isBlank()) {
            return null;
        }
        return preset.trim().toLowerCase(Locale.ROOT);
    }
}
