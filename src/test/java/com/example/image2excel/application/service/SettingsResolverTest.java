package com.example.image2excel.application.service;

import com.example.image2excel.application.exception.UseCaseValidationException;
import com.example.image2excel.config.ConverterProperties;
import com.example.image2excel.domain.model.ConversionRequest;
import com.example.image2excel.domain.model.ConversionSettings;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SettingsResolverTest {

    private final ConverterProperties properties = new ConverterProperties(160, 120, 100.0, 0.5, 13.5, false,
            24_000_000L, Map.of(
                    "tiny", new ConverterProperties.Preset(64, 48, 100.0),
                    "large", new ConverterProperties.Preset(512, 384, 25.0)));
    private final SettingsResolver resolver = new SettingsResolver(properties);

    @Test
    void resolveKeepsDefaultsWhenNothingIsOverridden() {
        ConversionSettings settings = resolver.resolve(ConversionRequest.forInput("photo.jpg"));

        assertThat(settings.inputFile()).isEqualTo("photo.jpg");
        assertThat(settings.outputFile()).isEmpty();
        assertThat(settings.hasOutputFile()).isFalse();
        assertThat(settings.outputWidth()).isEqualTo(160);
        assertThat(settings.outputHeight()).isEqualTo(120);
        assertThat(settings.outputZoom()).isEqualTo(100.0);
        assertThat(settings.outputColWidth()).isEqualTo(0.5);
        assertThat(settings.outputRowHeight()).isEqualTo(13.5);
        assertThat(settings.enlarge()).isFalse();
        assertThat(settings.preset()).isNull();
        assertThat(settings.batchMode()).isFalse();
        assertThat(settings.maxImagePixels()).isEqualTo(24_000_000L);
    }

    @Test
    void resolveAppliesRequestOverrides() {
        ConversionSettings settings = resolver.resolve(new ConversionRequest("photo.jpg", "out.xlsx",
                200, 100, 75.0, 1.0, 10.0, true, null));

        assertThat(settings.outputFile()).isEqualTo("out.xlsx");
        assertThat(settings.outputWidth()).isEqualTo(200);
        assertThat(settings.outputHeight()).isEqualTo(100);
        assertThat(settings.outputZoom()).isEqualTo(75.0);
        assertThat(settings.outputColWidth()).isEqualTo(1.0);
        assertThat(settings.outputRowHeight()).isEqualTo(10.0);
        assertThat(settings.enlarge()).isTrue();
    }

    @Test
    void presetWinsOverExplicitSize() {
        ConversionSettings settings = resolver.resolve(new ConversionRequest("photo.jpg", null,
                300, 300, 80.0, null, null, null, " Large "));

        assertThat(settings.preset()).isEqualTo("large");
        assertThat(settings.outputWidth()).isEqualTo(512);
        assertThat(settings.outputHeight()).isEqualTo(384);
        assertThat(settings.outputZoom()).isEqualTo(25.0);
        assertThat(settings.describe()).containsEntry("preset", "large");
    }

    @Test
    void unknownPresetIsRejected() {
        UseCaseValidationException ex = assertThrows(UseCaseValidationException.class,
                () -> resolver.resolve(new ConversionRequest("photo.jpg", null, null, null, null, null, null,
                        null, "huge")));

        assertThat(ex.getMessage()).contains("huge");
    }

    @Test
    void nonPositiveSizesAreRejected() {
        assertThrows(UseCaseValidationException.class, () -> resolver.resolve(new ConversionRequest(
                "photo.jpg", null, 0, 120, null, null, null, null, null)));
        assertThrows(UseCaseValidationException.class, () -> resolver.resolve(new ConversionRequest(
                "photo.jpg", null, null, null, -5.0, null, null, null, null)));
        assertThrows(UseCaseValidationException.class, () -> resolver.resolve(new ConversionRequest(
                "photo.jpg", null, null, null, null, 0.0, null, null, null)));
    }
}
