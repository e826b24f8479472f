package com.example.image2excel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

/**
 * Default conversion settings bound from the {@code image2excel.*} properties.
 * Command line options such as {@code --image2excel.output-width=200} override them through
 * Spring's externalized configuration.
 *
 * @param outputWidth     desired image width in pixels
 * @param outputHeight    desired image height in pixels
 * @param outputZoom      initial sheet zoom in percent
 * @param outputColWidth  column width in characters
 * @param outputRowHeight row height in points
 * @param enlarge         whether smaller images may be enlarged
 * @param maxImagePixels  pixel ceiling checked before decoding
 * @param presets         named size presets, keyed by preset name
 */
@ConfigurationProperties(prefix = "image2excel")
public record ConverterProperties(
        @DefaultValue("160") int outputWidth,
        @DefaultValue("120") int outputHeight,
        @DefaultValue("100") double outputZoom,
        @DefaultValue("0.5") double outputColWidth,
        @DefaultValue("13.5") double outputRowHeight,
        @DefaultValue("false") boolean enlarge,
        @DefaultValue("24000000") long maxImagePixels,
        Map<String, Preset> presets
) {

    public ConverterProperties {
        presets = presets == null ? Map.of() : Map.copyOf(presets);
    }

    /**
     * Size preset. Unset values leave the defaults untouched.
     */
    public record Preset(Integer outputWidth, Integer outputHeight, Double outputZoom) {
    }
}
