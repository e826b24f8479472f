package com.example.image2excel.interfaces.api;

import com.example.image2excel.application.service.ImageConversionService;
import com.example.image2excel.application.service.LayoutComposer;
import com.example.image2excel.application.service.SettingsResolver;
import com.example.image2excel.domain.exception.ImageFileRequiredException;
import com.example.image2excel.domain.model.ConversionRequest;
import com.example.image2excel.domain.model.ConversionSettings;
import com.example.image2excel.domain.model.GridDocument;
import com.example.image2excel.infrastructure.excel.PoiWorkbookWriter;
import com.example.image2excel.infrastructure.exception.ImageDecodingException;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Interfaces-layer controller that converts uploaded images into spreadsheets.
 */
@Controller
public class ImageConversionController {

    static final MediaType XLSX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final SettingsResolver settingsResolver;
    private final ImageConversionService conversionService;
    private final PoiWorkbookWriter workbookWriter;

    /**
     * Creates the controller with the required application services.
     *
     * @param settingsResolver  merges request parameters with the configured defaults
     * @param conversionService builds the spreadsheet document
     * @param workbookWriter    renders the document as xlsx
     */
    public ImageConversionController(SettingsResolver settingsResolver,
                                     ImageConversionService conversionService,
                                     PoiWorkbookWriter workbookWriter) {
        this.settingsResolver = settingsResolver;
        this.conversionService = conversionService;
        this.workbookWriter = workbookWriter;
    }

    /**
     * Converts the upload and streams the workbook back as a download.
     *
     * @param file    uploaded image
     * @param width   desired width in pixels (optional)
     * @param height  desired height in pixels (optional)
     * @param zoom    initial zoom in percent (optional)
     * @param enlarge whether small images may be enlarged (optional)
     * @param preset  preset name (optional)
     * @return xlsx document as a {@link ResponseEntity}
     */
    @PostMapping("/api/convert")
    @ResponseBody
    public ResponseEntity<byte[]> convert(@RequestParam("file") MultipartFile file,
                                          @RequestParam(value = "width", required = false) Integer width,
                                          @RequestParam(value = "height", required = false) Integer height,
                                          @RequestParam(value = "zoom", required = false) Double zoom,
                                          @RequestParam(value = "enlarge", required = false) Boolean enlarge,
                                          @RequestParam(value = "preset", required = false) String preset) {
        GridDocument document = buildDocument(file, width, height, zoom, enlarge, preset);
        String fileName = ImageConversionService.workbookName(uploadName(file));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(fileName, StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .contentType(XLSX)
                .body(workbookWriter.toByteArray(document));
    }

    /**
     * Converts the upload and returns a JSON description instead of the workbook.
     *
     * @param file    uploaded image
     * @param width   desired width in pixels (optional)
     * @param height  desired height in pixels (optional)
     * @param zoom    initial zoom in percent (optional)
     * @param enlarge whether small images may be enlarged (optional)
     * @param preset  preset name (optional)
     * @return JSON description of the grid, rules and information table
     */
    @PostMapping(value = "/api/describe", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<ConversionDescription> describe(@RequestParam("file") MultipartFile file,
                                                          @RequestParam(value = "width", required = false) Integer width,
                                                          @RequestParam(value = "height", required = false) Integer height,
                                                          @RequestParam(value = "zoom", required = false) Double zoom,
                                                          @RequestParam(value = "enlarge", required = false) Boolean enlarge,
                                                          @RequestParam(value = "preset", required = false) String preset) {
        GridDocument document = buildDocument(file, width, height, zoom, enlarge, preset);
        return ResponseEntity.ok(ConversionDescription.of(document, LayoutComposer.gridRange(document.grid())));
    }

    private GridDocument buildDocument(MultipartFile file,
                                       Integer width,
                                       Integer height,
                                       Double zoom,
                                       Boolean enlarge,
                                       String preset) {
        if (file == null || file.isEmpty()) {
            throw new ImageFileRequiredException();
        }
        String name = uploadName(file);
        ConversionSettings settings = settingsResolver.resolve(
                new ConversionRequest(name, null, width, height, zoom, null, null, enlarge, preset));
        try {
            return conversionService.buildDocument(file.getBytes(), name, settings);
        } catch (IOException ex) {
            throw new ImageDecodingException("Unable to read the uploaded image.", ex);
        }
    }

    private static String uploadName(MultipartFile file) {
        String original = file.getOriginalFilename();
        return original == null || original.isBlank() ? "upload" : original;
    }
}
