package com.example.image2excel.infrastructure.excel;

import com.example.image2excel.domain.model.CellRange;
import com.example.image2excel.domain.model.ChannelGrid;
import com.example.image2excel.domain.model.DocumentLayout;
import com.example.image2excel.domain.model.GradientRule;
import com.example.image2excel.domain.model.GridDocument;
import com.example.image2excel.domain.model.MetadataTable;
import com.example.image2excel.infrastructure.exception.WorkbookWriteException;
import com.example.image2excel.infrastructure.exception.WorkbookWriteException.Reason;
import org.apache.poi.ss.usermodel.Color;
import org.apache.poi.ss.usermodel.ConditionalFormattingThreshold;
import org.apache.poi.ss.usermodel.ConditionalFormattingThreshold.RangeType;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.streaming.SXSSFRow;
import org.apache.poi.xssf.streaming.SXSSFSheet;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.apache.poi.xssf.usermodel.DefaultIndexedColorMap;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFColorScaleFormatting;
import org.apache.poi.xssf.usermodel.XSSFConditionalFormattingRule;
import org.apache.poi.xssf.usermodel.XSSFConditionalFormattingThreshold;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFSheetConditionalFormatting;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTCol;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTCols;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTSheetFormatPr;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTWorksheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Infrastructure service that renders a {@link GridDocument} as an xlsx workbook with Apache POI.
 * Files are written next to their destination first and moved into place once complete.
 */
@Service
public class PoiWorkbookWriter {

    private static final Logger log = LoggerFactory.getLogger(PoiWorkbookWriter.class);
    private static final int INFORMATION_COLUMN_WIDTH = 35 * 256;
    private static final int INFORMATION_FIRST_ROW = 2;
    private static final int ROW_WINDOW = 100;

    /**
     * Saves the workbook to {@code target}, replacing an existing writable file.
     *
     * @param document finished document
     * @param target   destination xlsx file
     * @throws WorkbookWriteException when the directory is missing, the file is read-only or writing fails
     */
    public void save(GridDocument document, Path target) {
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            if (directory == null || !Files.isDirectory(directory)) {
                throw new NoSuchFileException(String.valueOf(directory));
            }
            if (Files.exists(target) && !Files.isWritable(target)) {
                throw new AccessDeniedException(target.toString());
            }
            temp = Files.createTempFile(directory, ".image2excel-", ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                write(document, out);
            }
            moveIntoPlace(temp, target);
            temp = null;
        } catch (NoSuchFileException ex) {
            throw new WorkbookWriteException(Reason.PATH_NOT_FOUND, target, ex);
        } catch (AccessDeniedException ex) {
            throw new WorkbookWriteException(Reason.PERMISSION_DENIED, target, ex);
        } catch (IOException ex) {
            throw new WorkbookWriteException(Reason.WRITE_FAILURE, target, ex);
        } finally {
            deleteLeftover(temp);
        }
    }

    /**
     * Renders the workbook into memory, for HTTP downloads.
     *
     * @param document finished document
     * @return xlsx bytes
     */
    public byte[] toByteArray(GridDocument document) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(document, out);
        } catch (IOException ex) {
            throw new WorkbookWriteException("Unable to render the workbook.", ex);
        }
        return out.toByteArray();
    }

    /**
     * Renders the workbook to a stream. The stream is not closed.
     * Sheet settings and color scales are prepared on an XSSF template; the cells are streamed in
     * row by row so only a window of rows is held in memory.
     *
     * @param document finished document
     * @param out      destination stream
     * @throws IOException when POI fails to write the package
     */
    public void write(GridDocument document, OutputStream out) throws IOException {
        try (SXSSFWorkbook workbook = new SXSSFWorkbook(prepareTemplate(document), ROW_WINDOW, true)) {
            try {
                writeGrid(workbook.getSheet(GridDocument.IMAGE_SHEET), document.grid(), document.layout().rowHeight());
                writeInformation(workbook.getSheet(GridDocument.INFORMATION_SHEET), document.metadata());
                workbook.write(out);
            } finally {
                if (!workbook.dispose()) {
                    log.warn("Could not delete the temporary row files of a streamed workbook");
                }
            }
        }
    }

    private XSSFWorkbook prepareTemplate(GridDocument document) {
        XSSFWorkbook template = new XSSFWorkbook();
        XSSFSheet imageSheet = template.createSheet(GridDocument.IMAGE_SHEET);
        applyLayout(imageSheet, document.layout());
        applyColorScales(imageSheet, document.rules());

        XSSFSheet informationSheet = template.createSheet(GridDocument.INFORMATION_SHEET);
        informationSheet.setColumnWidth(0, INFORMATION_COLUMN_WIDTH);
        informationSheet.setColumnWidth(1, INFORMATION_COLUMN_WIDTH);
        return template;
    }

    /**
     * Applies sheet-wide defaults rather than per-row or per-column sizes. Rows without data are
     * hidden by default and the columns right of the grid are hidden as one block.
     */
    private void applyLayout(XSSFSheet sheet, DocumentLayout layout) {
        sheet.setDisplayGridlines(layout.showGridLines());
        sheet.setDisplayRowColHeadings(layout.showHeadings());
        sheet.setZoom(layout.zoomPercent());
        sheet.setDefaultRowHeightInPoints((float) layout.rowHeight());

        CTWorksheet worksheet = sheet.getCTWorksheet();
        CTSheetFormatPr format = worksheet.isSetSheetFormatPr()
                ? worksheet.getSheetFormatPr()
                : worksheet.addNewSheetFormatPr();
        format.setDefaultColWidth(layout.columnWidth());
        format.setCustomHeight(true);
        format.setZeroHeight(true);

        if (layout.hasHiddenColumns()) {
            CTCols cols = worksheet.sizeOfColsArray() > 0 ? worksheet.getColsArray(0) : worksheet.addNewCols();
            CTCol hidden = cols.addNewCol();
            hidden.setMin(layout.hiddenColumnStart());
            hidden.setMax(layout.hiddenColumnEnd());
            hidden.setWidth(layout.columnWidth());
            hidden.setHidden(true);
        }
    }

    private void writeGrid(SXSSFSheet sheet, ChannelGrid grid, double rowHeight) {
        for (int rowIndex = 0; rowIndex < grid.height(); rowIndex++) {
            // Rows with data need an explicit height, the default ones are zero height.
            SXSSFRow row = sheet.createRow(rowIndex);
            row.setHeightInPoints((float) rowHeight);
            for (int column = 0; column < grid.width(); column++) {
                row.createCell(column).setCellValue(grid.value(column, rowIndex));
            }
        }
    }

    /**
     * Registers one two-stop color scale per rule over all of the rule's ranges.
     */
    private void applyColorScales(XSSFSheet sheet, List<GradientRule> rules) {
        XSSFSheetConditionalFormatting formatting = sheet.getSheetConditionalFormatting();
        for (GradientRule rule : rules) {
            XSSFConditionalFormattingRule colorScaleRule = formatting.createConditionalFormattingColorScaleRule();
            XSSFColorScaleFormatting colorScale = colorScaleRule.getColorScaleFormatting();

            XSSFConditionalFormattingThreshold low = colorScale.createThreshold();
            low.setRangeType(RangeType.NUMBER);
            low.setValue((double) GradientRule.LOW_VALUE);
            XSSFConditionalFormattingThreshold high = colorScale.createThreshold();
            high.setRangeType(RangeType.NUMBER);
            high.setValue((double) GradientRule.HIGH_VALUE);

            colorScale.setThresholds(new ConditionalFormattingThreshold[]{low, high});
            colorScale.setColors(new Color[]{opaque(GradientRule.LOW_COLOR), opaque(rule.highColor())});

            formatting.addConditionalFormatting(toRegions(rule.ranges()), colorScaleRule);
            log.debug("Bound {} color scale to {} ranges", rule.channel(), rule.ranges().size());
        }
    }

    private void writeInformation(SXSSFSheet sheet, MetadataTable metadata) {
        int rowIndex = INFORMATION_FIRST_ROW;
        for (MetadataTable.Entry entry : metadata.entries()) {
            SXSSFRow row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(entry.label());
            row.createCell(1).setCellValue(entry.value());
        }
    }

    private static CellRangeAddress[] toRegions(List<CellRange> ranges) {
        return ranges.stream()
                .map(range -> new CellRangeAddress(range.startRow() - 1, range.endRow() - 1,
                        range.startColumn() - 1, range.endColumn() - 1))
                .toArray(CellRangeAddress[]::new);
    }

    private static XSSFColor opaque(int rgb) {
        byte[] argb = {(byte) 0xFF, (byte) (rgb >> 16), (byte) (rgb >> 8), (byte) rgb};
        return new XSSFColor(argb, new DefaultIndexedColorMap());
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move not supported for {}, falling back to a plain move", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteLeftover(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            log.warn("Could not delete temporary workbook {}", temp, ex);
        }
    }
}
