package com.infomedia.abacox.cdrexception.component.export.excel;

import com.infomedia.abacox.cdrexception.component.cdrprocessing.Call;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.CallRecord;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.DateTimeUtil;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.IngestionStats;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.LegQuality;
import com.infomedia.abacox.cdrexception.component.configmanager.CauseCodeService;
import com.infomedia.abacox.cdrexception.component.exceptionanalysis.Classification;
import com.infomedia.abacox.cdrexception.component.exceptionanalysis.ExceptionAnalysisResult;
import com.infomedia.abacox.cdrexception.component.exceptionanalysis.ExceptionGroup;
import com.infomedia.abacox.cdrexception.component.exceptionanalysis.ExceptionGroupKey;
import com.infomedia.abacox.cdrexception.component.exceptionanalysis.ExceptionSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Writes an analysis result as an .xlsx workbook.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class ExceptionReportGenerator {

    static final String SUMMARY_SHEET = "Summary";
    static final String EXCEPTIONS_SHEET = "Exceptions";
    static final String INSTANCES_SHEET = "Instances";
    static final String DEVICES_SHEET = "Devices";
    static final String CAUSE_CODES_SHEET = "Cause Codes";
    static final String DATES_SHEET = "Dates";

    private static final int MIN_COLUMN_WIDTH = 256 * 10;
    private static final int MAX_COLUMN_WIDTH = 256 * 50;

    private final CauseCodeService causeCodeService;

    public void write(ExceptionAnalysisResult result, Path reportFile) throws IOException {
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(reportFile)) {
            write(result, out);
        }
        log.info("Report written to {}", reportFile);
    }

    public void write(ExceptionAnalysisResult result, OutputStream out) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            Styles styles = new Styles(workbook);
            createSummarySheet(workbook, styles, result);
            if (!result.isEmpty()) {
                createExceptionsSheet(workbook, styles, result.getExceptions());
                createInstancesSheet(workbook, styles, result.getExceptions());
                createSummaryTables(workbook, styles, result.getSummary());
            }
            workbook.write(out);
        }
    }

    private void createSummarySheet(Workbook workbook, Styles styles, ExceptionAnalysisResult result) {
        IngestionStats stats = result.getIngestionStats();
        SheetWriter sheet = new SheetWriter(workbook.createSheet(SUMMARY_SHEET), styles);
        sheet.header("Item", "Value");
        sheet.row("Start (UTC)", DateTimeUtil.formatUtc(result.getStart()));
        sheet.row("End (UTC)", DateTimeUtil.formatUtc(result.getEnd()));
        sheet.row("Files read", stats.getFilesRead());
        sheet.row("Files skipped", stats.getFilesSkipped());
        sheet.row("CDR files", stats.getCallDetailFiles());
        sheet.row("CMR files", stats.getCallQualityFiles());
        sheet.row("Rows read", stats.getRowsRead());
        sheet.row("Rows skipped", stats.getRowsSkipped());
        sheet.row("Row parse errors", stats.getRowParseErrors());
        stats.getParseErrorsByType().forEach((type, count) ->
                sheet.row("  " + type.getDescription(), count));
        sheet.row("Correlated calls", result.getCorrelatedCalls());
        sheet.row("Replaced duplicate CDRs", result.getReplacedCallRecords());
        sheet.row("Orphan CMRs", result.getOrphanQualityRecords());
        sheet.row("Calls in range", result.getCallsInRange());
        sheet.row("Red exceptions", result.getRedCount());
        sheet.row("Amber exceptions", result.getAmberCount());
        if (result.isEmpty()) {
            sheet.row("Result", "No calls found in the requested window");
        }
        sheet.finish();
    }

    private void createExceptionsSheet(Workbook workbook, Styles styles, List<ExceptionGroup> exceptions) {
        SheetWriter sheet = new SheetWriter(workbook.createSheet(EXCEPTIONS_SHEET), styles);
        sheet.header("Classification", "Device", "Role", "Dimension", "Value", "Description", "Instances");
        for (ExceptionGroup group : exceptions) {
            ExceptionGroupKey key = group.getKey();
            sheet.newRow();
            sheet.classificationCell(group.getClassification());
            sheet.cell(key.deviceName());
            sheet.cell(key.role().getLabel());
            sheet.cell(key.dimension().getLabel());
            sheet.cell(key.getValueLabel());
            sheet.cell(key.isQuality() ? "Poor call quality" : causeCodeService.getDescription(key.causeCode()));
            sheet.cell(group.getInstanceCount());
        }
        sheet.finish();
    }

    private void createInstancesSheet(Workbook workbook, Styles styles, List<ExceptionGroup> exceptions) {
        SheetWriter sheet = new SheetWriter(workbook.createSheet(INSTANCES_SHEET), styles);
        sheet.header("Device", "Role", "Dimension", "Value", "Call ID", "Origination (UTC)", "Orig IP", "Dest IP",
                "Calling Number", "Original Called Number", "Final Called Number", "Orig Cause", "Dest Cause",
                "Orig Device", "Dest Device", "Duration (s)", "Avg MoS", "CCR");
        for (ExceptionGroup group : exceptions) {
            ExceptionGroupKey key = group.getKey();
            for (Call call : group.getCalls()) {
                CallRecord record = call.getRecord();
                LegQuality quality = call.getQuality(key.role());
                sheet.newRow();
                sheet.cell(key.deviceName());
                sheet.cell(key.role().getLabel());
                sheet.cell(key.dimension().getLabel());
                sheet.cell(key.getValueLabel());
                sheet.cell(call.getCallId().toString());
                sheet.cell(DateTimeUtil.formatUtc(call.getOriginationTime()));
                sheet.cell(record.getOrigIp());
                sheet.cell(record.getDestIp());
                sheet.cell(record.getCallingNumber());
                sheet.cell(record.getOriginalCalledNumber());
                sheet.cell(record.getFinalCalledNumber());
                sheet.cell(record.getOrigCauseCode());
                sheet.cell(record.getDestCauseCode());
                sheet.cell(record.getOrigDeviceName());
                sheet.cell(record.getDestDeviceName());
                sheet.cell(record.getDurationSeconds());
                sheet.cell(quality == null ? null : quality.metrics().avgMos());
                sheet.cell(quality == null ? null : quality.metrics().ccr());
            }
        }
        sheet.finish();
    }

    private void createSummaryTables(Workbook workbook, Styles styles, ExceptionSummary summary) {
        SheetWriter devices = new SheetWriter(workbook.createSheet(DEVICES_SHEET), styles);
        devices.header("Device", "Calls");
        summary.getCallsByDevice().forEach(devices::row);
        devices.finish();

        SheetWriter causes = new SheetWriter(workbook.createSheet(CAUSE_CODES_SHEET), styles);
        causes.header("Cause Code", "Description", "Calls");
        summary.getCallsByCauseCode().forEach((code, count) -> {
            causes.newRow();
            causes.cell(code);
            causes.cell(causeCodeService.getDescription(code));
            causes.cell(count);
        });
        causes.finish();

        SheetWriter dates = new SheetWriter(workbook.createSheet(DATES_SHEET), styles);
        dates.header("Date (UTC)", "Calls");
        for (Map.Entry<LocalDate, Long> entry : summary.getCallsByDate().entrySet()) {
            dates.row(entry.getKey().toString(), entry.getValue());
        }
        dates.finish();
    }

    private static final class Styles {
        private final CellStyle header;
        private final CellStyle data;
        private final Map<Classification, CellStyle> classification = new EnumMap<>(Classification.class);

        private Styles(Workbook workbook) {
            this.header = createHeaderStyle(workbook);
            this.data = createDataStyle(workbook, null);
            classification.put(Classification.RED, createDataStyle(workbook, fill(IndexedColors.RED)));
            classification.put(Classification.AMBER, createDataStyle(workbook, fill(IndexedColors.LIGHT_ORANGE)));
            classification.put(Classification.NONE, data);
        }

        private static Consumer<CellStyle> fill(IndexedColors color) {
            return style -> {
                style.setFillForegroundColor(color.getIndex());
                style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            };
        }

        private static CellStyle createHeaderStyle(Workbook workbook) {
            CellStyle headerStyle = workbook.createCellStyle();
            Font headerFont = workbook.createFont();
            headerStyle.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
            headerStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            headerFont.setBold(true);
            headerStyle.setFont(headerFont);
            setThinBorders(headerStyle);
            return headerStyle;
        }

        private static CellStyle createDataStyle(Workbook workbook, Consumer<CellStyle> styleCustomizer) {
            CellStyle dataStyle = workbook.createCellStyle();
            setThinBorders(dataStyle);
            if (styleCustomizer != null) {
                styleCustomizer.accept(dataStyle);
            }
            return dataStyle;
        }

        private static void setThinBorders(CellStyle style) {
            style.setBorderBottom(BorderStyle.THIN);
            style.setBorderTop(BorderStyle.THIN);
            style.setBorderLeft(BorderStyle.THIN);
            style.setBorderRight(BorderStyle.THIN);
        }
    }

    /**
     * Appends rows and cells left to right, tracking the widest text per column.
     * Column widths come from text length, not autoSizeColumn.
     */
    private static final class SheetWriter {
        private final Sheet sheet;
        private final Styles styles;
        private final List<Integer> widths = new ArrayList<>();
        private Row row;
        private int nextColumn;

        private SheetWriter(Sheet sheet, Styles styles) {
            this.sheet = sheet;
            this.styles = styles;
        }

        void header(String... names) {
            row = sheet.createRow(0);
            nextColumn = 0;
            for (String name : names) {
                Cell cell = row.createCell(nextColumn);
                cell.setCellValue(name);
                cell.setCellStyle(styles.header);
                track(name);
            }
            sheet.createFreezePane(0, 1);
        }

        void newRow() {
            row = sheet.createRow(sheet.getLastRowNum() + 1);
            nextColumn = 0;
        }

        void row(String label, Object value) {
            newRow();
            cell(label);
            cell(value);
        }

        void classificationCell(Classification classification) {
            Cell cell = row.createCell(nextColumn);
            cell.setCellValue(classification.name());
            cell.setCellStyle(styles.classification.get(classification));
            track(classification.name());
        }

        void cell(Object value) {
            Cell cell = row.createCell(nextColumn);
            cell.setCellStyle(styles.data);
            if (value instanceof Number number) {
                if (value instanceof BigDecimal decimal) {
                    cell.setCellValue(decimal.doubleValue());
                } else {
                    cell.setCellValue(number.doubleValue());
                }
                track(value.toString());
            } else if (value != null) {
                cell.setCellValue(value.toString());
                track(value.toString());
            } else {
                cell.setBlank();
                track("");
            }
        }

        private void track(String text) {
            int width = (text.length() + 2) * 256;
            if (widths.size() <= nextColumn) {
                widths.add(width);
            } else if (width > widths.get(nextColumn)) {
                widths.set(nextColumn, width);
            }
            nextColumn++;
        }

        void finish() {
            for (int i = 0; i < widths.size(); i++) {
                sheet.setColumnWidth(i, Math.max(MIN_COLUMN_WIDTH, Math.min(MAX_COLUMN_WIDTH, widths.get(i))));
            }
        }
    }
}
