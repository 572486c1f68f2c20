package com.localflipper.output;

import com.localflipper.model.DealRow;
import com.localflipper.model.RankedResultSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Spreadsheet sink: one header row plus one row per deal, in ranked order. Numeric columns are written as
 * numeric cells so the sheet can be sorted and summed.
 */
public final class XlsxExporter {
    private static final Logger LOG = LogManager.getLogger(XlsxExporter.class);
    public static final String DEFAULT_SHEET = "LocalFlipperDeals";

    private final Path exportDir;
    private final String sheetName;

    public XlsxExporter(Path exportDir, String sheetName) {
        this.exportDir = exportDir;
        this.sheetName = WorkbookUtil.createSafeSheetName(
                sheetName == null || sheetName.isBlank() ? DEFAULT_SHEET : sheetName.trim());
    }

    public Path export(RankedResultSet results, LocalDateTime now) throws IOException {
        Files.createDirectories(exportDir);
        String filename = String.format("localflipper_%s_%s.xlsx", results.mode, CsvExporter.STAMP.format(now));
        Path outputPath = exportDir.resolve(filename);
        try (OutputStream out = Files.newOutputStream(outputPath)) {
            write(results, out);
        }
        LOG.info("Written {} rows to sheet '{}': {}", results.size(), sheetName, outputPath);
        return outputPath;
    }

    public void write(RankedResultSet results, OutputStream out) throws IOException {
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet(sheetName);
            CellStyle headerStyle = wb.createCellStyle();
            Font bold = wb.createFont();
            bold.setBold(true);
            headerStyle.setFont(bold);
            DataFormat format = wb.createDataFormat();
            CellStyle moneyStyle = wb.createCellStyle();
            moneyStyle.setDataFormat(format.getFormat("#,##0.00"));
            CellStyle decimalStyle = wb.createCellStyle();
            decimalStyle.setDataFormat(format.getFormat("0.00"));

            List<DealRecordSchema.Column> columns = DealRecordSchema.columns();
            Row header = sheet.createRow(0);
            for (int c = 0; c < columns.size(); c++) {
                Cell cell = header.createCell(c);
                cell.setCellValue(columns.get(c).header);
                cell.setCellStyle(headerStyle);
            }
            int r = 1;
            for (DealRow deal : results.rows) {
                Row row = sheet.createRow(r++);
                for (int c = 0; c < columns.size(); c++) {
                    DealRecordSchema.Column column = columns.get(c);
                    Object value = DealRecordSchema.value(deal, column);
                    if (value == null) {
                        continue;
                    }
                    Cell cell = row.createCell(c);
                    if (value instanceof Number) {
                        cell.setCellValue(((Number) value).doubleValue());
                        if (column.kind == DealRecordSchema.Kind.MONEY) {
                            cell.setCellStyle(moneyStyle);
                        } else if (column.kind == DealRecordSchema.Kind.DECIMAL) {
                            cell.setCellStyle(decimalStyle);
                        }
                    } else {
                        cell.setCellValue(String.valueOf(value));
                    }
                }
            }
            sheet.createFreezePane(0, 1);
            wb.write(out);
        }
    }

    public String sheetName() {
        return sheetName;
    }
}
