package com.localflipper.output;

import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class XlsxExporterTest {

    @Test
    void writeShouldKeepNumbersNumericAndLeaveMissingCellsBlank() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new XlsxExporter(Path.of("unused"), "Flips").write(SampleDeals.single(), out);

        try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(out.toByteArray()))) {
            Sheet sheet = wb.getSheet("Flips");
            assertNotNull(sheet);
            Row header = sheet.getRow(0);
            assertEquals("Search Term", header.getCell(0).getStringCellValue());
            assertEquals("Demand Score", header.getCell(16).getStringCellValue());

            Row row = sheet.getRow(1);
            assertEquals("PS5 console, good condition", row.getCell(2).getStringCellValue());
            assertEquals(CellType.NUMERIC, row.getCell(4).getCellType());
            assertEquals(250.0, row.getCell(4).getNumericCellValue(), 1e-9);
            assertEquals(3.0, row.getCell(8).getNumericCellValue(), 1e-9);
            assertEquals(42.05, row.getCell(15).getNumericCellValue(), 1e-9);
            assertNull(row.getCell(16));
            assertTrue(row.getCell(18).getStringCellValue().startsWith(DealRecordSchema.EBAY_SEARCH_PREFIX));
        }
    }

    @Test
    void blankOrUnsafeSheetNamesShouldBeSanitized() {
        assertEquals(XlsxExporter.DEFAULT_SHEET, new XlsxExporter(Path.of("unused"), " ").sheetName());
        assertEquals("deals 2024 05", new XlsxExporter(Path.of("unused"), "deals 2024/05").sheetName());
    }

    @Test
    void exportShouldWriteWorkbookFile(@TempDir Path tempDir) throws Exception {
        Path written = new XlsxExporter(tempDir, null).export(SampleDeals.single(), LocalDateTime.of(2024, 5, 6, 7, 8, 9));

        assertEquals(tempDir.resolve("localflipper_single_20240506_070809.xlsx"), written);
        assertTrue(Files.size(written) > 0);
    }
}
