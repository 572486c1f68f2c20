package com.localflipper.output;

import com.localflipper.model.RankedResultSet;
import com.opencsv.CSVReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvExporterTest {

    @Test
    void writeShouldEmitHeaderThenRowsInOrder() throws Exception {
        StringWriter out = new StringWriter();
        new CsvExporter(Path.of("unused")).write(SampleDeals.single(), out);

        List<String[]> records = readAll(new StringReader(out.toString()));

        assertEquals(2, records.size());
        assertArrayEquals(DealRecordSchema.headers(), records.get(0));
        assertArrayEquals(new String[]{
                "",
                "craigslist",
                "PS5 console, good condition",
                "Redding",
                "250.00",
                "400.00",
                "150.00",
                "60.00",
                "3",
                "Good",
                "0.70",
                "60",
                "312.50",
                "62.50",
                "20.45",
                "42.05",
                "",
                "https://redding.craigslist.org/vgm/d/ps5/1.html",
                "https://www.ebay.com/sch/i.html?_nkw=PS5+console%2C+good+condition"
        }, records.get(1));
    }

    @Test
    void emptyResultShouldStillWriteHeader() throws Exception {
        StringWriter out = new StringWriter();
        new CsvExporter(Path.of("unused")).write(RankedResultSet.empty(RankedResultSet.MODE_SAVED, List.of()), out);

        List<String[]> records = readAll(new StringReader(out.toString()));

        assertEquals(1, records.size());
        assertEquals("Search Term", records.get(0)[0]);
        assertEquals("eBay Search", records.get(0)[18]);
    }

    @Test
    void exportShouldNameFileByModeAndTimestamp(@TempDir Path tempDir) throws Exception {
        Path exportDir = tempDir.resolve("exports");

        Path written = new CsvExporter(exportDir).export(SampleDeals.single(), LocalDateTime.of(2024, 5, 6, 7, 8, 9));

        assertEquals(exportDir.resolve("localflipper_single_20240506_070809.csv"), written);
        assertTrue(Files.exists(written));
        try (Reader reader = Files.newBufferedReader(written, StandardCharsets.UTF_8)) {
            assertEquals(2, readAll(reader).size());
        }
    }

    private static List<String[]> readAll(Reader reader) throws Exception {
        try (CSVReader csv = new CSVReader(reader)) {
            return csv.readAll();
        }
    }
}
