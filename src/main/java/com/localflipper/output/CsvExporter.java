package com.localflipper.output;

import com.localflipper.model.DealRow;
import com.localflipper.model.RankedResultSet;
import com.opencsv.CSVWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes a ranked result set as CSV.
 *
 * Output path pattern: {exportDir}/localflipper_{mode}_{yyyyMMdd_HHmmss}.csv
 */
public final class CsvExporter {
    private static final Logger LOG = LogManager.getLogger(CsvExporter.class);
    static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path exportDir;

    public CsvExporter(Path exportDir) {
        this.exportDir = exportDir;
    }

    public Path export(RankedResultSet results, LocalDateTime now) throws IOException {
        Files.createDirectories(exportDir);
        String filename = String.format("localflipper_%s_%s.csv", results.mode, STAMP.format(now));
        Path outputPath = exportDir.resolve(filename);
        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            write(results, out);
        }
        LOG.info("Written {} rows to CSV: {}", results.size(), outputPath);
        return outputPath;
    }

    public void write(RankedResultSet results, Writer out) throws IOException {
        try (CSVWriter writer = new CSVWriter(
                out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {
            writer.writeNext(DealRecordSchema.headers());
            for (DealRow row : results.rows) {
                writer.writeNext(DealRecordSchema.toRecord(row));
            }
            writer.flush();
        }
    }
}
