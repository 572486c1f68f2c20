package com.localflipper.output;

import com.localflipper.model.DealRow;
import com.localflipper.model.RankedResultSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the ranked deals as an HTML report using Thymeleaf templates from classpath.
 */
public final class ThymeleafReportRenderer {
    private static final Logger LOG = LogManager.getLogger(ThymeleafReportRenderer.class);
    private static final DateTimeFormatter GENERATED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final TemplateEngine templateEngine;

    public ThymeleafReportRenderer() {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/");
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(false);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
    }

    public String render(RankedResultSet results, LocalDateTime now) {
        Context context = new Context(Locale.ROOT);
        context.setVariable("mode", results.mode);
        context.setVariable("terms", results.terms);
        context.setVariable("generatedAt", GENERATED_AT.format(now));
        context.setVariable("headers", DealRecordSchema.headers());
        context.setVariable("rows", toViewRows(results));
        return templateEngine.process("deals_report", context);
    }

    public Path export(RankedResultSet results, Path reportDir, LocalDateTime now) throws IOException {
        Files.createDirectories(reportDir);
        String filename = String.format("localflipper_%s_%s.html", results.mode, CsvExporter.STAMP.format(now));
        Path outputPath = reportDir.resolve(filename);
        Files.writeString(outputPath, render(results, now), StandardCharsets.UTF_8);
        LOG.info("Report written: {}", outputPath);
        return outputPath;
    }

    private List<Map<String, Object>> toViewRows(RankedResultSet results) {
        List<Map<String, Object>> out = new ArrayList<>();
        int rank = 1;
        for (DealRow row : results.rows) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("rank", rank++);
            String[] record = DealRecordSchema.toRecord(row);
            // the two link columns are rendered as anchors
            view.put("cells", Arrays.copyOf(record, record.length - 2));
            view.put("link", row.listing().url);
            view.put("ebaySearch", DealRecordSchema.ebaySearchUrl(row.title()));
            view.put("degraded", row.isDegraded());
            view.put("reasons", row.getReasonsJson());
            out.add(view);
        }
        return out;
    }
}
