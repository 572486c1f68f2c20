package com.localflipper.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures a single search run's step timings, item counts and soft-error counts.
 */
public final class RunTelemetry {
    public static final String STEP_ADAPTER_FETCH = "ADAPTER_FETCH";
    public static final String STEP_PRICE_LOOKUP = "PRICE_LOOKUP";
    public static final String STEP_CANDIDATE_BUILD = "CANDIDATE_BUILD";
    public static final String STEP_FILTER = "FILTER";
    public static final String STEP_ENRICH = "ENRICH";
    public static final String STEP_RANK = "RANK";
    public static final String STEP_EXPORT = "EXPORT";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runMode;
    private final String term;
    private final Instant startedAt;
    private Instant finishedAt;

    private int listingsRaw;
    private int candidates;
    private int rowsOut;
    private int degradedRows;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String runMode, String term, Instant startedAt) {
        this.runMode = blankTo(runMode, "single");
        this.term = blankTo(term, "-");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized String term() {
        return term;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public synchronized void endStep(
            String name,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        if (optionalNote != null && !optionalNote.trim().isEmpty()) {
            String note = optionalNote.trim();
            if (stat.optionalNote.isEmpty()) {
                stat.optionalNote = note;
            } else if (!stat.optionalNote.contains(note)) {
                stat.optionalNote = stat.optionalNote + "; " + note;
            }
        }
        if (errorCount > 0L) {
            errorsTotal += (int) Math.max(0L, errorCount);
        }
    }

    public synchronized void setCounts(int listingsRaw, int candidates, int rowsOut, int degradedRows) {
        this.listingsRaw = Math.max(0, listingsRaw);
        this.candidates = Math.max(0, candidates);
        this.rowsOut = Math.max(0, rowsOut);
        this.degradedRows = Math.max(0, degradedRows);
    }

    public synchronized int listingsRaw() {
        return listingsRaw;
    }

    public synchronized int candidates() {
        return candidates;
    }

    public synchronized int degradedRows() {
        return degradedRows;
    }

    /**
     * Folds a step measured by another telemetry instance (one term of a multi-term run) into this one.
     */
    public synchronized void absorbStep(StepRecord record, String note) {
        if (record == null) {
            return;
        }
        startStep(record.name());
        endStep(record.name(), record.itemsIn(), record.itemsOut(), record.errorCount(), note);
        steps.get(sanitizeStepName(record.name())).elapsedMs += Math.max(0L, record.elapsedMs());
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount,
                    stat.optionalNote
            ));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_mode=").append(runMode).append('\n');
        sb.append("term=").append(term).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("listings_raw=").append(listingsRaw).append('\n');
        sb.append("candidates=").append(candidates).append('\n');
        sb.append("rows_out=").append(rowsOut).append('\n');
        sb.append("degraded_rows=").append(degradedRows).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (stat.optionalNote != null && !stat.optionalNote.isBlank()) {
                sb.append(" note=").append(stat.optionalNote.trim());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String optionalNote;

        private StepStat(String name) {
            this.name = name;
            this.optionalNote = "";
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
    }
}
