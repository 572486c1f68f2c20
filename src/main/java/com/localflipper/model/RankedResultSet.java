package com.localflipper.model;

import java.util.List;

/**
 * Final ordered rows of a run. The order is fixed by the ranking stage and must not be changed by sinks.
 */
public final class RankedResultSet {
    public static final String MODE_SINGLE = "single";
    public static final String MODE_SAVED = "saved";

    public final String mode;
    public final List<String> terms;
    public final List<DealRow> rows;

    public RankedResultSet(String mode, List<String> terms, List<DealRow> rows) {
        this.mode = mode == null || mode.isBlank() ? MODE_SINGLE : mode;
        this.terms = terms == null ? List.of() : List.copyOf(terms);
        this.rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static RankedResultSet empty(String mode, List<String> terms) {
        return new RankedResultSet(mode, terms, List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }
}
