package com.localflipper.pipeline;

import com.localflipper.model.DealRow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Orders enriched rows by demand score, then effective profit, both descending. Rows missing either value sort
 * after rows that have it; equal keys keep their input order.
 */
public final class RankingAggregator {
    public static final Comparator<DealRow> RANK_ORDER = Comparator
            .comparing(DealRow::getDemandScore, Comparator.nullsLast(Comparator.<Double>reverseOrder()))
            .thenComparing(DealRow::getEffectiveProfit, Comparator.nullsLast(Comparator.<Double>reverseOrder()));

    public List<DealRow> rank(List<DealRow> rows) {
        List<DealRow> out = rows == null ? new ArrayList<>() : new ArrayList<>(rows);
        // List.sort is a stable merge sort
        out.sort(RANK_ORDER);
        return out;
    }

    /**
     * Tags every row with the term that produced it, concatenates the per-term lists in iteration order and
     * ranks the union once.
     */
    public List<DealRow> merge(Map<String, List<DealRow>> rowsByTerm) {
        List<DealRow> union = new ArrayList<>();
        if (rowsByTerm == null) {
            return union;
        }
        for (Map.Entry<String, List<DealRow>> entry : rowsByTerm.entrySet()) {
            String term = entry.getKey() == null ? "" : entry.getKey();
            if (entry.getValue() == null) {
                continue;
            }
            for (DealRow row : entry.getValue()) {
                union.add(row.toBuilder().searchTerm(term).build());
            }
        }
        return rank(union);
    }
}
