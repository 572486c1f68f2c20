package com.localflipper.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A deal candidate plus the annotations appended by enrichment. The candidate itself is never modified; each
 * enrichment stage produces a new row through {@link #toBuilder()}. A derived field is null when the stage that
 * computes it failed for this listing.
 */
@Value
@Builder(toBuilder = true)
public class DealRow {
    /** Originating search term; blank for single-term runs. */
    @Builder.Default
    String searchTerm = "";
    DealCandidate candidate;

    ConditionLabel conditionLabel;
    Double conditionScore;
    Integer sellerRating;
    Double ruleMarketValue;
    Double ruleProfit;
    Double travelCost;
    Double effectiveProfit;
    Double demandScore;

    @Builder.Default
    String reasonsJson = "{}";
    @Singular
    List<String> degradedStages;

    public static DealRow of(DealCandidate candidate) {
        return DealRow.builder().candidate(candidate).build();
    }

    public RawListing listing() {
        return candidate.listing;
    }

    public String source() {
        return candidate.listing.source;
    }

    public String title() {
        return candidate.listing.title;
    }

    public double localPrice() {
        return candidate.localPrice();
    }

    public boolean isDegraded() {
        return !degradedStages.isEmpty();
    }
}
