package com.localflipper.config;

import lombok.Builder;
import lombok.Getter;

import java.util.Locale;

/**
 * Immutable parameters of one search run. Construction validates every field, so an instance that exists
 * is always safe to hand to the pipeline.
 */
@Getter
public final class SearchConfiguration {
    private final String craigslistSite;
    private final String postalCode;
    private final int radiusMiles;
    private final String keyword;
    private final int maxResultsPerSource;
    /** Null when no ceiling applies. */
    private final Double priceCeiling;
    private final double minProfit;
    private final double minMarginPct;
    private final double fuelEconomyMpg;
    private final double fuelPricePerGallon;
    private final boolean includeFacebook;

    @Builder(toBuilder = true)
    private SearchConfiguration(
            String craigslistSite,
            String postalCode,
            int radiusMiles,
            String keyword,
            int maxResultsPerSource,
            Double priceCeiling,
            double minProfit,
            double minMarginPct,
            double fuelEconomyMpg,
            double fuelPricePerGallon,
            boolean includeFacebook
    ) {
        this.craigslistSite = trimToEmpty(craigslistSite).toLowerCase(Locale.ROOT);
        this.postalCode = trimToEmpty(postalCode);
        this.radiusMiles = radiusMiles;
        this.keyword = trimToEmpty(keyword);
        this.maxResultsPerSource = maxResultsPerSource;
        this.priceCeiling = priceCeiling != null && priceCeiling == 0.0 ? null : priceCeiling;
        this.minProfit = minProfit;
        this.minMarginPct = minMarginPct;
        this.fuelEconomyMpg = fuelEconomyMpg;
        this.fuelPricePerGallon = fuelPricePerGallon;
        this.includeFacebook = includeFacebook;
        validate();
    }

    public static SearchConfiguration fromConfig(Config config) {
        return SearchConfiguration.builder()
                .craigslistSite(config.getString("search.craigslist_site", "redding"))
                .postalCode(config.getString("search.postal", ""))
                .radiusMiles(config.getInt("search.radius_miles", 50))
                .keyword(config.getString("search.query", ""))
                .maxResultsPerSource(config.getInt("search.max_results", 50))
                // 0 means no ceiling; negatives are rejected by validate()
                .priceCeiling(config.getDouble("search.max_price", 0.0))
                .minProfit(config.getDouble("filter.min_profit", 0.0))
                .minMarginPct(config.getDouble("filter.min_margin_pct", 0.0))
                .fuelEconomyMpg(config.getDouble("travel.mpg", 22.0))
                .fuelPricePerGallon(config.getDouble("travel.gas_price", 4.50))
                .includeFacebook(config.getBoolean("search.include_facebook", false))
                .build();
    }

    /**
     * Returns a copy of this configuration searching for {@code term} instead.
     */
    public SearchConfiguration withKeyword(String term) {
        return toBuilder().keyword(term).build();
    }

    /**
     * True when neither threshold filters anything out.
     */
    public boolean isRawMode() {
        return minProfit <= 0.0 && minMarginPct <= 0.0;
    }

    private void validate() {
        if (keyword.isEmpty()) {
            throw invalid("keyword must not be blank");
        }
        if (radiusMiles < 0) {
            throw invalid("radius must be >= 0, got " + radiusMiles);
        }
        if (maxResultsPerSource < 1) {
            throw invalid("max results per source must be >= 1, got " + maxResultsPerSource);
        }
        if (priceCeiling != null && (!Double.isFinite(priceCeiling) || priceCeiling < 0.0)) {
            throw invalid("price ceiling must be a positive amount, got " + priceCeiling);
        }
        if (!Double.isFinite(minProfit) || minProfit < 0.0) {
            throw invalid("minimum profit must be >= 0, got " + minProfit);
        }
        if (!Double.isFinite(minMarginPct) || minMarginPct < 0.0) {
            throw invalid("minimum margin percent must be >= 0, got " + minMarginPct);
        }
        if (!Double.isFinite(fuelEconomyMpg) || fuelEconomyMpg <= 0.0) {
            throw invalid("fuel economy must be > 0, got " + fuelEconomyMpg);
        }
        if (!Double.isFinite(fuelPricePerGallon) || fuelPricePerGallon <= 0.0) {
            throw invalid("fuel price must be > 0, got " + fuelPricePerGallon);
        }
    }

    private static IllegalArgumentException invalid(String message) {
        return new IllegalArgumentException("invalid search config: " + message);
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    @Override
    public String toString() {
        return "SearchConfiguration{"
                + "site=" + craigslistSite
                + ", postal=" + postalCode
                + ", radius=" + radiusMiles
                + ", keyword=" + keyword
                + ", maxResults=" + maxResultsPerSource
                + ", priceCeiling=" + priceCeiling
                + ", minProfit=" + minProfit
                + ", minMarginPct=" + minMarginPct
                + ", mpg=" + fuelEconomyMpg
                + ", gasPrice=" + fuelPricePerGallon
                + ", facebook=" + includeFacebook
                + '}';
    }
}
