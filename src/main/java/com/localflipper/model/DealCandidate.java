package com.localflipper.model;

/**
 * A listing paired with whatever market-price information was available. Profit and margin are zero when the
 * estimate carries no data.
 */
public final class DealCandidate {
    public final RawListing listing;
    public final MarketPriceEstimate estimate;
    public final double estimatedProfit;
    public final double profitMarginPct;

    public DealCandidate(RawListing listing, MarketPriceEstimate estimate, double estimatedProfit, double profitMarginPct) {
        this.listing = listing;
        this.estimate = MarketPriceEstimate.orEmpty(estimate);
        this.estimatedProfit = estimatedProfit;
        this.profitMarginPct = profitMarginPct;
    }

    public double localPrice() {
        return listing.price == null ? 0.0 : listing.price;
    }
}
