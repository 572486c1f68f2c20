package com.localflipper.model;

/**
 * Average sold price for a title as reported by the market-price service.
 */
public final class MarketPriceEstimate {
    public static final MarketPriceEstimate EMPTY = new MarketPriceEstimate(0.0, 0);

    public final double averageSoldPrice;
    public final int sampleSize;

    public MarketPriceEstimate(double averageSoldPrice, int sampleSize) {
        this.averageSoldPrice = Double.isFinite(averageSoldPrice) ? Math.max(0.0, averageSoldPrice) : 0.0;
        this.sampleSize = Math.max(0, sampleSize);
    }

    public static MarketPriceEstimate orEmpty(MarketPriceEstimate estimate) {
        return estimate == null ? EMPTY : estimate;
    }

    /**
     * A zero sample size means "no data" even when an average is present.
     */
    public boolean hasData() {
        return sampleSize > 0 && averageSoldPrice > 0.0;
    }

    @Override
    public String toString() {
        return "MarketPriceEstimate{avg=" + averageSoldPrice + ", samples=" + sampleSize + '}';
    }
}
