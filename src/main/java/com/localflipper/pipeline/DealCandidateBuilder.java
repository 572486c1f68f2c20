package com.localflipper.pipeline;

import com.localflipper.model.DealCandidate;
import com.localflipper.model.MarketPriceEstimate;
import com.localflipper.model.RawListing;

import java.util.Optional;

/**
 * Pairs a listing with its market-price estimate. Always yields a candidate for a listing with a usable price;
 * a missing or empty estimate gives zero profit and margin instead of failing.
 */
public final class DealCandidateBuilder {

    public Optional<DealCandidate> build(RawListing listing, MarketPriceEstimate estimate) {
        if (listing == null || !listing.hasUsablePrice()) {
            return Optional.empty();
        }
        MarketPriceEstimate est = MarketPriceEstimate.orEmpty(estimate);
        double price = listing.price;
        if (!est.hasData()) {
            return Optional.of(new DealCandidate(listing, est, 0.0, 0.0));
        }
        double profit = est.averageSoldPrice - price;
        double marginPct = price > 0.0 ? profit / price * 100.0 : 0.0;
        return Optional.of(new DealCandidate(listing, est, round(profit, 100.0), round(marginPct, 10.0)));
    }

    private static double round(double value, double scale) {
        return Math.round(value * scale) / scale;
    }
}
