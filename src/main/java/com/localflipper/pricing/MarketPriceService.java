package com.localflipper.pricing;

import com.localflipper.model.MarketPriceEstimate;

/**
 * Looks up recently sold prices for an item title.
 */
public interface MarketPriceService {

    /**
     * Returns the estimate for {@code title}, or {@link MarketPriceEstimate#EMPTY} when nothing is known. May
     * throw; callers degrade the listing to the empty estimate.
     */
    MarketPriceEstimate lookup(String title) throws Exception;
}
