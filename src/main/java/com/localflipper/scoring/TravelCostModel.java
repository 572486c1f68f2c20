package com.localflipper.scoring;

import com.localflipper.config.SearchConfiguration;

/**
 * Fuel cost of a round trip to the edge of the search radius. Computed once per search configuration and
 * shared by every deal in the run.
 */
public final class TravelCostModel {

    public double roundTripCost(double radiusMiles, double mpg, double gasPricePerGallon) {
        if (!Double.isFinite(radiusMiles) || radiusMiles < 0.0) {
            throw new IllegalArgumentException("radius must be >= 0, got " + radiusMiles);
        }
        if (!Double.isFinite(mpg) || mpg <= 0.0) {
            throw new IllegalArgumentException("fuel economy must be > 0, got " + mpg);
        }
        if (!Double.isFinite(gasPricePerGallon) || gasPricePerGallon <= 0.0) {
            throw new IllegalArgumentException("fuel price must be > 0, got " + gasPricePerGallon);
        }
        if (radiusMiles == 0.0) {
            return 0.0;
        }
        double gallons = (radiusMiles * 2.0) / mpg;
        // unrounded; sinks format to cents
        return gallons * gasPricePerGallon;
    }

    public double roundTripCost(SearchConfiguration search) {
        return roundTripCost(search.getRadiusMiles(), search.getFuelEconomyMpg(), search.getFuelPricePerGallon());
    }
}
