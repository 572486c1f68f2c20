package com.localflipper.model;

public final class RuleValuation {
    public final double marketValue;
    public final double profit;

    public RuleValuation(double marketValue, double profit) {
        this.marketValue = marketValue;
        this.profit = profit;
    }
}
