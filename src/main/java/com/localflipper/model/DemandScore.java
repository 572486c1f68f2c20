package com.localflipper.model;

import java.util.Collections;
import java.util.Map;

public final class DemandScore {
    public final double score;
    public final Map<String, Double> breakdown;

    public DemandScore(double score, Map<String, Double> breakdown) {
        this.score = score;
        this.breakdown = breakdown == null ? Map.of() : Collections.unmodifiableMap(breakdown);
    }
}
