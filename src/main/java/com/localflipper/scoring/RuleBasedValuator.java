package com.localflipper.scoring;

import com.localflipper.config.Config;
import com.localflipper.model.RuleValuation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Estimates resale value from the local asking price alone: price times a multiplier interpolated from a
 * condition-score curve. Independent of any external price source.
 */
public final class RuleBasedValuator {
    public static final String DEFAULT_CURVE = "0.0:0.60,0.3:0.90,0.5:1.10,0.7:1.25,0.9:1.40,1.0:1.50";

    private final List<CurvePoint> curve;

    public RuleBasedValuator() {
        this(parseCurve(DEFAULT_CURVE));
    }

    public RuleBasedValuator(Config config) {
        this(parseCurve(config.getString("valuation.curve", DEFAULT_CURVE)));
    }

    public RuleBasedValuator(List<CurvePoint> curve) {
        if (curve == null || curve.isEmpty()) {
            throw new IllegalArgumentException("valuation curve must have at least one point");
        }
        List<CurvePoint> sorted = new ArrayList<>(curve);
        sorted.sort(Comparator.comparingDouble(CurvePoint::conditionScore));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).multiplier() < sorted.get(i - 1).multiplier()) {
                throw new IllegalArgumentException("valuation curve multipliers must not decrease with condition: " + sorted);
            }
        }
        this.curve = List.copyOf(sorted);
    }

    public RuleValuation valuate(double localPrice, double conditionScore) {
        double price = Double.isFinite(localPrice) ? Math.max(0.0, localPrice) : 0.0;
        double value = round2(price * multiplierFor(conditionScore));
        double profit = round2(value - price);
        return new RuleValuation(value, profit);
    }

    public double multiplierFor(double conditionScore) {
        double score = Double.isFinite(conditionScore) ? clamp(conditionScore, 0.0, 1.0) : 0.0;
        CurvePoint first = curve.get(0);
        if (score <= first.conditionScore()) {
            return first.multiplier();
        }
        for (int i = 1; i < curve.size(); i++) {
            CurvePoint lo = curve.get(i - 1);
            CurvePoint hi = curve.get(i);
            if (score <= hi.conditionScore()) {
                double span = hi.conditionScore() - lo.conditionScore();
                if (span <= 0.0) {
                    return hi.multiplier();
                }
                double t = (score - lo.conditionScore()) / span;
                return lo.multiplier() + t * (hi.multiplier() - lo.multiplier());
            }
        }
        return curve.get(curve.size() - 1).multiplier();
    }

    /**
     * Parses {@code score:multiplier} pairs separated by commas, e.g. {@code 0.0:0.6,1.0:1.5}.
     */
    public static List<CurvePoint> parseCurve(String raw) {
        List<CurvePoint> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String token : raw.split(",")) {
            String t = token.trim();
            if (t.isEmpty()) {
                continue;
            }
            String[] parts = t.split(":");
            if (parts.length != 2) {
                throw new IllegalArgumentException("invalid valuation curve point: " + t);
            }
            try {
                double score = Double.parseDouble(parts[0].trim());
                double multiplier = Double.parseDouble(parts[1].trim());
                if (multiplier < 0.0) {
                    throw new IllegalArgumentException("valuation multiplier must be >= 0: " + t);
                }
                out.add(new CurvePoint(score, multiplier));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid valuation curve point: " + t, e);
            }
        }
        return out;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public record CurvePoint(double conditionScore, double multiplier) {
    }
}
