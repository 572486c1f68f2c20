package com.localflipper.scoring;

import com.localflipper.config.Config;
import com.localflipper.model.DemandScore;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Blends title relevance, condition and rule profit into one 0..100 demand score. Profit passes through a
 * bounded saturating transform so one outlier cannot dominate the ranking.
 */
public class DemandScorer {
    private final double wRelevance;
    private final double wCondition;
    private final double wProfit;
    private final double halfSaturation;

    public DemandScorer() {
        this(0.35, 0.25, 0.40, 100.0);
    }

    public DemandScorer(Config config) {
        this(
                config.getDouble("demand.weight_relevance", 0.35),
                config.getDouble("demand.weight_condition", 0.25),
                config.getDouble("demand.weight_profit", 0.40),
                config.getDouble("demand.profit_half_saturation", 100.0)
        );
    }

    public DemandScorer(double wRelevance, double wCondition, double wProfit, double halfSaturation) {
        if (wRelevance < 0.0 || wCondition < 0.0 || wProfit < 0.0) {
            throw new IllegalArgumentException("demand weights must be >= 0");
        }
        if (!(halfSaturation > 0.0)) {
            throw new IllegalArgumentException("demand.profit_half_saturation must be > 0, got " + halfSaturation);
        }
        this.wRelevance = wRelevance;
        this.wCondition = wCondition;
        this.wProfit = wProfit;
        this.halfSaturation = halfSaturation;
    }

    public DemandScore score(String title, String categoryHint, double conditionScore, double ruleProfit) {
        double wSum = wRelevance + wCondition + wProfit;
        if (wSum <= 0.0001) {
            wSum = 1.0;
        }
        double relevance = relevance(title, categoryHint);
        double condition = Double.isFinite(conditionScore) ? clamp(conditionScore, 0.0, 1.0) : 0.0;
        double profit = profitSignal(ruleProfit);

        double weighted = (relevance * wRelevance
                + condition * wCondition
                + profit * wProfit) / wSum;
        double finalScore = clamp(weighted * 100.0, 0.0, 100.0);

        Map<String, Double> breakdown = new LinkedHashMap<>();
        breakdown.put("relevance", round4(relevance));
        breakdown.put("condition", round4(condition));
        breakdown.put("profit", round4(profit));
        breakdown.put("final", round2(finalScore));
        return new DemandScore(round2(finalScore), breakdown);
    }

    /**
     * 1.0 when the whole hint appears in the title, otherwise the share of hint tokens found in the title.
     * A blank hint is neutral.
     */
    double relevance(String title, String hint) {
        Set<String> hintTokens = tokens(hint);
        if (hintTokens.isEmpty()) {
            return 0.5;
        }
        String normalizedTitle = String.join(" ", tokens(title));
        String normalizedHint = String.join(" ", hintTokens);
        if (!normalizedTitle.isEmpty() && (" " + normalizedTitle + " ").contains(" " + normalizedHint + " ")) {
            return 1.0;
        }
        Set<String> titleTokens = tokens(title);
        int hits = 0;
        for (String token : hintTokens) {
            if (titleTokens.contains(token)) {
                hits++;
            }
        }
        return (double) hits / hintTokens.size();
    }

    /**
     * Maps any profit into (0, 1), strictly increasing; zero profit maps to 0.5.
     */
    double profitSignal(double ruleProfit) {
        if (!Double.isFinite(ruleProfit)) {
            return ruleProfit > 0 ? 1.0 : 0.0;
        }
        return 0.5 + 0.5 * (ruleProfit / (Math.abs(ruleProfit) + halfSaturation));
    }

    private static Set<String> tokens(String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null) {
            return out;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!token.isEmpty()) {
                out.add(token);
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

    private static double round4(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
