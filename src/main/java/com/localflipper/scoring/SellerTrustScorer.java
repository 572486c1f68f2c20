package com.localflipper.scoring;

import com.localflipper.model.SellerRating;

import java.util.ArrayList;
import java.util.List;

/**
 * Rates seller trust from listing text. Starts at a neutral base, subtracts for scam and urgency language,
 * adds for professional or warranty language, and clamps to {@link SellerRating#MIN_SCORE}..{@link SellerRating#MAX_SCORE}.
 */
public final class SellerTrustScorer {
    public static final int BASE_SCORE = 50;

    private static final List<PhraseRule> DEFAULT_RED = List.of(
            new PhraseRule("gift card", -30),
            new PhraseRule("western union", -30),
            new PhraseRule("wire transfer", -25),
            new PhraseRule("zelle only", -20),
            new PhraseRule("cash app", -15),
            new PhraseRule("cashapp", -15),
            new PhraseRule("deposit", -15),
            new PhraseRule("shipping only", -15),
            new PhraseRule("must go today", -10),
            new PhraseRule("urgent", -10),
            new PhraseRule("no questions", -10),
            new PhraseRule("text me at", -10),
            new PhraseRule("asap", -5),
            new PhraseRule("no returns", -5),
            new PhraseRule("first come first serve", -5)
    );

    private static final List<PhraseRule> DEFAULT_GREEN = List.of(
            new PhraseRule("warranty", 15),
            new PhraseRule("receipt", 10),
            new PhraseRule("original box", 10),
            new PhraseRule("serial number", 10),
            new PhraseRule("invoice", 10),
            new PhraseRule("public place", 10),
            new PhraseRule("tested", 5),
            new PhraseRule("local pickup", 5),
            new PhraseRule("smoke free", 5),
            new PhraseRule("pet free", 5)
    );

    private final List<PhraseRule> redRules;
    private final List<PhraseRule> greenRules;

    public SellerTrustScorer() {
        this(DEFAULT_RED, DEFAULT_GREEN);
    }

    public SellerTrustScorer(List<PhraseRule> redRules, List<PhraseRule> greenRules) {
        this.redRules = redRules == null ? List.of() : List.copyOf(redRules);
        this.greenRules = greenRules == null ? List.of() : List.copyOf(greenRules);
    }

    public SellerRating rate(String text) {
        if (text == null || text.isBlank()) {
            return new SellerRating(BASE_SCORE, List.of(), List.of());
        }
        double score = BASE_SCORE;
        List<String> reds = new ArrayList<>();
        List<String> greens = new ArrayList<>();
        for (PhraseRule rule : redRules) {
            if (rule.matches(text)) {
                reds.add(rule.phrase());
                score -= Math.abs(rule.weight());
            }
        }
        for (PhraseRule rule : greenRules) {
            if (rule.matches(text)) {
                greens.add(rule.phrase());
                score += Math.abs(rule.weight());
            }
        }
        return new SellerRating((int) Math.round(score), reds, greens);
    }

    public SellerRating rate(String title, String body) {
        return rate(ConditionExtractor.joinText(title, body));
    }
}
