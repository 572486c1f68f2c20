package com.localflipper.model;

import java.util.List;

public final class ConditionAssessment {
    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 1.0;

    public final ConditionLabel label;
    public final double score;
    public final List<String> matchedPhrases;

    public ConditionAssessment(ConditionLabel label, double score, List<String> matchedPhrases) {
        this.label = label == null ? ConditionLabel.UNKNOWN : label;
        this.score = Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
        this.matchedPhrases = matchedPhrases == null ? List.of() : List.copyOf(matchedPhrases);
    }
}
