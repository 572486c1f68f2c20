package com.localflipper.model;

public enum ConditionLabel {
    NEW("New", 1.00),
    LIKE_NEW("Like New", 0.90),
    GOOD("Good", 0.70),
    FAIR("Fair", 0.50),
    FOR_PARTS("For Parts", 0.10),
    UNKNOWN("Unknown", 0.60);

    private final String displayName;
    private final double score;

    ConditionLabel(String displayName, double score) {
        this.displayName = displayName;
        this.score = score;
    }

    public String displayName() {
        return displayName;
    }

    public double score() {
        return score;
    }
}
