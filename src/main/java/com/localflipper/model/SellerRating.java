package com.localflipper.model;

import java.util.List;

public final class SellerRating {
    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    public final int score;
    public final List<String> redFlags;
    public final List<String> greenFlags;

    public SellerRating(int score, List<String> redFlags, List<String> greenFlags) {
        this.score = Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
        this.redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
        this.greenFlags = greenFlags == null ? List.of() : List.copyOf(greenFlags);
    }
}
