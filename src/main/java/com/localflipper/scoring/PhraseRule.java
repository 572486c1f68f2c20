package com.localflipper.scoring;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One row of a keyword rule table: a phrase matched case-insensitively on word boundaries, and its weight.
 */
public final class PhraseRule {
    private final String phrase;
    private final double weight;
    private final Pattern pattern;

    public PhraseRule(String phrase, double weight) {
        if (phrase == null || phrase.trim().isEmpty()) {
            throw new IllegalArgumentException("phrase must not be blank");
        }
        this.phrase = phrase.trim().toLowerCase(Locale.ROOT);
        this.weight = weight;
        this.pattern = Pattern.compile(
                "(?<![\\p{L}\\p{N}])" + Pattern.quote(this.phrase) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
        );
    }

    public String phrase() {
        return phrase;
    }

    public double weight() {
        return weight;
    }

    public boolean matches(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return pattern.matcher(normalize(text)).find();
    }

    static String normalize(String text) {
        return text.replace('’', '\'')
                .replace('‘', '\'')
                .replaceAll("\\s+", " ");
    }

    @Override
    public String toString() {
        return phrase + "=" + weight;
    }
}
