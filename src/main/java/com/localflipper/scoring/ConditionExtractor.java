package com.localflipper.scoring;

import com.localflipper.model.ConditionAssessment;
import com.localflipper.model.ConditionLabel;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Guesses an item's condition from listing text. Every matching rule is collected; the label of the
 * highest-confidence match wins, earlier table rows winning ties.
 */
public class ConditionExtractor {
    private static final List<Rule> DEFAULT_RULES = List.of(
            rule("for parts", ConditionLabel.FOR_PARTS, 1.00),
            rule("parts only", ConditionLabel.FOR_PARTS, 1.00),
            rule("not working", ConditionLabel.FOR_PARTS, 1.00),
            rule("doesn't work", ConditionLabel.FOR_PARTS, 1.00),
            rule("does not work", ConditionLabel.FOR_PARTS, 1.00),
            rule("won't turn on", ConditionLabel.FOR_PARTS, 1.00),
            rule("no power", ConditionLabel.FOR_PARTS, 1.00),
            rule("needs repair", ConditionLabel.FOR_PARTS, 1.00),
            rule("broken", ConditionLabel.FOR_PARTS, 1.00),
            rule("cracked", ConditionLabel.FOR_PARTS, 1.00),

            rule("brand new", ConditionLabel.NEW, 0.95),
            rule("new in box", ConditionLabel.NEW, 0.95),
            rule("bnib", ConditionLabel.NEW, 0.95),
            rule("nib", ConditionLabel.NEW, 0.95),
            rule("sealed", ConditionLabel.NEW, 0.95),
            rule("unopened", ConditionLabel.NEW, 0.95),
            rule("never opened", ConditionLabel.NEW, 0.95),

            rule("like new", ConditionLabel.LIKE_NEW, 0.90),
            rule("mint", ConditionLabel.LIKE_NEW, 0.90),
            rule("barely used", ConditionLabel.LIKE_NEW, 0.90),
            rule("lightly used", ConditionLabel.LIKE_NEW, 0.90),
            rule("open box", ConditionLabel.LIKE_NEW, 0.90),
            rule("excellent condition", ConditionLabel.LIKE_NEW, 0.90),

            rule("fair condition", ConditionLabel.FAIR, 0.80),
            rule("needs work", ConditionLabel.FAIR, 0.80),
            rule("some wear", ConditionLabel.FAIR, 0.80),
            rule("heavily used", ConditionLabel.FAIR, 0.80),
            rule("well used", ConditionLabel.FAIR, 0.80),
            rule("scratched", ConditionLabel.FAIR, 0.80),
            rule("scratches", ConditionLabel.FAIR, 0.80),
            rule("worn", ConditionLabel.FAIR, 0.80),
            rule("as-is", ConditionLabel.FAIR, 0.80),
            rule("as is", ConditionLabel.FAIR, 0.80),

            rule("good condition", ConditionLabel.GOOD, 0.70),
            rule("great condition", ConditionLabel.GOOD, 0.70),
            rule("works great", ConditionLabel.GOOD, 0.70),
            rule("works perfectly", ConditionLabel.GOOD, 0.70),
            rule("fully functional", ConditionLabel.GOOD, 0.70),
            rule("tested", ConditionLabel.GOOD, 0.70),
            rule("working", ConditionLabel.GOOD, 0.70)
    );

    private final List<Rule> rules;

    public ConditionExtractor() {
        this(DEFAULT_RULES);
    }

    public ConditionExtractor(List<Rule> rules) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public ConditionAssessment extract(String text) {
        if (text == null || text.isBlank()) {
            return neutral();
        }
        Set<String> matched = new LinkedHashSet<>();
        Rule best = null;
        for (Rule rule : rules) {
            if (!rule.matcher.matches(text)) {
                continue;
            }
            matched.add(rule.matcher.phrase());
            if (best == null || rule.confidence() > best.confidence()) {
                best = rule;
            }
        }
        if (best == null) {
            return neutral();
        }
        return new ConditionAssessment(best.label, best.label.score(), new ArrayList<>(matched));
    }

    /**
     * Convenience overload for title plus optional body.
     */
    public ConditionAssessment extract(String title, String body) {
        return extract(joinText(title, body));
    }

    public List<Rule> rules() {
        return rules;
    }

    static String joinText(String title, String body) {
        String t = title == null ? "" : title.trim();
        String b = body == null ? "" : body.trim();
        if (b.isEmpty()) {
            return t;
        }
        return t.isEmpty() ? b : t + "\n" + b;
    }

    private static ConditionAssessment neutral() {
        return new ConditionAssessment(ConditionLabel.UNKNOWN, ConditionLabel.UNKNOWN.score(), List.of());
    }

    public static Rule rule(String phrase, ConditionLabel label, double confidence) {
        return new Rule(new PhraseRule(phrase, confidence), label);
    }

    public static final class Rule {
        private final PhraseRule matcher;
        private final ConditionLabel label;

        private Rule(PhraseRule matcher, ConditionLabel label) {
            this.matcher = matcher;
            this.label = label;
        }

        public String phrase() {
            return matcher.phrase();
        }

        public ConditionLabel label() {
            return label;
        }

        public double confidence() {
            return matcher.weight();
        }
    }
}
