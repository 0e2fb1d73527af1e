package org.smileyface.articleextractor.extractor;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered table of {@link ScoreRule}s that gives every candidate its base score.
 * The table is immutable and safe to share between concurrent extractions.
 */
public final class ScoringRules {

    /** Class/id fragments typical for navigation, comments, ads and other page chrome. */
    public static final String NOISE_PATTERN =
            "comment|sidebar|footer|masthead|menu|nav|breadcrumb|share|social|sponsor|promo|related"
                    + "|popup|modal|cookie|banner|widget|subscribe|newsletter"
                    + "|(^|[-_\\s])(ad|ads|advert|advertisement)([-_\\s]|$)";

    /** Class/id fragments typical for the main article container. */
    public static final String CONTENT_PATTERN = "article|content|main|entry|post|story|blog|prose|text";

    public static final double SEMANTIC_BONUS = 25.0;
    public static final double SECTION_BONUS = 5.0;
    public static final double BLOCK_BONUS = 3.0;
    public static final double PATTERN_WEIGHT = 25.0;

    private static final ScoringRules DEFAULTS = new ScoringRules(List.of(
            ScoreRule.tag("article", SEMANTIC_BONUS),
            ScoreRule.tag("main", SEMANTIC_BONUS),
            new ScoreRule("role:main", e -> e != null && "main".equalsIgnoreCase(e.attr("role").trim()), SEMANTIC_BONUS),
            ScoreRule.tag("section", SECTION_BONUS),
            ScoreRule.tag("pre", BLOCK_BONUS),
            ScoreRule.tag("blockquote", BLOCK_BONUS),
            ScoreRule.tag("footer", -PATTERN_WEIGHT),
            ScoreRule.attribute(NOISE_PATTERN, -PATTERN_WEIGHT),
            ScoreRule.attribute(CONTENT_PATTERN, PATTERN_WEIGHT)
    ));

    private final List<ScoreRule> rules;

    public ScoringRules(Collection<ScoreRule> rules) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static ScoringRules defaults() {
        return DEFAULTS;
    }

    public List<ScoreRule> getRules() {
        return rules;
    }

    /**
     * @return sum of the deltas of every rule matching {@code element}
     */
    public double bonusFor(Element element) {
        double sum = 0.0;
        for (ScoreRule r : rules) {
            sum += r.deltaFor(element);
        }
        return sum;
    }

    /**
     * An element is noise when the matched rules add up to a penalty.
     */
    public boolean isNoise(Element element) {
        return bonusFor(element) < 0.0;
    }

    /**
     * @return names of the rules matching {@code element}, in table order
     */
    public List<String> matchedRules(Element element) {
        List<String> names = new ArrayList<>();
        for (ScoreRule r : rules) {
            if (r.rule().isMatched(element)) names.add(r.name());
        }
        return names;
    }
}
