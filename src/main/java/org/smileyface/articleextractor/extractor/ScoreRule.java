package org.smileyface.articleextractor.extractor;

import org.jsoup.nodes.Element;

import java.util.Objects;

/**
 * One row of the scoring table: when {@code rule} matches an element, {@code delta} is added
 * to the element's base score. Negative rows also mark the element as noise for the cleaner.
 *
 * @param name  label used in logs and diagnostics
 * @param rule  element predicate
 * @param delta score adjustment applied on a match
 */
public record ScoreRule(String name, ContentRule rule, double delta) {

    public ScoreRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(rule, "rule");
    }

    public static ScoreRule tag(String tagName, double delta) {
        return new ScoreRule("tag:" + tagName, new TagNameContentRule(tagName), delta);
    }

    public static ScoreRule attribute(String regex, double delta) {
        return new ScoreRule("attr:" + regex, new AttributePatternRule(regex), delta);
    }

    public double deltaFor(Element element) {
        return rule.isMatched(element) ? delta : 0.0;
    }
}
