package org.smileyface.articleextractor.extractor;

import org.jsoup.nodes.Element;

/**
 * A predicate over DOM elements. Rules are the matching half of the scoring table
 * ({@link ScoreRule}) and are also used on their own by the normalizer and the scorer.
 */
@FunctionalInterface
public interface ContentRule {
    /**
     * Returns true if the provided element matches this rule.
     *
     * @param element a jsoup Element from the parsed HTML document (may be null)
     * @return true if matched
     */
    boolean isMatched(Element element);
}
