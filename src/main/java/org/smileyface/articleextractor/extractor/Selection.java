package org.smileyface.articleextractor.extractor;

import org.jsoup.nodes.Element;

/**
 * The element chosen as the article root.
 *
 * @param root         winning element, still attached to the normalized tree
 * @param score        its final score, or 0 when the body was taken without a score
 * @param bodyFallback true when the body replaced a candidate that missed the floors
 * @param lowContent   true when neither the best candidate nor the body met the floors
 * @param wordCount    words in the winner's visible text
 */
public record Selection(Element root, double score, boolean bodyFallback, boolean lowContent, int wordCount) {
}
