package org.smileyface.articleextractor.extractor;

import org.jsoup.nodes.Element;

/**
 * A ContentRule that matches elements whose visible text length (after trimming) is
 * at least a specified minimum number of characters.
 */
public final class MinCharacterRule implements ContentRule {

    private final int minChars;

    /**
     * Creates a rule that matches when the element's trimmed text length is greater than
     * or equal to {@code minChars}. Negative values are treated as zero.
     *
     * @param minChars minimum number of characters required to match
     */
    public MinCharacterRule(int minChars) {
        this.minChars = Math.max(0, minChars);
    }

    /**
     * @return the configured minimum characters threshold
     */
    public int getMinChars() {
        return minChars;
    }

    /**
     * Length check for text that was already measured, e.g. by the scorer's single traversal.
     */
    public boolean isLongEnough(int textLength) {
        return textLength >= minChars;
    }

    @Override
    public boolean isMatched(Element element) {
        if (element == null) return false;
        return isLongEnough(element.text().trim().length());
    }
}
