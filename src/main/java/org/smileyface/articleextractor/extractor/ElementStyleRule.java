package org.smileyface.articleextractor.extractor;

import org.jsoup.nodes.Element;

import java.util.Locale;

/**
 * A ContentRule that matches elements based on their inline {@code style} attribute.
 * Whitespace is removed from both the style and the fragment before a case-insensitive
 * substring check, so {@code "display: none"} and {@code "DISPLAY:none"} both match
 * the fragment {@code "display:none"}. The normalizer uses it to drop hidden elements.
 */
public final class ElementStyleRule implements ContentRule {

    private final String styleFragment;
    private final String compactFragment;

    /**
     * Creates a rule that matches when an element's inline style contains the given fragment
     * (case-insensitive, whitespace-insensitive).
     *
     * @param styleFragment non-null, non-blank substring to search for within {@code style}
     */
    public ElementStyleRule(String styleFragment) {
        if (styleFragment == null || styleFragment.isBlank()) {
            throw new IllegalArgumentException("styleFragment must not be null/blank");
        }
        this.styleFragment = styleFragment.trim();
        this.compactFragment = compact(this.styleFragment);
    }

    /**
     * @return the configured style fragment
     */
    public String getStyleFragment() {
        return styleFragment;
    }

    @Override
    public boolean isMatched(Element element) {
        if (element == null) return false;
        String style = element.attr("style");
        if (style.isBlank()) return false;
        return compact(style).contains(compactFragment);
    }

    private static String compact(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isWhitespace(c)) sb.append(c);
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
