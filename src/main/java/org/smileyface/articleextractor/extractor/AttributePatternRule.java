package org.smileyface.articleextractor.extractor;

import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A ContentRule that matches elements whose {@code class} or {@code id} contains a regex match.
 * <p>
 * Both attribute values are lower-cased and joined with a space before matching, so a pattern
 * such as {@code comment|sidebar} hits {@code <div class="post-comments">} as well as
 * {@code <div id="sidebar-left">}. Patterns are matched with {@link java.util.regex.Matcher#find()}.
 * Attribute values of any shape are tolerated; elements without class and id never match.
 */
public final class AttributePatternRule implements ContentRule {

    private final Pattern pattern;

    /**
     * @param regex a Java regular expression, applied case-insensitively; must not be null/blank
     * @throws java.util.regex.PatternSyntaxException if the expression is invalid
     */
    public AttributePatternRule(String regex) {
        if (regex == null || regex.isBlank()) {
            throw new IllegalArgumentException("regex must not be null/blank");
        }
        this.pattern = Pattern.compile(regex.trim(), Pattern.CASE_INSENSITIVE);
    }

    public String getPattern() {
        return pattern.pattern();
    }

    @Override
    public boolean isMatched(Element element) {
        if (element == null) return false;
        String className = element.className();
        String id = element.id();
        if (className.isBlank() && id.isBlank()) return false;
        String haystack = (className + " " + id).toLowerCase(Locale.ROOT);
        return pattern.matcher(haystack).find();
    }

    @Override
    public String toString() {
        return "attribute~" + pattern.pattern();
    }
}
