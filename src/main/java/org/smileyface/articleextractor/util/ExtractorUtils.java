package org.smileyface.articleextractor.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ExtractorUtils {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern MD_IMAGE = Pattern.compile("!\\[[^\\]]*]\\([^)]*\\)");
    private static final Pattern MD_LINK = Pattern.compile("\\[([^\\]]*)]\\([^)]*\\)");
    private static final Pattern MD_FENCE = Pattern.compile("(?m)^\\s*(```+|~~~+).*$");
    private static final Pattern MD_TABLE_ROW = Pattern.compile("(?m)^[ \\t]*\\|.*$");
    private static final Pattern MD_TABLE_PIPE = Pattern.compile("(?<!\\\\)\\|");
    private static final Pattern MD_LINE_MARKER = Pattern.compile(
            "(?m)^[ \\t]*(?:>[ \\t]?)*(?:#{1,6}[ \\t]+|[-*+][ \\t]+|\\d+[.)][ \\t]+)?");
    private static final Pattern MD_LEADING_EMPHASIS = Pattern.compile("(?:^|(?<=[\\s(\\[]))[*_~`]+");
    private static final Pattern MD_TRAILING_EMPHASIS = Pattern.compile("(?<!\\\\)[*_~`]+(?=[\\s.,;:!?)\\]]|$)");
    private static final Pattern MD_ESCAPE = Pattern.compile("\\\\(\\p{Punct})");

    private ExtractorUtils() {
        // No instanciation
    }

    /**
     * Drops a leading byte order mark and turns CRLF and CR line endings into LF. Both the parser
     * input and the cache fingerprint go through this, so inputs sharing a fingerprint parse alike.
     */
    public static String normalizeSource(String html) {
        if (html == null) return "";
        String h = html.startsWith("\uFEFF") ? html.substring(1) : html;
        return h.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Collapses every whitespace run (including non-breaking spaces) into one space.
     * Leading and trailing whitespace is kept as a single space.
     */
    public static String collapseWhitespace(String input) {
        if (input == null || input.isEmpty()) return "";
        return WHITESPACE.matcher(input).replaceAll(" ");
    }

    /**
     * Counts whitespace-delimited tokens that contain at least one letter or digit,
     * so stray punctuation and Markdown markers are not counted as words.
     */
    public static int countWords(String text) {
        if (text == null || text.isBlank()) return 0;
        int count = 0;
        for (String token : WHITESPACE.split(text.strip())) {
            if (containsLetterOrDigit(token)) count++;
        }
        return count;
    }

    /**
     * Returns the longest prefix of {@code text} of at most {@code maxChars} characters that ends
     * on a word boundary, with trailing whitespace removed. When the very first word is longer than
     * the limit the whole first word is returned, since cutting it would break a word.
     */
    public static String excerpt(String text, int maxChars) {
        if (text == null || text.isEmpty()) return "";
        int limit = Math.max(1, maxChars);
        if (text.length() <= limit) return text.stripTrailing();
        int cut = limit;
        if (!isWhitespace(text.charAt(cut))) {
            int i = cut;
            while (i > 0 && !isWhitespace(text.charAt(i - 1))) i--;
            if (i == 0) {
                int end = cut;
                while (end < text.length() && !isWhitespace(text.charAt(end))) end++;
                return text.substring(0, end);
            }
            cut = i;
        }
        return text.substring(0, cut).stripTrailing();
    }

    /**
     * Strips Markdown syntax that does not render as text: images, link targets, code fence lines,
     * table cell pipes, line-start block markers, emphasis markers around words and escape backslashes.
     * Markers inside a word are kept, so {@code max\_pool\_size} stays one token.
     * Used as the basis for word counting.
     */
    public static String markdownVisibleText(String markdown) {
        if (markdown == null || markdown.isEmpty()) return "";
        String text = MD_IMAGE.matcher(markdown).replaceAll("");
        text = MD_LINK.matcher(text).replaceAll("$1");
        text = MD_FENCE.matcher(text).replaceAll("");
        text = MD_TABLE_ROW.matcher(text).replaceAll(
                row -> Matcher.quoteReplacement(MD_TABLE_PIPE.matcher(row.group()).replaceAll(" ")));
        text = MD_LINE_MARKER.matcher(text).replaceAll("");
        text = MD_LEADING_EMPHASIS.matcher(text).replaceAll("");
        text = MD_TRAILING_EMPHASIS.matcher(text).replaceAll("");
        text = MD_ESCAPE.matcher(text).replaceAll("$1");
        return collapseWhitespace(text).strip();
    }

    private static boolean containsLetterOrDigit(String token) {
        for (int i = 0; i < token.length(); i++) {
            if (Character.isLetterOrDigit(token.charAt(i))) return true;
        }
        return false;
    }

    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || c == '\u00A0';
    }
}
