package org.smileyface.articleextractor.serializer;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.safety.Cleaner;
import org.jsoup.safety.Safelist;

import java.util.Locale;

/**
 * Renders a cleaned subtree as sanitized HTML.
 * <p>
 * Sanitization uses a jsoup {@link Safelist}: only the listed tags and attributes survive, so
 * inline event handlers and styles are dropped. The allowlist declares no protocols because
 * unresolved relative links must be kept; dangerous schemes ({@code javascript:},
 * {@code vbscript:} and non-image {@code data:} URLs) are removed in a separate pass instead.
 * Output is compact (no pretty printing), so the same tree always renders to the same bytes.
 */
public final class HtmlSerializer {

    static final Safelist SAFELIST = new Safelist()
            .addTags("a", "abbr", "article", "b", "blockquote", "br", "caption", "cite", "code", "col",
                    "colgroup", "dd", "del", "details", "dfn", "div", "dl", "dt", "em", "figcaption", "figure",
                    "h1", "h2", "h3", "h4", "h5", "h6", "hr", "i", "img", "ins", "kbd", "li", "mark", "ol", "p",
                    "picture", "pre", "q", "s", "samp", "section", "small", "source", "span", "strike", "strong",
                    "sub", "summary", "sup", "table", "tbody", "td", "tfoot", "th", "thead", "time", "tr", "u",
                    "ul", "video", "audio")
            .addAttributes("a", "href", "title")
            .addAttributes("abbr", "title")
            .addAttributes("blockquote", "cite")
            .addAttributes("q", "cite")
            .addAttributes("img", "src", "alt", "title", "width", "height")
            .addAttributes("source", "src", "type", "media")
            .addAttributes("video", "src", "poster", "controls", "width", "height")
            .addAttributes("audio", "src", "controls")
            .addAttributes("code", "class")
            .addAttributes("pre", "class")
            .addAttributes("ol", "start")
            .addAttributes("td", "colspan", "rowspan")
            .addAttributes("th", "colspan", "rowspan", "scope")
            .addAttributes("time", "datetime");

    private static final String[] URL_ATTRIBUTES = {"href", "src", "cite", "poster"};

    private final Cleaner cleaner = new Cleaner(SAFELIST);

    /**
     * @return the sanitized outer HTML of {@code root}, or an empty string for null
     */
    public String serialize(Element root) {
        if (root == null) return "";
        return sanitize(root).body().html();
    }

    /**
     * Sanitized copy of {@code root} wrapped in a fresh document; {@code root} is not modified.
     */
    public Document sanitize(Element root) {
        Document dirty = Document.createShell("");
        dirty.body().appendChild(root.clone());
        Document clean = cleaner.clean(dirty);
        for (Element el : clean.body().getAllElements()) {
            for (String attr : URL_ATTRIBUTES) {
                if (el.hasAttr(attr) && isUnsafeUrl(el.normalName(), attr, el.attr(attr))) {
                    el.removeAttr(attr);
                }
            }
        }
        clean.outputSettings().prettyPrint(false);
        return clean;
    }

    /**
     * Length of the sanitized rendering of a single node. Used to estimate how many trailing
     * blocks must be dropped to fit an output bound.
     */
    public int serializedLength(Node node) {
        if (node instanceof Element el) return serialize(el).length();
        if (node instanceof TextNode text) return text.outerHtml().length();
        return 0;
    }

    static boolean isUnsafeUrl(String tag, String attr, String value) {
        StringBuilder compact = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!Character.isWhitespace(c) && !Character.isISOControl(c)) compact.append(c);
        }
        String v = compact.toString().toLowerCase(Locale.ROOT);
        if (v.startsWith("javascript:") || v.startsWith("vbscript:")) return true;
        if (v.startsWith("data:")) {
            boolean imageSource = "src".equals(attr) && ("img".equals(tag) || "source".equals(tag));
            return !(imageSource && v.startsWith("data:image/"));
        }
        return false;
    }
}
