package org.smileyface.articleextractor.extractor;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.articleextractor.model.ExtractionOptions;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cleans a deep copy of the winning element. The tree the winner was taken from is never modified.
 * <p>
 * Steps, in order: scoped noise removal, image/code removal according to the options,
 * sanitization of empty links, unusable images and empty blocks, URL resolution against the
 * base URL, heading normalization, and a final pass dropping elements left empty.
 */
public final class ContentCleaner {

    private static final Logger log = LoggerFactory.getLogger(ContentCleaner.class);

    static final Set<String> MEDIA_TAGS = Set.of("img", "picture", "video");
    static final Set<String> CODE_TAGS = Set.of("pre", "code");
    static final String[] URL_ATTRIBUTES = {"href", "src", "poster"};
    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");
    private static final Pattern HTTP_BASE = Pattern.compile("(?i)\\s*https?://[^/?#\\s]+\\S*\\s*");

    private static final Set<String> EMBEDDED_MEDIA =
            Set.of("video", "audio", "picture", "svg", "canvas", "embed", "object");
    private static final List<String> TRACKING_PATHS = List.of("/pixel.gif", "/pixel.png", "/1x1.gif",
            "/1x1.png", "/spacer.gif", "/spacer.png", "/blank.gif", "/blank.png");
    private static final List<String> TRACKING_HOST_PREFIXES = List.of("tracking.", "analytics.", "metrics.");
    private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp", "svg", "bmp",
            "avif", "apng", "tiff", "jfif");

    private final ScoringRules rules;
    private final TreeNormalizer normalizer;

    public ContentCleaner(ScoringRules rules, TreeNormalizer normalizer) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    /**
     * @param winner selected article root; left untouched
     * @param ctx    options, base URL and the warning sink of the current call
     * @return the cleaned, detached copy
     */
    public Element clean(Element winner, ExtractionContext ctx) {
        Objects.requireNonNull(winner, "winner");
        ExtractionOptions options = ctx.getOptions();
        Element root = winner.clone();
        if ("body".equals(root.normalName()) || "html".equals(root.normalName())) {
            root.tagName("div");
        }

        if (options.isStripNoise()) stripNestedNoise(root);
        if (!options.isIncludeImages()) removeTags(root, MEDIA_TAGS);
        if (!options.isIncludeCode()) removeTags(root, CODE_TAGS);
        sanitize(root);
        if (options.isResolveUrls()) resolveUrls(root, ctx);
        if (options.isNormalizeHeadings()) normalizeHeadings(root);
        normalizer.dropEmptyElements(root);
        return root;
    }

    /**
     * Removes noise-classified elements nested in the winner, as long as each holds less than half
     * of the winner's text.
     */
    void stripNestedNoise(Element root) {
        final int rootTextLength = root.text().length();
        NodeTraversor.filter(new NodeFilter() {
            @Override
            public FilterResult head(Node node, int depth) {
                if (node == root || !(node instanceof Element el)) return FilterResult.CONTINUE;
                if (rules.isNoise(el) && el.text().length() * 2 < rootTextLength) {
                    log.trace("Removing nested noise <{} class='{}' id='{}'>", el.normalName(), el.className(), el.id());
                    return FilterResult.REMOVE;
                }
                return FilterResult.CONTINUE;
            }

            @Override
            public FilterResult tail(Node node, int depth) {
                return FilterResult.CONTINUE;
            }
        }, root);
    }

    static void removeTags(Element root, Set<String> tags) {
        NodeTraversor.filter(new NodeFilter() {
            @Override
            public FilterResult head(Node node, int depth) {
                if (node != root && node instanceof Element el && tags.contains(el.normalName())) {
                    return FilterResult.REMOVE;
                }
                return FilterResult.CONTINUE;
            }

            @Override
            public FilterResult tail(Node node, int depth) {
                return FilterResult.CONTINUE;
            }
        }, root);
    }

    /**
     * Drops links that would render empty, images without a usable source and empty
     * {@code p}, {@code li} and {@code div} blocks.
     */
    void sanitize(Element root) {
        for (Element a : root.getElementsByTag("a")) {
            if (a != root && !hasVisibleContent(a)) a.remove();
        }
        for (Element img : root.getElementsByTag("img")) {
            if (img != root && !isUsableImageSource(img.attr("src"))) img.remove();
        }
        Elements blocks = root.select("p, li, div");
        for (int i = blocks.size() - 1; i >= 0; i--) {
            Element block = blocks.get(i);
            if (block != root && !hasVisibleContent(block)) block.remove();
        }
    }

    private static boolean hasVisibleContent(Element el) {
        if (el.hasText()) return true;
        for (Element child : el.getAllElements()) {
            String tag = child.normalName();
            if ("img".equals(tag) && isUsableImageSource(child.attr("src"))) return true;
            if (EMBEDDED_MEDIA.contains(tag)) return true;
        }
        return false;
    }

    /**
     * An image source is usable when it is present, is not a known tracking pixel or tracking host,
     * and is either URL-shaped or a bare file name with an image extension and a basename of at
     * least two characters.
     */
    static boolean isUsableImageSource(String src) {
        if (src == null || src.isBlank()) return false;
        String value = src.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        for (String path : TRACKING_PATHS) {
            if (lower.contains(path)) return false;
        }
        int scheme = lower.indexOf("://");
        if (scheme >= 0) {
            int hostStart = scheme + 3;
            int hostEnd = lower.indexOf('/', hostStart);
            String host = lower.substring(hostStart, hostEnd < 0 ? lower.length() : hostEnd);
            for (String prefix : TRACKING_HOST_PREFIXES) {
                if (host.startsWith(prefix)) return false;
            }
        }
        if (lower.startsWith("data:") || lower.startsWith("http") || lower.startsWith("/")
                || lower.startsWith("./") || lower.startsWith("../")) {
            return true;
        }
        String fileName = lower.substring(lower.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) return false;
        String ext = fileName.substring(dot + 1);
        return IMAGE_EXTENSIONS.contains(ext) && fileName.substring(0, dot).strip().length() >= 2;
    }

    void resolveUrls(Element root, ExtractionContext ctx) {
        String base = validBase(ctx);
        if (base != null) root.setBaseUri(base);
        boolean unresolved = false;
        for (Element el : root.getAllElements()) {
            for (String attr : URL_ATTRIBUTES) {
                if (!el.hasAttr(attr)) continue;
                String value = el.attr(attr).trim();
                if (SCHEME.matcher(value).find()) continue;
                if (base == null) {
                    if (!value.isEmpty()) unresolved = true;
                    continue;
                }
                String absolute = el.absUrl(attr);
                if (absolute.isEmpty()) {
                    ctx.warn("Could not resolve URL: " + value);
                } else {
                    el.attr(attr, absolute);
                }
            }
        }
        if (unresolved) {
            ctx.warn(ctx.getBaseUrl() == null
                    ? "Relative URLs left unresolved: no base URL"
                    : "Relative URLs left unresolved: invalid base URL");
        }
    }

    private static String validBase(ExtractionContext ctx) {
        String baseUrl = ctx.getBaseUrl();
        if (baseUrl == null) return null;
        if (!HTTP_BASE.matcher(baseUrl).matches()) {
            ctx.warn("Invalid base URL: " + baseUrl);
            return null;
        }
        return baseUrl.trim();
    }

    /**
     * Shifts heading levels so the highest heading in the tree becomes {@code h1}.
     */
    static void normalizeHeadings(Element root) {
        Elements headings = root.select("h1, h2, h3, h4, h5, h6");
        int min = 7;
        for (Element h : headings) {
            min = Math.min(min, headingLevel(h));
        }
        int shift = min - 1;
        if (shift <= 0 || min == 7) return;
        for (Element h : headings) {
            h.tagName("h" + (headingLevel(h) - shift));
        }
    }

    static int headingLevel(Element el) {
        return el.normalName().charAt(1) - '0';
    }
}
