package org.smileyface.articleextractor.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.articleextractor.extractor.metadata.ArticleMetadata;
import org.smileyface.articleextractor.extractor.metadata.MetadataExtractor;
import org.smileyface.articleextractor.model.ArticleResult;
import org.smileyface.articleextractor.model.ExtractionOptions;
import org.smileyface.articleextractor.serializer.HtmlSerializer;
import org.smileyface.articleextractor.serializer.MarkdownSerializer;
import org.smileyface.articleextractor.util.ExtractorUtils;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the primary readable content of an HTML document.
 * <p>
 * The pipeline runs normalize, score, select, clean, serialize on the calling thread and keeps no
 * state between calls, so one instance can be shared by any number of threads. Malformed input
 * never throws: failures are reported through {@link ArticleResult#isSuccess()},
 * {@link ArticleResult#getError()} and the warnings. The only exception that escapes is
 * {@link TreeInvariantException}, which means the parser handed over a broken tree.
 */
public final class ContentExtractor {

    private static final Logger log = LoggerFactory.getLogger(ContentExtractor.class);

    static final String EMPTY_DOCUMENT = "Empty HTML document";
    static final String NO_CONTENT = "No readable content found";

    private static final Pattern FENCE_OPENING = Pattern.compile("^(`{3,}|~{3,})");

    private final TreeNormalizer normalizer;
    private final CandidateScorer scorer;
    private final CandidateSelector selector;
    private final ContentCleaner cleaner;
    private final MetadataExtractor metadataExtractor;
    private final HtmlSerializer htmlSerializer;
    private final MarkdownSerializer markdownSerializer;

    public ContentExtractor() {
        this(ScoringRules.defaults(), TreeNormalizer.DEFAULT_STRIP_TAGS);
    }

    /**
     * @param rules     scoring table shared by the scorer and the cleaner's noise pass
     * @param stripTags tags the normalizer removes with their subtree
     */
    public ContentExtractor(ScoringRules rules, Collection<String> stripTags) {
        Objects.requireNonNull(rules, "rules");
        this.normalizer = new TreeNormalizer(stripTags);
        this.scorer = new CandidateScorer(rules);
        this.selector = new CandidateSelector();
        this.cleaner = new ContentCleaner(rules, normalizer);
        this.metadataExtractor = new MetadataExtractor();
        this.htmlSerializer = new HtmlSerializer();
        this.markdownSerializer = new MarkdownSerializer();
    }

    /**
     * Parses {@code html} with jsoup and extracts its article.
     *
     * @param html    raw HTML; null or blank yields a failed result. A leading BOM is dropped and line
     *                endings are normalized to LF before parsing
     * @param url     source URL, used as the base for relative links; may be null
     * @param options extraction options; null means {@link ExtractionOptions#defaults()}
     */
    public ArticleResult extract(String html, String url, ExtractionOptions options) {
        if (html == null || html.isBlank()) {
            return ArticleResult.failure(url, EMPTY_DOCUMENT, List.of());
        }
        Document document = Jsoup.parse(ExtractorUtils.normalizeSource(html), url == null ? "" : url.trim());
        return extract(document, url, options);
    }

    /**
     * Extracts the article of an already parsed document. The document is normalized in place.
     */
    public ArticleResult extract(Document document, String url, ExtractionOptions options) {
        ExtractionContext ctx = new ExtractionContext(options == null ? ExtractionOptions.defaults() : options, url);
        if (document == null) {
            return ArticleResult.failure(url, EMPTY_DOCUMENT, List.of());
        }
        try {
            return run(document, url, ctx);
        } catch (TreeInvariantException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Extraction failed for {}", url, e);
            return ArticleResult.failure(url, "Extraction failed: " + e.getMessage(), ctx.getWarnings());
        }
    }

    private ArticleResult run(Document document, String url, ExtractionContext ctx) {
        ExtractionOptions options = ctx.getOptions();

        normalizer.normalize(document);
        Element body = document.body();
        ScoringResult scoring = scorer.score(body != null ? body : document);
        Selection selection = selector.select(scoring, body, options.getMinWordCount());
        if (selection.lowContent()) {
            ctx.warn("Low content: " + selection.wordCount() + " words found, minimum is "
                    + options.getMinWordCount());
        }
        log.debug("Winner <{}> score={} words={} fallback={}", selection.root().normalName(),
                selection.score(), selection.wordCount(), selection.bodyFallback());

        Element cleaned = cleaner.clean(selection.root(), ctx);
        if (options.hasOutputLimit()) {
            fitToLimit(cleaned, options.getMaxOutputChars(), ctx);
        }

        Document sanitized = htmlSerializer.sanitize(cleaned);
        String content = sanitized.body().html();
        String markdown = markdownSerializer.serialize(sanitized.body());
        if (options.hasOutputLimit() && markdown.length() > options.getMaxOutputChars()) {
            markdown = cutMarkdown(markdown, options.getMaxOutputChars());
            ctx.warn("Output truncated to " + options.getMaxOutputChars() + " characters");
        }

        int wordCount = ExtractorUtils.countWords(ExtractorUtils.markdownVisibleText(markdown));
        if (wordCount == 0) {
            return ArticleResult.failure(url, NO_CONTENT, ctx.getWarnings());
        }

        String visibleText = Jsoup.parseBodyFragment(content).body().text();
        ArticleMetadata metadata = metadataExtractor.extract(document, selection.root(), visibleText, ctx);

        return ArticleResult.builder()
                .url(url)
                .title(metadata.title())
                .content(content)
                .markdown(markdown)
                .excerpt(ExtractorUtils.excerpt(visibleText, options.getExcerptLength()))
                .wordCount(wordCount)
                .success(true)
                .author(metadata.author())
                .datePublished(metadata.datePublished())
                .language(metadata.language())
                .warnings(ctx.getWarnings())
                .build();
    }

    /**
     * Drops trailing blocks of the innermost multi-child container until the sanitized HTML fits
     * {@code maxChars}. A single remaining text node is cut at a word boundary.
     */
    void fitToLimit(Element root, int maxChars, ExtractionContext ctx) {
        int total = htmlSerializer.serialize(root).length();
        if (total <= maxChars) return;

        Element container = root;
        while (container.childNodeSize() == 1 && container.childNode(0) instanceof Element only) {
            container = only;
        }
        while (container.childNodeSize() > 1 && total > maxChars) {
            Node last = container.childNode(container.childNodeSize() - 1);
            total -= htmlSerializer.serializedLength(last);
            last.remove();
        }

        int length = htmlSerializer.serialize(root).length();
        while (length > maxChars) {
            if (container.childNodeSize() > 1) {
                container.childNode(container.childNodeSize() - 1).remove();
            } else if (container.childNodeSize() == 1 && container.childNode(0) instanceof Element only) {
                container = only;
            } else if (container.childNodeSize() == 1 && container.childNode(0) instanceof TextNode text) {
                String value = text.getWholeText();
                String cut = ExtractorUtils.excerpt(value, Math.max(1, value.length() - (length - maxChars)));
                if (cut.length() >= value.length()) break;
                text.text(cut);
            } else {
                break;
            }
            length = htmlSerializer.serialize(root).length();
        }
        ctx.warn("Output truncated to " + maxChars + " characters");
    }

    /**
     * Cuts {@code markdown} to at most {@code maxChars} at a word boundary. A code fence left open
     * by the cut is closed within the limit; when no code line of the block survives, the block is
     * dropped instead.
     */
    static String cutMarkdown(String markdown, int maxChars) {
        String cut = cutAtWord(markdown, maxChars);
        OpenFence open = openFence(cut);
        if (open == null) return cut;

        int budget = maxChars - open.fence().length() - 1;
        String body = budget > 0 ? cutAtWord(cut, budget) : "";
        if (body.indexOf('\n', open.start()) < 0) {
            return cut.substring(0, open.start()).stripTrailing();
        }
        return body + "\n" + open.fence();
    }

    private static String cutAtWord(String text, int maxChars) {
        String cut = ExtractorUtils.excerpt(text, maxChars);
        return cut.length() > maxChars ? text.substring(0, maxChars) : cut;
    }

    /**
     * @return the fence still open at the end of {@code markdown} and the offset of its opening line,
     *         or null when every fence is closed
     */
    static OpenFence openFence(String markdown) {
        OpenFence open = null;
        int lineStart = 0;
        while (lineStart <= markdown.length()) {
            int lineEnd = markdown.indexOf('\n', lineStart);
            if (lineEnd < 0) lineEnd = markdown.length();
            String line = markdown.substring(lineStart, lineEnd).strip();
            if (open == null) {
                Matcher m = FENCE_OPENING.matcher(line);
                if (m.find()) open = new OpenFence(lineStart, m.group(1));
            } else if (closes(line, open.fence())) {
                open = null;
            }
            lineStart = lineEnd + 1;
        }
        return open;
    }

    private static boolean closes(String line, String fence) {
        if (line.length() < fence.length()) return false;
        char marker = fence.charAt(0);
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) != marker) return false;
        }
        return true;
    }

    record OpenFence(int start, String fence) {
    }
}
