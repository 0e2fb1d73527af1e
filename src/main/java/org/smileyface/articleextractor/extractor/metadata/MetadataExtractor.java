package org.smileyface.articleextractor.extractor.metadata;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.articleextractor.extractor.ExtractionContext;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads title, author, publication date and language. Each field is an ordered chain of
 * {@link FieldExtractor}s where the first value found wins. A field no strategy can fill is
 * left null and reported as a warning.
 */
public final class MetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    private static final Pattern BYLINE_PREFIX = Pattern.compile("^(by|von|par|por|di|door)\\s+", Pattern.CASE_INSENSITIVE);

    static final FieldExtractor TITLE = FieldExtractor.firstOf(List.of(
            (document, winner) -> FieldExtractor.clean(document.title()),
            FieldExtractor.meta("og:title"),
            MetadataExtractor::topHeading
    ));

    static final FieldExtractor AUTHOR = FieldExtractor.firstOf(List.of(
            FieldExtractor.meta("author", "article:author", "byl", "dc.creator"),
            FieldExtractor.text("[rel=author]"),
            FieldExtractor.text(".byline"),
            FieldExtractor.text(".author"),
            FieldExtractor.text("[itemprop=author]")
    ));

    static final FieldExtractor DATE_PUBLISHED = FieldExtractor.firstOf(List.of(
            FieldExtractor.meta("article:published_time", "date", "pubdate", "publishdate", "dc.date",
                    "dc.date.issued", "datePublished"),
            FieldExtractor.attribute("[itemprop=datePublished][datetime]", "datetime"),
            FieldExtractor.attribute("time[datetime]", "datetime")
    ));

    static final FieldExtractor DECLARED_LANGUAGE = FieldExtractor.firstOf(List.of(
            MetadataExtractor::langAttributeChain,
            (document, winner) -> {
                for (Element m : document.getElementsByTag("meta")) {
                    if ("content-language".equalsIgnoreCase(m.attr("http-equiv").trim())) {
                        return FieldExtractor.clean(m.attr("content"));
                    }
                }
                return Optional.empty();
            },
            FieldExtractor.meta("og:locale")
    ));

    private final LanguageDetector languageDetector;

    public MetadataExtractor() {
        this(new LanguageDetector());
    }

    public MetadataExtractor(LanguageDetector languageDetector) {
        this.languageDetector = languageDetector;
    }

    /**
     * @param document    normalized document
     * @param winner      selected root inside {@code document}
     * @param contentText visible text of the cleaned content, used for language detection
     * @param ctx         receives a warning for every missing field
     */
    public ArticleMetadata extract(Document document, Element winner, String contentText, ExtractionContext ctx) {
        String title = TITLE.extract(document, winner).orElse(null);
        String author = AUTHOR.extract(document, winner)
                .map(a -> BYLINE_PREFIX.matcher(a).replaceFirst(""))
                .filter(a -> !a.isBlank())
                .orElse(null);
        String date = DATE_PUBLISHED.extract(document, winner).orElse(null);
        String language = DECLARED_LANGUAGE.extract(document, winner)
                .map(l -> l.replace('_', '-'))
                .or(() -> Optional.ofNullable(ctx.getOptions().getLanguageHint()))
                .or(() -> languageDetector.detect(contentText))
                .orElse(null);

        if (title == null) ctx.warn("Missing metadata: title");
        if (author == null) ctx.warn("Missing metadata: author");
        if (date == null) ctx.warn("Missing metadata: date_published");
        if (language == null) ctx.warn("Missing metadata: language");
        log.debug("Metadata title='{}' author='{}' date='{}' language='{}'", title, author, date, language);
        return new ArticleMetadata(title, author, date, language);
    }

    private static Optional<String> topHeading(Document document, Element winner) {
        if (winner == null) return Optional.empty();
        Element top = null;
        int topLevel = 7;
        for (Element h : winner.select("h1, h2, h3, h4, h5, h6")) {
            int level = h.normalName().charAt(1) - '0';
            if (level < topLevel && h.hasText()) {
                top = h;
                topLevel = level;
            }
        }
        return top == null ? Optional.empty() : FieldExtractor.clean(top.text());
    }

    private static Optional<String> langAttributeChain(Document document, Element winner) {
        for (Element e = winner; e != null; e = e.parent()) {
            for (String attr : new String[]{"lang", "xml:lang"}) {
                String lang = e.attr(attr).trim();
                if (!lang.isEmpty()) return Optional.of(lang);
            }
        }
        return Optional.empty();
    }
}
