package org.smileyface.articleextractor.extractor.metadata;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.articleextractor.util.ExtractorUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * One strategy for reading a metadata field. Strategies are combined with {@link #firstOf(List)},
 * which tries them in order and keeps the first value found.
 */
@FunctionalInterface
public interface FieldExtractor {

    /**
     * @param document the whole normalized document
     * @param winner   the selected article root inside {@code document}
     * @return the field value, whitespace-collapsed and non-blank, or empty
     */
    Optional<String> extract(Document document, Element winner);

    static FieldExtractor firstOf(List<FieldExtractor> chain) {
        List<FieldExtractor> strategies = List.copyOf(chain);
        return (document, winner) -> {
            for (FieldExtractor s : strategies) {
                Optional<String> value = s.extract(document, winner);
                if (value.isPresent()) return value;
            }
            return Optional.empty();
        };
    }

    /**
     * Reads the {@code content} of the first {@code meta} tag whose {@code name}, {@code property}
     * or {@code itemprop} equals one of {@code keys}, ignoring case.
     */
    static FieldExtractor meta(String... keys) {
        return (document, winner) -> {
            for (String key : keys) {
                String k = key.toLowerCase(Locale.ROOT);
                for (Element m : document.getElementsByTag("meta")) {
                    if (k.equalsIgnoreCase(m.attr("name").trim())
                            || k.equalsIgnoreCase(m.attr("property").trim())
                            || k.equalsIgnoreCase(m.attr("itemprop").trim())) {
                        Optional<String> value = clean(m.attr("content"));
                        if (value.isPresent()) return value;
                    }
                }
            }
            return Optional.empty();
        };
    }

    /**
     * Reads the text of the first element matching {@code cssQuery} anywhere in the document.
     */
    static FieldExtractor text(String cssQuery) {
        return (document, winner) -> {
            for (Element el : document.select(cssQuery)) {
                Optional<String> value = clean(el.text());
                if (value.isPresent()) return value;
            }
            return Optional.empty();
        };
    }

    /**
     * Reads {@code attribute} of the first element matching {@code cssQuery} anywhere in the document.
     */
    static FieldExtractor attribute(String cssQuery, String attribute) {
        return (document, winner) -> {
            for (Element el : document.select(cssQuery)) {
                Optional<String> value = clean(el.attr(attribute));
                if (value.isPresent()) return value;
            }
            return Optional.empty();
        };
    }

    static Optional<String> clean(String raw) {
        if (raw == null) return Optional.empty();
        String value = ExtractorUtils.collapseWhitespace(raw).strip();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
