package org.smileyface.articleextractor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.articleextractor.cache.Fingerprint;
import org.smileyface.articleextractor.cache.ResultCache;
import org.smileyface.articleextractor.config.ExtractorProperties;
import org.smileyface.articleextractor.extractor.ContentExtractor;
import org.smileyface.articleextractor.model.ArticleResult;
import org.smileyface.articleextractor.model.ExtractionOptions;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Runs extractions through the result cache. Identical requests (same HTML, base URL and options)
 * are computed once and then served from the cache.
 */
@Service
public class ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(ExtractionService.class);

    private final ContentExtractor extractor;
    private final ResultCache cache;
    private final ExtractionOptions defaultOptions;

    public ExtractionService(ContentExtractor extractor, ResultCache cache, ExtractorProperties properties) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.defaultOptions = properties == null ? ExtractionOptions.defaults() : properties.toDefaultOptions();
    }

    public ExtractionOptions getDefaultOptions() {
        return defaultOptions;
    }

    public ResultCache getCache() {
        return cache;
    }

    public ArticleResult extract(String html, String url) {
        return extract(html, url, defaultOptions);
    }

    /**
     * @param html    raw HTML
     * @param url     source URL used as base for relative links; may be null
     * @param options options for this request; null means the configured defaults
     */
    public ArticleResult extract(String html, String url, ExtractionOptions options) {
        ExtractionOptions opts = options == null ? defaultOptions : options;
        if (html == null || html.isBlank()) {
            return extractor.extract(html, url, opts);
        }
        long start = System.nanoTime();
        Fingerprint fingerprint = Fingerprint.of(html, url, opts);
        ArticleResult result = cache.getOrCompute(fingerprint, () -> extractor.extract(html, url, opts));
        if (log.isDebugEnabled()) {
            log.debug("Extraction of {} ({} chars) finished in {} ms: success={}, words={}, warnings={}",
                    url, html.length(), (System.nanoTime() - start) / 1_000_000,
                    result.isSuccess(), result.getWordCount(), result.getWarnings().size());
        }
        return result;
    }
}
