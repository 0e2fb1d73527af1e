package org.smileyface.articleextractor.controller;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.smileyface.articleextractor.model.ExtractionOptions;

/**
 * Body of {@code POST /extract}.
 *
 * @param html    document to extract from
 * @param url     source URL of the document, used for link resolution only
 * @param options per-request overrides; absent fields keep the service defaults
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionRequest(String html, String url, Options options) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Options(@JsonProperty("min_word_count") Integer minWordCount,
                          @JsonProperty("include_images") Boolean includeImages,
                          @JsonProperty("include_code") Boolean includeCode,
                          @JsonProperty("max_output_chars") Integer maxOutputChars,
                          @JsonProperty("language_hint") String languageHint,
                          @JsonProperty("excerpt_length") Integer excerptLength,
                          @JsonProperty("strip_noise") Boolean stripNoise,
                          @JsonProperty("resolve_urls") Boolean resolveUrls,
                          @JsonProperty("normalize_headings") Boolean normalizeHeadings) {

        public ExtractionOptions applyTo(ExtractionOptions defaults) {
            ExtractionOptions.Builder b = defaults.toBuilder();
            if (minWordCount != null) b.minWordCount(minWordCount);
            if (includeImages != null) b.includeImages(includeImages);
            if (includeCode != null) b.includeCode(includeCode);
            if (maxOutputChars != null) b.maxOutputChars(maxOutputChars);
            if (languageHint != null) b.languageHint(languageHint);
            if (excerptLength != null) b.excerptLength(excerptLength);
            if (stripNoise != null) b.stripNoise(stripNoise);
            if (resolveUrls != null) b.resolveUrls(resolveUrls);
            if (normalizeHeadings != null) b.normalizeHeadings(normalizeHeadings);
            return b.build();
        }
    }

    public ExtractionOptions resolveOptions(ExtractionOptions defaults) {
        return options == null ? defaults : options.applyTo(defaults);
    }
}
