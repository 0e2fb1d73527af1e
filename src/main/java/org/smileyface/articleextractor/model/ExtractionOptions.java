package org.smileyface.articleextractor.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable per-request configuration of the extraction pipeline.
 * Instances are created once per request through {@link #builder()} and never mutated; the
 * Jackson view of an instance is part of the cache fingerprint, so every field that changes
 * the output must be exposed as a property.
 */
public final class ExtractionOptions {

    public static final int DEFAULT_MIN_WORD_COUNT = 150;
    public static final int DEFAULT_MAX_OUTPUT_CHARS = 1_000_000;
    public static final int DEFAULT_EXCERPT_LENGTH = 200;

    private static final ExtractionOptions DEFAULTS = builder().build();

    private final int minWordCount;
    private final boolean includeImages;
    private final boolean includeCode;
    private final int maxOutputChars;
    private final String languageHint;
    private final int excerptLength;
    private final boolean stripNoise;
    private final boolean resolveUrls;
    private final boolean normalizeHeadings;

    private ExtractionOptions(Builder b) {
        this.minWordCount = Math.max(0, b.minWordCount);
        this.includeImages = b.includeImages;
        this.includeCode = b.includeCode;
        this.maxOutputChars = b.maxOutputChars;
        this.languageHint = (b.languageHint == null || b.languageHint.isBlank()) ? null : b.languageHint.trim();
        this.excerptLength = Math.max(1, b.excerptLength);
        this.stripNoise = b.stripNoise;
        this.resolveUrls = b.resolveUrls;
        this.normalizeHeadings = b.normalizeHeadings;
    }

    public static ExtractionOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this instance's values
     */
    public Builder toBuilder() {
        return new Builder()
                .minWordCount(minWordCount)
                .includeImages(includeImages)
                .includeCode(includeCode)
                .maxOutputChars(maxOutputChars)
                .languageHint(languageHint)
                .excerptLength(excerptLength)
                .stripNoise(stripNoise)
                .resolveUrls(resolveUrls)
                .normalizeHeadings(normalizeHeadings);
    }

    @JsonProperty("min_word_count")
    public int getMinWordCount() { return minWordCount; }

    @JsonProperty("include_images")
    public boolean isIncludeImages() { return includeImages; }

    @JsonProperty("include_code")
    public boolean isIncludeCode() { return includeCode; }

    /** Upper bound for the serialized HTML and Markdown; values of zero or less disable the bound. */
    @JsonProperty("max_output_chars")
    public int getMaxOutputChars() { return maxOutputChars; }

    @JsonProperty("language_hint")
    public String getLanguageHint() { return languageHint; }

    @JsonProperty("excerpt_length")
    public int getExcerptLength() { return excerptLength; }

    @JsonProperty("strip_noise")
    public boolean isStripNoise() { return stripNoise; }

    @JsonProperty("resolve_urls")
    public boolean isResolveUrls() { return resolveUrls; }

    @JsonProperty("normalize_headings")
    public boolean isNormalizeHeadings() { return normalizeHeadings; }

    public boolean hasOutputLimit() {
        return maxOutputChars > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExtractionOptions that = (ExtractionOptions) o;
        return minWordCount == that.minWordCount
                && includeImages == that.includeImages
                && includeCode == that.includeCode
                && maxOutputChars == that.maxOutputChars
                && excerptLength == that.excerptLength
                && stripNoise == that.stripNoise
                && resolveUrls == that.resolveUrls
                && normalizeHeadings == that.normalizeHeadings
                && Objects.equals(languageHint, that.languageHint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minWordCount, includeImages, includeCode, maxOutputChars, languageHint,
                excerptLength, stripNoise, resolveUrls, normalizeHeadings);
    }

    @Override
    public String toString() {
        return "ExtractionOptions{" +
                "minWordCount=" + minWordCount +
                ", includeImages=" + includeImages +
                ", includeCode=" + includeCode +
                ", maxOutputChars=" + maxOutputChars +
                ", languageHint='" + languageHint + '\'' +
                ", excerptLength=" + excerptLength +
                ", stripNoise=" + stripNoise +
                ", resolveUrls=" + resolveUrls +
                ", normalizeHeadings=" + normalizeHeadings +
                '}';
    }

    public static final class Builder {
        private int minWordCount = DEFAULT_MIN_WORD_COUNT;
        private boolean includeImages = true;
        private boolean includeCode = true;
        private int maxOutputChars = DEFAULT_MAX_OUTPUT_CHARS;
        private String languageHint;
        private int excerptLength = DEFAULT_EXCERPT_LENGTH;
        private boolean stripNoise = true;
        private boolean resolveUrls = true;
        private boolean normalizeHeadings = true;

        private Builder() {
        }

        public Builder minWordCount(int minWordCount) { this.minWordCount = minWordCount; return this; }
        public Builder includeImages(boolean includeImages) { this.includeImages = includeImages; return this; }
        public Builder includeCode(boolean includeCode) { this.includeCode = includeCode; return this; }
        public Builder maxOutputChars(int maxOutputChars) { this.maxOutputChars = maxOutputChars; return this; }
        public Builder languageHint(String languageHint) { this.languageHint = languageHint; return this; }
        public Builder excerptLength(int excerptLength) { this.excerptLength = excerptLength; return this; }
        public Builder stripNoise(boolean stripNoise) { this.stripNoise = stripNoise; return this; }
        public Builder resolveUrls(boolean resolveUrls) { this.resolveUrls = resolveUrls; return this; }
        public Builder normalizeHeadings(boolean normalizeHeadings) { this.normalizeHeadings = normalizeHeadings; return this; }

        public ExtractionOptions build() {
            return new ExtractionOptions(this);
        }
    }
}
