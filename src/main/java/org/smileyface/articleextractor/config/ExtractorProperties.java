package org.smileyface.articleextractor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.articleextractor.extractor.ContentRule;
import org.smileyface.articleextractor.extractor.ScoreRule;
import org.smileyface.articleextractor.extractor.ScoringRules;
import org.smileyface.articleextractor.extractor.TreeNormalizer;
import org.smileyface.articleextractor.model.ExtractionOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.PatternSyntaxException;

/**
 * Configuration of the extraction service.
 */
@ConfigurationProperties(prefix = "extractor")
public class ExtractorProperties {

    static final String DEFAULTS_RESOURCE = "ArticleExtractorConfig.json";

    Logger log = LogManager.getLogger(ExtractorProperties.class);

    /** Maximum number of cached results; 0 disables caching. */
    private int cacheSize = 1000;

    private int minWordCount = ExtractionOptions.DEFAULT_MIN_WORD_COUNT;

    private boolean includeImages = true;

    private boolean includeCode = true;

    /** Bound for the serialized HTML and Markdown; 0 or less means unbounded. */
    private int maxOutputChars = ExtractionOptions.DEFAULT_MAX_OUTPUT_CHARS;

    private int excerptLength = ExtractionOptions.DEFAULT_EXCERPT_LENGTH;

    /** Language reported when the document declares none. */
    private String languageHint;

    /** Tags removed with their subtree before scoring. */
    private List<String> stripTags = new ArrayList<>(TreeNormalizer.DEFAULT_STRIP_TAGS);

    /** Scoring table; empty means the built-in table. */
    private List<ScoringRuleConfig> scoringRules = new ArrayList<>();

    /**
     * Loads default values from classpath resource ArticleExtractorConfig.json if available.
     * Spring still binds {@code extractor.*} properties on top.
     */
    public ExtractorProperties() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                ArticleExtractorConfig cfg = new ObjectMapper().readValue(in, ArticleExtractorConfig.class);
                if (cfg.cacheSize != null && cfg.cacheSize >= 0) this.cacheSize = cfg.cacheSize;
                if (cfg.minWordCount != null && cfg.minWordCount >= 0) this.minWordCount = cfg.minWordCount;
                if (cfg.includeImages != null) this.includeImages = cfg.includeImages;
                if (cfg.includeCode != null) this.includeCode = cfg.includeCode;
                if (cfg.maxOutputChars != null) this.maxOutputChars = cfg.maxOutputChars;
                if (cfg.excerptLength != null && cfg.excerptLength > 0) this.excerptLength = cfg.excerptLength;
                if (cfg.languageHint != null && !cfg.languageHint.isBlank()) this.languageHint = cfg.languageHint;
                if (cfg.stripTags != null && !cfg.stripTags.isEmpty()) this.stripTags = new ArrayList<>(cfg.stripTags);
                if (cfg.scoringRules != null) this.scoringRules = new ArrayList<>(cfg.scoringRules);
                log.info("Loaded extractor defaults from {} ({} scoring rules)", DEFAULTS_RESOURCE, scoringRules.size());
            }
        } catch (Exception e) {
            log.warn("Failed to load extractor defaults from classpath resource {}, using built-in defaults",
                    DEFAULTS_RESOURCE, e);
        }
    }

    public int getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
        this.cacheSize = Math.max(0, cacheSize);
    }

    public int getMinWordCount() {
        return minWordCount;
    }

    public void setMinWordCount(int minWordCount) {
        this.minWordCount = Math.max(0, minWordCount);
    }

    public boolean isIncludeImages() {
        return includeImages;
    }

    public void setIncludeImages(boolean includeImages) {
        this.includeImages = includeImages;
    }

    public boolean isIncludeCode() {
        return includeCode;
    }

    public void setIncludeCode(boolean includeCode) {
        this.includeCode = includeCode;
    }

    public int getMaxOutputChars() {
        return maxOutputChars;
    }

    public void setMaxOutputChars(int maxOutputChars) {
        this.maxOutputChars = maxOutputChars;
    }

    public int getExcerptLength() {
        return excerptLength;
    }

    public void setExcerptLength(int excerptLength) {
        this.excerptLength = excerptLength > 0 ? excerptLength : ExtractionOptions.DEFAULT_EXCERPT_LENGTH;
    }

    public String getLanguageHint() {
        return languageHint;
    }

    public void setLanguageHint(String languageHint) {
        this.languageHint = (languageHint == null || languageHint.isBlank()) ? null : languageHint.trim();
    }

    public List<String> getStripTags() {
        return stripTags;
    }

    public void setStripTags(List<String> stripTags) {
        this.stripTags = stripTags != null ? stripTags : new ArrayList<>();
    }

    public List<ScoringRuleConfig> getScoringRules() {
        return scoringRules;
    }

    public void setScoringRules(List<ScoringRuleConfig> scoringRules) {
        this.scoringRules = scoringRules != null ? scoringRules : new ArrayList<>();
    }

    /**
     * Options applied to requests that do not override them.
     */
    public ExtractionOptions toDefaultOptions() {
        return ExtractionOptions.builder()
                .minWordCount(minWordCount)
                .includeImages(includeImages)
                .includeCode(includeCode)
                .maxOutputChars(maxOutputChars)
                .excerptLength(excerptLength)
                .languageHint(languageHint)
                .build();
    }

    /**
     * Builds the scoring table from {@link #scoringRules}. Entries with an unknown target, a blank
     * pattern or an invalid regex are logged and skipped. When nothing usable is configured the
     * built-in table is returned.
     */
    public ScoringRules buildScoringRules() {
        List<ScoreRule> rules = new ArrayList<>();
        for (ScoringRuleConfig cfg : scoringRules) {
            if (cfg == null) continue;
            ScoreRule rule = toScoreRule(cfg);
            if (rule != null) rules.add(rule);
        }
        if (rules.isEmpty()) {
            return ScoringRules.defaults();
        }
        return new ScoringRules(rules);
    }

    private ScoreRule toScoreRule(ScoringRuleConfig cfg) {
        String target = cfg.getTarget() == null ? "" : cfg.getTarget().trim().toLowerCase(Locale.ROOT);
        String pattern = cfg.getPattern();
        if (pattern == null || pattern.isBlank()) {
            log.warn("Skipping scoring rule with blank pattern: {}", cfg);
            return null;
        }
        try {
            switch (target) {
                case "tag":
                    return ScoreRule.tag(pattern.trim(), cfg.getDelta());
                case "attribute":
                    return ScoreRule.attribute(pattern, cfg.getDelta());
                case "role":
                    String role = pattern.trim();
                    ContentRule byRole = e -> e != null && role.equalsIgnoreCase(e.attr("role").trim());
                    return new ScoreRule("role:" + role, byRole, cfg.getDelta());
                default:
                    log.warn("Skipping scoring rule with unknown target '{}': {}", cfg.getTarget(), cfg);
                    return null;
            }
        } catch (PatternSyntaxException e) {
            log.warn("Skipping scoring rule with invalid pattern '{}': {}", pattern, e.getDescription());
            return null;
        }
    }

    // --------- Nested config DTOs for JSON mapping ---------
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ArticleExtractorConfig {
        public Integer cacheSize;
        public Integer minWordCount;
        public Boolean includeImages;
        public Boolean includeCode;
        public Integer maxOutputChars;
        public Integer excerptLength;
        public String languageHint;
        public List<String> stripTags;
        public List<ScoringRuleConfig> scoringRules;
    }

    /**
     * One configured scoring row. {@code target} is {@code tag}, {@code attribute} (regex over
     * class and id) or {@code role}.
     */
    public static class ScoringRuleConfig {

        private String target;
        private String pattern;
        private double delta;

        public ScoringRuleConfig() {} // for JSON mapping and property binding

        public ScoringRuleConfig(String target, String pattern, double delta) {
            this.target = target;
            this.pattern = pattern;
            this.delta = delta;
        }

        public String getTarget() { return target; }
        public void setTarget(String target) { this.target = target; }

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }

        public double getDelta() { return delta; }
        public void setDelta(double delta) { this.delta = delta; }

        @Override
        public String toString() {
            return "ScoringRuleConfig{target='" + target + "', pattern='" + pattern + "', delta=" + delta + '}';
        }
    }
}
