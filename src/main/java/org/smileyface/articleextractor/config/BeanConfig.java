package org.smileyface.articleextractor.config;

import org.smileyface.articleextractor.cache.DisabledResultCache;
import org.smileyface.articleextractor.cache.InMemoryResultCache;
import org.smileyface.articleextractor.cache.ResultCache;
import org.smileyface.articleextractor.extractor.ContentExtractor;
import org.smileyface.articleextractor.extractor.ScoringRules;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the extraction pipeline and the result cache from {@link ExtractorProperties}.
 */
@Configuration
public class BeanConfig {

    @Bean
    public ScoringRules scoringRules(ExtractorProperties properties) {
        return properties.buildScoringRules();
    }

    @Bean
    public ContentExtractor contentExtractor(ScoringRules scoringRules, ExtractorProperties properties) {
        return new ContentExtractor(scoringRules, properties.getStripTags());
    }

    /**
     * Selects the cache implementation from {@code extractor.cache-size}:
     * a positive size uses {@link InMemoryResultCache}, 0 uses {@link DisabledResultCache}.
     */
    @Bean
    public ResultCache resultCache(ExtractorProperties properties) {
        int size = properties.getCacheSize();
        if (size > 0) {
            return new InMemoryResultCache(size);
        }
        return new DisabledResultCache();
    }
}
