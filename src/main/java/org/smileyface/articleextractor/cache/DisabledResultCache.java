package org.smileyface.articleextractor.cache;

import org.smileyface.articleextractor.model.ArticleResult;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache of size zero: every call computes.
 */
public final class DisabledResultCache implements ResultCache {

    @Override
    public ArticleResult getOrCompute(Fingerprint fingerprint, Supplier<ArticleResult> compute) {
        return compute.get();
    }

    @Override
    public Optional<CacheEntry> getEntry(Fingerprint fingerprint) {
        return Optional.empty();
    }

    @Override
    public long size() {
        return 0;
    }

    @Override
    public long maximumSize() {
        return 0;
    }

    @Override
    public void clear() {
        // nothing cached
    }
}
