package org.smileyface.articleextractor.cache;

import org.smileyface.articleextractor.model.ArticleResult;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Memoizes extraction results by {@link Fingerprint}.
 * Implementations guarantee that concurrent callers asking for the same fingerprint share one
 * computation, while different fingerprints never wait on each other.
 */
public interface ResultCache {

    /**
     * Returns the cached result for {@code fingerprint}, computing it with {@code compute} when
     * absent. If another caller is already computing the same fingerprint, waits for that result.
     * An exception thrown by {@code compute} is propagated to every waiting caller and nothing is
     * cached.
     */
    ArticleResult getOrCompute(Fingerprint fingerprint, Supplier<ArticleResult> compute);

    /**
     * @return the completed entry for {@code fingerprint}, if cached
     */
    Optional<CacheEntry> getEntry(Fingerprint fingerprint);

    long size();

    long maximumSize();

    void clear();
}
