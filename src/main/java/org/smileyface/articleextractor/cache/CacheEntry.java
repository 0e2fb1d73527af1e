package org.smileyface.articleextractor.cache;

import org.smileyface.articleextractor.model.ArticleResult;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A cached result with its creation time and the number of times it was served from the cache.
 */
public final class CacheEntry {

    private final ArticleResult result;
    private final Instant createdAt;
    private final AtomicLong hits = new AtomicLong();

    public CacheEntry(ArticleResult result, Instant createdAt) {
        this.result = Objects.requireNonNull(result, "result");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public ArticleResult getResult() {
        return result;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public long getHits() {
        return hits.get();
    }

    long recordHit() {
        return hits.incrementAndGet();
    }

    @Override
    public String toString() {
        return "CacheEntry{" +
                "createdAt=" + createdAt +
                ", hits=" + hits.get() +
                ", result=" + result +
                '}';
    }
}
