package org.smileyface.articleextractor.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.articleextractor.model.ArticleResult;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Bounded in-memory {@link ResultCache} backed by a Caffeine {@link AsyncCache}.
 * <p>
 * Each fingerprint maps to a future. The first caller installs its own future with
 * {@code putIfAbsent} and computes on its own thread; later callers join that future. Caffeine's
 * map is striped, so callers for different fingerprints never contend on a shared lock, and
 * eviction only drops the map's reference while callers keep the entry they already hold.
 * A failed computation is removed so the next caller retries.
 */
public final class InMemoryResultCache implements ResultCache {

    private static final Logger log = LogManager.getLogger();

    private final AsyncCache<Fingerprint, CacheEntry> cache;
    private final long maximumSize;

    public InMemoryResultCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be > 0, use DisabledResultCache instead");
        }
        this.maximumSize = maximumSize;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .executor(Runnable::run)
                .buildAsync();
        log.info("Result cache created (maximumSize={})", maximumSize);
    }

    @Override
    public ArticleResult getOrCompute(Fingerprint fingerprint, Supplier<ArticleResult> compute) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(compute, "compute");

        CompletableFuture<CacheEntry> mine = new CompletableFuture<>();
        CompletableFuture<CacheEntry> existing = cache.asMap().putIfAbsent(fingerprint, mine);
        if (existing == null) {
            return computeInto(fingerprint, mine, compute);
        }

        try {
            CacheEntry entry = existing.join();
            long hits = entry.recordHit();
            log.debug("Cache hit for {} (hits={})", fingerprint, hits);
            return entry.getResult();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }

    private ArticleResult computeInto(Fingerprint fingerprint,
                                      CompletableFuture<CacheEntry> future,
                                      Supplier<ArticleResult> compute) {
        try {
            ArticleResult result = Objects.requireNonNull(compute.get(), "computed result");
            future.complete(new CacheEntry(result, Instant.now()));
            log.debug("Cached result for {}", fingerprint);
            return result;
        } catch (RuntimeException | Error e) {
            cache.asMap().remove(fingerprint, future);
            future.completeExceptionally(e);
            throw e;
        }
    }

    @Override
    public Optional<CacheEntry> getEntry(Fingerprint fingerprint) {
        CompletableFuture<CacheEntry> future = cache.getIfPresent(fingerprint);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    @Override
    public long size() {
        return cache.synchronous().estimatedSize();
    }

    @Override
    public long maximumSize() {
        return maximumSize;
    }

    @Override
    public void clear() {
        cache.synchronous().invalidateAll();
    }

    /**
     * Runs pending maintenance such as size-based eviction. Eviction is otherwise amortized
     * over reads and writes.
     */
    public void cleanUp() {
        cache.synchronous().cleanUp();
    }
}
