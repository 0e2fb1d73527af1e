package org.smileyface.articleextractor.cache;

import org.junit.jupiter.api.Test;
import org.smileyface.articleextractor.model.ArticleResult;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class DisabledResultCacheTest {

    @Test
    void alwaysComputes() {
        DisabledResultCache cache = new DisabledResultCache();
        Fingerprint fp = Fingerprint.of("<p>a</p>", null, null);
        AtomicInteger calls = new AtomicInteger();

        for (int i = 0; i < 3; i++) {
            cache.getOrCompute(fp, () -> {
                calls.incrementAndGet();
                return ArticleResult.failure(null, "x", null);
            });
        }

        assertThat(calls).hasValue(3);
        assertThat(cache.getEntry(fp)).isEmpty();
        assertThat(cache.size()).isZero();
        assertThat(cache.maximumSize()).isZero();
    }
}
