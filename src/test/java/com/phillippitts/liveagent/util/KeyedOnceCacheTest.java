package com.phillippitts.liveagent.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyedOnceCacheTest {

    @Test
    void loadsOncePerKeyUnderContention() throws Exception {
        KeyedOnceCache<String, String> cache = new KeyedOnceCache<>();
        AtomicInteger loaderCalls = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                Callable<String> call = () -> {
                    go.await();
                    return cache.get("track", k -> {
                        loaderCalls.incrementAndGet();
                        sleepQuietly(20);
                        return "decoded:" + k;
                    });
                };
                results.add(pool.submit(call));
            }
            go.countDown();
            for (Future<String> f : results) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isEqualTo("decoded:track");
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(loaderCalls.get()).isEqualTo(1);
        assertThat(cache.loadCount()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void distinctKeysLoadSeparately() {
        KeyedOnceCache<Integer, String> cache = new KeyedOnceCache<>();

        cache.get(16_000, k -> "a");
        cache.get(24_000, k -> "b");
        cache.get(16_000, k -> "c");

        assertThat(cache.get(16_000, k -> "ignored")).isEqualTo("a");
        assertThat(cache.loadCount()).isEqualTo(2);
    }

    @Test
    void failedLoadIsRetriedOnNextRequest() {
        KeyedOnceCache<String, String> cache = new KeyedOnceCache<>();

        assertThatThrownBy(() -> cache.get("k", key -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(cache.size()).isZero();
        assertThat(cache.get("k", key -> "ok")).isEqualTo("ok");
        assertThat(cache.loadCount()).isEqualTo(1);
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
