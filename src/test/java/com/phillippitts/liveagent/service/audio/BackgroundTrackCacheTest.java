package com.phillippitts.liveagent.service.audio;

import com.phillippitts.liveagent.exception.MediaFormatException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.liveagent.service.audio.AudioTestSupport.constantPcm16;
import static com.phillippitts.liveagent.service.audio.AudioTestSupport.wav;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackgroundTrackCacheTest {

    private static final byte[] OFFICE = wav(constantPcm16(16_000, 1, 250), 16_000, 1);

    @Test
    void concurrentSessionsDecodeOnce() throws Exception {
        AtomicInteger fetches = new AtomicInteger();
        BackgroundTrackCache cache = new BackgroundTrackCache(source -> {
            fetches.incrementAndGet();
            return OFFICE;
        });
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(6);
        List<Future<BackgroundTrack>> opened = new ArrayList<>();
        try {
            for (int i = 0; i < 12; i++) {
                opened.add(pool.submit(() -> {
                    go.await();
                    return cache.open("https://cdn.example.com/office.wav", 16_000);
                }));
            }
            go.countDown();
            for (Future<BackgroundTrack> f : opened) {
                assertThat(f.get(5, TimeUnit.SECONDS).length()).isEqualTo(32_000);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(fetches.get()).isEqualTo(1);
        assertThat(cache.loadCount()).isEqualTo(1);
    }

    @Test
    void eachOpenGetsItsOwnCursor() {
        BackgroundTrackCache cache = new BackgroundTrackCache(source -> OFFICE);

        BackgroundTrack first = cache.open("classpath:office.wav", 16_000);
        BackgroundTrack second = cache.open("classpath:office.wav", 16_000);
        first.next(100);

        assertThat(first.cursor()).isEqualTo(100);
        assertThat(second.cursor()).isZero();
    }

    @Test
    void targetRateIsPartOfTheKey() {
        BackgroundTrackCache cache = new BackgroundTrackCache(source -> OFFICE);

        BackgroundTrack narrow = cache.open("classpath:office.wav", 8_000);
        BackgroundTrack wide = cache.open("classpath:office.wav", 16_000);

        assertThat(narrow.length()).isEqualTo(16_000);
        assertThat(wide.length()).isEqualTo(32_000);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void undecodableSourceIsNotCached() {
        AtomicInteger fetches = new AtomicInteger();
        BackgroundTrackCache cache = new BackgroundTrackCache(source -> {
            fetches.incrementAndGet();
            return new byte[]{1, 2, 3};
        });

        assertThatThrownBy(() -> cache.open("classpath:bad.wav", 16_000)).isInstanceOf(MediaFormatException.class);
        assertThatThrownBy(() -> cache.open("classpath:bad.wav", 16_000)).isInstanceOf(MediaFormatException.class);

        assertThat(fetches.get()).isEqualTo(2);
        assertThat(cache.size()).isZero();
    }
}
