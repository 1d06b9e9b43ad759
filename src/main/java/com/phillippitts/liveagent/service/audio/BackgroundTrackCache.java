package com.phillippitts.liveagent.service.audio;

import com.phillippitts.liveagent.util.KeyedOnceCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Process-wide cache of decoded background tracks, keyed by source and target sample rate.
 *
 * <p>Each key is decoded at most once and shared read-only for the lifetime of the process;
 * every {@link #open} hands out a track with its own cursor.
 */
@Component
public class BackgroundTrackCache {

    private static final Logger LOG = LogManager.getLogger(BackgroundTrackCache.class);

    private final TrackLoader loader;
    private final KeyedOnceCache<TrackKey, byte[]> tracks = new KeyedOnceCache<>();

    public BackgroundTrackCache(TrackLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * Returns a new track with its own cursor over the shared PCM for {@code source}.
     *
     * @throws com.phillippitts.liveagent.exception.MediaFormatException if the track cannot be
     *         loaded or decoded; nothing is cached in that case
     */
    public BackgroundTrack open(String source, int sampleRate) {
        return new BackgroundTrack(tracks.get(new TrackKey(source, sampleRate), this::decode), sampleRate);
    }

    private byte[] decode(TrackKey key) {
        long start = System.nanoTime();
        byte[] pcm = PcmFormatConverter.toPcm16Mono(loader.load(key.source()), key.sampleRate());
        LOG.info("Cached background track {} at {} Hz ({} bytes, {} ms)", key.source(), key.sampleRate(),
                pcm.length, (System.nanoTime() - start) / 1_000_000L);
        return pcm;
    }

    /** Number of successful decodes since startup. */
    public int loadCount() {
        return tracks.loadCount();
    }

    public int size() {
        return tracks.size();
    }

    private record TrackKey(String source, int sampleRate) {
    }
}
