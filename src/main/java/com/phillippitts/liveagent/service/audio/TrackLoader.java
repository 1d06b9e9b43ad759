package com.phillippitts.liveagent.service.audio;

/**
 * Fetches the raw container bytes of a background track.
 */
@FunctionalInterface
public interface TrackLoader {

    /**
     * @throws com.phillippitts.liveagent.exception.MediaFormatException if the source is
     *         rejected or cannot be read
     */
    byte[] load(String source);
}
