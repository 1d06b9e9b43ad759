package com.phillippitts.liveagent.domain;

import java.util.Optional;

/**
 * Blocking pull-stream of media produced by an external service.
 *
 * <p>{@link #close()} may be called from any thread and must make a blocked {@link #next()}
 * return promptly, either empty or by throwing.
 *
 * @param <T> frame type
 */
public interface MediaStream<T extends Frame> extends AutoCloseable {

    /**
     * Blocks until the next item is available.
     *
     * @return the item, or empty once the stream has ended
     * @throws com.phillippitts.liveagent.exception.UpstreamServiceException if the stream failed
     */
    Optional<T> next();

    @Override
    void close();
}
