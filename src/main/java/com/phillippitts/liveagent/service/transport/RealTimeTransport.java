package com.phillippitts.liveagent.service.transport;

import com.phillippitts.liveagent.domain.Frame;

import java.util.Optional;

/**
 * The real-time room a call runs in.
 *
 * <p>Inbound frames are participant audio and camera images; outbound frames are bot audio,
 * avatar video and assistant text. Room management beyond join and leave belongs to the
 * implementation.
 */
public interface RealTimeTransport {

    String name();

    /**
     * Joins the room for {@code sessionId}. Returns once media can flow.
     *
     * @throws com.phillippitts.liveagent.exception.UpstreamServiceException if the room cannot be joined
     */
    void join(String sessionId);

    /**
     * Blocks for the next inbound frame.
     *
     * @return the frame, or empty once the participant has left
     */
    Optional<Frame> receive();

    /**
     * @throws com.phillippitts.liveagent.exception.UpstreamServiceException if the frame cannot be sent
     */
    void send(Frame frame);

    /** Leaves the room and unblocks a pending {@link #receive()}. Idempotent. */
    void leave();
}
