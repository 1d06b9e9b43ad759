package com.phillippitts.liveagent.domain;

import java.util.concurrent.atomic.AtomicLong;

/** Process-wide monotonic frame id source. */
public final class FrameSequence {

    private static final AtomicLong NEXT = new AtomicLong();

    private FrameSequence() {
    }

    public static long next() {
        return NEXT.incrementAndGet();
    }
}
