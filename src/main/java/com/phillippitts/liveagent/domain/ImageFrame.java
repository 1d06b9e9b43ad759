package com.phillippitts.liveagent.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * A still image: a participant camera frame on the way in, an avatar video frame on the way out.
 *
 * <p>The frame takes ownership of {@code bytes}; {@link #bytes()} is read-only for consumers.
 * Equality compares pixel content.
 *
 * @param sequenceId  monotonic frame id
 * @param direction   flow direction
 * @param bytes       pixel data, raw or encoded per {@code pixelFormat}
 * @param width       width in pixels
 * @param height      height in pixels
 * @param pixelFormat byte layout
 */
public record ImageFrame(
        long sequenceId,
        FrameDirection direction,
        byte[] bytes,
        int width,
        int height,
        PixelFormat pixelFormat
) implements Frame {

    public ImageFrame {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(pixelFormat, "pixelFormat");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive, got: " + width + 'x' + height);
        }
    }

    public static ImageFrame of(byte[] bytes, int width, int height, PixelFormat pixelFormat) {
        return new ImageFrame(FrameSequence.next(), FrameDirection.DOWNSTREAM, bytes, width, height, pixelFormat);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ImageFrame other)) {
            return false;
        }
        return sequenceId == other.sequenceId
                && width == other.width
                && height == other.height
                && direction == other.direction
                && pixelFormat == other.pixelFormat
                && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(sequenceId, direction, width, height, pixelFormat) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "ImageFrame[id=" + sequenceId + ", " + width + 'x' + height + ' ' + pixelFormat + ']';
    }
}
