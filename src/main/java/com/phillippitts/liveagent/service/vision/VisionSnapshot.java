package com.phillippitts.liveagent.service.vision;

import com.phillippitts.liveagent.domain.ImageFrame;
import com.phillippitts.liveagent.domain.PixelFormat;

import java.util.Objects;

/**
 * The most recent participant camera image. Shares the read-only pixel array of the frame it was
 * taken from.
 *
 * @param imageBytes      raw or encoded pixels, per {@code pixelFormat}
 * @param pixelFormat     byte layout
 * @param width           width in pixels
 * @param height          height in pixels
 * @param capturedAtNanos monotonic capture time ({@link System#nanoTime()} scale)
 */
public record VisionSnapshot(byte[] imageBytes, PixelFormat pixelFormat, int width, int height,
                             long capturedAtNanos) {

    public VisionSnapshot {
        Objects.requireNonNull(imageBytes, "imageBytes");
        Objects.requireNonNull(pixelFormat, "pixelFormat");
    }

    public static VisionSnapshot of(ImageFrame frame, long capturedAtNanos) {
        return new VisionSnapshot(frame.bytes(), frame.pixelFormat(), frame.width(), frame.height(), capturedAtNanos);
    }

    public long ageNanos(long nowNanos) {
        return nowNanos - capturedAtNanos;
    }
}
