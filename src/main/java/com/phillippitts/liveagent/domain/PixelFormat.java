package com.phillippitts.liveagent.domain;

/** Layout of {@link ImageFrame} bytes. Raw formats are 8 bits per channel, row-major. */
public enum PixelFormat {
    RGB(3),
    RGBA(4),
    JPEG(0),
    PNG(0);

    private final int bytesPerPixel;

    PixelFormat(int bytesPerPixel) {
        this.bytesPerPixel = bytesPerPixel;
    }

    public int bytesPerPixel() {
        return bytesPerPixel;
    }

    public boolean isEncoded() {
        return bytesPerPixel == 0;
    }
}
