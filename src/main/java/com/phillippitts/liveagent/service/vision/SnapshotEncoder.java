package com.phillippitts.liveagent.service.vision;

import com.phillippitts.liveagent.config.properties.VisionProperties;
import com.phillippitts.liveagent.domain.PixelFormat;
import com.phillippitts.liveagent.exception.MediaFormatException;
import com.phillippitts.liveagent.util.PipelineTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Re-encodes snapshots as bounded-size JPEG data URLs for language-model turns.
 *
 * <p>Encoding runs on the media executor with a timeout. Any failure yields an empty result so the
 * turn goes out text-only.
 */
@Component
public class SnapshotEncoder {

    private static final Logger LOG = LogManager.getLogger(SnapshotEncoder.class);
    public static final String DATA_URL_PREFIX = "data:image/jpeg;base64,";

    private final Executor executor;
    private final int maxDimension;
    private final int jpegQuality;
    private final Duration timeout;

    @Autowired
    public SnapshotEncoder(@Qualifier("mediaExecutor") Executor executor, VisionProperties properties) {
        this(executor, properties.getMaxDimension(), properties.getJpegQuality(),
                PipelineTimeouts.SNAPSHOT_ENCODE_TIMEOUT);
    }

    public SnapshotEncoder(Executor executor, int maxDimension, int jpegQuality, Duration timeout) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.maxDimension = maxDimension;
        this.jpegQuality = jpegQuality;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Encodes off the calling thread and waits up to the configured timeout.
     *
     * @return the data URL, or empty if encoding failed or timed out
     */
    public Optional<String> encodeDataUrl(VisionSnapshot snapshot) {
        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> toDataUrl(snapshot), executor);
        try {
            return Optional.of(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Snapshot encoding exceeded {} ms; sending turn without image", timeout.toMillis());
        } catch (ExecutionException e) {
            LOG.warn("Snapshot encoding failed; sending turn without image: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
        }
        return Optional.empty();
    }

    String toDataUrl(VisionSnapshot snapshot) {
        BufferedImage image = scale(toImage(snapshot), maxDimension);
        return DATA_URL_PREFIX + Base64.getEncoder().encodeToString(encodeJpeg(image, jpegQuality));
    }

    static BufferedImage toImage(VisionSnapshot snapshot) {
        PixelFormat format = snapshot.pixelFormat();
        if (format.isEncoded()) {
            return decode(snapshot.imageBytes());
        }
        int width = snapshot.width();
        int height = snapshot.height();
        int bpp = format.bytesPerPixel();
        byte[] bytes = snapshot.imageBytes();
        if ((long) width * height * bpp > bytes.length) {
            throw new MediaFormatException("Snapshot " + width + 'x' + height + ' ' + format + " needs "
                    + ((long) width * height * bpp) + " bytes, got " + bytes.length);
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = bytes[i] & 0xFF;
                int g = bytes[i + 1] & 0xFF;
                int b = bytes[i + 2] & 0xFF;
                image.setRGB(x, y, (r << 16) | (g << 8) | b);
                i += bpp;
            }
        }
        return image;
    }

    private static BufferedImage decode(byte[] encoded) {
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(new ByteArrayInputStream(encoded));
        } catch (IOException e) {
            throw new MediaFormatException("Cannot decode snapshot", e);
        }
        if (decoded == null) {
            throw new MediaFormatException("Snapshot is not a readable image");
        }
        // JPEG has no alpha channel
        BufferedImage rgb = new BufferedImage(decoded.getWidth(), decoded.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(decoded, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    /**
     * Shrinks so the longest edge is at most {@code maxDimension}; 0 keeps the original size.
     */
    static BufferedImage scale(BufferedImage image, int maxDimension) {
        int longest = Math.max(image.getWidth(), image.getHeight());
        if (maxDimension <= 0 || longest <= maxDimension) {
            return image;
        }
        double factor = (double) maxDimension / longest;
        int width = Math.max(1, (int) Math.round(image.getWidth() * factor));
        int height = Math.max(1, (int) Math.round(image.getHeight() * factor));
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    static byte[] encodeJpeg(BufferedImage image, int quality) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new MediaFormatException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(quality / 100f);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException e) {
            throw new MediaFormatException("JPEG encoding failed", e);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }
}
