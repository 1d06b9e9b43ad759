package com.phillippitts.liveagent.config.properties;

import com.phillippitts.liveagent.service.vision.AttachMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Participant camera snapshots attached to user turns.
 */
@ConfigurationProperties(prefix = "vision")
@Validated
public class VisionProperties {

    private static final Duration MAX_AGE_CEILING = Duration.ofSeconds(60);

    /** Capture and attach camera snapshots. */
    private boolean enabled = false;

    /** Snapshot capture ceiling; frames arriving faster are dropped. */
    @Min(1)
    private int fps = 3;

    /** Snapshots older than this are not attached. Zero means no age limit; capped at 60s. */
    @NotNull
    private Duration maxAge = Duration.ofSeconds(5);

    @NotNull
    private AttachMode attachMode = AttachMode.ALWAYS;

    /** Longest edge of the encoded snapshot in pixels. Zero keeps the original size. */
    @Min(0)
    @Max(2048)
    private int maxDimension = 512;

    @Min(30)
    @Max(95)
    private int jpegQuality = 65;

    /** Turn text fragments that count as a visual reference in {@code AUTO} mode. */
    private List<String> keywords = new ArrayList<>(List.of(
            "see", "look", "show", "camera", "image", "photo", "picture", "screen", "read",
            "what is this", "what's this", "who is", "what am i", "wearing", "holding",
            "color", "colour", "shirt", "hat", "glasses", "sign", "logo", "text"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getFps() {
        return fps;
    }

    public void setFps(int fps) {
        this.fps = fps;
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    public void setMaxAge(Duration maxAge) {
        this.maxAge = maxAge;
    }

    /** Max age clamped to 0..60s. */
    public Duration effectiveMaxAge() {
        if (maxAge.isNegative()) {
            return Duration.ZERO;
        }
        return maxAge.compareTo(MAX_AGE_CEILING) > 0 ? MAX_AGE_CEILING : maxAge;
    }

    public AttachMode getAttachMode() {
        return attachMode;
    }

    public void setAttachMode(AttachMode attachMode) {
        this.attachMode = attachMode;
    }

    public int getMaxDimension() {
        return maxDimension;
    }

    public void setMaxDimension(int maxDimension) {
        this.maxDimension = maxDimension;
    }

    public int getJpegQuality() {
        return jpegQuality;
    }

    public void setJpegQuality(int jpegQuality) {
        this.jpegQuality = jpegQuality;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords;
    }
}
