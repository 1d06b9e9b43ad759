package com.phillippitts.liveagent.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Background ambience mixed under bot speech.
 */
@ConfigurationProperties(prefix = "audio.background")
@Validated
public class BackgroundAudioProperties {

    /** WAV source: {@code https://}, {@code classpath:} or {@code file:} location. Blank disables mixing. */
    private String source = "";

    /** Linear gain applied to the background track. 0 bypasses the mixer. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double gain = 0.06;

    /** Largest WAV accepted from a remote source. */
    @Positive
    private int maxDownloadBytes = 5 * 1024 * 1024;

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public double getGain() {
        return gain;
    }

    public void setGain(double gain) {
        this.gain = gain;
    }

    public int getMaxDownloadBytes() {
        return maxDownloadBytes;
    }

    public void setMaxDownloadBytes(int maxDownloadBytes) {
        this.maxDownloadBytes = maxDownloadBytes;
    }

    public boolean isEnabled() {
        return source != null && !source.isBlank() && gain > 0.0;
    }
}
