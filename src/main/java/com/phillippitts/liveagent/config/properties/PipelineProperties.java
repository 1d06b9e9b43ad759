package com.phillippitts.liveagent.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the pipeline executor and per-session defaults.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public class PipelineProperties {

    /** Data frames each stage inbox holds before its producer blocks. */
    @Positive(message = "Inbox capacity must be positive")
    private int inboxCapacity = 32;

    /** Idle timeout for plain voice sessions. */
    @NotNull
    private Duration idleTimeout = Duration.ofSeconds(300);

    /** Idle timeout for avatar sessions (share-a-link-and-join flows need more wall-clock time). */
    @NotNull
    private Duration avatarIdleTimeout = Duration.ofSeconds(1800);

    /** Sample rate of audio delivered to the transport, in Hz. */
    @Positive(message = "Output sample rate must be positive")
    private int outputSampleRate = 16_000;

    /** Default system prompt when a session request carries none. */
    private String systemPrompt = "You are a helpful voice assistant. Keep responses concise.";

    public int getInboxCapacity() {
        return inboxCapacity;
    }

    public void setInboxCapacity(int inboxCapacity) {
        this.inboxCapacity = inboxCapacity;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public Duration getAvatarIdleTimeout() {
        return avatarIdleTimeout;
    }

    public void setAvatarIdleTimeout(Duration avatarIdleTimeout) {
        this.avatarIdleTimeout = avatarIdleTimeout;
    }

    public int getOutputSampleRate() {
        return outputSampleRate;
    }

    public void setOutputSampleRate(int outputSampleRate) {
        this.outputSampleRate = outputSampleRate;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }
}
