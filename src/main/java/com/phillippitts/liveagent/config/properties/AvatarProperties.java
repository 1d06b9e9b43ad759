package com.phillippitts.liveagent.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Avatar rendering bridge settings.
 */
@ConfigurationProperties(prefix = "avatar")
@Validated
public class AvatarProperties {

    /** Text-driven renderers receive sentence chunks; longer runs without a boundary are force-flushed. */
    @Positive
    private int textFlushMaxChars = 400;

    /** Outbound items buffered for the sender task before the stage blocks. */
    @Positive
    private int senderQueueCapacity = 256;

    public int getTextFlushMaxChars() {
        return textFlushMaxChars;
    }

    public void setTextFlushMaxChars(int textFlushMaxChars) {
        this.textFlushMaxChars = textFlushMaxChars;
    }

    public int getSenderQueueCapacity() {
        return senderQueueCapacity;
    }

    public void setSenderQueueCapacity(int senderQueueCapacity) {
        this.senderQueueCapacity = senderQueueCapacity;
    }
}
