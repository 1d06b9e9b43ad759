package com.phillippitts.liveagent.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Conversation context seeding and transcript logging.
 */
@ConfigurationProperties(prefix = "context")
@Validated
public class ContextProperties {

    /** Most recent prior-call messages kept when seeding a session. */
    @Min(0)
    private int memoryMaxMessages = 50;

    /** Each seeded message is cut to this many characters. */
    @Positive
    private int memoryMaxChars = 2000;

    /** System note placed before seeded messages. */
    private String memoryPreamble = "Returning caller: the following messages are from a previous call "
            + "with this caller. Use them as context.";

    /** Turn text handed to transcript sinks is cut to this many characters. */
    @Positive
    private int transcriptMaxChars = 8000;

    public int getMemoryMaxMessages() {
        return memoryMaxMessages;
    }

    public void setMemoryMaxMessages(int memoryMaxMessages) {
        this.memoryMaxMessages = memoryMaxMessages;
    }

    public int getMemoryMaxChars() {
        return memoryMaxChars;
    }

    public void setMemoryMaxChars(int memoryMaxChars) {
        this.memoryMaxChars = memoryMaxChars;
    }

    public String getMemoryPreamble() {
        return memoryPreamble;
    }

    public void setMemoryPreamble(String memoryPreamble) {
        this.memoryPreamble = memoryPreamble;
    }

    public int getTranscriptMaxChars() {
        return transcriptMaxChars;
    }

    public void setTranscriptMaxChars(int transcriptMaxChars) {
        this.transcriptMaxChars = transcriptMaxChars;
    }
}
