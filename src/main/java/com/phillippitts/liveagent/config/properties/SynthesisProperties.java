package com.phillippitts.liveagent.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Speech synthesis voice selection. Reconnect policy lives under {@code synthesis.connect}.
 */
@ConfigurationProperties(prefix = "synthesis")
@Validated
public class SynthesisProperties {

    /** Voice id. Blank asks the service for its default voice, resolved once per service. */
    private String voice = "";

    public String getVoice() {
        return voice;
    }

    public void setVoice(String voice) {
        this.voice = voice;
    }

    public boolean hasVoice() {
        return voice != null && !voice.isBlank();
    }
}
