package com.phillippitts.liveagent.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Language model routing.
 */
@ConfigurationProperties(prefix = "llm")
@Validated
public class LanguageModelProperties {

    @NotBlank
    private String model = "default";

    /** Model used when the outgoing context carries an image. Blank keeps {@link #model}. */
    private String visionModel = "";

    /** Tool-call round trips allowed for a single user turn. */
    @Positive
    private int maxToolRounds = 5;

    /** Generate an opening turn from the system prompt once the participant has joined. */
    private boolean greetOnJoin = true;

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getVisionModel() {
        return visionModel;
    }

    public void setVisionModel(String visionModel) {
        this.visionModel = visionModel;
    }

    public int getMaxToolRounds() {
        return maxToolRounds;
    }

    public void setMaxToolRounds(int maxToolRounds) {
        this.maxToolRounds = maxToolRounds;
    }

    public boolean isGreetOnJoin() {
        return greetOnJoin;
    }

    public void setGreetOnJoin(boolean greetOnJoin) {
        this.greetOnJoin = greetOnJoin;
    }
}
