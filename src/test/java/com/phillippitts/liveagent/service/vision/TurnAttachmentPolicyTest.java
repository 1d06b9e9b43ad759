package com.phillippitts.liveagent.service.vision;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TurnAttachmentPolicyTest {

    private static final List<String> KEYWORDS = List.of("see", "look at", "Camera");

    @Test
    void alwaysAndNeverIgnoreText() {
        assertThat(TurnAttachmentPolicy.forMode(AttachMode.ALWAYS, KEYWORDS).shouldAttach("hi")).isTrue();
        assertThat(TurnAttachmentPolicy.forMode(AttachMode.NEVER, KEYWORDS).shouldAttach("can you see me")).isFalse();
    }

    @Test
    void autoMatchesKeywordsCaseInsensitively() {
        TurnAttachmentPolicy auto = TurnAttachmentPolicy.forMode(AttachMode.AUTO, KEYWORDS);

        assertThat(auto.shouldAttach("Can you SEE this?")).isTrue();
        assertThat(auto.shouldAttach("please look at my screen")).isTrue();
        assertThat(auto.shouldAttach("is my camera on")).isTrue();
        assertThat(auto.shouldAttach("what's the weather")).isFalse();
        assertThat(auto.shouldAttach("   ")).isFalse();
    }

    @Test
    void blankKeywordsAreDropped() {
        KeywordAttachmentPolicy policy = new KeywordAttachmentPolicy(List.of(" ", "Show "));

        assertThat(policy.keywords()).containsExactly("show");
    }
}
