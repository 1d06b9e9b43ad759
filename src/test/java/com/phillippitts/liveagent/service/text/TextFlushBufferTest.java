package com.phillippitts.liveagent.service.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextFlushBufferTest {

    @Test
    void releasesUpToSentenceBoundaryAndKeepsTheRest() {
        TextFlushBuffer buffer = new TextFlushBuffer();

        assertThat(buffer.append("Hello")).isEmpty();
        assertThat(buffer.append(" world.")).contains("Hello world.");
        assertThat(buffer.append(" How are you")).isEmpty();
        assertThat(buffer.flush()).contains(" How are you");
        assertThat(buffer.isEmpty()).isTrue();
    }

    @Test
    void cutsAtTheLastBoundaryInsideAToken() {
        TextFlushBuffer buffer = new TextFlushBuffer();

        assertThat(buffer.append("Sure! I can help. With")).contains("Sure! I can help.");
        assertThat(buffer.flush()).contains(" With");
    }

    @Test
    void newlineCountsAsBoundary() {
        TextFlushBuffer buffer = new TextFlushBuffer();

        assertThat(buffer.append("first item\nsecond")).contains("first item\n");
    }

    @Test
    void forceFlushesPastMaxChars() {
        TextFlushBuffer buffer = new TextFlushBuffer(10);

        assertThat(buffer.append("abcdefghij")).isEmpty();
        assertThat(buffer.append("k")).contains("abcdefghijk");
        assertThat(buffer.isEmpty()).isTrue();
    }

    @Test
    void clearDropsBufferedText() {
        TextFlushBuffer buffer = new TextFlushBuffer();
        buffer.append("half a sen");

        buffer.clear();

        assertThat(buffer.flush()).isEmpty();
    }

    @Test
    void ignoresEmptyTokens() {
        TextFlushBuffer buffer = new TextFlushBuffer();

        assertThat(buffer.append("")).isEmpty();
        assertThat(buffer.append(null)).isEmpty();
        assertThat(buffer.isEmpty()).isTrue();
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> new TextFlushBuffer(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
