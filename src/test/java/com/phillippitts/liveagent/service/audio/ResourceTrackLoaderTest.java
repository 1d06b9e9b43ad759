package com.phillippitts.liveagent.service.audio;

import com.phillippitts.liveagent.config.properties.BackgroundAudioProperties;
import com.phillippitts.liveagent.exception.MediaFormatException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceTrackLoaderTest {

    @TempDir
    Path dir;

    private ResourceTrackLoader loader(int maxBytes) {
        BackgroundAudioProperties props = new BackgroundAudioProperties();
        props.setMaxDownloadBytes(maxBytes);
        return new ResourceTrackLoader(new DefaultResourceLoader(), props);
    }

    @Test
    void loadsFileSource() throws IOException {
        Path file = Files.write(dir.resolve("ambience.wav"), new byte[]{1, 2, 3, 4});

        byte[] data = loader(1024).load(file.toUri().toString());

        assertThat(data).containsExactly(1, 2, 3, 4);
    }

    @Test
    void rejectsPlainHttp() {
        assertThatThrownBy(() -> loader(1024).load("http://cdn.example.com/office.wav"))
                .isInstanceOf(MediaFormatException.class)
                .hasMessageContaining("https");
    }

    @Test
    void rejectsOversizedSource() throws IOException {
        Path file = Files.write(dir.resolve("big.wav"), new byte[2048]);

        assertThatThrownBy(() -> loader(1024).load(file.toUri().toString()))
                .isInstanceOf(MediaFormatException.class)
                .hasMessageContaining("exceeds");
    }

    @Test
    void rejectsEmptySource() throws IOException {
        Path file = Files.write(dir.resolve("empty.wav"), new byte[0]);

        assertThatThrownBy(() -> loader(1024).load(file.toUri().toString()))
                .isInstanceOf(MediaFormatException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void missingFileSurfacesAsMediaFormatError() {
        String missing = dir.resolve("missing.wav").toUri().toString();

        assertThatThrownBy(() -> loader(1024).load(missing)).isInstanceOf(MediaFormatException.class);
    }
}
