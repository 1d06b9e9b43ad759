package com.phillippitts.liveagent.service.audio;

import com.phillippitts.liveagent.config.properties.BackgroundAudioProperties;
import com.phillippitts.liveagent.exception.MediaFormatException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;

/**
 * Loads background tracks through Spring's {@link ResourceLoader}.
 *
 * <p>Accepted locations: {@code https://}, {@code classpath:} and {@code file:}. Plain
 * {@code http://} is rejected. Reads stop one byte past the configured cap so oversized
 * sources fail without being buffered whole.
 */
@Component
public class ResourceTrackLoader implements TrackLoader {

    private static final Logger LOG = LogManager.getLogger(ResourceTrackLoader.class);
    private static final List<String> ALLOWED_PREFIXES = List.of("https://", "classpath:", "file:");

    private final ResourceLoader resourceLoader;
    private final int maxBytes;

    public ResourceTrackLoader(ResourceLoader resourceLoader, BackgroundAudioProperties properties) {
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
        this.maxBytes = properties.getMaxDownloadBytes();
    }

    @Override
    public byte[] load(String source) {
        if (source == null || ALLOWED_PREFIXES.stream().noneMatch(source::startsWith)) {
            throw new MediaFormatException("Background audio source must be https, classpath or file: " + source);
        }
        Resource resource = resourceLoader.getResource(source);
        try (InputStream in = resource.getInputStream()) {
            byte[] data = in.readNBytes(maxBytes + 1);
            if (data.length > maxBytes) {
                throw new MediaFormatException("Background audio exceeds " + maxBytes + " bytes: " + source);
            }
            if (data.length == 0) {
                throw new MediaFormatException("Background audio is empty: " + source);
            }
            LOG.debug("Fetched {} bytes of background audio from {}", data.length, source);
            return data;
        } catch (IOException e) {
            throw new MediaFormatException("Cannot read background audio from " + source, e);
        }
    }
}
