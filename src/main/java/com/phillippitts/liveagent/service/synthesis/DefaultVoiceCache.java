package com.phillippitts.liveagent.service.synthesis;

import com.phillippitts.liveagent.util.KeyedOnceCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Default voice per synthesis service, resolved once per service name and kept for the lifetime
 * of the process.
 */
@Component
public class DefaultVoiceCache {

    private static final Logger LOG = LogManager.getLogger(DefaultVoiceCache.class);

    private final KeyedOnceCache<String, String> voices = new KeyedOnceCache<>();

    public String resolve(SpeechSynthesisService service) {
        return voices.get(service.connectionName(), name -> {
            String voice = service.defaultVoice();
            LOG.info("Resolved default voice for {}: {}", name, voice);
            return voice;
        });
    }

    public int loadCount() {
        return voices.loadCount();
    }
}
