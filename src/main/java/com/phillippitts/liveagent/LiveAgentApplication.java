package com.phillippitts.liveagent;

import com.phillippitts.liveagent.config.properties.AvatarProperties;
import com.phillippitts.liveagent.config.properties.BackgroundAudioProperties;
import com.phillippitts.liveagent.config.properties.ConnectionProperties;
import com.phillippitts.liveagent.config.properties.ContextProperties;
import com.phillippitts.liveagent.config.properties.LanguageModelProperties;
import com.phillippitts.liveagent.config.properties.PipelineProperties;
import com.phillippitts.liveagent.config.properties.SynthesisProperties;
import com.phillippitts.liveagent.config.properties.VisionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        PipelineProperties.class,
        ConnectionProperties.class,
        SynthesisProperties.class,
        BackgroundAudioProperties.class,
        VisionProperties.class,
        AvatarProperties.class,
        ContextProperties.class,
        LanguageModelProperties.class
})
@EnableScheduling
public class LiveAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveAgentApplication.class, args);
    }

}
