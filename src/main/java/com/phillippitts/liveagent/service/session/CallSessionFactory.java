package com.phillippitts.liveagent.service.session;

import com.phillippitts.liveagent.config.properties.AvatarProperties;
import com.phillippitts.liveagent.config.properties.BackgroundAudioProperties;
import com.phillippitts.liveagent.config.properties.ConnectionProperties;
import com.phillippitts.liveagent.config.properties.ContextProperties;
import com.phillippitts.liveagent.config.properties.LanguageModelProperties;
import com.phillippitts.liveagent.config.properties.PipelineProperties;
import com.phillippitts.liveagent.config.properties.SynthesisProperties;
import com.phillippitts.liveagent.config.properties.VisionProperties;
import com.phillippitts.liveagent.exception.ConfigurationException;
import com.phillippitts.liveagent.exception.MediaFormatException;
import com.phillippitts.liveagent.service.audio.BackgroundMixerStage;
import com.phillippitts.liveagent.service.audio.BackgroundTrack;
import com.phillippitts.liveagent.service.audio.BackgroundTrackCache;
import com.phillippitts.liveagent.service.avatar.AvatarFallbackController;
import com.phillippitts.liveagent.service.connection.BackoffPolicy;
import com.phillippitts.liveagent.service.connection.ResilientConnection;
import com.phillippitts.liveagent.service.context.ConversationContextManager;
import com.phillippitts.liveagent.service.context.UserTurnStage;
import com.phillippitts.liveagent.service.llm.LanguageModelStage;
import com.phillippitts.liveagent.service.pipeline.Stage;
import com.phillippitts.liveagent.service.recognition.RecognitionStage;
import com.phillippitts.liveagent.service.synthesis.DefaultVoiceCache;
import com.phillippitts.liveagent.service.synthesis.SynthesisStage;
import com.phillippitts.liveagent.service.text.TextFlushBuffer;
import com.phillippitts.liveagent.service.transport.TransportInputStage;
import com.phillippitts.liveagent.service.transport.TransportOutputStage;
import com.phillippitts.liveagent.service.vision.SnapshotAttacher;
import com.phillippitts.liveagent.service.vision.SnapshotEncoder;
import com.phillippitts.liveagent.service.vision.TurnAttachmentPolicy;
import com.phillippitts.liveagent.service.vision.VisionCaptureStage;
import com.phillippitts.liveagent.service.vision.VisionSnapshotStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Assembles the stage list of a call.
 *
 * <p>Order: transport input, vision capture, recognition, user turn, language model, synthesis,
 * background mixer, avatar, transport output. Vision, mixer and avatar are present only when
 * enabled. Required collaborators are checked before anything is opened.
 */
@Component
public class CallSessionFactory {

    private static final Logger LOG = LogManager.getLogger(CallSessionFactory.class);

    private final PipelineProperties pipelineProperties;
    private final ConnectionProperties connectionProperties;
    private final SynthesisProperties synthesisProperties;
    private final BackgroundAudioProperties backgroundProperties;
    private final VisionProperties visionProperties;
    private final AvatarProperties avatarProperties;
    private final ContextProperties contextProperties;
    private final LanguageModelProperties languageModelProperties;
    private final BackgroundTrackCache trackCache;
    private final DefaultVoiceCache voiceCache;
    private final SnapshotEncoder snapshotEncoder;
    private final ApplicationEventPublisher publisher;

    public CallSessionFactory(PipelineProperties pipelineProperties,
                              ConnectionProperties connectionProperties,
                              SynthesisProperties synthesisProperties,
                              BackgroundAudioProperties backgroundProperties,
                              VisionProperties visionProperties,
                              AvatarProperties avatarProperties,
                              ContextProperties contextProperties,
                              LanguageModelProperties languageModelProperties,
                              BackgroundTrackCache trackCache,
                              DefaultVoiceCache voiceCache,
                              SnapshotEncoder snapshotEncoder,
                              ApplicationEventPublisher publisher) {
        this.pipelineProperties = pipelineProperties;
        this.connectionProperties = connectionProperties;
        this.synthesisProperties = synthesisProperties;
        this.backgroundProperties = backgroundProperties;
        this.visionProperties = visionProperties;
        this.avatarProperties = avatarProperties;
        this.contextProperties = contextProperties;
        this.languageModelProperties = languageModelProperties;
        this.trackCache = trackCache;
        this.voiceCache = voiceCache;
        this.snapshotEncoder = snapshotEncoder;
        this.publisher = publisher;
    }

    /**
     * @throws ConfigurationException if a required collaborator or the system prompt is missing
     */
    public SessionPipeline build(String sessionId, CallSessionRequest request, SessionCollaborators services,
                                 CallOutcome outcome) {
        validate(request, services);

        VisionSnapshotStore snapshots = visionProperties.isEnabled() ? new VisionSnapshotStore() : null;
        ConversationContextManager conversation = conversation(request, snapshots);
        if (!request.priorMessages().isEmpty()) {
            conversation.seed(request.priorMessages());
        }

        AvatarFallbackController avatar = services.avatar() == null ? null
                : new AvatarFallbackController(services.avatar(), avatarProperties,
                        pipelineProperties.getOutputSampleRate(), publisher);
        BooleanSupplier muted = avatar == null ? () -> false : avatar::rendersSpeech;

        List<Stage> stages = new ArrayList<>();
        stages.add(new TransportInputStage(services.transport()));
        if (snapshots != null) {
            stages.add(new VisionCaptureStage(snapshots, visionProperties.getFps()));
        }
        stages.add(new RecognitionStage(services.recognition()));
        stages.add(new UserTurnStage(conversation, publisher));
        stages.add(new LanguageModelStage(services.languageModel(), services.tools(), conversation,
                languageModelProperties, outcome));
        stages.add(new SynthesisStage(services.synthesis(),
                new ResilientConnection(services.synthesis(), BackoffPolicy.from(connectionProperties), publisher),
                voiceResolver(services), muted, new TextFlushBuffer()));
        BackgroundMixerStage mixer = mixer(sessionId);
        if (mixer != null) {
            stages.add(mixer);
        }
        if (avatar != null) {
            stages.add(avatar);
        }
        stages.add(new TransportOutputStage(services.transport()));

        Duration idleTimeout = avatar != null ? pipelineProperties.getAvatarIdleTimeout()
                : pipelineProperties.getIdleTimeout();
        return new SessionPipeline(List.copyOf(stages), conversation, avatar, idleTimeout);
    }

    private void validate(CallSessionRequest request, SessionCollaborators services) {
        if (services == null) {
            throw new ConfigurationException("collaborators", "Session collaborators are required");
        }
        require(services.transport(), "transport");
        require(services.recognition(), "recognition");
        require(services.languageModel(), "languageModel");
        require(services.synthesis(), "synthesis");
        String prompt = systemPrompt(request);
        if (prompt == null || prompt.isBlank()) {
            throw new ConfigurationException("pipeline.system-prompt", "A system prompt is required");
        }
    }

    private static void require(Object collaborator, String name) {
        if (collaborator == null) {
            throw new ConfigurationException(name, "Missing required collaborator: " + name);
        }
    }

    private String systemPrompt(CallSessionRequest request) {
        return request.systemPrompt() != null ? request.systemPrompt() : pipelineProperties.getSystemPrompt();
    }

    private ConversationContextManager conversation(CallSessionRequest request, VisionSnapshotStore snapshots) {
        String prompt = systemPrompt(request);
        if (snapshots == null) {
            return ConversationContextManager.withoutVision(prompt, contextProperties);
        }
        TurnAttachmentPolicy policy = TurnAttachmentPolicy.forMode(visionProperties.getAttachMode(),
                visionProperties.getKeywords());
        SnapshotAttacher attacher = new SnapshotAttacher(snapshots, visionProperties.effectiveMaxAge(),
                snapshotEncoder, System::nanoTime);
        return new ConversationContextManager(prompt, policy, attacher, contextProperties);
    }

    private Supplier<String> voiceResolver(SessionCollaborators services) {
        if (synthesisProperties.hasVoice()) {
            String voice = synthesisProperties.getVoice();
            return () -> voice;
        }
        return () -> voiceCache.resolve(services.synthesis());
    }

    /**
     * Background mixer for the session, or {@code null} when mixing is off or the track is unusable.
     */
    private BackgroundMixerStage mixer(String sessionId) {
        if (!backgroundProperties.isEnabled()) {
            return null;
        }
        try {
            BackgroundTrack track = trackCache.open(backgroundProperties.getSource(),
                    pipelineProperties.getOutputSampleRate());
            return new BackgroundMixerStage(track, backgroundProperties.getGain(), publisher);
        } catch (MediaFormatException e) {
            LOG.warn("Background audio unavailable for session {}; continuing without it: {}",
                    sessionId, e.getMessage());
            return null;
        }
    }
}
