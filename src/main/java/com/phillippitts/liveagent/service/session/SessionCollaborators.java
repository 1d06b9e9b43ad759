package com.phillippitts.liveagent.service.session;

import com.phillippitts.liveagent.service.avatar.AvatarRenderingService;
import com.phillippitts.liveagent.service.llm.LanguageModelService;
import com.phillippitts.liveagent.service.llm.ToolExecutionGateway;
import com.phillippitts.liveagent.service.recognition.SpeechRecognitionService;
import com.phillippitts.liveagent.service.synthesis.SpeechSynthesisService;
import com.phillippitts.liveagent.service.transport.RealTimeTransport;

/**
 * External services wired into one session.
 *
 * @param avatar optional; {@code null} for a voice-only call
 * @param tools  optional; {@code null} when the model gets no tools
 */
public record SessionCollaborators(
        RealTimeTransport transport,
        SpeechRecognitionService recognition,
        LanguageModelService languageModel,
        SpeechSynthesisService synthesis,
        AvatarRenderingService avatar,
        ToolExecutionGateway tools
) {
}
