package com.phillippitts.liveagent.service.llm;

import com.phillippitts.liveagent.config.properties.LanguageModelProperties;
import com.phillippitts.liveagent.domain.ControlFrame;
import com.phillippitts.liveagent.domain.ControlType;
import com.phillippitts.liveagent.domain.Frame;
import com.phillippitts.liveagent.domain.TextFrame;
import com.phillippitts.liveagent.exception.UpstreamServiceException;
import com.phillippitts.liveagent.service.context.ChatMessage;
import com.phillippitts.liveagent.service.context.ConversationContextManager;
import com.phillippitts.liveagent.service.pipeline.AbstractStage;
import com.phillippitts.liveagent.service.pipeline.FrameSink;
import com.phillippitts.liveagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs a streamed completion for every ready user turn.
 *
 * <p>Tokens go downstream as assistant {@link TextFrame}s between RESPONSE_START and
 * RESPONSE_END. Tool calls are executed through the gateway and their results fed back for up to
 * {@code maxToolRounds} further completions. Requests whose latest user message carries an image
 * go to the vision model when one is configured.
 *
 * <p>An interruption abandons the open stream; the text produced so far is kept in the context
 * as the assistant's turn.
 */
public class LanguageModelStage extends AbstractStage {

    private static final Logger LOG = LogManager.getLogger(LanguageModelStage.class);
    private static final int LOG_PREVIEW_CHARS = 80;

    private final LanguageModelService model;
    private final ToolExecutionGateway tools;
    private final ConversationContextManager conversation;
    private final LanguageModelProperties properties;
    private final ToolResultListener toolResultListener;
    private final AtomicLong generation = new AtomicLong();
    private volatile CompletionStream openStream;

    /**
     * @param tools gateway for tool calls, or {@code null} when the session has no tools
     */
    public LanguageModelStage(LanguageModelService model, ToolExecutionGateway tools,
                              ConversationContextManager conversation, LanguageModelProperties properties,
                              ToolResultListener toolResultListener) {
        super("language-model");
        this.model = Objects.requireNonNull(model, "model");
        this.tools = tools;
        this.conversation = Objects.requireNonNull(conversation, "conversation");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.toolResultListener = toolResultListener == null ? ToolResultListener.NONE : toolResultListener;
    }

    @Override
    public void process(Frame frame, FrameSink sink) {
        if (frame instanceof ControlFrame control) {
            if (control.is(ControlType.TURN_READY)) {
                respond(sink);
                return;
            }
            if (control.is(ControlType.TRANSPORT_READY)) {
                sink.push(frame);
                if (properties.isGreetOnJoin()) {
                    respond(sink);
                }
                return;
            }
        }
        passThrough(frame, sink);
    }

    @Override
    public void onInterruption() {
        generation.incrementAndGet();
        CompletionStream stream = openStream;
        if (stream != null) {
            stream.close();
        }
    }

    private void respond(FrameSink sink) {
        long turn = generation.get();
        sink.push(ControlFrame.of(ControlType.RESPONSE_START));
        try {
            for (int round = 0; ; round++) {
                List<ToolCallRequest> calls = completeOnce(turn, sink);
                if (calls.isEmpty() || !isCurrent(turn)) {
                    return;
                }
                if (round >= properties.getMaxToolRounds()) {
                    LOG.warn("Tool round limit {} reached; ending response", properties.getMaxToolRounds());
                    return;
                }
                conversation.add(ChatMessage.assistantToolCalls(calls));
                for (ToolCallRequest call : calls) {
                    JSONObject result = execute(call);
                    conversation.add(ChatMessage.toolResult(call.id(), result));
                    toolResultListener.onToolResult(call, result);
                }
            }
        } finally {
            if (isCurrent(turn)) {
                sink.push(ControlFrame.of(ControlType.RESPONSE_END));
            }
        }
    }

    /**
     * Streams one completion. Records the assistant text, including a partial response cut short by
     * an interruption.
     *
     * @return tool calls requested by the model
     */
    private List<ToolCallRequest> completeOnce(long turn, FrameSink sink) {
        List<ChatMessage> messages = conversation.messages();
        CompletionRequest request = new CompletionRequest(selectModel(), messages,
                tools == null ? List.of() : tools.toolSchemas());
        StringBuilder text = new StringBuilder();
        List<ToolCallRequest> calls = new ArrayList<>();
        CompletionStream stream = model.complete(request);
        openStream = stream;
        try {
            if (!isCurrent(turn)) {
                return List.of();
            }
            Optional<CompletionEvent> event;
            while (isCurrent(turn) && (event = stream.next()).isPresent()) {
                CompletionEvent e = event.get();
                if (e.isToolCall()) {
                    calls.add(e.toolCall());
                } else if (e.token() != null && !e.token().isEmpty() && isCurrent(turn)) {
                    text.append(e.token());
                    sink.push(TextFrame.assistant(e.token()));
                }
            }
        } catch (UpstreamServiceException e) {
            if (isCurrent(turn)) {
                throw e;
            }
            LOG.debug("Completion stream closed by interruption: {}", e.getMessage());
        } finally {
            openStream = null;
            stream.close();
            if (text.length() > 0) {
                conversation.addTurn(ChatMessage.Role.ASSISTANT, text.toString());
            }
        }
        if (!isCurrent(turn)) {
            LOG.debug("Response interrupted after \"{}\"", LogSanitizer.preview(text.toString(), LOG_PREVIEW_CHARS));
            return List.of();
        }
        return calls;
    }

    private JSONObject execute(ToolCallRequest call) {
        if (tools == null) {
            return new JSONObject().put("error", "No tools are available in this session");
        }
        try {
            JSONObject result = tools.execute(call.name(), call.arguments());
            LOG.info("Tool {} completed", call.name());
            return result == null ? new JSONObject() : result;
        } catch (UpstreamServiceException e) {
            LOG.warn("Tool {} failed: {}", call.name(), e.getMessage());
            return new JSONObject().put("error", e.getMessage());
        }
    }

    String selectModel() {
        String vision = properties.getVisionModel();
        if (vision != null && !vision.isBlank()
                && conversation.lastUserMessage().map(ChatMessage::hasImage).orElse(false)) {
            return vision;
        }
        return properties.getModel();
    }

    private boolean isCurrent(long turn) {
        return generation.get() == turn;
    }
}
