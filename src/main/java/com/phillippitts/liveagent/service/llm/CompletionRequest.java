package com.phillippitts.liveagent.service.llm;

import com.phillippitts.liveagent.service.context.ChatMessage;
import org.json.JSONObject;

import java.util.List;
import java.util.Objects;

/**
 * One streaming completion call.
 *
 * @param model       model id
 * @param messages    context snapshot, system prompt first
 * @param toolSchemas function schemas the model may call; empty for none
 */
public record CompletionRequest(String model, List<ChatMessage> messages, List<JSONObject> toolSchemas) {

    public CompletionRequest {
        Objects.requireNonNull(model, "model");
        messages = List.copyOf(messages);
        toolSchemas = toolSchemas == null ? List.of() : List.copyOf(toolSchemas);
    }
}
