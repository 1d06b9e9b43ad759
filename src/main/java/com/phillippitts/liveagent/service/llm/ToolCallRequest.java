package com.phillippitts.liveagent.service.llm;

import org.json.JSONObject;

import java.util.Objects;

/**
 * A function call requested by the language model.
 *
 * @param id        model-assigned call id, echoed back with the result
 * @param name      tool name
 * @param arguments parsed call arguments
 */
public record ToolCallRequest(String id, String name, JSONObject arguments) {

    public ToolCallRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        arguments = arguments == null ? new JSONObject() : arguments;
    }
}
