package com.phillippitts.liveagent.service.llm;

import org.json.JSONObject;

/**
 * Observes completed tool calls, for example to note that the call was transferred.
 */
@FunctionalInterface
public interface ToolResultListener {

    ToolResultListener NONE = (call, result) -> { };

    void onToolResult(ToolCallRequest call, JSONObject result);
}
