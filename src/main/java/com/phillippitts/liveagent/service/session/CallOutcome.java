package com.phillippitts.liveagent.service.session;

import com.phillippitts.liveagent.service.llm.ToolCallRequest;
import com.phillippitts.liveagent.service.llm.ToolResultListener;
import org.json.JSONObject;

/**
 * Outcome facts collected from tool results during a call.
 *
 * <p>A tool result with {@code "transferred": true} marks the call as transferred; a
 * {@code "call_result"} string records the business outcome. The last value seen wins.
 */
public class CallOutcome implements ToolResultListener {

    static final String TRANSFERRED_KEY = "transferred";
    static final String RESULT_KEY = "call_result";

    private volatile boolean transferred;
    private volatile String result;

    @Override
    public void onToolResult(ToolCallRequest call, JSONObject toolResult) {
        if (toolResult.optBoolean(TRANSFERRED_KEY, false)) {
            transferred = true;
        }
        String value = toolResult.optString(RESULT_KEY, null);
        if (value != null && !value.isBlank()) {
            result = value;
        }
    }

    public boolean transferred() {
        return transferred;
    }

    /** Business outcome, or {@code null} if no tool reported one. */
    public String result() {
        return result;
    }
}
