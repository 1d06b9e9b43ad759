package com.phillippitts.liveagent.service.session;

import com.phillippitts.liveagent.service.llm.ToolCallRequest;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CallOutcomeTest {

    private final ToolCallRequest call = new ToolCallRequest("c1", "end_call", new JSONObject());

    @Test
    void startsUntransferredWithoutResult() {
        CallOutcome outcome = new CallOutcome();

        assertThat(outcome.transferred()).isFalse();
        assertThat(outcome.result()).isNull();
    }

    @Test
    void recordsTransferAndLatestResult() {
        CallOutcome outcome = new CallOutcome();

        outcome.onToolResult(call, new JSONObject().put("call_result", "callback_requested"));
        outcome.onToolResult(call, new JSONObject().put("transferred", true).put("call_result", "sale"));
        outcome.onToolResult(call, new JSONObject().put("status", "ok"));

        assertThat(outcome.transferred()).isTrue();
        assertThat(outcome.result()).isEqualTo("sale");
    }

    @Test
    void transferFlagIsNotCleared() {
        CallOutcome outcome = new CallOutcome();

        outcome.onToolResult(call, new JSONObject().put("transferred", true));
        outcome.onToolResult(call, new JSONObject().put("transferred", false));

        assertThat(outcome.transferred()).isTrue();
    }
}
