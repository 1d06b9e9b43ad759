package com.phillippitts.liveagent.service.llm;

import org.json.JSONObject;

import java.util.List;

/**
 * Executes model-requested tool calls against external systems.
 */
public interface ToolExecutionGateway {

    /** Function schemas advertised to the model. */
    List<JSONObject> toolSchemas();

    /**
     * Runs one tool call.
     *
     * @return structured result handed back to the model
     * @throws com.phillippitts.liveagent.exception.UpstreamServiceException if the call failed
     */
    JSONObject execute(String toolName, JSONObject arguments);
}
