package com.phillippitts.liveagent.service.llm;

/**
 * Streamed completion output: a text token or a tool call, never both.
 */
public record CompletionEvent(String token, ToolCallRequest toolCall) {

    public static CompletionEvent token(String token) {
        return new CompletionEvent(token, null);
    }

    public static CompletionEvent toolCall(ToolCallRequest toolCall) {
        return new CompletionEvent(null, toolCall);
    }

    public boolean isToolCall() {
        return toolCall != null;
    }
}
