package com.phillippitts.liveagent.service.context;

import com.phillippitts.liveagent.service.llm.ToolCallRequest;
import com.phillippitts.liveagent.util.LogSanitizer;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One entry of the conversation context.
 *
 * <p>Content is plain text, optionally paired with an inline image URL (multi-part content).
 * Assistant messages may carry tool calls instead of text; tool messages carry the id of the
 * call they answer.
 *
 * @param role       message author
 * @param text       text content; may be empty for assistant tool-call messages
 * @param imageUrl   {@code data:} URL of an attached image, or {@code null}
 * @param toolCallId id of the answered call for {@link Role#TOOL}, otherwise {@code null}
 * @param toolCalls  calls requested by an assistant message; never {@code null}
 */
public record ChatMessage(Role role, String text, String imageUrl, String toolCallId,
                          List<ToolCallRequest> toolCalls) {

    public enum Role {
        SYSTEM, USER, ASSISTANT, TOOL;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public ChatMessage {
        Objects.requireNonNull(role, "role");
        text = text == null ? "" : text;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ChatMessage system(String text) {
        return new ChatMessage(Role.SYSTEM, text, null, null, null);
    }

    public static ChatMessage user(String text) {
        return new ChatMessage(Role.USER, text, null, null, null);
    }

    public static ChatMessage userWithImage(String text, String imageUrl) {
        return new ChatMessage(Role.USER, text, Objects.requireNonNull(imageUrl, "imageUrl"), null, null);
    }

    public static ChatMessage assistant(String text) {
        return new ChatMessage(Role.ASSISTANT, text, null, null, null);
    }

    public static ChatMessage assistantToolCalls(List<ToolCallRequest> calls) {
        return new ChatMessage(Role.ASSISTANT, "", null, null, calls);
    }

    public static ChatMessage toolResult(String toolCallId, JSONObject result) {
        return new ChatMessage(Role.TOOL, result.toString(), null, Objects.requireNonNull(toolCallId, "toolCallId"),
                null);
    }

    public boolean hasImage() {
        return imageUrl != null;
    }

    public boolean isConversational() {
        return role == Role.USER || role == Role.ASSISTANT;
    }

    public ChatMessage truncated(int maxChars) {
        if (text.length() <= maxChars) {
            return this;
        }
        return new ChatMessage(role, text.substring(0, maxChars), imageUrl, toolCallId, toolCalls);
    }

    /**
     * Text for transcripts: images become {@code [image]} and the result is cut to {@code maxChars}.
     */
    public String textForLog(int maxChars) {
        String rendered = hasImage() ? (text.isEmpty() ? "[image]" : text + " [image]") : text;
        return LogSanitizer.truncate(rendered, maxChars);
    }

    /**
     * Chat-completions wire shape: {@code {"role": ..., "content": ...}} with a content-part array
     * when an image is attached.
     */
    public JSONObject toJson() {
        JSONObject json = new JSONObject().put("role", role.wireName());
        if (hasImage()) {
            JSONArray parts = new JSONArray()
                    .put(new JSONObject().put("type", "text").put("text", text))
                    .put(new JSONObject().put("type", "image_url")
                            .put("image_url", new JSONObject().put("url", imageUrl)));
            json.put("content", parts);
        } else {
            json.put("content", text);
        }
        if (!toolCalls.isEmpty()) {
            JSONArray calls = new JSONArray();
            for (ToolCallRequest call : toolCalls) {
                calls.put(new JSONObject()
                        .put("id", call.id())
                        .put("type", "function")
                        .put("function", new JSONObject()
                                .put("name", call.name())
                                .put("arguments", call.arguments().toString())));
            }
            json.put("tool_calls", calls);
        }
        if (toolCallId != null) {
            json.put("tool_call_id", toolCallId);
        }
        return json;
    }
}
