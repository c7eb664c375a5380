package com.phillippitts.platemate.service.conversation.gemini;

import com.phillippitts.platemate.service.conversation.ChatSessionConfig;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.List;

/**
 * JSON encoding of {@code generateContent} requests and decoding of its responses.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
final class GeminiJsonCodec {

    static final String ROLE_USER = "user";
    static final String ROLE_MODEL = "model";

    private GeminiJsonCodec() {
        // Utility class - prevent instantiation
    }

    /**
     * Decoded reply.
     *
     * @param text        concatenated text parts of the first candidate; empty if none
     * @param blockReason prompt block reason or non-STOP finish reason such as SAFETY; {@code null} if none
     */
    record Reply(String text, String blockReason) {

        boolean isBlocked() {
            return blockReason != null;
        }
    }

    static JSONObject content(String role, String text) {
        return new JSONObject()
                .put("role", role)
                .put("parts", new JSONArray().put(new JSONObject().put("text", text)));
    }

    static String encodeRequest(List<JSONObject> contents, ChatSessionConfig config) {
        JSONObject generationConfig = new JSONObject()
                .put("temperature", config.temperature())
                .put("topP", config.topP())
                .put("topK", config.topK())
                .put("maxOutputTokens", config.maxOutputTokens())
                .put("responseMimeType", config.responseMimeType());
        return new JSONObject()
                .put("contents", new JSONArray(contents))
                .put("generationConfig", generationConfig)
                .toString();
    }

    /**
     * @throws JSONException if the body is not a JSON object
     */
    static Reply decodeResponse(String body) {
        if (body == null || body.isBlank()) {
            return new Reply("", null);
        }
        JSONObject json = new JSONObject(body);

        JSONObject feedback = json.optJSONObject("promptFeedback");
        if (feedback != null && feedback.has("blockReason")) {
            return new Reply("", feedback.optString("blockReason"));
        }

        JSONArray candidates = json.optJSONArray("candidates");
        if (candidates == null || candidates.isEmpty()) {
            return new Reply("", null);
        }
        JSONObject first = candidates.getJSONObject(0);
        String finishReason = first.optString("finishReason", "");
        if ("SAFETY".equals(finishReason) || "BLOCKLIST".equals(finishReason)
                || "PROHIBITED_CONTENT".equals(finishReason)) {
            return new Reply("", finishReason);
        }

        StringBuilder text = new StringBuilder();
        JSONObject content = first.optJSONObject("content");
        JSONArray parts = content == null ? null : content.optJSONArray("parts");
        if (parts != null) {
            for (int i = 0; i < parts.length(); i++) {
                JSONObject part = parts.optJSONObject(i);
                // Thinking models emit their reasoning as parts flagged "thought"
                if (part == null || part.optBoolean("thought", false)) {
                    continue;
                }
                text.append(part.optString("text", ""));
            }
        }
        return new Reply(text.toString(), null);
    }
}
