package com.phillippitts.platemate.service.speech.vosk;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Extracts transcript text from Vosk recognizer JSON.
 *
 * <p>Handles the two shapes a streaming recognizer emits:
 * <ul>
 *   <li><b>Result:</b> {@code {"text": "..."}} from {@code getResult()}/{@code getFinalResult()}</li>
 *   <li><b>Partial:</b> {@code {"partial": "..."}} from {@code getPartialResult()}</li>
 * </ul>
 *
 * <p>Thread-safe: all methods are static and stateless. Output above {@link #MAX_JSON_SIZE}
 * is truncated before parsing.
 */
final class VoskJsonParser {

    private static final Logger LOG = LogManager.getLogger(VoskJsonParser.class);

    /** Maximum accepted JSON size from the recognizer (1MB). */
    static final int MAX_JSON_SIZE = 1_048_576;

    private VoskJsonParser() {
        // Utility class - prevent instantiation
    }

    /** Text of a result object, trimmed; empty when absent or unparseable. */
    static String resultText(String json) {
        return field(json, "text");
    }

    /** Text of a partial result object, trimmed; empty when absent or unparseable. */
    static String partialText(String json) {
        return field(json, "partial");
    }

    private static String field(String json, String name) {
        if (json == null || json.isBlank()) {
            return "";
        }
        if (json.length() > MAX_JSON_SIZE) {
            LOG.warn("Vosk JSON response exceeds {}B cap (actual: {}B); truncating", MAX_JSON_SIZE, json.length());
            json = json.substring(0, MAX_JSON_SIZE);
        }
        try {
            return new JSONObject(json).optString(name, "").trim();
        } catch (JSONException e) {
            LOG.warn("Failed to parse Vosk JSON response ({} chars): {}", json.length(), e.getMessage());
            return "";
        }
    }
}
