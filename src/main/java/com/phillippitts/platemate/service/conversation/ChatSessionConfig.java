package com.phillippitts.platemate.service.conversation;

import com.phillippitts.platemate.config.properties.GeminiProperties;

import java.util.Objects;

/**
 * Generation parameters for one chat session.
 *
 * @param model            model identifier
 * @param temperature      sampling temperature
 * @param topP             nucleus sampling probability mass
 * @param topK             top-k cutoff
 * @param maxOutputTokens  reply length limit
 * @param responseMimeType reply content type
 */
public record ChatSessionConfig(String model,
                                double temperature,
                                double topP,
                                int topK,
                                int maxOutputTokens,
                                String responseMimeType) {

    public ChatSessionConfig {
        Objects.requireNonNull(model, "model");
        responseMimeType = responseMimeType == null ? "text/plain" : responseMimeType;
    }

    public static ChatSessionConfig from(GeminiProperties props) {
        return new ChatSessionConfig(props.model(), props.temperature(), props.topP(), props.topK(),
                props.maxOutputTokens(), "text/plain");
    }
}
