package com.phillippitts.platemate.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the Gemini generative chat API.
 * Binds to properties prefixed with "gemini".
 *
 * <p>Example application.properties:
 * <pre>
 * gemini.api-key=${GEMINI_API_KEY:}
 * gemini.model=gemini-2.0-flash
 * gemini.temperature=0.7
 * </pre>
 *
 * @param apiKey          API key, supplied through the environment; blank disables real calls
 * @param baseUrl         REST base URL up to and including the API version
 * @param model           model identifier
 * @param temperature     sampling temperature
 * @param topP            nucleus sampling probability mass
 * @param topK            top-k sampling cutoff
 * @param maxOutputTokens maximum tokens per reply
 * @param connectTimeout  HTTP connect timeout
 * @param readTimeout     HTTP read timeout
 */
@Validated
@ConfigurationProperties(prefix = "gemini")
public record GeminiProperties(
        String apiKey,

        @NotBlank(message = "Gemini base URL must not be blank")
        @DefaultValue("https://generativelanguage.googleapis.com/v1beta")
        String baseUrl,

        @NotBlank(message = "Gemini model must not be blank")
        @DefaultValue("gemini-2.0-flash-thinking-exp-01-21")
        String model,

        @DecimalMin("0.0") @DecimalMax("2.0")
        @DefaultValue("0.7")
        double temperature,

        @DecimalMin("0.0") @DecimalMax("1.0")
        @DefaultValue("0.95")
        double topP,

        @Positive
        @DefaultValue("64")
        int topK,

        @Positive
        @DefaultValue("2048")
        int maxOutputTokens,

        @NotNull
        @DefaultValue("5s")
        Duration connectTimeout,

        @NotNull
        @DefaultValue("60s")
        Duration readTimeout
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
