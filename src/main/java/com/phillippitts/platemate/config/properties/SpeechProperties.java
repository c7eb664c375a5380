package com.phillippitts.platemate.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for voice input.
 *
 * Required capture format (enforced by the audio tap): 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "speech")
public class SpeechProperties {

    /** Feature flag; when false, listening is refused and reported as unavailable. */
    private final boolean voiceInput;

    /** Path to the Vosk model directory. */
    @NotBlank
    private final String voskModelPath;

    /** Recognizer sample rate in Hz. */
    @Min(8000)
    @Max(48_000)
    private final int sampleRate;

    /** Frames per buffer delivered by the audio tap. */
    @Min(256)
    @Max(16_384)
    private final int bufferFrames;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    @ConstructorBinding
    public SpeechProperties(Boolean voiceInput,
                            String voskModelPath,
                            Integer sampleRate,
                            Integer bufferFrames,
                            String deviceName) {
        this.voiceInput = voiceInput == null || voiceInput;
        this.voskModelPath = voskModelPath == null ? "models/vosk-model-small-en-us-0.15" : voskModelPath;
        this.sampleRate = sampleRate == null ? 16_000 : sampleRate;
        this.bufferFrames = bufferFrames == null ? 1024 : bufferFrames;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public boolean isVoiceInput() { return voiceInput; }
    public String getVoskModelPath() { return voskModelPath; }
    public int getSampleRate() { return sampleRate; }
    public int getBufferFrames() { return bufferFrames; }
    public String getDeviceName() { return deviceName; }
}
