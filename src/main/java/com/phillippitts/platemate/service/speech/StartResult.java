package com.phillippitts.platemate.service.speech;

/**
 * Outcome of {@link SpeechCaptureService#startListening()}.
 */
public enum StartResult {
    STARTED,
    ALREADY_ACTIVE,
    /** Voice input is switched off by configuration. */
    UNAVAILABLE,
    PERMISSION_DENIED,
    /** Microphone or recognizer failed to open. */
    FAILED
}
