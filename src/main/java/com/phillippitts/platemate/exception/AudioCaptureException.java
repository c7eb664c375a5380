package com.phillippitts.platemate.exception;

/**
 * Thrown when the microphone cannot be opened or the recognizer fails to start.
 * Capture is aborted and the speech service returns to idle.
 */
public class AudioCaptureException extends PlateMateException {

    private final String reason;

    public AudioCaptureException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AudioCaptureException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /** Short machine-readable reason, e.g. {@code MIC_UNAVAILABLE}. */
    public String getReason() {
        return reason;
    }
}
