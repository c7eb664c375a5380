package com.phillippitts.platemate.util;

import java.time.Duration;

/**
 * Standard timeout values for worker thread management.
 *
 * <p><b>Usage:</b> Used by {@link com.phillippitts.platemate.service.speech.audio.JavaSoundAudioTap}
 * to bound how long stopping the microphone may block the caller.
 *
 * @since 1.0
 */
public final class ThreadTimeouts {

    /**
     * Timeout for the audio tap thread to terminate during a normal stop.
     *
     * <p>The thread may be blocked in {@code TargetDataLine.read}; one second lets the
     * current chunk drain.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the audio tap thread during application shutdown (best-effort).
     */
    public static final Duration CAPTURE_THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    private ThreadTimeouts() {
        // Utility class - prevent instantiation
    }
}
