package com.phillippitts.platemate.service.speech;

import java.util.function.Consumer;

/**
 * Streaming speech recognizer with partial results.
 */
public interface SpeechRecognitionProvider {

    /**
     * Starts a recognition task.
     *
     * @param listener receives PARTIAL, FINAL and ERROR events, possibly on another thread
     * @return the running task
     * @throws com.phillippitts.platemate.exception.AudioCaptureException if the recognizer cannot start
     */
    RecognitionTask start(Consumer<RecognitionEvent> listener);
}
