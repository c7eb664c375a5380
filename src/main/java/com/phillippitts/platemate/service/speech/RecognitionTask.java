package com.phillippitts.platemate.service.speech;

/**
 * One streaming recognition request. Audio is appended incrementally; results arrive through the
 * listener passed to {@link SpeechRecognitionProvider#start}.
 */
public interface RecognitionTask {

    /** Feeds PCM16LE mono audio. Ignored once the task has ended or been cancelled. */
    void append(byte[] buffer, int length);

    /** Graceful finish: no more audio will follow, and a FINAL event is still delivered. */
    void endAudio();

    /** Hard stop: releases the recognizer and emits no further events. */
    void cancel();
}
