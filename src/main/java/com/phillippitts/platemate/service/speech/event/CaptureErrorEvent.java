package com.phillippitts.platemate.service.speech.event;

import java.time.Instant;

/**
 * Published when voice capture fails, e.g. microphone permission denied or recognizer error.
 *
 * @param reason short reason code such as MIC_PERMISSION_DENIED or RECOGNITION_ERROR
 * @param at     when the failure was observed
 */
public record CaptureErrorEvent(String reason, Instant at) {
}
