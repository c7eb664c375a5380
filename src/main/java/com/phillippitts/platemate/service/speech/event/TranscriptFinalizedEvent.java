package com.phillippitts.platemate.service.speech.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when a voice capture produced a non-empty final transcript.
 *
 * @param text transcript, trimmed
 * @param at   when the transcript was finalized
 */
public record TranscriptFinalizedEvent(String text, Instant at) {

    public TranscriptFinalizedEvent {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(at, "at");
    }
}
