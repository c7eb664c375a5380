/**
 * Voice capture: microphone tap, streaming recognition and the capture state machine that turns
 * finished utterances into {@link com.phillippitts.platemate.service.speech.event.TranscriptFinalizedEvent}s.
 */
package com.phillippitts.platemate.service.speech;
