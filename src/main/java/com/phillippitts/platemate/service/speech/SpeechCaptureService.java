package com.phillippitts.platemate.service.speech;

import com.phillippitts.platemate.config.properties.SpeechProperties;
import com.phillippitts.platemate.exception.AudioCaptureException;
import com.phillippitts.platemate.service.permission.PermissionProvider;
import com.phillippitts.platemate.service.permission.PermissionStatus;
import com.phillippitts.platemate.service.speech.audio.AudioTap;
import com.phillippitts.platemate.service.speech.event.CaptureErrorEvent;
import com.phillippitts.platemate.service.speech.event.TranscriptFinalizedEvent;
import com.phillippitts.platemate.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Voice capture state machine: microphone permission, audio tap and streaming recognizer.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → AWAITING_PERMISSION (startListening)
 * AWAITING_PERMISSION → RECORDING | IDLE (permission answer, open failure)
 * RECORDING → FINALIZING (stopListening)
 * RECORDING | FINALIZING → IDLE (final transcript, recognizer error, cancel)
 * </pre>
 *
 * <p>Every capture gets a fresh id. Recognizer callbacks carry the id they were started with and
 * are dropped unless it is still the active one, so a cancelled task can never deliver a
 * transcript. The microphone is released through the capture's own {@link AudioTap.Handle}, so a
 * late release never stops a newer capture.
 *
 * <p><b>Thread Safety:</b> transitions are guarded by a {@link ReentrantLock}. Device and
 * recognizer calls that may block or call back are made outside the lock.
 */
@Service
public class SpeechCaptureService {

    private static final Logger LOG = LogManager.getLogger(SpeechCaptureService.class);

    static final String MIC_PERMISSION_DENIED = "MIC_PERMISSION_DENIED";
    static final String RECOGNITION_ERROR = "RECOGNITION_ERROR";

    private final SpeechProperties props;
    private final PermissionProvider microphonePermission;
    private final SpeechRecognitionProvider recognitionProvider;
    private final AudioTap audioTap;
    private final ApplicationEventPublisher publisher;

    private final Lock lock = new ReentrantLock();
    // @GuardedBy("lock")
    private CaptureState state = CaptureState.IDLE;
    // @GuardedBy("lock")
    private UUID activeCaptureId;
    // @GuardedBy("lock")
    private RecognitionTask activeTask;
    // @GuardedBy("lock")
    private AudioTap.Handle activeTap;
    private volatile String currentTranscription = "";

    public SpeechCaptureService(SpeechProperties props,
                                @Qualifier("microphonePermission") PermissionProvider microphonePermission,
                                SpeechRecognitionProvider recognitionProvider,
                                AudioTap audioTap,
                                ApplicationEventPublisher publisher) {
        this.props = Objects.requireNonNull(props, "props");
        this.microphonePermission = Objects.requireNonNull(microphonePermission, "microphonePermission");
        this.recognitionProvider = Objects.requireNonNull(recognitionProvider, "recognitionProvider");
        this.audioTap = Objects.requireNonNull(audioTap, "audioTap");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Begins a voice capture.
     *
     * @return outcome; only {@link StartResult#STARTED} leaves the service RECORDING
     */
    public StartResult startListening() {
        if (!props.isVoiceInput()) {
            LOG.debug("Voice input disabled by configuration");
            return StartResult.UNAVAILABLE;
        }

        UUID captureId = UUID.randomUUID();
        lock.lock();
        try {
            if (state != CaptureState.IDLE) {
                LOG.debug("Ignoring start: capture already {}", state);
                return StartResult.ALREADY_ACTIVE;
            }
            state = CaptureState.AWAITING_PERMISSION;
            activeCaptureId = captureId;
        } finally {
            lock.unlock();
        }

        PermissionStatus status = microphonePermission.requestPermission();
        if (!status.isAuthorized()) {
            boolean stillPending = completeIfActive(captureId) != null;
            LOG.info("Microphone permission not granted: {}", status);
            if (stillPending) {
                publisher.publishEvent(new CaptureErrorEvent(MIC_PERMISSION_DENIED, Instant.now()));
            }
            return StartResult.PERMISSION_DENIED;
        }

        lock.lock();
        try {
            if (!captureId.equals(activeCaptureId)) {
                LOG.debug("Capture {} cancelled while awaiting permission", captureId);
                return StartResult.FAILED;
            }
            RecognitionTask lingering = activeTask;
            activeTask = null;
            if (lingering != null) {
                lingering.cancel();
            }

            RecognitionTask task;
            try {
                task = recognitionProvider.start(event -> onRecognitionEvent(captureId, event));
            } catch (AudioCaptureException e) {
                return failStart(e);
            }
            AudioTap.Handle tap;
            try {
                tap = audioTap.open(new AudioTap.BufferSink() {
                    @Override
                    public void onBuffer(byte[] buffer, int length) {
                        task.append(buffer, length);
                    }

                    @Override
                    public void onError(AudioCaptureException error) {
                        onTapFailure(captureId, error);
                    }
                });
            } catch (AudioCaptureException e) {
                task.cancel();
                return failStart(e);
            }
            activeTask = task;
            activeTap = tap;
            state = CaptureState.RECORDING;
            currentTranscription = "";
            LOG.info("Voice capture started (capture={})", captureId);
            return StartResult.STARTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Graceful stop: closes the microphone and asks the recognizer for its final transcript.
     * No-op unless RECORDING.
     */
    public void stopListening() {
        UUID captureId;
        RecognitionTask task;
        AudioTap.Handle tap;
        lock.lock();
        try {
            if (state != CaptureState.RECORDING) {
                return;
            }
            state = CaptureState.FINALIZING;
            captureId = activeCaptureId;
            task = activeTask;
            tap = activeTap;
        } finally {
            lock.unlock();
        }

        tap.close();
        // The FINAL event may arrive synchronously from here and completes the capture
        task.endAudio();

        if (completeIfActive(captureId) != null) {
            LOG.debug("Capture {} finalized without a final transcript", captureId);
        }
    }

    /**
     * Hard cancel: drops the active task without emitting any event.
     */
    public void cancel() {
        Capture cancelled;
        lock.lock();
        try {
            if (state == CaptureState.IDLE) {
                return;
            }
            cancelled = releaseActive();
        } finally {
            lock.unlock();
        }
        cancelled.stop();
        LOG.info("Voice capture cancelled");
    }

    public CaptureState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /** Latest partial transcript of the active capture; empty when idle. */
    public String currentTranscription() {
        return currentTranscription;
    }

    public boolean isVoiceInputEnabled() {
        return props.isVoiceInput();
    }

    void onRecognitionEvent(UUID captureId, RecognitionEvent event) {
        if (event.type() == RecognitionEvent.Type.PARTIAL) {
            lock.lock();
            try {
                if (captureId.equals(activeCaptureId) && state != CaptureState.IDLE) {
                    currentTranscription = event.text();
                }
            } finally {
                lock.unlock();
            }
            return;
        }

        Capture finished = completeIfActive(captureId);
        if (finished == null) {
            LOG.debug("Dropping {} event from stale capture {}", event.type(), captureId);
            return;
        }
        finished.closeTap();

        if (event.type() == RecognitionEvent.Type.FINAL) {
            String text = event.text().trim();
            if (text.isEmpty()) {
                LOG.info("Voice capture finished with an empty transcript");
                return;
            }
            LOG.info("Transcript finalized: '{}'", LogSanitizer.preview(text));
            publisher.publishEvent(new TranscriptFinalizedEvent(text, Instant.now()));
        } else {
            LOG.warn("Recognition failed: {}", event.error() != null ? event.error().toString() : "unknown");
            publisher.publishEvent(new CaptureErrorEvent(RECOGNITION_ERROR, Instant.now()));
        }
    }

    private void onTapFailure(UUID captureId, AudioCaptureException error) {
        Capture failed = completeIfActive(captureId);
        if (failed == null) {
            return;
        }
        failed.stop();
        LOG.warn("Audio capture failed: {}", error.getMessage());
        publisher.publishEvent(new CaptureErrorEvent(error.getReason(), Instant.now()));
    }

    private StartResult failStart(AudioCaptureException e) {
        // Caller holds the lock
        state = CaptureState.IDLE;
        activeCaptureId = null;
        activeTask = null;
        activeTap = null;
        LOG.warn("Voice capture failed to start: {}", e.getMessage());
        publisher.publishEvent(new CaptureErrorEvent(e.getReason(), Instant.now()));
        return StartResult.FAILED;
    }

    /**
     * Moves to IDLE if {@code captureId} is still active.
     *
     * @return the resources of the completed capture, or null if it was no longer active
     */
    private Capture completeIfActive(UUID captureId) {
        lock.lock();
        try {
            if (!captureId.equals(activeCaptureId) || state == CaptureState.IDLE) {
                return null;
            }
            return releaseActive();
        } finally {
            lock.unlock();
        }
    }

    private Capture releaseActive() {
        // Caller holds the lock
        Capture released = new Capture(activeTask, activeTap);
        activeCaptureId = null;
        activeTask = null;
        activeTap = null;
        state = CaptureState.IDLE;
        currentTranscription = "";
        return released;
    }

    /** Task and tap handle of one capture, either may be null before RECORDING. */
    private record Capture(RecognitionTask task, AudioTap.Handle tap) {

        void closeTap() {
            if (tap != null) {
                tap.close();
            }
        }

        void stop() {
            closeTap();
            if (task != null) {
                task.cancel();
            }
        }
    }
}
