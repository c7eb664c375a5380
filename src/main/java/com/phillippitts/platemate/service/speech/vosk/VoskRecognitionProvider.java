package com.phillippitts.platemate.service.speech.vosk;

import com.phillippitts.platemate.config.properties.SpeechProperties;
import com.phillippitts.platemate.exception.AudioCaptureException;
import com.phillippitts.platemate.service.speech.RecognitionEvent;
import com.phillippitts.platemate.service.speech.RecognitionTask;
import com.phillippitts.platemate.service.speech.SpeechRecognitionProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.vosk.Model;
import org.vosk.Recognizer;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Streaming speech recognition backed by the Vosk offline recognizer.
 *
 * <p>The model is loaded lazily on the first task and shared; each task owns one {@link Recognizer}.
 * Utterances closed by Vosk's endpoint detection are accumulated, so PARTIAL events always carry
 * the whole transcript so far and FINAL arrives only after {@link RecognitionTask#endAudio()}.
 *
 * <p>Audio contract: PCM16LE mono at {@code speech.sample-rate}.
 */
@Component
public class VoskRecognitionProvider implements SpeechRecognitionProvider {

    private static final Logger LOG = LogManager.getLogger(VoskRecognitionProvider.class);

    private final SpeechProperties props;

    private final Object lock = new Object();
    // @GuardedBy("lock")
    private Model model;

    public VoskRecognitionProvider(SpeechProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public RecognitionTask start(Consumer<RecognitionEvent> listener) {
        Objects.requireNonNull(listener, "listener");
        try {
            Recognizer recognizer = new Recognizer(loadModel(), props.getSampleRate());
            return new VoskTask(recognizer, listener);
        } catch (IOException | RuntimeException | UnsatisfiedLinkError e) {
            throw new AudioCaptureException("RECOGNIZER_UNAVAILABLE",
                    "Failed to start Vosk recognizer: " + e.getMessage(), e);
        }
    }

    private Model loadModel() throws IOException {
        synchronized (lock) {
            if (model == null) {
                LOG.info("Loading Vosk model: path={}, sampleRate={}", props.getVoskModelPath(), props.getSampleRate());
                model = new Model(props.getVoskModelPath());
            }
            return model;
        }
    }

    @PreDestroy
    public void close() {
        synchronized (lock) {
            if (model != null) {
                try {
                    model.close();
                } catch (RuntimeException e) {
                    LOG.warn("Error closing Vosk model", e);
                }
                model = null;
            }
        }
    }

    /**
     * One recognizer session. Vosk recognizers are not thread-safe; every call is serialized
     * on the task monitor because audio arrives on the tap thread while endAudio/cancel come
     * from the caller.
     */
    private static final class VoskTask implements RecognitionTask {

        private final Recognizer recognizer;
        private final Consumer<RecognitionEvent> listener;
        private final StringBuilder committed = new StringBuilder();
        private boolean ended;

        VoskTask(Recognizer recognizer, Consumer<RecognitionEvent> listener) {
            this.recognizer = recognizer;
            this.listener = listener;
        }

        @Override
        public void append(byte[] buffer, int length) {
            RecognitionEvent event;
            synchronized (this) {
                if (ended) {
                    return;
                }
                try {
                    if (recognizer.acceptWaveForm(buffer, length)) {
                        commit(VoskJsonParser.resultText(recognizer.getResult()));
                        event = RecognitionEvent.partial(committed.toString());
                    } else {
                        event = RecognitionEvent.partial(join(VoskJsonParser.partialText(recognizer.getPartialResult())));
                    }
                } catch (RuntimeException e) {
                    release();
                    event = RecognitionEvent.error(e);
                }
            }
            listener.accept(event);
        }

        @Override
        public void endAudio() {
            RecognitionEvent event;
            synchronized (this) {
                if (ended) {
                    return;
                }
                try {
                    commit(VoskJsonParser.resultText(recognizer.getFinalResult()));
                    event = RecognitionEvent.finalResult(committed.toString());
                } catch (RuntimeException e) {
                    event = RecognitionEvent.error(e);
                } finally {
                    release();
                }
            }
            listener.accept(event);
        }

        @Override
        public synchronized void cancel() {
            if (!ended) {
                release();
            }
        }

        private void commit(String text) {
            if (!text.isEmpty()) {
                if (committed.length() > 0) {
                    committed.append(' ');
                }
                committed.append(text);
            }
        }

        private String join(String pending) {
            if (committed.length() == 0) {
                return pending;
            }
            return pending.isEmpty() ? committed.toString() : committed + " " + pending;
        }

        private void release() {
            ended = true;
            try {
                recognizer.close();
            } catch (RuntimeException e) {
                LOG.debug("Error closing Vosk recognizer: {}", e.getMessage());
            }
        }
    }
}
