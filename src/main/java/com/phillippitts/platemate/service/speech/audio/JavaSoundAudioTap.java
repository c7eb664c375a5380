package com.phillippitts.platemate.service.speech.audio;

import com.phillippitts.platemate.config.properties.SpeechProperties;
import com.phillippitts.platemate.exception.AudioCaptureException;
import com.phillippitts.platemate.util.ThreadTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Java Sound based microphone tap producing raw PCM16LE mono @16kHz in fixed-size buffers.
 *
 * <p>The line is opened on the caller's thread so failures surface synchronously from
 * {@link #open(BufferSink)}; reading happens on a daemon thread named {@code audio-tap}.
 */
@Component
public class JavaSoundAudioTap implements AudioTap {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioTap.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final SpeechProperties props;
    private final DataLineProvider provider;

    private final Object lock = new Object();
    private Capture current;

    @Autowired
    public JavaSoundAudioTap(SpeechProperties props) {
        this(props, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioTap(SpeechProperties props, DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.provider = Objects.requireNonNull(provider);
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public Handle open(BufferSink sink) {
        Objects.requireNonNull(sink, "sink");
        synchronized (lock) {
            if (current != null && current.active.get()) {
                throw new AudioCaptureException("TAP_BUSY", "Audio tap is already open");
            }
            TargetDataLine line;
            try {
                line = provider.open(AudioFormat.REQUIRED_FORMAT, Optional.ofNullable(props.getDeviceName()));
                line.start();
            } catch (LineUnavailableException e) {
                throw new AudioCaptureException("MIC_UNAVAILABLE", "Microphone unavailable: " + e.getMessage(), e);
            } catch (SecurityException e) {
                throw new AudioCaptureException("MIC_PERMISSION_DENIED", "Microphone access denied", e);
            } catch (IllegalArgumentException e) {
                throw new AudioCaptureException("MIC_UNAVAILABLE", "No capture line supports the format", e);
            }
            Capture c = new Capture(line, sink);
            int bufferBytes = props.getBufferFrames() * AudioFormat.REQUIRED_BLOCK_ALIGN;
            Thread t = new Thread(() -> pump(c, bufferBytes), "audio-tap");
            t.setDaemon(true);
            c.thread = t;
            current = c;
            t.start();
            LOG.debug("Audio tap opened: device='{}', buffer={} bytes",
                    props.getDeviceName() != null ? props.getDeviceName() : "default", bufferBytes);
            return c;
        }
    }

    @Override
    public void close() {
        Capture c;
        synchronized (lock) {
            c = current;
        }
        if (c != null) {
            closeCapture(c, ThreadTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
        }
    }

    @Override
    public boolean isOpen() {
        synchronized (lock) {
            return current != null && current.active.get();
        }
    }

    @PreDestroy
    public void shutdown() {
        Capture c;
        synchronized (lock) {
            c = current;
        }
        if (c != null) {
            LOG.info("Shutting down with open audio tap; forcing cleanup");
            closeCapture(c, ThreadTimeouts.CAPTURE_THREAD_SHUTDOWN_TIMEOUT.toMillis());
        }
    }

    private void closeCapture(Capture c, long joinTimeoutMs) {
        synchronized (lock) {
            if (current == c) {
                current = null;
            }
        }
        c.active.set(false);
        if (!c.released.compareAndSet(false, true)) {
            return;
        }
        // A sink may close the tap from the capture thread itself; never join ourselves
        if (c.thread != Thread.currentThread()) {
            joinThread(c.thread, joinTimeoutMs);
        }
        release(c.line);
    }

    private void pump(Capture c, int bufferBytes) {
        byte[] buf = new byte[bufferBytes];
        long total = 0;
        try {
            while (c.active.get()) {
                int n = c.line.read(buf, 0, buf.length);
                if (n <= 0) {
                    continue;
                }
                total += n;
                if (c.active.get()) {
                    c.sink.onBuffer(buf, n);
                }
            }
            LOG.debug("Audio tap drained: {} bytes delivered", total);
        } catch (RuntimeException e) {
            if (c.active.getAndSet(false)) {
                LOG.warn("Audio capture failed: {}", e.toString());
                c.sink.onError(new AudioCaptureException("CAPTURE_ERROR", "Audio capture failed", e));
            }
        }
    }

    private static void release(TargetDataLine line) {
        try {
            line.stop();
        } catch (RuntimeException e) {
            LOG.debug("Failed to stop line: {}", e.getMessage());
        }
        try {
            line.close();
        } catch (RuntimeException e) {
            LOG.debug("Failed to close line: {}", e.getMessage());
        }
    }

    private static void joinThread(Thread thread, long timeoutMs) {
        if (thread == null || !thread.isAlive()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Audio tap thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for audio tap thread to terminate");
        }
    }

    private final class Capture implements Handle {
        final TargetDataLine line;
        final BufferSink sink;
        final AtomicBoolean active = new AtomicBoolean(true);
        final AtomicBoolean released = new AtomicBoolean(false);
        volatile Thread thread;

        Capture(TargetDataLine line, BufferSink sink) {
            this.line = line;
            this.sink = sink;
        }

        @Override
        public void close() {
            closeCapture(this, ThreadTimeouts.CAPTURE_THREAD_STOP_TIMEOUT.toMillis());
        }
    }
}
