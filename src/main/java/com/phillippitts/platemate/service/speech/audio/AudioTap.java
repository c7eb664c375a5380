package com.phillippitts.platemate.service.speech.audio;

import com.phillippitts.platemate.exception.AudioCaptureException;

/**
 * Source of live microphone audio delivered as fixed-size PCM16LE mono buffers.
 *
 * <p>At most one sink is attached at a time. Each {@link #open} returns a {@link Handle} bound to
 * that capture only; closing a handle whose capture has already been replaced leaves the newer
 * capture running. {@link #close()} stops whatever is open and is safe to call when nothing is.
 */
public interface AudioTap {

    /** Receives captured audio on the tap's capture thread. */
    interface BufferSink {

        /**
         * @param buffer PCM bytes; only the first {@code length} bytes are valid and the array is reused
         * @param length number of valid bytes
         */
        void onBuffer(byte[] buffer, int length);

        /** Capture failed after the tap was opened. Delivery has stopped. */
        default void onError(AudioCaptureException error) {
        }
    }

    /** One opened capture. Closing is idempotent. */
    interface Handle {
        void close();
    }

    /**
     * Opens the device and starts delivering buffers.
     *
     * @return handle that stops this capture and no other
     * @throws AudioCaptureException if the device cannot be opened or is already open
     */
    Handle open(BufferSink sink);

    void close();

    boolean isOpen();
}
