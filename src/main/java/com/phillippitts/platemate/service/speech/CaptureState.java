package com.phillippitts.platemate.service.speech;

/**
 * Lifecycle of the voice capture pipeline.
 */
public enum CaptureState {
    IDLE,
    AWAITING_PERMISSION,
    RECORDING,
    FINALIZING
}
