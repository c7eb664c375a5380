package com.phillippitts.platemate.service.location;

import java.time.Duration;

/**
 * Runs a task once after a delay. Injected so retry timing can be driven by tests.
 */
public interface DelayScheduler {

    /** Cancels a scheduled task if it has not started yet. */
    interface Handle {
        void cancel();
    }

    Handle schedule(Runnable task, Duration delay);
}
