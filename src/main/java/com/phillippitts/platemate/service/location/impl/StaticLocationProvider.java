package com.phillippitts.platemate.service.location.impl;

import com.phillippitts.platemate.domain.LocationFix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reports a fixed, configured coordinate. Every request delivers the fix synchronously.
 */
public class StaticLocationProvider extends AbstractLocationProvider {

    private static final Logger LOG = LogManager.getLogger(StaticLocationProvider.class);

    private final double latitude;
    private final double longitude;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public StaticLocationProvider(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    @Override
    public void startUpdates() {
        if (running.compareAndSet(false, true)) {
            LOG.info("Static location provider at {}, {}", latitude, longitude);
        }
    }

    @Override
    public void requestOnce() {
        deliver(LocationFix.of(latitude, longitude, 0.0));
    }

    @Override
    public void stopUpdates() {
        running.set(false);
    }
}
