package com.phillippitts.platemate.service.location.impl;

import com.phillippitts.platemate.domain.LocationFix;
import com.phillippitts.platemate.service.location.LocationProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Listener fan-out shared by location providers.
 */
abstract class AbstractLocationProvider implements LocationProvider {

    private static final Logger LOG = LogManager.getLogger(AbstractLocationProvider.class);

    private final List<Consumer<LocationFix>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void addListener(Consumer<LocationFix> listener) {
        listeners.add(listener);
    }

    protected void deliver(LocationFix fix) {
        for (Consumer<LocationFix> l : listeners) {
            try {
                l.accept(fix);
            } catch (RuntimeException e) {
                LOG.warn("Location listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
