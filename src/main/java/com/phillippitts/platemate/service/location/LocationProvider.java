package com.phillippitts.platemate.service.location;

import com.phillippitts.platemate.domain.LocationFix;

import java.util.function.Consumer;

/**
 * Source of location fixes. Fixes are pushed to listeners, possibly on a provider thread.
 * Failed lookups deliver nothing.
 */
public interface LocationProvider {

    void addListener(Consumer<LocationFix> listener);

    /** Starts periodic updates. Calling it again while running is a no-op. */
    void startUpdates();

    /** Requests a single fix as soon as possible. */
    void requestOnce();

    void stopUpdates();
}
